package org.epubmeta.dom;

import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import javax.xml.namespace.QName;
import javax.xml.xpath.XPath;
import javax.xml.xpath.XPathConstants;
import javax.xml.xpath.XPathExpressionException;
import javax.xml.xpath.XPathFactory;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * XPath evaluation with the EPUB namespace prefixes registered. Values that come from outside are passed in as
 * variables ({@code $name}) instead of being spliced into the expression.
 */
public class EpubXPath {

    private final XPath xpath;
    private final Map<String, Object> variables = new HashMap<>();

    public EpubXPath() {
        xpath = XPathFactory.newInstance().newXPath();
        xpath.setNamespaceContext(XmlNamespace.CONTEXT);
        xpath.setXPathVariableResolver((QName name) -> variables.get(name.getLocalPart()));
    }

    public List<EpubElement> query(String expression, Node context) {
        return query(expression, context, Collections.emptyMap());
    }

    public List<EpubElement> query(String expression, Node context, Map<String, String> bindings) {
        NodeList nodes = (NodeList) evaluate(expression, context, bindings, XPathConstants.NODESET);
        List<EpubElement> elements = new ArrayList<>(nodes.getLength());
        for (int i = 0; i < nodes.getLength(); i++) {
            if (nodes.item(i) instanceof Element element) {
                elements.add(new EpubElement(element));
            }
        }
        return elements;
    }

    /**
     * @return the first matching element, or {@code null}
     */
    public EpubElement queryFirst(String expression, Node context) {
        return queryFirst(expression, context, Collections.emptyMap());
    }

    public EpubElement queryFirst(String expression, Node context, Map<String, String> bindings) {
        Node node = (Node) evaluate(expression, context, bindings, XPathConstants.NODE);
        return node instanceof Element element ? new EpubElement(element) : null;
    }

    private Object evaluate(String expression, Node context, Map<String, String> bindings, QName returnType) {
        variables.clear();
        variables.putAll(bindings);
        try {
            return xpath.evaluate(expression, context, returnType);
        } catch (XPathExpressionException e) {
            throw new IllegalArgumentException("Invalid XPath expression: " + expression, e);
        } finally {
            variables.clear();
        }
    }
}
