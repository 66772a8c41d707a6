package org.epubmeta.dom;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.text.StringEscapeUtils;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import javax.xml.XMLConstants;
import java.util.Objects;

/**
 * Namespace aware view of a DOM element of an EPUB document.
 * <p>
 * Attribute and child names are given as {@code prefix:local} with prefixes from {@link XmlNamespace}.
 * A namespace that is already the element's own or in-scope default namespace is omitted, so no
 * redundant declarations end up in the serialized document.
 */
public final class EpubElement {

    private final Element element;

    public EpubElement(Element element) {
        this.element = Objects.requireNonNull(element, "element");
    }

    public Element unwrap() {
        return element;
    }

    public String getLocalName() {
        return element.getLocalName() != null ? element.getLocalName() : element.getTagName();
    }

    public String getNamespaceUri() {
        return element.getNamespaceURI();
    }

    public String getAttribute(String name) {
        QualifiedName qname = QualifiedName.parse(name);
        String namespaceUri = attributeNamespace(qname);
        if (namespaceUri == null) {
            return element.getAttribute(qname.localName());
        }
        return element.getAttributeNS(namespaceUri, qname.localName());
    }

    public boolean hasAttribute(String name) {
        QualifiedName qname = QualifiedName.parse(name);
        String namespaceUri = attributeNamespace(qname);
        if (namespaceUri == null) {
            return element.hasAttribute(qname.localName());
        }
        return element.hasAttributeNS(namespaceUri, qname.localName());
    }

    public void setAttribute(String name, String value) {
        QualifiedName qname = QualifiedName.parse(name);
        String namespaceUri = attributeNamespace(qname);
        if (namespaceUri == null) {
            element.setAttribute(qname.localName(), value);
            return;
        }
        String prefix = prefixInScope(namespaceUri, qname.prefix());
        element.setAttributeNS(namespaceUri, prefix + ":" + qname.localName(), value);
    }

    public void removeAttribute(String name) {
        QualifiedName qname = QualifiedName.parse(name);
        String namespaceUri = attributeNamespace(qname);
        if (namespaceUri == null) {
            element.removeAttribute(qname.localName());
        } else {
            element.removeAttributeNS(namespaceUri, qname.localName());
        }
    }

    /**
     * Create a new element and append it as last child.
     */
    public EpubElement newChild(String name, String value) {
        EpubElement child = createChild(name, value);
        element.appendChild(child.element);
        return child;
    }

    public EpubElement newChild(String name) {
        return newChild(name, "");
    }

    /**
     * Create a new element and insert it before all existing children.
     */
    public EpubElement newChildFirst(String name, String value) {
        EpubElement child = createChild(name, value);
        element.insertBefore(child.element, element.getFirstChild());
        return child;
    }

    public String getText() {
        return element.getTextContent();
    }

    public void setText(String value) {
        element.setTextContent(value);
    }

    /**
     * The text as it appears in the serialized document, with markup characters escaped.
     */
    public String getEscapedText() {
        return StringEscapeUtils.escapeXml10(getText());
    }

    public void setEscapedText(String value) {
        setText(StringEscapeUtils.unescapeXml(value));
    }

    /**
     * Remove this element from its document.
     */
    public void delete() {
        Node parent = element.getParentNode();
        if (parent != null) {
            parent.removeChild(element);
        }
    }

    private EpubElement createChild(String name, String value) {
        QualifiedName qname = QualifiedName.parse(name);
        Element child;
        if (!qname.hasPrefix()) {
            child = element.getOwnerDocument().createElementNS(element.lookupNamespaceURI(null), qname.localName());
        } else {
            String namespaceUri = XmlNamespace.uriOf(qname.prefix());
            if (element.isDefaultNamespace(namespaceUri)) {
                child = element.getOwnerDocument().createElementNS(namespaceUri, qname.localName());
            } else {
                String prefix = element.lookupPrefix(namespaceUri);
                boolean declared = prefix != null;
                if (!declared) {
                    prefix = qname.prefix();
                }
                child = element.getOwnerDocument().createElementNS(namespaceUri, prefix + ":" + qname.localName());
                if (!declared) {
                    child.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, "xmlns:" + prefix, namespaceUri);
                }
            }
        }
        if (StringUtils.isNotEmpty(value)) {
            child.setTextContent(value);
        }
        return new EpubElement(child);
    }

    /**
     * The namespace to address an attribute in, or {@code null} when it is to be addressed unqualified.
     */
    private String attributeNamespace(QualifiedName qname) {
        if (!qname.hasPrefix()) {
            return null;
        }
        String namespaceUri = XmlNamespace.uriOf(qname.prefix());
        String ownNamespace = element.getNamespaceURI();
        if (ownNamespace == null && element.isDefaultNamespace(namespaceUri) || namespaceUri.equals(ownNamespace)) {
            return null;
        }
        return namespaceUri;
    }

    private String prefixInScope(String namespaceUri, String preferredPrefix) {
        String prefix = element.lookupPrefix(namespaceUri);
        if (prefix != null) {
            return prefix;
        }
        element.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, "xmlns:" + preferredPrefix, namespaceUri);
        return preferredPrefix;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof EpubElement other && element.equals(other.element);
    }

    @Override
    public int hashCode() {
        return element.hashCode();
    }

    @Override
    public String toString() {
        return "EpubElement{" + element.getNodeName() + "}";
    }
}
