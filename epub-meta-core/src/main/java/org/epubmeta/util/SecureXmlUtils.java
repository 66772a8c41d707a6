package org.epubmeta.util;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Document;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

@Slf4j
@UtilityClass
public class SecureXmlUtils {

    public static DocumentBuilderFactory createSecureDocumentBuilderFactory(boolean namespaceAware) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(namespaceAware);

            // Prevent XXE attacks
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);

            return factory;
        } catch (ParserConfigurationException e) {
            log.warn("Failed to configure secure XML parser, using defaults: {}", e.getMessage());
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(namespaceAware);
            return factory;
        }
    }

    /**
     * Archive members (NCX and XHTML in particular) often carry a DOCTYPE, so it is accepted here, but the
     * external DTD is never fetched. Named HTML entities have to be converted beforehand, see
     * {@link HtmlEntityUtils}.
     */
    public static DocumentBuilderFactory createDoctypeTolerantDocumentBuilderFactory() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);

            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);

            return factory;
        } catch (ParserConfigurationException e) {
            log.warn("Failed to configure DOCTYPE tolerant XML parser, using defaults: {}", e.getMessage());
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            return factory;
        }
    }

    public static DocumentBuilder createSecureDocumentBuilder(boolean namespaceAware)
            throws ParserConfigurationException {
        return createSecureDocumentBuilderFactory(namespaceAware).newDocumentBuilder();
    }

    public static Document parse(byte[] data) throws ParserConfigurationException, SAXException, IOException {
        DocumentBuilder builder = createSecureDocumentBuilder(true);
        return builder.parse(new ByteArrayInputStream(data));
    }

    public static Document parseDoctypeTolerant(byte[] data) throws ParserConfigurationException, SAXException, IOException {
        DocumentBuilder builder = createDoctypeTolerantDocumentBuilderFactory().newDocumentBuilder();
        return builder.parse(new ByteArrayInputStream(data));
    }

    public static Document parseDoctypeTolerant(String xml) throws ParserConfigurationException, SAXException, IOException {
        DocumentBuilder builder = createDoctypeTolerantDocumentBuilderFactory().newDocumentBuilder();
        return builder.parse(new InputSource(new StringReader(xml)));
    }

    /**
     * Serialize a document as UTF-8 without reformatting it.
     */
    public static byte[] serialize(Document document) throws TransformerException {
        TransformerFactory transformerFactory = TransformerFactory.newInstance();
        transformerFactory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
        transformerFactory.setAttribute(XMLConstants.ACCESS_EXTERNAL_STYLESHEET, "");
        Transformer tf = transformerFactory.newTransformer();
        tf.setOutputProperty(OutputKeys.ENCODING, StandardCharsets.UTF_8.name());
        tf.setOutputProperty(OutputKeys.INDENT, "no");
        if (document.getXmlStandalone()) {
            tf.setOutputProperty(OutputKeys.STANDALONE, "yes");
        }

        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        tf.transform(new DOMSource(document), new StreamResult(baos));
        return baos.toByteArray();
    }
}
