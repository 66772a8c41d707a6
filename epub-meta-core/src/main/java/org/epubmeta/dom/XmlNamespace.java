package org.epubmeta.dom;

import lombok.Getter;
import org.epubmeta.exception.EpubError;

import javax.xml.XMLConstants;
import javax.xml.namespace.NamespaceContext;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * XML namespaces used in EPUB package, container and navigation documents.
 */
@Getter
public enum XmlNamespace {
    /** Open Container Format, META-INF/container.xml */
    OCF("n", "urn:oasis:names:tc:opendocument:xmlns:container"),
    /** Open Packaging Format, the .opf package document */
    OPF("opf", "http://www.idpf.org/2007/opf"),
    /** Dublin Core Metadata Element Set */
    DC("dc", "http://purl.org/dc/elements/1.1/"),
    /** Navigation Control file for XML, the .ncx table of contents */
    NCX("ncx", "http://www.daisy.org/z3986/2005/ncx/"),
    XHTML("xhtml", "http://www.w3.org/1999/xhtml");

    private static final Map<String, XmlNamespace> BY_PREFIX = prefixIndex();

    private static final Map<String, XmlNamespace> BY_URI = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(XmlNamespace::getUri, Function.identity()));

    /**
     * Prefix → URI resolution for XPath expressions over EPUB documents.
     */
    public static final NamespaceContext CONTEXT = new NamespaceContext() {
        @Override
        public String getNamespaceURI(String prefix) {
            if (prefix == null) {
                throw new IllegalArgumentException("Prefix cannot be null");
            }
            if (XMLConstants.XML_NS_PREFIX.equals(prefix)) {
                return XMLConstants.XML_NS_URI;
            }
            XmlNamespace namespace = BY_PREFIX.get(prefix);
            return namespace != null ? namespace.uri : XMLConstants.NULL_NS_URI;
        }

        @Override
        public String getPrefix(String namespaceUri) {
            XmlNamespace namespace = BY_URI.get(namespaceUri);
            return namespace != null ? namespace.prefix : null;
        }

        @Override
        public Iterator<String> getPrefixes(String namespaceUri) {
            String prefix = getPrefix(namespaceUri);
            return prefix != null
                    ? Collections.singletonList(prefix).iterator()
                    : Collections.emptyIterator();
        }
    };

    private final String prefix;
    private final String uri;

    XmlNamespace(String prefix, String uri) {
        this.prefix = prefix;
        this.uri = uri;
    }

    private static Map<String, XmlNamespace> prefixIndex() {
        Map<String, XmlNamespace> index = new HashMap<>();
        for (XmlNamespace namespace : values()) {
            index.put(namespace.prefix, namespace);
        }
        // container.xml is commonly queried with either prefix
        index.put("ocf", OCF);
        return Collections.unmodifiableMap(index);
    }

    public static XmlNamespace fromPrefix(String prefix) {
        XmlNamespace namespace = prefix != null ? BY_PREFIX.get(prefix) : null;
        if (namespace == null) {
            throw EpubError.UNKNOWN_NAMESPACE.createException(prefix);
        }
        return namespace;
    }

    public static String uriOf(String prefix) {
        return fromPrefix(prefix).uri;
    }
}
