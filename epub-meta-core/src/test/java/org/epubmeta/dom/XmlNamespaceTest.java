package org.epubmeta.dom;

import org.epubmeta.exception.UnknownNamespaceException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class XmlNamespaceTest {

    @Test
    void prefixesResolveToUris() {
        assertThat(XmlNamespace.uriOf("opf")).isEqualTo("http://www.idpf.org/2007/opf");
        assertThat(XmlNamespace.uriOf("dc")).isEqualTo("http://purl.org/dc/elements/1.1/");
        assertThat(XmlNamespace.uriOf("ncx")).isEqualTo("http://www.daisy.org/z3986/2005/ncx/");
        assertThat(XmlNamespace.uriOf("n")).isEqualTo("urn:oasis:names:tc:opendocument:xmlns:container");
        assertThat(XmlNamespace.fromPrefix("ocf")).isSameAs(XmlNamespace.OCF);
    }

    @Test
    void unknownPrefixIsConfigurationError() {
        assertThatThrownBy(() -> XmlNamespace.uriOf("xyz"))
                .isInstanceOf(UnknownNamespaceException.class)
                .hasMessage("Unknown XML namespace xyz!");
    }

    @Test
    void contextServesXPath() {
        assertThat(XmlNamespace.CONTEXT.getNamespaceURI("xhtml")).isEqualTo("http://www.w3.org/1999/xhtml");
        assertThat(XmlNamespace.CONTEXT.getNamespaceURI("unknown")).isEmpty();
        assertThat(XmlNamespace.CONTEXT.getPrefix("http://purl.org/dc/elements/1.1/")).isEqualTo("dc");
    }

    @Test
    void qualifiedNameSplitsAtFirstColon() {
        QualifiedName name = QualifiedName.parse("opf:file-as");

        assertThat(name.prefix()).isEqualTo("opf");
        assertThat(name.localName()).isEqualTo("file-as");
        assertThat(QualifiedName.parse("id").hasPrefix()).isFalse();
        assertThat(name.toString()).isEqualTo("opf:file-as");
    }
}
