package org.epubmeta.dom;

import org.epubmeta.exception.EpubStructureException;
import org.epubmeta.util.SecureXmlUtils;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PackageDocumentTest {

    private static PackageDocument load(String path, String xml) throws Exception {
        return new PackageDocument(path, SecureXmlUtils.parse(xml.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void hrefsResolveAgainstPackageDirectory() throws Exception {
        PackageDocument document = load("OEBPS/content/book.opf", "<package xmlns=\"http://www.idpf.org/2007/opf\"/>");

        assertThat(document.getDirectory()).isEqualTo("OEBPS/content/");
        assertThat(document.resolveHref("text/ch1.xhtml")).isEqualTo("OEBPS/content/text/ch1.xhtml");
        assertThat(document.resolveHref("../images/a%20b.jpg")).isEqualTo("OEBPS/images/a b.jpg");
        assertThat(document.resolveHref("c++.xhtml")).isEqualTo("OEBPS/content/c++.xhtml");
    }

    @Test
    void malformedEscapesAreTakenLiterally() throws Exception {
        PackageDocument document = load("OPS/fb.opf", "<package xmlns=\"http://www.idpf.org/2007/opf\"/>");

        assertThat(document.resolveHref("100%.jpg")).isEqualTo("OPS/100%.jpg");
        assertThat(document.resolveHref("50%25%zz.xhtml")).isEqualTo("OPS/50%%zz.xhtml");
        assertThat(document.resolveHref("caf%C3%A9.xhtml")).isEqualTo("OPS/caf\u00E9.xhtml");
    }

    @Test
    void packageAtArchiveRootHasEmptyDirectory() throws Exception {
        PackageDocument document = load("content.opf", "<package xmlns=\"http://www.idpf.org/2007/opf\"/>");

        assertThat(document.getDirectory()).isEmpty();
        assertThat(document.resolveHref("ch1.xhtml")).isEqualTo("ch1.xhtml");
    }

    @Test
    void resyncMakesNewNodesQueryableAndNotifiesListeners() throws Exception {
        PackageDocument document = load("content.opf",
                "<package xmlns=\"http://www.idpf.org/2007/opf\"><metadata/></package>");
        AtomicInteger notified = new AtomicInteger();
        document.addResyncListener(notified::incrementAndGet);

        document.requireMetadata().newChild("dc:title", "Added");
        document.resync();

        assertThat(document.queryFirst("//opf:metadata/dc:title").getText()).isEqualTo("Added");
        assertThat(notified).hasValue(1);
    }

    @Test
    void missingSectionsAreStructureErrors() throws Exception {
        PackageDocument document = load("content.opf", "<package xmlns=\"http://www.idpf.org/2007/opf\"/>");

        assertThatThrownBy(document::requireMetadata).isInstanceOf(EpubStructureException.class);
        assertThatThrownBy(document::requireManifest).isInstanceOf(EpubStructureException.class);
        assertThatThrownBy(document::requireSpine)
                .isInstanceOf(EpubStructureException.class)
                .hasMessage("No spine element found in epub!");
    }
}
