package org.epubmeta.service.metadata;

import org.epubmeta.EpubFixtures;
import org.epubmeta.dom.EpubElement;
import org.epubmeta.dom.PackageDocument;
import org.epubmeta.util.SecureXmlUtils;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MetadataAccessorTest {

    private static PackageDocument packageDocument(String metadata) throws Exception {
        String opf = EpubFixtures.minimalOpf(metadata, "", "<spine toc=\"ncx\"/>");
        return new PackageDocument(EpubFixtures.OPF_PATH, SecureXmlUtils.parse(EpubFixtures.bytes(opf)));
    }

    private static String serialized(PackageDocument packageDocument) {
        return new String(packageDocument.serialize(), StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("Query building")
    class QueryBuilding {

        @Test
        void plainElementQuery() {
            Map<String, String> bindings = new HashMap<>();

            assertEquals("//opf:metadata/dc:title", MetadataAccessor.buildQuery("dc:title", null, List.of(), false, bindings));
            assertTrue(bindings.isEmpty());
        }

        @Test
        void attributeValuesAreBound() {
            Map<String, String> bindings = new HashMap<>();

            String query = MetadataAccessor.buildQuery("dc:identifier", "id", List.of("book'id"), false, bindings);

            assertEquals("//opf:metadata/dc:identifier[@id=$v0]", query);
            assertThat(bindings).containsOnly(Map.entry("v0", "book'id"));
        }

        @Test
        void caseInsensitiveQueryFoldsBothSides() {
            Map<String, String> bindings = new HashMap<>();

            String query = MetadataAccessor.buildQuery("dc:identifier", "opf:scheme", List.of("UUID", "Urn"), true, bindings);

            assertEquals("//opf:metadata/dc:identifier[translate(@opf:scheme, $upper, $lower)=$v0"
                    + " or translate(@opf:scheme, $upper, $lower)=$v1]", query);
            assertThat(bindings)
                    .containsEntry("v0", "uuid")
                    .containsEntry("v1", "urn")
                    .containsEntry("upper", "ABCDEFGHIJKLMNOPQRSTUVWXYZ")
                    .containsEntry("lower", "abcdefghijklmnopqrstuvwxyz");
        }
    }

    @Test
    void singletonCollapsesDuplicates() throws Exception {
        PackageDocument packageDocument = packageDocument(
                "<dc:publisher>First</dc:publisher><dc:publisher>Second</dc:publisher>");
        MetadataAccessor accessor = new MetadataAccessor(packageDocument);

        assertEquals("First", accessor.getSingleton(MetadataAccessor.PUBLISHER));

        accessor.setSingleton(MetadataAccessor.PUBLISHER, "Only");

        assertThat(packageDocument.query("//dc:publisher")).hasSize(1);
        assertEquals("Only", accessor.getSingleton(MetadataAccessor.PUBLISHER));

        accessor.setSingleton(MetadataAccessor.PUBLISHER, "");

        assertThat(packageDocument.query("//dc:publisher")).isEmpty();
        assertEquals("", accessor.getSingleton(MetadataAccessor.PUBLISHER));
    }

    @Test
    void newIdentifierUsesFirstSpelling() throws Exception {
        PackageDocument packageDocument = packageDocument("<dc:identifier opf:scheme=\"urn\">urn:x</dc:identifier>");
        MetadataAccessor accessor = new MetadataAccessor(packageDocument);

        assertEquals("urn:x", accessor.getIdentifier(IdentifierScheme.UUID));

        accessor.setIdentifier(IdentifierScheme.AMAZON, "B000FC0PDA");

        assertThat(serialized(packageDocument)).contains("<dc:identifier opf:scheme=\"AMAZON\">B000FC0PDA</dc:identifier>");
        assertEquals("B000FC0PDA", accessor.getIdentifier("amazon"));
    }

    @Test
    void uniqueIdentifierNeedsDeclaration() throws Exception {
        String opf = "<package xmlns=\"http://www.idpf.org/2007/opf\"><metadata xmlns:dc=\"http://purl.org/dc/elements/1.1/\">"
                + "<dc:identifier id=\"x\">abc</dc:identifier></metadata></package>";
        PackageDocument packageDocument = new PackageDocument("content.opf", SecureXmlUtils.parse(EpubFixtures.bytes(opf)));
        MetadataAccessor accessor = new MetadataAccessor(packageDocument);

        accessor.setUniqueIdentifier("changed");

        assertEquals("", accessor.getUniqueIdentifier());
        assertThat(packageDocument.queryFirst("//dc:identifier").getText()).isEqualTo("abc");
    }

    @Test
    void authorsWithoutRoleAreFixedUp() throws Exception {
        PackageDocument packageDocument = packageDocument("<dc:creator>Jane Roe</dc:creator>");
        MetadataAccessor accessor = new MetadataAccessor(packageDocument);

        assertThat(accessor.getAuthors()).containsExactly(Map.entry("Jane Roe", "Jane Roe"));
        EpubElement creator = packageDocument.queryFirst("//dc:creator");
        assertThat(creator.getAttribute("opf:role")).isEqualTo("aut");
        assertThat(creator.getAttribute("opf:file-as")).isEqualTo("Jane Roe");
    }

    @Test
    void nonAuthorCreatorsSurviveAuthorReplacement() throws Exception {
        PackageDocument packageDocument = packageDocument(
                "<dc:creator opf:role=\"aut\" opf:file-as=\"Roe, Jane\">Jane Roe</dc:creator>"
                        + "<dc:creator opf:role=\"ill\">Ann Artist</dc:creator>");
        MetadataAccessor accessor = new MetadataAccessor(packageDocument);

        accessor.setAuthors("Max Doe, Erika Doe");

        assertThat(accessor.getAuthors()).containsExactly(
                Map.entry("Max Doe", "Max Doe"), Map.entry("Erika Doe", "Erika Doe"));
        assertThat(packageDocument.queryFirst("//dc:creator[@opf:role='ill']").getText()).isEqualTo("Ann Artist");

        accessor.setAuthors("");

        assertThat(packageDocument.query("//dc:creator")).hasSize(1);
    }

    @Test
    void subjectsAreReplacedAsAWhole() throws Exception {
        PackageDocument packageDocument = packageDocument("<dc:subject>Old</dc:subject>");
        MetadataAccessor accessor = new MetadataAccessor(packageDocument);

        accessor.setSubjects(" Fiction ,Drama");

        assertThat(accessor.getSubjects()).containsExactly("Fiction", "Drama");

        accessor.setSubjects(List.of());

        assertThat(accessor.getSubjects()).isEmpty();
    }
}
