package org.epubmeta.dom;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;
import org.epubmeta.exception.EpubError;
import org.epubmeta.util.HrefUtils;
import org.epubmeta.util.SecureXmlUtils;
import org.w3c.dom.Document;
import org.xml.sax.SAXException;

import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.TransformerException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The parsed package (.opf) document of an EPUB.
 * <p>
 * After every mutation of the DOM {@link #resync()} has to be called before the next query. It reparses the document
 * from its serialized form and tells listeners to drop anything derived from the previous tree.
 */
@Slf4j
public class PackageDocument {

    public static final String METADATA = "//opf:metadata";
    public static final String MANIFEST = "//opf:manifest";
    public static final String SPINE = "//opf:spine";
    public static final String GUIDE = "//opf:guide";

    /** Archive path of the package document */
    @Getter
    private final String path;
    /** Archive directory all hrefs of the package document are relative to, empty or ending with a slash */
    @Getter
    private final String directory;
    private final EpubXPath xpath = new EpubXPath();
    private final List<Runnable> resyncListeners = new ArrayList<>();
    private Document document;

    public PackageDocument(String path, Document document) {
        this.path = path;
        this.directory = path.contains("/") ? path.substring(0, path.lastIndexOf('/') + 1) : "";
        this.document = document;
    }

    public Document getDocument() {
        return document;
    }

    public EpubElement getRoot() {
        return new EpubElement(document.getDocumentElement());
    }

    public List<EpubElement> query(String expression) {
        return xpath.query(expression, document);
    }

    public List<EpubElement> query(String expression, Map<String, String> bindings) {
        return xpath.query(expression, document, bindings);
    }

    public EpubElement queryFirst(String expression) {
        return xpath.queryFirst(expression, document);
    }

    public EpubElement queryFirst(String expression, Map<String, String> bindings) {
        return xpath.queryFirst(expression, document, bindings);
    }

    public EpubElement requireMetadata() {
        EpubElement metadata = queryFirst(METADATA);
        if (metadata == null) {
            throw EpubError.METADATA_MISSING.createException();
        }
        return metadata;
    }

    public EpubElement requireManifest() {
        EpubElement manifest = queryFirst(MANIFEST);
        if (manifest == null) {
            throw EpubError.MANIFEST_MISSING.createException();
        }
        return manifest;
    }

    public EpubElement requireSpine() {
        EpubElement spine = queryFirst(SPINE);
        if (spine == null) {
            throw EpubError.SPINE_MISSING.createException();
        }
        return spine;
    }

    /**
     * Archive path of a file referenced relative to the package document. Percent-encoded characters are decoded
     * and dot segments resolved.
     */
    public String resolveHref(String href) {
        if (StringUtils.isEmpty(href)) {
            return directory;
        }
        String resolved = directory + HrefUtils.decode(href);
        String normalized = FilenameUtils.normalize(resolved, true);
        return normalized != null ? normalized : resolved;
    }

    public byte[] serialize() {
        try {
            return SecureXmlUtils.serialize(document);
        } catch (TransformerException e) {
            throw EpubError.MALFORMED_XML.createException(e, path);
        }
    }

    /**
     * Reparse the DOM tree from its serialized form. XPath queries are not guaranteed to see nodes added or removed
     * since the last parse, so every mutator ends with this.
     */
    public void resync() {
        byte[] data = serialize();
        try {
            document = SecureXmlUtils.parse(data);
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw EpubError.MALFORMED_XML.createException(e, path);
        }
        log.debug("Resynced package document {} ({} bytes)", path, data.length);
        for (Runnable listener : resyncListeners) {
            listener.run();
        }
    }

    public void addResyncListener(Runnable listener) {
        resyncListeners.add(listener);
    }
}
