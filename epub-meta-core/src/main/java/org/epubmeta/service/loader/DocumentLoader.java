package org.epubmeta.service.loader;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ArrayUtils;
import org.apache.commons.lang3.StringUtils;
import org.epubmeta.archive.ArchiveException;
import org.epubmeta.archive.EpubArchive;
import org.epubmeta.archive.ZipEpubArchive;
import org.epubmeta.dom.EpubElement;
import org.epubmeta.dom.EpubXPath;
import org.epubmeta.dom.PackageDocument;
import org.epubmeta.exception.EpubError;
import org.epubmeta.util.HtmlEntityUtils;
import org.epubmeta.util.SecureXmlUtils;
import org.w3c.dom.Document;
import org.xml.sax.SAXException;

import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads and parses the XML documents of an EPUB archive.
 */
@Slf4j
public class DocumentLoader {

    public static final String CONTAINER_PATH = "META-INF/container.xml";
    public static final String PACKAGE_MEDIA_TYPE = "application/oebps-package+xml";

    private static final String ROOTFILE_BY_MEDIA_TYPE = "//n:rootfiles/n:rootfile[@media-type=$mediaType]";
    private static final String ANY_ROOTFILE = "//*[local-name()='rootfile']";
    private static final String BYTE_ORDER_MARK = "\uFEFF";
    private static final Pattern XML_ENCODING_PATTERN = Pattern.compile("^(?:\\xEF\\xBB\\xBF)?<\\?xml[^>]*encoding=[\"']([A-Za-z0-9._-]+)[\"']");

    @Getter
    private final EpubArchive archive;
    private final EpubXPath xpath = new EpubXPath();

    public DocumentLoader(EpubArchive archive) {
        this.archive = archive;
    }

    /**
     * Open the archive of an EPUB file.
     *
     * @throws org.epubmeta.exception.EpubIoException if the file is missing, unreadable or not a usable zip archive
     */
    public static EpubArchive openContainer(Path path) {
        try {
            return ZipEpubArchive.open(path);
        } catch (ArchiveException e) {
            throw switch (e.getStatus()) {
                case NO_SUCH_FILE -> EpubError.FILE_NOT_FOUND.createException(e);
                case NOT_A_ZIP -> EpubError.NOT_A_ZIP_ARCHIVE.createException(e);
                case INCONSISTENT -> EpubError.ZIP_ARCHIVE_INCONSISTENT.createException(e);
                case PERMISSION_DENIED -> EpubError.PERMISSION_DENIED.createException(e);
                default -> EpubError.FILE_READ_ERROR.createException(e, e.getMessage());
            };
        }
    }

    /**
     * Find the archive path of the package document through {@code META-INF/container.xml}.
     */
    public String resolvePackagePath() {
        Document container = loadXmlMember(CONTAINER_PATH);
        EpubElement rootfile = xpath.queryFirst(ROOTFILE_BY_MEDIA_TYPE, container, Map.of("mediaType", PACKAGE_MEDIA_TYPE));
        if (rootfile == null) {
            rootfile = xpath.queryFirst(ANY_ROOTFILE, container);
        }
        if (rootfile == null || StringUtils.isEmpty(rootfile.getAttribute("full-path"))) {
            throw EpubError.ROOTFILE_MISSING.createException();
        }
        return rootfile.getAttribute("full-path");
    }

    public PackageDocument loadPackageDocument() {
        String packagePath = resolvePackagePath();
        Document document = loadXmlMember(packagePath);
        log.debug("Loaded package document {} from {}", packagePath, archive.getPath().getFileName());
        return new PackageDocument(packagePath, document);
    }

    /**
     * Read and parse an XML member of the archive.
     *
     * @throws org.epubmeta.exception.EpubStructureException if the member is absent, empty or not well-formed
     */
    public Document loadXmlMember(String path) {
        byte[] data = readMember(path);
        if (ArrayUtils.isEmpty(data)) {
            throw EpubError.CONTAINER_DATA_MISSING.createException(path);
        }
        try {
            return SecureXmlUtils.parseDoctypeTolerant(data);
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw EpubError.MALFORMED_XML.createException(e, path);
        }
    }

    /**
     * Read and parse an XHTML member of the archive.
     */
    public Document loadXhtmlMember(String path) {
        byte[] data = readMember(path);
        if (ArrayUtils.isEmpty(data)) {
            throw EpubError.CONTAINER_DATA_MISSING.createException(path);
        }
        return parseXhtml(data, path);
    }

    /**
     * Parse XHTML content. Named HTML entities are turned into character references first, as they are not
     * defined for an XML parser that does not load the DTD.
     *
     * @param name used in error messages only
     */
    public Document parseXhtml(byte[] data, String name) {
        String xhtml = StringUtils.removeStart(new String(data, detectCharset(data)), BYTE_ORDER_MARK);
        xhtml = HtmlEntityUtils.convertNamedToNumeric(xhtml);
        try {
            return SecureXmlUtils.parseDoctypeTolerant(xhtml);
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw EpubError.MALFORMED_XML.createException(e, name);
        }
    }

    /**
     * @return the member's data, or {@code null} if there is no such member
     */
    public byte[] readMember(String path) {
        try {
            return archive.readMember(path);
        } catch (IOException e) {
            throw EpubError.FILE_READ_ERROR.createException(e, e.getMessage());
        }
    }

    static Charset detectCharset(byte[] data) {
        String prolog = new String(data, 0, Math.min(data.length, 200), StandardCharsets.ISO_8859_1);
        Matcher matcher = XML_ENCODING_PATTERN.matcher(prolog);
        if (matcher.find()) {
            try {
                return Charset.forName(matcher.group(1));
            } catch (IllegalArgumentException e) {
                log.warn("Unsupported XML encoding {}, reading as UTF-8", matcher.group(1));
            }
        }
        return StandardCharsets.UTF_8;
    }
}
