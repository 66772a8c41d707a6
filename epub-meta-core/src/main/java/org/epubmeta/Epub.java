package org.epubmeta;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.epubmeta.archive.EpubArchive;
import org.epubmeta.config.EpubProperties;
import org.epubmeta.dom.PackageDocument;
import org.epubmeta.exception.EpubError;
import org.epubmeta.model.Cover;
import org.epubmeta.model.Manifest;
import org.epubmeta.model.ManifestItem;
import org.epubmeta.model.Spine;
import org.epubmeta.model.Toc;
import org.epubmeta.service.content.ContentExtractor;
import org.epubmeta.service.cover.CoverPageManager;
import org.epubmeta.service.loader.DocumentLoader;
import org.epubmeta.service.metadata.IdentifierScheme;
import org.epubmeta.service.metadata.MetadataAccessor;
import org.epubmeta.service.structure.ManifestParser;
import org.epubmeta.service.structure.SpineParser;
import org.epubmeta.service.structure.TocParser;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * An EPUB file opened for reading and editing its metadata.
 * <p>
 * Changes are made to the in-memory package document and only written to the file by {@link #save()}.
 * Instances are not thread safe.
 */
@Slf4j
public class Epub implements AutoCloseable {

    @Getter
    private final Path path;
    private final EpubArchive archive;
    private final PackageDocument packageDocument;
    private final MetadataAccessor metadata;
    private final CoverPageManager coverPageManager;
    private final ManifestParser manifestParser;
    private final SpineParser spineParser;
    private final TocParser tocParser;

    private Manifest manifest;
    private Spine spine;
    private Toc toc;

    public Epub(Path path) {
        this(path, EpubProperties.load());
    }

    /**
     * Open an EPUB file. Manifest and spine are read right away, so broken references between them fail here.
     *
     * @throws org.epubmeta.exception.EpubIoException        if the file cannot be read as zip archive
     * @throws org.epubmeta.exception.EpubStructureException if the container or package document is missing or broken
     */
    public Epub(Path path, EpubProperties properties) {
        this.path = path;
        this.archive = DocumentLoader.openContainer(path);
        try {
            DocumentLoader documentLoader = new DocumentLoader(archive);
            this.packageDocument = documentLoader.loadPackageDocument();
            this.metadata = new MetadataAccessor(packageDocument);
            this.coverPageManager = new CoverPageManager(packageDocument, archive, metadata, properties);
            this.manifestParser = new ManifestParser(archive, coverPageManager.getPendingFiles(), new ContentExtractor(documentLoader));
            this.spineParser = new SpineParser();
            this.tocParser = new TocParser(documentLoader, properties);

            packageDocument.addResyncListener(this::invalidateCaches);
            getSpine();
        } catch (RuntimeException e) {
            try {
                archive.close();
            } catch (IOException closeError) {
                e.addSuppressed(closeError);
            }
            throw e;
        }
    }

    public String getFilename() {
        return path.toString();
    }

    /**
     * Write all changes back to the file.
     */
    public void save() {
        archive.writeMember(packageDocument.getPath(), packageDocument.serialize());
        coverPageManager.flushPendingFiles();
        try {
            archive.commit();
        } catch (IOException e) {
            throw EpubError.FILE_WRITE_ERROR.createException(e, path, e.getMessage());
        }
        invalidateCaches();
        log.info("Saved EPUB {}", path.getFileName());
    }

    @Override
    public void close() {
        try {
            archive.close();
        } catch (IOException e) {
            throw EpubError.FILE_READ_ERROR.createException(e, e.getMessage());
        }
    }

    public String getTitle() {
        return metadata.getSingleton(MetadataAccessor.TITLE);
    }

    /**
     * @param title the new title, an empty string removes it
     */
    public void setTitle(String title) {
        metadata.setSingleton(MetadataAccessor.TITLE, title);
    }

    public String getLanguage() {
        return metadata.getSingleton(MetadataAccessor.LANGUAGE);
    }

    public void setLanguage(String language) {
        metadata.setSingleton(MetadataAccessor.LANGUAGE, language);
    }

    public String getPublisher() {
        return metadata.getSingleton(MetadataAccessor.PUBLISHER);
    }

    public void setPublisher(String publisher) {
        metadata.setSingleton(MetadataAccessor.PUBLISHER, publisher);
    }

    public String getCopyright() {
        return metadata.getSingleton(MetadataAccessor.RIGHTS);
    }

    public void setCopyright(String rights) {
        metadata.setSingleton(MetadataAccessor.RIGHTS, rights);
    }

    public String getDescription() {
        return metadata.getSingleton(MetadataAccessor.DESCRIPTION);
    }

    public void setDescription(String description) {
        metadata.setSingleton(MetadataAccessor.DESCRIPTION, description);
    }

    public String getUniqueIdentifier() {
        return metadata.getUniqueIdentifier();
    }

    public void setUniqueIdentifier(String identifier) {
        metadata.setUniqueIdentifier(identifier);
    }

    public String getUuid() {
        return metadata.getIdentifier(IdentifierScheme.UUID);
    }

    public void setUuid(String uuid) {
        metadata.setIdentifier(IdentifierScheme.UUID, uuid);
    }

    public String getUri() {
        return metadata.getIdentifier(IdentifierScheme.URI);
    }

    public void setUri(String uri) {
        metadata.setIdentifier(IdentifierScheme.URI, uri);
    }

    public String getIsbn() {
        return metadata.getIdentifier(IdentifierScheme.ISBN);
    }

    public void setIsbn(String isbn) {
        metadata.setIdentifier(IdentifierScheme.ISBN, isbn);
    }

    public String getGoogle() {
        return metadata.getIdentifier(IdentifierScheme.GOOGLE);
    }

    public void setGoogle(String google) {
        metadata.setIdentifier(IdentifierScheme.GOOGLE, google);
    }

    public String getAmazon() {
        return metadata.getIdentifier(IdentifierScheme.AMAZON);
    }

    public void setAmazon(String amazon) {
        metadata.setIdentifier(IdentifierScheme.AMAZON, amazon);
    }

    /**
     * @param scheme value of the {@code opf:scheme} attribute, compared ignoring case
     */
    public String getIdentifier(String scheme) {
        return metadata.getIdentifier(scheme);
    }

    public void setIdentifier(String scheme, String value) {
        metadata.setIdentifier(scheme, value);
    }

    /**
     * @return authors mapped from sort key to display name, in document order
     */
    public Map<String, String> getAuthors() {
        return metadata.getAuthors();
    }

    /**
     * @param authors sort keys ("Pratchett, Terry") mapped to display names ("Terry Pratchett")
     */
    public void setAuthors(Map<String, String> authors) {
        metadata.setAuthors(authors);
    }

    public void setAuthors(List<String> authors) {
        metadata.setAuthors(authors);
    }

    /**
     * @param authors comma separated names
     */
    public void setAuthors(String authors) {
        metadata.setAuthors(authors);
    }

    public List<String> getSubjects() {
        return metadata.getSubjects();
    }

    public void setSubjects(List<String> subjects) {
        metadata.setSubjects(subjects);
    }

    public void setSubjects(String subjects) {
        metadata.setSubjects(subjects);
    }

    /**
     * @return the cover image, {@code null} if there is none or a new one was set but not saved yet
     */
    public Cover getCover() {
        return coverPageManager.getCover();
    }

    /**
     * Set a new cover image. It is added to the file on {@link #save()}.
     */
    public void setCover(Path image, String mediaType) {
        coverPageManager.setCover(image, mediaType);
    }

    public void clearCover() {
        coverPageManager.clearCover();
    }

    public void addCoverImageTitlePage() {
        coverPageManager.addCoverImageTitlePage();
    }

    /**
     * @param template XHTML with the placeholders {@code ${title}} and {@code ${coverImagePath}}
     */
    public void addCoverImageTitlePage(String template) {
        coverPageManager.addCoverImageTitlePage(template);
    }

    public void removeTitlePage() {
        coverPageManager.removeTitlePage();
    }

    public Manifest getManifest() {
        if (manifest == null) {
            manifest = manifestParser.parse(packageDocument);
        }
        return manifest;
    }

    public Spine getSpine() {
        if (spine == null) {
            spine = spineParser.parse(packageDocument, getManifest());
        }
        return spine;
    }

    public Toc getToc() {
        if (toc == null) {
            toc = tocParser.parse(getSpine().getTocItem(), getManifest());
        }
        return toc;
    }

    /**
     * Plain text of the whole book.
     */
    public String getContents() {
        return getContents(false, 1);
    }

    /**
     * Text of the book in reading order.
     *
     * @param keepMarkup whether to keep basic formatting markup
     * @param fraction   share of the book to read, by file size. Reading stops before the first file that would
     *                   exceed it. Spine items that are not XHTML are skipped and do not count.
     */
    public String getContents(boolean keepMarkup, double fraction) {
        if (fraction < 0) {
            throw EpubError.INVALID_INPUT.createException("negative fraction " + fraction);
        }
        List<ManifestItem> readingOrder = getSpine().stream().filter(ManifestItem::isXhtml).toList();
        long totalSize = readingOrder.stream().mapToLong(ManifestItem::getSize).sum();
        double limit = fraction * totalSize;

        StringBuilder contents = new StringBuilder();
        long readSize = 0;
        for (ManifestItem item : readingOrder) {
            if (fraction < 1 && readSize + item.getSize() > limit) {
                break;
            }
            readSize += item.getSize();
            contents.append(item.getContents(null, null, keepMarkup));
        }
        return contents.toString();
    }

    private void invalidateCaches() {
        if (manifest != null || toc != null) {
            log.debug("Dropping cached structure of {}", path.getFileName());
        }
        manifest = null;
        spine = null;
        toc = null;
    }
}
