package org.epubmeta.service.cover;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.io.IOUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.text.StringEscapeUtils;
import org.apache.commons.text.StringSubstitutor;
import org.epubmeta.archive.EpubArchive;
import org.epubmeta.config.EpubProperties;
import org.epubmeta.dom.EpubElement;
import org.epubmeta.dom.PackageDocument;
import org.epubmeta.exception.EpubError;
import org.epubmeta.model.Cover;
import org.epubmeta.model.ManifestItem;
import org.epubmeta.service.metadata.MetadataAccessor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Manages the cover image of an EPUB and an optional generated title page showing it.
 * <p>
 * New files are held back until {@link #flushPendingFiles()} hands them to the archive on save, so
 * {@link #getCover()} does not see a new image before that.
 */
@Slf4j
public class CoverPageManager {

    private static final String COVER_POINTER = "//opf:metadata/opf:meta[@name='cover']";
    private static final String MANIFEST_ITEM_BY_ID = "//opf:manifest/opf:item[@id=$id]";
    private static final String SPINE_ITEMREF_BY_ID = "//opf:spine/opf:itemref[@idref=$id]";
    private static final String GUIDE_REFERENCE_BY_HREF = "//opf:guide/opf:reference[@href=$href]";
    private static final String DEFAULT_COVER_EXTENSION = "img";

    private static final Map<String, String> IMAGE_EXTENSIONS = Map.of(
            "image/jpeg", "jpg",
            "image/jpg", "jpg",
            "image/png", "png",
            "image/gif", "gif",
            "image/svg+xml", "svg",
            "image/webp", "webp"
    );

    private final PackageDocument packageDocument;
    private final EpubArchive archive;
    private final MetadataAccessor metadataAccessor;
    private final EpubProperties properties;
    private final Map<String, byte[]> pendingFiles = new LinkedHashMap<>();

    public CoverPageManager(PackageDocument packageDocument, EpubArchive archive, MetadataAccessor metadataAccessor,
                            EpubProperties properties) {
        this.packageDocument = packageDocument;
        this.archive = archive;
        this.metadataAccessor = metadataAccessor;
        this.properties = properties;
    }

    /**
     * Replace the cover image by a local file. The image is added to the archive on save.
     *
     * @throws org.epubmeta.exception.InvalidEpubInputException if the file cannot be read or no media type is given
     */
    public void setCover(Path source, String mediaType) {
        if (source == null || !Files.isRegularFile(source) || !Files.isReadable(source)) {
            throw EpubError.INVALID_COVER_PATH.createException(source);
        }
        if (StringUtils.isBlank(mediaType)) {
            throw EpubError.INVALID_INPUT.createException("media type of cover image missing");
        }
        byte[] data;
        try {
            data = Files.readAllBytes(source);
        } catch (IOException e) {
            throw EpubError.INVALID_COVER_PATH.createException(e, source);
        }

        clearCover();

        String coverId = properties.getCoverId();
        String href = coverId + "." + coverExtension(mediaType, source);

        EpubElement pointer = packageDocument.requireMetadata().newChild("opf:meta");
        pointer.setAttribute("name", "cover");
        pointer.setAttribute("content", coverId);

        EpubElement item = packageDocument.requireManifest().newChild("opf:item");
        item.setAttribute("id", coverId);
        item.setAttribute("href", href);
        item.setAttribute("media-type", mediaType);

        pendingFiles.put(packageDocument.resolveHref(href), data);
        packageDocument.resync();
        log.debug("Staged cover image {} as {}", source.getFileName(), href);
    }

    /**
     * Remove the cover pointer. Manifest entries and images are only removed if this library added them, as other
     * images may be referenced from content documents too.
     */
    public void clearCover() {
        List<EpubElement> pointers = packageDocument.query(COVER_POINTER);
        List<EpubElement> ownItems = packageDocument.query(MANIFEST_ITEM_BY_ID, Map.of("id", properties.getCoverId()));
        if (pointers.isEmpty() && ownItems.isEmpty()) {
            return;
        }
        pointers.forEach(EpubElement::delete);
        for (EpubElement item : ownItems) {
            removeFile(packageDocument.resolveHref(item.getAttribute("href")));
            item.delete();
        }
        packageDocument.resync();
    }

    /**
     * @return the cover image, or {@code null} if the EPUB has none or the image is not stored in the archive yet
     */
    public Cover getCover() {
        EpubElement item = findCoverItem();
        if (item == null) {
            return null;
        }
        String path = packageDocument.resolveHref(item.getAttribute("href"));
        byte[] data;
        try {
            data = archive.readMember(path);
        } catch (IOException e) {
            throw EpubError.FILE_READ_ERROR.createException(e, e.getMessage());
        }
        if (data == null) {
            return null;
        }
        return Cover.builder()
                .mediaType(item.getAttribute("media-type"))
                .data(data)
                .path(path)
                .build();
    }

    public void addCoverImageTitlePage() {
        addCoverImageTitlePage(loadTemplate(properties.getTitlePageTemplate()));
    }

    /**
     * Add a title page showing the cover image in front of all other content. An existing generated title page is
     * replaced.
     *
     * @param template XHTML with the placeholders {@code ${title}} and {@code ${coverImagePath}}
     * @throws org.epubmeta.exception.InvalidEpubInputException if the EPUB has no cover image
     */
    public void addCoverImageTitlePage(String template) {
        EpubElement coverItem = findCoverItem();
        if (coverItem == null) {
            throw EpubError.NO_COVER_IMAGE.createException(archive.getPath().getFileName());
        }
        String coverHref = coverItem.getAttribute("href");

        removeTitlePage();

        Map<String, String> values = Map.of(
                "title", StringEscapeUtils.escapeXml10(metadataAccessor.getSingleton(MetadataAccessor.TITLE)),
                "coverImagePath", StringEscapeUtils.escapeXml10(coverHref));
        String page = new StringSubstitutor(values).replace(template);

        String titlePageId = properties.getTitlePageId();
        String href = titlePageHref();

        EpubElement item = packageDocument.requireManifest().newChildFirst("opf:item", "");
        item.setAttribute("id", titlePageId);
        item.setAttribute("href", href);
        item.setAttribute("media-type", ManifestItem.XHTML_MEDIA_TYPE);

        EpubElement itemref = packageDocument.requireSpine().newChildFirst("opf:itemref", "");
        itemref.setAttribute("idref", titlePageId);

        EpubElement guide = packageDocument.queryFirst(PackageDocument.GUIDE);
        if (guide == null) {
            guide = packageDocument.getRoot().newChild("opf:guide");
        }
        EpubElement reference = guide.newChildFirst("opf:reference", "");
        reference.setAttribute("type", "cover");
        reference.setAttribute("title", "Cover");
        reference.setAttribute("href", href);

        pendingFiles.put(packageDocument.resolveHref(href), page.getBytes(StandardCharsets.UTF_8));
        packageDocument.resync();
        log.debug("Staged title page {} for cover {}", href, coverHref);
    }

    /**
     * Remove a title page added by {@link #addCoverImageTitlePage()} together with its manifest, spine and guide
     * entries.
     */
    public void removeTitlePage() {
        String titlePageId = properties.getTitlePageId();
        List<EpubElement> items = packageDocument.query(MANIFEST_ITEM_BY_ID, Map.of("id", titlePageId));
        List<EpubElement> itemrefs = packageDocument.query(SPINE_ITEMREF_BY_ID, Map.of("id", titlePageId));
        if (items.isEmpty() && itemrefs.isEmpty()) {
            return;
        }
        for (EpubElement item : items) {
            String href = item.getAttribute("href");
            packageDocument.query(GUIDE_REFERENCE_BY_HREF, Map.of("href", href)).forEach(EpubElement::delete);
            removeFile(packageDocument.resolveHref(href));
            item.delete();
        }
        itemrefs.forEach(EpubElement::delete);
        packageDocument.resync();
    }

    public boolean hasPendingFiles() {
        return !pendingFiles.isEmpty();
    }

    public Map<String, byte[]> getPendingFiles() {
        return Collections.unmodifiableMap(pendingFiles);
    }

    /**
     * Hand all held back files to the archive.
     */
    public void flushPendingFiles() {
        pendingFiles.forEach(archive::writeMember);
        pendingFiles.clear();
    }

    private EpubElement findCoverItem() {
        EpubElement pointer = packageDocument.queryFirst(COVER_POINTER);
        if (pointer == null) {
            return null;
        }
        String coverId = pointer.getAttribute("content");
        if (StringUtils.isEmpty(coverId)) {
            return null;
        }
        return packageDocument.queryFirst(MANIFEST_ITEM_BY_ID, Map.of("id", coverId));
    }

    private void removeFile(String path) {
        pendingFiles.remove(path);
        archive.deleteMember(path);
    }

    private String titlePageHref() {
        return properties.getTitlePageId() + ".xhtml";
    }

    static String coverExtension(String mediaType, Path source) {
        String extension = IMAGE_EXTENSIONS.get(mediaType.toLowerCase(Locale.ROOT));
        if (extension == null) {
            extension = FilenameUtils.getExtension(source.getFileName().toString());
        }
        return StringUtils.defaultIfEmpty(extension, DEFAULT_COVER_EXTENSION).toLowerCase(Locale.ROOT);
    }

    private static String loadTemplate(String resource) {
        try {
            return IOUtils.resourceToString(resource, StandardCharsets.UTF_8, CoverPageManager.class.getClassLoader());
        } catch (IOException e) {
            throw EpubError.TITLE_PAGE_TEMPLATE_MISSING.createException(e, resource);
        }
    }
}
