package org.epubmeta.model;

import lombok.Getter;
import org.epubmeta.exception.EpubError;
import org.epubmeta.service.content.ContentExtractor;

import java.io.IOException;
import java.util.Objects;

/**
 * A file declared in the EPUB manifest.
 */
@Getter
public class ManifestItem {

    public static final String XHTML_MEDIA_TYPE = "application/xhtml+xml";

    private final String id;
    /** Path of the file, relative to the package document */
    private final String href;
    private final String mediaType;
    /** Archive path of the file */
    private final String path;
    /** Uncompressed size from the archive index, 0 if unknown */
    private final long size;

    @Getter(lombok.AccessLevel.NONE)
    private final ItemDataSource dataSource;
    @Getter(lombok.AccessLevel.NONE)
    private final ContentExtractor contentExtractor;
    @Getter(lombok.AccessLevel.NONE)
    private byte[] data;

    public ManifestItem(String id, String href, String mediaType, String path, long size,
                        ItemDataSource dataSource, ContentExtractor contentExtractor) {
        this.id = Objects.requireNonNull(id, "id");
        this.href = Objects.requireNonNull(href, "href");
        this.mediaType = mediaType != null && !mediaType.isEmpty() ? mediaType : XHTML_MEDIA_TYPE;
        this.path = path;
        this.size = size;
        this.dataSource = dataSource;
        this.contentExtractor = contentExtractor;
    }

    /**
     * Read the referenced file. The data is read on first access and kept afterwards.
     */
    public byte[] getData() {
        if (data == null) {
            byte[] read;
            try {
                read = dataSource.read();
            } catch (IOException e) {
                throw EpubError.FILE_READ_ERROR.createException(e, e.getMessage());
            }
            if (read == null) {
                throw EpubError.CONTAINER_DATA_MISSING.createException(path);
            }
            data = read;
        }
        return data;
    }

    public boolean isXhtml() {
        return XHTML_MEDIA_TYPE.equals(mediaType);
    }

    /**
     * Extract the plain text contents of the referenced XHTML file.
     */
    public String getContents() {
        return getContents(null, null, false);
    }

    /**
     * Extract (a part of) the contents of the referenced XHTML file.
     *
     * @param fragmentBegin ID of the element to start reading at, {@code null} for the start of the body
     * @param fragmentEnd   ID of the element to stop reading at (exclusive), {@code null} for the end of the document
     * @param keepMarkup    whether to keep basic formatting markup instead of extracting plain text
     */
    public String getContents(String fragmentBegin, String fragmentEnd, boolean keepMarkup) {
        return contentExtractor.extract(this, fragmentBegin, fragmentEnd, keepMarkup);
    }

    @Override
    public String toString() {
        return "ManifestItem{id='" + id + "', href='" + href + "', mediaType='" + mediaType + "'}";
    }
}
