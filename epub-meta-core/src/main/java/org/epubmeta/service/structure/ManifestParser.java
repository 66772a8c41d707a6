package org.epubmeta.service.structure;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.epubmeta.archive.EpubArchive;
import org.epubmeta.dom.EpubElement;
import org.epubmeta.dom.PackageDocument;
import org.epubmeta.model.Manifest;
import org.epubmeta.model.ManifestItem;
import org.epubmeta.service.content.ContentExtractor;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Slf4j
@RequiredArgsConstructor
public class ManifestParser {

    private static final String ITEMS = "//opf:manifest/opf:item";

    private final EpubArchive archive;
    /** Files not handed to the archive yet, by archive path */
    private final Map<String, byte[]> stagedFiles;
    private final ContentExtractor contentExtractor;

    /**
     * @throws org.epubmeta.exception.EpubStructureException if there is no manifest or an ID is used twice
     */
    public Manifest parse(PackageDocument packageDocument) {
        packageDocument.requireManifest();
        Map<String, Long> memberSizes = archive.listMembers();

        List<ManifestItem> items = new ArrayList<>();
        for (EpubElement element : packageDocument.query(ITEMS)) {
            String id = element.getAttribute("id");
            String href = element.getAttribute("href");
            String mediaType = StringUtils.defaultIfEmpty(element.getAttribute("media-type"), ManifestItem.XHTML_MEDIA_TYPE);
            String path = packageDocument.resolveHref(href);
            byte[] staged = stagedFiles.get(path);
            long size = staged != null ? staged.length : memberSizes.getOrDefault(path, 0L);

            items.add(new ManifestItem(id, href, mediaType, path, size, () -> read(path), contentExtractor));
        }

        Manifest manifest = Manifest.of(items);
        log.debug("Parsed manifest with {} items", manifest.size());
        return manifest;
    }

    private byte[] read(String path) throws IOException {
        byte[] staged = stagedFiles.get(path);
        return staged != null ? staged : archive.readMember(path);
    }
}
