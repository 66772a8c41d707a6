package org.epubmeta.service.structure;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.epubmeta.dom.EpubElement;
import org.epubmeta.dom.PackageDocument;
import org.epubmeta.exception.EpubError;
import org.epubmeta.model.Manifest;
import org.epubmeta.model.ManifestItem;
import org.epubmeta.model.Spine;

import java.util.ArrayList;
import java.util.List;

@Slf4j
public class SpineParser {

    private static final String ITEMREFS = "//opf:spine/opf:itemref";

    /**
     * @throws org.epubmeta.exception.EpubStructureException if the spine is missing or references items the manifest
     *                                                       does not declare
     */
    public Spine parse(PackageDocument packageDocument, Manifest manifest) {
        EpubElement spineElement = packageDocument.requireSpine();

        String tocId = spineElement.getAttribute("toc");
        if (StringUtils.isEmpty(tocId)) {
            throw EpubError.TOC_ID_MISSING.createException();
        }
        ManifestItem tocItem = manifest.get(tocId);
        if (tocItem == null) {
            throw EpubError.TOC_ITEM_MISSING.createException(tocId);
        }

        List<ManifestItem> items = new ArrayList<>();
        for (EpubElement itemref : packageDocument.query(ITEMREFS)) {
            String idref = itemref.getAttribute("idref");
            ManifestItem item = manifest.get(idref);
            if (item == null) {
                throw EpubError.SPINE_ITEM_MISSING.createException(idref);
            }
            items.add(item);
        }

        log.debug("Parsed spine with {} items, toc {}", items.size(), tocItem.getHref());
        return new Spine(tocItem, items);
    }
}
