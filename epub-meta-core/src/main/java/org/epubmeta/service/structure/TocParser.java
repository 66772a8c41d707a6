package org.epubmeta.service.structure;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.epubmeta.config.EpubProperties;
import org.epubmeta.dom.EpubElement;
import org.epubmeta.dom.EpubXPath;
import org.epubmeta.exception.EpubError;
import org.epubmeta.model.Manifest;
import org.epubmeta.model.ManifestItem;
import org.epubmeta.model.NavPoint;
import org.epubmeta.model.Toc;
import org.epubmeta.service.loader.DocumentLoader;
import org.epubmeta.util.HrefUtils;
import org.w3c.dom.Document;
import org.w3c.dom.Node;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads the NCX table of contents.
 */
@Slf4j
@RequiredArgsConstructor
public class TocParser {

    private static final String DOC_TITLE = "//ncx:docTitle/ncx:text";
    private static final String DOC_AUTHOR = "//ncx:docAuthor/ncx:text";
    private static final String NAV_MAP = "//ncx:navMap";
    private static final String CHILD_NAV_POINTS = "ncx:navPoint";
    private static final String LABEL = "ncx:navLabel/ncx:text";
    private static final String CONTENT = "ncx:content";

    private final DocumentLoader documentLoader;
    private final EpubProperties properties;
    private final EpubXPath xpath = new EpubXPath();

    /**
     * @param tocItem  manifest item of the NCX file
     * @param manifest used to check the files navigation points refer to
     */
    public Toc parse(ManifestItem tocItem, Manifest manifest) {
        Document ncx = documentLoader.loadXmlMember(tocItem.getPath());

        String docTitle = text(xpath.queryFirst(DOC_TITLE, ncx));
        String docAuthor = text(xpath.queryFirst(DOC_AUTHOR, ncx));

        List<NavPoint> navPoints = new ArrayList<>();
        EpubElement navMap = xpath.queryFirst(NAV_MAP, ncx);
        if (navMap != null) {
            navPoints = parseNavPoints(navMap.unwrap());
        }
        Toc toc = new Toc(docTitle, docAuthor, navPoints);

        if (properties.isValidateTocReferences()) {
            validateReferences(toc.getNavMap().getNavPoints(), tocItem, manifest);
        }
        log.debug("Parsed toc {} with {} top level navigation points", tocItem.getHref(), navPoints.size());
        return toc;
    }

    // Only direct navPoint children are nested, deeper ones belong to those children.
    private List<NavPoint> parseNavPoints(Node parent) {
        List<NavPoint> navPoints = new ArrayList<>();
        for (EpubElement element : xpath.query(CHILD_NAV_POINTS, parent)) {
            EpubElement label = xpath.queryFirst(LABEL, element.unwrap());
            EpubElement content = xpath.queryFirst(CONTENT, element.unwrap());
            navPoints.add(new NavPoint(
                    element.getAttribute("id"),
                    element.getAttribute("class"),
                    NumberUtils.toInt(StringUtils.trim(element.getAttribute("playOrder")), 0),
                    text(label),
                    content != null ? content.getAttribute("src") : "",
                    parseNavPoints(element.unwrap())));
        }
        return navPoints;
    }

    private void validateReferences(List<NavPoint> navPoints, ManifestItem tocItem, Manifest manifest) {
        Set<String> manifestPaths = manifest.stream()
                .map(ManifestItem::getPath)
                .collect(Collectors.toSet());
        String tocDirectory = FilenameUtils.getPath(tocItem.getPath());
        validateReferences(navPoints, tocDirectory, manifestPaths);
    }

    private void validateReferences(List<NavPoint> navPoints, String tocDirectory, Set<String> manifestPaths) {
        for (NavPoint navPoint : navPoints) {
            String file = navPoint.getContentSourceFile();
            // an empty file part points into the NCX itself
            if (StringUtils.isNotEmpty(file) && !file.contains("://")) {
                String path = FilenameUtils.normalize(tocDirectory + HrefUtils.decode(file), true);
                if (path == null || !manifestPaths.contains(path)) {
                    throw EpubError.TOC_REFERENCE_DANGLING.createException(navPoint.getId(), file);
                }
            }
            validateReferences(navPoint.getChildren().getNavPoints(), tocDirectory, manifestPaths);
        }
    }

    private static String text(EpubElement element) {
        return element != null ? StringUtils.trimToEmpty(element.getText()) : "";
    }
}
