package org.epubmeta.model;

import lombok.Getter;

import java.util.List;

/**
 * The table of contents read from the NCX file of an EPUB.
 */
@Getter
public class Toc {

    private final String docTitle;
    private final String docAuthor;
    private final NavPointList navMap;

    public Toc(String docTitle, String docAuthor, List<NavPoint> navPoints) {
        this.docTitle = docTitle != null ? docTitle : "";
        this.docAuthor = docAuthor != null ? docAuthor : "";
        this.navMap = new NavPointList(navPoints);
    }

    public List<NavPoint> findNavPointsForFile(String file) {
        return navMap.findNavPointsForFile(file);
    }
}
