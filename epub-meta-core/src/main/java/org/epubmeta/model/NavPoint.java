package org.epubmeta.model;

import lombok.Getter;

import java.util.List;

/**
 * An entry of the EPUB table of contents, possibly with nested entries.
 */
@Getter
public class NavPoint {

    private final String id;
    /** Value of the {@code class} attribute, e.g. "chapter" */
    private final String navClass;
    private final int playOrder;
    private final String navLabel;
    /** File part of the content source, relative to the package document */
    private final String contentSourceFile;
    /** Fragment part of the content source, {@code null} if the source has none */
    private final String contentSourceFragment;
    private final NavPointList children;

    public NavPoint(String id, String navClass, int playOrder, String navLabel, String contentSource,
                    List<NavPoint> children) {
        this.id = id;
        this.navClass = navClass;
        this.playOrder = playOrder;
        this.navLabel = navLabel != null ? navLabel : "";
        String source = contentSource != null ? contentSource : "";
        int hash = source.indexOf('#');
        if (hash < 0) {
            this.contentSourceFile = source;
            this.contentSourceFragment = null;
        } else {
            this.contentSourceFile = source.substring(0, hash);
            this.contentSourceFragment = source.substring(hash + 1);
        }
        this.children = new NavPointList(children);
    }

    public String getContentSource() {
        return contentSourceFragment != null ? contentSourceFile + "#" + contentSourceFragment : contentSourceFile;
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    @Override
    public String toString() {
        return "NavPoint{id='" + id + "', playOrder=" + playOrder + ", navLabel='" + navLabel + "', src='" + getContentSource() + "'}";
    }
}
