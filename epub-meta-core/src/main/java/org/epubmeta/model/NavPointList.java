package org.epubmeta.model;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Sibling entries of the table of contents, in reading order.
 */
public final class NavPointList implements Iterable<NavPoint> {

    private final List<NavPoint> navPoints;

    public NavPointList(List<NavPoint> navPoints) {
        this.navPoints = navPoints != null ? List.copyOf(navPoints) : List.of();
    }

    public NavPoint get(int index) {
        return navPoints.get(index);
    }

    public NavPoint first() {
        return navPoints.isEmpty() ? null : navPoints.get(0);
    }

    public NavPoint last() {
        return navPoints.isEmpty() ? null : navPoints.get(navPoints.size() - 1);
    }

    public int size() {
        return navPoints.size();
    }

    public boolean isEmpty() {
        return navPoints.isEmpty();
    }

    /**
     * All entries below this list (depth first, parents before children) whose content source points to the given
     * file.
     */
    public List<NavPoint> findNavPointsForFile(String file) {
        List<NavPoint> matches = new ArrayList<>();
        collect(file, matches);
        return matches;
    }

    private void collect(String file, List<NavPoint> matches) {
        for (NavPoint navPoint : navPoints) {
            if (navPoint.getContentSourceFile().equals(file)) {
                matches.add(navPoint);
            }
            navPoint.getChildren().collect(file, matches);
        }
    }

    public List<NavPoint> getNavPoints() {
        return navPoints;
    }

    public Stream<NavPoint> stream() {
        return navPoints.stream();
    }

    @Override
    public Iterator<NavPoint> iterator() {
        return navPoints.iterator();
    }
}
