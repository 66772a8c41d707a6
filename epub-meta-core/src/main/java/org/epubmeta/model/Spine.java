package org.epubmeta.model;

import lombok.Getter;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * The reading order of an EPUB. Holds references to the items of its {@link Manifest}.
 */
public final class Spine implements Iterable<ManifestItem> {

    @Getter
    private final ManifestItem tocItem;
    private final List<ManifestItem> items;

    public Spine(ManifestItem tocItem, List<ManifestItem> items) {
        this.tocItem = Objects.requireNonNull(tocItem, "tocItem");
        this.items = List.copyOf(items);
    }

    public ManifestItem get(int index) {
        return items.get(index);
    }

    public ManifestItem first() {
        return items.isEmpty() ? null : items.get(0);
    }

    public ManifestItem last() {
        return items.isEmpty() ? null : items.get(items.size() - 1);
    }

    public int indexOf(ManifestItem item) {
        return items.indexOf(item);
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public List<ManifestItem> getItems() {
        return items;
    }

    public Stream<ManifestItem> stream() {
        return items.stream();
    }

    @Override
    public Iterator<ManifestItem> iterator() {
        return items.iterator();
    }
}
