package org.epubmeta.model;

import org.epubmeta.exception.EpubError;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * All files declared in an EPUB package document, in declaration order.
 */
public final class Manifest implements Iterable<ManifestItem> {

    private final Map<String, ManifestItem> itemsById;
    private final List<ManifestItem> items;

    private Manifest(Map<String, ManifestItem> itemsById) {
        this.itemsById = Collections.unmodifiableMap(itemsById);
        this.items = List.copyOf(itemsById.values());
    }

    /**
     * @throws org.epubmeta.exception.EpubStructureException if two items share an ID
     */
    public static Manifest of(List<ManifestItem> items) {
        Map<String, ManifestItem> byId = new LinkedHashMap<>();
        for (ManifestItem item : items) {
            if (byId.putIfAbsent(item.getId(), item) != null) {
                throw EpubError.DUPLICATE_MANIFEST_ITEM.createException(item.getId());
            }
        }
        return new Manifest(byId);
    }

    /**
     * @return the item with the given ID, or {@code null}
     */
    public ManifestItem get(String id) {
        return itemsById.get(id);
    }

    public ManifestItem get(int index) {
        return items.get(index);
    }

    public boolean contains(String id) {
        return itemsById.containsKey(id);
    }

    /**
     * @return the first item declared with the given href, or {@code null}
     */
    public ManifestItem findByHref(String href) {
        for (ManifestItem item : items) {
            if (item.getHref().equals(href)) {
                return item;
            }
        }
        return null;
    }

    public ManifestItem first() {
        return items.isEmpty() ? null : items.get(0);
    }

    public ManifestItem last() {
        return items.isEmpty() ? null : items.get(items.size() - 1);
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

    public List<String> getIds() {
        return new ArrayList<>(itemsById.keySet());
    }

    public Stream<ManifestItem> stream() {
        return items.stream();
    }

    @Override
    public Iterator<ManifestItem> iterator() {
        return items.iterator();
    }
}
