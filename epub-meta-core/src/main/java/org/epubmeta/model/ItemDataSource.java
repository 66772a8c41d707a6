package org.epubmeta.model;

import java.io.IOException;

/**
 * Deferred read of the archive member behind a manifest item.
 */
@FunctionalInterface
public interface ItemDataSource {

    /**
     * @return the member's data, or {@code null} if the archive has no such member
     */
    byte[] read() throws IOException;
}
