package org.epubmeta.archive;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * The container file of an EPUB.
 * <p>
 * Writes and deletions are staged and only reach the file on {@link #commit()}. Reads see staged changes.
 */
public interface EpubArchive extends Closeable {

    Path getPath();

    /**
     * @return the member's data, or {@code null} if there is no such member
     */
    byte[] readMember(String name) throws IOException;

    boolean hasMember(String name);

    void writeMember(String name, byte[] data);

    void deleteMember(String name);

    /**
     * @return all member names mapped to their uncompressed size, in archive order
     */
    Map<String, Long> listMembers();

    /**
     * @return the uncompressed size of the member, 0 if unknown
     */
    long getMemberSize(String name);

    boolean hasPendingChanges();

    void commit() throws IOException;
}
