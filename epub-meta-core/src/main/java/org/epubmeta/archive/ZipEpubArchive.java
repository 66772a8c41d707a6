package org.epubmeta.archive;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.apache.commons.io.IOUtils;
import org.epubmeta.util.ArchiveUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.Enumeration;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

@Slf4j
public class ZipEpubArchive implements EpubArchive {

    private final Path path;
    private final Map<String, byte[]> stagedWrites = new LinkedHashMap<>();
    private final Set<String> stagedDeletes = new HashSet<>();
    private ZipFile zipFile;

    private ZipEpubArchive(Path path, ZipFile zipFile) {
        this.path = path;
        this.zipFile = zipFile;
    }

    public static ZipEpubArchive open(Path path) throws ArchiveException {
        return new ZipEpubArchive(path, openZipFile(path));
    }

    private static ZipFile openZipFile(Path path) throws ArchiveException {
        if (!Files.exists(path)) {
            throw new ArchiveException(ArchiveStatus.NO_SUCH_FILE, "No such file: " + path);
        }
        if (Files.isDirectory(path)) {
            throw new ArchiveException(ArchiveStatus.READ_ERROR, "Is a directory: " + path);
        }
        if (!Files.isReadable(path)) {
            throw new ArchiveException(ArchiveStatus.PERMISSION_DENIED, "Permission denied: " + path);
        }
        try {
            return ZipFile.builder()
                    .setPath(path)
                    .setUseUnicodeExtraFields(true)
                    .get();
        } catch (AccessDeniedException e) {
            throw new ArchiveException(ArchiveStatus.PERMISSION_DENIED, "Permission denied: " + path, e);
        } catch (IOException e) {
            ArchiveStatus status = ArchiveUtils.hasZipSignature(path) ? ArchiveStatus.INCONSISTENT : ArchiveStatus.NOT_A_ZIP;
            throw new ArchiveException(status, e.getMessage(), e);
        }
    }

    @Override
    public Path getPath() {
        return path;
    }

    @Override
    public byte[] readMember(String name) throws IOException {
        if (stagedDeletes.contains(name)) {
            return null;
        }
        byte[] staged = stagedWrites.get(name);
        if (staged != null) {
            return staged;
        }
        ZipArchiveEntry entry = zipFile.getEntry(name);
        if (entry == null || entry.isDirectory()) {
            return null;
        }
        try (InputStream in = zipFile.getInputStream(entry)) {
            return IOUtils.toByteArray(in);
        } catch (IOException e) {
            throw new ArchiveException(ArchiveStatus.READ_ERROR, "Failed to read " + name + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean hasMember(String name) {
        if (stagedDeletes.contains(name)) {
            return false;
        }
        return stagedWrites.containsKey(name) || zipFile.getEntry(name) != null;
    }

    @Override
    public void writeMember(String name, byte[] data) {
        stagedDeletes.remove(name);
        stagedWrites.put(name, data);
    }

    @Override
    public void deleteMember(String name) {
        stagedWrites.remove(name);
        if (zipFile.getEntry(name) != null) {
            stagedDeletes.add(name);
        }
    }

    @Override
    public Map<String, Long> listMembers() {
        Map<String, Long> members = new LinkedHashMap<>();
        Enumeration<ZipArchiveEntry> entries = zipFile.getEntriesInPhysicalOrder();
        while (entries.hasMoreElements()) {
            ZipArchiveEntry entry = entries.nextElement();
            if (!entry.isDirectory() && !stagedDeletes.contains(entry.getName())) {
                members.put(entry.getName(), Math.max(entry.getSize(), 0L));
            }
        }
        stagedWrites.forEach((name, data) -> members.put(name, (long) data.length));
        return Collections.unmodifiableMap(members);
    }

    @Override
    public long getMemberSize(String name) {
        if (stagedDeletes.contains(name)) {
            return 0L;
        }
        byte[] staged = stagedWrites.get(name);
        if (staged != null) {
            return staged.length;
        }
        ZipArchiveEntry entry = zipFile.getEntry(name);
        return entry != null ? Math.max(entry.getSize(), 0L) : 0L;
    }

    @Override
    public boolean hasPendingChanges() {
        return !stagedWrites.isEmpty() || !stagedDeletes.isEmpty();
    }

    /**
     * Rewrite the archive with all staged changes. Untouched members are copied raw, keeping their order and
     * compression, so a stored {@code mimetype} member stays first and uncompressed.
     */
    @Override
    public void commit() throws IOException {
        if (!hasPendingChanges()) {
            return;
        }

        Path temp = Files.createTempFile(path.toAbsolutePath().getParent(), path.getFileName().toString() + ".", ".tmp");
        boolean closed = false;
        try {
            writeTo(temp);
            zipFile.close();
            closed = true;
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            Files.deleteIfExists(temp);
            ArchiveException failure = new ArchiveException(ArchiveStatus.WRITE_ERROR,
                    "Failed to write " + path + ": " + e.getMessage(), e);
            if (closed) {
                // the original file is untouched, staged changes stay for another attempt
                try {
                    zipFile = openZipFile(path);
                } catch (ArchiveException reopenError) {
                    failure.addSuppressed(reopenError);
                }
            }
            throw failure;
        }

        log.debug("Committed {} writes and {} deletions to {}", stagedWrites.size(), stagedDeletes.size(), path.getFileName());
        stagedWrites.clear();
        stagedDeletes.clear();
        zipFile = openZipFile(path);
    }

    private void writeTo(Path target) throws IOException {
        Map<String, byte[]> pending = new LinkedHashMap<>(stagedWrites);
        try (ZipArchiveOutputStream out = new ZipArchiveOutputStream(target)) {
            Enumeration<ZipArchiveEntry> entries = zipFile.getEntriesInPhysicalOrder();
            while (entries.hasMoreElements()) {
                ZipArchiveEntry entry = entries.nextElement();
                String name = entry.getName();
                if (stagedDeletes.contains(name)) {
                    continue;
                }
                byte[] replacement = pending.remove(name);
                if (replacement != null) {
                    putEntry(out, name, replacement, entry.getMethod());
                } else {
                    try (InputStream raw = zipFile.getRawInputStream(entry)) {
                        out.addRawArchiveEntry(entry, raw);
                    }
                }
            }
            for (Map.Entry<String, byte[]> added : pending.entrySet()) {
                putEntry(out, added.getKey(), added.getValue(), ZipArchiveEntry.DEFLATED);
            }
            out.finish();
        }
    }

    private static void putEntry(ZipArchiveOutputStream out, String name, byte[] data, int method) throws IOException {
        ZipArchiveEntry entry = new ZipArchiveEntry(name);
        entry.setMethod(method);
        entry.setSize(data.length);
        out.putArchiveEntry(entry);
        out.write(data);
        out.closeArchiveEntry();
    }

    @Override
    public void close() throws IOException {
        zipFile.close();
    }
}
