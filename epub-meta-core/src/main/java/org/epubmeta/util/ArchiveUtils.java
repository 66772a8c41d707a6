package org.epubmeta.util;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

@Slf4j
@UtilityClass
public class ArchiveUtils {

    // Local file header, the usual start of a zip file
    private static final byte[] ZIP_MAGIC = {0x50, 0x4B, 0x03, 0x04};
    // End of central directory record, the start of an archive without entries
    private static final byte[] ZIP_EMPTY_MAGIC = {0x50, 0x4B, 0x05, 0x06};
    // Spanned archive marker
    private static final byte[] ZIP_SPANNED_MAGIC = {0x50, 0x4B, 0x07, 0x08};

    /**
     * Whether the file starts with a zip signature. Used to tell a broken archive from something that never was one.
     */
    public static boolean hasZipSignature(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            return false;
        }

        try (InputStream is = new BufferedInputStream(Files.newInputStream(file))) {
            byte[] buffer = new byte[4];
            int bytesRead = is.readNBytes(buffer, 0, buffer.length);
            if (bytesRead < buffer.length) {
                return false;
            }
            return startsWith(buffer, ZIP_MAGIC)
                    || startsWith(buffer, ZIP_EMPTY_MAGIC)
                    || startsWith(buffer, ZIP_SPANNED_MAGIC);
        } catch (IOException e) {
            log.warn("Failed to detect archive type by content for file: {}", file.toAbsolutePath());
            return false;
        }
    }

    private static boolean startsWith(byte[] buffer, byte[] magic) {
        if (buffer.length < magic.length) {
            return false;
        }
        for (int i = 0; i < magic.length; i++) {
            if (buffer[i] != magic[i]) {
                return false;
            }
        }
        return true;
    }
}
