package org.epubmeta.archive;

import lombok.Getter;

import java.io.IOException;

@Getter
public class ArchiveException extends IOException {

    private final ArchiveStatus status;

    public ArchiveException(ArchiveStatus status, String message) {
        super(message);
        this.status = status;
    }

    public ArchiveException(ArchiveStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }
}
