package org.epubmeta.archive;

public enum ArchiveStatus {
    NO_SUCH_FILE,
    NOT_A_ZIP,
    INCONSISTENT,
    PERMISSION_DENIED,
    READ_ERROR,
    WRITE_ERROR
}
