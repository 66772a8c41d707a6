package org.epubmeta.exception;

import lombok.Getter;

@Getter
public enum EpubError {
    FILE_NOT_FOUND(Category.IO, "Failed to read EPUB file. No such file."),
    NOT_A_ZIP_ARCHIVE(Category.IO, "Failed to read EPUB file. Not a zip archive."),
    ZIP_ARCHIVE_INCONSISTENT(Category.IO, "Failed to read EPUB file. Zip archive inconsistent."),
    PERMISSION_DENIED(Category.IO, "Failed to read EPUB file. Permission denied."),
    FILE_READ_ERROR(Category.IO, "Failed to read EPUB file. %s"),
    FILE_WRITE_ERROR(Category.IO, "Failed to write EPUB file %s: %s"),

    CONTAINER_DATA_MISSING(Category.STRUCTURE, "Failed to access EPUB container data: %s"),
    MALFORMED_XML(Category.STRUCTURE, "Malformed XML in EPUB container data: %s"),
    ROOTFILE_MISSING(Category.STRUCTURE, "No rootfile found in container.xml!"),
    METADATA_MISSING(Category.STRUCTURE, "No metadata element found in package document!"),
    MANIFEST_MISSING(Category.STRUCTURE, "No manifest element found in package document!"),
    DUPLICATE_MANIFEST_ITEM(Category.STRUCTURE, "Item with ID %s already exists!"),
    SPINE_MISSING(Category.STRUCTURE, "No spine element found in epub!"),
    TOC_ID_MISSING(Category.STRUCTURE, "No toc ID given in spine!"),
    TOC_ITEM_MISSING(Category.STRUCTURE, "TOC item referenced by spine missing in manifest: %s"),
    SPINE_ITEM_MISSING(Category.STRUCTURE, "Item referenced by spine missing in manifest: %s"),
    TOC_REFERENCE_DANGLING(Category.STRUCTURE, "Navigation point %s references a file missing in manifest: %s"),

    FRAGMENT_BEGIN_NOT_FOUND(Category.NOT_FOUND, "Begin of fragment not found: No element with ID %s!"),
    FRAGMENT_END_NOT_FOUND(Category.NOT_FOUND, "End of fragment not found: No element with ID %s!"),

    INVALID_COVER_PATH(Category.INVALID_INPUT, "Cover image is not readable: %s"),
    NO_COVER_IMAGE(Category.INVALID_INPUT, "No cover image set in EPUB: %s"),
    TITLE_PAGE_TEMPLATE_MISSING(Category.INVALID_INPUT, "Title page template not found: %s"),
    INVALID_INPUT(Category.INVALID_INPUT, "Invalid input: %s"),

    UNKNOWN_NAMESPACE(Category.CONFIGURATION, "Unknown XML namespace %s!");

    public enum Category {
        IO,
        STRUCTURE,
        NOT_FOUND,
        INVALID_INPUT,
        CONFIGURATION
    }

    private final Category category;
    private final String message;

    EpubError(Category category, String message) {
        this.category = category;
        this.message = message;
    }

    public EpubException createException(Object... details) {
        String formatted = (details.length > 0) ? String.format(message, details) : message;
        return switch (category) {
            case IO -> new EpubIoException(this, formatted);
            case STRUCTURE -> new EpubStructureException(this, formatted);
            case NOT_FOUND -> new FragmentNotFoundException(this, formatted);
            case INVALID_INPUT -> new InvalidEpubInputException(this, formatted);
            case CONFIGURATION -> new UnknownNamespaceException(this, formatted);
        };
    }

    public EpubException createException(Throwable cause, Object... details) {
        EpubException exception = createException(details);
        exception.initCause(cause);
        return exception;
    }
}
