package org.epubmeta.exception;

/**
 * A required archive member or XML element is missing or malformed.
 */
public class EpubStructureException extends EpubException {

    public EpubStructureException(EpubError error, String message) {
        super(error, message);
    }
}
