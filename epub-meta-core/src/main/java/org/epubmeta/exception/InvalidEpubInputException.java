package org.epubmeta.exception;

/**
 * A caller-supplied argument was rejected.
 */
public class InvalidEpubInputException extends EpubException {

    public InvalidEpubInputException(EpubError error, String message) {
        super(error, message);
    }
}
