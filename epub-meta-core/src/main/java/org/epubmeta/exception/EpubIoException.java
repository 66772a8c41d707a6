package org.epubmeta.exception;

/**
 * Archive unreadable or unwritable.
 */
public class EpubIoException extends EpubException {

    public EpubIoException(EpubError error, String message) {
        super(error, message);
    }
}
