package org.epubmeta.exception;

/**
 * A qualified name used a namespace prefix that is not registered.
 */
public class UnknownNamespaceException extends EpubException {

    public UnknownNamespaceException(EpubError error, String message) {
        super(error, message);
    }
}
