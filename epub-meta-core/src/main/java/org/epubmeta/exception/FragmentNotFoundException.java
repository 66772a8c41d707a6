package org.epubmeta.exception;

/**
 * A fragment anchor was not found in the target document.
 */
public class FragmentNotFoundException extends EpubException {

    public FragmentNotFoundException(EpubError error, String message) {
        super(error, message);
    }
}
