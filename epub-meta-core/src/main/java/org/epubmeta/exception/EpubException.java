package org.epubmeta.exception;

import lombok.Getter;

@Getter
public class EpubException extends RuntimeException {

    private final EpubError error;

    public EpubException(EpubError error, String message) {
        super(message);
        this.error = error;
    }

    public EpubError.Category getCategory() {
        return error.getCategory();
    }
}
