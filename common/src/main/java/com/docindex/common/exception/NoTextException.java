package com.docindex.common.exception;

import lombok.Getter;

/**
 * The document exists but no usable text could be derived from it.
 */
@Getter
public class NoTextException extends DocIndexException {

    private final String key;

    public NoTextException(String key) {
        super("Document has no text to embed: " + key);
        this.key = key;
    }
}
