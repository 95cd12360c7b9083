package com.docindex.common.exception;

/**
 * Base type of every error raised by the indexer.
 */
public class DocIndexException extends RuntimeException {

    public DocIndexException(String message) {
        super(message);
    }

    public DocIndexException(String message, Throwable cause) {
        super(message, cause);
    }
}
