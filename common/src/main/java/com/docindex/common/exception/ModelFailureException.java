package com.docindex.common.exception;

/**
 * The embedding model could not be loaded or failed during inference.
 */
public class ModelFailureException extends DocIndexException {

    public ModelFailureException(String message) {
        super(message);
    }

    public ModelFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
