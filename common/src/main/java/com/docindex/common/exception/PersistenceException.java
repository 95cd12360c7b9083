package com.docindex.common.exception;

public class PersistenceException extends DocIndexException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
