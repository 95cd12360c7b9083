package com.docindex.common.exception;

public class EmptyQueryException extends DocIndexException {

    public EmptyQueryException() {
        super("Query text must not be blank");
    }
}
