package com.docindex.common.exception;

public class EmptyInputException extends DocIndexException {

    public EmptyInputException(String message) {
        super(message);
    }
}
