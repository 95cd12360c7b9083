package com.docindex.common.exception;

import lombok.Getter;

@Getter
public class DocumentNotFoundException extends DocIndexException {

    private final String key;

    public DocumentNotFoundException(String key) {
        super("Document not found: " + key);
        this.key = key;
    }
}
