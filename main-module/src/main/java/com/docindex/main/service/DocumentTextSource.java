package com.docindex.main.service;

import com.docindex.common.model.DocumentRecord;

import java.util.Optional;

/**
 * Derives the text that gets embedded for a stored document.
 */
public interface DocumentTextSource {

    /** Usable text of the document, empty when there is none */
    Optional<String> textOf(DocumentRecord document);
}
