package com.docindex.main.service;

import com.docindex.common.exception.DocumentNotFoundException;
import com.docindex.common.exception.EmptyInputException;
import com.docindex.common.exception.NoTextException;
import com.docindex.common.model.DocumentRecord;
import com.docindex.main.dto.RegisterDocumentRequest;
import com.docindex.storage.kv.DocumentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Document registration on top of the document store.
 * Registered or changed documents become unindexed and are picked up by the next index update.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentService {

    private final DocumentStore documentStore;
    private final DocumentTextSource textSource;
    private final IndexManager indexManager;

    /**
     * Store a document. Documents without an abstract are rejected, since nothing could ever index them.
     */
    public DocumentRecord register(RegisterDocumentRequest request) {
        if (request.getAbstractText() == null || request.getAbstractText().isBlank()) {
            throw new EmptyInputException("Document " + request.getKey() + " has no abstract to index");
        }
        Instant now = Instant.now();
        Optional<DocumentRecord> existing = documentStore.get(request.getKey());

        boolean unchanged = existing
                .map(document -> document.indexed() && Objects.equals(document.abstractText(), request.getAbstractText()))
                .orElse(false);

        DocumentRecord document = DocumentRecord.builder()
                .key(request.getKey())
                .title(request.getTitle())
                .authors(request.getAuthors())
                .abstractText(request.getAbstractText())
                .primaryCategory(request.getPrimaryCategory())
                .indexed(unchanged)
                .createdAt(existing.map(DocumentRecord::createdAt).orElse(now))
                .updatedAt(now)
                .build();
        documentStore.put(document);

        log.debug("Registered document {} (new={}, needsIndexing={})", document.key(), existing.isEmpty(), !unchanged);
        return document;
    }

    public Optional<DocumentRecord> get(String key) {
        return documentStore.get(key);
    }

    public List<DocumentRecord> list(int limit) {
        return documentStore.list(limit);
    }

    /**
     * Index a stored document right away instead of waiting for the next update.
     */
    public boolean indexNow(String key) {
        DocumentRecord document = documentStore.get(key)
                .orElseThrow(() -> new DocumentNotFoundException(key));
        String text = textSource.textOf(document)
                .orElseThrow(() -> new NoTextException(key));
        return indexManager.addDocument(key, text);
    }

    public boolean delete(String key) {
        indexManager.removeDocument(key);
        boolean deleted = documentStore.delete(key);
        log.debug("Deleted document {}: {}", key, deleted);
        return deleted;
    }
}
