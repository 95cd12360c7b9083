package com.docindex.main.service;

import com.docindex.common.model.DocumentRecord;
import com.docindex.common.model.SimilarDocument;
import com.docindex.main.dto.SimilarDocumentView;
import com.docindex.main.dto.SimilarDocumentsResponse;
import com.docindex.storage.kv.DocumentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs index searches and joins the hits with document metadata.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SearchService {

    /** Versioned keys such as 2101.00001v3 */
    private static final Pattern VERSION_SUFFIX = Pattern.compile("^(.+?)v\\d+$");

    private final IndexManager indexManager;
    private final DocumentStore documentStore;

    public SimilarDocumentsResponse similarToDocument(String key, int k) {
        String resolvedKey = resolveKey(key);
        log.debug("Searching {} documents similar to {}", k, resolvedKey);
        return SimilarDocumentsResponse.of(resolvedKey, join(indexManager.findSimilarByKey(resolvedKey, k)));
    }

    public SimilarDocumentsResponse semanticSearch(String query, int k) {
        log.debug("Semantic search for '{}', k={}", query, k);
        return SimilarDocumentsResponse.of(query, join(indexManager.findSimilarByText(query, k)));
    }

    public List<SimilarDocument> searchByVector(float[] vector, int k) {
        return indexManager.findSimilarByVector(vector, k);
    }

    /**
     * Falls back to the unversioned key when the versioned one is not stored.
     */
    String resolveKey(String key) {
        if (documentStore.get(key).isPresent()) {
            return key;
        }
        Matcher matcher = VERSION_SUFFIX.matcher(key);
        if (matcher.matches() && documentStore.get(matcher.group(1)).isPresent()) {
            return matcher.group(1);
        }
        return key;
    }

    private List<SimilarDocumentView> join(List<SimilarDocument> hits) {
        List<SimilarDocumentView> views = new ArrayList<>(hits.size());
        for (SimilarDocument hit : hits) {
            Optional<DocumentRecord> document = documentStore.get(hit.key());
            if (document.isEmpty()) {
                log.warn("Indexed document {} is missing from the document store", hit.key());
                continue;
            }
            views.add(new SimilarDocumentView(hit.key(), document.get().title(), document.get().authors(),
                    document.get().primaryCategory(), hit.distance()));
        }
        return views;
    }
}
