package com.docindex.main.service;

import com.docindex.common.model.DocumentRecord;
import org.springframework.stereotype.Component;

import java.util.Optional;

/** Embeds the document abstract */
@Component
public class AbstractTextSource implements DocumentTextSource {

    @Override
    public Optional<String> textOf(DocumentRecord document) {
        return Optional.ofNullable(document.abstractText())
                .map(String::strip)
                .filter(text -> !text.isEmpty());
    }
}
