package com.docindex.storage.kv;

import com.docindex.common.model.DocumentRecord;

import java.util.List;
import java.util.Optional;

/**
 * Интерфейс хранилища метаданных документов.
 * Ошибки хранилища выбрасываются как {@link com.docindex.common.exception.PersistenceException}.
 */
public interface DocumentStore {

    /** Сохранить документ (замена по ключу) */
    void put(DocumentRecord document);

    /** Получить документ по ключу */
    Optional<DocumentRecord> get(String key);

    /** Удалить документ */
    boolean delete(String key);

    /** Документы, ещё не попавшие в индекс, в порядке ключей */
    List<DocumentRecord> listUnindexed(int limit);

    /** Все документы с флагом индексации, в порядке ключей */
    List<DocumentRecord> listIndexed();

    /** Все документы в порядке ключей */
    List<DocumentRecord> list(int limit);

    /**
     * Установить флаг индексации.
     *
     * @return false если документа с таким ключом нет
     */
    boolean markIndexed(String key, boolean indexed);
}
