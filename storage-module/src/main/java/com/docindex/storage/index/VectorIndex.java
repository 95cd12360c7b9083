package com.docindex.storage.index;

import java.io.DataOutput;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Интерфейс для операций с векторным индексом.
 * Позволяет использовать разные реализации (точный перебор, IVF, HNSW)
 * с единым API для менеджера индекса.
 * Реализации не потокобезопасны: синхронизацию обеспечивает вызывающая сторона.
 */
public interface VectorIndex {

    /**
     * Обучить индекс на выборке векторов. Повторный вызов после обучения ничего не делает.
     * @param sample обучающая выборка
     */
    void train(List<float[]> sample);

    /**
     * Добавить вектор в индекс
     * @param vector вектор для добавления
     * @param id внутренний идентификатор, уникальный в пределах индекса
     */
    void add(float[] vector, long id);

    /**
     * Удалить вектор из индекса
     * @param id внутренний идентификатор
     * @return true если вектор найден и удалён
     */
    boolean remove(long id);

    /**
     * Поиск k ближайших соседей
     * @param query вектор запроса
     * @param k количество соседей
     * @return не более min(k, size()) результатов по возрастанию L2 расстояния
     */
    List<Neighbor> search(float[] query, int k);

    /** Проверить наличие вектора с данным id */
    boolean contains(long id);

    /** Копия сохранённого вектора */
    Optional<float[]> vector(long id);

    /** Все внутренние идентификаторы индекса */
    Set<Long> ids();

    /** Количество векторов в индексе */
    int size();

    /** Размерность векторов */
    int dimension();

    /** Текущее состояние индекса */
    IndexState state();

    /**
     * Записать содержимое индекса (без заголовка формата)
     * @param out поток назначения
     */
    void save(DataOutput out) throws IOException;

    default IndexVariant variant() {
        return state().variant();
    }

    default boolean isTrained() {
        return state().trained();
    }
}
