package com.docindex.storage.index;

import com.github.jelmerk.knn.Item;

/** Элемент hnswlib: внутренний id и вектор */
public class VectorItem implements Item<Long, float[]> {

    private static final long serialVersionUID = 1L;

    private final long id;
    private final float[] vector;

    VectorItem(long id, float[] vector) {
        this.id = id;
        this.vector = vector;
    }

    @Override
    public Long id() {
        return id;
    }

    @Override
    public float[] vector() {
        return vector;
    }

    @Override
    public int dimensions() {
        return vector.length;
    }
}
