package com.docindex.common.serialization;

import com.docindex.common.model.IdMapSnapshot;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Бинарный сериализатор карты идентификаторов.
 * Формат:
 * [magic "DIMP" (4 байта)] [версия формата (1 байт)]
 * [nextId (varint)] [количество записей (varint)]
 * Для каждой записи:
 *   [внутренний id (varint)] [длина ключа (varint)] [ключ UTF-8]
 * Обратное отображение ключ -> id восстанавливается из прямого.
 */
public class IdMapSerializer {

    static final byte[] MAGIC = {'D', 'I', 'M', 'P'};
    static final byte FORMAT_VERSION = 1;

    public byte[] serialize(IdMapSnapshot snapshot) {
        if (snapshot == null) {
            throw new IllegalArgumentException("Snapshot cannot be null");
        }

        int totalSize = calculateSize(snapshot);
        ByteBuffer buffer = ByteBuffer.allocate(totalSize);

        buffer.put(MAGIC);
        buffer.put(FORMAT_VERSION);
        writeVarint(buffer, snapshot.nextId());
        writeVarint(buffer, snapshot.keysById().size());

        for (Map.Entry<Long, String> entry : snapshot.keysById().entrySet()) {
            writeVarint(buffer, entry.getKey());
            writeString(buffer, entry.getValue());
        }

        return buffer.array();
    }

    private void writeString(ByteBuffer buffer, String value) {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        writeVarint(buffer, bytes.length);
        buffer.put(bytes);
    }

    void writeVarint(ByteBuffer buffer, long value) {
        while ((value & ~0x7FL) != 0) {
            buffer.put((byte) ((value & 0x7F) | 0x80));
            value >>>= 7;
        }
        buffer.put((byte) (value & 0x7F));
    }

    int calculateSize(IdMapSnapshot snapshot) {
        int size = MAGIC.length + 1;
        size += varintSize(snapshot.nextId());
        size += varintSize(snapshot.keysById().size());

        for (Map.Entry<Long, String> entry : snapshot.keysById().entrySet()) {
            size += varintSize(entry.getKey());
            byte[] keyBytes = entry.getValue().getBytes(StandardCharsets.UTF_8);
            size += varintSize(keyBytes.length);
            size += keyBytes.length;
        }

        return size;
    }

    private int varintSize(long value) {
        int size = 0;
        while ((value & ~0x7FL) != 0) {
            size++;
            value >>>= 7;
        }
        return size + 1;
    }
}
