package com.docindex.common.serialization;

import com.docindex.common.model.IdMapSnapshot;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

public class IdMapDeserializer {

    public IdMapSnapshot deserialize(byte[] data) {
        if (data == null) {
            throw new IllegalArgumentException("Data cannot be null");
        }

        ByteBuffer buffer = ByteBuffer.wrap(data);
        try {
            byte[] magic = new byte[IdMapSerializer.MAGIC.length];
            buffer.get(magic);
            if (!Arrays.equals(magic, IdMapSerializer.MAGIC)) {
                throw new IllegalArgumentException("Not an id map snapshot");
            }
            byte version = buffer.get();
            if (version != IdMapSerializer.FORMAT_VERSION) {
                throw new IllegalArgumentException("Unsupported id map format version: " + version);
            }

            long nextId = readVarint(buffer);
            int size = (int) readVarint(buffer);
            if (size < 0 || size > buffer.remaining()) {
                throw new IllegalArgumentException("Corrupt id map: bad entry count " + size);
            }

            Map<Long, String> keysById = new LinkedHashMap<>(size * 2);
            Set<String> seenKeys = new HashSet<>(size * 2);
            for (int i = 0; i < size; i++) {
                long id = readVarint(buffer);
                String key = readString(buffer);
                if (id <= 0 || keysById.containsKey(id) || !seenKeys.add(key)) {
                    throw new IllegalArgumentException("Corrupt id map: duplicate or invalid entry " + id + " -> " + key);
                }
                keysById.put(id, key);
            }

            if (buffer.hasRemaining()) {
                throw new IllegalArgumentException("Corrupt id map: " + buffer.remaining() + " trailing bytes");
            }
            return new IdMapSnapshot(nextId, keysById);
        } catch (BufferUnderflowException e) {
            throw new IllegalArgumentException("Corrupt id map: unexpected end of data", e);
        }
    }

    private String readString(ByteBuffer buffer) {
        int length = (int) readVarint(buffer);
        if (length < 0 || length > buffer.remaining()) {
            throw new IllegalArgumentException("Corrupt id map: bad key length " + length);
        }
        byte[] bytes = new byte[length];
        buffer.get(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    long readVarint(ByteBuffer buffer) {
        long result = 0;
        int shift = 0;
        byte b;

        do {
            if (shift >= 64) {
                throw new IllegalStateException("Varint too long");
            }
            b = buffer.get();
            result |= (long) (b & 0x7F) << shift;
            shift += 7;
        } while ((b & 0x80) != 0);

        return result;
    }
}
