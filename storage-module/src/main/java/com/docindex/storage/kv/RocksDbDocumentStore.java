package com.docindex.storage.kv;

import com.docindex.common.exception.PersistenceException;
import com.docindex.common.model.DocumentRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.DBOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteBatch;
import org.rocksdb.WriteOptions;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
@Slf4j
public class RocksDbDocumentStore implements DocumentStore {
    private static final String DOCUMENTS_CF = "documents";   // Метаданные документов
    private static final String UNINDEXED_CF = "unindexed";   // Ключи документов вне индекса
    private static final byte[] EMPTY = new byte[0];

    @Value("${doc-index.storage.data-path:./data/documents}")
    private String dataPath;

    private RocksDB rocksDB;
    private DBOptions dbOptions;
    private final Map<String, ColumnFamilyHandle> columnFamilyHandles = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());

    @PostConstruct
    public void initialize() {
        RocksDB.loadLibrary();

        try {
            Path dbPath = Paths.get(dataPath);
            dbPath.toFile().mkdirs();

            List<ColumnFamilyDescriptor> columnFamilyDescriptors = Arrays.asList(
                new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY),
                new ColumnFamilyDescriptor(DOCUMENTS_CF.getBytes(StandardCharsets.UTF_8)),
                new ColumnFamilyDescriptor(UNINDEXED_CF.getBytes(StandardCharsets.UTF_8))
            );

            List<ColumnFamilyHandle> handles = new ArrayList<>();

            dbOptions = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true);

            rocksDB = RocksDB.open(dbOptions, dbPath.toString(), columnFamilyDescriptors, handles);

            columnFamilyHandles.put("default", handles.get(0));
            columnFamilyHandles.put(DOCUMENTS_CF, handles.get(1));
            columnFamilyHandles.put(UNINDEXED_CF, handles.get(2));

            log.info("RocksDB document store initialized at path: {}", dbPath);

        } catch (RocksDBException e) {
            log.error("Failed to initialize RocksDB", e);
            throw new PersistenceException("Failed to initialize document store", e);
        }
    }

    @Override
    public void put(DocumentRecord document) {
        byte[] key = encodeKey(document.key());
        try (WriteBatch batch = new WriteBatch(); WriteOptions options = new WriteOptions()) {
            batch.put(documents(), key, objectMapper.writeValueAsBytes(document));
            if (document.indexed()) {
                batch.delete(unindexed(), key);
            } else {
                batch.put(unindexed(), key, EMPTY);
            }
            rocksDB.write(options, batch);
        } catch (RocksDBException | IOException e) {
            throw new PersistenceException("Failed to store document " + document.key(), e);
        }
    }

    @Override
    public Optional<DocumentRecord> get(String key) {
        try {
            byte[] value = rocksDB.get(documents(), encodeKey(key));
            if (value == null) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(value, DocumentRecord.class));
        } catch (RocksDBException | IOException e) {
            throw new PersistenceException("Failed to read document " + key, e);
        }
    }

    @Override
    public boolean delete(String key) {
        byte[] encoded = encodeKey(key);
        try (WriteBatch batch = new WriteBatch(); WriteOptions options = new WriteOptions()) {
            if (rocksDB.get(documents(), encoded) == null) {
                return false;
            }
            batch.delete(documents(), encoded);
            batch.delete(unindexed(), encoded);
            rocksDB.write(options, batch);
            return true;
        } catch (RocksDBException e) {
            throw new PersistenceException("Failed to delete document " + key, e);
        }
    }

    @Override
    public List<DocumentRecord> listUnindexed(int limit) {
        List<DocumentRecord> result = new ArrayList<>();
        try (RocksIterator iterator = rocksDB.newIterator(unindexed())) {
            iterator.seekToFirst();

            while (iterator.isValid() && result.size() < limit) {
                byte[] value = rocksDB.get(documents(), iterator.key());
                if (value == null) {
                    log.warn("Unindexed marker without document: {}", decodeKey(iterator.key()));
                } else {
                    result.add(objectMapper.readValue(value, DocumentRecord.class));
                }
                iterator.next();
            }
        } catch (RocksDBException | IOException e) {
            throw new PersistenceException("Failed to list unindexed documents", e);
        }
        return result;
    }

    @Override
    public List<DocumentRecord> listIndexed() {
        List<DocumentRecord> result = new ArrayList<>();
        try (RocksIterator iterator = rocksDB.newIterator(documents())) {
            iterator.seekToFirst();

            while (iterator.isValid()) {
                DocumentRecord document = objectMapper.readValue(iterator.value(), DocumentRecord.class);
                if (document.indexed()) {
                    result.add(document);
                }
                iterator.next();
            }
        } catch (IOException e) {
            throw new PersistenceException("Failed to list indexed documents", e);
        }
        return result;
    }

    @Override
    public List<DocumentRecord> list(int limit) {
        List<DocumentRecord> result = new ArrayList<>();
        try (RocksIterator iterator = rocksDB.newIterator(documents())) {
            iterator.seekToFirst();

            while (iterator.isValid() && result.size() < limit) {
                result.add(objectMapper.readValue(iterator.value(), DocumentRecord.class));
                iterator.next();
            }
        } catch (IOException e) {
            throw new PersistenceException("Failed to list documents", e);
        }
        return result;
    }

    @Override
    public boolean markIndexed(String key, boolean indexed) {
        Optional<DocumentRecord> existing = get(key);
        if (existing.isEmpty()) {
            log.debug("Cannot mark unknown document {} as indexed={}", key, indexed);
            return false;
        }
        if (existing.get().indexed() != indexed) {
            put(existing.get().withIndexed(indexed));
        }
        return true;
    }

    @PreDestroy
    public void cleanup() {
        if (rocksDB != null) {
            columnFamilyHandles.values().forEach(ColumnFamilyHandle::close);
            columnFamilyHandles.clear();
            rocksDB.close();
            rocksDB = null;
            dbOptions.close();
            log.info("RocksDB closed successfully");
        }
    }

    private ColumnFamilyHandle documents() {
        return columnFamilyHandles.get(DOCUMENTS_CF);
    }

    private ColumnFamilyHandle unindexed() {
        return columnFamilyHandles.get(UNINDEXED_CF);
    }

    private static byte[] encodeKey(String key) {
        return key.getBytes(StandardCharsets.UTF_8);
    }

    private static String decodeKey(byte[] key) {
        return new String(key, StandardCharsets.UTF_8);
    }
}
