package com.docindex.main.service;

import com.docindex.common.exception.PersistenceException;
import com.docindex.common.model.IdMapSnapshot;
import com.docindex.common.serialization.IdMapDeserializer;
import com.docindex.common.serialization.IdMapSerializer;
import com.docindex.main.config.IndexProperties;
import com.docindex.storage.index.VectorIndex;
import com.docindex.storage.index.VectorIndexCodec;
import com.docindex.storage.index.VectorIndexConfig;
import com.docindex.storage.index.VectorIndexFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Reads and writes the two index files: the vector snapshot and the id map.
 * Each file goes to a temporary sibling first and is then moved into place;
 * the vector snapshot is always written before the id map, so after a crash the
 * vectors may be ahead of the id map but never behind it.
 */
@Slf4j
@Component
public class IndexSnapshotStore {

    static final String VECTORS_FILE = "vectors.idx";
    static final String ID_MAP_FILE = "id-map.bin";
    private static final String TMP_SUFFIX = ".tmp";

    private final Path directory;
    private final VectorIndexFactory vectorIndexFactory;
    private final IdMapSerializer idMapSerializer = new IdMapSerializer();
    private final IdMapDeserializer idMapDeserializer = new IdMapDeserializer();

    public IndexSnapshotStore(IndexProperties properties, VectorIndexFactory vectorIndexFactory) {
        this.directory = Path.of(properties.getDirectory());
        this.vectorIndexFactory = vectorIndexFactory;
    }

    /** Index and id map read back together, already reconciled with each other */
    public record LoadedIndex(VectorIndex index, IdMapSnapshot idMap) {
    }

    public boolean exists() {
        return Files.exists(directory.resolve(VECTORS_FILE)) || Files.exists(directory.resolve(ID_MAP_FILE));
    }

    public void write(VectorIndex index, IdMapSnapshot idMap) {
        try {
            Files.createDirectories(directory);
            writeAtomically(directory.resolve(VECTORS_FILE), out -> VectorIndexCodec.write(index, out));
            byte[] idMapBytes = idMapSerializer.serialize(idMap);
            writeAtomically(directory.resolve(ID_MAP_FILE), out -> out.write(idMapBytes));
            log.info("Saved index snapshot to {}: {} vectors, {} keys, nextId={}",
                    directory, index.size(), idMap.keysById().size(), idMap.nextId());
        } catch (IOException e) {
            throw new PersistenceException("Failed to save index snapshot to " + directory, e);
        }
    }

    /**
     * Read the persisted index.
     *
     * @return empty when nothing has been persisted yet
     * @throws PersistenceException when the files exist but cannot be read
     */
    public Optional<LoadedIndex> read(VectorIndexConfig config) {
        Path vectorsPath = directory.resolve(VECTORS_FILE);
        Path idMapPath = directory.resolve(ID_MAP_FILE);
        if (!Files.exists(vectorsPath)) {
            if (Files.exists(idMapPath)) {
                throw new PersistenceException("Id map found without vector snapshot in " + directory);
            }
            return Optional.empty();
        }

        VectorIndex index;
        try (InputStream in = new BufferedInputStream(Files.newInputStream(vectorsPath))) {
            index = vectorIndexFactory.read(in, config);
        } catch (IOException e) {
            throw new PersistenceException("Failed to read vector snapshot " + vectorsPath, e);
        }

        IdMapSnapshot idMap;
        if (Files.exists(idMapPath)) {
            try {
                idMap = idMapDeserializer.deserialize(Files.readAllBytes(idMapPath));
            } catch (IOException | IllegalArgumentException e) {
                throw new PersistenceException("Failed to read id map " + idMapPath, e);
            }
        } else {
            log.warn("Vector snapshot present without id map in {}, starting from an empty id map", directory);
            idMap = IdMapSnapshot.empty();
        }

        if (index.dimension() != config.dimension()) {
            throw new PersistenceException(String.format(
                "Persisted index dimension %d does not match embedding dimension %d",
                index.dimension(), config.dimension()));
        }
        if (index.variant() != config.variant()) {
            log.warn("Persisted index variant {} differs from configured {}, keeping the persisted one",
                    index.variant(), config.variant());
        }

        return Optional.of(new LoadedIndex(index, reconcile(index, idMap)));
    }

    private IdMapSnapshot reconcile(VectorIndex index, IdMapSnapshot idMap) {
        Set<Long> vectorIds = index.ids();
        long nextId = idMap.nextId();

        for (Long id : vectorIds) {
            if (!idMap.keysById().containsKey(id)) {
                log.warn("Pruning orphan vector {} without id map entry", id);
                index.remove(id);
                nextId = Math.max(nextId, id + 1);
            }
        }

        Map<Long, String> keysById = new LinkedHashMap<>();
        idMap.keysById().forEach((id, key) -> {
            if (vectorIds.contains(id)) {
                keysById.put(id, key);
            } else {
                log.warn("Dropping id map entry {} -> {} without vector", id, key);
            }
        });
        return new IdMapSnapshot(nextId, keysById);
    }

    private void writeAtomically(Path target, SnapshotWriter writer) throws IOException {
        Path tmp = target.resolveSibling(target.getFileName() + TMP_SUFFIX);
        try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(tmp))) {
            writer.write(out);
        }
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, replacing non-atomically", target);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @FunctionalInterface
    private interface SnapshotWriter {
        void write(OutputStream out) throws IOException;
    }
}
