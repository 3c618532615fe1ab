package p2pchat.peer.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import p2pchat.common.exception.StorageException;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Record store that keeps each collection in its own JSON file under a base directory.
 * A collection file holds one object mapping record ids to documents. Every write
 * rewrites the file through a temporary file and a move, before the call returns.
 */
public class JsonFileRecordStore implements RecordStore {

    private static final Pattern COLLECTION_NAME = Pattern.compile("[a-z][a-z0-9_]*");

    private final Path baseDirectory;
    private final ObjectMapper mapper;
    private final Map<String, ObjectNode> loaded = new ConcurrentHashMap<>();

    public JsonFileRecordStore(Path baseDirectory) throws StorageException {
        this(baseDirectory, JsonSupport.newObjectMapper());
    }

    public JsonFileRecordStore(Path baseDirectory, ObjectMapper mapper) throws StorageException {
        this.baseDirectory = baseDirectory;
        this.mapper = mapper;
        try {
            Files.createDirectories(baseDirectory);
        } catch (IOException e) {
            throw new StorageException("Cannot create data directory " + baseDirectory, e);
        }
    }

    @Override
    public void put(String collection, String id, JsonNode document) throws StorageException {
        ObjectNode records = load(collection);
        synchronized (records) {
            ObjectNode updated = records.deepCopy();
            updated.set(id, document.deepCopy());
            commit(collection, records, updated);
        }
    }

    @Override
    public boolean putIfAbsent(String collection, String id, JsonNode document) throws StorageException {
        ObjectNode records = load(collection);
        synchronized (records) {
            if (records.has(id)) {
                return false;
            }
            ObjectNode updated = records.deepCopy();
            updated.set(id, document.deepCopy());
            commit(collection, records, updated);
            return true;
        }
    }

    @Override
    public Optional<JsonNode> get(String collection, String id) throws StorageException {
        ObjectNode records = load(collection);
        synchronized (records) {
            JsonNode node = records.get(id);
            return node != null ? Optional.of(node.deepCopy()) : Optional.empty();
        }
    }

    @Override
    public boolean contains(String collection, String id) throws StorageException {
        ObjectNode records = load(collection);
        synchronized (records) {
            return records.has(id);
        }
    }

    @Override
    public boolean remove(String collection, String id) throws StorageException {
        ObjectNode records = load(collection);
        synchronized (records) {
            if (!records.has(id)) {
                return false;
            }
            ObjectNode updated = records.deepCopy();
            updated.remove(id);
            commit(collection, records, updated);
            return true;
        }
    }

    @Override
    public List<JsonNode> values(String collection) throws StorageException {
        ObjectNode records = load(collection);
        synchronized (records) {
            List<JsonNode> snapshot = new ArrayList<>(records.size());
            Iterator<JsonNode> it = records.elements();
            while (it.hasNext()) {
                snapshot.add(it.next().deepCopy());
            }
            return snapshot;
        }
    }

    private ObjectNode load(String collection) throws StorageException {
        if (!COLLECTION_NAME.matcher(collection).matches()) {
            throw new IllegalArgumentException("Invalid collection name: " + collection);
        }
        ObjectNode records = loaded.get(collection);
        if (records != null) {
            return records;
        }
        synchronized (loaded) {
            records = loaded.get(collection);
            if (records == null) {
                records = read(collection);
                loaded.put(collection, records);
            }
            return records;
        }
    }

    private ObjectNode read(String collection) throws StorageException {
        Path file = fileFor(collection);
        if (!Files.exists(file)) {
            return mapper.createObjectNode();
        }
        try {
            JsonNode root = mapper.readTree(file.toFile());
            if (root == null || root.isMissingNode()) {
                return mapper.createObjectNode();
            }
            if (!root.isObject()) {
                throw new StorageException("Collection file " + file + " is not a JSON object", null);
            }
            return (ObjectNode) root;
        } catch (IOException e) {
            throw new StorageException("Cannot read collection " + collection + " from " + file, e);
        }
    }

    /**
     * Writes the updated collection to disk and only then makes it visible in memory,
     * so a failed write leaves both views unchanged.
     */
    private void commit(String collection, ObjectNode current, ObjectNode updated) throws StorageException {
        flush(collection, updated);
        current.removeAll();
        current.setAll(updated);
    }

    private void flush(String collection, ObjectNode records) throws StorageException {
        Path file = fileFor(collection);
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), records);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            System.err.println("[RecordStore] Failed to write " + file + ": " + e.getMessage());
            throw new StorageException("Cannot write collection " + collection + " to " + file, e);
        }
    }

    private Path fileFor(String collection) {
        return baseDirectory.resolve(collection + ".json");
    }
}
