package p2pchat.peer.store;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Volatile record store. Documents are copied on the way in and out.
 */
public class InMemoryRecordStore implements RecordStore {

    private final Map<String, ConcurrentMap<String, JsonNode>> collections = new ConcurrentHashMap<>();

    @Override
    public void put(String collection, String id, JsonNode document) {
        collection(collection).put(id, document.deepCopy());
    }

    @Override
    public boolean putIfAbsent(String collection, String id, JsonNode document) {
        return collection(collection).putIfAbsent(id, document.deepCopy()) == null;
    }

    @Override
    public Optional<JsonNode> get(String collection, String id) {
        JsonNode node = collection(collection).get(id);
        return node != null ? Optional.of(node.deepCopy()) : Optional.empty();
    }

    @Override
    public boolean contains(String collection, String id) {
        return collection(collection).containsKey(id);
    }

    @Override
    public boolean remove(String collection, String id) {
        return collection(collection).remove(id) != null;
    }

    @Override
    public List<JsonNode> values(String collection) {
        List<JsonNode> snapshot = new ArrayList<>();
        for (JsonNode node : collection(collection).values()) {
            snapshot.add(node.deepCopy());
        }
        return snapshot;
    }

    private ConcurrentMap<String, JsonNode> collection(String name) {
        return collections.computeIfAbsent(name, k -> new ConcurrentHashMap<>());
    }
}
