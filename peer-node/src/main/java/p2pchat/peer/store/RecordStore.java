package p2pchat.peer.store;

import com.fasterxml.jackson.databind.JsonNode;
import p2pchat.common.exception.StorageException;

import java.util.List;
import java.util.Optional;

/**
 * Durable on-device key-value store of JSON documents grouped into named collections.
 * Every call completes its write before returning.
 */
public interface RecordStore {

    /**
     * Insert or replace a document.
     */
    void put(String collection, String id, JsonNode document) throws StorageException;

    /**
     * Insert a document only if no document with this id exists.
     *
     * @return true if inserted, false if the id was already taken
     */
    boolean putIfAbsent(String collection, String id, JsonNode document) throws StorageException;

    Optional<JsonNode> get(String collection, String id) throws StorageException;

    boolean contains(String collection, String id) throws StorageException;

    /**
     * Remove a document.
     *
     * @return true if a document was removed
     */
    boolean remove(String collection, String id) throws StorageException;

    /**
     * Snapshot of every document in a collection.
     */
    List<JsonNode> values(String collection) throws StorageException;
}
