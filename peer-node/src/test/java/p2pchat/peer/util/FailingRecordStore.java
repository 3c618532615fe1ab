package p2pchat.peer.util;

import com.fasterxml.jackson.databind.JsonNode;
import p2pchat.common.exception.StorageException;
import p2pchat.peer.store.InMemoryRecordStore;
import p2pchat.peer.store.RecordStore;

import java.util.List;
import java.util.Optional;

/**
 * In-memory record store whose writes to one collection can be made to fail after a
 * number of successful ones.
 */
public class FailingRecordStore implements RecordStore {

    private final RecordStore delegate = new InMemoryRecordStore();
    private String failingCollection;
    private int writesBeforeFailure;
    private Exception failure;

    /**
     * Let {@code successfulWrites} more writes to the collection through, then fail every
     * further one with the given exception.
     */
    public synchronized void failWrites(String collection, int successfulWrites, Exception failure) {
        this.failingCollection = collection;
        this.writesBeforeFailure = successfulWrites;
        this.failure = failure;
    }

    public synchronized void heal() {
        this.failingCollection = null;
    }

    private synchronized void beforeWrite(String collection) throws StorageException {
        if (!collection.equals(failingCollection)) {
            return;
        }
        if (writesBeforeFailure > 0) {
            writesBeforeFailure--;
            return;
        }
        if (failure instanceof StorageException) {
            throw (StorageException) failure;
        }
        throw (RuntimeException) failure;
    }

    @Override
    public void put(String collection, String id, JsonNode document) throws StorageException {
        beforeWrite(collection);
        delegate.put(collection, id, document);
    }

    @Override
    public boolean putIfAbsent(String collection, String id, JsonNode document) throws StorageException {
        beforeWrite(collection);
        return delegate.putIfAbsent(collection, id, document);
    }

    @Override
    public Optional<JsonNode> get(String collection, String id) throws StorageException {
        return delegate.get(collection, id);
    }

    @Override
    public boolean contains(String collection, String id) throws StorageException {
        return delegate.contains(collection, id);
    }

    @Override
    public boolean remove(String collection, String id) throws StorageException {
        beforeWrite(collection);
        return delegate.remove(collection, id);
    }

    @Override
    public List<JsonNode> values(String collection) throws StorageException {
        return delegate.values(collection);
    }
}
