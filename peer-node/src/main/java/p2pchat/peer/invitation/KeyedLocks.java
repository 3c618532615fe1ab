package p2pchat.peer.invitation;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One {@link ReentrantLock} per key, created on first use and dropped once no thread
 * holds or waits for it.
 */
class KeyedLocks {

    private final Map<String, Entry> entries = new HashMap<>();

    /**
     * Block until the lock for the key is held. Release it by closing the handle.
     */
    Held acquire(String key) {
        Entry entry;
        synchronized (entries) {
            entry = entries.computeIfAbsent(key, k -> new Entry());
            entry.users++;
        }
        entry.lock.lock();
        return new Held(key, entry);
    }

    int size() {
        synchronized (entries) {
            return entries.size();
        }
    }

    private void release(String key, Entry entry) {
        entry.lock.unlock();
        synchronized (entries) {
            if (--entry.users == 0) {
                entries.remove(key);
            }
        }
    }

    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }

    final class Held implements AutoCloseable {

        private final String key;
        private final Entry entry;
        private boolean released;

        private Held(String key, Entry entry) {
            this.key = key;
            this.entry = entry;
        }

        @Override
        public void close() {
            if (!released) {
                released = true;
                release(key, entry);
            }
        }
    }
}
