package io.pricelake.financial.store;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test store with per-key failure injection.
 */
public class InMemoryObjectStore implements ObjectStore {
    private final Map<String, byte[]> objects = new ConcurrentSkipListMap<>();
    private final Set<String> failingReads = ConcurrentHashMap.newKeySet();
    private final Set<String> failingWrites = ConcurrentHashMap.newKeySet();
    private final Map<String, Long> readDelays = new ConcurrentHashMap<>();
    public final AtomicInteger writes = new AtomicInteger();
    /** "read", "read-done" and "write" events in the order they happened. */
    public final List<String> events = new CopyOnWriteArrayList<>();

    public void failReadsOf(String key) { failingReads.add(key); }
    public void failWritesOf(String key) { failingWrites.add(key); }
    public void slowReadsOf(String key, long millis) { readDelays.put(key, millis); }
    public void heal() {
        failingReads.clear();
        failingWrites.clear();
        readDelays.clear();
    }

    public Map<String, byte[]> snapshot() { return Map.copyOf(objects); }

    @Override
    public List<String> listKeys(String prefix) {
        return objects.keySet().stream().filter(k -> k.startsWith(prefix)).toList();
    }

    @Override
    public Optional<byte[]> read(String key) throws IOException {
        events.add("read " + key);
        if (failingReads.contains(key)) throw new IOException("injected read failure for " + key);
        Long delay = readDelays.get(key);
        if (delay != null) {
            try {
                Thread.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("read of " + key + " interrupted");
            }
        }
        events.add("read-done " + key);
        return Optional.ofNullable(objects.get(key)).map(byte[]::clone);
    }

    @Override
    public void write(String key, byte[] data) throws IOException {
        if (failingWrites.contains(key)) throw new IOException("injected write failure for " + key);
        events.add("write " + key);
        writes.incrementAndGet();
        objects.put(key, data.clone());
    }

    @Override
    public boolean exists(String key) { return objects.containsKey(key); }
}
