package io.pricelake.financial.store;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Flat key/value blob store with prefix listing. Keys use {@code /} as separator.
 */
public interface ObjectStore {
    /** Keys starting with {@code prefix}, sorted. */
    List<String> listKeys(String prefix) throws IOException;

    /** Object content, or empty when the key does not exist. */
    Optional<byte[]> read(String key) throws IOException;

    /** Replaces the object atomically: readers see either the old or the new content. */
    void write(String key, byte[] data) throws IOException;

    boolean exists(String key) throws IOException;
}
