package io.pricelake.core;

/**
 * Unit of work for a single key. Keys handed to one stage are independent of each other.
 */
@FunctionalInterface
public interface KeyedOperation<K, R> {
    KeyResult<R> apply(K key) throws Exception;
}
