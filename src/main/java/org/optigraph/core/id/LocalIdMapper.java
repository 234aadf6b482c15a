package org.optigraph.core.id;

import lombok.experimental.StandardException;

import java.util.List;

/**
 * Bidirectional mapping between graph-level keys and the dense integer ids of one
 * backend's local index space.
 *
 * @param <K> graph-level key type.
 */
public interface LocalIdMapper<K> {

    /**
     * Converts a graph-level key to its backend-local id.
     * @param graphKey the graph-level key.
     * @return the local id.
     * @throws UnknownIDException If the key was never mapped.
     */
    int toLocal(K graphKey) throws UnknownIDException;

    /**
     * Converts a backend-local id back to its graph-level key.
     * @param localId the local id.
     * @return the graph-level key.
     * @throws UnknownIDException If the local id was never mapped.
     */
    K toGraph(int localId);

    /**
     * Checks whether a graph-level key has a local id.
     *
     * @param graphKey key to test.
     * @return true when the key is mapped.
     */
    boolean containsGraph(K graphKey);

    /**
     * Checks whether a local id is mapped.
     *
     * @param localId local id to test.
     * @return true when the id is mapped.
     */
    boolean containsLocal(int localId);

    /**
     * Adds one mapping. Both sides must be previously unmapped.
     *
     * @param graphKey graph-level key.
     * @param localId backend-local id.
     */
    void put(K graphKey, int localId);

    /**
     * Returns the mapped graph-level keys in insertion order.
     */
    List<K> graphKeys();

    /**
     * Returns number of mapped pairs.
     *
     * @return total mapping size.
     */
    int size();

    /**
     * Exception thrown when a key or local id cannot be found in the mapping.
     */
    @StandardException
    class UnknownIDException extends RuntimeException {
    }

    /**
     * Factory method for the default append-only implementation.
     *
     * @return an empty mapper.
     */
    static <K> LocalIdMapper<K> createAppendOnly() {
        return new FastUtilLocalIdMapper<>();
    }
}
