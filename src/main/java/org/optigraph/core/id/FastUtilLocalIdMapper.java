package org.optigraph.core.id;

import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;

import java.util.Collections;
import java.util.List;

/**
 * Append-only {@link LocalIdMapper} backed by fastutil maps.
 * <p>
 * Mappings are never removed. Not thread-safe; callers serialize writes per backend.
 */
public class FastUtilLocalIdMapper<K> implements LocalIdMapper<K> {

    private static final int MISSING = Integer.MIN_VALUE;

    // graph key -> local id, avoids boxing on the remap path
    private final Object2IntOpenHashMap<K> forward;
    private final Int2ObjectOpenHashMap<K> reverse;
    private final ObjectArrayList<K> insertionOrder;

    public FastUtilLocalIdMapper() {
        this.forward = new Object2IntOpenHashMap<>();
        this.forward.defaultReturnValue(MISSING);
        this.reverse = new Int2ObjectOpenHashMap<>();
        this.insertionOrder = new ObjectArrayList<>();
    }

    @Override
    public int toLocal(K graphKey) throws UnknownIDException {
        if (graphKey == null) {
            throw new IllegalArgumentException("graphKey cannot be null");
        }
        int id = forward.getInt(graphKey);
        if (id == MISSING) {
            throw new UnknownIDException("Graph key not mapped: " + graphKey);
        }
        return id;
    }

    @Override
    public K toGraph(int localId) {
        K key = reverse.get(localId);
        if (key == null) {
            throw new UnknownIDException("Local id not mapped: " + localId);
        }
        return key;
    }

    @Override
    public boolean containsGraph(K graphKey) {
        return graphKey != null && forward.containsKey(graphKey);
    }

    @Override
    public boolean containsLocal(int localId) {
        return reverse.containsKey(localId);
    }

    @Override
    public void put(K graphKey, int localId) {
        if (graphKey == null) {
            throw new IllegalArgumentException("graphKey cannot be null");
        }
        if (localId == MISSING) {
            throw new IllegalArgumentException("Reserved local id: " + localId);
        }
        if (forward.containsKey(graphKey)) {
            throw new IllegalArgumentException("Duplicate graph key detected: " + graphKey);
        }
        if (reverse.containsKey(localId)) {
            throw new IllegalArgumentException("Duplicate local id detected: " + localId);
        }
        forward.put(graphKey, localId);
        reverse.put(localId, graphKey);
        insertionOrder.add(graphKey);
    }

    @Override
    public List<K> graphKeys() {
        return Collections.unmodifiableList(insertionOrder);
    }

    @Override
    public int size() {
        return insertionOrder.size();
    }
}
