package org.bigcsters.core.id;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.List;

/**
 * {@link IDMapper} backed by a fastutil open hash map.
 *
 * <p>Immutable after construction and safe for concurrent readers.</p>
 */
public class FastUtilIDMapper implements IDMapper {

    private static final int MISSING = -1;

    // participant id -> index
    private final Object2IntOpenHashMap<String> forward;
    // index -> participant id
    private final String[] reverse;

    /**
     * Builds the mapper from an ordered id list.
     *
     * @param orderedIds participant ids; blank or duplicate ids are rejected.
     */
    public FastUtilIDMapper(List<String> orderedIds) {
        if (orderedIds == null) {
            throw new IllegalArgumentException("orderedIds cannot be null");
        }
        int size = orderedIds.size();
        this.forward = new Object2IntOpenHashMap<>(size);
        this.forward.defaultReturnValue(MISSING);
        this.reverse = new String[size];

        for (int i = 0; i < size; i++) {
            String id = orderedIds.get(i);
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("participant id at position " + i + " is blank");
            }
            int previous = forward.putIfAbsent(id, i);
            if (previous != MISSING) {
                throw new DuplicateIDException(
                        "Duplicate participant id " + id + " at positions " + previous + " and " + i
                );
            }
            reverse[i] = id;
        }
        this.forward.trim();
    }

    @Override
    public int toInternal(String externalId) throws UnknownIDException {
        int id = forward.getInt(externalId);
        if (id == MISSING) {
            throw new UnknownIDException("Participant id not found: " + externalId);
        }
        return id;
    }

    @Override
    public String toExternal(int internalId) {
        if (!containsInternal(internalId)) {
            throw new IndexOutOfBoundsException("Internal index out of bounds: " + internalId);
        }
        return reverse[internalId];
    }

    @Override
    public boolean containsExternal(String externalId) {
        return forward.containsKey(externalId);
    }

    @Override
    public boolean containsInternal(int internalId) {
        return internalId >= 0 && internalId < reverse.length;
    }

    @Override
    public int size() {
        return reverse.length;
    }
}
