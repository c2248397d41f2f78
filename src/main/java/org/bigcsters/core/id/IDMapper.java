package org.bigcsters.core.id;

import lombok.experimental.StandardException;

import java.util.List;

/**
 * Bidirectional mapping between participant ids (emails) and dense internal indices.
 *
 * <p>Internal indices follow the order in which participants were supplied, so every
 * index-ordered tie-break in the matching strategies is reproducible from input order.</p>
 */
public interface IDMapper {

    /**
     * Converts a participant id to its internal index.
     * @param externalId participant id (email).
     * @return internal index.
     * @throws UnknownIDException if the id is not mapped.
     */
    int toInternal(String externalId) throws UnknownIDException;

    /**
     * Converts an internal index back to its participant id.
     * @param internalId internal index.
     * @return participant id.
     * @throws IndexOutOfBoundsException if the index is invalid.
     */
    String toExternal(int internalId);

    /**
     * @param externalId participant id to test.
     * @return true when the id is mapped.
     */
    boolean containsExternal(String externalId);

    /**
     * @param internalId internal index to test.
     * @return true when the index is within mapper bounds.
     */
    boolean containsInternal(int internalId);

    /**
     * @return number of mapped participants.
     */
    int size();

    /**
     * Thrown when a participant id cannot be found in the mapping.
     */
    @StandardException
    class UnknownIDException extends RuntimeException {
    }

    /**
     * Thrown when the same participant id is supplied twice.
     */
    @StandardException
    class DuplicateIDException extends RuntimeException {
    }

    /**
     * Creates the default immutable implementation.
     *
     * @param orderedIds participant ids; position becomes the internal index.
     * @return immutable mapper.
     */
    static IDMapper createImmutable(List<String> orderedIds) {
        return new FastUtilIDMapper(orderedIds);
    }
}
