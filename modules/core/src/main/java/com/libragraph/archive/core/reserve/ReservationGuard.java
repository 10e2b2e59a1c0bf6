package com.libragraph.archive.core.reserve;

import java.util.Optional;

/**
 * Tells whether a file is reserved on a node, i.e. must be kept there.
 */
public interface ReservationGuard {

    /** Name of the first reservation holding the file on the node, if any. */
    Optional<String> reservation(long fileId, long nodeId);

    default boolean isReserved(long fileId, long nodeId) {
        return reservation(fileId, nodeId).isPresent();
    }
}
