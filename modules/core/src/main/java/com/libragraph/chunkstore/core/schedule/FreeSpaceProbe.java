package com.libragraph.chunkstore.core.schedule;

import java.util.OptionalDouble;

/**
 * Reports how much room the object store has left.
 */
@FunctionalInterface
public interface FreeSpaceProbe {

    /**
     * Free space as a percentage of capacity, or empty when it cannot be determined.
     */
    OptionalDouble freeSpacePercent();
}
