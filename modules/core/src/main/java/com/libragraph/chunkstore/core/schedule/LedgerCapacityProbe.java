package com.libragraph.chunkstore.core.schedule;

import com.libragraph.chunkstore.core.dao.ChunkDao;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jdbi.v3.core.Jdbi;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Object stores report no capacity, so pressure is judged from the bytes the ledger
 * tracks against a configured quota. Without a quota there is never pressure.
 */
@ApplicationScoped
@IfBuildProperty(name = "chunkstore.object-store.type", stringValue = "s3")
public class LedgerCapacityProbe implements FreeSpaceProbe {

    private final Jdbi jdbi;
    private final Optional<Long> capacityBytes;

    @Inject
    public LedgerCapacityProbe(Jdbi jdbi,
                               @ConfigProperty(name = "chunkstore.object-store.s3.capacity-bytes")
                               Optional<Long> capacityBytes) {
        this.jdbi = jdbi;
        this.capacityBytes = capacityBytes.filter(c -> c > 0);
    }

    @Override
    public OptionalDouble freeSpacePercent() {
        if (capacityBytes.isEmpty()) {
            return OptionalDouble.empty();
        }
        long used = jdbi.withExtension(ChunkDao.class, ChunkDao::liveBytes);
        long capacity = capacityBytes.get();
        return OptionalDouble.of(Math.max(0.0, 100.0 * (capacity - used) / capacity));
    }
}
