package com.libragraph.chunkstore.core.coordination;

import com.libragraph.chunkstore.core.config.GcSettings;
import com.libragraph.chunkstore.core.dao.CollectorLockDao;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Database-backed {@link CollectorLock}: one row per lock key, changed only by
 * conditional single-statement updates.
 */
@ApplicationScoped
public class JdbiCollectorLock implements CollectorLock {

    private static final Logger log = Logger.getLogger(JdbiCollectorLock.class);

    private final Jdbi jdbi;
    private final Clock clock;
    private final String key;

    @Inject
    public JdbiCollectorLock(Jdbi jdbi, Clock clock, GcSettings settings) {
        this.jdbi = jdbi;
        this.clock = clock;
        this.key = settings.lockKey();
    }

    @Override
    public Optional<CollectorLease> tryAcquire(String holder, Duration ttl) {
        Instant now = clock.instant();
        Instant expiresAt = now.plus(ttl);
        String token = UUID.randomUUID().toString();
        int updated = jdbi.withExtension(CollectorLockDao.class, dao -> {
            dao.ensure(key);
            return dao.tryAcquire(key, holder, token, now, expiresAt);
        });
        if (updated == 0) {
            log.debugf("Lock %s busy, %s not acquired", key, holder);
            return Optional.empty();
        }
        log.infof("Lock %s acquired by %s until %s", key, holder, expiresAt);
        return Optional.of(new CollectorLease(key, holder, token, now, expiresAt));
    }

    @Override
    public boolean renew(CollectorLease lease, Duration ttl) {
        Instant now = clock.instant();
        boolean renewed = jdbi.withExtension(CollectorLockDao.class,
                dao -> dao.renew(lease.key(), lease.token(), now, now.plus(ttl))) > 0;
        if (!renewed) {
            log.warnf("Lock %s lease of %s could not be renewed", lease.key(), lease.holder());
        }
        return renewed;
    }

    @Override
    public boolean release(CollectorLease lease) {
        boolean released = jdbi.withExtension(CollectorLockDao.class,
                dao -> dao.release(lease.key(), lease.token())) > 0;
        if (released) {
            log.infof("Lock %s released by %s", lease.key(), lease.holder());
        } else {
            log.warnf("Lock %s was no longer held by %s at release", lease.key(), lease.holder());
        }
        return released;
    }

    @Override
    public Optional<String> currentHolder() {
        Instant now = clock.instant();
        return jdbi.withExtension(CollectorLockDao.class, dao -> dao.find(key))
                .filter(row -> row.token() != null && row.expiresAt() != null && row.expiresAt().isAfter(now))
                .map(row -> row.holder());
    }
}
