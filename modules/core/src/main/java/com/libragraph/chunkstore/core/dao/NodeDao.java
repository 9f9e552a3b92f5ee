package com.libragraph.chunkstore.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@RegisterConstructorMapper(NodeRecord.class)
public interface NodeDao {

    @SqlUpdate("INSERT INTO node (hostname, last_seen) VALUES (:hostname, :now) ON CONFLICT DO NOTHING")
    void insertIfAbsent(@Bind("hostname") String hostname, @Bind("now") Instant now);

    @SqlQuery("SELECT id, hostname, last_seen FROM node WHERE hostname = :hostname")
    Optional<NodeRecord> findByHostname(@Bind("hostname") String hostname);

    @SqlQuery("SELECT id, hostname, last_seen FROM node ORDER BY id")
    List<NodeRecord> findAll();

    @SqlUpdate("UPDATE node SET last_seen = :now WHERE id = :id")
    void heartbeat(@Bind("id") int id, @Bind("now") Instant now);

    /**
     * Registers {@code hostname} if new and refreshes its heartbeat. Returns the node.
     */
    default NodeRecord upsert(String hostname, Instant now) {
        insertIfAbsent(hostname, now);
        NodeRecord node = findByHostname(hostname)
                .orElseThrow(() -> new IllegalStateException("Node row vanished: " + hostname));
        heartbeat(node.id(), now);
        return new NodeRecord(node.id(), node.hostname(), now);
    }
}
