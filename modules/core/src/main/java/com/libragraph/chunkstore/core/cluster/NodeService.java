package com.libragraph.chunkstore.core.cluster;

import com.libragraph.chunkstore.core.dao.NodeDao;
import com.libragraph.chunkstore.core.dao.NodeRecord;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Registers this process in the {@code node} table at boot and keeps its heartbeat fresh.
 * The registered identity names this node as collector lease holder and audit author.
 */
@ApplicationScoped
@Startup
public class NodeService {

    private static final Logger log = Logger.getLogger(NodeService.class);

    private final Jdbi jdbi;
    private final Clock clock;
    private final String hostname;
    private final Instant startedAt;
    private volatile NodeRecord node;

    @Inject
    public NodeService(Jdbi jdbi, Clock clock,
                       @ConfigProperty(name = "chunkstore.cluster.node-id") Optional<String> configuredHostname) {
        this(jdbi, clock, configuredHostname.orElseGet(NodeService::localHostname));
    }

    public NodeService(Jdbi jdbi, Clock clock, String hostname) {
        this.jdbi = jdbi;
        this.clock = clock;
        this.hostname = hostname;
        this.startedAt = clock.instant();
    }

    @PostConstruct
    void init() {
        register();
    }

    public NodeRecord register() {
        node = jdbi.withExtension(NodeDao.class, dao -> dao.upsert(hostname, clock.instant()));
        log.infof("Node registered: id=%d, hostname=%s", node.id(), hostname);
        return node;
    }

    public void heartbeat() {
        jdbi.useExtension(NodeDao.class, dao -> dao.heartbeat(registered().id(), clock.instant()));
    }

    /**
     * Lease holder identity: hostname plus the node's registry id.
     */
    public String holderId() {
        return registered().holderId();
    }

    /**
     * Every node that has ever registered, with its last heartbeat.
     */
    public List<NodeRecord> nodes() {
        return jdbi.withExtension(NodeDao.class, NodeDao::findAll);
    }

    public String hostname() {
        return hostname;
    }

    public Instant startedAt() {
        return startedAt;
    }

    private NodeRecord registered() {
        NodeRecord current = node;
        if (current == null) {
            throw new IllegalStateException("NodeService is not registered (hostname=" + hostname + ")");
        }
        return current;
    }

    private static String localHostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.warnf("Cannot resolve local hostname, using 'localhost': %s", e.getMessage());
            return "localhost";
        }
    }
}
