package com.libragraph.archive.app;

import com.libragraph.archive.core.dao.StorageNodeDao;
import com.libragraph.archive.core.dao.StorageNodeRecord;
import com.libragraph.archive.core.reserve.ReservationGuard;
import com.libragraph.archive.core.reserve.ReservingNodeIO;
import com.libragraph.archive.core.storage.FilesystemNodeIO;
import com.libragraph.archive.core.storage.NodeIO;
import com.libragraph.archive.core.store.RecordStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;

import java.util.Optional;

/**
 * Registers the local storage node from {@code archive.node.*} and provides its {@link NodeIO}.
 * A reserving node gets its I/O wrapped so unreserved files are never kept there.
 */
@ApplicationScoped
public class NodeIOProducer {

    private static final Logger log = Logger.getLogger(NodeIOProducer.class);

    @Inject
    Jdbi jdbi;

    @Inject
    RecordStore store;

    @Inject
    ReservationGuard guard;

    @ConfigProperty(name = "archive.node.name")
    String nodeName;

    @ConfigProperty(name = "archive.node.root")
    String nodeRoot;

    @ConfigProperty(name = "archive.reservation.enabled", defaultValue = "false")
    boolean reserving;

    @Produces
    @Singleton
    NodeIO nodeIO() {
        StorageNodeRecord node = registerNode(jdbi, nodeName, nodeRoot, reserving);
        return wrap(node, new FilesystemNodeIO(node, store), guard, store);
    }

    static NodeIO wrap(StorageNodeRecord node, NodeIO io, ReservationGuard guard, RecordStore store) {
        if (!node.reserving()) {
            return io;
        }
        log.infof("Node %s is reserving: only reserved files are kept", node.name());
        return new ReservingNodeIO(io, guard, store);
    }

    /**
     * Finds the node by name, updating its root and reserving flag to match the
     * configuration, or inserts it.
     */
    static StorageNodeRecord registerNode(Jdbi jdbi, String name, String root, boolean reserving) {
        return jdbi.inTransaction(h -> {
            StorageNodeDao dao = h.attach(StorageNodeDao.class);
            Optional<StorageNodeRecord> existing = dao.findByName(name);
            if (existing.isEmpty()) {
                long id = dao.insert(name, root, reserving);
                log.infof("Registered storage node %s (id %d) at %s", name, id, root);
                return dao.findById(id).orElseThrow();
            }
            StorageNodeRecord node = existing.get();
            if (!node.root().equals(root) || node.reserving() != reserving) {
                log.warnf("Storage node %s changed: root %s -> %s, reserving %s -> %s",
                        name, node.root(), root, node.reserving(), reserving);
                dao.update(node.id(), root, reserving);
                return dao.findById(node.id()).orElseThrow();
            }
            return node;
        });
    }
}
