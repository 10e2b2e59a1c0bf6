package com.libragraph.archive.core.reserve;

import com.libragraph.archive.core.dao.StorageNodeRecord;
import com.libragraph.archive.core.storage.CopyRequest;
import com.libragraph.archive.core.storage.FileCopy;
import com.libragraph.archive.core.storage.NodeIO;
import com.libragraph.archive.core.store.RecordStore;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link NodeIO} for a node that only holds reserved files.
 *
 * <ul>
 *   <li>Reserved copies are never deleted: they are dropped from the batch and
 *       flagged as wanted again.</li>
 *   <li>A pull onto the node is cancelled unless the file is already reserved here.</li>
 * </ul>
 * Everything else passes through to the wrapped node I/O.
 */
public class ReservingNodeIO implements NodeIO {

    private static final Logger log = Logger.getLogger(ReservingNodeIO.class);

    private final NodeIO delegate;
    private final ReservationGuard guard;
    private final RecordStore store;

    public ReservingNodeIO(NodeIO delegate, ReservationGuard guard, RecordStore store) {
        this.delegate = delegate;
        this.guard = guard;
        this.store = store;
    }

    @Override
    public StorageNodeRecord node() {
        return delegate.node();
    }

    @Override
    public InputStream open(String path) throws IOException {
        return delegate.open(path);
    }

    @Override
    public void delete(List<FileCopy> copies) {
        long nodeId = node().id();
        List<FileCopy> allowed = new ArrayList<>(copies.size());
        for (FileCopy copy : copies) {
            Optional<String> holder = guard.reservation(copy.fileId(), nodeId);
            if (holder.isEmpty()) {
                allowed.add(copy);
                continue;
            }
            log.warnf("Cancelling deletion of %s: file reserved by: %s", copy.path(), holder.get());
            store.markCopyWanted(copy.copyId());
        }
        delegate.delete(allowed);
    }

    @Override
    public void pull(CopyRequest request) {
        if (!guard.isReserved(request.fileId(), node().id())) {
            log.warnf("Cancelling pull of %s onto %s: not reserved.", request.path(), node().name());
            store.cancelRequest(request.requestId());
            return;
        }
        delegate.pull(request);
    }
}
