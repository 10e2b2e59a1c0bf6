package com.libragraph.archive.core.storage;

import com.libragraph.archive.core.dao.StorageNodeRecord;
import com.libragraph.archive.core.store.RecordStore;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * {@link NodeIO} for a node that is a directory on a local filesystem.
 *
 * <p>Layout: {@code {root}/{acquisition}/{file}}. Empty acquisition directories
 * are removed after their last file is deleted.
 */
public class FilesystemNodeIO implements NodeIO {

    private static final Logger log = Logger.getLogger(FilesystemNodeIO.class);

    private final StorageNodeRecord node;
    private final Path root;
    private final RecordStore store;

    public FilesystemNodeIO(StorageNodeRecord node, RecordStore store) {
        this.node = node;
        this.root = Path.of(node.root()).toAbsolutePath().normalize();
        this.store = store;
    }

    @Override
    public StorageNodeRecord node() {
        return node;
    }

    Path resolve(StorageNodeRecord owner, Path base, String path) {
        Path resolved = base.resolve(path).normalize();
        if (!resolved.startsWith(base) || resolved.equals(base)) {
            throw new StorageException(owner.name(), path, "Path escapes node root");
        }
        return resolved;
    }

    @Override
    public InputStream open(String path) throws IOException {
        return Files.newInputStream(resolve(node, root, path));
    }

    @Override
    public void delete(List<FileCopy> copies) {
        for (FileCopy copy : copies) {
            Path file = resolve(node, root, copy.path());
            try {
                if (!Files.deleteIfExists(file)) {
                    log.warnf("%s: %s already absent", node.name(), copy.path());
                }
                pruneEmptyParents(file.getParent(), root);
            } catch (IOException e) {
                throw new StorageException(node.name(), copy.path(), "Failed to delete", e);
            }
            store.markCopyRemoved(copy.copyId());
            log.infof("%s: deleted %s", node.name(), copy.path());
        }
    }

    private void pruneEmptyParents(Path dir, Path stop) throws IOException {
        Path current = dir;
        while (current != null && !current.equals(stop)) {
            try (DirectoryStream<Path> entries = Files.newDirectoryStream(current)) {
                if (entries.iterator().hasNext()) {
                    break;
                }
            }
            Files.delete(current);
            current = current.getParent();
        }
    }

    @Override
    public void pull(CopyRequest request) {
        Path sourceRoot = Path.of(request.source().root()).toAbsolutePath().normalize();
        Path from = resolve(request.source(), sourceRoot, request.path());
        Path to = resolve(node, root, request.path());
        Path partial = to.resolveSibling(to.getFileName() + ".partial");
        try {
            Files.createDirectories(to.getParent());
            Files.copy(from, partial, StandardCopyOption.REPLACE_EXISTING);
            Files.move(partial, to, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new StorageException(node.name(), request.path(),
                    "Failed to pull from " + request.source().name(), e);
        }
        store.recordCopy(request.fileId(), node.id());
        store.completeRequest(request.requestId());
        log.infof("%s: pulled %s from %s", node.name(), request.path(), request.source().name());
    }
}
