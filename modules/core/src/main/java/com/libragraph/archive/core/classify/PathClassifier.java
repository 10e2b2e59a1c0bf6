package com.libragraph.archive.core.classify;

import com.libragraph.archive.core.catalog.AcqType;
import com.libragraph.archive.core.catalog.FileType;
import com.libragraph.archive.core.catalog.Instrument;
import com.libragraph.archive.core.catalog.TypeCatalog;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.Map;
import java.util.Optional;

/**
 * Maps a node-relative path {@code <acquisition>/<file>} to its acquisition and
 * file type. Any failure is a non-match, never an exception.
 */
@ApplicationScoped
public class PathClassifier {

    private static final Logger log = Logger.getLogger(PathClassifier.class);

    private final TypeCatalog catalog;

    @Inject
    public PathClassifier(TypeCatalog catalog) {
        this.catalog = catalog;
    }

    public Optional<Classification> classify(String path) {
        int slash = path.lastIndexOf('/');
        if (slash <= 0 || slash == path.length() - 1) {
            log.debugf("No match for %s: not <acquisition>/<file>", path);
            return Optional.empty();
        }
        String acqPart = path.substring(0, slash);
        String fileName = path.substring(slash + 1);

        Optional<AcqName> acqName = AcqName.parse(acqPart);
        if (acqName.isEmpty()) {
            log.debugf("No match for %s: bad acquisition name", path);
            return Optional.empty();
        }
        Optional<AcqType> acqType = catalog.acqType(acqName.get().acqType());
        if (acqType.isEmpty()) {
            log.debugf("No match for %s: unknown acquisition type %s", path, acqName.get().acqType());
            return Optional.empty();
        }
        Optional<Instrument> instrument = catalog.instrument(acqName.get().instrument());
        if (instrument.isEmpty()) {
            log.debugf("No match for %s: unknown instrument %s", path, acqName.get().instrument());
            return Optional.empty();
        }

        for (FileType fileType : catalog.allowedFileTypes(acqType.get())) {
            if (fileType.pattern() == null) {
                continue;
            }
            Optional<Map<String, String>> groups = fileType.pattern().match(fileName);
            if (groups.isPresent()) {
                return Optional.of(new Classification(path, acqName.get(), acqType.get(), instrument.get(),
                        fileName, fileType, groups.get()));
            }
        }
        log.debugf("No match for %s: no file type of %s matches", path, acqType.get().name());
        return Optional.empty();
    }
}
