package com.libragraph.archive.core.classify;

import com.libragraph.archive.core.catalog.AcqType;
import com.libragraph.archive.core.catalog.FileType;
import com.libragraph.archive.core.catalog.Instrument;

import java.util.Map;

/**
 * A successfully classified path.
 *
 * @param path     the node-relative path that was classified
 * @param fileName leaf filename
 * @param groups   named groups captured by the file type's pattern; possibly empty
 */
public record Classification(
        String path,
        AcqName acqName,
        AcqType acqType,
        Instrument instrument,
        String fileName,
        FileType fileType,
        Map<String, String> groups
) {
    public Classification {
        groups = Map.copyOf(groups);
    }
}
