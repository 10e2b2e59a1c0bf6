package com.libragraph.archive.core.ingest;

import com.libragraph.archive.core.dao.AcquisitionRecord;
import com.libragraph.archive.core.dao.ArchiveFileRecord;
import com.libragraph.archive.core.dao.FileCopyRecord;
import com.libragraph.archive.core.storage.NodeIO;
import com.libragraph.archive.formats.extract.ExtractionException;

/**
 * Runs after a file copy has been recorded.
 * {@code newFile} and {@code newAcq} are non-null only if this import created them.
 */
@FunctionalInterface
public interface PostImportCallback {

    void onImport(FileCopyRecord copy, ArchiveFileRecord newFile, AcquisitionRecord newAcq, NodeIO node)
            throws ExtractionException;
}
