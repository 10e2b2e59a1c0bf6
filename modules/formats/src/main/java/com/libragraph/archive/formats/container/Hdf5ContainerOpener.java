package com.libragraph.archive.formats.container;

import io.jhdf.HdfFile;
import io.jhdf.exceptions.HdfException;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;

/**
 * Opens HDF5 files with jHDF. The whole stream is read into memory and parsed
 * from the byte array, so nothing is left on disk once the container is closed.
 */
@ApplicationScoped
public class Hdf5ContainerOpener implements ContainerOpener {

    private static final Logger log = Logger.getLogger(Hdf5ContainerOpener.class);

    @Override
    public DataContainer open(InputStream input, String filename) throws IOException {
        byte[] bytes = input.readAllBytes();
        try {
            HdfFile file = HdfFile.fromBytes(bytes);
            log.debugf("Opened HDF5 container %s (%d bytes)", filename, bytes.length);
            return new Hdf5Container(file, filename);
        } catch (HdfException e) {
            throw new ContainerFormatException("Not a readable HDF5 file: " + filename, e);
        }
    }
}
