package com.libragraph.archive.app;

import com.libragraph.archive.core.ingest.ImportBatchRunner;
import com.libragraph.archive.core.ingest.ImportOutcome;
import com.libragraph.archive.core.storage.NodeIO;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Imports files already on the local node. Each argument is a file or directory,
 * either relative to the node root or absolute under it; directories are walked.
 * Exits 1 if any import failed.
 */
@QuarkusMain
public class ImportCommand implements QuarkusApplication {

    private static final Logger log = Logger.getLogger(ImportCommand.class);

    static final int EXIT_FAILURES = 1;
    static final int EXIT_USAGE = 2;

    @Inject
    ImportBatchRunner runner;

    @Inject
    NodeIO node;

    @Override
    public int run(String... args) throws Exception {
        if (args.length == 0) {
            log.error("Usage: archive-import <path>...");
            return EXIT_USAGE;
        }
        Path root = Path.of(node.node().root()).toAbsolutePath().normalize();
        List<String> paths;
        try {
            paths = expand(root, List.of(args));
        } catch (IllegalArgumentException e) {
            log.error(e.getMessage());
            return EXIT_USAGE;
        }

        List<ImportOutcome> outcomes = runner.importAll(paths, node);
        int failed = 0;
        for (ImportOutcome outcome : outcomes) {
            if (outcome instanceof ImportOutcome.Failed f) {
                failed++;
                log.errorf("%s: %s%s", f.path(), f.error().message(),
                        f.error().retryable() ? " (retryable)" : "");
            }
        }
        return failed == 0 ? 0 : EXIT_FAILURES;
    }

    /**
     * Turns arguments into node-relative file paths with {@code /} separators,
     * walking directories in sorted order.
     *
     * @throws IllegalArgumentException if an argument lies outside the node root
     */
    static List<String> expand(Path root, List<String> args) throws IOException {
        List<String> paths = new ArrayList<>();
        for (String arg : args) {
            Path p = Path.of(arg);
            Path absolute = (p.isAbsolute() ? p : root.resolve(p)).normalize();
            if (!absolute.startsWith(root)) {
                throw new IllegalArgumentException("Not under node root " + root + ": " + arg);
            }
            if (Files.isDirectory(absolute)) {
                try (Stream<Path> files = Files.walk(absolute)) {
                    files.filter(Files::isRegularFile)
                            .sorted()
                            .forEach(f -> paths.add(relative(root, f)));
                }
            } else {
                paths.add(relative(root, absolute));
            }
        }
        return paths;
    }

    private static String relative(Path root, Path file) {
        return root.relativize(file).toString().replace(file.getFileSystem().getSeparator(), "/");
    }
}
