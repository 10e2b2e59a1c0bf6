package com.libragraph.archive.formats.extract;

import com.libragraph.archive.formats.container.ContainerFormatException;
import com.libragraph.archive.formats.container.ContainerOpener;
import com.libragraph.archive.formats.container.DataContainer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs an {@link Extractor} against one item and merges its outputs into an
 * {@link InfoRecord}.
 *
 * <p>Merge precedence, lowest to highest: content fields, filename fields,
 * external fields. The content is opened at most once and is always closed
 * before this method returns. Any failure throws and no record is produced.
 */
@ApplicationScoped
public class ExtractionService {

    private static final Logger log = Logger.getLogger(ExtractionService.class);

    private final ContainerOpener opener;

    @Inject
    public ExtractionService(ContainerOpener opener) {
        this.opener = opener;
    }

    public InfoRecord extract(Extractor extractor, ExtractionContext ctx) throws ExtractionException {
        // Name first: it's pure, so a bad name fails before any I/O.
        Map<String, Object> fromName = extractor.filenameParser().isPresent()
                ? extractor.filenameParser().get().parseFilename(ctx.name())
                : Map.of();

        Map<String, Object> fromContent = extractor.contentParser().isPresent()
                ? readContent(extractor.contentParser().get(), ctx)
                : Map.of();

        Map<String, Object> merged = new LinkedHashMap<>(fromContent);
        merged.putAll(fromName);
        merged.putAll(ctx.external());

        InfoRecord record = InfoRecord.build(extractor.id(), ctx.ownerId(), merged);
        log.debugf("Extracted %s for %s: %s", extractor.id().label(), ctx.name(), record.values());
        return record;
    }

    private Map<String, Object> readContent(ContentParser parser, ExtractionContext ctx)
            throws ExtractionException {
        try (InputStream in = ctx.source().open();
             DataContainer container = opener.open(in, ctx.name())) {
            return parser.parseContent(container);
        } catch (IOException e) {
            throw new ExtractionException("I/O error reading " + ctx.path() + ": " + e.getMessage(), e);
        } catch (ContainerFormatException e) {
            throw new ExtractionException(e.getMessage(), e);
        }
    }
}
