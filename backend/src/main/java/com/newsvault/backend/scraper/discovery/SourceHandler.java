package com.newsvault.backend.scraper.discovery;

import com.newsvault.backend.scraper.model.CandidateItem;
import com.newsvault.backend.scraper.model.SourceDefinition;
import java.util.stream.Stream;

/**
 * Discovers candidate items for one kind of source.
 */
public interface SourceHandler {

    /**
     * Yields the items of {@code source} published inside its recency window, in source order.
     * The returned stream can be consumed once.
     *
     * @throws SourceFetchException when the feed or listing document itself is unavailable
     */
    Stream<CandidateItem> discover(SourceDefinition source);
}
