package com.newsvault.backend.scraper.extraction;

import com.newsvault.backend.scraper.discovery.PageFetcher;
import com.newsvault.backend.scraper.model.CandidateItem;
import com.newsvault.backend.scraper.model.SourceDefinition;
import java.io.IOException;
import java.util.Optional;
import org.jsoup.nodes.Document;

/**
 * Per-item state shared by the stages of one extraction.
 * <p>
 * The static HTML page is fetched at most once; later stages re-parse the same document.
 */
public class ExtractionContext {

    private final CandidateItem item;
    private final SourceDefinition source;
    private final PageFetcher pageFetcher;

    private Document staticPage;
    private IOException staticFailure;

    public ExtractionContext(CandidateItem item, SourceDefinition source, PageFetcher pageFetcher) {
        this.item = item;
        this.source = source;
        this.pageFetcher = pageFetcher;
    }

    public CandidateItem getItem() {
        return item;
    }

    public SourceDefinition getSource() {
        return source;
    }

    public Document staticPage() throws IOException {
        if (staticPage == null && staticFailure == null) {
            try {
                staticPage = pageFetcher.fetchHtml(item.getUrl());
            } catch (IOException e) {
                staticFailure = e;
            }
        }
        if (staticFailure != null) {
            throw staticFailure;
        }
        return staticPage;
    }

    /**
     * The static page if an earlier stage already fetched it successfully.
     */
    public Optional<Document> fetchedStaticPage() {
        return Optional.ofNullable(staticPage);
    }
}
