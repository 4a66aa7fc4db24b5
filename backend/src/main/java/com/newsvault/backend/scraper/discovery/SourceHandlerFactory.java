package com.newsvault.backend.scraper.discovery;

import com.newsvault.backend.scraper.model.SourceDefinition;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Selects the discovery variant for a source by its kind.
 */
@Component
@RequiredArgsConstructor
public class SourceHandlerFactory {

    private final FeedSourceHandler feedSourceHandler;
    private final ListingSourceHandler listingSourceHandler;

    public SourceHandler getHandler(SourceDefinition source) {
        return switch (source.getKind()) {
            case FEED -> feedSourceHandler;
            case LISTING -> listingSourceHandler;
        };
    }
}
