package com.newsvault.backend.scraper.extraction;

import com.newsvault.backend.scraper.model.ExtractionMethod;

/**
 * One stage of the extraction fallback chain.
 */
public interface ExtractionStrategy {

    ExtractionMethod method();

    /**
     * Returns cleaned article text, possibly shorter than the acceptance threshold.
     *
     * @throws ExtractionStepException when this stage cannot produce any text
     */
    String extract(ExtractionContext context);
}
