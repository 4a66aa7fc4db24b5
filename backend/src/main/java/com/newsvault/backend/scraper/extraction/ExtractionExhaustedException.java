package com.newsvault.backend.scraper.extraction;

import com.newsvault.backend.scraper.model.ExtractionMethod;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Every extraction stage failed or produced too little text for an item.
 */
public class ExtractionExhaustedException extends RuntimeException {

    private final String url;
    private final Map<ExtractionMethod, String> reasons;

    public ExtractionExhaustedException(String url, Map<ExtractionMethod, String> reasons) {
        super("All extraction strategies exhausted for " + url + ": " + describe(reasons));
        this.url = url;
        this.reasons = Collections.unmodifiableMap(new LinkedHashMap<>(reasons));
    }

    public String getUrl() {
        return url;
    }

    public Map<ExtractionMethod, String> getReasons() {
        return reasons;
    }

    private static String describe(Map<ExtractionMethod, String> reasons) {
        return reasons.entrySet().stream()
                .map(entry -> entry.getKey().getCode() + "=" + entry.getValue())
                .collect(Collectors.joining("; "));
    }
}
