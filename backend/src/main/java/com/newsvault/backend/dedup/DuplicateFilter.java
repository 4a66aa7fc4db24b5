package com.newsvault.backend.dedup;

import com.newsvault.backend.config.PipelineProperties;
import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Bounded LRU memory of recently ingested articles, keyed by canonical URL and optionally by normalized title.
 * <p>
 * Lookups never insert. An item is admitted only after its index write succeeded, so a failed
 * item is retried in a later cycle. Forgetting old entries under capacity pressure is acceptable.
 * <p>
 * Items being processed are reserved, so two sources carrying the same URL in one cycle never
 * both extract and persist it.
 */
@Component
@Slf4j
public class DuplicateFilter {

    private final Map<String, Instant> urls;
    private final Map<String, Instant> titles;
    private final Set<String> inFlight = new HashSet<>();
    private final boolean matchTitles;
    private final int capacity;
    private final Clock clock;

    public DuplicateFilter(PipelineProperties properties, Clock clock) {
        this.capacity = Math.max(1, properties.getDedup().getCapacity());
        this.matchTitles = properties.getDedup().isMatchTitles();
        this.clock = clock;
        this.urls = lruMap(capacity);
        this.titles = lruMap(capacity);
        log.info("📊 Initialized duplicate filter with capacity {} (title matching: {})", capacity, matchTitles);
    }

    public synchronized boolean isDuplicate(String url) {
        return url != null && urls.containsKey(url);
    }

    /**
     * URL match first, then the normalized title when title matching is enabled.
     */
    public synchronized boolean isDuplicate(String url, String title) {
        if (isDuplicate(url)) return true;
        if (!matchTitles) return false;
        String key = TitleNormalizer.normalize(title);
        return key != null && titles.containsKey(key);
    }

    /**
     * Claims the URL for processing. Returns false when it is a duplicate or another worker holds it.
     * A successful reservation must be given back with {@link #release(String)}.
     */
    public synchronized boolean tryReserve(String url, String title) {
        if (url == null || isDuplicate(url, title) || inFlight.contains(url)) {
            return false;
        }
        inFlight.add(url);
        return true;
    }

    public synchronized void release(String url) {
        inFlight.remove(url);
    }

    /**
     * Records the URL as ingested. Returns false if it was already present.
     */
    public synchronized boolean admit(String url) {
        return admit(url, null);
    }

    public synchronized boolean admit(String url, String title) {
        if (url == null) return false;
        Instant now = Instant.now(clock);
        boolean added = urls.put(url, now) == null;
        if (matchTitles) {
            String key = TitleNormalizer.normalize(title);
            if (key != null) {
                titles.put(key, now);
            }
        }
        return added;
    }

    public synchronized int size() {
        return urls.size();
    }

    public int getCapacity() {
        return capacity;
    }

    public synchronized void clear() {
        urls.clear();
        titles.clear();
    }

    private static Map<String, Instant> lruMap(int capacity) {
        return new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Instant> eldest) {
                return size() > capacity;
            }
        };
    }
}
