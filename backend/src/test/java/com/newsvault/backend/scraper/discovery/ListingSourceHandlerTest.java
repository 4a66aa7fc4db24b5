package com.newsvault.backend.scraper.discovery;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.newsvault.backend.config.PipelineProperties;
import com.newsvault.backend.config.ScrapingConfig;
import com.newsvault.backend.scraper.model.CandidateItem;
import com.newsvault.backend.scraper.model.SourceDefinition;
import com.newsvault.backend.scraper.model.SourceKind;
import com.newsvault.backend.scraper.render.RenderEnginePool;
import com.newsvault.backend.scraper.render.RenderException;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;
import org.jsoup.Jsoup;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ListingSourceHandlerTest {

    private static final String LISTING_URL = "https://tokyo.example.com/news/";

    private PageFetcher pageFetcher;
    private RenderEnginePool renderEnginePool;
    private ListingSourceHandler handler;

    @BeforeEach
    void setUp() {
        pageFetcher = mock(PageFetcher.class);
        renderEnginePool = mock(RenderEnginePool.class);
        // 12:00 in Tokyo
        Clock clock = Clock.fixed(Instant.parse("2025-06-10T03:00:00Z"), ZoneOffset.UTC);
        handler = new ListingSourceHandler(pageFetcher, renderEnginePool, new PublishDateParser(),
                new ScrapingConfig(), new PipelineProperties(), clock);
    }

    @Test
    void collectsRecentRowsAndFetchesMissingDatesFromArticlePages() throws IOException {
        when(pageFetcher.fetchHtml(LISTING_URL)).thenReturn(Jsoup.parse("<table>"
                + "<tr class=\"row\"><td class=\"time\">06/10 11:30</td><td class=\"cat\">Stocks</td><td><a class=\"title\" href=\"/news/1\">Fresh one</a></td></tr>"
                + "<tr class=\"row\"><td class=\"time\">06/08 09:00</td><td><a class=\"title\" href=\"/news/2\">Too old</a></td></tr>"
                + "<tr class=\"row\"><td><a class=\"title\" href=\"/news/3?utm_campaign=x\">Undated</a></td></tr>"
                + "<tr class=\"row\"><td class=\"time\">06/10 11:00</td><td><a class=\"title\" href=\"/video/4\">Clip</a></td></tr>"
                + "<tr class=\"row\"><td class=\"time\">06/10 11:30</td><td><a class=\"title\" href=\"/news/1#again\">Fresh one</a></td></tr>"
                + "<tr class=\"row\"><td><a class=\"title\" href=\"/news/6\">Broken page</a></td></tr>"
                + "</table>", LISTING_URL));
        when(pageFetcher.fetchHtml("https://tokyo.example.com/news/3")).thenReturn(Jsoup.parse(
                "<html><head><meta property=\"article:published_time\" content=\"2025-06-10T01:00:00Z\"></head></html>"));
        when(pageFetcher.fetchHtml("https://tokyo.example.com/news/6")).thenThrow(new IOException("503"));

        List<CandidateItem> items = handler.discover(listingSource(false)).collect(Collectors.toList());

        assertEquals(2, items.size());
        assertEquals("https://tokyo.example.com/news/1", items.get(0).getUrl());
        assertEquals("Fresh one", items.get(0).getTitle());
        assertEquals("Stocks", items.get(0).getCategory());
        assertEquals(Instant.parse("2025-06-10T02:30:00Z"), items.get(0).getPublishedAt().toInstant());
        assertEquals(ZoneId.of("America/Los_Angeles"), items.get(0).getPublishedAt().getZone());
        assertEquals("https://tokyo.example.com/news/3", items.get(1).getUrl());
        verify(pageFetcher, never()).fetchHtml("https://tokyo.example.com/news/1");
        verify(pageFetcher, never()).fetchHtml("https://tokyo.example.com/video/4");
    }

    @Test
    void rendersListingWhenConfigured() {
        when(renderEnginePool.renderHtml(LISTING_URL)).thenReturn("<table>"
                + "<tr class=\"row\"><td class=\"time\">06/10 10:00</td><td><a class=\"title\" href=\"https://tokyo.example.com/news/9\">Rendered</a></td></tr>"
                + "</table>");

        List<CandidateItem> items = handler.discover(listingSource(true)).collect(Collectors.toList());

        assertEquals(1, items.size());
        assertEquals("Rendered", items.get(0).getTitle());
    }

    @Test
    void unreachableListingFailsTheSource() throws IOException {
        when(pageFetcher.fetchHtml(anyString())).thenThrow(new IOException("timeout"));
        when(renderEnginePool.renderHtml(anyString())).thenThrow(new RenderException("render timed out", true, null));

        assertThrows(SourceFetchException.class, () -> handler.discover(listingSource(false)));
        assertThrows(SourceFetchException.class, () -> handler.discover(listingSource(true)));
    }

    private SourceDefinition listingSource(boolean renderListing) {
        return SourceDefinition.builder()
                .name("tokyo")
                .kind(SourceKind.LISTING)
                .endpoint(LISTING_URL)
                .recencyWindow(Duration.ofDays(1))
                .zone(ZoneId.of("Asia/Tokyo"))
                .itemSelector("tr.row")
                .linkSelector("a.title")
                .categorySelector("td.cat")
                .dateSelector("td.time")
                .datePattern("MM/dd HH:mm")
                .renderListing(renderListing)
                .skipUrlContaining("/video/")
                .build();
    }
}
