package com.newsvault.backend.scraper.discovery;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.newsvault.backend.config.PipelineProperties;
import com.newsvault.backend.scraper.model.CandidateItem;
import com.newsvault.backend.scraper.model.SourceDefinition;
import com.newsvault.backend.scraper.model.SourceKind;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;
import org.jsoup.Jsoup;
import org.jsoup.parser.Parser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FeedSourceHandlerTest {

    private static final String FEED_URL = "https://fx.example.com/rss";

    private PageFetcher pageFetcher;
    private PipelineProperties properties;
    private FeedSourceHandler handler;

    @BeforeEach
    void setUp() {
        pageFetcher = mock(PageFetcher.class);
        properties = new PipelineProperties();
        Clock clock = Clock.fixed(Instant.parse("2025-06-10T12:00:00Z"), ZoneOffset.UTC);
        handler = new FeedSourceHandler(pageFetcher, new PublishDateParser(), properties, clock);
    }

    @Test
    void keepsOnlyEntriesInsideRecencyWindow() throws IOException {
        when(pageFetcher.fetchXml(FEED_URL)).thenReturn(xml("<rss version=\"2.0\"><channel><title>FX</title>"
                + "<item><title>Old story</title><link>https://fx.example.com/old?utm_source=rss</link>"
                + "<pubDate>Sat, 07 Jun 2025 12:00:00 GMT</pubDate><description>Old summary</description></item>"
                + "<item><title>Fresh story</title><link>https://fx.example.com/fresh?utm_source=rss</link>"
                + "<pubDate>Tue, 10 Jun 2025 10:00:00 GMT</pubDate><category>Forex</category>"
                + "<description>&lt;p&gt;Fresh &lt;b&gt;summary&lt;/b&gt;&lt;/p&gt;</description></item>"
                + "</channel></rss>"));

        List<CandidateItem> items = handler.discover(feedSource(Duration.ofDays(1), 0)).collect(Collectors.toList());

        assertEquals(1, items.size());
        CandidateItem item = items.get(0);
        assertEquals("https://fx.example.com/fresh", item.getUrl());
        assertEquals("Fresh story", item.getTitle());
        assertEquals("Forex", item.getCategory());
        assertEquals("Fresh summary", item.getSummary());
        assertEquals("fxfeed", item.getSourceName());
        assertEquals(Instant.parse("2025-06-10T10:00:00Z"), item.getPublishedAt().toInstant());
        assertEquals(ZoneId.of("America/Los_Angeles"), item.getPublishedAt().getZone());
    }

    @Test
    void readsAtomEntriesAndSkipsMalformedOnes() throws IOException {
        when(pageFetcher.fetchXml(FEED_URL)).thenReturn(xml("<feed xmlns=\"http://www.w3.org/2005/Atom\"><title>FX</title>"
                + "<entry><title>Atom story</title><link rel=\"alternate\" href=\"https://fx.example.com/atom-story\"/>"
                + "<published>2025-06-10T11:00:00Z</published><author><name>Desk</name></author>"
                + "<summary>Rates held steady</summary></entry>"
                + "<entry><title>No date</title><link href=\"https://fx.example.com/undated\"/></entry>"
                + "</feed>"));

        List<CandidateItem> items = handler.discover(feedSource(Duration.ofDays(1), 0)).collect(Collectors.toList());

        assertEquals(1, items.size());
        assertEquals("https://fx.example.com/atom-story", items.get(0).getUrl());
        assertEquals("Desk", items.get(0).getAuthor());
        assertEquals("Rates held steady", items.get(0).getSummary());
    }

    @Test
    void capsItemsAtMaxItems() throws IOException {
        StringBuilder feed = new StringBuilder("<rss version=\"2.0\"><channel><title>FX</title>");
        for (int i = 0; i < 5; i++) {
            feed.append("<item><title>Story ").append(i).append("</title>")
                    .append("<link>https://fx.example.com/story-").append(i).append("</link>")
                    .append("<pubDate>Tue, 10 Jun 2025 11:00:00 GMT</pubDate></item>");
        }
        feed.append("</channel></rss>");
        when(pageFetcher.fetchXml(FEED_URL)).thenReturn(xml(feed.toString()));

        List<CandidateItem> items = handler.discover(feedSource(Duration.ofDays(1), 2)).collect(Collectors.toList());

        assertEquals(2, items.size());
        assertEquals("https://fx.example.com/story-0", items.get(0).getUrl());
    }

    @Test
    void unreachableFeedFailsTheSource() throws IOException {
        when(pageFetcher.fetchXml(FEED_URL)).thenThrow(new IOException("connection refused"));

        SourceFetchException error = assertThrows(SourceFetchException.class,
                () -> handler.discover(feedSource(Duration.ofDays(1), 0)));

        assertEquals("fxfeed", error.getSourceName());
    }

    @Test
    void documentThatIsNotAFeedFailsTheSource() throws IOException {
        when(pageFetcher.fetchXml(FEED_URL)).thenReturn(xml("<html><body><p>Maintenance</p></body></html>"));

        assertThrows(SourceFetchException.class, () -> handler.discover(feedSource(Duration.ofDays(1), 0)));
    }

    @Test
    void cutoffIsMeasuredInCanonicalZone() {
        assertEquals(Instant.parse("2025-06-10T06:00:00Z"),
                handler.recencyCutoff(feedSource(Duration.ofHours(6), 0)).toInstant());
    }

    private SourceDefinition feedSource(Duration window, int maxItems) {
        return SourceDefinition.builder()
                .name("fxfeed")
                .kind(SourceKind.FEED)
                .endpoint(FEED_URL)
                .recencyWindow(window)
                .zone(ZoneOffset.UTC)
                .maxItems(maxItems)
                .build();
    }

    private static org.jsoup.nodes.Document xml(String content) {
        return Jsoup.parse(content, "", Parser.xmlParser());
    }
}
