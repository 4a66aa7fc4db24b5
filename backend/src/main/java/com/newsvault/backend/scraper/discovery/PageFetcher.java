package com.newsvault.backend.scraper.discovery;

import com.newsvault.backend.config.PipelineProperties;
import com.newsvault.backend.config.ScrapingConfig;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.parser.Parser;
import org.springframework.stereotype.Component;

/**
 * Plain HTTP fetches with a realistic browser user agent.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PageFetcher {

    private final ScrapingConfig scrapingConfig;
    private final PipelineProperties pipelineProperties;

    public Document fetchHtml(String url) throws IOException {
        log.debug("Fetching page {}", url);
        return Jsoup.connect(url)
                .userAgent(scrapingConfig.getUserAgent())
                .headers(scrapingConfig.getDefaultHeaders())
                .timeout((int) pipelineProperties.getFetchTimeout().toMillis())
                .followRedirects(true)
                .get();
    }

    public Document fetchXml(String url) throws IOException {
        log.debug("Fetching feed {}", url);
        return Jsoup.connect(url)
                .userAgent(scrapingConfig.getUserAgent())
                .timeout((int) pipelineProperties.getFetchTimeout().toMillis())
                .followRedirects(true)
                .ignoreContentType(true)
                .parser(Parser.xmlParser())
                .get();
    }
}
