package com.newsvault.backend.config;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "scraping")
@Data
public class ScrapingConfig {

    private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/140.0.0.0 Safari/537.36";

    // Default headers for HTTP requests
    private Map<String, String> defaultHeaders = Map.of(
            "Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,image/webp,*/*;q=0.8",
            "Accept-Language", "en-US,en;q=0.5",
            "Accept-Encoding", "gzip, deflate",
            "Upgrade-Insecure-Requests", "1"
    );

    // URL patterns never worth fetching as articles
    private List<String> excludedUrlPatterns = Arrays.asList(
            "javascript:", "mailto:",
            "facebook.com", "twitter.com", "x.com/", "instagram.com",
            "whatsapp.com", "telegram.org", "linkedin.com",
            "/search?", "/tag/", "/author/"
    );

    // Generic content selectors in priority order, used when a source has none of its own
    private List<String> contentSelectors = Arrays.asList(
            "article",
            "[class*=article]",
            "[class*=content]",
            "[class*=post]",
            "[class*=entry]",
            ".story-body",
            "main",
            ".main-content"
    );

    // Elements stripped before any text is taken from a page
    private List<String> strippedElements = Arrays.asList(
            "script", "style", "noscript", "nav", "footer", "header", "aside",
            "form", "iframe", "button", "menu"
    );

    // Navigation and promotional phrases removed from cleaned text
    private List<String> boilerplatePhrases = Arrays.asList(
            "Skip to main content",
            "Follow us on",
            "Share:",
            "ADVERTISEMENT",
            "SPONSORED",
            "Did this content help you?",
            "Ad-free experience",
            "Sign up for our newsletter",
            "All rights reserved",
            "Cookie Policy"
    );
}
