package com.newsvault.backend.scraper.extraction;

import com.newsvault.backend.scraper.model.ExtractionMethod;
import java.io.IOException;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

/**
 * Concatenates the {@code <p>} text of the static page.
 */
@Component
@RequiredArgsConstructor
public class ParagraphExtractionStrategy implements ExtractionStrategy {

    private final TextCleaner textCleaner;

    @Override
    public ExtractionMethod method() {
        return ExtractionMethod.PARAGRAPH;
    }

    @Override
    public String extract(ExtractionContext context) {
        Document page;
        try {
            page = context.staticPage();
        } catch (IOException e) {
            throw new ExtractionStepException("fetch failed: " + e.getMessage(), e);
        }

        String paragraphs = page.select("p").stream()
                .map(Element::text)
                .map(String::trim)
                .filter(text -> !text.isEmpty())
                .collect(Collectors.joining("\n"));
        if (paragraphs.isEmpty()) {
            throw new ExtractionStepException("no paragraphs");
        }
        return textCleaner.clean(paragraphs);
    }
}
