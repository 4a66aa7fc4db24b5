package com.newsvault.backend.ai.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsvault.backend.ai.dto.CleanedContent;
import com.newsvault.backend.config.PipelineProperties;
import com.newsvault.backend.health.DependencyHealthRegistry;
import com.newsvault.backend.scraper.model.ExtractedArticle;
import com.newsvault.backend.scraper.model.SourceDefinition;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.chat.prompt.PromptTemplate;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

/**
 * Optional LLM pass over extracted text: removes leftover boilerplate, fills in author and
 * category, and translates when asked to.
 * <p>
 * Any failure returns the article unchanged.
 */
@Service
@Slf4j
public class LlmContentCleaner {

    private static final String CLEANING_PROMPT = """
            You are cleaning a scraped news article.
            Remove navigation text, advertisements, share prompts and other boilerplate.
            Keep every sentence of the actual article unchanged otherwise.
            Identify the author and a one or two word category if the text states them.
            {translationInstruction}

            Title: {title}

            Article:
            {content}

            Answer with a single JSON object exactly in this format and nothing else:
            {format}
            """;

    private static final String RESPONSE_FORMAT = """
            {"cleanedContent": "...", "author": "... or null", "category": "... or null", \
            "translatedTitle": "... or null", "translatedContent": "... or null"}""";

    private final ChatModel chatModel;
    private final PipelineProperties properties;
    private final DependencyHealthRegistry healthRegistry;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public LlmContentCleaner(ObjectProvider<ChatModel> chatModel, PipelineProperties properties,
                             DependencyHealthRegistry healthRegistry) {
        this.chatModel = chatModel.getIfAvailable();
        this.properties = properties;
        this.healthRegistry = healthRegistry;
    }

    public boolean isEnabledFor(SourceDefinition source) {
        boolean wanted = properties.getLlm().isCleaningEnabled() || source.isLlmCleaning()
                || wantsTranslation(source);
        return wanted && chatModel != null;
    }

    public ExtractedArticle enhance(ExtractedArticle article, SourceDefinition source) {
        if (!isEnabledFor(source)) {
            return article;
        }

        try {
            String content = article.getContent();
            if (content.length() > properties.getLlm().getMaxInputChars()) {
                content = content.substring(0, properties.getLlm().getMaxInputChars());
            }

            PromptTemplate promptTemplate = new PromptTemplate(CLEANING_PROMPT);
            Prompt prompt = promptTemplate.create(Map.of(
                    "translationInstruction", wantsTranslation(source)
                            ? "Also translate the title and the cleaned article into English."
                            : "Do not translate; leave the translated fields null.",
                    "title", article.getTitle(),
                    "content", content,
                    "format", RESPONSE_FORMAT));

            ChatResponse response = chatModel.call(prompt);
            String aiResponse = response.getResult().getOutput().getText().trim();
            log.debug("🤖 LLM cleaning response received: {}", aiResponse.substring(0, Math.min(200, aiResponse.length())));

            CleanedContent cleaned = parseResponse(aiResponse);
            healthRegistry.markHealthy(DependencyHealthRegistry.LLM);
            return merge(article, cleaned);
        } catch (Exception e) {
            healthRegistry.markUnhealthy(DependencyHealthRegistry.LLM, e.getMessage());
            log.warn("⚠️ LLM cleaning failed for {}, keeping regex-cleaned text: {}", article.getUrl(), e.getMessage());
            return article;
        }
    }

    CleanedContent parseResponse(String aiResponse) throws Exception {
        String json = aiResponse;
        // Models sometimes wrap JSON in a markdown code fence
        int start = json.indexOf('{');
        int end = json.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new IllegalArgumentException("No JSON object in LLM response");
        }
        json = json.substring(start, end + 1);
        return objectMapper.readValue(json, CleanedContent.class);
    }

    private ExtractedArticle merge(ExtractedArticle article, CleanedContent cleaned) {
        ExtractedArticle.ExtractedArticleBuilder builder = article.toBuilder();
        String cleanedText = blankToNull(cleaned.getCleanedContent());
        // A cleaner that throws most of the article away is not trusted
        if (cleanedText != null && cleanedText.length() >= Math.min(article.getContentLength(), properties.getMinContentLength())) {
            builder.content(cleanedText).contentLength(cleanedText.length());
        }
        if (article.getAuthor() == null) builder.author(blankToNull(cleaned.getAuthor()));
        if (article.getCategory() == null) builder.category(blankToNull(cleaned.getCategory()));
        builder.translatedTitle(blankToNull(cleaned.getTranslatedTitle()));
        builder.translatedContent(blankToNull(cleaned.getTranslatedContent()));
        return builder.build();
    }

    private boolean wantsTranslation(SourceDefinition source) {
        return properties.getLlm().isTranslationEnabled() || source.isTranslate();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() || value.equalsIgnoreCase("null") ? null : value.trim();
    }
}
