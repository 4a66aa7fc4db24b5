package com.newsvault.backend.ai.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Structured answer of the LLM cleaning prompt.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CleanedContent {
    private String cleanedContent;
    private String author;
    private String category;
    private String translatedTitle;
    private String translatedContent;
}
