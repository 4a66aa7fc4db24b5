package com.newsvault.backend.scraper.source;

import com.newsvault.backend.config.ConfigurationException;
import com.newsvault.backend.config.PipelineProperties;
import com.newsvault.backend.scraper.model.ExtractionMethod;
import com.newsvault.backend.scraper.model.SourceDefinition;
import com.newsvault.backend.scraper.model.SourceKind;
import jakarta.annotation.PostConstruct;
import java.io.InputStream;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;
import org.yaml.snakeyaml.Yaml;

/**
 * Loads source definitions from the declarative YAML file once at startup.
 * Changing the file requires a restart.
 */
@Service
@Slf4j
public class SourceRegistry {

    private static final Pattern SHORT_DURATION = Pattern.compile("(\\d+)\\s*([smhd])", Pattern.CASE_INSENSITIVE);

    private final PipelineProperties properties;
    private final ResourceLoader resourceLoader;
    private final Map<String, SourceDefinition> sources = new LinkedHashMap<>();

    public SourceRegistry(PipelineProperties properties, ResourceLoader resourceLoader) {
        this.properties = properties;
        this.resourceLoader = resourceLoader;
    }

    @PostConstruct
    public void loadConfigurations() {
        Resource resource = resourceLoader.getResource(properties.getSourcesFile());
        try (InputStream inputStream = resource.getInputStream()) {
            loadFrom(inputStream);
        } catch (ConfigurationException e) {
            throw e;
        } catch (Exception e) {
            log.error("Error loading source definitions from {}", properties.getSourcesFile(), e);
            throw new ConfigurationException("sources", "Failed to load source definitions from " + properties.getSourcesFile(), e);
        }
    }

    void loadFrom(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Map<String, Object> data = yaml.load(inputStream);
        if (data == null || !(data.get("sources") instanceof List)) {
            throw new ConfigurationException("sources", "Source file has no 'sources' list");
        }
        List<?> entries = (List<?>) data.get("sources");

        sources.clear();
        for (Object entry : entries) {
            if (!(entry instanceof Map)) {
                log.warn("Skipping source entry that is not a mapping: {}", entry);
                continue;
            }
            @SuppressWarnings("unchecked")
            Map<String, Object> sourceData = (Map<String, Object>) entry;
            try {
                SourceDefinition definition = createDefinitionFromMap(sourceData);
                if (sources.containsKey(definition.getName())) {
                    log.warn("Duplicate source name '{}' ignored", definition.getName());
                    continue;
                }
                sources.put(definition.getName(), definition);
                log.info("Loaded source definition: {} ({}, {})", definition.getName(),
                        definition.getKind().getCode(), definition.getEndpoint());
            } catch (IllegalArgumentException e) {
                log.warn("Skipping invalid source definition {}: {}", sourceData.get("name"), e.getMessage());
            }
        }

        log.info("Successfully loaded {} source definitions", sources.size());
    }

    public List<SourceDefinition> getSources() {
        return Collections.unmodifiableList(new ArrayList<>(sources.values()));
    }

    public Optional<SourceDefinition> getSource(String name) {
        return Optional.ofNullable(sources.get(name));
    }

    @SuppressWarnings("unchecked")
    private SourceDefinition createDefinitionFromMap(Map<String, Object> sourceData) {
        String name = string(sourceData, "name");
        String endpoint = string(sourceData, "endpoint");
        String kind = string(sourceData, "kind");
        if (name == null || name.isBlank()) throw new IllegalArgumentException("name is required");
        if (endpoint == null || !endpoint.startsWith("http")) throw new IllegalArgumentException("endpoint must be an http(s) URL");
        if (kind == null) throw new IllegalArgumentException("kind is required");

        SourceDefinition.SourceDefinitionBuilder builder = SourceDefinition.builder()
                .name(name)
                .displayName(string(sourceData, "displayName"))
                .kind(SourceKind.fromCode(kind))
                .endpoint(endpoint)
                .recencyWindow(Optional.ofNullable(string(sourceData, "recencyWindow"))
                        .map(SourceRegistry::parseDuration)
                        .orElse(properties.getDefaultRecencyWindow()))
                .zone(Optional.ofNullable(string(sourceData, "timezone")).map(ZoneId::of).orElse(properties.getZone()))
                .maxItems(integer(sourceData, "maxItems", 50))
                .minContentLength((Integer) sourceData.get("minContentLength"))
                .minWordCount(integer(sourceData, "minWordCount", 0))
                .renderEnabled(bool(sourceData, "render", true))
                .itemSelector(string(sourceData, "itemSelector"))
                .linkSelector(string(sourceData, "linkSelector"))
                .titleSelector(string(sourceData, "titleSelector"))
                .categorySelector(string(sourceData, "categorySelector"))
                .dateSelector(string(sourceData, "dateSelector"))
                .datePattern(string(sourceData, "datePattern"))
                .renderListing(bool(sourceData, "renderListing", false))
                .checkArchiveBeforeWrite(bool(sourceData, "checkArchiveBeforeWrite", false))
                .llmCleaning(bool(sourceData, "llmCleaning", false))
                .translate(bool(sourceData, "translate", false));

        List<String> contentSelectors = (List<String>) sourceData.get("contentSelectors");
        if (contentSelectors != null) builder.contentSelectors(contentSelectors);

        List<String> skip = (List<String>) sourceData.get("skipUrlsContaining");
        if (skip != null) builder.skipUrlsContaining(skip);

        List<String> order = (List<String>) sourceData.get("extractionOrder");
        if (order != null) {
            Set<ExtractionMethod> seen = new HashSet<>();
            for (String step : order) {
                ExtractionMethod method = ExtractionMethod.fromCode(step);
                if (seen.add(method)) builder.extractionStep(method);
            }
        }

        SourceDefinition definition = builder.build();
        if (definition.getKind() == SourceKind.LISTING && definition.getLinkSelector() == null) {
            throw new IllegalArgumentException("listing sources need a linkSelector");
        }
        return definition;
    }

    /**
     * Accepts ISO-8601 ({@code PT24H}) or the short form used in source files ({@code 24h}, {@code 1d}).
     */
    static Duration parseDuration(String value) {
        String trimmed = value.trim();
        if (trimmed.toUpperCase().startsWith("P")) {
            return Duration.parse(trimmed.toUpperCase());
        }
        Matcher matcher = SHORT_DURATION.matcher(trimmed);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Unrecognized duration: " + value);
        }
        long amount = Long.parseLong(matcher.group(1));
        switch (matcher.group(2).toLowerCase()) {
            case "s":
                return Duration.ofSeconds(amount);
            case "m":
                return Duration.ofMinutes(amount);
            case "h":
                return Duration.ofHours(amount);
            default:
                return Duration.ofDays(amount);
        }
    }

    private static String string(Map<String, Object> data, String key) {
        Object value = data.get(key);
        return value != null ? value.toString() : null;
    }

    private static int integer(Map<String, Object> data, String key, int defaultValue) {
        Object value = data.get(key);
        return value instanceof Number ? ((Number) value).intValue() : defaultValue;
    }

    private static boolean bool(Map<String, Object> data, String key, boolean defaultValue) {
        Object value = data.get(key);
        return value instanceof Boolean ? (Boolean) value : defaultValue;
    }
}
