package com.newsvault.backend.scraper.extraction;

import com.newsvault.backend.config.PipelineProperties;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

/**
 * Removes boilerplate blocks from a rendered page by text and link density.
 * <p>
 * A block is dropped when most of its text is link text, when it has no text at all,
 * or when its class/id marks it as sharing, comments, promotion or navigation.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ContentDensityPruner {

    private static final String BLOCK_SELECTOR = "div, section, aside, ul, ol, table, figure, form, nav";
    private static final Pattern NEGATIVE_HINTS = Pattern.compile(
            "comment|share|social|related|promo|newsletter|advert|sponsor|cookie|subscribe|sidebar|breadcrumb|popup|banner|menu",
            Pattern.CASE_INSENSITIVE);

    private final PipelineProperties properties;

    /**
     * Prunes {@code root} in place and returns it.
     */
    public Element prune(Element root) {
        List<Element> blocks = new ArrayList<>(root.select(BLOCK_SELECTOR));
        // Deepest blocks first so a parent is judged on what survives inside it
        Collections.reverse(blocks);

        int removed = 0;
        for (Element block : blocks) {
            if (block == root || block.parent() == null) continue;
            if (shouldRemove(block)) {
                block.remove();
                removed++;
            }
        }
        log.debug("Pruned {} low-density blocks", removed);
        return root;
    }

    boolean shouldRemove(Element block) {
        String hints = block.className() + " " + block.id();
        if (!hints.isBlank() && NEGATIVE_HINTS.matcher(hints).find() && block.select("p").size() < 3) {
            return true;
        }

        int textLength = block.text().length();
        if (textLength == 0) {
            return block.select("img, video, picture").isEmpty();
        }

        int linkTextLength = block.select("a").stream().mapToInt(a -> a.text().length()).sum();
        double linkDensity = (double) linkTextLength / textLength;
        return linkDensity > properties.getPruningThreshold();
    }
}
