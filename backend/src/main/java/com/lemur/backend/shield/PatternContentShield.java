package com.lemur.backend.shield;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex based {@link ContentShield}.
 * <p>
 * Comments are dropped outright. The remaining categories are processed in a fixed
 * order, each one over the output of the previous, so {@code <style>} inside an
 * {@code <svg>} ends up inside the svg placeholder and never gets its own token.
 * Tokens look like {@code __sc1__}: the first two letters of the category followed
 * by a per-category counter starting at 1.
 */
@Component
public class PatternContentShield implements ContentShield {

    private static final Logger log = LoggerFactory.getLogger(PatternContentShield.class);

    private static final Pattern COMMENT = Pattern.compile("<!--[\\s\\S]*?-->");

    private static final List<Category> CATEGORIES = List.of(
            new Category("svg", "<svg[^>]*>[\\s\\S]*?</svg>"),
            new Category("script", "<script[^>]*>[\\s\\S]*?</script>"),
            new Category("style", "<style[^>]*>[\\s\\S]*?</style>"),
            new Category("meta", "<meta[^>]*>"),
            new Category("link", "<link[^>]*>"));

    @Override
    public ShieldedDocument protect(String document) {
        String processed = COMMENT.matcher(document).replaceAll("");
        Map<String, String> placeholders = new LinkedHashMap<>();

        for (Category category : CATEGORIES) {
            Matcher matcher = category.pattern().matcher(processed);
            StringBuilder out = new StringBuilder();
            int counter = 1;
            while (matcher.find()) {
                String token = category.token(counter++);
                placeholders.put(token, matcher.group());
                matcher.appendReplacement(out, Matcher.quoteReplacement(token));
            }
            matcher.appendTail(out);
            processed = out.toString();
        }

        log.debug("[SHIELD] Protected document: {} chars -> {} chars, {} placeholders",
                document.length(), processed.length(), placeholders.size());
        return new ShieldedDocument(processed, placeholders);
    }

    @Override
    public String restore(String text, Map<String, String> placeholders) {
        String restored = text;
        // Entries are applied one after another, not to a fixpoint.
        for (Map.Entry<String, String> entry : placeholders.entrySet()) {
            restored = restored.replace(entry.getKey(), entry.getValue());
        }
        return restored;
    }

    private record Category(String name, Pattern pattern) {

        Category(String name, String regex) {
            this(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
        }

        String token(int counter) {
            return "__" + name.substring(0, 2) + counter + "__";
        }
    }
}
