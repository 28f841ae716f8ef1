package com.locationinsights.backend.services.sentiment;

import com.locationinsights.backend.models.ReviewIssue;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Tags complaint categories by whole-word keyword match, case-insensitive.
 */
@Component
public class ReviewIssueDetector {

    private static final Map<ReviewIssue, List<String>> KEYWORDS = Map.of(
            ReviewIssue.FOOD, List.of("cold", "stale", "soggy", "undercooked", "overcooked"),
            ReviewIssue.SERVICE, List.of("slow", "rude", "wrong order", "bad service", "unhelpful"),
            ReviewIssue.CLEANLINESS, List.of("dirty", "unclean", "filthy", "messy"),
            ReviewIssue.PRICE, List.of("expensive", "overpriced", "not worth"));

    private final Map<ReviewIssue, Pattern> patterns = new EnumMap<>(ReviewIssue.class);

    public ReviewIssueDetector() {
        KEYWORDS.forEach((issue, words) -> patterns.put(issue, compile(words)));
    }

    public Set<ReviewIssue> detect(String text) {
        if (text == null || text.isBlank()) {
            return Set.of();
        }
        Set<ReviewIssue> found = EnumSet.noneOf(ReviewIssue.class);
        patterns.forEach((issue, pattern) -> {
            if (pattern.matcher(text).find()) {
                found.add(issue);
            }
        });
        return found;
    }

    private static Pattern compile(List<String> phrases) {
        String alternation = phrases.stream()
                .map(phrase -> Pattern.quote(phrase).replace(" ", "\\E\\s+\\Q"))
                .collect(Collectors.joining("|"));
        return Pattern.compile("\\b(?:" + alternation + ")\\b", Pattern.CASE_INSENSITIVE);
    }
}
