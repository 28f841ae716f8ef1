package com.locationinsights.backend.services.sentiment;

import com.locationinsights.backend.models.SentimentLabel;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Rating decides the label. Only three-star reviews consult the text, through a small
 * word lexicon with negation handling.
 */
@Component
public class RatingLexiconSentimentClassifier implements SentimentClassifier {

    static final int OVERRIDE_THRESHOLD = 2;
    private static final int NEGATION_WINDOW = 2;

    private static final Pattern TOKEN_SPLIT = Pattern.compile("[^a-z']+");

    private static final Set<String> POSITIVE_WORDS = Set.of(
            "good", "great", "excellent", "amazing", "awesome", "love", "loved", "friendly",
            "delicious", "fresh", "fast", "clean", "tasty", "perfect", "nice", "best",
            "helpful", "pleasant", "recommend", "wonderful");

    private static final Set<String> NEGATIVE_WORDS = Set.of(
            "bad", "terrible", "awful", "horrible", "worst", "rude", "slow", "dirty",
            "cold", "stale", "disgusting", "poor", "hate", "hated", "gross", "wrong",
            "disappointing", "disappointed", "overpriced", "mediocre");

    private static final Set<String> NEGATORS = Set.of(
            "not", "no", "never", "isn't", "wasn't", "don't", "didn't");

    @Override
    public SentimentLabel classify(int rating, String text) {
        if (rating >= 4) {
            return SentimentLabel.POSITIVE;
        }
        if (rating <= 2) {
            return SentimentLabel.NEGATIVE;
        }

        int score = lexiconScore(text);
        if (score >= OVERRIDE_THRESHOLD) {
            return SentimentLabel.POSITIVE;
        }
        if (score <= -OVERRIDE_THRESHOLD) {
            return SentimentLabel.NEGATIVE;
        }
        return SentimentLabel.NEUTRAL;
    }

    /**
     * Positive hits minus negative hits. A hit preceded by a negator within two tokens flips polarity.
     */
    int lexiconScore(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        String[] tokens = TOKEN_SPLIT.split(text.toLowerCase(Locale.ROOT).replace('’', '\''));

        int score = 0;
        for (int i = 0; i < tokens.length; i++) {
            String token = tokens[i];
            int polarity = POSITIVE_WORDS.contains(token) ? 1 : NEGATIVE_WORDS.contains(token) ? -1 : 0;
            if (polarity == 0) {
                continue;
            }
            score += isNegated(tokens, i) ? -polarity : polarity;
        }
        return score;
    }

    private boolean isNegated(String[] tokens, int index) {
        for (int back = 1; back <= NEGATION_WINDOW && index - back >= 0; back++) {
            if (NEGATORS.contains(tokens[index - back])) {
                return true;
            }
        }
        return false;
    }
}
