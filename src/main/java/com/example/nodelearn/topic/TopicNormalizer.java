package com.example.nodelearn.topic;

import com.example.nodelearn.error.InvalidTopicException;
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Canonicalizes raw topic text so that spelling variants of one concept compare equal.
 * Pure and stateless.
 */
@Component
public class TopicNormalizer {

    // Hyphens are kept: "self-attention" stays one token.
    private static final String STRIPPED_PUNCTUATION = "!\"#$%&'()*+,./:;<=>?@[\\]^_`{|}~‘’“”«»¿¡";
    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern HYPHENS_ONLY = Pattern.compile("-+");

    // Letters NFD does not decompose into base + mark.
    private static final Map<Character, String> LIGATURES = Map.of(
            'ø', "o",
            'æ', "ae",
            'œ', "oe",
            'ł', "l",
            'đ', "d",
            'ß', "ss",
            'þ', "th",
            'ı', "i"
    );

    /**
     * @throws InvalidTopicException when nothing is left after normalization
     */
    public Topic normalize(String raw) {
        String key = canonicalKey(raw);
        if (key.isEmpty()) {
            throw new InvalidTopicException("Topic is empty after normalization: '" + raw + "'");
        }
        String display = WHITESPACE.matcher(raw.strip()).replaceAll(" ");
        return new Topic(key, display);
    }

    /**
     * Normalized form of {@code raw}, or the empty string when nothing survives.
     */
    public String canonicalKey(String raw) {
        if (raw == null) {
            return "";
        }
        String folded = COMBINING_MARKS.matcher(Normalizer.normalize(raw, Normalizer.Form.NFD)).replaceAll("");
        folded = folded.toLowerCase(Locale.ROOT);

        StringBuilder sb = new StringBuilder(folded.length());
        for (int i = 0; i < folded.length(); i++) {
            char c = folded.charAt(i);
            if (STRIPPED_PUNCTUATION.indexOf(c) >= 0) {
                continue;
            }
            String replacement = LIGATURES.get(c);
            if (replacement != null) {
                sb.append(replacement);
            } else {
                sb.append(c);
            }
        }
        return WHITESPACE.matcher(sb.toString().strip()).replaceAll(" ");
    }

    /**
     * Distinct normalized tokens of free text, in first-occurrence order. Blank input yields an empty list.
     */
    public List<String> tokenize(String text) {
        String key = canonicalKey(text);
        if (key.isEmpty()) {
            return List.of();
        }
        Set<String> tokens = new LinkedHashSet<>();
        for (String token : key.split(" ")) {
            if (!token.isEmpty() && !HYPHENS_ONLY.matcher(token).matches()) {
                tokens.add(token);
            }
        }
        return new ArrayList<>(tokens);
    }
}
