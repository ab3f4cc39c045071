package com.trendearly.pipeline.extractor;

import com.trendearly.pipeline.dto.CandidateKeyword;
import com.trendearly.pipeline.entity.KeywordType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

@Component
public class KeywordNormalizer {

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x1f\\x7f-\\x9f]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final String EDGE_PUNCTUATION = ".,!?;:";

    /**
     * trim, casefold, collapse whitespace; also drops control characters, a leading '#', and
     * punctuation at either end.
     *
     * @return empty if nothing is left
     */
    public Optional<String> normalize(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String text = CONTROL_CHARS.matcher(raw).replaceAll(" ");
        text = WHITESPACE.matcher(text).replaceAll(" ").trim();
        while (text.startsWith("#")) {
            text = text.substring(1).trim();
        }
        text = casefold(stripEdges(text));
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    public KeywordType detectType(String raw) {
        return raw != null && raw.trim().startsWith("#") ? KeywordType.HASHTAG : KeywordType.KEYWORD;
    }

    /**
     * Normalizes and de-duplicates, keeping the first occurrence of each text (and its type).
     */
    public List<CandidateKeyword> normalizeAll(Collection<String> raws) {
        Map<String, CandidateKeyword> unique = new LinkedHashMap<>();
        for (String raw : raws) {
            normalize(raw).ifPresent(text ->
                    unique.putIfAbsent(text, new CandidateKeyword(text, detectType(raw))));
        }
        return new ArrayList<>(unique.values());
    }

    // upper 후 lower: "ß" -> "ss" 처럼 대소문자 변환으로 길이가 바뀌는 문자까지 통일
    static String casefold(String text) {
        return text.toUpperCase(Locale.ROOT).toLowerCase(Locale.ROOT);
    }

    private String stripEdges(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && EDGE_PUNCTUATION.indexOf(text.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && EDGE_PUNCTUATION.indexOf(text.charAt(end - 1)) >= 0) {
            end--;
        }
        return text.substring(start, end).trim();
    }
}
