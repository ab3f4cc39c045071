package com.trendearly.pipeline.extractor;

import com.trendearly.pipeline.dto.CandidateKeyword;
import com.trendearly.pipeline.entity.KeywordType;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class KeywordNormalizerTest {

    private final KeywordNormalizer normalizer = new KeywordNormalizer();

    @Test
    void trimsCasefoldsAndCollapsesWhitespace() {
        assertThat(normalizer.normalize("  AI   Agents \t")).contains("ai agents");
    }

    @Test
    void stripsHashControlCharsAndEdgePunctuation() {
        assertThat(normalizer.normalize("#GlowUp!")).contains("glowup");
        assertThat(normalizer.normalize("...skin\u0000care?")).contains("skin care");
        assertThat(normalizer.normalize("## double")).contains("double");
    }

    @Test
    void foldsCaseBeyondSimpleLowercase() {
        assertThat(normalizer.normalize("Straße")).contains("strasse");
        assertThat(normalizer.normalizeAll(List.of("STRASSE", "straße"))).hasSize(1);
    }

    @Test
    void blankInputNormalizesToEmpty() {
        assertThat(normalizer.normalize(null)).isEmpty();
        assertThat(normalizer.normalize("   ")).isEmpty();
        assertThat(normalizer.normalize("#!?")).isEmpty();
    }

    @Test
    void hashPrefixMeansHashtag() {
        assertThat(normalizer.detectType("#fyp")).isEqualTo(KeywordType.HASHTAG);
        assertThat(normalizer.detectType(" #fyp")).isEqualTo(KeywordType.HASHTAG);
        assertThat(normalizer.detectType("fyp")).isEqualTo(KeywordType.KEYWORD);
    }

    @Test
    void deduplicatesCaseVariantsKeepingFirst() {
        List<CandidateKeyword> result = normalizer.normalizeAll(
                Arrays.asList("Matcha Latte", "#matcha latte", "matcha  latte", null, "", "Cold Plunge"));

        assertThat(result).containsExactly(
                new CandidateKeyword("matcha latte", KeywordType.KEYWORD),
                new CandidateKeyword("cold plunge", KeywordType.KEYWORD));
    }
}
