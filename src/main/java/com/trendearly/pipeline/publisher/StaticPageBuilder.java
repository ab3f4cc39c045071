package com.trendearly.pipeline.publisher;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.trendearly.pipeline.dto.KeywordPage;
import com.trendearly.pipeline.entity.DailySnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders snapshots and their cached series into a static tree:
 * {@code index.html}, {@code style.css}, {@code keywords/<id>/index.html}, {@code data/keywords.json}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StaticPageBuilder {

    private static final String SITE_NAME = "TrendEarly";

    private static final String STYLESHEET = """
            body { font-family: -apple-system, BlinkMacSystemFont, 'Segoe UI', Roboto, sans-serif; line-height: 1.6; color: #333; max-width: 1200px; margin: 0 auto; padding: 20px; background: #f5f5f5; }
            .container { background: white; border-radius: 8px; padding: 30px; box-shadow: 0 2px 4px rgba(0,0,0,0.1); }
            h1 { margin-top: 0; color: #2563eb; }
            .score { font-size: 3em; font-weight: bold; color: #2563eb; margin: 20px 0; }
            .metrics { display: grid; grid-template-columns: repeat(auto-fit, minmax(200px, 1fr)); gap: 20px; margin: 30px 0; }
            .metric, .chart-container { padding: 15px; background: #f9fafb; border-radius: 6px; }
            .metric-label { font-size: 0.9em; color: #6b7280; }
            .metric-value { font-size: 1.5em; font-weight: bold; color: #111827; }
            .keywords-list { display: grid; gap: 15px; margin-top: 30px; }
            .keyword-item { display: flex; justify-content: space-between; padding: 20px; background: #f9fafb; border-radius: 6px; text-decoration: none; color: inherit; }
            .keyword-score { font-size: 2em; font-weight: bold; color: #2563eb; }
            .footer { margin-top: 40px; padding-top: 20px; border-top: 1px solid #e5e7eb; font-size: 0.9em; color: #6b7280; }
            """;

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public void build(Path outputDir, LocalDate date, List<KeywordPage> pages) throws IOException {
        List<KeywordPage> ranked = new ArrayList<>(pages);
        ranked.sort(Comparator.comparingInt((KeywordPage p) -> p.snapshot().getMomentumScore()).reversed());

        Files.createDirectories(outputDir);
        String generatedAt = clock.instant().toString();

        for (KeywordPage page : ranked) {
            Path dir = outputDir.resolve("keywords").resolve(String.valueOf(page.keyword().getId()));
            Files.createDirectories(dir);
            Files.writeString(dir.resolve("index.html"), renderKeywordPage(page, generatedAt), StandardCharsets.UTF_8);
        }

        Files.writeString(outputDir.resolve("index.html"), renderIndex(ranked, date, generatedAt), StandardCharsets.UTF_8);
        Files.writeString(outputDir.resolve("style.css"), STYLESHEET, StandardCharsets.UTF_8);

        Path dataDir = Files.createDirectories(outputDir.resolve("data"));
        objectMapper.writerWithDefaultPrettyPrinter()
                .writeValue(dataDir.resolve("keywords.json").toFile(), toJson(ranked, date));

        log.info("[Publish] built {} keyword pages for {} into {}", ranked.size(), date, outputDir);
    }

    String renderKeywordPage(KeywordPage page, String generatedAt) throws IOException {
        DailySnapshot s = page.snapshot();
        String keyword = escape(page.keyword().getText());
        List<Double> series = page.trends() == null ? List.of() : page.trends().getWeeklySeries();

        StringBuilder html = new StringBuilder();
        html.append(head(keyword + " - " + SITE_NAME));
        html.append("""
                <body>
                <div class="container">
                  <a href="/" class="back-link">&larr; Back to Home</a>
                  <h1>%s</h1>
                  <div class="score">%d/100</div>
                  <p>Last updated: %s</p>
                  <div class="metrics">
                    <div class="metric"><div class="metric-label">Lift</div><div class="metric-value">%s</div></div>
                    <div class="metric"><div class="metric-label">Acceleration</div><div class="metric-value">%s</div></div>
                    <div class="metric"><div class="metric-label">Novelty</div><div class="metric-value">%s%%</div></div>
                    <div class="metric"><div class="metric-label">Noise</div><div class="metric-value">%s</div></div>
                  </div>
                """.formatted(
                keyword,
                s.getMomentumScore(),
                s.getSnapshotDate(),
                format(s.getLift(), 2),
                format(s.getAcceleration(), 2),
                format(s.getNovelty() * 100, 1),
                format(s.getNoise(), 2)));

        if (!series.isEmpty()) {
            html.append("""
                      <div class="chart-container">
                        <h2>Search interest (weekly)</h2>
                        <script type="application/json" id="series">%s</script>
                      </div>
                    """.formatted(objectMapper.writeValueAsString(series)));
        }

        html.append(footer(generatedAt));
        return html.toString();
    }

    String renderIndex(List<KeywordPage> ranked, LocalDate date, String generatedAt) {
        StringBuilder html = new StringBuilder();
        html.append(head(SITE_NAME + " - Trending Keywords"));
        html.append("""
                <body>
                <div class="container">
                  <h1>%s - Trending Keywords</h1>
                  <p>Keywords ranked by momentum score for %s</p>
                  <div class="keywords-list">
                """.formatted(SITE_NAME, date));

        for (KeywordPage page : ranked) {
            html.append("""
                        <a href="/keywords/%d/" class="keyword-item"><span class="keyword-name">%s</span><span class="keyword-score">%d</span></a>
                    """.formatted(page.keyword().getId(), escape(page.keyword().getText()), page.snapshot().getMomentumScore()));
        }

        html.append("  </div>\n");
        html.append(footer(generatedAt));
        return html.toString();
    }

    private Map<String, Object> toJson(List<KeywordPage> ranked, LocalDate date) {
        List<Map<String, Object>> keywords = new ArrayList<>();
        for (KeywordPage page : ranked) {
            DailySnapshot s = page.snapshot();
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("id", page.keyword().getId());
            item.put("keyword", page.keyword().getText());
            item.put("type", page.keyword().getType().name().toLowerCase(Locale.ROOT));
            item.put("momentum_score", s.getMomentumScore());
            item.put("lift", s.getLift());
            item.put("acceleration", s.getAcceleration());
            item.put("novelty", s.getNovelty());
            item.put("noise", s.getNoise());
            keywords.add(item);
        }
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("date", date.toString());
        root.put("keywords", keywords);
        return root;
    }

    private String head(String title) {
        return """
                <!DOCTYPE html>
                <html lang="en">
                <head>
                  <meta charset="UTF-8">
                  <meta name="viewport" content="width=device-width, initial-scale=1.0">
                  <title>%s</title>
                  <link rel="stylesheet" href="/style.css">
                </head>
                """.formatted(title);
    }

    private String footer(String generatedAt) {
        return """
                  <div class="footer">
                    <p>Data source: Google Trends</p>
                    <p>Generated: %s</p>
                  </div>
                </div>
                </body>
                </html>
                """.formatted(generatedAt);
    }

    private static String format(double value, int decimals) {
        return String.format(Locale.ROOT, "%." + decimals + "f", value);
    }

    static String escape(String text) {
        StringBuilder out = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            switch (c) {
                case '<':
                    out.append("&lt;");
                    break;
                case '>':
                    out.append("&gt;");
                    break;
                case '&':
                    out.append("&amp;");
                    break;
                case '"':
                    out.append("&quot;");
                    break;
                case '\'':
                    out.append("&#39;");
                    break;
                default:
                    out.append(c);
            }
        }
        return out.toString();
    }
}
