package com.trendearly.pipeline.crawler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trendearly.pipeline.config.PipelineProperties;
import com.trendearly.pipeline.exception.InfrastructureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.List;

/**
 * Trending keyword and hashtag lists from the Creative Center popular-trend API.
 * Hashtags are returned with a leading {@code #} so the type survives normalization.
 */
@Slf4j
@Component
public class CreativeCenterKeywordSource implements KeywordSource {

    private static final String KEYWORD_PATH = "/creative_radar_api/v1/popular_trend/keyword/list";
    private static final String HASHTAG_PATH = "/creative_radar_api/v1/popular_trend/hashtag/list";
    private static final String USER_AGENT = "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36";

    private final HttpClient client;
    private final ObjectMapper mapper;
    private final PipelineProperties.Ingestion props;

    public CreativeCenterKeywordSource(HttpClient client, ObjectMapper mapper, PipelineProperties properties) {
        this.client = client;
        this.mapper = mapper;
        this.props = properties.getIngestion();
    }

    @Override
    public List<String> fetchCandidateKeywords(Integer limit) {
        int perList = limit == null ? props.getLimitPerList() : Math.min(limit, props.getLimitPerList());

        List<String> candidates = new ArrayList<>();
        int failedLists = 0;

        try {
            candidates.addAll(extract(fetch(KEYWORD_PATH, perList), "keyword", ""));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InfrastructureException("Interrupted while fetching trending keywords", e);
        } catch (Exception e) {
            failedLists++;
            log.error("[Ingest] Failed to fetch trending keywords", e);
        }

        try {
            candidates.addAll(extract(fetch(HASHTAG_PATH, perList), "hashtag", "#"));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InfrastructureException("Interrupted while fetching trending hashtags", e);
        } catch (Exception e) {
            failedLists++;
            log.error("[Ingest] Failed to fetch trending hashtags", e);
        }

        if (failedLists == 2) {
            throw new InfrastructureException("Keyword source unreachable: every trend list failed");
        }

        log.info("[Ingest] fetched {} raw candidates", candidates.size());
        if (limit != null && candidates.size() > limit) {
            return List.copyOf(candidates.subList(0, limit));
        }
        return candidates;
    }

    private JsonNode fetch(String path, int limit) throws Exception {
        String url = props.getBaseUrl() + path + "?limit=" + limit + "&period=" + props.getPeriodDays();
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .header("User-Agent", USER_AGENT)
                .header("Accept", "application/json")
                .GET()
                .build();

        HttpResponse<String> res = client.send(request, HttpResponse.BodyHandlers.ofString());
        if (res.statusCode() / 100 != 2) {
            throw new IllegalStateException("status=" + res.statusCode() + " path=" + path);
        }
        return mapper.readTree(res.body());
    }

    List<String> extract(JsonNode root, String primaryField, String prefix) {
        JsonNode items = root.path("data").path("list");
        if (!items.isArray() || items.isEmpty()) {
            items = root.path("list");
        }

        List<String> out = new ArrayList<>();
        for (JsonNode item : items) {
            String text = null;
            if (item.isTextual()) {
                text = item.asText();
            } else if (item.isObject()) {
                text = firstText(item, primaryField, "name", "text");
            }
            if (text != null && !text.isBlank()) {
                out.add(prefix.isEmpty() || text.startsWith(prefix) ? text : prefix + text);
            }
        }
        return out;
    }

    private String firstText(JsonNode item, String... fields) {
        for (String field : fields) {
            JsonNode node = item.get(field);
            if (node != null && node.isTextual() && !node.asText().isBlank()) {
                return node.asText();
            }
        }
        return null;
    }
}
