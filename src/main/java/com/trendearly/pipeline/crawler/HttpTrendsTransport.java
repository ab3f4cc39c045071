package com.trendearly.pipeline.crawler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trendearly.pipeline.config.PipelineProperties;
import com.trendearly.pipeline.exception.TransportException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Interest-over-time lookup against a JSON endpoint shaped like
 * {@code {"data":[{"date":"2024-01-07","<keyword>":53,"isPartial":false}, ...]}}.
 */
@Slf4j
@Component
public class HttpTrendsTransport implements TrendsTransport {

    private static final String USER_AGENT = "trendearly-pipeline/1.0";

    private final HttpClient client;
    private final ObjectMapper mapper;
    private final PipelineProperties.Trends props;

    public HttpTrendsTransport(HttpClient client, ObjectMapper mapper, PipelineProperties properties) {
        this.client = client;
        this.mapper = mapper;
        this.props = properties.getTrends();
    }

    @Override
    public List<Double> fetch(String keyword, String geo, String timeframe) throws TransportException {
        String url = props.getBaseUrl()
                + "?q=" + encode(keyword)
                + "&geo=" + encode(geo)
                + "&timeframe=" + encode(timeframe);

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(props.getRequestTimeout())
                .header("User-Agent", USER_AGENT)
                .header("Accept", "application/json")
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new TransportException("Trends request failed for '" + keyword + "'", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while fetching '" + keyword + "'", e);
        }

        if (response.statusCode() / 100 != 2) {
            throw new TransportException("Trends returned status " + response.statusCode() + " for '" + keyword + "'");
        }

        List<Double> series = parseSeries(keyword, response.body());
        if (series.isEmpty()) {
            throw new TransportException("No data returned for '" + keyword + "'");
        }
        log.debug("[Trends] fetched {} points for '{}'", series.size(), keyword);
        return series;
    }

    List<Double> parseSeries(String keyword, String body) throws TransportException {
        JsonNode records;
        try {
            records = mapper.readTree(body).path("data");
        } catch (IOException e) {
            throw new TransportException("Malformed trends response for '" + keyword + "'", e);
        }

        List<Double> values = new ArrayList<>();
        for (JsonNode record : records) {
            JsonNode value = record.get(keyword);
            if (value == null || !value.isNumber()) {
                value = firstNumericColumn(record);
            }
            if (value != null) {
                values.add(value.asDouble());
            }
        }
        return values;
    }

    // 키워드 컬럼이 없으면 isPartial 을 제외한 첫 숫자 컬럼
    private JsonNode firstNumericColumn(JsonNode record) {
        Iterator<Map.Entry<String, JsonNode>> fields = record.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!"isPartial".equals(field.getKey()) && field.getValue().isNumber()) {
                return field.getValue();
            }
        }
        return null;
    }

    private String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }
}
