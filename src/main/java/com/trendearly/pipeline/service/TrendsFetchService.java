package com.trendearly.pipeline.service;

import com.trendearly.pipeline.crawler.TrendsTransport;
import com.trendearly.pipeline.exception.FetchException;
import com.trendearly.pipeline.exception.TransportException;
import com.trendearly.pipeline.ratelimit.RateGate;
import com.trendearly.pipeline.ratelimit.RetryPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Rate-limited, retrying weekly series lookup. Every attempt, retries included, passes the
 * shared {@link RateGate}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TrendsFetchService {

    private final TrendsTransport transport;
    private final RateGate rateGate;
    private final RetryPolicy retryPolicy;

    public List<Double> fetch(String keyword, String geo, String timeframe) throws FetchException {
        try {
            List<Double> series = retryPolicy.execute("trends:" + keyword, attempt -> {
                rateGate.acquire();
                log.debug("[Trends] fetching '{}' attempt={}", keyword, attempt);
                return transport.fetch(keyword, geo, timeframe);
            });
            log.info("[Trends] fetched '{}' ({} points)", keyword, series.size());
            return series;
        } catch (TransportException e) {
            throw new FetchException("Trends lookup failed for '" + keyword + "' after "
                    + retryPolicy.getMaxAttempts() + " attempts: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException("Interrupted while fetching '" + keyword + "'", e);
        }
    }
}
