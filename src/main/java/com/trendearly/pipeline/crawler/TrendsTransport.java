package com.trendearly.pipeline.crawler;

import com.trendearly.pipeline.exception.TransportException;

import java.util.List;

/**
 * Raw external lookup of a weekly interest series. No rate limiting and no retry here.
 */
public interface TrendsTransport {

    /**
     * @return weekly values, oldest first, newest last
     */
    List<Double> fetch(String keyword, String geo, String timeframe) throws TransportException;
}
