package com.coursesync.scrape.http;

import com.coursesync.config.ScraperProperties;
import com.coursesync.scrape.model.UpstreamEndpoint;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class UpstreamCostTable {
    private final ScraperProperties.RateLimit config;

    public UpstreamCostTable(ScraperProperties properties) {
        this.config = properties.getRateLimit();
    }

    public double costOf(UpstreamEndpoint endpoint) {
        Map<String, Double> costs = config.getCosts();
        Double cost = costs == null ? null : costs.get(endpoint.configKey());
        if (cost == null || cost < 0) {
            return config.getDefaultCost();
        }
        return cost;
    }

    /**
     * Search cost scales with the number of records the page is expected to return.
     */
    public double searchCost(int expectedRecords) {
        return costOf(UpstreamEndpoint.SEARCH) + Math.max(0, expectedRecords) * config.getSearchCostPerRecord();
    }
}
