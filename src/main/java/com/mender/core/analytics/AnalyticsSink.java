package com.mender.core.analytics;

/**
 * Destination for product analytics events.
 */
public interface AnalyticsSink {

    void track(AnalyticsEvent event);
}
