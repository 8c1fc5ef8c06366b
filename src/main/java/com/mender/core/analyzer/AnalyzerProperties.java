package com.mender.core.analyzer;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "mender.analyzer")
public class AnalyzerProperties {

    /** Where the handler for an endpoint lives; {@code {endpoint}} is replaced by the endpoint path. */
    private String routeFileTemplate = "src/app{endpoint}/route.ts";

    /** Globs of UI sources scanned for links to a failing endpoint. */
    private List<String> uiSources = new ArrayList<>(List.of(
            "src/components/*.tsx",
            "src/components/**/*.tsx"));

    /** Page that broken links are redirected to. */
    private String fallbackRoute = "/dashboard/sandbox";

    public String getRouteFileTemplate() {
        return routeFileTemplate;
    }

    public void setRouteFileTemplate(String routeFileTemplate) {
        this.routeFileTemplate = routeFileTemplate;
    }

    public List<String> getUiSources() {
        return uiSources;
    }

    public void setUiSources(List<String> uiSources) {
        this.uiSources = uiSources;
    }

    public String getFallbackRoute() {
        return fallbackRoute;
    }

    public void setFallbackRoute(String fallbackRoute) {
        this.fallbackRoute = fallbackRoute;
    }

    public String routeFileFor(String endpoint) {
        return routeFileTemplate.replace("{endpoint}", endpoint);
    }
}
