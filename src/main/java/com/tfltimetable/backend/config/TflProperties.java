package com.tfltimetable.backend.config;

import lombok.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Transport, auth and stop point conventions for every outbound TfL call.
 * Bound once at startup and shared read-only by the client and the resolver.
 */
@Value
@ConfigurationProperties(prefix = "tfl")
public class TflProperties {

    String baseUrl;

    // Sent as the app_key query parameter; calls go out anonymously when blank
    String appKey;

    String userAgent;

    int timeoutSeconds;

    String hubPrefix;

    // 940G = London Underground platform NaPTAN
    String platformPrefix;

    // Real stop ids used to pad single-id batch requests, tried in order
    List<String> paddingStopIds;

    int maxHubDepth;

    public boolean isHub(String stopPointId) {
        return stopPointId != null && stopPointId.startsWith(hubPrefix);
    }

    public boolean isPlatform(String stopPointId) {
        return stopPointId != null && stopPointId.startsWith(platformPrefix);
    }

    public boolean hasAppKey() {
        return appKey != null && !appKey.isBlank();
    }
}
