package com.example.resource.api.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

public record SystemStatsResponse(
    @JsonProperty("total_resources") int totalResources,
    @JsonProperty("user_resources_count") int userResourcesCount,
    @JsonProperty("admin_resources_count") int adminResourcesCount,
    @JsonProperty("system_uptime") String systemUptime,
    @JsonProperty("uptime_seconds") long uptimeSeconds,
    @JsonProperty("last_updated") Instant lastUpdated) {}
