package com.festivalplatform.domain.webhooks.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Map;

/** Wire shape of the JSON body posted to subscribers. */
@JsonPropertyOrder({"id", "type", "tenant_id", "timestamp", "api_version", "data"})
public record EventPayload(
    @JsonProperty("id") String id,
    @JsonProperty("type") String type,
    @JsonProperty("tenant_id") String tenantId,
    @JsonProperty("timestamp") String timestamp,
    @JsonProperty("api_version") String apiVersion,
    @JsonProperty("data") Map<String, Object> data) {}
