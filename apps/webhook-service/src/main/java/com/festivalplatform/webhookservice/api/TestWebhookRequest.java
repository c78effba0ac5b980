package com.festivalplatform.webhookservice.api;

import java.util.Map;

public record TestWebhookRequest(String eventType, Map<String, Object> data) {}
