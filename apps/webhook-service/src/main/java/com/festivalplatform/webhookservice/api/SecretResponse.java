package com.festivalplatform.webhookservice.api;

import java.util.UUID;

public record SecretResponse(UUID webhookId, String secret) {}
