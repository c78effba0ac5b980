package com.festivalplatform.domain.webhooks.event.payload;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OrderCreatedV1(
    String orderId,
    String userId,
    String standId,
    BigDecimal amount,
    String currency,
    int itemCount,
    Instant createdAt) {}
