package com.festivalplatform.domain.webhooks.event.payload;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OrderRefundedV1(
    String orderId,
    String userId,
    String refundId,
    BigDecimal refundedAmount,
    String currency,
    String reason,
    Instant refundedAt) {}
