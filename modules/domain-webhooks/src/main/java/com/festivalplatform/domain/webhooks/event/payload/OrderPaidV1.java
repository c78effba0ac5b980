package com.festivalplatform.domain.webhooks.event.payload;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OrderPaidV1(
    String orderId,
    String userId,
    BigDecimal amount,
    String currency,
    String paymentMethod,
    String paymentReference,
    Instant paidAt) {}
