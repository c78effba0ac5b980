package com.festivalplatform.domain.webhooks.event.payload;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record WalletTopupV1(
    String walletId,
    String userId,
    BigDecimal amount,
    String currency,
    BigDecimal balanceAfter,
    String paymentMethod,
    Instant toppedUpAt) {}
