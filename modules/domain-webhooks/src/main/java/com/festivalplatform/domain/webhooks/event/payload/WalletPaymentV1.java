package com.festivalplatform.domain.webhooks.event.payload;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record WalletPaymentV1(
    String walletId,
    String userId,
    String standId,
    String transactionId,
    BigDecimal amount,
    String currency,
    BigDecimal balanceAfter,
    Instant paidAt) {}
