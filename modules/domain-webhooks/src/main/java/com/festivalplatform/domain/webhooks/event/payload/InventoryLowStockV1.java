package com.festivalplatform.domain.webhooks.event.payload;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record InventoryLowStockV1(
    String itemId,
    String itemName,
    String standId,
    int currentQuantity,
    int thresholdQuantity,
    Instant detectedAt) {}
