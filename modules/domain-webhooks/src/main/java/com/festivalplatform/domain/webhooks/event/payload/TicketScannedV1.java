package com.festivalplatform.domain.webhooks.event.payload;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TicketScannedV1(
    String ticketId,
    String ticketTypeId,
    String holderId,
    String gate,
    String scanResult,
    Instant scannedAt) {}
