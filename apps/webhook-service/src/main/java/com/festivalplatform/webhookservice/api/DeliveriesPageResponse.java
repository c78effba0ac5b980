package com.festivalplatform.webhookservice.api;

import java.util.List;

public record DeliveriesPageResponse(
    List<DeliveryResponse> deliveries, int page, int size, long totalElements, int totalPages) {}
