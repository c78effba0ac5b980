package com.festivalplatform.webhookservice.delivery;

import com.festivalplatform.domain.webhooks.delivery.WebhookDelivery;
import java.util.List;

public record DeliveryPage(
    List<WebhookDelivery> deliveries, int page, int size, long totalElements, int totalPages) {}
