package com.festivalplatform.domain.webhooks.delivery;

import com.festivalplatform.domain.webhooks.WebhookDomainException;
import java.util.EnumSet;
import java.util.Map;

public final class DeliveryStateMachine {
  private static final Map<DeliveryStatus, EnumSet<DeliveryStatus>> ALLOWED_TRANSITIONS =
      Map.of(
          DeliveryStatus.PENDING,
              EnumSet.of(DeliveryStatus.DELIVERED, DeliveryStatus.RETRYING, DeliveryStatus.FAILED),
          DeliveryStatus.RETRYING,
              EnumSet.of(DeliveryStatus.DELIVERED, DeliveryStatus.RETRYING, DeliveryStatus.FAILED),
          DeliveryStatus.DELIVERED, EnumSet.noneOf(DeliveryStatus.class),
          DeliveryStatus.FAILED, EnumSet.noneOf(DeliveryStatus.class));

  // Operator reset back to PENDING sits outside the automatic lifecycle.
  private static final EnumSet<DeliveryStatus> MANUAL_RESET_SOURCES =
      EnumSet.of(DeliveryStatus.PENDING, DeliveryStatus.RETRYING, DeliveryStatus.FAILED);

  private DeliveryStateMachine() {}

  public static boolean canTransition(DeliveryStatus from, DeliveryStatus to) {
    if (from == null || to == null) {
      return false;
    }
    EnumSet<DeliveryStatus> allowed = ALLOWED_TRANSITIONS.get(from);
    return allowed != null && allowed.contains(to);
  }

  public static void validateTransition(DeliveryStatus from, DeliveryStatus to) {
    if (!canTransition(from, to)) {
      throw new WebhookDomainException(
          "Invalid delivery status transition from " + from + " to " + to);
    }
  }

  public static boolean canResetManually(DeliveryStatus from) {
    return from != null && MANUAL_RESET_SOURCES.contains(from);
  }
}
