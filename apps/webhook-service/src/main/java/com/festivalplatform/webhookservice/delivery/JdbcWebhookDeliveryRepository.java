package com.festivalplatform.webhookservice.delivery;

import com.festivalplatform.domain.webhooks.delivery.DeliveryAttempt;
import com.festivalplatform.domain.webhooks.delivery.DeliveryStatus;
import com.festivalplatform.domain.webhooks.delivery.WebhookDelivery;
import com.festivalplatform.domain.webhooks.event.EventType;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcWebhookDeliveryRepository implements WebhookDeliveryRepository {
  private static final String SELECT_COLUMNS =
      """
      SELECT id,
             webhook_id,
             tenant_id,
             event_id,
             event_type,
             target_url,
             payload,
             signature,
             status,
             attempt_count,
             max_attempts,
             next_retry_at,
             delivered_at,
             last_error,
             created_at,
             updated_at
      FROM webhook_deliveries
      """;

  private static final String STATS_COLUMNS =
      """
      SELECT COUNT(*) AS total,
             COUNT(*) FILTER (WHERE status = 'DELIVERED') AS delivered,
             COUNT(*) FILTER (WHERE status = 'FAILED') AS failed,
             COUNT(*) FILTER (WHERE status = 'PENDING') AS pending,
             COUNT(*) FILTER (WHERE status = 'RETRYING') AS retrying,
             COALESCE(AVG(attempt_count), 0) AS avg_attempts
      FROM webhook_deliveries
      """;

  private final JdbcTemplate jdbcTemplate;

  public JdbcWebhookDeliveryRepository(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  @Override
  public void insert(WebhookDelivery delivery) {
    String sql =
        """
        INSERT INTO webhook_deliveries (
            id, webhook_id, tenant_id, event_id, event_type, target_url, payload, signature,
            status, attempt_count, max_attempts, next_retry_at, delivered_at, last_error,
            created_at, updated_at
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;
    jdbcTemplate.update(
        sql,
        delivery.id(),
        delivery.webhookId(),
        delivery.tenantId(),
        delivery.eventId(),
        delivery.eventType().wireName(),
        delivery.targetUrl(),
        delivery.payload(),
        delivery.signature(),
        delivery.status().name(),
        delivery.attemptCount(),
        delivery.maxAttempts(),
        toTimestamp(delivery.nextRetryAt()),
        toTimestamp(delivery.deliveredAt()),
        delivery.lastError(),
        toTimestamp(delivery.createdAt()),
        toTimestamp(delivery.updatedAt()));
  }

  @Override
  public boolean updateIfUnchanged(
      WebhookDelivery next, DeliveryStatus expectedStatus, int expectedAttemptCount) {
    String sql =
        """
        UPDATE webhook_deliveries
        SET status = ?,
            attempt_count = ?,
            next_retry_at = ?,
            delivered_at = ?,
            last_error = ?,
            updated_at = ?
        WHERE id = ?
          AND status = ?
          AND attempt_count = ?
        """;
    int updated =
        jdbcTemplate.update(
            sql,
            next.status().name(),
            next.attemptCount(),
            toTimestamp(next.nextRetryAt()),
            toTimestamp(next.deliveredAt()),
            next.lastError(),
            toTimestamp(next.updatedAt()),
            next.id(),
            expectedStatus.name(),
            expectedAttemptCount);
    return updated > 0;
  }

  @Override
  public Optional<WebhookDelivery> findById(UUID id) {
    List<WebhookDelivery> rows =
        jdbcTemplate.query(SELECT_COLUMNS + " WHERE id = ?", this::mapRow, id);
    return rows.stream().findFirst();
  }

  @Override
  public List<WebhookDelivery> findByWebhookId(UUID webhookId, int offset, int limit) {
    return jdbcTemplate.query(
        SELECT_COLUMNS + " WHERE webhook_id = ? ORDER BY created_at DESC, id DESC LIMIT ? OFFSET ?",
        this::mapRow,
        webhookId,
        limit,
        offset);
  }

  @Override
  public long countByWebhookId(UUID webhookId) {
    Long count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM webhook_deliveries WHERE webhook_id = ?", Long.class, webhookId);
    return count == null ? 0L : count;
  }

  @Override
  public List<UUID> findPendingIds(Instant createdBefore, int limit) {
    String sql =
        """
        SELECT id
        FROM webhook_deliveries
        WHERE status = 'PENDING'
          AND created_at <= ?
        ORDER BY created_at ASC
        LIMIT ?
        """;
    return jdbcTemplate.query(
        sql, (rs, rowNum) -> rs.getObject("id", UUID.class), toTimestamp(createdBefore), limit);
  }

  @Override
  public List<UUID> findDueRetryIds(Instant now, int limit) {
    String sql =
        """
        SELECT id
        FROM webhook_deliveries
        WHERE status = 'RETRYING'
          AND next_retry_at <= ?
        ORDER BY next_retry_at ASC
        LIMIT ?
        """;
    return jdbcTemplate.query(
        sql, (rs, rowNum) -> rs.getObject("id", UUID.class), toTimestamp(now), limit);
  }

  @Override
  public void appendAttempt(DeliveryAttempt attempt) {
    String sql =
        """
        INSERT INTO webhook_delivery_attempts (
            id, delivery_id, attempt_number, status_code, response_body, response_time_ms,
            success, error, attempted_at
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;
    jdbcTemplate.update(
        sql,
        attempt.id(),
        attempt.deliveryId(),
        attempt.attemptNumber(),
        attempt.statusCode(),
        attempt.responseBody(),
        attempt.responseTimeMillis(),
        attempt.success(),
        attempt.error(),
        toTimestamp(attempt.attemptedAt()));
  }

  @Override
  public List<DeliveryAttempt> findAttempts(UUID deliveryId) {
    String sql =
        """
        SELECT id,
               delivery_id,
               attempt_number,
               status_code,
               response_body,
               response_time_ms,
               success,
               error,
               attempted_at
        FROM webhook_delivery_attempts
        WHERE delivery_id = ?
        ORDER BY attempted_at ASC, attempt_number ASC
        """;
    return jdbcTemplate.query(sql, this::mapAttempt, deliveryId);
  }

  @Override
  public int deleteTerminalCreatedBefore(Instant cutoff) {
    String sql =
        """
        DELETE FROM webhook_deliveries
        WHERE status IN ('DELIVERED', 'FAILED')
          AND created_at < ?
        """;
    return jdbcTemplate.update(sql, toTimestamp(cutoff));
  }

  @Override
  public DeliveryStats statsForWebhook(UUID webhookId, Instant since) {
    return jdbcTemplate.queryForObject(
        STATS_COLUMNS + " WHERE webhook_id = ? AND created_at >= ?",
        this::mapStats,
        webhookId,
        toTimestamp(since));
  }

  @Override
  public DeliveryStats statsForTenant(UUID tenantId, Instant since) {
    return jdbcTemplate.queryForObject(
        STATS_COLUMNS + " WHERE tenant_id = ? AND created_at >= ?",
        this::mapStats,
        tenantId,
        toTimestamp(since));
  }

  private WebhookDelivery mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new WebhookDelivery(
        rs.getObject("id", UUID.class),
        rs.getObject("webhook_id", UUID.class),
        rs.getObject("tenant_id", UUID.class),
        rs.getObject("event_id", UUID.class),
        EventType.requireWireName(rs.getString("event_type")),
        rs.getString("target_url"),
        rs.getString("payload"),
        rs.getString("signature"),
        DeliveryStatus.valueOf(rs.getString("status")),
        rs.getInt("attempt_count"),
        rs.getInt("max_attempts"),
        toInstant(rs.getTimestamp("next_retry_at")),
        toInstant(rs.getTimestamp("delivered_at")),
        rs.getString("last_error"),
        rs.getTimestamp("created_at").toInstant(),
        rs.getTimestamp("updated_at").toInstant());
  }

  private DeliveryAttempt mapAttempt(ResultSet rs, int rowNum) throws SQLException {
    return new DeliveryAttempt(
        rs.getObject("id", UUID.class),
        rs.getObject("delivery_id", UUID.class),
        rs.getInt("attempt_number"),
        rs.getObject("status_code", Integer.class),
        rs.getString("response_body"),
        rs.getLong("response_time_ms"),
        rs.getBoolean("success"),
        rs.getString("error"),
        rs.getTimestamp("attempted_at").toInstant());
  }

  private DeliveryStats mapStats(ResultSet rs, int rowNum) throws SQLException {
    return DeliveryStats.of(
        rs.getLong("total"),
        rs.getLong("delivered"),
        rs.getLong("failed"),
        rs.getLong("pending"),
        rs.getLong("retrying"),
        rs.getDouble("avg_attempts"));
  }

  private static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  private static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
