package com.festivalplatform.webhookservice.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.festivalplatform.domain.webhooks.event.EventType;
import com.festivalplatform.domain.webhooks.subscription.WebhookConfig;
import com.festivalplatform.domain.webhooks.subscription.WebhookStatus;
import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcWebhookConfigRepository implements WebhookConfigRepository {
  private static final TypeReference<Map<String, String>> HEADERS_TYPE = new TypeReference<>() {};

  private static final String SELECT_COLUMNS =
      """
      SELECT id,
             tenant_id,
             name,
             description,
             target_url,
             signing_secret,
             subscribed_event_types,
             custom_headers,
             status,
             max_retries,
             timeout_seconds,
             consecutive_failure_count,
             last_triggered_at,
             last_success_at,
             last_failure_at,
             created_by,
             created_at,
             updated_at
      FROM webhook_configs
      """;

  private final JdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  public JdbcWebhookConfigRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
    this.jdbcTemplate = jdbcTemplate;
    this.objectMapper = objectMapper;
  }

  @Override
  public void insert(WebhookConfig config) {
    String sql =
        """
        INSERT INTO webhook_configs (
            id, tenant_id, name, description, target_url, signing_secret,
            subscribed_event_types, custom_headers, status, max_retries, timeout_seconds,
            consecutive_failure_count, last_triggered_at, last_success_at, last_failure_at,
            created_by, created_at, updated_at
        ) VALUES (?, ?, ?, ?, ?, ?, CAST(? AS TEXT[]), CAST(? AS JSONB), ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;
    jdbcTemplate.update(
        sql,
        config.id(),
        config.tenantId(),
        config.name(),
        config.description(),
        config.targetUrl(),
        config.signingSecret(),
        toArrayLiteral(config.subscribedEventTypes()),
        toJson(config.customHeaders()),
        requestedStatus == null ? null : requestedStatus.name(),
        requestedStatus == null ? null : requestedStatus.name(),
        config.maxRetries(),
        config.timeoutSeconds(),
        config.consecutiveFailureCount(),
        toTimestamp(config.lastTriggeredAt()),
        toTimestamp(config.lastSuccessAt()),
        toTimestamp(config.lastFailureAt()),
        config.createdBy(),
        toTimestamp(config.createdAt()),
        toTimestamp(config.updatedAt()));
  }

  @Override
  public void updateSettings(WebhookConfig config, WebhookStatus requestedStatus) {
    String sql =
        """
        UPDATE webhook_configs
        SET name = ?,
            description = ?,
            target_url = ?,
            subscribed_event_types = CAST(? AS TEXT[]),
            custom_headers = CAST(? AS JSONB),
            status = COALESCE(CAST(? AS VARCHAR), status),
            consecutive_failure_count = CASE
                        WHEN CAST(? AS VARCHAR) = 'ACTIVE' THEN 0
                        ELSE consecutive_failure_count
                     END,
            max_retries = ?,
            timeout_seconds = ?,
            updated_at = ?
        WHERE id = ?
        """;
    jdbcTemplate.update(
        sql,
        config.name(),
        config.description(),
        config.targetUrl(),
        toArrayLiteral(config.subscribedEventTypes()),
        toJson(config.customHeaders()),
        requestedStatus == null ? null : requestedStatus.name(),
        requestedStatus == null ? null : requestedStatus.name(),
        config.maxRetries(),
        config.timeoutSeconds(),
        toTimestamp(config.updatedAt()),
        config.id());
  }

  @Override
  public void updateSecret(UUID id, String signingSecret, Instant updatedAt) {
    jdbcTemplate.update(
        "UPDATE webhook_configs SET signing_secret = ?, updated_at = ? WHERE id = ?",
        signingSecret,
        toTimestamp(updatedAt),
        id);
  }

  @Override
  public Optional<WebhookConfig> findById(UUID id) {
    List<WebhookConfig> rows =
        jdbcTemplate.query(SELECT_COLUMNS + " WHERE id = ?", this::mapRow, id);
    return rows.stream().findFirst();
  }

  @Override
  public List<WebhookConfig> findByTenantId(UUID tenantId) {
    return jdbcTemplate.query(
        SELECT_COLUMNS + " WHERE tenant_id = ? ORDER BY created_at DESC, id DESC",
        this::mapRow,
        tenantId);
  }

  @Override
  public List<WebhookConfig> findDispatchable(UUID tenantId, EventType eventType) {
    String sql =
        SELECT_COLUMNS
            + """
             WHERE tenant_id = ?
               AND status = 'ACTIVE'
               AND subscribed_event_types @> ARRAY[CAST(? AS TEXT)]
             ORDER BY created_at ASC
            """;
    return jdbcTemplate.query(sql, this::mapRow, tenantId, eventType.wireName());
  }

  @Override
  public boolean deleteById(UUID id) {
    return jdbcTemplate.update("DELETE FROM webhook_configs WHERE id = ?", id) > 0;
  }

  @Override
  public void markTriggered(UUID id, Instant triggeredAt) {
    jdbcTemplate.update(
        "UPDATE webhook_configs SET last_triggered_at = ? WHERE id = ?",
        toTimestamp(triggeredAt),
        id);
  }

  @Override
  public void incrementFailure(UUID id, Instant failedAt) {
    String sql =
        """
        UPDATE webhook_configs
        SET consecutive_failure_count = consecutive_failure_count + 1,
            status = CASE
                        WHEN status = 'ACTIVE' AND consecutive_failure_count + 1 >= ? THEN 'FAILING'
                        ELSE status
                     END,
            last_failure_at = ?,
            updated_at = ?
        WHERE id = ?
        """;
    Timestamp at = toTimestamp(failedAt);
    jdbcTemplate.update(sql, WebhookConfig.FAILING_THRESHOLD, at, at, id);
  }

  @Override
  public void resetFailureCount(UUID id, Instant succeededAt) {
    String sql =
        """
        UPDATE webhook_configs
        SET consecutive_failure_count = 0,
            status = CASE WHEN status = 'FAILING' THEN 'ACTIVE' ELSE status END,
            last_success_at = ?,
            updated_at = ?
        WHERE id = ?
        """;
    Timestamp at = toTimestamp(succeededAt);
    jdbcTemplate.update(sql, at, at, id);
  }

  private WebhookConfig mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new WebhookConfig(
        rs.getObject("id", UUID.class),
        rs.getObject("tenant_id", UUID.class),
        rs.getString("name"),
        rs.getString("description"),
        rs.getString("target_url"),
        rs.getString("signing_secret"),
        readEventTypes(rs.getArray("subscribed_event_types")),
        readHeaders(rs.getString("custom_headers")),
        WebhookStatus.valueOf(rs.getString("status")),
        rs.getInt("max_retries"),
        rs.getInt("timeout_seconds"),
        rs.getInt("consecutive_failure_count"),
        toInstant(rs.getTimestamp("last_triggered_at")),
        toInstant(rs.getTimestamp("last_success_at")),
        toInstant(rs.getTimestamp("last_failure_at")),
        rs.getString("created_by"),
        rs.getTimestamp("created_at").toInstant(),
        rs.getTimestamp("updated_at").toInstant());
  }

  // Unknown wire names are skipped so a rolled-back catalog entry does not break reads.
  private static Set<EventType> readEventTypes(Array array) throws SQLException {
    Set<EventType> types = EnumSet.noneOf(EventType.class);
    if (array == null) {
      return types;
    }
    for (Object value : (Object[]) array.getArray()) {
      EventType.fromWireName(String.valueOf(value)).ifPresent(types::add);
    }
    return types;
  }

  private Map<String, String> readHeaders(String json) {
    if (json == null || json.isBlank()) {
      return Map.of();
    }
    try {
      return objectMapper.readValue(json, HEADERS_TYPE);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to read webhook custom headers", ex);
    }
  }

  private String toJson(Map<String, String> headers) {
    try {
      return objectMapper.writeValueAsString(headers == null ? Map.of() : headers);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to serialize webhook custom headers", ex);
    }
  }

  // Wire names only contain [a-z._], so no quoting is needed inside the literal.
  private static String toArrayLiteral(Set<EventType> types) {
    return types.stream()
        .map(EventType::wireName)
        .sorted()
        .collect(Collectors.joining(",", "{", "}"));
  }

  private static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  private static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
