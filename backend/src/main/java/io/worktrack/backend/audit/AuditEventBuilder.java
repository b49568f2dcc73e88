package io.worktrack.backend.audit;

import io.worktrack.backend.security.ActingUser;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Builder that constructs an {@link AuditEventRecord}.
 *
 * <p>Required fields: {@code eventType}, {@code entityType}, {@code entityId}. When an actor is
 * given the event is attributed to that user ({@code actorType = USER}); otherwise it is recorded
 * as a {@code SYSTEM} event. {@code source} defaults to {@code API}.
 *
 * <pre>{@code
 * AuditEventRecord record = AuditEventBuilder.builder()
 *     .eventType("time_entry.verified")
 *     .entityType("time_entry")
 *     .entityId(entry.getId())
 *     .actor(actingUser)
 *     .details(Map.of("status", Map.of("from", "submitted", "to", "verified")))
 *     .build();
 * }</pre>
 */
public class AuditEventBuilder {

  private String eventType;
  private String entityType;
  private UUID entityId;
  private UUID actorId;
  private String source = "API";
  private Map<String, Object> details;

  private AuditEventBuilder() {}

  /** Creates a new builder instance. */
  public static AuditEventBuilder builder() {
    return new AuditEventBuilder();
  }

  public AuditEventBuilder eventType(String eventType) {
    this.eventType = eventType;
    return this;
  }

  public AuditEventBuilder entityType(String entityType) {
    this.entityType = entityType;
    return this;
  }

  public AuditEventBuilder entityId(UUID entityId) {
    this.entityId = entityId;
    return this;
  }

  public AuditEventBuilder actor(ActingUser actor) {
    this.actorId = actor != null ? actor.userId() : null;
    return this;
  }

  public AuditEventBuilder source(String source) {
    this.source = source;
    return this;
  }

  public AuditEventBuilder details(Map<String, Object> details) {
    this.details = details;
    return this;
  }

  public AuditEventRecord build() {
    Objects.requireNonNull(eventType, "eventType");
    Objects.requireNonNull(entityType, "entityType");
    Objects.requireNonNull(entityId, "entityId");
    return new AuditEventRecord(
        eventType,
        entityType,
        entityId,
        actorId,
        actorId != null ? "USER" : "SYSTEM",
        source,
        details);
  }
}
