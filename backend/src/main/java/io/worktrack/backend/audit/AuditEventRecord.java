package io.worktrack.backend.audit;

import java.util.Map;
import java.util.UUID;

/**
 * Non-JPA DTO passed to {@link AuditService#log(AuditEventRecord)}. Constructed by {@link
 * AuditEventBuilder}.
 *
 * @param eventType free-form event type following {@code {entity}.{action}} convention
 * @param entityType the kind of entity being audited (e.g., "time_entry", "pay_period")
 * @param entityId ID of the affected entity (not a FK -- entity may be deleted later)
 * @param actorId user ID of the acting user; null for system-initiated events
 * @param actorType USER or SYSTEM
 * @param source origin of the action: API, IMPORT, INTERNAL
 * @param details before/after values and other key fields; nullable
 */
public record AuditEventRecord(
    String eventType,
    String entityType,
    UUID entityId,
    UUID actorId,
    String actorType,
    String source,
    Map<String, Object> details) {}
