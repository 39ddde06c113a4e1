package com.medtracker.auth.event;

import com.medtracker.auth.enums.AuditEventType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Security audit record. Attributes never carry raw emails or secrets.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditEvent {

    private String type;
    private String correlationId;
    private Instant timestamp;
    private Map<String, Object> attributes;

    public static AuditEvent of(AuditEventType type, String correlationId, Instant timestamp,
                                Map<String, Object> attributes) {
        return AuditEvent.builder()
                .type(type.getCode())
                .correlationId(correlationId)
                .timestamp(timestamp)
                .attributes(attributes)
                .build();
    }
}
