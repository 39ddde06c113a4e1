package com.medtracker.auth.event;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.medtracker.auth.config.AsyncConfig;
import com.medtracker.auth.config.AuthProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Publishes authentication audit events. Every event is written to the
 * {@code audit} logger; Kafka delivery is opt-in. Failures are logged and
 * never reach the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthEventPublisher {

    private static final Logger AUDIT_LOG = LoggerFactory.getLogger("audit");

    private final KafkaTemplate<String, byte[]> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final AuthProperties authProperties;

    @Async(AsyncConfig.AUDIT_EXECUTOR)
    public void publish(AuditEvent event) {
        try {
            AUDIT_LOG.info("{} correlationId={} attributes={}",
                    event.getType(), event.getCorrelationId(), event.getAttributes());

            AuthProperties.Audit.Kafka kafka = authProperties.getAudit().getKafka();
            if (!Boolean.TRUE.equals(kafka.getEnabled())) {
                return;
            }

            byte[] value = objectMapper.writeValueAsBytes(event);
            kafkaTemplate.send(kafka.getTopic(), event.getCorrelationId(), value)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            log.error("Failed to publish audit event {}", event.getType(), ex);
                        } else {
                            log.debug("Audit event {} published", event.getType());
                        }
                    });

        } catch (Exception e) {
            log.error("Error publishing audit event {}", event.getType(), e);
        }
    }
}
