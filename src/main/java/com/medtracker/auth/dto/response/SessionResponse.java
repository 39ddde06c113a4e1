package com.medtracker.auth.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.medtracker.auth.entity.UserSession;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Session summary")
public class SessionResponse {

    @Schema(description = "Session ID")
    private UUID id;

    @Schema(description = "Whether this is a demo session")
    private Boolean demo;

    @Schema(description = "Last recorded activity")
    private Instant lastActivityAt;

    @Schema(description = "Fixed expiry instant")
    private Instant expiresAt;

    public static SessionResponse from(UserSession session) {
        return SessionResponse.builder()
                .id(session.getId())
                .demo(session.getDemo())
                .lastActivityAt(session.getLastActivityAt())
                .expiresAt(session.getExpiresAt())
                .build();
    }
}
