package com.medtracker.auth.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Session status payload. {@code user} and {@code session} are serialized as
 * null when unauthenticated.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.ALWAYS)
@Schema(description = "Session status")
public class SessionStatusResponse {

    private boolean authenticated;
    private AccountResponse user;
    private SessionResponse session;

    public static SessionStatusResponse unauthenticated() {
        return new SessionStatusResponse(false, null, null);
    }
}
