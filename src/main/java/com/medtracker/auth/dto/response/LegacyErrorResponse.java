package com.medtracker.auth.dto.response;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Bare {@code {"detail": ...}} body kept for rate-limit and session-status failures.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Legacy error body")
public class LegacyErrorResponse {

    @Schema(description = "Error code", example = "TOO_MANY_ATTEMPTS")
    private Object detail;
}
