package com.medtracker.auth.dto.request;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Login request DTO.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Login request with email and password")
public class LoginRequest {

    // Unchecked here: a missing or malformed address must fail exactly like a wrong password
    @Schema(description = "Email address", example = "john.doe@example.com")
    private String email;

    @NotNull(message = "Password is required")
    @Schema(description = "Account password", example = "Passw0rd!")
    private String password;
}
