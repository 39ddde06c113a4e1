package com.medtracker.auth.dto.request;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.*;

/**
 * Account registration request DTO.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Account registration request")
public class RegisterRequest {

    @NotBlank(message = "Email is required")
    @Schema(description = "Email address", example = "john.doe@example.com")
    private String email;

    @NotNull(message = "Password is required")
    @Schema(description = "Password (min 8 chars, must include a letter and a digit)")
    private String password;

    @Size(max = 100)
    @Schema(description = "First name")
    private String firstName;

    @Size(max = 100)
    @Schema(description = "Last name")
    private String lastName;

    @Size(max = 200)
    @Schema(description = "Display name", example = "John")
    private String displayName;
}
