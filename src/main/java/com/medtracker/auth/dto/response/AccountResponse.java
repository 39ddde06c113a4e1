package com.medtracker.auth.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.medtracker.auth.entity.Account;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Public view of an account.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Account summary")
public class AccountResponse {

    @Schema(description = "Account ID")
    private UUID id;

    @Schema(description = "Normalized email", example = "john.doe@example.com")
    private String email;

    @Schema(description = "First name")
    private String firstName;

    @Schema(description = "Last name")
    private String lastName;

    @Schema(description = "Display name")
    private String displayName;

    public static AccountResponse from(Account account) {
        return AccountResponse.builder()
                .id(account.getId())
                .email(account.getEmail())
                .firstName(account.getFirstName())
                .lastName(account.getLastName())
                .displayName(account.getDisplayName())
                .build();
    }

    public static AccountResponse identityOf(Account account) {
        return AccountResponse.builder()
                .id(account.getId())
                .email(account.getEmail())
                .displayName(account.getDisplayName())
                .build();
    }
}
