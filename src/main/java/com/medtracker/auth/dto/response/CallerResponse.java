package com.medtracker.auth.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.medtracker.auth.enums.AuthSurface;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Resolved caller identity")
public class CallerResponse {

    private AccountResponse user;

    @Schema(description = "Surface the identity was resolved through", example = "SESSION")
    private AuthSurface surface;
}
