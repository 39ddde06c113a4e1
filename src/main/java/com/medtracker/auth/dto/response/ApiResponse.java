package com.medtracker.auth.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The {@code {data, error}} envelope. Both keys are always present; exactly
 * one of them is non-null.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.ALWAYS)
@Schema(description = "Generic API response envelope")
public class ApiResponse<T> {

    @Schema(description = "Response data")
    private T data;

    @Schema(description = "Error code, or an error object for structured failures", example = "INVALID_CREDENTIALS")
    private Object error;

    public static <T> ApiResponse<T> success(T data) {
        return ApiResponse.<T>builder()
                .data(data)
                .build();
    }

    public static <T> ApiResponse<T> error(Object error) {
        return ApiResponse.<T>builder()
                .error(error)
                .build();
    }
}
