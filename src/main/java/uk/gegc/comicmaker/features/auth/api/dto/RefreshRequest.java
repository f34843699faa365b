package uk.gegc.comicmaker.features.auth.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

@Schema(name = "RefreshRequest")
public record RefreshRequest(
        @Schema(description = "Refresh token issued at login")
        @NotBlank(message = "Refresh token must not be blank")
        String refreshToken
) {
}
