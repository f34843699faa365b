package uk.gegc.comicmaker.features.auth.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

@Schema(name = "RegisterRequest", description = "Payload for user registration")
public record RegisterRequest(
        @Schema(description = "Unique username", example = "inkslinger")
        @NotBlank(message = "Username must not be blank")
        @Size(min = 4, max = 50, message = "Username must be between 4 and 50 characters")
        @Pattern(regexp = "^[A-Za-z0-9_.-]+$", message = "Username may only contain letters, digits, '.', '_' and '-'")
        String username,

        @Schema(description = "User email address", example = "artist@example.com")
        @NotBlank(message = "Email must not be blank")
        @Size(max = 254, message = "Email must be at most 254 characters")
        @Email(message = "Email must be a valid address")
        String email,

        @Schema(description = "Password for the new account", example = "P@ssw0rd!")
        @NotBlank(message = "Password must not be blank")
        @Size(min = 8, max = 100, message = "Password must be between 8 and 100 characters")
        String password
) {
}
