package uk.gegc.comicmaker.features.user.application;

import lombok.RequiredArgsConstructor;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Component;
import uk.gegc.comicmaker.features.user.domain.model.User;
import uk.gegc.comicmaker.features.user.domain.repository.UserRepository;
import uk.gegc.comicmaker.shared.exception.UnauthorizedException;

/**
 * Maps the authenticated principal (username or email) back to its {@link User} row.
 */
@Component
@RequiredArgsConstructor
public class CurrentUserResolver {

    private final UserRepository userRepository;

    public User resolve(Authentication authentication) {
        String principal = authentication != null ? authentication.getName() : null;
        if (principal == null || principal.isBlank()) {
            throw new UnauthorizedException("No authenticated user found");
        }
        User user = userRepository.findByUsername(principal)
                .or(() -> userRepository.findByEmail(principal))
                .orElseThrow(() -> new UnauthorizedException("Unknown principal"));
        if (!user.isActive()) {
            throw new UnauthorizedException("Account is not active");
        }
        return user;
    }
}
