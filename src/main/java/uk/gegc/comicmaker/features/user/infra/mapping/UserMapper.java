package uk.gegc.comicmaker.features.user.infra.mapping;

import org.springframework.stereotype.Component;
import uk.gegc.comicmaker.features.auth.api.dto.AuthenticatedUserDto;
import uk.gegc.comicmaker.features.user.domain.model.User;

@Component
public class UserMapper {

    public AuthenticatedUserDto toDto(User user) {
        return new AuthenticatedUserDto(
                user.getId(),
                user.getUsername(),
                user.getEmail(),
                user.getPlan(),
                user.getAccountStatus(),
                user.getMonthlyQuota(),
                user.getQuotaUsed(),
                user.getQuotaResetAt(),
                user.isFreeStoryAvailable(),
                user.isFreeStoryUsed(),
                user.getCreatedAt()
        );
    }
}
