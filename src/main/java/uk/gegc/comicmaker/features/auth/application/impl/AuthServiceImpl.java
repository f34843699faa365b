package uk.gegc.comicmaker.features.auth.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.authentication.AuthenticationManager;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.comicmaker.features.auth.api.dto.AuthenticatedUserDto;
import uk.gegc.comicmaker.features.auth.api.dto.JwtResponse;
import uk.gegc.comicmaker.features.auth.api.dto.LoginRequest;
import uk.gegc.comicmaker.features.auth.api.dto.RefreshRequest;
import uk.gegc.comicmaker.features.auth.api.dto.RegisterRequest;
import uk.gegc.comicmaker.features.auth.application.AuthService;
import uk.gegc.comicmaker.features.auth.infra.security.JwtTokenService;
import uk.gegc.comicmaker.features.plan.application.PlanPolicy;
import uk.gegc.comicmaker.features.plan.domain.model.PlanTier;
import uk.gegc.comicmaker.features.user.application.CurrentUserResolver;
import uk.gegc.comicmaker.features.user.domain.exception.UserAlreadyExistsException;
import uk.gegc.comicmaker.features.user.domain.model.AccountStatus;
import uk.gegc.comicmaker.features.user.domain.model.User;
import uk.gegc.comicmaker.features.user.domain.repository.UserRepository;
import uk.gegc.comicmaker.features.user.infra.mapping.UserMapper;
import uk.gegc.comicmaker.shared.exception.UnauthorizedException;
import uk.gegc.comicmaker.shared.exception.ValidationException;

import java.time.Clock;
import java.time.LocalDateTime;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuthServiceImpl implements AuthService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final AuthenticationManager authManager;
    private final JwtTokenService jwtTokenService;
    private final PlanPolicy planPolicy;
    private final CurrentUserResolver currentUserResolver;
    private final UserMapper userMapper;
    private final Clock clock;

    @Override
    @Transactional
    public AuthenticatedUserDto register(RegisterRequest request) {
        if (userRepository.existsByUsername(request.username())) {
            throw new UserAlreadyExistsException("Username already in use");
        }
        if (userRepository.existsByEmail(request.email())) {
            throw new UserAlreadyExistsException("Email already in use");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        User user = new User();
        user.setUsername(request.username());
        user.setEmail(request.email());
        user.setHashedPassword(passwordEncoder.encode(request.password()));
        user.setPlan(PlanTier.FREE);
        user.setAccountStatus(AccountStatus.ACTIVE);
        user.setMonthlyQuota(planPolicy.limitsFor(PlanTier.FREE).monthlyQuota());
        user.setQuotaUsed(0);
        user.setQuotaResetAt(now.plusMonths(1));
        user.setFreeStoryAvailable(true);
        user.setFreeStoryUsed(false);
        user.setCreatedAt(now);

        try {
            User saved = userRepository.saveAndFlush(user);
            log.info("Registered user {} ({})", saved.getUsername(), saved.getId());
            return userMapper.toDto(saved);
        } catch (DataIntegrityViolationException e) {
            throw new UserAlreadyExistsException("Username or email already in use");
        }
    }

    @Override
    public JwtResponse login(LoginRequest request) {
        try {
            Authentication authentication = authManager.authenticate(
                    new UsernamePasswordAuthenticationToken(request.username(), request.password()));
            return issueTokens(authentication);
        } catch (AuthenticationException ex) {
            log.info("Failed login for '{}': {}", request.username(), ex.getClass().getSimpleName());
            throw new UnauthorizedException("Invalid username or password");
        }
    }

    @Override
    public JwtResponse refresh(RefreshRequest request) {
        String token = request.refreshToken();
        if (!jwtTokenService.validateToken(token)) {
            throw new UnauthorizedException("Invalid refresh token");
        }
        if (!JwtTokenService.TYPE_REFRESH.equals(jwtTokenService.getTokenType(token))) {
            throw new ValidationException("Token is not a refresh token");
        }
        Authentication authentication = jwtTokenService.getAuthentication(token);
        return issueTokens(authentication);
    }

    @Override
    @Transactional(readOnly = true)
    public AuthenticatedUserDto getCurrentUser(Authentication authentication) {
        return userMapper.toDto(currentUserResolver.resolve(authentication));
    }

    private JwtResponse issueTokens(Authentication authentication) {
        return new JwtResponse(
                jwtTokenService.generateAccessToken(authentication),
                jwtTokenService.generateRefreshToken(authentication),
                jwtTokenService.getAccessTokenValidityInMs(),
                jwtTokenService.getRefreshTokenValidityInMs());
    }
}
