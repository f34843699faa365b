package uk.gegc.comicmaker.features.auth.application;

import org.springframework.security.core.Authentication;
import uk.gegc.comicmaker.features.auth.api.dto.AuthenticatedUserDto;
import uk.gegc.comicmaker.features.auth.api.dto.JwtResponse;
import uk.gegc.comicmaker.features.auth.api.dto.LoginRequest;
import uk.gegc.comicmaker.features.auth.api.dto.RefreshRequest;
import uk.gegc.comicmaker.features.auth.api.dto.RegisterRequest;

public interface AuthService {

    AuthenticatedUserDto register(RegisterRequest request);

    JwtResponse login(LoginRequest request);

    JwtResponse refresh(RefreshRequest request);

    AuthenticatedUserDto getCurrentUser(Authentication authentication);
}
