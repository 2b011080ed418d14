package com.socialhub.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

import com.socialhub.backend.global.error.ProblemException;
import com.socialhub.backend.modules.auth.domain.Role;
import com.socialhub.backend.modules.auth.domain.RoleLevel;
import com.socialhub.backend.modules.auth.domain.SocialUser;
import com.socialhub.backend.modules.auth.infrastructure.persistence.RoleRepository;
import com.socialhub.backend.modules.auth.infrastructure.persistence.UserRepository;
import com.socialhub.backend.modules.auth.presentation.dto.LoginRequest;
import com.socialhub.backend.modules.auth.presentation.dto.RegisterRequest;
import com.socialhub.backend.modules.auth.presentation.dto.ResetPasswordRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final UserRepository userRepository;
    private final RoleRepository roleRepository;
    private final PasswordEncoder passwordEncoder;
    private final TokenService tokenService;
    private final SessionResolver sessionResolver;
    private final AccountStatusGate accountStatusGate;
    private final Clock clock;
    private final String publicBaseUrl;

    public AuthService(
            UserRepository userRepository,
            RoleRepository roleRepository,
            PasswordEncoder passwordEncoder,
            TokenService tokenService,
            SessionResolver sessionResolver,
            AccountStatusGate accountStatusGate,
            Clock clock,
            @Value("${social.public-base-url:http://localhost:8080}") String publicBaseUrl
    ) {
        this.userRepository = userRepository;
        this.roleRepository = roleRepository;
        this.passwordEncoder = passwordEncoder;
        this.tokenService = tokenService;
        this.sessionResolver = sessionResolver;
        this.accountStatusGate = accountStatusGate;
        this.clock = clock;
        this.publicBaseUrl = stripTrailingSlash(publicBaseUrl);
    }

    public AccountLink register(RegisterRequest request) {
        String username = request.username().trim();
        String email = request.email().trim();
        if (userRepository.existsByUsernameOrEmail(username, email)) {
            throw new ProblemException(HttpStatus.CONFLICT, "conflict.user_exists", "username or email already taken");
        }
        Role normalRole = roleRepository.findByLevel(RoleLevel.NORMAL.level())
                .orElseThrow(() -> new IllegalStateException("role level 1 is not seeded"));

        SocialUser user = new SocialUser();
        user.setUsername(username);
        user.setEmail(email);
        user.setPasswordHash(passwordEncoder.encode(request.password()));
        user.setRole(normalRole);
        user.setActive(false);
        user.setBanned(false);
        try {
            user = userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            // lost a race against a concurrent registration of the same name or email
            log.warn("registration for {} hit a unique constraint", username);
            throw new ProblemException(HttpStatus.CONFLICT, "conflict.user_exists", "username or email already taken");
        }

        String token = tokenService.issue(TokenClass.ACTIVATION, user.getId());
        user.assignActivationToken(token, expiryFor(TokenClass.ACTIVATION));
        log.info("registered user {}", user.getId());
        return new AccountLink(user, publicBaseUrl + "/auth/activate?token=" + token);
    }

    /**
     * Login as a fallback chain: a usable access cookie, then a usable refresh cookie (rotating
     * both), then the submitted credentials.
     */
    public LoginAttempt login(String accessToken, String refreshToken, LoginRequest credentials) {
        LoginAttempt attempt = tryAccess(accessToken);
        if (!attempt.isResolved()) {
            attempt = tryRefresh(refreshToken);
        }
        if (!attempt.isResolved()) {
            attempt = credentialLogin(credentials);
        }
        ProblemException rejection = accountStatusGate.checkLogin(attempt.user());
        if (rejection != null) {
            log.warn("login for user {} rejected: {}", attempt.user().getId(), rejection.getCode());
            throw rejection;
        }
        return attempt;
    }

    LoginAttempt tryAccess(String accessToken) {
        return verifiedUser(TokenClass.ACCESS, accessToken)
                .map(user -> LoginAttempt.resolved(user, null))
                .orElse(LoginAttempt.notApplicable());
    }

    LoginAttempt tryRefresh(String refreshToken) {
        return verifiedUser(TokenClass.REFRESH, refreshToken)
                .map(user -> LoginAttempt.resolved(user, sessionResolver.issuePair(user.getId())))
                .orElse(LoginAttempt.notApplicable());
    }

    LoginAttempt credentialLogin(LoginRequest credentials) {
        if (credentials == null || isBlank(credentials.identifier()) || isBlank(credentials.password())) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "validation_error", "identifier and password are required");
        }
        SocialUser user = userRepository.findByIdentifier(credentials.identifier().trim())
                .filter(candidate -> passwordEncoder.matches(credentials.password(), candidate.getPasswordHash()))
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, "unauthorized.invalid_credentials",
                        "invalid credentials"));
        return LoginAttempt.resolved(user, sessionResolver.issuePair(user.getId()));
    }

    /**
     * Always succeeds so callers cannot probe which identifiers exist.
     */
    public AccountLink forgotPassword(String identifier) {
        Optional<SocialUser> found = userRepository.findByIdentifier(identifier.trim());
        if (found.isEmpty()) {
            return new AccountLink(null, null);
        }
        SocialUser user = found.get();
        String token = tokenService.issue(TokenClass.PASSWORD_RESET, user.getId());
        user.assignPasswordResetToken(token, expiryFor(TokenClass.PASSWORD_RESET));
        log.info("password reset requested for user {}", user.getId());
        return new AccountLink(user, publicBaseUrl + "/auth/reset-password?token=" + token);
    }

    public SocialUser resetPassword(String token, ResetPasswordRequest request) {
        if (!request.newPassword().equals(request.confirmPassword())) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "bad_request.password_mismatch",
                    "confirmPassword must match newPassword");
        }
        SocialUser user = userForStoredToken(TokenClass.PASSWORD_RESET, token,
                userRepository.findByPasswordResetToken(token), SocialUser::getResetTokenExpiry);
        user.setPasswordHash(passwordEncoder.encode(request.newPassword()));
        user.clearPasswordResetToken();
        log.info("password reset for user {}", user.getId());
        return user;
    }

    public SocialUser activate(String token) {
        SocialUser user = userForStoredToken(TokenClass.ACTIVATION, token,
                userRepository.findByActivationToken(token), SocialUser::getActivationTokenExpiry);
        user.setActive(true);
        user.clearActivationToken();
        log.info("activated user {}", user.getId());
        return user;
    }

    public AccountLink resendActivation(LoginRequest credentials) {
        SocialUser user = userRepository.findByIdentifier(credentials.identifier().trim())
                .filter(candidate -> passwordEncoder.matches(credentials.password(), candidate.getPasswordHash()))
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, "unauthorized.invalid_credentials",
                        "invalid credentials"));
        if (user.isActive()) {
            throw new ProblemException(HttpStatus.CONFLICT, "conflict.user_already_active", "user already active");
        }
        String token = tokenService.issue(TokenClass.ACTIVATION, user.getId());
        user.assignActivationToken(token, expiryFor(TokenClass.ACTIVATION));
        return new AccountLink(user, publicBaseUrl + "/auth/activate?token=" + token);
    }

    @Transactional(readOnly = true)
    public SocialUser currentUser(UUID userId) {
        return userRepository.findWithRoleById(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, "unauthorized.user_not_found",
                        "user not found"));
    }

    private Optional<SocialUser> verifiedUser(TokenClass tokenClass, String token) {
        if (isBlank(token)) {
            return Optional.empty();
        }
        try {
            return userRepository.findWithRoleById(tokenService.verify(tokenClass, token));
        } catch (TokenVerificationException ex) {
            log.debug("{} cookie not usable for login: {}", tokenClass, ex.getFailure());
            return Optional.empty();
        }
    }

    private SocialUser userForStoredToken(
            TokenClass tokenClass,
            String token,
            Optional<SocialUser> stored,
            Function<SocialUser, OffsetDateTime> expiryOf
    ) {
        ProblemException invalid = new ProblemException(HttpStatus.UNAUTHORIZED,
                "unauthorized.invalid_or_expired_token", "invalid or expired token");
        UUID subject;
        try {
            subject = tokenService.verify(tokenClass, token);
        } catch (TokenVerificationException ex) {
            throw invalid;
        }
        SocialUser user = stored.orElseThrow(() -> invalid);
        OffsetDateTime expiry = expiryOf.apply(user);
        if (!user.getId().equals(subject) || expiry == null || !expiry.isAfter(OffsetDateTime.now(clock))) {
            throw invalid;
        }
        return user;
    }

    private OffsetDateTime expiryFor(TokenClass tokenClass) {
        return OffsetDateTime.now(clock).plus(tokenClass.ttl());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
