package com.socialhub.backend.modules.auth.presentation;

import com.socialhub.backend.global.error.ProblemException;
import com.socialhub.backend.global.security.SecurityUtils;
import com.socialhub.backend.global.security.SessionCookies;
import com.socialhub.backend.modules.auth.application.AccountLink;
import com.socialhub.backend.modules.auth.application.AuthService;
import com.socialhub.backend.modules.auth.application.LoginAttempt;
import com.socialhub.backend.modules.auth.presentation.dto.AuthMessageResponse;
import com.socialhub.backend.modules.auth.presentation.dto.ForgotPasswordRequest;
import com.socialhub.backend.modules.auth.presentation.dto.LoginRequest;
import com.socialhub.backend.modules.auth.presentation.dto.RegisterRequest;
import com.socialhub.backend.modules.auth.presentation.dto.ResetPasswordRequest;
import com.socialhub.backend.modules.auth.presentation.dto.UserResponse;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth")
public class AuthController {

    private final AuthService authService;
    private final SessionCookies sessionCookies;

    public AuthController(AuthService authService, SessionCookies sessionCookies) {
        this.authService = authService;
        this.sessionCookies = sessionCookies;
    }

    @PostMapping("/register")
    public ResponseEntity<AuthMessageResponse> register(@Valid @RequestBody RegisterRequest request) {
        AccountLink registered = authService.register(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(new AuthMessageResponse(
                "User Registered Successfully", UserResponse.from(registered.user()), registered.link()));
    }

    @PostMapping("/login")
    public ResponseEntity<AuthMessageResponse> login(
            @RequestBody(required = false) LoginRequest credentials,
            HttpServletRequest request,
            HttpServletResponse response
    ) {
        LoginAttempt attempt = authService.login(
                sessionCookies.readAccessToken(request),
                sessionCookies.readRefreshToken(request),
                credentials
        );
        if (attempt.issued() != null) {
            sessionCookies.write(response, attempt.issued());
        }
        return ResponseEntity.ok(new AuthMessageResponse(
                "User Logged In Successfully", UserResponse.from(attempt.user()), null));
    }

    @PostMapping("/logout")
    public ResponseEntity<AuthMessageResponse> logout(HttpServletRequest request, HttpServletResponse response) {
        if (sessionCookies.readAccessToken(request) == null || sessionCookies.readRefreshToken(request) == null) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "bad_request.not_logged_in", "user not logged in");
        }
        sessionCookies.clear(response);
        return ResponseEntity.ok(AuthMessageResponse.of("User Logged Out Successfully"));
    }

    @PostMapping("/forgot-password")
    public ResponseEntity<AuthMessageResponse> forgotPassword(
            @Valid @RequestBody ForgotPasswordRequest request,
            HttpServletResponse response
    ) {
        AccountLink reset = authService.forgotPassword(request.identifier());
        sessionCookies.clear(response);
        return ResponseEntity.ok(new AuthMessageResponse(
                "If the account exists, a password reset link has been sent", null, reset.link()));
    }

    @PostMapping("/reset-password")
    public ResponseEntity<AuthMessageResponse> resetPassword(
            @RequestParam("token") String token,
            @Valid @RequestBody ResetPasswordRequest request
    ) {
        UserResponse user = UserResponse.from(authService.resetPassword(token, request));
        return ResponseEntity.ok(new AuthMessageResponse("Password Reset Successfully", user, null));
    }

    @GetMapping("/activate")
    public ResponseEntity<AuthMessageResponse> activate(@RequestParam("token") String token) {
        UserResponse user = UserResponse.from(authService.activate(token));
        return ResponseEntity.ok(new AuthMessageResponse("User Activated Successfully", user, null));
    }

    @PostMapping("/resend-activation")
    public ResponseEntity<AuthMessageResponse> resendActivation(@Valid @RequestBody LoginRequest request) {
        AccountLink activation = authService.resendActivation(request);
        return ResponseEntity.ok(new AuthMessageResponse(
                "Activation Link Sent Successfully", UserResponse.from(activation.user()), activation.link()));
    }

    @GetMapping("/me")
    public ResponseEntity<UserResponse> me() {
        return ResponseEntity.ok(UserResponse.from(authService.currentUser(SecurityUtils.getCurrentUserId())));
    }
}
