package com.medtracker.auth.controller;

import com.medtracker.auth.dto.request.LoginRequest;
import com.medtracker.auth.dto.request.RegisterRequest;
import com.medtracker.auth.dto.response.*;
import com.medtracker.auth.security.SessionCookieFactory;
import com.medtracker.auth.service.AuthOutcome;
import com.medtracker.auth.service.AuthenticationService;
import com.medtracker.auth.util.EmailMasker;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.util.WebUtils;

/**
 * REST controller for authentication endpoints.
 */
@Slf4j
@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
@Tag(name = "Authentication", description = "Session and token authentication APIs")
public class AuthController {

    private static final String BEARER_PREFIX = "Bearer ";

    private final AuthenticationService authenticationService;
    private final SessionCookieFactory sessionCookieFactory;

    @PostMapping("/login")
    @Operation(summary = "Authenticate account", description = "Login with email and password; sets the session cookie")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(
                    responseCode = "200",
                    description = "Successfully authenticated",
                    content = @Content(schema = @Schema(implementation = AccountResponse.class))
            ),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "401", description = "Invalid credentials"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Duplicate submission"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "423", description = "Account locked"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "429", description = "Too many attempts")
    })
    public ResponseEntity<ApiResponse<AccountResponse>> login(@Valid @RequestBody LoginRequest request) {
        log.info("Login attempt for: {}", EmailMasker.mask(request.getEmail()));
        return toResponse(authenticationService.login(request));
    }

    @PostMapping("/register")
    @Operation(summary = "Register account", description = "Create an account and sign it in")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(
                    responseCode = "201",
                    description = "Account registered",
                    content = @Content(schema = @Schema(implementation = AccountResponse.class))
            ),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Invalid email or weak password"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Email already registered or duplicate submission")
    })
    public ResponseEntity<ApiResponse<AccountResponse>> register(@Valid @RequestBody RegisterRequest request) {
        log.info("Registration attempt for: {}", EmailMasker.mask(request.getEmail()));
        return toResponse(authenticationService.register(request));
    }

    @PostMapping("/logout")
    @Operation(summary = "Logout", description = "Revoke the current session if any; always succeeds")
    public ResponseEntity<ApiResponse<LogoutResponse>> logout(HttpServletRequest httpRequest) {
        return toResponse(authenticationService.logout(sessionCookie(httpRequest)));
    }

    @GetMapping("/session")
    @Operation(summary = "Session status", description = "Report whether the session cookie is authenticated")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(
                    responseCode = "200",
                    description = "Session status",
                    content = @Content(schema = @Schema(implementation = SessionStatusResponse.class))
            ),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "401", description = "No session cookie, or unknown account")
    })
    public ResponseEntity<ApiResponse<SessionStatusResponse>> sessionStatus(HttpServletRequest httpRequest) {
        return toResponse(authenticationService.sessionStatus(sessionCookie(httpRequest)));
    }

    @PostMapping("/demo")
    @Operation(summary = "Start demo", description = "Sign in to the shared demo account")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(
                    responseCode = "200",
                    description = "Demo session started",
                    content = @Content(schema = @Schema(implementation = DemoResponse.class))
            ),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "429", description = "Too many demo starts")
    })
    public ResponseEntity<ApiResponse<DemoResponse>> startDemo() {
        return toResponse(authenticationService.startDemo());
    }

    @PostMapping("/token")
    @Operation(summary = "Issue bearer token", description = "Exchange the session cookie for a short-lived JWT")
    public ResponseEntity<ApiResponse<TokenResponse>> issueToken(HttpServletRequest httpRequest) {
        return ResponseEntity.ok(ApiResponse.success(
                authenticationService.issueToken(sessionCookie(httpRequest))));
    }

    @GetMapping("/me")
    @Operation(summary = "Current caller", description = "Resolve the caller by bearer token, then session cookie")
    public ResponseEntity<ApiResponse<CallerResponse>> currentCaller(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            HttpServletRequest httpRequest) {
        return ResponseEntity.ok(ApiResponse.success(
                authenticationService.currentCaller(extractBearerToken(authorization), sessionCookie(httpRequest))));
    }

    private <T> ResponseEntity<ApiResponse<T>> toResponse(AuthOutcome<T> outcome) {
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(outcome.getStatus());
        switch (outcome.getCookieAction()) {
            case SET:
                builder.header(HttpHeaders.SET_COOKIE, sessionCookieFactory.issue(outcome.getSession()).toString());
                break;
            case CLEAR:
                builder.header(HttpHeaders.SET_COOKIE, sessionCookieFactory.clear().toString());
                break;
            default:
                break;
        }
        return builder.body(ApiResponse.success(outcome.getData()));
    }

    private String sessionCookie(HttpServletRequest request) {
        Cookie cookie = WebUtils.getCookie(request, sessionCookieFactory.cookieName());
        return cookie != null ? cookie.getValue() : null;
    }

    private static String extractBearerToken(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.startsWith(BEARER_PREFIX)) {
            return null;
        }
        return authorizationHeader.substring(BEARER_PREFIX.length()).trim();
    }
}
