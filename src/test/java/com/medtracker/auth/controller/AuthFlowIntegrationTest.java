package com.medtracker.auth.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.medtracker.auth.service.DuplicateSubmissionGuard;
import com.medtracker.auth.service.DuplicateSubmissionGuard.GuardPermit;
import com.medtracker.auth.service.RateLimitingService;
import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class AuthFlowIntegrationTest {

    private static final String PASSWORD = "Passw0rd1";

    @Autowired MockMvc mvc;
    @Autowired ObjectMapper om;
    @Autowired RateLimitingService rateLimiter;
    @Autowired DuplicateSubmissionGuard guard;

    @BeforeEach
    void resetInMemoryDefenses() {
        rateLimiter.reset();
        guard.reset();
    }

    @Test
    void register_then_session_status_should_be_authenticated() throws Exception {
        String email = uniqueEmail();

        MockHttpServletResponse registered = register(email, PASSWORD)
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.email").value(email))
                .andExpect(jsonPath("$.error").isEmpty())
                .andReturn().getResponse();

        String setCookie = registered.getHeader(HttpHeaders.SET_COOKIE);
        assertThat(setCookie).startsWith("session=").contains("HttpOnly").contains("Path=/");
        Cookie session = sessionCookie(registered);

        mvc.perform(get("/auth/session").cookie(session))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.authenticated").value(true))
                .andExpect(jsonPath("$.data.user.email").value(email))
                .andExpect(jsonPath("$.data.session.id").value(session.getValue()));
    }

    @Test
    void register_should_reject_taken_email_and_weak_password() throws Exception {
        String email = uniqueEmail();
        register(email, PASSWORD).andExpect(status().isCreated());

        register(email.toUpperCase(), PASSWORD)
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("EMAIL_EXISTS"));

        register(uniqueEmail(), "password")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("PASSWORD_WEAK"));
    }

    @Test
    void fifth_bad_password_should_lock_the_account() throws Exception {
        String email = uniqueEmail();
        register(email, PASSWORD).andExpect(status().isCreated());

        for (int i = 0; i < 4; i++) {
            login(email, "Wrong-pass1")
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.error").value("INVALID_CREDENTIALS"));
        }

        login(email, "Wrong-pass1")
                .andExpect(status().isLocked())
                .andExpect(jsonPath("$.error.code").value("ACCOUNT_LOCKED"))
                .andExpect(jsonPath("$.error.lock_expires_at").isNotEmpty())
                .andExpect(jsonPath("$.data").isEmpty());

        login(email, PASSWORD).andExpect(status().isLocked());
    }

    @Test
    void login_should_set_cookie_and_logout_should_revoke_it() throws Exception {
        String email = uniqueEmail();
        register(email, PASSWORD).andExpect(status().isCreated());

        MockHttpServletResponse loggedIn = login("  " + email.toUpperCase() + " ", PASSWORD)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.email").value(email))
                .andReturn().getResponse();
        Cookie session = sessionCookie(loggedIn);

        MockHttpServletResponse loggedOut = mvc.perform(post("/auth/logout").cookie(session))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.success").value(true))
                .andReturn().getResponse();
        assertThat(loggedOut.getHeader(HttpHeaders.SET_COOKIE)).contains("Max-Age=0");

        mvc.perform(get("/auth/session").cookie(session))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.authenticated").value(false))
                .andExpect(jsonPath("$.data.user").isEmpty());
    }

    @Test
    void logout_without_cookie_should_still_succeed() throws Exception {
        mvc.perform(post("/auth/logout"))
                .andExpect(status().isOk())
                .andExpect(content().json("{\"data\":{\"success\":true},\"error\":null}", true));
    }

    @Test
    void session_status_without_cookie_should_use_legacy_detail_shape() throws Exception {
        mvc.perform(get("/auth/session"))
                .andExpect(status().isUnauthorized())
                .andExpect(content().json("{\"detail\":\"NO_SESSION\"}", true));
    }

    @Test
    void unknown_session_cookie_should_be_unauthenticated_and_cleared() throws Exception {
        mvc.perform(get("/auth/session").cookie(new Cookie("session", UUID.randomUUID().toString())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.authenticated").value(false))
                .andExpect(header().string(HttpHeaders.SET_COOKIE, containsString("Max-Age=0")));
    }

    @Test
    void in_flight_login_should_be_rejected_as_duplicate() throws Exception {
        String email = uniqueEmail();
        register(email, PASSWORD).andExpect(status().isCreated());

        try (GuardPermit inFlight = guard.acquire("login:" + email)) {
            assertThat(inFlight.isAcquired()).isTrue();
            login(email, PASSWORD)
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.error").value("DUPLICATE_SUBMISSION"));
        }

        login(email, PASSWORD).andExpect(status().isOk());
    }

    @Test
    void second_demo_start_in_window_should_be_rate_limited() throws Exception {
        MockHttpServletResponse first = mvc.perform(post("/auth/demo"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.session.demo").value(true))
                .andExpect(jsonPath("$.data.user.email").value("demo@example.com"))
                .andReturn().getResponse();
        assertThat(sessionCookie(first).getValue()).isNotBlank();

        mvc.perform(post("/auth/demo"))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().exists(HttpHeaders.RETRY_AFTER))
                .andExpect(content().json("{\"detail\":\"TOO_MANY_ATTEMPTS\"}", true));
    }

    @Test
    void session_can_be_exchanged_for_bearer_token() throws Exception {
        String email = uniqueEmail();
        Cookie session = sessionCookie(register(email, PASSWORD)
                .andExpect(status().isCreated())
                .andReturn().getResponse());

        String tokenBody = mvc.perform(post("/auth/token").cookie(session))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.token_type").value("Bearer"))
                .andReturn().getResponse().getContentAsString();
        JsonNode json = om.readTree(tokenBody);
        String token = json.path("data").path("access_token").asText();
        assertThat(token.split("\\.")).hasSize(3);

        mvc.perform(get("/auth/me").header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.surface").value("TOKEN"))
                .andExpect(jsonPath("$.data.user.email").value(email));

        mvc.perform(get("/auth/me").header(HttpHeaders.AUTHORIZATION, "Bearer not.a.token"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.detail").value("NO_SESSION"));
    }

    @Test
    void malformed_body_should_be_a_400_envelope() throws Exception {
        mvc.perform(post("/auth/login").contentType(MediaType.APPLICATION_JSON).content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_REQUEST"));

        mvc.perform(post("/auth/login").contentType(MediaType.APPLICATION_JSON).content("{\"email\":\"a@b.io\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
    }

    @Test
    void blank_missing_and_malformed_login_emails_should_all_look_like_bad_credentials() throws Exception {
        for (String body : new String[] {
                "{\"email\":\"   \",\"password\":\"x\"}",
                "{\"password\":\"x\"}",
                "{\"email\":\"not-an-email\",\"password\":\"x\"}"}) {
            mvc.perform(post("/auth/login").contentType(MediaType.APPLICATION_JSON).content(body))
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.error").value("INVALID_CREDENTIALS"));
        }
    }

    @Test
    void address_with_apostrophe_should_register_and_log_in() throws Exception {
        String email = "o'brien-" + UUID.randomUUID().toString().substring(0, 8) + "@clinic.io";

        register(email, PASSWORD)
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.email").value(email));

        login(email, PASSWORD).andExpect(status().isOk());
    }

    private ResultActions register(String email, String password) throws Exception {
        String body = om.writeValueAsString(Map.of("email", email, "password", password));
        return mvc.perform(post("/auth/register").contentType(MediaType.APPLICATION_JSON).content(body));
    }

    private ResultActions login(String email, String password) throws Exception {
        String body = om.writeValueAsString(Map.of("email", email, "password", password));
        return mvc.perform(post("/auth/login").contentType(MediaType.APPLICATION_JSON).content(body));
    }

    private static Cookie sessionCookie(MockHttpServletResponse response) {
        String header = response.getHeader(HttpHeaders.SET_COOKIE);
        assertThat(header).isNotNull().startsWith("session=");
        int end = header.indexOf(';');
        String value = header.substring("session=".length(), end < 0 ? header.length() : end);
        return new Cookie("session", value);
    }

    private static String uniqueEmail() {
        return "user-" + UUID.randomUUID().toString().substring(0, 8) + "@clinic.io";
    }
}
