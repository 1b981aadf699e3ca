package com.edudata.authservice.controller;

import com.edudata.authservice.entity.OtpChallenge;
import com.edudata.authservice.model.AuthFailure;
import com.edudata.authservice.model.AuthOutcome;
import com.edudata.authservice.model.DeliveryResult;
import com.edudata.authservice.repository.OtpChallengeRepository;
import com.edudata.authservice.service.AuthService;
import com.edudata.authservice.service.NotificationDispatcher;
import com.edudata.authservice.testsupport.BaseSpringTest;
import com.edudata.authservice.testsupport.MutableClock;
import com.edudata.authservice.testsupport.TestClockConfig;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestClockConfig.class)
class AuthFlowIntegrationTest extends BaseSpringTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private MutableClock clock;

    @Autowired
    private OtpChallengeRepository challengeRepository;

    @Autowired
    private AuthService authService;

    @MockitoBean
    private NotificationDispatcher notificationDispatcher;

    @BeforeEach
    void setUp() {
        challengeRepository.deleteAll();
        clock.set(TestClockConfig.START);
        when(notificationDispatcher.deliver(anyString(), anyString())).thenReturn(DeliveryResult.fallback());
    }

    // ---------- helpers ----------

    private ResultActions postJson(String path, String json) throws Exception {
        return mockMvc.perform(post(path).contentType(MediaType.APPLICATION_JSON).content(json));
    }

    private String loginForSession(String identifier, String password) throws Exception {
        String body = postJson("/auth/login",
                "{\"identifier\":\"" + identifier + "\",\"password\":\"" + password + "\"}")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.otpRequired").value(true))
                .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(body).get("sessionToken").asText();
    }

    private String lastCodeSentTo(String contact) {
        ArgumentCaptor<String> code = ArgumentCaptor.forClass(String.class);
        verify(notificationDispatcher, atLeastOnce()).deliver(eq(contact), code.capture());
        List<String> all = code.getAllValues();
        return all.get(all.size() - 1);
    }

    private ResultActions verifyOtp(String sessionToken, String code) throws Exception {
        return postJson("/auth/verify-otp",
                "{\"sessionToken\":\"" + sessionToken + "\",\"code\":\"" + code + "\"}");
    }

    /** Full login for {@code identifier}; returns the verify-otp response body. */
    private JsonNode signIn(String identifier, String password) throws Exception {
        String sessionToken = loginForSession(identifier, password);
        String body = verifyOtp(sessionToken, lastCodeSentTo(identifier))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(body);
    }

    // ---------- scenarios ----------

    @Test
    void loginVerifyThenReplayIsRejected() throws Exception {
        String sessionToken = loginForSession("stud1", "student123");
        String code = lastCodeSentTo("stud1");

        String body = verifyOtp(sessionToken, code)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.user.identifier").value("stud1"))
                .andExpect(jsonPath("$.user.role").value("STUDENT"))
                .andExpect(jsonPath("$.user.passwordHash").doesNotExist())
                .andExpect(jsonPath("$.token").isNotEmpty())
                .andExpect(jsonPath("$.expiresIn").value(Duration.ofDays(7).toSeconds()))
                .andReturn().getResponse().getContentAsString();

        verifyOtp(sessionToken, code)
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.reason").value("AlreadyUsed"));

        String jwt = objectMapper.readTree(body).get("token").asText();
        mockMvc.perform(get("/auth/me").header("Authorization", "Bearer " + jwt))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.identifier").value("stud1"))
                .andExpect(jsonPath("$.displayName").exists())
                .andExpect(jsonPath("$.role").value("STUDENT"));
    }

    @Test
    void fourthLoginInWindowIsRateLimitedUntilWindowPasses() throws Exception {
        for (int i = 0; i < 3; i++) {
            loginForSession("stud1", "student123");
        }

        postJson("/auth/login", "{\"identifier\":\"stud1\",\"password\":\"student123\"}")
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "600"))
                .andExpect(jsonPath("$.retryAfterMinutes").value(10))
                .andExpect(jsonPath("$.message").value("Too many OTP attempts. Try again after 10 minutes."));

        assertThat(challengeRepository.count()).isEqualTo(3);

        clock.advance(Duration.ofMinutes(10).plusSeconds(1));
        loginForSession("stud1", "student123");
    }

    @Test
    void resendSharesTheLoginBudget() throws Exception {
        String sessionToken = loginForSession("stud1", "student123");
        loginForSession("stud1", "student123");
        loginForSession("stud1", "student123");

        postJson("/auth/resend-otp", "{\"sessionToken\":\"" + sessionToken + "\"}")
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.reason").value("RateLimited"));
    }

    @Test
    void codeIsRejectedOnceExpired() throws Exception {
        String sessionToken = loginForSession("stud1", "student123");
        String code = lastCodeSentTo("stud1");

        clock.advance(Duration.ofMinutes(5));

        verifyOtp(sessionToken, code)
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.reason").value("Expired"));
    }

    @Test
    void wrongCodeLeavesChallengeRedeemable() throws Exception {
        String sessionToken = loginForSession("stud1", "student123");
        String code = lastCodeSentTo("stud1");
        String wrong = code.equals("000000") ? "000001" : "000000";

        verifyOtp(sessionToken, wrong)
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.reason").value("InvalidCode"));

        verifyOtp(sessionToken, code).andExpect(status().isOk());
    }

    @Test
    void unknownSessionTokenIsInvalidSession() throws Exception {
        verifyOtp("f".repeat(64), "123456")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.reason").value("InvalidSession"));

        postJson("/auth/resend-otp", "{\"sessionToken\":\"" + "f".repeat(64) + "\"}")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.reason").value("InvalidSession"));
    }

    @Test
    void unknownUserAndWrongPasswordLookTheSame() throws Exception {
        String unknown = postJson("/auth/login", "{\"identifier\":\"nobody\",\"password\":\"student123\"}")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.reason").value("InvalidCredentials"))
                .andReturn().getResponse().getContentAsString();
        String wrong = postJson("/auth/login", "{\"email\":\"stud1\",\"password\":\"nope\"}")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.reason").value("InvalidCredentials"))
                .andReturn().getResponse().getContentAsString();

        JsonNode a = objectMapper.readTree(unknown);
        JsonNode b = objectMapper.readTree(wrong);
        assertThat(a.get("message")).isEqualTo(b.get("message"));
        assertThat(a.get("title")).isEqualTo(b.get("title"));
        assertThat(challengeRepository.count()).isZero();
    }

    @Test
    void concurrentVerifySucceedsExactlyOnce() throws Exception {
        String sessionToken = loginForSession("stud1", "student123");
        String code = lastCodeSentTo("stud1");

        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<AuthOutcome>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                Callable<AuthOutcome> attempt = () -> {
                    start.await();
                    return authService.verifyOtp(sessionToken, code);
                };
                results.add(pool.submit(attempt));
            }
            start.countDown();

            int issued = 0;
            int alreadyUsed = 0;
            for (Future<AuthOutcome> f : results) {
                AuthOutcome outcome = f.get(10, TimeUnit.SECONDS);
                if (outcome instanceof AuthOutcome.TokenIssued) {
                    issued++;
                } else if (outcome.equals(AuthOutcome.rejected(AuthFailure.ALREADY_USED))) {
                    alreadyUsed++;
                }
            }
            assertThat(issued).isEqualTo(1);
            assertThat(alreadyUsed).isEqualTo(threads - 1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void resendKeepsPreviousChallengeRedeemable() throws Exception {
        String first = loginForSession("stud1", "student123");
        String firstCode = lastCodeSentTo("stud1");

        String resent = postJson("/auth/resend-otp", "{\"sessionToken\":\"" + first + "\"}")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("OTP resent"))
                .andReturn().getResponse().getContentAsString();
        String second = objectMapper.readTree(resent).get("sessionToken").asText();
        String secondCode = lastCodeSentTo("stud1");

        assertThat(second).isNotEqualTo(first);
        verifyOtp(first, firstCode).andExpect(status().isOk());
        verifyOtp(second, secondCode).andExpect(status().isOk());
    }

    @Test
    void resendAfterExpiryIssuesFreshChallenge() throws Exception {
        String expired = loginForSession("stud1", "student123");
        String expiredCode = lastCodeSentTo("stud1");

        clock.advance(Duration.ofMinutes(6));

        String resent = postJson("/auth/resend-otp", "{\"sessionToken\":\"" + expired + "\"}")
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        String fresh = objectMapper.readTree(resent).get("sessionToken").asText();
        String freshCode = lastCodeSentTo("stud1");

        assertThat(fresh).isNotEqualTo(expired).hasSize(64);
        verifyOtp(fresh, freshCode).andExpect(status().isOk());
        verifyOtp(expired, expiredCode)
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.reason").value("Expired"));
    }

    @Test
    void resendEmailAliasAndUsedChallenge() throws Exception {
        String sessionToken = loginForSession("stud1", "student123");
        verifyOtp(sessionToken, lastCodeSentTo("stud1")).andExpect(status().isOk());

        postJson("/auth/resend-otp-email", "{\"sessionToken\":\"" + sessionToken + "\"}")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.reason").value("AlreadyUsed"));
    }

    @Test
    void storedChallengeNeverContainsTheCode() throws Exception {
        String sessionToken = loginForSession("stud1", "student123");
        String code = lastCodeSentTo("stud1");

        OtpChallenge row = challengeRepository.findByToken(sessionToken).orElseThrow();
        assertThat(row.getCodeHash()).hasSize(64).isNotEqualTo(code).doesNotContain(code);
        assertThat(row.isUsed()).isFalse();
        assertThat(row.getExpiresAt()).isEqualTo(row.getCreatedAt().plus(Duration.ofMinutes(5)));
    }

    @Test
    void signupThenLoginSendsCodeToContact() throws Exception {
        postJson("/auth/signup", """
                {"identifier":"Teacher7@School.edu","password":"pw-123456","displayName":"T Seven",
                 "contact":"+919812345678","role":"TEACHER"}""")
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.ok").value(true));

        postJson("/auth/signup", """
                {"identifier":"teacher7@school.edu","password":"x","displayName":"Dup"}""")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.reason").value("DuplicateIdentifier"));

        loginForSession("teacher7@school.edu", "pw-123456");
        verify(notificationDispatcher).deliver(eq("+919812345678"), anyString());
    }

    @Test
    void signupValidation() throws Exception {
        postJson("/auth/signup", "{\"identifier\":\"someone\",\"displayName\":\"No Password\"}")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.reason").value("ValidationError"));

        postJson("/auth/signup", """
                {"identifier":"wannabe","password":"pw","displayName":"W","role":"ADMIN"}""")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.reason").value("ValidationError"));
    }

    @Test
    void userLookupIsForbiddenForStudents() throws Exception {
        JsonNode student = signIn("stud1", "student123");
        String studentId = student.at("/user/id").asText();

        mockMvc.perform(get("/auth/users/" + studentId)
                        .header("Authorization", "Bearer " + student.get("token").asText()))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.status").value(403))
                .andExpect(jsonPath("$.reason").value("Forbidden"))
                .andExpect(jsonPath("$.type").value("https://edudata.dev/problems/forbidden"));
    }

    @Test
    void userLookupAllowsTeacherAndAdmin() throws Exception {
        String studentId = signIn("stud1", "student123").at("/user/id").asText();

        postJson("/auth/signup", """
                {"identifier":"teacher9","password":"pw-999999","displayName":"T Nine","role":"TEACHER"}""")
                .andExpect(status().isCreated());
        String teacherJwt = signIn("teacher9", "pw-999999").get("token").asText();
        String adminJwt = signIn("admin", "admin123").get("token").asText();

        for (String jwt : List.of(teacherJwt, adminJwt)) {
            mockMvc.perform(get("/auth/users/" + studentId).header("Authorization", "Bearer " + jwt))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.identifier").value("stud1"))
                    .andExpect(jsonPath("$.role").value("STUDENT"))
                    .andExpect(jsonPath("$.contact").doesNotExist());
        }

        mockMvc.perform(get("/auth/users/" + UUID.randomUUID()).header("Authorization", "Bearer " + adminJwt))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.reason").value("UserNotFound"));
    }

    @Test
    void userLookupWithoutTokenIsUnauthorized() throws Exception {
        mockMvc.perform(get("/auth/users/" + UUID.randomUUID()))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void meRequiresValidBearerToken() throws Exception {
        mockMvc.perform(get("/auth/me"))
                .andExpect(status().isUnauthorized())
                .andExpect(header().string("WWW-Authenticate", "Bearer"));

        mockMvc.perform(get("/auth/me").header("Authorization", "Bearer not.a.token"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.reason").value("Unauthorized"));
    }
}
