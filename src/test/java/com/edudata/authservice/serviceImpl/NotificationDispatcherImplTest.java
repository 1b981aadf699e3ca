package com.edudata.authservice.serviceImpl;

import com.edudata.authservice.config.AuthProperties;
import com.edudata.authservice.model.DeliveryResult;
import com.edudata.authservice.utils.EmailTemplate;
import com.edudata.authservice.utils.TwilioSmsSender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class NotificationDispatcherImplTest {

    private AuthProperties properties;
    private TwilioSmsSender sms;
    private EmailTemplate email;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        properties = new AuthProperties();
        properties.getNotification().setDispatchTimeout(Duration.ofMillis(200));
        sms = mock(TwilioSmsSender.class);
        email = mock(EmailTemplate.class);
        executor = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void phoneContactGoesOutBySms() {
        NotificationDispatcherImpl dispatcher = new NotificationDispatcherImpl(properties, sms, email, executor);

        DeliveryResult result = dispatcher.deliver("+919876543210", "123456");

        assertThat(result).isEqualTo(DeliveryResult.external(DeliveryResult.Transport.SMS));
        verify(sms).sendOtp("+919876543210", "123456");
        verifyNoInteractions(email);
    }

    @Test
    void emailContactGoesOutByMail() {
        NotificationDispatcherImpl dispatcher = new NotificationDispatcherImpl(properties, sms, email, executor);

        DeliveryResult result = dispatcher.deliver("stud1@school.edu", "123456");

        assertThat(result.isExternal()).isTrue();
        assertThat(result.transport()).isEqualTo(DeliveryResult.Transport.EMAIL);
        verify(email).sendOtp("stud1@school.edu", "123456");
    }

    @Test
    void noConfiguredChannelUsesLog() {
        NotificationDispatcherImpl dispatcher = new NotificationDispatcherImpl(properties, (TwilioSmsSender) null, (EmailTemplate) null, executor);

        assertThat(dispatcher.deliver("+919876543210", "123456")).isEqualTo(DeliveryResult.fallback());
        assertThat(dispatcher.deliver("stud1", "123456")).isEqualTo(DeliveryResult.fallback());
    }

    @Test
    void plainLoginIdUsesLogEvenWithChannelsConfigured() {
        NotificationDispatcherImpl dispatcher = new NotificationDispatcherImpl(properties, sms, email, executor);

        assertThat(dispatcher.deliver("stud1", "123456")).isEqualTo(DeliveryResult.fallback());
        verifyNoInteractions(sms, email);
    }

    @Test
    void providerFailureFallsBackWithoutThrowing() {
        doThrow(new IllegalStateException("provider down")).when(sms).sendOtp(anyString(), anyString());
        NotificationDispatcherImpl dispatcher = new NotificationDispatcherImpl(properties, sms, email, executor);

        DeliveryResult result = dispatcher.deliver("+919876543210", "123456");

        assertThat(result.isExternal()).isFalse();
        assertThat(result.channel()).isEqualTo(DeliveryResult.Channel.FALLBACK);
    }

    @Test
    void slowProviderTimesOutAndFallsBack() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        doAnswer(inv -> {
            release.await(5, TimeUnit.SECONDS);
            return null;
        }).when(sms).sendOtp(anyString(), anyString());
        NotificationDispatcherImpl dispatcher = new NotificationDispatcherImpl(properties, sms, email, executor);

        long started = System.nanoTime();
        DeliveryResult result = dispatcher.deliver("+919876543210", "123456");
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        release.countDown();

        assertThat(result).isEqualTo(DeliveryResult.fallback());
        assertThat(elapsedMillis).isLessThan(2_000);
    }

    @Test
    void rejectedSubmissionFallsBack() {
        NotificationDispatcherImpl dispatcher = new NotificationDispatcherImpl(properties, sms, email, task -> {
            throw new RejectedExecutionException("queue full");
        });

        assertThat(dispatcher.deliver("+919876543210", "123456")).isEqualTo(DeliveryResult.fallback());
        verifyNoInteractions(sms);
    }
}
