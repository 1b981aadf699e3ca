package com.edudata.authservice.config;

import com.twilio.http.TwilioRestClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

@Slf4j
@Configuration
public class NotificationConfig {

    public static final String NOTIFICATION_EXECUTOR = "notificationExecutor";

    /**
     * Twilio client, created once at startup and only when all three credentials are present.
     * Without it the dispatcher uses the operator log channel for phone contacts.
     */
    @Bean
    @ConditionalOnExpression("'${auth.notification.twilio.account-sid:}' != '' "
            + "and '${auth.notification.twilio.auth-token:}' != '' "
            + "and '${auth.notification.twilio.from-number:}' != ''")
    public TwilioRestClient twilioRestClient(AuthProperties properties) {
        AuthProperties.Notification.Twilio twilio = properties.getNotification().getTwilio();
        log.info("Twilio SMS channel enabled (from={})", twilio.getFromNumber());
        return new TwilioRestClient.Builder(twilio.getAccountSid(), twilio.getAuthToken()).build();
    }

    /**
     * Bounded pool for external sends. Callers wait at most the dispatch timeout;
     * when the queue is full the send is rejected and the caller falls back.
     */
    @Bean(name = NOTIFICATION_EXECUTOR)
    public ThreadPoolTaskExecutor notificationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("otc-notify-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
