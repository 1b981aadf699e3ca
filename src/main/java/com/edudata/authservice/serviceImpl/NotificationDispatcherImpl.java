package com.edudata.authservice.serviceImpl;

import com.edudata.authservice.config.AuthProperties;
import com.edudata.authservice.config.NotificationConfig;
import com.edudata.authservice.model.DeliveryResult;
import com.edudata.authservice.model.DeliveryResult.Transport;
import com.edudata.authservice.service.NotificationDispatcher;
import com.edudata.authservice.utils.ContactMasking;
import com.edudata.authservice.utils.EmailTemplate;
import com.edudata.authservice.utils.TwilioSmsSender;
import com.twilio.http.TwilioRestClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Picks a transport for a contact and sends on the notification executor, waiting at most
 * the dispatch timeout. Anything short of a confirmed send ends in the operator log.
 */
@Slf4j
@Service
public class NotificationDispatcherImpl implements NotificationDispatcher {

    private final AuthProperties properties;
    private final TwilioSmsSender smsSender;   // null when Twilio is not configured
    private final EmailTemplate emailTemplate; // null when mail is disabled or unavailable
    private final Executor executor;

    @Autowired
    public NotificationDispatcherImpl(AuthProperties properties,
                                      ObjectProvider<TwilioRestClient> twilioClient,
                                      ObjectProvider<JavaMailSender> mailSender,
                                      @Qualifier(NotificationConfig.NOTIFICATION_EXECUTOR) Executor executor) {
        this(properties,
                smsSenderOf(twilioClient.getIfAvailable(), properties),
                emailTemplateOf(mailSender.getIfAvailable(), properties),
                executor);
    }

    NotificationDispatcherImpl(AuthProperties properties,
                               TwilioSmsSender smsSender,
                               EmailTemplate emailTemplate,
                               Executor executor) {
        this.properties = properties;
        this.smsSender = smsSender;
        this.emailTemplate = emailTemplate;
        this.executor = executor;
        log.info("OTP delivery channels: sms={} email={} fallback=log",
                smsSender != null, emailTemplate != null);
    }

    @Override
    public DeliveryResult deliver(String contact, String code) {
        Transport transport = transportFor(contact);
        if (transport == Transport.LOG) {
            return fallback(contact, code);
        }

        CompletableFuture<Void> send;
        try {
            send = CompletableFuture.runAsync(() -> {
                if (transport == Transport.SMS) {
                    smsSender.sendOtp(contact, code);
                } else {
                    emailTemplate.sendOtp(contact, code);
                }
            }, executor);
        } catch (RejectedExecutionException e) {
            log.warn("DeliveryDegraded: {} queue full for {}", transport, ContactMasking.mask(contact));
            return fallback(contact, code);
        }

        Duration timeout = properties.getNotification().getDispatchTimeout();
        try {
            send.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            log.info("OTP sent via {} to {}", transport, ContactMasking.mask(contact));
            return DeliveryResult.external(transport);
        } catch (TimeoutException e) {
            send.cancel(true);
            log.warn("DeliveryDegraded: {} send to {} timed out after {}",
                    transport, ContactMasking.mask(contact), timeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("DeliveryDegraded: {} send to {} failed: {}",
                    transport, ContactMasking.mask(contact), cause.toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            send.cancel(true);
            log.warn("DeliveryDegraded: interrupted while sending {} to {}", transport, ContactMasking.mask(contact));
        }
        return fallback(contact, code);
    }

    private Transport transportFor(String contact) {
        if (contact == null) {
            return Transport.LOG;
        }
        if (contact.startsWith("+") && smsSender != null) {
            return Transport.SMS;
        }
        if (contact.contains("@") && emailTemplate != null) {
            return Transport.EMAIL;
        }
        return Transport.LOG;
    }

    /** Operator channel: the only place a plaintext code is ever written. */
    private DeliveryResult fallback(String contact, String code) {
        log.info("[OTP] contact={} code={}", ContactMasking.mask(contact), code);
        return DeliveryResult.fallback();
    }

    private static TwilioSmsSender smsSenderOf(TwilioRestClient client, AuthProperties properties) {
        if (client == null || !properties.getNotification().getTwilio().isConfigured()) {
            return null;
        }
        return new TwilioSmsSender(client, properties);
    }

    private static EmailTemplate emailTemplateOf(JavaMailSender mailSender, AuthProperties properties) {
        if (mailSender == null || !properties.getNotification().getMail().isEnabled()) {
            return null;
        }
        return new EmailTemplate(mailSender, properties);
    }
}
