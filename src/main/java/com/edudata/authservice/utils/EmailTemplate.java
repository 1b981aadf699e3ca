package com.edudata.authservice.utils;

import com.edudata.authservice.config.AuthProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.util.StringUtils;

/**
 * Plain-text one-time-code mail. Built by the dispatcher only when a
 * {@link JavaMailSender} is present.
 */
@RequiredArgsConstructor
public class EmailTemplate {

    private final JavaMailSender mailSender;
    private final AuthProperties properties;

    public void sendOtp(String to, String otp) {
        SimpleMailMessage message = new SimpleMailMessage();
        String from = properties.getNotification().getMail().getFrom();
        if (StringUtils.hasText(from)) {
            message.setFrom(from);
        }
        message.setTo(to);
        message.setSubject(OtcMessages.EMAIL_SUBJECT);
        message.setText(OtcMessages.body(otp, properties.getOtc().getTtl()));
        mailSender.send(message);
    }
}
