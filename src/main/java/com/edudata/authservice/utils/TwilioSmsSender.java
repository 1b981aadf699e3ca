package com.edudata.authservice.utils;

import com.edudata.authservice.config.AuthProperties;
import com.twilio.http.TwilioRestClient;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * One-time-code SMS through Twilio. Errors propagate; the dispatcher decides on fallback.
 */
@Slf4j
@RequiredArgsConstructor
public class TwilioSmsSender {

    private final TwilioRestClient client;
    private final AuthProperties properties;

    public void sendOtp(String to, String otp) {
        AuthProperties.Notification.Twilio twilio = properties.getNotification().getTwilio();
        Message message = Message.creator(
                new PhoneNumber(to),
                new PhoneNumber(twilio.getFromNumber()),
                OtcMessages.body(otp, properties.getOtc().getTtl())
        ).create(client);

        log.debug("SMS queued to {} sid={} status={}",
                ContactMasking.mask(to), message.getSid(), message.getStatus());
    }
}
