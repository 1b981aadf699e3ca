package com.edudata.authservice.utils;

import java.time.Duration;

public final class OtcMessages {

    private OtcMessages() {}

    public static final String EMAIL_SUBJECT = "Your EduData OTP";

    public static String body(String code, Duration ttl) {
        long minutes = Math.max(1, ttl.toMinutes());
        return "Your EduData OTP is: " + code + ". It expires in " + minutes + " minutes.";
    }
}
