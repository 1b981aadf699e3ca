package com.edudata.authservice.service;

import com.edudata.authservice.model.DeliveryResult;

public interface NotificationDispatcher {

    /**
     * Sends {@code code} to {@code contact}. Time-bounded and never throws: any
     * failure of the external channel ends in the fallback channel.
     */
    DeliveryResult deliver(String contact, String code);
}
