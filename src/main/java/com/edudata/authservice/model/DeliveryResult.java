package com.edudata.authservice.model;

/**
 * How a one-time code reached (or was made available for) the user.
 */
public record DeliveryResult(Channel channel, Transport transport) {

    public enum Channel { EXTERNAL, FALLBACK }

    public enum Transport { SMS, EMAIL, LOG }

    public static DeliveryResult external(Transport transport) {
        return new DeliveryResult(Channel.EXTERNAL, transport);
    }

    public static DeliveryResult fallback() {
        return new DeliveryResult(Channel.FALLBACK, Transport.LOG);
    }

    public boolean isExternal() {
        return channel == Channel.EXTERNAL;
    }
}
