package com.z254.butterfly.sentinel.notification;

public class NotificationDeliveryException extends RuntimeException {

    private final NotificationChannel channel;

    public NotificationDeliveryException(NotificationChannel channel, String message, Throwable cause) {
        super(message, cause);
        this.channel = channel;
    }

    public NotificationChannel getChannel() {
        return channel;
    }
}
