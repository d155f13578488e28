package com.z254.butterfly.sentinel.notification;

/**
 * Delivery adapter for one or more channels.
 */
public interface NotificationSink {

    boolean supports(NotificationChannel channel);

    /**
     * Deliver the notification on the channel.
     *
     * @return whether the notification was delivered (or handed off for delivery)
     * @throws NotificationDeliveryException when the channel rejected the notification
     */
    boolean send(Notification notification, NotificationChannel channel);
}
