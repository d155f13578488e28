package com.z254.butterfly.sentinel.notification;

public enum NotificationChannel {
    LOG,
    EMAIL,
    CHAT,
    PAGER,
    SMS
}
