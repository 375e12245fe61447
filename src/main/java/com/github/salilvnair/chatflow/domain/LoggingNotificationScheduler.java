package com.github.salilvnair.chatflow.domain;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LoggingNotificationScheduler implements NotificationScheduler {

    @Override
    public void updatePreferences(String userId, NotificationPreferences preferences) {
        log.info("Notification preferences userId={} prefs={}", userId, preferences);
    }

    @Override
    public void notifySuppliers(String userId, String gstin, int supplierCount) {
        log.info("Supplier reminder requested userId={} gstin={} suppliers={}", userId, gstin, supplierCount);
    }

    @Override
    public void requestCaCallback(String userId, String question) {
        log.info("CA callback requested userId={} hasQuestion={}", userId, question != null);
    }
}
