package com.github.salilvnair.chatflow.domain;

/**
 * Schedules notifications and hand-offs that happen outside the conversation.
 */
public interface NotificationScheduler {

    void updatePreferences(String userId, NotificationPreferences preferences);

    void notifySuppliers(String userId, String gstin, int supplierCount);

    /**
     * @param question free text from the user, or {@code null} for a plain callback request
     */
    void requestCaCallback(String userId, String question);

    record NotificationPreferences(boolean filingReminders, boolean riskAlerts, boolean statusUpdates) {

        public boolean allOff() {
            return !filingReminders && !riskAlerts && !statusUpdates;
        }
    }
}
