package com.github.salilvnair.chatflow.engine.handler.flow;

import com.github.salilvnair.chatflow.domain.NotificationScheduler;
import com.github.salilvnair.chatflow.domain.NotificationScheduler.NotificationPreferences;
import com.github.salilvnair.chatflow.engine.handler.AbstractFlowHandler;
import com.github.salilvnair.chatflow.engine.handler.HandlerOutcome;
import com.github.salilvnair.chatflow.engine.session.EngineSession;
import com.github.salilvnair.chatflow.engine.state.ChatSession;
import com.github.salilvnair.chatflow.engine.state.ConversationState;
import com.github.salilvnair.chatflow.engine.state.SessionKeys;
import com.github.salilvnair.chatflow.i18n.ReplyComposer;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class NotificationSettingsHandler extends AbstractFlowHandler {

    static final Map<String, NotificationPreferences> PRESETS = Map.of(
            "1", new NotificationPreferences(true, false, false),
            "2", new NotificationPreferences(false, true, false),
            "3", new NotificationPreferences(false, false, true),
            "4", new NotificationPreferences(true, true, true),
            "5", new NotificationPreferences(false, false, false)
    );

    private final NotificationScheduler notificationScheduler;

    public NotificationSettingsHandler(ReplyComposer replies, NotificationScheduler notificationScheduler) {
        super(replies, ConversationState.NOTIFICATION_SETTINGS);
        this.notificationScheduler = notificationScheduler;
    }

    @Override
    public HandlerOutcome handle(EngineSession session) {
        NotificationPreferences preferences = PRESETS.get(session.userText());
        if (preferences == null) {
            return HandlerOutcome.pass();
        }
        ChatSession chat = session.getSession();
        notificationScheduler.updatePreferences(chat.getUserId(), preferences);

        Map<String, Object> stored = new LinkedHashMap<>();
        stored.put("filing_reminders", preferences.filingReminders());
        stored.put("risk_alerts", preferences.riskAlerts());
        stored.put("status_updates", preferences.statusUpdates());
        chat.put(SessionKeys.NOTIFICATION_PREFS, stored);

        String key = preferences.allOff() ? "notifications.all_off" : "notifications.updated";
        return HandlerOutcome.handled(
                message(session, key),
                enter(session, ConversationState.SETTINGS_MENU, false)
        );
    }
}
