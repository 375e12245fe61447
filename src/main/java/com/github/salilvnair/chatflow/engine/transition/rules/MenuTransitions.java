package com.github.salilvnair.chatflow.engine.transition.rules;

import com.github.salilvnair.chatflow.engine.state.ChatSession;
import com.github.salilvnair.chatflow.engine.state.ConversationState;
import com.github.salilvnair.chatflow.engine.state.FlowModule;
import com.github.salilvnair.chatflow.engine.state.Language;
import com.github.salilvnair.chatflow.engine.state.SessionKeys;
import com.github.salilvnair.chatflow.engine.transition.ActionResult;
import com.github.salilvnair.chatflow.engine.transition.TransitionAction;
import com.github.salilvnair.chatflow.engine.transition.TransitionTable;
import com.github.salilvnair.chatflow.engine.transition.TransitionTableContributor;
import com.github.salilvnair.chatflow.i18n.ReplyComposer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

import static com.github.salilvnair.chatflow.engine.state.ConversationState.*;

/**
 * Main menu, settings, language selection and the module switch shortcut.
 */
@Component
@RequiredArgsConstructor
public class MenuTransitions implements TransitionTableContributor {

    private final ReplyComposer replies;

    @Override
    public void contribute(TransitionTable.Builder table) {
        table.choice(MAIN_MENU, "1", GST_MENU)
                .choice(MAIN_MENU, "2", ITR_MENU)
                .choice(MAIN_MENU, "3", CONNECT_CA_MENU)
                .choice(MAIN_MENU, "4", SETTINGS_MENU)
                .keyword(MAIN_MENU, "hi", null, TransitionAction.NONE)
                .keyword(MAIN_MENU, "hello", null, TransitionAction.NONE)
                .keyword(MAIN_MENU, "start", null, TransitionAction.NONE);

        table.choice(SETTINGS_MENU, "1", LANG_MENU)
                .choice(SETTINGS_MENU, "2", NOTIFICATION_SETTINGS)
                .choice(SETTINGS_MENU, "3", MULTI_GSTIN_MENU);

        Language[] languages = Language.values();
        for (int i = 0; i < languages.length; i++) {
            Language language = languages[i];
            table.choice(LANG_MENU, String.valueOf(i + 1), SETTINGS_MENU, false, (session, input) -> {
                session.getSession().setLanguage(language);
                session.addReply(replies.message(session.getSession(), "notice.language_updated",
                        Map.of("languageName", language.displayName())));
                return ActionResult.proceed();
            });
        }

        switchShortcut(table, GST_MENU, "itr", FlowModule.ITR);
        switchShortcut(table, ITR_MENU, "gst", FlowModule.GST);
        switchShortcut(table, CONNECT_CA_MENU, "gst", FlowModule.GST);
        switchShortcut(table, CONNECT_CA_MENU, "itr", FlowModule.ITR);
    }

    private void switchShortcut(TransitionTable.Builder table,
                                ConversationState from,
                                String keyword,
                                FlowModule target) {
        table.keyword(from, keyword, CONFIRM_SWITCH_MODULE, (session, input) -> {
            ChatSession chat = session.getSession();
            chat.put(SessionKeys.SWITCH_SOURCE, from.name());
            chat.put(SessionKeys.SWITCH_TARGET, target.menuState().name());
            chat.put(SessionKeys.SWITCH_SOURCE_LABEL, from.module().label());
            chat.put(SessionKeys.SWITCH_TARGET_LABEL, target.label());
            return ActionResult.proceed();
        });
    }
}
