package com.github.salilvnair.chatflow.engine.transition;

import com.github.salilvnair.chatflow.engine.session.EngineSession;
import com.github.salilvnair.chatflow.engine.state.ChatSession;
import com.github.salilvnair.chatflow.engine.state.ConversationState;
import com.github.salilvnair.chatflow.i18n.ReplyComposer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fallback dispatch for events no handler took. Unknown input re-renders the current
 * prompt with a "didn't understand" notice and leaves the state alone.
 */
@Slf4j
@Component
public class StateTransitionCore {

    private final TransitionTable table;
    private final ReplyComposer replies;

    public StateTransitionCore(List<TransitionTableContributor> contributors, ReplyComposer replies) {
        TransitionTable.Builder builder = TransitionTable.builder();
        contributors.forEach(c -> c.contribute(builder));
        this.table = builder.build();
        this.replies = replies;
        log.info("ChatFlow transition table: {} rules over {} states", table.size(), table.states().size());
    }

    public void apply(EngineSession session) {
        ChatSession chat = session.getSession();
        ClassifiedInput input = InputClassifier.classify(session.getEvent(), chat.getState());
        Optional<TransitionRule> match = table.find(chat.getState(), input);
        if (match.isEmpty()) {
            log.debug("No transition userId={} state={} kind={}", chat.getUserId(), chat.getState(), input.kind());
            session.addReply(replies.noticeWithPrompt(chat, ReplyComposer.DID_NOT_UNDERSTAND, Map.of()));
            return;
        }

        TransitionRule rule = match.get();
        ActionResult result = rule.action().execute(session, input);
        if (!result.stay()) {
            ConversationState next = result.redirect() != null ? result.redirect() : rule.nextState();
            if (next != null) {
                chat.transitionTo(next, rule.pushCurrent());
            }
        }
        if (result.showPrompt()) {
            session.addReply(replies.prompt(chat));
        }
    }

    public TransitionTable table() {
        return table;
    }
}
