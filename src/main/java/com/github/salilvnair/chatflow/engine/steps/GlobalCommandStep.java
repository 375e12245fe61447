package com.github.salilvnair.chatflow.engine.steps;

import com.github.salilvnair.chatflow.engine.command.CommandTransition;
import com.github.salilvnair.chatflow.engine.command.GlobalCommandInterceptor;
import com.github.salilvnair.chatflow.engine.pipeline.EngineStep;
import com.github.salilvnair.chatflow.engine.pipeline.StepResult;
import com.github.salilvnair.chatflow.engine.session.EngineSession;
import com.github.salilvnair.chatflow.engine.state.ChatSession;
import com.github.salilvnair.chatflow.i18n.ReplyComposer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class GlobalCommandStep implements EngineStep {

    private final GlobalCommandInterceptor interceptor;
    private final ReplyComposer replies;

    @Override
    public StepResult execute(EngineSession session) {
        ChatSession chat = session.getSession();
        Optional<CommandTransition> intercepted = interceptor.intercept(session.getEvent().text(), chat);
        if (intercepted.isEmpty()) {
            return new StepResult.Continue();
        }
        CommandTransition transition = intercepted.get();
        log.debug("Global command userId={} command={} effect={} from={}",
                chat.getUserId(), transition.command(), transition.effect(), chat.getState());

        transition.applyTo(chat);
        if (!transition.mutatesSession()) {
            session.markReadOnly();
        }

        switch (transition.effect()) {
            case SHOW_HELP -> session.addReply(replies.message(chat, "help.commands"));
            case NOTHING_TO_POP -> session.addReply(replies.noticeWithPrompt(chat, "notice.nothing_to_go_back", Map.of()));
            case HANDOFF -> session.addReply(replies.message(chat, "notice.ca_handoff"));
            case WIPE -> {
                session.addReply(replies.message(chat, "notice.restarted"));
                session.addReply(replies.prompt(chat));
            }
            default -> session.addReply(replies.prompt(chat));
        }
        return new StepResult.Stop(session.toResult());
    }
}
