package com.github.salilvnair.chatflow.engine.command;

import com.github.salilvnair.chatflow.engine.state.ChatSession;
import com.github.salilvnair.chatflow.engine.state.ConversationState;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Evaluates the universal shortcuts before any handler sees the event. Does not
 * modify the session.
 */
@Component
public class GlobalCommandInterceptor {

    private static final Pattern EDGE_PUNCTUATION = Pattern.compile("^[\\p{Punct}\\s]+|[\\p{Punct}\\s]+$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public Optional<CommandTransition> intercept(String rawText, ChatSession session) {
        String normalized = normalize(rawText);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        boolean allowAliases = !session.getState().isFreeInput();
        return GlobalCommand.match(normalized, allowAliases)
                .map(command -> toTransition(command, session));
    }

    static String normalize(String rawText) {
        if (rawText == null) {
            return "";
        }
        String collapsed = WHITESPACE.matcher(rawText.trim().toLowerCase(Locale.ROOT)).replaceAll(" ");
        if (collapsed.isEmpty()) {
            return "";
        }
        String stripped = EDGE_PUNCTUATION.matcher(collapsed).replaceAll("");
        if (stripped.isEmpty() && collapsed.chars().allMatch(c -> c == '?')) {
            return "?";
        }
        return stripped;
    }

    private CommandTransition toTransition(GlobalCommand command, ChatSession session) {
        ConversationState current = session.getState();
        return switch (command) {
            case HOME -> new CommandTransition(command, CommandTransition.Effect.GO_HOME, ConversationState.MAIN_MENU);
            case BACK -> back(command, session);
            case NIL_FILING -> new CommandTransition(command, CommandTransition.Effect.PUSH_AND_JUMP, ConversationState.NIL_FILING_MENU);
            case HELP -> new CommandTransition(command, CommandTransition.Effect.SHOW_HELP, current);
            case RESTART -> new CommandTransition(command, CommandTransition.Effect.WIPE, ConversationState.MAIN_MENU);
            case TALK_TO_CA -> new CommandTransition(command, CommandTransition.Effect.HANDOFF, current);
        };
    }

    private CommandTransition back(GlobalCommand command, ChatSession session) {
        Optional<ConversationState> previous = session.getStack().peek();
        if (previous.isPresent()) {
            return new CommandTransition(command, CommandTransition.Effect.POP, previous.get());
        }
        if (session.getState() != ConversationState.MAIN_MENU) {
            return new CommandTransition(command, CommandTransition.Effect.POP_TO_ROOT, ConversationState.MAIN_MENU);
        }
        return new CommandTransition(command, CommandTransition.Effect.NOTHING_TO_POP, ConversationState.MAIN_MENU);
    }
}
