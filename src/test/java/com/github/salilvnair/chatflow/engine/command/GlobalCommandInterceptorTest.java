package com.github.salilvnair.chatflow.engine.command;

import com.github.salilvnair.chatflow.engine.state.ChatSession;
import com.github.salilvnair.chatflow.engine.state.ConversationState;
import com.github.salilvnair.chatflow.engine.state.Language;
import com.github.salilvnair.chatflow.engine.state.NavigationStack;
import com.github.salilvnair.chatflow.engine.state.SessionKeys;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.github.salilvnair.chatflow.support.TestConstants.T0;
import static com.github.salilvnair.chatflow.support.TestConstants.USER_ID;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GlobalCommandInterceptorTest {

    private final GlobalCommandInterceptor interceptor = new GlobalCommandInterceptor();

    private static ChatSession at(ConversationState state, List<ConversationState> stack) {
        return new ChatSession(USER_ID, state, Language.EN, NavigationStack.of(8, stack),
                new LinkedHashMap<>(), 3L, T0, Set.of());
    }

    private CommandTransition intercept(String text, ChatSession session) {
        return interceptor.intercept(text, session).orElseThrow();
    }

    @ParameterizedTest
    @EnumSource(ConversationState.class)
    void zeroGoesHomeFromEveryState(ConversationState state) {
        ChatSession session = at(state, List.of(ConversationState.GST_MENU));
        session.put(SessionKeys.ITR_PAN, "ABCDE1234F");

        CommandTransition transition = intercept("0", session);
        transition.applyTo(session);

        assertEquals(CommandTransition.Effect.GO_HOME, transition.effect());
        assertEquals(ConversationState.MAIN_MENU, session.getState());
        assertTrue(session.getStack().isEmpty());
        assertEquals(null, session.get(SessionKeys.ITR_PAN));
    }

    @ParameterizedTest
    @EnumSource(ConversationState.class)
    void ninePopsTheStackFromEveryState(ConversationState state) {
        ChatSession session = at(state, List.of(ConversationState.GST_MENU, ConversationState.GST_PERIOD_MENU));

        CommandTransition transition = intercept("9", session);
        transition.applyTo(session);

        assertEquals(CommandTransition.Effect.POP, transition.effect());
        assertEquals(ConversationState.GST_PERIOD_MENU, session.getState());
        assertEquals(List.of(ConversationState.GST_MENU), session.getStack().asList());
    }

    @ParameterizedTest
    @EnumSource(value = ConversationState.class, names = "MAIN_MENU", mode = EnumSource.Mode.EXCLUDE)
    void nineWithEmptyStackReturnsToMainMenu(ConversationState state) {
        ChatSession session = at(state, List.of());

        CommandTransition transition = intercept("9", session);
        transition.applyTo(session);

        assertEquals(CommandTransition.Effect.POP_TO_ROOT, transition.effect());
        assertEquals(ConversationState.MAIN_MENU, session.getState());
    }

    @Test
    void nineAtMainMenuHasNothingToPop() {
        ChatSession session = at(ConversationState.MAIN_MENU, List.of());

        CommandTransition transition = intercept("9", session);
        transition.applyTo(session);

        assertEquals(CommandTransition.Effect.NOTHING_TO_POP, transition.effect());
        assertEquals(ConversationState.MAIN_MENU, session.getState());
    }

    @ParameterizedTest
    @EnumSource(value = ConversationState.class, names = "NIL_FILING_MENU", mode = EnumSource.Mode.EXCLUDE)
    void nilJumpsToNilFilingAndPushesCurrent(ConversationState state) {
        ChatSession session = at(state, List.of());

        CommandTransition transition = intercept("NIL", session);
        transition.applyTo(session);

        assertEquals(CommandTransition.Effect.PUSH_AND_JUMP, transition.effect());
        assertEquals(ConversationState.NIL_FILING_MENU, session.getState());
        if (state != ConversationState.MAIN_MENU) {
            assertEquals(Optional.of(state), session.getStack().peek());
        }
    }

    @ParameterizedTest
    @EnumSource(ConversationState.class)
    void helpLeavesSessionUntouched(ConversationState state) {
        ChatSession session = at(state, List.of(ConversationState.GST_MENU));

        CommandTransition transition = intercept("help", session);
        transition.applyTo(session);

        assertEquals(CommandTransition.Effect.SHOW_HELP, transition.effect());
        assertEquals(false, transition.mutatesSession());
        assertEquals(state, session.getState());
        assertEquals(1, session.getStack().depth());
    }

    @ParameterizedTest
    @EnumSource(ConversationState.class)
    void restartWipesEverything(ConversationState state) {
        ChatSession session = at(state, List.of(ConversationState.GST_MENU));
        session.put(SessionKeys.GSTIN, "27ABCDE1234F1Z5");

        CommandTransition transition = intercept("restart", session);
        transition.applyTo(session);

        assertEquals(CommandTransition.Effect.WIPE, transition.effect());
        assertEquals(ConversationState.MAIN_MENU, session.getState());
        assertTrue(session.getStack().isEmpty());
        assertTrue(session.getData().isEmpty());
    }

    @ParameterizedTest
    @EnumSource(ConversationState.class)
    void caFlagsHandoffWithoutMoving(ConversationState state) {
        ChatSession session = at(state, List.of());

        CommandTransition transition = intercept("Talk to CA", session);
        transition.applyTo(session);

        assertEquals(CommandTransition.Effect.HANDOFF, transition.effect());
        assertEquals(state, session.getState());
        assertEquals(Boolean.TRUE, session.get(SessionKeys.CA_HANDOFF));
    }

    @Test
    void interceptDoesNotModifySession() {
        ChatSession session = at(ConversationState.GST_PERIOD_MENU, List.of(ConversationState.GST_MENU));

        interceptor.intercept("0", session);
        interceptor.intercept("restart", session);

        assertEquals(ConversationState.GST_PERIOD_MENU, session.getState());
        assertEquals(1, session.getStack().depth());
    }

    @Test
    void wordAliasesOnlyOutsideFreeInputStates() {
        assertEquals(GlobalCommand.HOME, intercept("Main Menu", at(ConversationState.GST_MENU, List.of())).command());
        assertEquals(GlobalCommand.BACK, intercept("back!", at(ConversationState.GST_MENU, List.of())).command());
        assertEquals(Optional.empty(), interceptor.intercept("back", at(ConversationState.ITR1_ASK_NAME, List.of())));
        assertEquals(Optional.empty(), interceptor.intercept("menu", at(ConversationState.WAIT_GSTIN, List.of())));
    }

    @ParameterizedTest
    @ValueSource(strings = {"hello", "1", "90", "nil filing", "", "   "})
    void ordinaryInputIsNotIntercepted(String text) {
        assertEquals(Optional.empty(), interceptor.intercept(text, at(ConversationState.GST_MENU, List.of())));
    }

    @Test
    void normalizeCollapsesCaseWhitespaceAndEdgePunctuation() {
        assertEquals("talk to ca", GlobalCommandInterceptor.normalize("  Talk   TO ca. "));
        assertEquals("?", GlobalCommandInterceptor.normalize("??"));
        assertEquals("0", GlobalCommandInterceptor.normalize(" 0 "));
        assertEquals("", GlobalCommandInterceptor.normalize(null));
    }
}
