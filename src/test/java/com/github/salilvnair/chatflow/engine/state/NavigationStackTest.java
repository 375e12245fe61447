package com.github.salilvnair.chatflow.engine.state;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.github.salilvnair.chatflow.engine.state.ConversationState.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NavigationStackTest {

    @Test
    void pushRejectedWhenFullAndExistingEntriesKept() {
        NavigationStack stack = new NavigationStack(2);

        assertTrue(stack.push(GST_MENU));
        assertTrue(stack.push(GST_PERIOD_MENU));
        assertFalse(stack.push(ASK_GST_PERIOD_3B));

        assertEquals(2, stack.depth());
        assertTrue(stack.isFull());
        assertEquals(List.of(GST_MENU, GST_PERIOD_MENU), stack.asList());
    }

    @Test
    void mainMenuIsNeverPushed() {
        NavigationStack stack = new NavigationStack(4);

        assertFalse(stack.push(MAIN_MENU));
        assertFalse(stack.push(null));

        assertTrue(stack.isEmpty());
    }

    @Test
    void popReturnsMostRecentFirst() {
        NavigationStack stack = NavigationStack.of(4, List.of(GST_MENU, NIL_FILING_MENU));

        assertEquals(Optional.of(NIL_FILING_MENU), stack.pop());
        assertEquals(Optional.of(GST_MENU), stack.pop());
        assertEquals(Optional.empty(), stack.pop());
    }

    @Test
    void unwindToRemovesTargetAndEverythingAboveIt() {
        NavigationStack stack = NavigationStack.of(8, List.of(ITR_MENU, ITR1_ASK_PAN, ITR1_ASK_NAME, ITR1_ASK_DOB));

        assertTrue(stack.unwindTo(ITR1_ASK_PAN));

        assertEquals(List.of(ITR_MENU), stack.asList());
        assertFalse(stack.unwindTo(GST_MENU));
        assertEquals(1, stack.depth());
    }

    @Test
    void copyIsIndependent() {
        NavigationStack stack = NavigationStack.of(4, List.of(GST_MENU));
        NavigationStack copy = stack.copy();

        copy.push(WAIT_GSTIN);

        assertEquals(1, stack.depth());
        assertEquals(2, copy.depth());
        assertEquals(4, copy.capacity());
    }

    @Test
    void capacityMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new NavigationStack(0));
    }
}
