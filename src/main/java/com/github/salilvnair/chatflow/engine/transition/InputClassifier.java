package com.github.salilvnair.chatflow.engine.transition;

import com.github.salilvnair.chatflow.engine.model.InboundEvent;
import com.github.salilvnair.chatflow.engine.state.ConversationState;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

public final class InputClassifier {

    private static final Pattern MENU_CHOICE = Pattern.compile("^\\d{1,2}$");
    private static final Set<String> AFFIRMATIVE = Set.of("yes", "y", "ok", "okay", "confirm", "haan", "ha");
    private static final Set<String> NEGATIVE = Set.of("no", "n", "cancel", "nahi");

    private InputClassifier() {
    }

    /**
     * Free-input states classify all text as {@link InputKind#FREE_TEXT}, so that e.g. a
     * two digit amount is not mistaken for a menu choice.
     */
    public static ClassifiedInput classify(InboundEvent event, ConversationState state) {
        if (event.isMedia()) {
            return new ClassifiedInput(InputKind.MEDIA, null, event.textOrEmpty().trim());
        }
        String raw = event.textOrEmpty().trim();
        String lower = raw.toLowerCase(Locale.ROOT);
        if (state.isFreeInput()) {
            return new ClassifiedInput(InputKind.FREE_TEXT, lower, raw);
        }
        if (MENU_CHOICE.matcher(lower).matches()) {
            return new ClassifiedInput(InputKind.NUMERIC_CHOICE, String.valueOf(Integer.parseInt(lower)), raw);
        }
        String word = lower.replaceAll("[\\p{Punct}\\s]+$", "");
        if (AFFIRMATIVE.contains(word)) {
            return new ClassifiedInput(InputKind.CONFIRMATION, "yes", raw);
        }
        if (NEGATIVE.contains(word)) {
            return new ClassifiedInput(InputKind.CONFIRMATION, "no", raw);
        }
        return new ClassifiedInput(InputKind.FREE_TEXT, lower, raw);
    }

    public static boolean isAffirmative(String text) {
        if (text == null) {
            return false;
        }
        String word = text.trim().toLowerCase(Locale.ROOT).replaceAll("[\\p{Punct}\\s]+$", "");
        return AFFIRMATIVE.contains(word);
    }
}
