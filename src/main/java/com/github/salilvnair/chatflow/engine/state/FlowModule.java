package com.github.salilvnair.chatflow.engine.state;

/**
 * Top level area a state belongs to. Each module has a menu state that acts as its
 * landing point when a flow is abandoned or restarted.
 */
public enum FlowModule {
    MAIN("Main menu"),
    GST("GST"),
    ITR("ITR"),
    SETTINGS("Settings"),
    CONNECT_CA("Connect with CA");

    private final String label;

    FlowModule(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public ConversationState menuState() {
        return switch (this) {
            case GST -> ConversationState.GST_MENU;
            case ITR -> ConversationState.ITR_MENU;
            case SETTINGS -> ConversationState.SETTINGS_MENU;
            case CONNECT_CA -> ConversationState.CONNECT_CA_MENU;
            case MAIN -> ConversationState.MAIN_MENU;
        };
    }
}
