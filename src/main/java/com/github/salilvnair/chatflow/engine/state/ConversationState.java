package com.github.salilvnair.chatflow.engine.state;

import java.util.Locale;
import java.util.Optional;

/**
 * Every state a conversation can be in. {@code freeInput} states treat typed text as data,
 * so keyword aliases such as {@code menu} and {@code back} are not intercepted there.
 */
public enum ConversationState {

    // main
    MAIN_MENU(FlowModule.MAIN, false),
    SESSION_RESUME_PROMPT(FlowModule.MAIN, false),
    SENSITIVE_CONFIRM_EXPIRED(FlowModule.MAIN, false),
    CONFIRM_SWITCH_MODULE(FlowModule.MAIN, false),

    // settings
    SETTINGS_MENU(FlowModule.SETTINGS, false),
    LANG_MENU(FlowModule.SETTINGS, false),
    NOTIFICATION_SETTINGS(FlowModule.SETTINGS, false),

    // gst
    GST_MENU(FlowModule.GST, false),
    WAIT_GSTIN(FlowModule.GST, true),
    GST_PERIOD_MENU(FlowModule.GST, false),
    ASK_GST_PERIOD_3B(FlowModule.GST, true),
    ASK_GST_PERIOD_1(FlowModule.GST, true),
    GST_FILING_CONFIRM(FlowModule.GST, false),
    GST_FILING_STATUS(FlowModule.GST, false),
    WAIT_INVOICE_UPLOAD(FlowModule.GST, false),
    INVOICE_CONFIRM(FlowModule.GST, false),
    MEDIUM_CREDIT_CHECK(FlowModule.GST, false),
    MEDIUM_CREDIT_RESULT(FlowModule.GST, false),
    NIL_FILING_MENU(FlowModule.GST, false),
    NIL_FILING_CONFIRM(FlowModule.GST, false),
    MULTI_GSTIN_MENU(FlowModule.GST, false),
    MULTI_GSTIN_ADD(FlowModule.GST, true),
    MULTI_GSTIN_LABEL(FlowModule.GST, true),
    MULTI_GSTIN_SWITCH(FlowModule.GST, false),
    MULTI_GSTIN_SUMMARY(FlowModule.GST, false),

    // itr
    ITR_MENU(FlowModule.ITR, false),
    ITR1_ASK_PAN(FlowModule.ITR, true),
    ITR1_ASK_NAME(FlowModule.ITR, true),
    ITR1_ASK_DOB(FlowModule.ITR, true),
    ITR1_ASK_SALARY(FlowModule.ITR, true),
    ITR1_ASK_OTHER_INCOME(FlowModule.ITR, true),
    ITR1_ASK_80C(FlowModule.ITR, true),
    ITR1_ASK_TDS(FlowModule.ITR, true),
    ITR1_CONFIRM(FlowModule.ITR, false),
    ITR4_ASK_PAN(FlowModule.ITR, true),
    ITR4_ASK_NAME(FlowModule.ITR, true),
    ITR4_ASK_BUSINESS_TYPE(FlowModule.ITR, false),
    ITR4_ASK_TURNOVER(FlowModule.ITR, true),
    ITR4_ASK_OTHER_INCOME(FlowModule.ITR, true),
    ITR4_ASK_TDS(FlowModule.ITR, true),
    ITR4_CONFIRM(FlowModule.ITR, false),
    ITR_RESULT(FlowModule.ITR, false),

    // connect with CA
    CONNECT_CA_MENU(FlowModule.CONNECT_CA, false),
    CONNECT_CA_ASK_TEXT(FlowModule.CONNECT_CA, true);

    private final FlowModule module;
    private final boolean freeInput;

    ConversationState(FlowModule module, boolean freeInput) {
        this.module = module;
        this.freeInput = freeInput;
    }

    public FlowModule module() {
        return module;
    }

    public boolean isFreeInput() {
        return freeInput;
    }

    public boolean isConfirmation() {
        return name().endsWith("_CONFIRM");
    }

    /** Catalog key of the prompt shown on entering this state. */
    public String promptKey() {
        return "prompt." + name().toLowerCase(Locale.ROOT);
    }

    public static Optional<ConversationState> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        for (ConversationState value : values()) {
            if (value.name().equals(name.trim())) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
