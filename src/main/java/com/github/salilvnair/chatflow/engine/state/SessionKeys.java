package com.github.salilvnair.chatflow.engine.state;

/**
 * Keys of {@link ChatSession#getData()}.
 */
public final class SessionKeys {

    private SessionKeys() {
    }

    // profile
    public static final String GSTIN = "gstin";
    public static final String GST_ONBOARDED = "gst_onboarded";
    public static final String MULTI_GSTIN = "multi_gstin";
    public static final String NOTIFICATION_PREFS = "notification_prefs";

    // navigation
    public static final String PRE_EXPIRY_STATE = "pre_expiry_state";
    public static final String AFTER_GSTIN = "wizard_after_gstin";
    public static final String SWITCH_SOURCE = "switch_source_module";
    public static final String SWITCH_TARGET = "switch_target_module";
    public static final String SWITCH_SOURCE_LABEL = "switch_source_label";
    public static final String SWITCH_TARGET_LABEL = "switch_target_label";
    public static final String CA_HANDOFF = "ca_handoff";
    public static final String LAST_FILING_REFERENCE = "last_filing_reference";

    // gst filing
    public static final String GST_FILING_RETURN_TYPE = "gst_filing_return_type";
    public static final String GST_FILING_PERIOD = "gst_filing_period";
    public static final String GST_FILING_OUTPUT_TAX = "gst_filing_output_tax";
    public static final String GST_FILING_ITC = "gst_filing_itc";
    public static final String GST_FILING_NET = "gst_filing_net";
    public static final String GST_FILING_REFERENCE = "gst_filing_reference";

    // nil filing
    public static final String NIL_RETURNS = "nil_returns";
    public static final String NIL_RETURNS_LABEL = "nil_returns_label";

    // invoice upload
    public static final String INVOICE_DOCUMENT_ID = "invoice_document_id";
    public static final String INVOICE_NUMBER = "invoice_number";
    public static final String INVOICE_SUPPLIER = "invoice_supplier";
    public static final String INVOICE_TAXABLE = "invoice_taxable";
    public static final String INVOICE_TAX = "invoice_tax";

    // credit check
    public static final String CREDIT_MATCHED = "credit_matched";
    public static final String CREDIT_MISMATCHED = "credit_mismatched";
    public static final String CREDIT_ADDITIONAL = "credit_additional";
    public static final String CREDIT_MISMATCHED_SUPPLIERS = "credit_mismatched_suppliers";

    // multi gstin
    public static final String MULTI_PENDING_GSTIN = "multi_pending_gstin";

    // itr
    public static final String ITR_FORM = "itr_form";
    public static final String ITR_PAN = "itr_pan";
    public static final String ITR_NAME = "itr_name";
    public static final String ITR_DOB = "itr_dob";
    public static final String ITR_BUSINESS_TYPE = "itr_business_type";
    public static final String ITR_INCOME = "itr_income";
    public static final String ITR_OTHER_INCOME = "itr_other_income";
    public static final String ITR_DEDUCTIONS = "itr_deductions";
    public static final String ITR_TDS = "itr_tds";
    public static final String ITR_TAXABLE_INCOME = "itr_taxable_income";
    public static final String ITR_TAX_LIABILITY = "itr_tax_liability";
    public static final String ITR_BALANCE = "itr_balance";
    public static final String ITR_OUTCOME = "itr_outcome";
}
