package com.github.salilvnair.chatflow.domain;

import java.math.BigDecimal;
import java.util.List;

/**
 * GST and ITR computations. Implementations enforce their own timeouts and report
 * failures as {@link com.github.salilvnair.chatflow.engine.exception.DomainServiceException}.
 */
public interface TaxComputationService {

    GstReturnSummary prepareReturn(String gstin, String returnType, String period);

    FilingReceipt fileReturn(String gstin, String returnType, String period);

    FilingReceipt prepareNilReturns(String gstin, List<String> returnTypes);

    CreditReconciliation reconcileCredit(String gstin);

    ItrComputation computeItr(ItrInput input);

    record GstReturnSummary(
            String returnType,
            String period,
            BigDecimal outputTax,
            BigDecimal inputTaxCredit,
            BigDecimal netPayable
    ) {}

    record FilingReceipt(String reference, String status) {}

    record CreditReconciliation(
            BigDecimal matchedCredit,
            BigDecimal mismatchedCredit,
            BigDecimal additionalCredit,
            int mismatchedSuppliers
    ) {}

    record ItrInput(
            String form,
            String pan,
            String name,
            String dateOfBirth,
            String businessType,
            long salaryOrTurnover,
            long otherIncome,
            long deductions,
            long tdsPaid
    ) {}

    record ItrComputation(
            long taxableIncome,
            long taxLiability,
            long tdsPaid,
            long balance
    ) {
        public boolean isRefund() {
            return balance < 0;
        }
    }
}
