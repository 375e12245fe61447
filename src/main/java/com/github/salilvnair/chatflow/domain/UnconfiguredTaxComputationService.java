package com.github.salilvnair.chatflow.domain;

import com.github.salilvnair.chatflow.engine.exception.DomainServiceException;

import java.util.List;

/**
 * Registered when the host application provides no {@link TaxComputationService}.
 */
public class UnconfiguredTaxComputationService implements TaxComputationService {

    private static final String SERVICE = "tax-computation";

    @Override
    public GstReturnSummary prepareReturn(String gstin, String returnType, String period) {
        throw DomainServiceException.unavailable(SERVICE);
    }

    @Override
    public FilingReceipt fileReturn(String gstin, String returnType, String period) {
        throw DomainServiceException.unavailable(SERVICE);
    }

    @Override
    public FilingReceipt prepareNilReturns(String gstin, List<String> returnTypes) {
        throw DomainServiceException.unavailable(SERVICE);
    }

    @Override
    public CreditReconciliation reconcileCredit(String gstin) {
        throw DomainServiceException.unavailable(SERVICE);
    }

    @Override
    public ItrComputation computeItr(ItrInput input) {
        throw DomainServiceException.unavailable(SERVICE);
    }
}
