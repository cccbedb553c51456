package com.trustplatform.common.exception;

public class UnknownFactorException extends TrustEngineException {

    private final String factorName;

    public UnknownFactorException(String factorName) {
        super("Factor is not registered: " + factorName);
        this.factorName = factorName;
    }

    public String getFactorName() {
        return factorName;
    }
}
