package com.trustplatform.common.exception;

import java.util.UUID;

public class PolicyValidationException extends TrustEngineException {

    private final UUID policyId;

    public PolicyValidationException(UUID policyId, String message) {
        super("[policy " + policyId + "] " + message);
        this.policyId = policyId;
    }

    public UUID getPolicyId() {
        return policyId;
    }
}
