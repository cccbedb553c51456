package com.trustplatform.common.exception;

/** Base type for failures raised around the trust engine. */
public class TrustEngineException extends RuntimeException {

    public TrustEngineException(String message) {
        super(message);
    }

    public TrustEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
