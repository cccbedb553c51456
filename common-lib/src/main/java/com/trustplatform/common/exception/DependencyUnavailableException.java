package com.trustplatform.common.exception;

/**
 * A collaborator the evaluation depends on (policy store, posture store) failed or timed out.
 * Never retried internally; retry policy belongs to the caller.
 */
public class DependencyUnavailableException extends TrustEngineException {

    private final String dependency;

    public DependencyUnavailableException(String dependency, String message) {
        super("[" + dependency + "] " + message);
        this.dependency = dependency;
    }

    public DependencyUnavailableException(String dependency, String message, Throwable cause) {
        super("[" + dependency + "] " + message, cause);
        this.dependency = dependency;
    }

    public String getDependency() {
        return dependency;
    }
}
