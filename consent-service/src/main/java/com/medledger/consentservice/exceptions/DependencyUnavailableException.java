package com.medledger.consentservice.exceptions;

/**
 * A ledger, blob store or crypto call failed or timed out. Retryable, and never to be
 * read as an authorization denial.
 */
public class DependencyUnavailableException extends ConsentEngineException {

    private final String dependency;

    public DependencyUnavailableException(String dependency, String message, Throwable cause) {
        super(ErrorKind.UNAVAILABLE, dependency + " unavailable: " + message, cause);
        this.dependency = dependency;
    }

    public DependencyUnavailableException(ErrorKind kind, String dependency, String message, Throwable cause) {
        super(kind, dependency + " unavailable: " + message, cause);
        this.dependency = dependency;
    }

    public String getDependency() {
        return dependency;
    }
}
