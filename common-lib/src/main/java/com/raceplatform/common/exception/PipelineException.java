package com.raceplatform.common.exception;

/**
 * Root of the decision-core exception hierarchy. The message is prefixed with the component
 * that raised it.
 */
public class PipelineException extends RuntimeException {
    private final String component;

    public PipelineException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public PipelineException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }

    /** Fatal errors abort the invocation instead of producing an abstention. */
    public boolean isFatal() {
        return false;
    }
}
