package com.raceplatform.common.exception;

import java.util.List;

/**
 * Malformed or missing threshold configuration. Fatal: the pipeline never runs with
 * substituted defaults.
 */
public class ConfigInvalidException extends PipelineException {
    private final List<String> violations;

    public ConfigInvalidException(List<String> violations) {
        super("GpiConfig", "invalid configuration: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }

    @Override
    public boolean isFatal() {
        return true;
    }
}
