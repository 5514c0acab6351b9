package com.bank.txnrisk.exception;

/**
 * Raised while building the scoring configuration at startup. Fatal: the
 * application context fails to start rather than scoring with bad settings.
 */
public class ScoringConfigurationException extends RuntimeException {

    private final String property;

    public ScoringConfigurationException(String property, String message) {
        super("Invalid scoring configuration [" + property + "]: " + message);
        this.property = property;
    }

    public String getProperty() {
        return property;
    }
}
