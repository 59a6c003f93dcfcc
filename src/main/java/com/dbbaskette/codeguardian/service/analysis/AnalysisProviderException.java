package com.dbbaskette.codeguardian.service.analysis;

public class AnalysisProviderException extends Exception {

    public AnalysisProviderException(String message) {
        super(message);
    }

    public AnalysisProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
