package com.dbbaskette.codeguardian.service.result;

import java.util.Map;

public record ServiceError(ErrorKind kind, String message, Map<String, String> details) {

    public ServiceError {
        details = details == null ? Map.of() : Map.copyOf(details);
    }
}
