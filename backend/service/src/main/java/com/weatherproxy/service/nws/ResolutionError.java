package com.weatherproxy.service.nws;

public record ResolutionError(ResolutionErrorKind kind, String message, Throwable cause) {
    public ResolutionError(ResolutionErrorKind kind, String message) {
        this(kind, message, null);
    }

    public boolean clientFacing() {
        return kind.clientFacing();
    }
}
