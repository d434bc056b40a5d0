package com.weatherproxy.service.nws;

public enum ResolutionErrorKind {
    OUT_OF_COVERAGE(true),
    GRID_NOT_FOUND(true),
    UPSTREAM_ERROR(false),
    UPSTREAM_UNREACHABLE(false),
    MALFORMED_UPSTREAM_RESPONSE(false),
    FORECAST_UNAVAILABLE(false),
    NO_FORECAST_PERIODS(false);

    private final boolean clientFacing;

    ResolutionErrorKind(boolean clientFacing) {
        this.clientFacing = clientFacing;
    }

    /**
     * Whether the failure describes the caller's coordinates rather than an upstream fault,
     * in which case its message may be shown to the caller.
     */
    public boolean clientFacing() {
        return clientFacing;
    }
}
