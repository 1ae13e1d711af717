package com.quarry.query;

/**
 * Per-call settings that travel with a request. Immutable.
 */
public final class RequestSettings {

    private static final RequestSettings DEFAULTS = new RequestSettings(false, false, false);

    private final boolean turbo;
    private final boolean consistent;
    private final boolean debug;

    public RequestSettings(boolean turbo, boolean consistent, boolean debug) {
        this.turbo = turbo;
        this.consistent = consistent;
        this.debug = debug;
    }

    public static RequestSettings defaults() {
        return DEFAULTS;
    }

    /**
     * Trade accuracy for speed, e.g. by sampling
     */
    public boolean isTurbo() {
        return turbo;
    }

    /**
     * Read from a consistent replica and avoid rollups that lag behind the raw data
     */
    public boolean isConsistent() {
        return consistent;
    }

    public boolean isDebug() {
        return debug;
    }

    @Override
    public String toString() {
        return "RequestSettings{turbo=" + turbo + ", consistent=" + consistent + ", debug=" + debug + "}";
    }
}
