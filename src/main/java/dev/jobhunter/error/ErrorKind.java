package dev.jobhunter.error;

/**
 * Stable error classification surfaced to workers and HTTP callers.
 */
public enum ErrorKind {

    VALIDATION_FAILED("ValidationFailed"),
    FETCH_FAILED("FetchFailed"),
    PERSIST_FAILED("PersistFailed"),
    TIMEOUT("Timeout"),
    CANCELLED("Cancelled"),
    SESSION_BUSY("SessionBusy"),
    UNKNOWN_SESSION("UnknownSession"),
    STORE_UNAVAILABLE("StoreUnavailable");

    private final String code;

    ErrorKind(String code) {
        this.code = code;
    }

    /**
     * Wire name used in tool responses and API error bodies.
     */
    public String code() {
        return code;
    }
}
