package dev.jobhunter.error;

public class AnalysisException extends RuntimeException {
    private final ErrorKind kind;

    public AnalysisException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public AnalysisException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public static AnalysisException validation(String message) {
        return new AnalysisException(ErrorKind.VALIDATION_FAILED, message);
    }

    public static AnalysisException unknownSession(String sessionId) {
        return new AnalysisException(ErrorKind.UNKNOWN_SESSION, "Unknown or inactive session: " + sessionId);
    }
}
