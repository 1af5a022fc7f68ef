package dev.jobhunter.tool;

import dev.jobhunter.session.AnalysisSession;

/**
 * The session a tool call runs for, plus the request id used in log lines.
 */
public record ToolCallContext(AnalysisSession session, Object requestId) {

    public String sessionId() {
        return session.getId();
    }
}
