package dev.jobhunter.tool;

import dev.jobhunter.model.JobMatchInput;
import dev.jobhunter.settings.Preferences;

/**
 * A decoded tool call. One record per {@link ToolName}, each with a fixed argument schema.
 */
public interface ToolRequest {

    ToolName tool();

    record SetQueryParams(String url, String sessionId) implements ToolRequest {
        @Override
        public ToolName tool() {
            return ToolName.SET_QUERY_PARAMS;
        }
    }

    record FetchContent(String url, Integer maxLength) implements ToolRequest {
        @Override
        public ToolName tool() {
            return ToolName.FETCH_CONTENT;
        }
    }

    record ReloadPage() implements ToolRequest {
        @Override
        public ToolName tool() {
            return ToolName.RELOAD_PAGE;
        }
    }

    record GetSettings() implements ToolRequest {
        @Override
        public ToolName tool() {
            return ToolName.GET_SETTINGS;
        }
    }

    record SetSettings(Preferences settings) implements ToolRequest {
        @Override
        public ToolName tool() {
            return ToolName.SET_SETTINGS;
        }
    }

    record SaveJobMatch(JobMatchInput match) implements ToolRequest {
        @Override
        public ToolName tool() {
            return ToolName.SAVE_JOB_MATCH;
        }
    }

    record ListJobMatches(int limit) implements ToolRequest {
        @Override
        public ToolName tool() {
            return ToolName.LIST_JOB_MATCHES;
        }
    }

    record ClearJobMatches() implements ToolRequest {
        @Override
        public ToolName tool() {
            return ToolName.CLEAR_JOB_MATCHES;
        }
    }
}
