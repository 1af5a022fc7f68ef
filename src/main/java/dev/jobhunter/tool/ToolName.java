package dev.jobhunter.tool;

import dev.jobhunter.error.ErrorKind;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The closed set of operations a worker may call.
 */
public enum ToolName {

    SET_QUERY_PARAMS("set_query_params",
            "Point observing front ends at a URL for the current analysis.",
            List.of("url", "sessionId"), List.of("url"), ErrorKind.VALIDATION_FAILED),
    FETCH_CONTENT("fetch_content",
            "Retrieve the HTML and text content of a page.",
            List.of("url", "maxLength"), List.of("url"), ErrorKind.FETCH_FAILED),
    RELOAD_PAGE("reload_page",
            "Ask observing front ends to reload.",
            List.of(), List.of(), ErrorKind.VALIDATION_FAILED),
    GET_SETTINGS("get_settings",
            "Load the current job search preferences.",
            List.of(), List.of(), ErrorKind.STORE_UNAVAILABLE),
    SET_SETTINGS("set_settings",
            "Validate and persist job search preferences.",
            List.of("settings"), List.of("settings"), ErrorKind.STORE_UNAVAILABLE),
    SAVE_JOB_MATCH("save_job_match",
            "Persist a scored job match.",
            List.of("session_id", "url", "title", "company", "location", "match_score", "summary", "raw_excerpt"),
            List.of("url", "match_score", "summary"), ErrorKind.PERSIST_FAILED),
    LIST_JOB_MATCHES("list_job_matches",
            "List the most recent job matches.",
            List.of("limit"), List.of(), ErrorKind.PERSIST_FAILED),
    CLEAR_JOB_MATCHES("clear_job_matches",
            "Delete every saved job match.",
            List.of(), List.of(), ErrorKind.PERSIST_FAILED);

    private final String wireName;
    private final String description;
    private final List<String> arguments;
    private final List<String> required;
    private final ErrorKind fallbackKind;

    ToolName(String wireName, String description, List<String> arguments, List<String> required,
            ErrorKind fallbackKind) {
        this.wireName = wireName;
        this.description = description;
        this.arguments = arguments;
        this.required = required;
        this.fallbackKind = fallbackKind;
    }

    public String wireName() {
        return wireName;
    }

    public String description() {
        return description;
    }

    /**
     * Kind reported when the handler fails with an unclassified exception.
     */
    public ErrorKind fallbackKind() {
        return fallbackKind;
    }

    public static Optional<ToolName> fromWireName(String name) {
        return Arrays.stream(values())
                .filter(tool -> tool.wireName.equals(name))
                .findFirst();
    }

    /**
     * Tool definitions returned by list_tools.
     */
    public static List<Map<String, Object>> definitions() {
        return Arrays.stream(values())
                .map(ToolName::definition)
                .toList();
    }

    private Map<String, Object> definition() {
        Map<String, Object> definition = new LinkedHashMap<>();
        definition.put("name", wireName);
        definition.put("description", description);
        definition.put("arguments", arguments);
        definition.put("required", required);
        return definition;
    }
}
