package dev.jobhunter.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.jobhunter.error.AnalysisException;
import dev.jobhunter.model.JobMatchInput;
import dev.jobhunter.service.MatchStoreService;
import dev.jobhunter.settings.Preferences;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Turns a tool name and its JSON arguments into a typed {@link ToolRequest}.
 * Any schema mismatch is reported as ValidationFailed.
 */
@Component
@RequiredArgsConstructor
public class ToolRequestDecoder {

    private final ObjectMapper objectMapper;

    public ToolRequest decode(String toolName, JsonNode arguments) {
        ToolName tool = ToolName.fromWireName(toolName)
                .orElseThrow(() -> AnalysisException.validation("Unknown tool: " + toolName));

        JsonNode args = arguments == null || arguments.isNull() || arguments.isMissingNode()
                ? objectMapper.createObjectNode()
                : arguments;
        if (!args.isObject()) {
            throw AnalysisException.validation("Arguments of " + tool.wireName() + " must be a JSON object");
        }

        return switch (tool) {
            case SET_QUERY_PARAMS -> new ToolRequest.SetQueryParams(
                    requiredText(args, "url", tool), optionalText(args, "sessionId", tool));
            case FETCH_CONTENT -> new ToolRequest.FetchContent(
                    requiredText(args, "url", tool), optionalInt(args, "maxLength", tool));
            case RELOAD_PAGE -> new ToolRequest.ReloadPage();
            case GET_SETTINGS -> new ToolRequest.GetSettings();
            case SET_SETTINGS -> new ToolRequest.SetSettings(
                    convert(required(args, "settings", tool), Preferences.class, tool));
            case SAVE_JOB_MATCH -> new ToolRequest.SaveJobMatch(convert(args, JobMatchInput.class, tool));
            case LIST_JOB_MATCHES -> {
                Integer limit = optionalInt(args, "limit", tool);
                yield new ToolRequest.ListJobMatches(limit != null ? limit : MatchStoreService.DEFAULT_LIST_LIMIT);
            }
            case CLEAR_JOB_MATCHES -> new ToolRequest.ClearJobMatches();
        };
    }

    private static JsonNode required(JsonNode args, String field, ToolName tool) {
        JsonNode value = args.get(field);
        if (value == null || value.isNull()) {
            throw AnalysisException.validation(tool.wireName() + ": '" + field + "' is required");
        }
        return value;
    }

    private static String requiredText(JsonNode args, String field, ToolName tool) {
        JsonNode value = required(args, field, tool);
        if (!value.isTextual() || value.asText().isBlank()) {
            throw AnalysisException.validation(tool.wireName() + ": '" + field + "' must be a non-empty string");
        }
        return value.asText();
    }

    private static String optionalText(JsonNode args, String field, ToolName tool) {
        JsonNode value = args.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw AnalysisException.validation(tool.wireName() + ": '" + field + "' must be a string");
        }
        return value.asText().isBlank() ? null : value.asText();
    }

    private static Integer optionalInt(JsonNode args, String field, ToolName tool) {
        JsonNode value = args.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            throw AnalysisException.validation(tool.wireName() + ": '" + field + "' must be an integer");
        }
        return value.intValue();
    }

    private <T> T convert(JsonNode node, Class<T> type, ToolName tool) {
        if (!node.isObject()) {
            throw AnalysisException.validation(tool.wireName() + ": expected a JSON object");
        }
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw AnalysisException.validation(tool.wireName() + ": invalid arguments: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            throw AnalysisException.validation(tool.wireName() + ": invalid arguments: " + e.getMessage());
        }
    }
}
