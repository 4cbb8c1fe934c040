package com.starscape.imageedit.features.callback.app;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.imageedit.features.callback.domain.CallbackEvent;
import org.springframework.stereotype.Component;

/**
 * Reads RunningHub webhook payloads:
 * {@code {"taskId": "...", "eventData": {"code": 0, "msg": "...", "data": {"fileUrl": "..."}}}}.
 * {@code eventData} may be sent as a serialized JSON string and {@code data} as an
 * array of file objects, of which the first is used.
 */
@Component
public class CallbackEventParser {

    private final ObjectMapper objectMapper;

    public CallbackEventParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public CallbackEvent parse(String body) {
        if (body == null || body.isBlank()) {
            return new CallbackEvent.Malformed("", "Empty callback body");
        }
        try {
            return parse(objectMapper.readTree(body));
        } catch (JsonProcessingException e) {
            return new CallbackEvent.Malformed("", "Callback body is not JSON: " + e.getOriginalMessage());
        }
    }

    public CallbackEvent parse(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            return new CallbackEvent.Malformed("", "Callback body is not a JSON object");
        }
        String taskId = text(payload.get("taskId"));
        if (taskId.isBlank()) {
            return new CallbackEvent.Malformed("", "Missing taskId");
        }

        JsonNode eventData = payload.get("eventData");
        if (eventData != null && eventData.isTextual()) {
            try {
                eventData = objectMapper.readTree(eventData.asText());
            } catch (JsonProcessingException e) {
                return new CallbackEvent.Malformed(taskId, "eventData is not JSON: " + e.getOriginalMessage());
            }
        }
        if (eventData == null || !eventData.isObject()) {
            return new CallbackEvent.Malformed(taskId, "Missing eventData");
        }

        JsonNode code = eventData.get("code");
        if (code == null || !code.canConvertToInt()) {
            return new CallbackEvent.Malformed(taskId, "Missing result code");
        }
        if (code.asInt() != 0) {
            String message = text(eventData.get("msg"));
            return new CallbackEvent.Failure(taskId, code.asInt(), message.isEmpty() ? null : message);
        }

        JsonNode data = eventData.get("data");
        if (data != null && data.isArray()) {
            data = data.size() > 0 ? data.get(0) : null;
        }
        String fileUrl = data != null && data.isObject() ? text(data.get("fileUrl")) : "";
        if (fileUrl.isBlank()) {
            return new CallbackEvent.Malformed(taskId, "No fileUrl in result");
        }
        return new CallbackEvent.Success(taskId, fileUrl);
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isContainerNode()) {
            return "";
        }
        return node.asText().trim();
    }
}
