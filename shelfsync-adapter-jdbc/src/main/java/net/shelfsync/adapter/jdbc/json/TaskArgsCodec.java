package net.shelfsync.adapter.jdbc.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import net.shelfsync.core.model.CursorTaskArgs;

/** TB_TASK_INVOCATION.ARGS 컬럼(JSON CLOB) 변환 */
public final class TaskArgsCodec {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private TaskArgsCodec() {
    }

    public static String toJson(CursorTaskArgs args) {
        try {
            return MAPPER.writeValueAsString(args);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize task args", e);
        }
    }

    public static CursorTaskArgs fromJson(String json) {
        if (json == null || json.isBlank()) return null;
        try {
            return MAPPER.readValue(json, CursorTaskArgs.class);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to parse task args: " + abbreviate(json), e);
        }
    }

    private static String abbreviate(String json) {
        return json.length() <= 200 ? json : json.substring(0, 200) + "...";
    }
}
