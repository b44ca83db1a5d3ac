package taskwarden.coordinator.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * JSON encoding of task envelopes and handler results.
 */
public final class TaskCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private TaskCodec() {
    }

    public static String encode(Task task) {
        try {
            return MAPPER.writeValueAsString(TaskEnvelope.from(task));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Task " + task.id() + " has arguments that are not JSON-serializable", e);
        }
    }

    /**
     * @throws IllegalArgumentException if the payload is malformed or from a newer schema version
     */
    public static Task decode(String json) {
        TaskEnvelope envelope;
        try {
            envelope = MAPPER.readValue(json, TaskEnvelope.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed task envelope: " + e.getOriginalMessage(), e);
        }
        return envelope.toTask();
    }

    /**
     * Serialize a handler result. Values Jackson cannot write are stored as their string form.
     */
    public static String resultToJson(Object result) {
        try {
            return MAPPER.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            try {
                return MAPPER.writeValueAsString(String.valueOf(result));
            } catch (JsonProcessingException inner) {
                throw new IllegalStateException("Cannot serialize result", inner);
            }
        }
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
