package com.durableflow.examples.simple;

import com.durableflow.worker.ActivityContext;
import com.durableflow.worker.ActivityException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Locale;
import java.util.UUID;

/**
 * Activity handlers of the simple workflow.
 *
 * All three are idempotent: the same attempt produces the same effect however often it runs,
 * keyed by {@link ActivityContext#getIdempotencyKey()}.
 */
public class SimpleActivities {

    private static final Logger log = LoggerFactory.getLogger(SimpleActivities.class);
    private static final ObjectMapper mapper = new ObjectMapper();

    public static final String REQUIRED_FIELD = "required_field";

    private final Clock clock;

    public SimpleActivities(Clock clock) {
        this.clock = clock;
    }

    /**
     * Validate Input Activity.
     * Reports problems in its result instead of failing, so the workflow decides what to do.
     */
    public JsonNode validateInput(ActivityContext context) {
        log.info("[{}] Validating input parameters", context.getIdempotencyKey());
        JsonNode parameters = context.getInput();

        if (parameters == null || parameters.isNull() || parameters.isEmpty()) {
            return validation(false, "No parameters provided");
        }
        if (!parameters.hasNonNull(REQUIRED_FIELD)) {
            return validation(false, "Missing required field");
        }
        return validation(true, "Input validation successful");
    }

    /**
     * Process Data Activity.
     */
    public JsonNode processData(ActivityContext context) throws ActivityException {
        log.info("[{}] Processing data", context.getIdempotencyKey());
        JsonNode parameters = context.getInput();
        if (parameters == null || !parameters.hasNonNull(REQUIRED_FIELD)) {
            throw ActivityException.nonRetryable("INVALID_INPUT", "Missing " + REQUIRED_FIELD);
        }

        ObjectNode data = mapper.createObjectNode();
        data.set("original", parameters);
        data.put("processedAt", clock.instant().toString());
        data.put("processedValue", parameters.get(REQUIRED_FIELD).asText().toUpperCase(Locale.ROOT));

        ObjectNode result = mapper.createObjectNode();
        result.put("processed", true);
        result.set("data", data);
        return result;
    }

    /**
     * Store Data Activity.
     * The storage id is derived from the idempotency key, so a repeated attempt overwrites
     * the same record instead of creating a second one.
     */
    public JsonNode storeData(ActivityContext context) {
        String storageId = "storage_" + UUID.nameUUIDFromBytes(context.getIdempotencyKey().getBytes(StandardCharsets.UTF_8));
        log.info("[{}] Storing processed data as {}", context.getIdempotencyKey(), storageId);

        ObjectNode result = mapper.createObjectNode();
        result.put("stored", true);
        result.put("storageId", storageId);
        result.put("message", "Data stored successfully");
        return result;
    }

    private static JsonNode validation(boolean valid, String message) {
        ObjectNode result = mapper.createObjectNode();
        result.put("valid", valid);
        result.put("message", message);
        return result;
    }
}
