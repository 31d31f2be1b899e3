package com.toolgate.common.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;

/**
 * Shared Jackson mapper and payload sizing helpers.
 * <p>
 * The mapper ignores unknown properties so policy documents written for newer
 * versions still load.
 */
@Slf4j
public final class JsonSupport {

    /** Size reported for payloads that cannot be serialized at all. */
    public static final long UNSERIALIZABLE_SIZE = Long.MAX_VALUE;

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);

    private JsonSupport() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * UTF-8 byte length of the JSON form of {@code value}.
     * Returns {@link #UNSERIALIZABLE_SIZE} when Jackson cannot serialize it, so
     * any configured size limit rejects the payload.
     */
    public static long payloadSizeBytes(Object value) {
        try {
            return MAPPER.writeValueAsString(value).getBytes(StandardCharsets.UTF_8).length;
        } catch (JsonProcessingException e) {
            log.debug("Payload not serializable: {}", e.getOriginalMessage());
            return UNSERIALIZABLE_SIZE;
        }
    }

    /**
     * Compact JSON form of {@code value}, or {@code null} if it cannot be
     * serialized.
     */
    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.debug("Value not serializable: {}", e.getOriginalMessage());
            return null;
        }
    }
}
