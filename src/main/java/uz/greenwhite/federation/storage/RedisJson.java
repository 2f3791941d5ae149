package uz.greenwhite.federation.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import uz.greenwhite.federation.error.InternalFederationException;

/**
 * JSON encoding of stored records. Unreadable entries are logged and treated as absent.
 */
@Slf4j
@RequiredArgsConstructor
class RedisJson {

    private final ObjectMapper objectMapper;

    String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new InternalFederationException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    <T> T read(String value, Class<T> type) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.readValue(value, type);
        } catch (JsonProcessingException e) {
            log.error("Unreadable {} in Redis, skipping: {}", type.getSimpleName(), e.getMessage());
            return null;
        }
    }
}
