package uz.greenwhite.federation.error;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base of every failure the federation core reports to its callers.
 * Carries a {@link ErrorKind} and optional structured details.
 */
@Getter
public abstract class FederationException extends RuntimeException {

    private final ErrorKind kind;
    private final Map<String, Object> details;

    protected FederationException(ErrorKind kind, String message) {
        this(kind, message, Map.of(), null);
    }

    protected FederationException(ErrorKind kind, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.details = details == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }
}
