package uz.greenwhite.federation.error;

import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Provider or transport failure. {@code httpStatus} is 0 when no response was received.
 */
@Getter
public class ExternalServiceException extends FederationException {

    private final String service;
    private final int httpStatus;
    private final boolean retryable;

    public ExternalServiceException(String service, String message, int httpStatus, boolean retryable) {
        this(service, message, httpStatus, retryable, null);
    }

    public ExternalServiceException(String service, String message, int httpStatus,
                                    boolean retryable, Throwable cause) {
        super(ErrorKind.EXTERNAL_SERVICE, "External service error: " + service + " - " + message,
                details(service, httpStatus, retryable), cause);
        this.service = service;
        this.httpStatus = httpStatus;
        this.retryable = retryable;
    }

    private static Map<String, Object> details(String service, int httpStatus, boolean retryable) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("service", service);
        details.put("httpStatus", httpStatus);
        details.put("retryable", retryable);
        return details;
    }
}
