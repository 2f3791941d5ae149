package uz.greenwhite.federation.error;

import lombok.Getter;

import java.util.Map;

@Getter
public class ValidationException extends FederationException {

    private final String field;

    public ValidationException(String field, String message) {
        super(ErrorKind.VALIDATION, "Validation error: " + field + " - " + message,
                Map.of("field", field), null);
        this.field = field;
    }
}
