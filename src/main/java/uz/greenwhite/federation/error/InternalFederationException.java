package uz.greenwhite.federation.error;

import java.util.Map;

public class InternalFederationException extends FederationException {

    public InternalFederationException(String message, Throwable cause) {
        super(ErrorKind.INTERNAL, "Internal server error: " + message, Map.of(), cause);
    }
}
