package uz.greenwhite.federation.error;

import java.util.Map;

public class ResourceNotFoundException extends FederationException {

    public ResourceNotFoundException(String type, Object id) {
        super(ErrorKind.NOT_FOUND, type + " not found: " + id,
                Map.of("type", type, "id", String.valueOf(id)), null);
    }
}
