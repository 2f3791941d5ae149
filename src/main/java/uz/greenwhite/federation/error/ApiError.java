package uz.greenwhite.federation.error;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiError {

    private ErrorKind kind;
    private String code;
    private String message;
    private Map<String, Object> details;

    @JsonProperty("timestamp")
    private Instant timestamp;

    public static ApiError of(FederationException e) {
        return ApiError.builder()
                .kind(e.getKind())
                .code(e.getKind().getCode())
                .message(e.getMessage())
                .details(e.getDetails())
                .timestamp(Instant.now())
                .build();
    }
}
