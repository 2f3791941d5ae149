package uz.greenwhite.federation.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "federation.storage")
public class StorageProperties {

    /**
     * memory | redis
     */
    private String type = "memory";

    /**
     * TTL of workflow and translation records in Redis.
     * Default: 72 hours
     */
    private long redisTtlHours = 72;
}
