package uz.greenwhite.federation.proxy;

import lombok.Builder;
import lombok.Value;

/**
 * Maps request paths to the protocol versions a payload is translated between.
 * Either version may be null, meaning "not decided by this rule".
 */
@Value
@Builder
public class RoutingRule {
    String name;
    String pathPattern;
    int priority;
    String sourceVersion;
    String targetVersion;
}
