package uz.greenwhite.federation.proxy;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import uz.greenwhite.federation.config.ProxyProperties;
import uz.greenwhite.federation.error.ValidationException;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Picks the highest-priority {@link RoutingRule} whose Ant-style pattern matches the path.
 */
@Slf4j
@Component
public class RequestRouter {

    private static final Comparator<RoutingRule> BY_PRIORITY =
            Comparator.comparingInt(RoutingRule::getPriority).reversed();

    private final AntPathMatcher matcher = new AntPathMatcher();
    private final List<RoutingRule> rules = new CopyOnWriteArrayList<>();

    public RequestRouter(ProxyProperties properties) {
        properties.getRoutingRules().forEach(route -> addRule(RoutingRule.builder()
                .name(route.getName())
                .pathPattern(route.getPathPattern())
                .priority(route.getPriority())
                .sourceVersion(route.getSourceVersion())
                .targetVersion(route.getTargetVersion())
                .build()));
    }

    public void addRule(RoutingRule rule) {
        if (rule.getPathPattern() == null || rule.getPathPattern().isBlank()) {
            throw new ValidationException("path_pattern", "Routing rule " + rule.getName() + " has no path pattern");
        }
        rules.add(rule);
        log.info("Routing rule added: {} {} (priority {})", rule.getName(), rule.getPathPattern(), rule.getPriority());
    }

    public Optional<RoutingRule> route(String path) {
        return rules.stream()
                .filter(rule -> matcher.match(rule.getPathPattern(), path))
                .min(BY_PRIORITY);
    }

    public List<RoutingRule> rules() {
        return rules.stream().sorted(BY_PRIORITY).toList();
    }
}
