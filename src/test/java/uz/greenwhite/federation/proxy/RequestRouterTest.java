package uz.greenwhite.federation.proxy;

import org.junit.jupiter.api.Test;
import uz.greenwhite.federation.config.ProxyProperties;
import uz.greenwhite.federation.error.ValidationException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestRouterTest {

    @Test
    void highestPriorityMatchWins() {
        RequestRouter router = new RequestRouter(new ProxyProperties());
        router.addRule(RoutingRule.builder().name("all").pathPattern("/**").priority(0).build());
        router.addRule(RoutingRule.builder().name("legacy").pathPattern("/legacy/**")
                .priority(10).sourceVersion("v1.0").build());

        assertThat(router.route("/legacy/tools/call")).get()
                .extracting(RoutingRule::getName).isEqualTo("legacy");
        assertThat(router.route("/tools/call")).get()
                .extracting(RoutingRule::getName).isEqualTo("all");
    }

    @Test
    void noMatchIsEmpty() {
        RequestRouter router = new RequestRouter(new ProxyProperties());
        router.addRule(RoutingRule.builder().name("legacy").pathPattern("/legacy/**").build());

        assertThat(router.route("/tools")).isEmpty();
    }

    @Test
    void rulesFromPropertiesAreLoaded() {
        ProxyProperties properties = new ProxyProperties();
        ProxyProperties.Route route = new ProxyProperties.Route();
        route.setName("legacy");
        route.setPathPattern("/legacy/**");
        route.setPriority(5);
        route.setTargetVersion("v1.0");
        properties.setRoutingRules(List.of(route));

        RequestRouter router = new RequestRouter(properties);

        assertThat(router.rules()).hasSize(1);
        assertThat(router.route("/legacy/x")).get()
                .extracting(RoutingRule::getTargetVersion).isEqualTo("v1.0");
    }

    @Test
    void ruleWithoutPatternIsRejected() {
        RequestRouter router = new RequestRouter(new ProxyProperties());

        assertThatThrownBy(() -> router.addRule(RoutingRule.builder().name("broken").build()))
                .isInstanceOf(ValidationException.class);
    }
}
