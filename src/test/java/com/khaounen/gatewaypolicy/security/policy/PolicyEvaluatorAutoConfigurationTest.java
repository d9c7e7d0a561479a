package com.khaounen.gatewaypolicy.security.policy;

import com.khaounen.gatewaypolicy.config.RequestContextFilter;
import com.khaounen.gatewaypolicy.security.filters.PolicyEnforcementFilter;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.boot.test.context.runner.WebApplicationContextRunner;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;

class PolicyEvaluatorAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(PolicyEvaluatorAutoConfiguration.class));

    private final WebApplicationContextRunner webRunner = new WebApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(PolicyEvaluatorAutoConfiguration.class));

    @Test
    void remoteModeCreatesHttpEvaluator() {
        runner.withPropertyValues(
                "gateway-policy.endpoint=http://opa:8181/",
                "gateway-policy.timeout=2s",
                "gateway-policy.max-retries=2"
        ).run(context -> {
            OpaPolicyEvaluator evaluator = assertInstanceOf(OpaPolicyEvaluator.class, context.getBean(PolicyEvaluator.class));
            assertEquals("http://opa:8181", evaluator.getEndpoint());
            PolicyEngineProperties properties = context.getBean(PolicyEngineProperties.class);
            assertEquals(Duration.ofSeconds(2), properties.getTimeout());
            assertEquals(2, properties.getMaxRetries());
        });
    }

    @Test
    void inMemoryModeCreatesReferenceEvaluator() {
        runner.withPropertyValues("gateway-policy.mode=in-memory").run(context ->
                assertInstanceOf(InMemoryPolicyEvaluator.class, context.getBean(PolicyEvaluator.class)));
    }

    @Test
    void remoteModeWithoutEndpointFailsStartup() {
        runner.run(context -> assertNotNull(context.getStartupFailure()));
    }

    @Test
    void userSuppliedEvaluatorWins() {
        InMemoryPolicyEvaluator custom = new InMemoryPolicyEvaluator();
        runner.withBean(PolicyEvaluator.class, () -> custom).run(context ->
                assertSame(custom, context.getBean(PolicyEvaluator.class)));
    }

    @Test
    void filtersAreRegisteredOnlyWhenEnabled() {
        webRunner.withPropertyValues("gateway-policy.mode=in-memory").run(context -> {
            assertFalse(context.containsBean("policyEnforcementFilter"));
            assertFalse(context.containsBean("policyRequestContextFilter"));
        });

        webRunner.withPropertyValues(
                "gateway-policy.mode=in-memory",
                "gateway-policy.filter.enabled=true",
                "gateway-policy.filter.gateway=admin-gateway"
        ).run(context -> {
            assertEquals(1, context.getBeansOfType(PolicyEnforcementFilter.class).size());
            assertEquals(1, context.getBeansOfType(RequestContextFilter.class).size());
        });
    }

    @Test
    void filterRequiresRecognizedGateway() {
        webRunner.withPropertyValues(
                "gateway-policy.mode=in-memory",
                "gateway-policy.filter.enabled=true",
                "gateway-policy.filter.gateway=partner-gateway"
        ).run(context -> assertNotNull(context.getStartupFailure()));
    }
}
