package com.khaounen.gatewaypolicy.security.policy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.khaounen.gatewaypolicy.config.RequestContextFilter;
import com.khaounen.gatewaypolicy.security.filters.PolicyEnforcementFilter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;

@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(PolicyEngineProperties.class)
public class PolicyEvaluatorAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public PolicyEvaluator policyEvaluator(
            PolicyEngineProperties properties,
            ObjectProvider<ObjectMapper> objectMapperProvider
    ) {
        if (properties.getMode() == PolicyEngineProperties.Mode.IN_MEMORY) {
            log.info("gateway-policy: using in-memory policy evaluator");
            return new InMemoryPolicyEvaluator();
        }
        String endpoint = properties.getEndpoint();
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalStateException(
                    "gateway-policy.endpoint is required when gateway-policy.mode is REMOTE"
            );
        }
        HttpClient client = HttpClient.newBuilder()
                .connectTimeout(properties.getConnectTimeout())
                .build();
        ObjectMapper objectMapper = objectMapperProvider.getIfAvailable(ObjectMapper::new);
        log.info("gateway-policy: querying policy engine at {}", endpoint);
        return new OpaPolicyEvaluator(
                endpoint,
                client,
                objectMapper,
                properties.getTimeout(),
                properties.getMaxRetries(),
                properties.getRetryBackoff()
        );
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    @ConditionalOnClass(name = "org.springframework.security.core.context.SecurityContextHolder")
    @ConditionalOnProperty(prefix = "gateway-policy.filter", name = "enabled", havingValue = "true")
    static class FilterConfiguration {

        @Bean(name = "policyRequestContextFilter")
        @ConditionalOnMissingBean
        public RequestContextFilter requestContextFilter() {
            return new RequestContextFilter();
        }

        @Bean
        @ConditionalOnMissingBean
        public PolicyEnforcementFilter policyEnforcementFilter(
                PolicyEngineProperties properties,
                PolicyEvaluator policyEvaluator
        ) {
            String gateway = properties.getFilter().getGateway();
            if (Gateway.fromId(gateway).isEmpty()) {
                throw new IllegalStateException(
                        "gateway-policy.filter.gateway must be one of admin-gateway, public-gateway but was " + gateway
                );
            }
            return new PolicyEnforcementFilter(properties.getFilter(), policyEvaluator);
        }
    }
}
