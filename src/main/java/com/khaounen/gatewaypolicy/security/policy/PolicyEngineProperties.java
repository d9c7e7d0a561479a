package com.khaounen.gatewaypolicy.security.policy;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.AntPathMatcher;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "gateway-policy")
public class PolicyEngineProperties {

    private Mode mode = Mode.REMOTE;
    private String endpoint;
    private Duration timeout = OpaPolicyEvaluator.DEFAULT_TIMEOUT;
    private Duration connectTimeout = Duration.ofSeconds(2);
    private int maxRetries = 0;
    private Duration retryBackoff = OpaPolicyEvaluator.DEFAULT_RETRY_BACKOFF;
    private Filter filter = new Filter();

    public enum Mode {
        REMOTE,
        IN_MEMORY
    }

    @Data
    public static class Filter {
        private boolean enabled = false;
        private String gateway;
        private boolean failOpen = false;
        private List<String> excludePaths = new ArrayList<>();

        private final AntPathMatcher matcher = new AntPathMatcher();

        public boolean isExcluded(String path) {
            if (excludePaths == null || excludePaths.isEmpty() || path == null) {
                return false;
            }
            return excludePaths.stream().anyMatch(pattern -> matcher.match(pattern, path));
        }
    }
}
