package com.medtracker.auth.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Configuration properties for the Authentication Gateway.
 */
@Data
@Component
@ConfigurationProperties(prefix = "auth")
public class AuthProperties {

    private Token token = new Token();
    private Lockout lockout = new Lockout();
    private Session session = new Session();
    private RateLimit rateLimit = new RateLimit();
    private Password password = new Password();
    private Demo demo = new Demo();
    private Audit audit = new Audit();

    @Data
    public static class Token {
        private String secret;
        private String issuer = "SaaS Medical Tracker API";
        private String audience = "SaaS Medical Tracker API";
        private Duration accessTokenTtl = Duration.ofMinutes(30);
        private Duration clockSkew = Duration.ofSeconds(30);
    }

    @Data
    public static class Lockout {
        private Integer threshold = 5;
        private Duration duration = Duration.ofMinutes(15);
    }

    @Data
    public static class Session {
        private String cookieName = "session";
        private Duration ttl = Duration.ofMinutes(30);
        private Boolean cookieSecure = false;
        private String cookieSameSite = "Lax";
    }

    @Data
    public static class RateLimit {
        private Duration window = Duration.ofSeconds(60);
        private Integer maxRequests = 30;
        // Keyed by the text before the first ':' of a limiter key
        private Map<String, Integer> limits = new HashMap<>();
    }

    @Data
    public static class Password {
        private Integer minLength = 8;
    }

    @Data
    public static class Demo {
        private String email = "demo@example.com";
        private String displayName = "Demo User";
        private Duration sessionTtl = Duration.ofMinutes(30);
    }

    @Data
    public static class Audit {
        private Kafka kafka = new Kafka();

        @Data
        public static class Kafka {
            private Boolean enabled = false;
            private String topic = "auth.audit";
        }
    }
}
