package com.example.clipper.config;

import com.example.clipper.service.keys.CredentialRotator;
import com.example.clipper.service.keys.KeyValidator;
import com.example.clipper.util.KeyMasks;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Configuration
public class HealthConfig {

    /**
     * Checks every key of each validated service against its live endpoint. Keys only show up masked.
     */
    @Bean
    public HealthIndicator credentialsHealth(CredentialRotator rotator, List<KeyValidator> validators) {
        return () -> {
            Health.Builder builder = Health.up();
            for (KeyValidator validator : validators) {
                String service = validator.service();
                List<String> keys = rotator.getAll(service);
                if (keys.isEmpty()) {
                    builder.down().withDetail(service, "no keys");
                    continue;
                }
                Map<String, String> results = new LinkedHashMap<>();
                int valid = 0;
                for (String key : keys) {
                    boolean ok = validator.validate(key);
                    if (ok) {
                        valid++;
                    }
                    results.put(KeyMasks.mask(key), ok ? "valid" : "invalid");
                }
                if (valid == 0) {
                    builder.down();
                }
                builder.withDetail(service, Map.of("valid", valid, "total", keys.size(), "keys", results));
            }
            return builder.build();
        };
    }
}
