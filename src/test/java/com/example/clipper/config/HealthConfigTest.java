package com.example.clipper.config;

import com.example.clipper.service.keys.CredentialRotator;
import com.example.clipper.service.keys.KeyValidator;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

class HealthConfigTest {

    private final CredentialRotator rotator = Mockito.mock(CredentialRotator.class);

    private static KeyValidator validator(String service, String... validKeys) {
        List<String> valid = List.of(validKeys);
        return new KeyValidator() {
            @Override
            public String service() {
                return service;
            }

            @Override
            public boolean validate(String key) {
                return valid.contains(key);
            }
        };
    }

    @Test
    void upWhenAtLeastOneKeyWorks() {
        when(rotator.getAll("github")).thenReturn(List.of("ghp_aaaaaaaaaaaa1111", "ghp_bbbbbbbbbbbb2222"));

        Health health = new HealthConfig()
                .credentialsHealth(rotator, List.of(validator("github", "ghp_aaaaaaaaaaaa1111")))
                .health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        @SuppressWarnings("unchecked")
        Map<String, Object> github = (Map<String, Object>) health.getDetails().get("github");
        assertThat(github).containsEntry("valid", 1).containsEntry("total", 2);
        assertThat(github.get("keys").toString())
                .contains("ghp_…1111")
                .doesNotContain("ghp_aaaaaaaaaaaa1111");
    }

    @Test
    void downWhenNoKeyWorks() {
        when(rotator.getAll("github")).thenReturn(List.of("ghp_revoked_token_0000"));

        Health health = new HealthConfig().credentialsHealth(rotator, List.of(validator("github"))).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
    }

    @Test
    void downWhenPoolIsEmpty() {
        when(rotator.getAll("github")).thenReturn(List.of());

        Health health = new HealthConfig().credentialsHealth(rotator, List.of(validator("github"))).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("github", "no keys");
    }
}
