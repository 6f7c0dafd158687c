package com.example.clipper.service.github;

import com.example.clipper.config.GithubProperties;
import com.example.clipper.service.keys.KeyValidator;
import com.example.clipper.util.KeyMasks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;

/**
 * A GitHub token is valid when {@code GET /user} answers 200 with it.
 */
@Component
public class GithubKeyValidator implements KeyValidator {
    private static final Logger LOGGER = LoggerFactory.getLogger(GithubKeyValidator.class);
    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private final WebClient client;
    private final GithubProperties props;

    public GithubKeyValidator(@Qualifier("githubWebClient") WebClient client, GithubProperties props) {
        this.client = client;
        this.props = props;
    }

    @Override
    public String service() {
        return props.getKeyService();
    }

    @Override
    public boolean validate(String key) {
        try {
            var response = client.get()
                    .uri("/user")
                    .headers(h -> h.setBearerAuth(key))
                    .retrieve()
                    .toBodilessEntity()
                    .block(TIMEOUT);
            return response != null && response.getStatusCode().value() == 200;
        } catch (WebClientResponseException ex) {
            LOGGER.warn("GitHub key check failed key={} status={}", KeyMasks.mask(key), ex.getStatusCode().value());
            return false;
        } catch (RuntimeException ex) {
            LOGGER.warn("GitHub key check failed key={} error={}", KeyMasks.mask(key), ex.toString());
            return false;
        }
    }
}
