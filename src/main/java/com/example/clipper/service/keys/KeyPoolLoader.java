package com.example.clipper.service.keys;

import com.example.clipper.config.KeysProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Function;

/**
 * Reads a service's key pool: the key file first, then the environment variable as a single-key pool.
 */
@Component
public class KeyPoolLoader {
    private static final Logger LOGGER = LoggerFactory.getLogger(KeyPoolLoader.class);

    private final KeysProperties props;
    private final Function<String, String> envLookup;

    @Autowired
    public KeyPoolLoader(KeysProperties props, Environment environment) {
        this(props, environment::getProperty);
    }

    KeyPoolLoader(KeysProperties props, Function<String, String> envLookup) {
        this.props = props;
        this.envLookup = envLookup;
    }

    public List<String> load(String service) {
        Path file = keyFile(service);
        List<String> keys = List.of();
        if (Files.isRegularFile(file)) {
            try {
                keys = Files.readAllLines(file, StandardCharsets.UTF_8).stream()
                        .map(String::trim)
                        .filter(line -> !line.isEmpty() && !line.startsWith("#"))
                        .toList();
            } catch (IOException e) {
                throw new IllegalStateException("Failed to read key file: " + file + ". Error: " + e.getMessage(), e);
            }
        }

        if (keys.isEmpty()) {
            String envVar = envVar(service);
            String value = envLookup.apply(envVar);
            if (value != null && !value.isBlank()) {
                LOGGER.info("Key pool service={} source=env var={}", service, envVar);
                return List.of(value.trim());
            }
            LOGGER.warn("Key pool service={} is empty file={} env={}", service, file, envVar);
            return List.of();
        }

        LOGGER.info("Key pool service={} source=file path={} keys={}", service, file, keys.size());
        return keys;
    }

    public Path keyFile(String service) {
        return Path.of(props.getDir()).resolve(props.fileFor(service));
    }

    public String envVar(String service) {
        return props.envVarFor(service);
    }
}
