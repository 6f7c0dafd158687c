package com.example.clipper.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Where rotated API keys come from: one newline-delimited file per service under {@link #getDir()},
 * with an environment variable as single-key fallback.
 */
@ConfigurationProperties(prefix = "clipper.keys")
public class KeysProperties {

    private static final Map<String, String> DEFAULT_ENV_VARS = Map.of(
            "github", "GH_PAT",
            "deepgram", "DEEPGRAM_API_KEY",
            "gemini", "GEMINI_API_KEY"
    );

    private String dir = "config/keys";
    private Map<String, Source> services = new HashMap<>();

    public String fileFor(String service) {
        Source source = services.get(service);
        if (source != null && source.getFile() != null && !source.getFile().isBlank()) {
            return source.getFile();
        }
        return service + "-keys.txt";
    }

    public String envVarFor(String service) {
        Source source = services.get(service);
        if (source != null && source.getEnv() != null && !source.getEnv().isBlank()) {
            return source.getEnv();
        }
        String known = DEFAULT_ENV_VARS.get(service);
        if (known != null) {
            return known;
        }
        return service.toUpperCase(Locale.ROOT).replace('-', '_') + "_API_KEY";
    }

    public String getDir() {
        return dir;
    }

    public void setDir(String dir) {
        this.dir = dir;
    }

    public Map<String, Source> getServices() {
        return services;
    }

    public void setServices(Map<String, Source> services) {
        this.services = services;
    }

    public static class Source {
        private String file;
        private String env;

        public Source() {
        }

        public Source(String file, String env) {
            this.file = file;
            this.env = env;
        }

        public String getFile() {
            return file;
        }

        public void setFile(String file) {
            this.file = file;
        }

        public String getEnv() {
            return env;
        }

        public void setEnv(String env) {
            this.env = env;
        }
    }
}
