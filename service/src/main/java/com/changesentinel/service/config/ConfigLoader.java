package com.changesentinel.service.config;

import com.changesentinel.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

public final class ConfigLoader {
    public static final String FILE_NAME = "monitor.json";

    private ConfigLoader() {
    }

    public static MonitorConfig load(Path configDir) {
        return load(configDir, System.getenv());
    }

    public static MonitorConfig load(Path configDir, Map<String, String> environment) {
        MonitorConfig config = read(configDir.resolve(FILE_NAME));
        String apiKey = environment.get("CLASSIFIER_API_KEY");
        if (apiKey != null && !apiKey.isBlank()) {
            config = config.withClassifierApiKey(apiKey.trim());
        }
        return config.validate();
    }

    private static MonitorConfig read(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readValue(in, MonitorConfig.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}
