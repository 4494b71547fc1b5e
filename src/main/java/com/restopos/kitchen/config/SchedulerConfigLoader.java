package com.restopos.kitchen.config;

import com.google.common.base.Preconditions;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Builds {@link SchedulerConfig} from its JSON form. Keys missing from the JSON keep their defaults.
 */
@Slf4j public class SchedulerConfigLoader {

    public static final String DEFAULT_RESOURCE = "kitchen_config.json";

    private SchedulerConfigLoader() {
    }

    public static SchedulerConfig fromClasspath(String resourceName) {
        InputStream inputStream = SchedulerConfigLoader.class.getClassLoader().getResourceAsStream(resourceName);
        Preconditions.checkArgument(inputStream != null, "No config resource named %s on the classpath", resourceName);
        try (Reader reader = new InputStreamReader(inputStream, StandardCharsets.UTF_8)) {
            return fromJson(reader);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read config resource " + resourceName, e);
        }
    }

    public static SchedulerConfig fromJson(Reader reader) {
        JsonObject configJson = JsonParser.parseReader(reader).getAsJsonObject();
        SchedulerConfig config = SchedulerConfig.builder().build();

        if (has(configJson, "maxConcurrentPreparations"))
            config.setMaxConcurrentPreparations(positive(configJson, "maxConcurrentPreparations"));
        if (has(configJson, "tickIntervalSeconds"))
            config.setTickIntervalSeconds(positive(configJson, "tickIntervalSeconds"));
        if (has(configJson, "basePreparationDurationMinutes"))
            config.setBasePreparationDurationMinutes(positive(configJson, "basePreparationDurationMinutes"));
        if (has(configJson, "delayPredictionEveryTicks"))
            config.setDelayPredictionEveryTicks(positive(configJson, "delayPredictionEveryTicks"));
        if (has(configJson, "learningEveryTicks"))
            config.setLearningEveryTicks(positive(configJson, "learningEveryTicks"));
        if (has(configJson, "learningLookbackDays"))
            config.setLearningLookbackDays(positive(configJson, "learningLookbackDays"));
        if (has(configJson, "learningSampleLimit"))
            config.setLearningSampleLimit(positive(configJson, "learningSampleLimit"));
        if (has(configJson, "capacityLookbackHours"))
            config.setCapacityLookbackHours(positive(configJson, "capacityLookbackHours"));
        if (has(configJson, "delayLookbackDays"))
            config.setDelayLookbackDays(positive(configJson, "delayLookbackDays"));
        if (has(configJson, "minHistorySamples"))
            config.setMinHistorySamples(positive(configJson, "minHistorySamples"));
        if (has(configJson, "poissonMeanPerSecond"))
            config.setPoissonMeanPerSecond(configJson.get("poissonMeanPerSecond").getAsDouble());

        if (has(configJson, "minDelayForReadyInSecs"))
            config.setMinDelayForReadyInSecs(configJson.get("minDelayForReadyInSecs").getAsInt());
        if (has(configJson, "maxDelayForReadyInSecs"))
            config.setMaxDelayForReadyInSecs(configJson.get("maxDelayForReadyInSecs").getAsInt());
        Preconditions.checkArgument(config.getMinDelayForReadyInSecs() >= 0, "minDelayForReadyInSecs must not be negative");
        Preconditions.checkArgument(config.getMaxDelayForReadyInSecs() >= config.getMinDelayForReadyInSecs(),
            "maxDelayForReadyInSecs must not be lower than minDelayForReadyInSecs");

        log.info("Loaded scheduler config, tickIntervalSeconds={}, maxConcurrentPreparations={}, basePreparationDurationMinutes={}",
            config.getTickIntervalSeconds(), config.getMaxConcurrentPreparations(), config.getBasePreparationDurationMinutes());
        return config;
    }

    private static boolean has(JsonObject configJson, String key) {
        JsonElement element = configJson.get(key);
        return element != null && !element.isJsonNull();
    }

    private static int positive(JsonObject configJson, String key) {
        int value = configJson.get(key).getAsInt();
        Preconditions.checkArgument(value > 0, "%s must be positive, was %s", key, value);
        return value;
    }
}
