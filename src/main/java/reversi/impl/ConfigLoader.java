package reversi.impl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import reversi.records.EngineConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads the JSON engine settings. Every field is optional:
 *
 * <pre>{@code
 * {
 *   "max_time": 100.0,
 *   "log": true,
 *   "mcts_config": { "exploration_factor": 1.418 }
 * }
 * }</pre>
 *
 * A missing, unreadable or malformed document yields the defaults; the
 * problem is logged and never fatal. Out-of-range values (a non-positive
 * {@code max_time}, a negative {@code exploration_factor}) fall back to their
 * default one field at a time.
 */
public final class ConfigLoader {

    private static final Logger LOGGER = LogManager.getLogger();
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ConfigLoader() {}

    public static EngineConfig load(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            LOGGER.warn("Configuration file {} not found; using defaults.", file);
            return EngineConfig.defaults();
        }
        try {
            return parse(Files.readString(file));
        } catch (IOException e) {
            LOGGER.warn("Failed to read the configuration file {}: {}; using defaults.", file, e.getMessage());
            return EngineConfig.defaults();
        }
    }

    public static EngineConfig parse(String json) {
        try {
            ConfigDocument doc = MAPPER.readValue(json, ConfigDocument.class);
            return doc == null ? EngineConfig.defaults() : doc.toConfig();
        } catch (JsonProcessingException e) {
            LOGGER.warn("Failed to parse the configuration file: {}; using defaults.", e.getOriginalMessage());
            return EngineConfig.defaults();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class ConfigDocument {
        @JsonProperty("max_time")
        public Double maxTime;

        @JsonProperty("log")
        public Boolean log;

        @JsonProperty("mcts_config")
        public MctsSection mcts;

        EngineConfig toConfig() {
            EngineConfig d = EngineConfig.defaults();
            double time = d.maxTimeSeconds();
            if (maxTime != null) {
                if (Double.isFinite(maxTime) && maxTime > 0) {
                    time = maxTime;
                } else {
                    LOGGER.warn("Ignoring max_time {}; must be a positive number of seconds. Using {}.", maxTime, time);
                }
            }
            double exploration = d.explorationFactor();
            if (mcts != null && mcts.explorationFactor != null) {
                if (Double.isFinite(mcts.explorationFactor) && mcts.explorationFactor >= 0) {
                    exploration = mcts.explorationFactor;
                } else {
                    LOGGER.warn("Ignoring exploration_factor {}; must be finite and non-negative. Using {}.",
                            mcts.explorationFactor, exploration);
                }
            }
            return new EngineConfig(time, log != null ? log : d.log(), exploration);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class MctsSection {
        @JsonProperty("exploration_factor")
        public Double explorationFactor;
    }
}
