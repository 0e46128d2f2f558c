package dumb.deduce;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import dumb.deduce.util.Json;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

import static java.util.Objects.requireNonNull;

public record Configuration(@JsonProperty("freshVariablePrefix") String freshVariablePrefix) {
    public static final String RESOURCE = "deduce.json";

    private static final Logger logger = LoggerFactory.getLogger(Configuration.class);
    private static volatile Configuration loaded;

    public Configuration {
        requireNonNull(freshVariablePrefix);
    }

    @JsonCreator
    public static Configuration create(@JsonProperty("freshVariablePrefix") @Nullable String freshVariablePrefix) {
        return new Configuration(freshVariablePrefix != null ? freshVariablePrefix : Variable.DEFAULT_FRESH_PREFIX);
    }

    public static Configuration defaults() {
        return new Configuration(Variable.DEFAULT_FRESH_PREFIX);
    }

    /**
     * The configuration read from {@value #RESOURCE} on the classpath, loaded once. Falls back to
     * {@link #defaults()} when the resource is missing or unreadable.
     */
    public static Configuration get() {
        var c = loaded;
        if (c == null) {
            c = load(RESOURCE);
            loaded = c;
        }
        return c;
    }

    static Configuration load(String resource) {
        try (var in = Configuration.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                logger.warn("No {} on classpath, using defaults", resource);
                return defaults();
            }
            return Json.obj(in, Configuration.class);
        } catch (IOException e) {
            logger.warn("Failed to read {}: {}, using defaults", resource, e.getMessage());
            return defaults();
        }
    }
}
