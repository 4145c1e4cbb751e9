package com.cubyte.ecs;

import com.cubyte.ecs.core.World;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Properties;

/**
 * Settings used when building a {@link World}.
 * <p>
 * {@link #load()} reads the optional classpath resource {@value #RESOURCE}; system properties with the
 * same keys override it.
 *
 * @param initialCapacity        entity and storage capacity allocated up front
 * @param autoRegisterComponents whether generated component registrations are applied on build
 */
public record WorldConfig(int initialCapacity, boolean autoRegisterComponents) {

    public static final String RESOURCE = "cubyte-ecs.properties";
    public static final String INITIAL_CAPACITY = "ecs.world.initial-capacity";
    public static final String AUTO_REGISTER = "ecs.world.auto-register";

    public WorldConfig {
        if (initialCapacity <= 0) {
            throw new IllegalArgumentException(INITIAL_CAPACITY + " must be positive: " + initialCapacity);
        }
    }

    public static WorldConfig defaults() {
        return new WorldConfig(World.DEFAULT_INITIAL_CAPACITY, true);
    }

    /**
     * Classpath resource, then system properties, then defaults.
     *
     * @throws IllegalArgumentException if a value cannot be parsed
     */
    public static WorldConfig load() {
        Properties properties = new Properties();
        try (InputStream in = WorldConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read " + RESOURCE, e);
        }
        for (String key : new String[]{INITIAL_CAPACITY, AUTO_REGISTER}) {
            String override = System.getProperty(key);
            if (override != null) {
                properties.setProperty(key, override);
            }
        }
        return from(properties);
    }

    /**
     * Missing keys take their default value.
     *
     * @throws IllegalArgumentException if a value cannot be parsed
     */
    public static WorldConfig from(Properties properties) {
        WorldConfig defaults = defaults();
        int capacity = defaults.initialCapacity();
        String capacityValue = properties.getProperty(INITIAL_CAPACITY);
        if (capacityValue != null) {
            try {
                capacity = Integer.parseInt(capacityValue.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(INITIAL_CAPACITY + " is not an integer: '" + capacityValue + "'", e);
            }
        }
        boolean autoRegister = defaults.autoRegisterComponents();
        String autoValue = properties.getProperty(AUTO_REGISTER);
        if (autoValue != null) {
            switch (autoValue.trim().toLowerCase(Locale.ROOT)) {
                case "true" -> autoRegister = true;
                case "false" -> autoRegister = false;
                default -> throw new IllegalArgumentException(AUTO_REGISTER + " is not a boolean: '" + autoValue + "'");
            }
        }
        return new WorldConfig(capacity, autoRegister);
    }

    public WorldConfig withInitialCapacity(int capacity) {
        return new WorldConfig(capacity, autoRegisterComponents);
    }

    public WorldConfig withAutoRegisterComponents(boolean autoRegister) {
        return new WorldConfig(initialCapacity, autoRegister);
    }
}
