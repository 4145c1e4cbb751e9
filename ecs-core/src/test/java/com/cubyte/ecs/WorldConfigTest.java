package com.cubyte.ecs;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("WorldConfig")
public class WorldConfigTest {

    @AfterEach
    void clearOverrides() {
        System.clearProperty(WorldConfig.INITIAL_CAPACITY);
        System.clearProperty(WorldConfig.AUTO_REGISTER);
    }

    @Test
    @DisplayName("Missing keys fall back to defaults")
    void defaults() {
        WorldConfig config = WorldConfig.from(new Properties());

        assertEquals(1024, config.initialCapacity());
        assertTrue(config.autoRegisterComponents());
    }

    @Test
    @DisplayName("The classpath file is read")
    void classpathResource() {
        WorldConfig config = WorldConfig.load();

        assertEquals(256, config.initialCapacity());
        assertFalse(config.autoRegisterComponents());
    }

    @Test
    @DisplayName("System properties override the classpath file")
    void systemOverrides() {
        System.setProperty(WorldConfig.INITIAL_CAPACITY, "2048");
        System.setProperty(WorldConfig.AUTO_REGISTER, "TRUE");

        WorldConfig config = WorldConfig.load();

        assertEquals(2048, config.initialCapacity());
        assertTrue(config.autoRegisterComponents());
    }

    @Test
    @DisplayName("Invalid values name the offending key")
    void invalidValues() {
        Properties badNumber = new Properties();
        badNumber.setProperty(WorldConfig.INITIAL_CAPACITY, "lots");
        Properties badFlag = new Properties();
        badFlag.setProperty(WorldConfig.AUTO_REGISTER, "maybe");
        Properties negative = new Properties();
        negative.setProperty(WorldConfig.INITIAL_CAPACITY, "-1");

        IllegalArgumentException number = assertThrows(IllegalArgumentException.class, () -> WorldConfig.from(badNumber));
        IllegalArgumentException flag = assertThrows(IllegalArgumentException.class, () -> WorldConfig.from(badFlag));
        IllegalArgumentException range = assertThrows(IllegalArgumentException.class, () -> WorldConfig.from(negative));

        assertTrue(number.getMessage().contains(WorldConfig.INITIAL_CAPACITY));
        assertTrue(flag.getMessage().contains(WorldConfig.AUTO_REGISTER));
        assertTrue(range.getMessage().contains(WorldConfig.INITIAL_CAPACITY));
    }
}
