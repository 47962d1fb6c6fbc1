package com.trading.dpl.io;

import com.trading.dpl.engine.PoolConfig;
import org.junit.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.Assert.*;

public class EngineConfigTest {

    @Test
    public void testDefaults() {
        EngineConfig config = EngineConfig.defaults();

        assertEquals(new PoolConfig(16, 1024), config.poolConfig());
        assertEquals(256, config.getStreaming().getWindowSize());
        assertTrue(config.getColumnar().isEnabled());
        assertEquals(1024, config.getFeed().getRingBufferSize());
    }

    @Test
    public void testLoadFromClasspath() {
        EngineConfig config = EngineConfig.load();
        assertEquals(EngineConfig.defaults(), config);
    }

    @Test
    public void testPartialJsonKeepsDefaults() {
        EngineConfig config = EngineConfig.fromJson("{\"pool\":{\"maxSize\":8},\"columnar\":{\"enabled\":false}}");

        assertEquals(new PoolConfig(16, 8), config.poolConfig());
        assertFalse(config.getColumnar().isEnabled());
        assertEquals(256, config.getStreaming().getWindowSize());
    }

    @Test
    public void testUnknownPropertiesIgnored() {
        EngineConfig config = EngineConfig.fromJson("{\"dashboard\":{\"port\":8080},\"streaming\":{\"windowSize\":3}}");
        assertEquals(3, config.getStreaming().getWindowSize());
    }

    @Test
    public void testValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> EngineConfig.fromJson("{\"feed\":{\"ringBufferSize\":1000}}"));
        assertThrows(IllegalArgumentException.class,
                () -> EngineConfig.fromJson("{\"streaming\":{\"windowSize\":0}}"));
        assertThrows(IllegalArgumentException.class,
                () -> EngineConfig.fromJson("{\"pool\":{\"maxSize\":0}}"));
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.fromJson("{not json"));
    }

    @Test
    public void testFromFile() throws IOException {
        Path file = Files.createTempFile("dpl-engine", ".json");
        try {
            Files.writeString(file, "{\"feed\":{\"ringBufferSize\":64}}");
            assertEquals(64, EngineConfig.fromFile(file).getFeed().getRingBufferSize());
        } finally {
            Files.delete(file);
        }
        assertThrows(UncheckedIOException.class, () -> EngineConfig.fromFile(file));
    }
}
