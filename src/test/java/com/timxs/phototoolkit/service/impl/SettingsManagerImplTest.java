package com.timxs.phototoolkit.service.impl;

import com.timxs.phototoolkit.config.EngineProperties;
import com.timxs.phototoolkit.config.ProcessingConfig;
import com.timxs.phototoolkit.config.WatermarkSpec;
import com.timxs.phototoolkit.model.WatermarkPosition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SettingsManagerImplTest {

    @TempDir
    Path tempDir;

    private Path settingsFile;

    private SettingsManagerImpl settingsManager;

    @BeforeEach
    void setUp() {
        settingsFile = tempDir.resolve("settings.json");
        EngineProperties properties = new EngineProperties();
        properties.setSettingsFile(settingsFile);
        settingsManager = new SettingsManagerImpl(properties);
    }

    @Test
    void readsProcessingSection() throws IOException {
        Files.writeString(settingsFile, """
            {
              "processing": {
                "input_folder": "/photos/in",
                "output_folder": "/photos/out",
                "border_thickness": "12",
                "border_color": "#000000",
                "saturation": 80,
                "filename_prefix": "web_",
                "filename_suffix": "_v2",
                "overwrite_existing": true,
                "parallel_processing": true,
                "max_workers": 4,
                "watermarks": [
                  {"path": "/logos/a.png", "position": "bottom-right", "opacity": 0.8, "scale": "15", "margin": 10},
                  {"path": "/logos/b.png"}
                ]
              }
            }
            """);

        StepVerifier.create(settingsManager.getConfig())
            .assertNext(config -> {
                assertEquals(Path.of("/photos/in"), config.getInputFolder());
                assertEquals(Path.of("/photos/out"), config.getOutputFolder());
                assertEquals(12, config.getBorderThickness());
                assertEquals("#000000", config.getBorderColor());
                assertEquals(80, config.getSaturation());
                assertEquals("web_", config.getFilenamePrefix());
                assertEquals("_v2", config.getFilenameSuffix());
                assertTrue(config.isOverwriteExisting());
                assertTrue(config.isParallelProcessing());
                assertEquals(4, config.getMaxWorkers());
                assertEquals(2, config.getWatermarks().size());
                assertEquals(new WatermarkSpec(Path.of("/logos/a.png"), WatermarkPosition.BOTTOM_RIGHT, 0.8, 15.0, 10),
                    config.getWatermarks().get(0));
                assertEquals(WatermarkSpec.of(Path.of("/logos/b.png")), config.getWatermarks().get(1));
            })
            .verifyComplete();
    }

    @Test
    void readsLegacySingleWatermarkFields() throws IOException {
        Files.writeString(settingsFile, """
            {"processing": {"watermark_path": "/logo.png", "watermark_position": "top-left",
                            "watermark_opacity": 0.3, "watermark_scale": 40.0, "watermark_margin": 5}}
            """);

        StepVerifier.create(settingsManager.getConfig())
            .assertNext(config -> assertEquals(
                new WatermarkSpec(Path.of("/logo.png"), WatermarkPosition.TOP_LEFT, 0.3, 40.0, 5),
                config.getWatermarks().get(0)))
            .verifyComplete();
    }

    @Test
    void unknownPositionFallsBackToCenter() throws IOException {
        Files.writeString(settingsFile, """
            {"processing": {"watermarks": [{"path": "/logo.png", "position": "somewhere"}]}}
            """);

        StepVerifier.create(settingsManager.getConfig())
            .assertNext(config -> assertEquals(WatermarkPosition.MIDDLE_CENTER,
                config.getWatermarks().get(0).position()))
            .verifyComplete();
    }

    @Test
    void missingFileGivesDefaults() {
        StepVerifier.create(settingsManager.getConfig())
            .assertNext(this::assertDefaults)
            .verifyComplete();
    }

    @Test
    void malformedFileGivesDefaults() throws IOException {
        Files.writeString(settingsFile, "{ not json");

        StepVerifier.create(settingsManager.getConfig())
            .assertNext(this::assertDefaults)
            .verifyComplete();
    }

    @Test
    void readsEngineSection() throws IOException {
        Files.writeString(settingsFile, """
            {"engine": {"poll_interval_ms": 250, "max_worker_ceiling": 6, "window_factor": 3, "preview_max_size": "640"}}
            """);

        StepVerifier.create(settingsManager.getEngineProperties())
            .assertNext(properties -> {
                assertEquals(Duration.ofMillis(250), properties.getPollInterval());
                assertEquals(6, properties.getMaxWorkerCeiling());
                assertEquals(3, properties.getWindowFactor());
                assertEquals(640, properties.getPreviewMaxSize());
                assertEquals(settingsFile, properties.getSettingsFile());
            })
            .verifyComplete();
    }

    @Test
    void engineDefaultsWhenSectionMissing() throws IOException {
        Files.writeString(settingsFile, "{\"processing\": {}}");

        StepVerifier.create(settingsManager.getEngineProperties())
            .assertNext(properties -> {
                assertEquals(Duration.ofSeconds(1), properties.getPollInterval());
                assertEquals(12, properties.getMaxWorkerCeiling());
                assertEquals(2, properties.getWindowFactor());
                assertEquals(800, properties.getPreviewMaxSize());
            })
            .verifyComplete();
    }

    private void assertDefaults(ProcessingConfig config) {
        assertNull(config.getInputFolder());
        assertNull(config.getOutputFolder());
        assertEquals(0, config.getBorderThickness());
        assertEquals(100, config.getSaturation());
        assertFalse(config.isOverwriteExisting());
        assertTrue(config.getWatermarks().isEmpty());
    }
}
