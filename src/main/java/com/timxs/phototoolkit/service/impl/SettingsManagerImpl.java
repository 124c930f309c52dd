package com.timxs.phototoolkit.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.timxs.phototoolkit.config.EngineProperties;
import com.timxs.phototoolkit.config.ProcessingConfig;
import com.timxs.phototoolkit.config.WatermarkSpec;
import com.timxs.phototoolkit.model.WatermarkPosition;
import com.timxs.phototoolkit.service.SettingsManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * 配置管理器实现
 * 从设置文件的 processing 和 engine 两组设置中读取配置
 */
@Slf4j
@Service
public class SettingsManagerImpl implements SettingsManager {

    /**
     * JSON 解析器
     */
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final Path settingsFile;

    public SettingsManagerImpl(EngineProperties properties) {
        this.settingsFile = properties.getSettingsFile();
    }

    @Override
    public Mono<ProcessingConfig> getConfig() {
        return readSettings()
            .map(root -> buildConfig(root.path("processing")))
            .switchIfEmpty(Mono.fromSupplier(() -> ProcessingConfig.builder().build()))
            .onErrorResume(e -> {
                log.warn("Failed to load settings, using defaults: {}", e.getMessage());
                return Mono.just(ProcessingConfig.builder().build());
            });
    }

    @Override
    public Mono<EngineProperties> getEngineProperties() {
        return readSettings()
            .map(root -> buildEngineProperties(root.path("engine")))
            .switchIfEmpty(Mono.fromSupplier(this::defaultEngineProperties))
            .onErrorResume(e -> {
                log.warn("Failed to load engine settings, using defaults: {}", e.getMessage());
                return Mono.just(defaultEngineProperties());
            });
    }

    /**
     * 读取设置文件，文件不存在时为空
     */
    private Mono<JsonNode> readSettings() {
        return Mono.fromCallable(() -> {
                if (settingsFile == null || !Files.isRegularFile(settingsFile)) {
                    log.debug("设置文件不存在: {}", settingsFile);
                    return null;
                }
                try {
                    return OBJECT_MAPPER.readTree(settingsFile.toFile());
                } catch (IOException e) {
                    throw new IOException("Invalid settings file " + settingsFile + ": " + e.getMessage(), e);
                }
            })
            .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * 构建批处理配置
     * 兼容旧版单水印字段（watermark_path 等）
     */
    private ProcessingConfig buildConfig(JsonNode processing) {
        ProcessingConfig.ProcessingConfigBuilder builder = ProcessingConfig.builder()
            .inputFolder(getPath(processing, "input_folder"))
            .outputFolder(getPath(processing, "output_folder"))
            .borderThickness(getInt(processing, "border_thickness", 0))
            .borderColor(getString(processing, "border_color", "#FFFFFF"))
            .saturation(getInt(processing, "saturation", 100))
            .filenamePrefix(getString(processing, "filename_prefix", ""))
            .filenameSuffix(getString(processing, "filename_suffix", ""))
            .overwriteExisting(getBoolean(processing, "overwrite_existing", false))
            .parallelProcessing(getBoolean(processing, "parallel_processing", false))
            .maxWorkers(getInt(processing, "max_workers", 0));

        JsonNode watermarks = processing.get("watermarks");
        if (watermarks != null && watermarks.isArray()) {
            watermarks.forEach(node -> builder.watermark(buildWatermark(node, "")));
        } else if (!getString(processing, "watermark_path", "").isBlank()) {
            builder.watermark(buildWatermark(processing, "watermark_"));
        }
        return builder.build();
    }

    /**
     * 构建单个水印配置
     *
     * @param node   设置节点
     * @param prefix 字段前缀（数组元素为空，旧版字段为 watermark_）
     */
    private WatermarkSpec buildWatermark(JsonNode node, String prefix) {
        String positionStr = getString(node, prefix + "position", WatermarkSpec.DEFAULT_POSITION.getKey());
        WatermarkPosition position = WatermarkPosition.fromKey(positionStr);
        if (position == null) {
            log.warn("Unknown watermark position '{}', using center", positionStr);
            position = WatermarkSpec.DEFAULT_POSITION;
        }
        return new WatermarkSpec(
            getPath(node, prefix + "path"),
            position,
            getDouble(node, prefix + "opacity", WatermarkSpec.DEFAULT_OPACITY),
            getDouble(node, prefix + "scale", WatermarkSpec.DEFAULT_SCALE),
            getInt(node, prefix + "margin", WatermarkSpec.DEFAULT_MARGIN)
        );
    }

    private EngineProperties buildEngineProperties(JsonNode engine) {
        EngineProperties properties = defaultEngineProperties();
        properties.setPollInterval(Duration.ofMillis(
            getInt(engine, "poll_interval_ms", (int) properties.getPollInterval().toMillis())));
        properties.setMaxWorkerCeiling(getInt(engine, "max_worker_ceiling", properties.getMaxWorkerCeiling()));
        properties.setWindowFactor(getInt(engine, "window_factor", properties.getWindowFactor()));
        properties.setPreviewMaxSize(getInt(engine, "preview_max_size", properties.getPreviewMaxSize()));
        return properties;
    }

    private EngineProperties defaultEngineProperties() {
        EngineProperties properties = new EngineProperties();
        properties.setSettingsFile(settingsFile);
        return properties;
    }

    // ========== 辅助方法 ==========

    /**
     * 从 JsonNode 获取路径，空字符串视为未设置
     */
    private Path getPath(JsonNode node, String key) {
        String value = getString(node, key, "");
        return value.isBlank() ? null : Path.of(value.trim());
    }

    /**
     * 从 JsonNode 获取布尔值
     */
    private boolean getBoolean(JsonNode node, String key, boolean defaultValue) {
        JsonNode value = node.get(key);
        if (value != null && value.isBoolean()) {
            return value.asBoolean();
        }
        return defaultValue;
    }

    /**
     * 从 JsonNode 获取整数值
     * 支持数字类型和字符串类型
     */
    private int getInt(JsonNode node, String key, int defaultValue) {
        JsonNode value = node.get(key);
        if (value != null) {
            if (value.isNumber()) {
                return value.asInt();
            }
            if (value.isTextual()) {
                try {
                    return Integer.parseInt(value.asText().trim());
                } catch (NumberFormatException e) {
                    return defaultValue;
                }
            }
        }
        return defaultValue;
    }

    /**
     * 从 JsonNode 获取浮点值
     * 支持数字类型和字符串类型
     */
    private double getDouble(JsonNode node, String key, double defaultValue) {
        JsonNode value = node.get(key);
        if (value != null) {
            if (value.isNumber()) {
                return value.asDouble();
            }
            if (value.isTextual()) {
                try {
                    return Double.parseDouble(value.asText().trim());
                } catch (NumberFormatException e) {
                    return defaultValue;
                }
            }
        }
        return defaultValue;
    }

    /**
     * 从 JsonNode 获取字符串值
     */
    private String getString(JsonNode node, String key, String defaultValue) {
        JsonNode value = node.get(key);
        if (value != null && value.isTextual()) {
            return value.asText();
        }
        return defaultValue;
    }
}
