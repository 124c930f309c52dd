package com.timxs.phototoolkit.config;

import com.timxs.phototoolkit.model.WorkItem;

import java.nio.file.Path;
import java.util.List;

/**
 * 单张图片的处理参数 record
 * 只包含值类型，可以安全地交给任意工作线程
 *
 * @param inputPath       输入文件
 * @param outputPath      输出文件（预览时可为 null）
 * @param borderThickness 边框宽度，0 表示不加边框
 * @param borderColor     边框颜色
 * @param saturation      饱和度 0-200，100 表示不变
 * @param watermarks      有效的水印（已过滤掉未配置路径的项）
 */
public record ImageTask(
    Path inputPath,
    Path outputPath,
    int borderThickness,
    String borderColor,
    int saturation,
    List<WatermarkSpec> watermarks
) {
    public ImageTask {
        watermarks = watermarks == null ? List.of() : List.copyOf(watermarks);
    }

    /**
     * 从工作项和批处理配置创建
     */
    public static ImageTask from(WorkItem item, ProcessingConfig config) {
        return from(item.inputPath(), item.outputPath(), config);
    }

    /**
     * 从输入/输出路径和批处理配置创建
     */
    public static ImageTask from(Path inputPath, Path outputPath, ProcessingConfig config) {
        return new ImageTask(
            inputPath,
            outputPath,
            Math.max(0, config.getBorderThickness()),
            config.getBorderColor(),
            config.getSaturation(),
            config.getWatermarks().stream()
                .filter(watermark -> watermark != null && watermark.hasPath())
                .toList()
        );
    }
}
