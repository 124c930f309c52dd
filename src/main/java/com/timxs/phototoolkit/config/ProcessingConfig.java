package com.timxs.phototoolkit.config;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 批处理配置
 * 一次批处理运行的不可变输入，启动前整体校验一次
 */
@Value
@Builder(toBuilder = true)
public class ProcessingConfig {

    /**
     * 十六进制颜色（#RGB 或 #RRGGBB，# 可省略）
     */
    private static final Pattern HEX_COLOR = Pattern.compile("^#?([0-9a-fA-F]{3}|[0-9a-fA-F]{6})$");

    // ========== 目录 ==========

    /**
     * 输入目录（非递归扫描）
     */
    Path inputFolder;

    /**
     * 输出目录，不存在时自动创建
     */
    Path outputFolder;

    // ========== 图片处理 ==========

    /**
     * 边框宽度（像素），0 表示不加边框
     */
    @Builder.Default
    int borderThickness = 0;

    /**
     * 边框颜色（十六进制）
     */
    @Builder.Default
    String borderColor = "#FFFFFF";

    /**
     * 饱和度（0-200），100 表示不变，0 为灰度
     */
    @Builder.Default
    int saturation = 100;

    /**
     * 水印列表，按顺序叠加
     */
    @Singular
    List<WatermarkSpec> watermarks;

    // ========== 输出命名 ==========

    /**
     * 输出文件名前缀
     */
    @Builder.Default
    String filenamePrefix = "";

    /**
     * 输出文件名后缀（位于扩展名之前）
     */
    @Builder.Default
    String filenameSuffix = "";

    /**
     * 输出文件已存在时是否覆盖
     */
    @Builder.Default
    boolean overwriteExisting = false;

    // ========== 并行 ==========

    /**
     * 是否并行处理，关闭时严格顺序处理
     */
    @Builder.Default
    boolean parallelProcessing = false;

    /**
     * 最大工作线程数，0 表示根据 CPU 核数自动计算
     */
    @Builder.Default
    int maxWorkers = 0;

    /**
     * 校验配置，收集全部错误
     *
     * @return 错误信息列表，为空表示有效
     */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();

        if (inputFolder == null || inputFolder.toString().isBlank()) {
            errors.add("Input folder is required");
        } else if (!Files.isDirectory(inputFolder)) {
            errors.add("Input folder does not exist: " + inputFolder);
        }

        if (outputFolder == null || outputFolder.toString().isBlank()) {
            errors.add("Output folder is required");
        }

        if (borderThickness < 0) {
            errors.add("Border thickness cannot be negative");
        }
        if (borderThickness > 0 && (borderColor == null || !HEX_COLOR.matcher(borderColor).matches())) {
            errors.add("Invalid border color: " + borderColor);
        }

        if (saturation < 0 || saturation > 200) {
            errors.add("Saturation must be between 0 and 200");
        }

        if (maxWorkers < 0) {
            errors.add("Max workers cannot be negative");
        }

        for (int i = 0; i < watermarks.size(); i++) {
            WatermarkSpec watermark = watermarks.get(i);
            if (watermark == null) {
                continue;
            }
            for (String error : watermark.validate()) {
                errors.add("Watermark " + (i + 1) + ": " + error);
            }
        }
        return errors;
    }
}
