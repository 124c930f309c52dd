package com.timxs.phototoolkit.config;

import com.timxs.phototoolkit.model.WatermarkPosition;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 图片水印配置 record
 *
 * @param path     水印图片路径，为空时该水印在处理时被忽略
 * @param position 位置（九宫格）
 * @param opacity  透明度 0.0-1.0
 * @param scale    缩放比例，目标图片短边的百分比 1.0-100.0
 * @param margin   边距（像素）
 */
public record WatermarkSpec(
    Path path,
    WatermarkPosition position,
    double opacity,
    double scale,
    int margin
) {
    public static final WatermarkPosition DEFAULT_POSITION = WatermarkPosition.MIDDLE_CENTER;
    public static final double DEFAULT_OPACITY = 0.5;
    public static final double DEFAULT_SCALE = 25.0;
    public static final int DEFAULT_MARGIN = 20;

    /**
     * 使用默认位置、透明度、缩放和边距创建水印配置
     */
    public static WatermarkSpec of(Path path) {
        return new WatermarkSpec(path, DEFAULT_POSITION, DEFAULT_OPACITY, DEFAULT_SCALE, DEFAULT_MARGIN);
    }

    /**
     * 是否配置了水印图片
     */
    public boolean hasPath() {
        return path != null && !path.toString().isBlank();
    }

    /**
     * 校验配置
     *
     * @return 错误信息列表，为空表示有效
     */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (hasPath() && !Files.isRegularFile(path)) {
            errors.add("Watermark file not found: " + path);
        }
        if (position == null) {
            errors.add("Invalid watermark position");
        }
        if (!(opacity >= 0.0 && opacity <= 1.0)) {
            errors.add("Watermark opacity must be between 0.0 and 1.0");
        }
        if (!(scale >= 1.0 && scale <= 100.0)) {
            errors.add("Watermark scale must be between 1.0 and 100.0");
        }
        if (margin < 0) {
            errors.add("Watermark margin cannot be negative");
        }
        return errors;
    }

    /**
     * 根据目标图片尺寸计算水印缩放后的尺寸，保持宽高比
     * 长边缩放到目标图片短边 × scale%
     *
     * @return [宽, 高]
     */
    public int[] calculateSize(int imageWidth, int imageHeight, int watermarkWidth, int watermarkHeight) {
        int targetSize = (int) (Math.min(imageWidth, imageHeight) * (scale / 100.0));
        double ratio = (double) watermarkWidth / watermarkHeight;
        if (watermarkWidth > watermarkHeight) {
            return new int[] {targetSize, (int) (targetSize / ratio)};
        }
        return new int[] {(int) (targetSize * ratio), targetSize};
    }
}
