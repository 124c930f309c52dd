package com.timxs.phototoolkit.model;

import java.util.Locale;

/**
 * 水印位置枚举
 * 定义九宫格位置，用于指定水印在图片上的锚点
 */
public enum WatermarkPosition {

    /**
     * 左上角
     */
    TOP_LEFT("top-left"),

    /**
     * 顶部居中
     */
    TOP_CENTER("top"),

    /**
     * 右上角
     */
    TOP_RIGHT("top-right"),

    /**
     * 左侧居中
     */
    MIDDLE_LEFT("left"),

    /**
     * 正中央
     */
    MIDDLE_CENTER("center"),

    /**
     * 右侧居中
     */
    MIDDLE_RIGHT("right"),

    /**
     * 左下角
     */
    BOTTOM_LEFT("bottom-left"),

    /**
     * 底部居中
     */
    BOTTOM_CENTER("bottom"),

    /**
     * 右下角
     */
    BOTTOM_RIGHT("bottom-right");

    /**
     * 设置文件中使用的短名称（如 top-left、center）
     */
    private final String key;

    WatermarkPosition(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    /**
     * 解析位置字符串
     * 同时支持短名称（bottom-right）和枚举名（BOTTOM_RIGHT）
     *
     * @param value 位置字符串
     * @return 对应的位置，无法识别时返回 null
     */
    public static WatermarkPosition fromKey(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (WatermarkPosition position : values()) {
            if (position.key.equals(normalized)
                || position.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return position;
            }
        }
        return null;
    }

    /**
     * 计算水印在图片上的 X 坐标
     *
     * @param imageWidth     图片宽度
     * @param watermarkWidth 水印宽度
     * @param margin         边距（像素）
     * @return X 坐标
     */
    public int calculateX(int imageWidth, int watermarkWidth, int margin) {
        return switch (this) {
            case TOP_LEFT, MIDDLE_LEFT, BOTTOM_LEFT -> margin;
            case TOP_CENTER, MIDDLE_CENTER, BOTTOM_CENTER -> (imageWidth - watermarkWidth) / 2;
            case TOP_RIGHT, MIDDLE_RIGHT, BOTTOM_RIGHT -> imageWidth - watermarkWidth - margin;
        };
    }

    /**
     * 计算水印在图片上的 Y 坐标
     *
     * @param imageHeight     图片高度
     * @param watermarkHeight 水印高度
     * @param margin          边距（像素）
     * @return Y 坐标
     */
    public int calculateY(int imageHeight, int watermarkHeight, int margin) {
        return switch (this) {
            case TOP_LEFT, TOP_CENTER, TOP_RIGHT -> margin;
            case MIDDLE_LEFT, MIDDLE_CENTER, MIDDLE_RIGHT -> (imageHeight - watermarkHeight) / 2;
            case BOTTOM_LEFT, BOTTOM_CENTER, BOTTOM_RIGHT -> imageHeight - watermarkHeight - margin;
        };
    }
}
