package com.timxs.phototoolkit.model;

import java.nio.file.Path;
import java.util.Locale;

/**
 * 图片格式枚举
 * 定义支持的输入/输出格式及其扩展名和 ImageIO 格式名称
 */
public enum ImageFormat {

    /**
     * JPEG（不支持 Alpha 通道）
     */
    JPEG("jpg", false, "jpg", "jpeg"),

    /**
     * PNG
     */
    PNG("png", true, "png"),

    /**
     * GIF
     */
    GIF("gif", true, "gif"),

    /**
     * BMP（不支持 Alpha 通道）
     */
    BMP("bmp", false, "bmp"),

    /**
     * TIFF
     */
    TIFF("tiff", true, "tiff", "tif"),

    /**
     * WebP，需要 webp-imageio 的 SPI
     */
    WEBP("webp", true, "webp");

    /**
     * ImageIO 写入时使用的格式名称
     */
    private final String formatName;

    /**
     * 是否支持 Alpha 通道
     */
    private final boolean alphaSupported;

    /**
     * 文件扩展名（不含点号，小写）
     */
    private final String[] extensions;

    ImageFormat(String formatName, boolean alphaSupported, String... extensions) {
        this.formatName = formatName;
        this.alphaSupported = alphaSupported;
        this.extensions = extensions;
    }

    public String getFormatName() {
        return formatName;
    }

    public boolean isAlphaSupported() {
        return alphaSupported;
    }

    /**
     * 根据文件扩展名获取对应的格式
     *
     * @param extension 扩展名（可带点号，不区分大小写）
     * @return 对应的格式，不支持时返回 null
     */
    public static ImageFormat fromExtension(String extension) {
        if (extension == null) {
            return null;
        }
        String ext = extension.toLowerCase(Locale.ROOT).replace(".", "");
        for (ImageFormat format : values()) {
            for (String candidate : format.extensions) {
                if (candidate.equals(ext)) {
                    return format;
                }
            }
        }
        return null;
    }

    /**
     * 根据文件路径获取对应的格式
     *
     * @param path 文件路径
     * @return 对应的格式，不支持时返回 null
     */
    public static ImageFormat fromPath(Path path) {
        return fromExtension(extensionOf(path));
    }

    /**
     * 是否为支持的图片文件
     */
    public static boolean isSupported(Path path) {
        return fromPath(path) != null;
    }

    /**
     * 提取文件扩展名（含点号），没有扩展名时返回空字符串
     */
    public static String extensionOf(Path path) {
        if (path == null || path.getFileName() == null) {
            return "";
        }
        String name = path.getFileName().toString();
        int lastDotIndex = name.lastIndexOf('.');
        return lastDotIndex > 0 ? name.substring(lastDotIndex) : "";
    }
}
