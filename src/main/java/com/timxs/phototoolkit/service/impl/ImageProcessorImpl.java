package com.timxs.phototoolkit.service.impl;

import com.timxs.phototoolkit.config.ImageTask;
import com.timxs.phototoolkit.config.WatermarkSpec;
import com.timxs.phototoolkit.model.ImageFormat;
import com.timxs.phototoolkit.model.ProcessingResult;
import com.timxs.phototoolkit.service.ImageProcessor;
import com.timxs.phototoolkit.service.WatermarkService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 图片处理器实现
 * 处理顺序：饱和度 -> 边框 -> 水印（按配置顺序）-> 按输出扩展名编码
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ImageProcessorImpl implements ImageProcessor {

    /**
     * 水印服务，用于叠加图片水印
     */
    private final WatermarkService watermarkService;

    /**
     * 处理图片并写入输出文件
     *
     * @param task 处理参数
     * @return 处理结果
     */
    @Override
    public ProcessingResult process(ImageTask task) {
        Path input = task.inputPath();
        Path output = task.outputPath();
        try {
            if (!Files.exists(input)) {
                return ProcessingResult.failed(input, output, "Input file not found: " + input);
            }
            if (!ImageFormat.isSupported(input)) {
                return ProcessingResult.failed(input, output,
                    "Unsupported image format: " + ImageFormat.extensionOf(input));
            }
            ImageFormat outputFormat = ImageFormat.fromPath(output);
            if (outputFormat == null) {
                return ProcessingResult.failed(input, output,
                    "Unsupported image format: " + ImageFormat.extensionOf(output));
            }

            // 确保输出目录存在
            Path outputDir = output.toAbsolutePath().getParent();
            if (outputDir != null) {
                Files.createDirectories(outputDir);
            }

            BufferedImage image = render(task);
            try (OutputStream out = Files.newOutputStream(output)) {
                writeImage(image, outputFormat, out);
            }
            log.debug("图片处理完成: {} -> {}", input.getFileName(), output);
            return ProcessingResult.success(input, output);

        } catch (FileNotFoundException | UnreadableImageException e) {
            return ProcessingResult.failed(input, output, e.getMessage());
        } catch (AccessDeniedException e) {
            return ProcessingResult.failed(input, output, "Permission denied: " + e.getMessage());
        } catch (IllegalArgumentException e) {
            return ProcessingResult.failed(input, output, e.getMessage());
        } catch (IOException e) {
            log.warn("图片处理IO错误: {} - {}", input, e.getMessage());
            return ProcessingResult.failed(input, output, "Image I/O error: " + e.getMessage());
        } catch (Throwable t) {
            // 捕获所有异常包括 Error（如 OutOfMemoryError），保证不越过处理边界
            log.error("图片处理发生严重错误: {}", t.getMessage(), t);
            return ProcessingResult.failed(input, output,
                "Unexpected error: " + t.getClass().getSimpleName() + ": " + t.getMessage());
        }
    }

    /**
     * 生成预览
     * 在弹性线程池中执行，避免阻塞调用线程
     *
     * @param task    处理参数
     * @param maxSize 预览图最大边长
     * @return PNG 数据（异步）
     */
    @Override
    public Mono<byte[]> preview(ImageTask task, int maxSize) {
        return Mono.fromCallable(() -> {
                Path input = task.inputPath();
                if (!Files.exists(input)) {
                    throw new FileNotFoundException("File not found: " + input);
                }
                if (!ImageFormat.isSupported(input)) {
                    throw new IllegalArgumentException("Unsupported format: " + ImageFormat.extensionOf(input));
                }
                BufferedImage image = scaleToFit(render(task), maxSize);
                ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
                writeImage(image, ImageFormat.PNG, outputStream);
                return outputStream.toByteArray();
            })
            .subscribeOn(Schedulers.boundedElastic())
            .doOnError(e -> log.warn("预览生成失败: {} - {}", task.inputPath(), e.getMessage()));
    }

    /**
     * 读取图片并依次应用饱和度、边框和水印
     */
    private BufferedImage render(ImageTask task) throws IOException {
        BufferedImage image = ImageIO.read(task.inputPath().toFile());
        if (image == null) {
            throw new UnreadableImageException(task.inputPath());
        }

        if (task.saturation() != 100) {
            image = adjustSaturation(image, task.saturation());
        }

        // 先加边框，水印叠加在边框之上
        if (task.borderThickness() > 0) {
            image = addBorder(image, task.borderThickness(), task.borderColor());
        }

        for (WatermarkSpec watermark : task.watermarks()) {
            image = watermarkService.applyWatermark(image, watermark);
        }
        return image;
    }

    /**
     * 调整饱和度
     * 在 HSB 空间中按比例缩放 S 分量，0 为灰度，100 不变，200 为双倍饱和度
     *
     * @param src        原图
     * @param saturation 饱和度 0-200
     * @return 调整后的图片
     */
    BufferedImage adjustSaturation(BufferedImage src, int saturation) {
        if (saturation < 0 || saturation > 200) {
            throw new IllegalArgumentException("Saturation must be between 0 and 200, got " + saturation);
        }
        float factor = saturation / 100.0f;
        int width = src.getWidth();
        int height = src.getHeight();
        BufferedImage result = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        float[] hsb = new float[3];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int argb = src.getRGB(x, y);
                int alpha = argb >>> 24;
                Color.RGBtoHSB((argb >> 16) & 0xFF, (argb >> 8) & 0xFF, argb & 0xFF, hsb);
                float s = Math.min(1.0f, hsb[1] * factor);
                int rgb = Color.HSBtoRGB(hsb[0], s, hsb[2]) & 0x00FFFFFF;
                result.setRGB(x, y, (alpha << 24) | rgb);
            }
        }
        return result;
    }

    /**
     * 添加纯色边框
     * 画布四周各扩展 thickness 像素
     *
     * @param src       原图
     * @param thickness 边框宽度（像素）
     * @param color     边框颜色（十六进制）
     * @return 带边框的图片
     */
    BufferedImage addBorder(BufferedImage src, int thickness, String color) {
        if (thickness <= 0) {
            throw new IllegalArgumentException("Border thickness must be positive, got " + thickness);
        }
        int width = src.getWidth() + thickness * 2;
        int height = src.getHeight() + thickness * 2;
        BufferedImage result = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = result.createGraphics();
        try {
            g.setColor(parseColor(color));
            g.fillRect(0, 0, width, height);
            g.drawImage(src, thickness, thickness, null);
        } finally {
            g.dispose();
        }
        return result;
    }

    /**
     * 按比例缩小到不超过 maxSize，小图保持原样
     */
    private BufferedImage scaleToFit(BufferedImage src, int maxSize) {
        if (maxSize <= 0 || (src.getWidth() <= maxSize && src.getHeight() <= maxSize)) {
            return src;
        }
        double ratio = Math.min((double) maxSize / src.getWidth(), (double) maxSize / src.getHeight());
        int width = Math.max(1, (int) (src.getWidth() * ratio));
        int height = Math.max(1, (int) (src.getHeight() * ratio));
        BufferedImage result = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = result.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.drawImage(src, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return result;
    }

    /**
     * 按格式编码图片
     * JPEG、BMP 不支持 Alpha 通道，需要先转换为 RGB
     */
    private void writeImage(BufferedImage image, ImageFormat format, OutputStream out) throws IOException {
        BufferedImage imageToWrite = image;
        if (!format.isAlphaSupported() && image.getColorModel().hasAlpha()) {
            imageToWrite = convertToRGB(image);
        }
        boolean success = ImageIO.write(imageToWrite, format.getFormatName(), out);
        if (!success) {
            throw new IOException("No image writer available for format: " + format.getFormatName());
        }
    }

    /**
     * 将带 Alpha 通道的图片转换为 RGB
     * 透明区域填充为白色
     *
     * @param src 源图片
     * @return RGB 格式的图片
     */
    private BufferedImage convertToRGB(BufferedImage src) {
        BufferedImage rgb = new BufferedImage(src.getWidth(), src.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, src.getWidth(), src.getHeight());
            g.drawImage(src, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }

    /**
     * 解析颜色字符串
     * 支持十六进制格式（#RGB、#RRGGBB，# 可省略）
     *
     * @param colorStr 颜色字符串
     * @return Color 对象
     * @throws IllegalArgumentException 格式无效
     */
    private Color parseColor(String colorStr) {
        if (colorStr == null || colorStr.isBlank()) {
            return Color.WHITE;
        }
        String hex = colorStr.startsWith("#") ? colorStr.substring(1) : colorStr;
        if (hex.length() == 3) {
            hex = "" + hex.charAt(0) + hex.charAt(0) + hex.charAt(1) + hex.charAt(1) + hex.charAt(2) + hex.charAt(2);
        }
        try {
            if (hex.length() != 6) {
                throw new NumberFormatException(hex);
            }
            return new Color(Integer.parseInt(hex, 16));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid border color: " + colorStr);
        }
    }

    /**
     * 图片无法解码（内容损坏或没有可用的读取器）
     */
    static class UnreadableImageException extends IOException {
        UnreadableImageException(Path path) {
            super("Unable to read image: " + path);
        }
    }
}
