package com.timxs.phototoolkit.service.impl;

import com.timxs.phototoolkit.config.WatermarkSpec;
import com.timxs.phototoolkit.service.WatermarkService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.awt.*;
import java.awt.image.BufferedImage;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 水印服务实现
 * 使用 Java 2D Graphics API 将水印图片按透明度合成到原图上
 */
@Slf4j
@Service
public class WatermarkServiceImpl implements WatermarkService {

    /**
     * 加载水印图片并叠加
     * 未配置路径时直接返回原图
     *
     * @param image 原始图片
     * @param spec  水印配置
     * @return 添加水印后的图片
     * @throws FileNotFoundException 水印文件不存在
     * @throws IOException           水印文件无法解码
     */
    @Override
    public BufferedImage applyWatermark(BufferedImage image, WatermarkSpec spec) throws IOException {
        if (spec == null || !spec.hasPath()) {
            return image;
        }
        BufferedImage watermarkImage = loadWatermarkImage(spec.path());
        log.debug("水印图片加载成功: {} ({}x{})", spec.path(), watermarkImage.getWidth(), watermarkImage.getHeight());
        return addImageWatermark(image, spec, watermarkImage);
    }

    /**
     * 添加图片水印
     * 水印长边缩放到原图短边 × scale%，保持宽高比
     *
     * @param image          原始图片
     * @param spec           水印配置
     * @param watermarkImage 水印图片
     * @return 添加水印后的图片
     * @throws IllegalArgumentException 原始图片为空时抛出
     */
    @Override
    public BufferedImage addImageWatermark(BufferedImage image, WatermarkSpec spec, BufferedImage watermarkImage) {
        if (image == null) {
            throw new IllegalArgumentException("Image cannot be null");
        }
        // 水印图片为空时，直接返回原图
        if (watermarkImage == null) {
            log.warn("Watermark image is null, returning original image");
            return image;
        }

        int[] size = spec.calculateSize(image.getWidth(), image.getHeight(),
            watermarkImage.getWidth(), watermarkImage.getHeight());
        int scaledWidth = size[0];
        int scaledHeight = size[1];

        // 缩放后尺寸无效时，直接返回原图
        if (scaledWidth <= 0 || scaledHeight <= 0) {
            log.warn("Scaled watermark size is invalid ({}x{}), returning original image", scaledWidth, scaledHeight);
            return image;
        }

        // 创建带 alpha 通道的新图片
        BufferedImage result = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_ARGB);

        Graphics2D g2d = result.createGraphics();
        try {
            g2d.drawImage(image, 0, 0, null);

            g2d.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);

            g2d.setComposite(AlphaComposite.getInstance(AlphaComposite.SRC_OVER, (float) spec.opacity()));

            // 计算位置（使用枚举方法 + 边界检查）
            int x = Math.max(0, spec.position().calculateX(image.getWidth(), scaledWidth, spec.margin()));
            int y = Math.max(0, spec.position().calculateY(image.getHeight(), scaledHeight, spec.margin()));

            g2d.drawImage(watermarkImage, x, y, scaledWidth, scaledHeight, null);

            log.debug("Added image watermark at position ({}, {}) with size {}x{}",
                x, y, scaledWidth, scaledHeight);
        } finally {
            g2d.dispose();
        }

        return result;
    }

    /**
     * 从本地文件加载水印图片
     *
     * @param path 水印文件路径
     * @return 水印图片
     */
    private BufferedImage loadWatermarkImage(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new FileNotFoundException("Watermark file not found: " + path);
        }
        BufferedImage img = ImageIO.read(path.toFile());
        if (img == null) {
            throw new IOException("Unable to read watermark image: " + path);
        }
        return img;
    }
}
