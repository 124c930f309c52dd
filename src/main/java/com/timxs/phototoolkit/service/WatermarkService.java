package com.timxs.phototoolkit.service;

import com.timxs.phototoolkit.config.WatermarkSpec;

import java.awt.image.BufferedImage;
import java.io.IOException;

/**
 * 水印服务接口
 */
public interface WatermarkService {

    /**
     * 加载水印图片并叠加到原图上
     *
     * @param image 原始图片
     * @param spec  水印配置
     * @return 添加水印后的图片
     * @throws IOException 水印文件不存在或无法读取
     */
    BufferedImage applyWatermark(BufferedImage image, WatermarkSpec spec) throws IOException;

    /**
     * 添加图片水印
     *
     * @param image          原始图片
     * @param spec           水印配置
     * @param watermarkImage 水印图片
     * @return 添加水印后的图片
     */
    BufferedImage addImageWatermark(BufferedImage image, WatermarkSpec spec, BufferedImage watermarkImage);
}
