package com.timxs.phototoolkit.service;

import com.timxs.phototoolkit.config.ImageTask;
import com.timxs.phototoolkit.model.ProcessingResult;
import reactor.core.publisher.Mono;

/**
 * 图片处理器接口
 * 对单张图片执行饱和度调整、边框和水印叠加，无共享可变状态，可在任意工作线程中调用
 */
public interface ImageProcessor {

    /**
     * 处理图片并写入输出文件
     * 自动创建缺失的输出目录，所有失败都以失败结果返回，不会抛出异常
     *
     * @param task 处理参数
     * @return 处理结果
     */
    ProcessingResult process(ImageTask task);

    /**
     * 生成处理效果预览
     * 结果按比例缩小到不超过 maxSize，编码为 PNG
     *
     * @param task    处理参数（输出路径被忽略）
     * @param maxSize 预览图最大边长
     * @return PNG 数据（异步）
     */
    Mono<byte[]> preview(ImageTask task, int maxSize);
}
