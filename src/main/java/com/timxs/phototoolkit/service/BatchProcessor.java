package com.timxs.phototoolkit.service;

import com.timxs.phototoolkit.config.ConfigValidationException;
import com.timxs.phototoolkit.config.ProcessingConfig;
import com.timxs.phototoolkit.model.ProgressSnapshot;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.time.Duration;

/**
 * 批处理服务接口
 * 在后台线程中处理整个目录，调用方不会因 start 阻塞
 */
public interface BatchProcessor {

    /**
     * 校验配置并在后台开始处理，立即返回
     *
     * @param config 批处理配置
     * @throws ConfigValidationException 配置无效
     * @throws IllegalStateException     已有运行中的批处理
     */
    void start(ProcessingConfig config);

    /**
     * 请求取消当前处理，幂等，立即返回
     */
    void cancel();

    /**
     * 获取当前进度快照
     *
     * @return 进度快照
     */
    ProgressSnapshot getProgress();

    /**
     * 是否有批处理正在运行
     */
    boolean isRunning();

    /**
     * 等待当前批处理的后台线程结束
     *
     * @param timeout 最长等待时间
     * @return 是否已结束
     */
    boolean awaitCompletion(Duration timeout);

    /**
     * 当前（或最近一次）批处理的最终快照
     * 尚未运行过时立即发出当前快照
     *
     * @return 最终进度快照（异步）
     */
    Mono<ProgressSnapshot> completion();

    /**
     * 设置进度观察者
     *
     * @param listener 观察者，传 null 表示移除
     */
    void setProgressListener(ProgressListener listener);

    /**
     * 同步处理整个目录
     * 配置无效时返回 error 状态的快照，包含一条 CONFIG 记录
     *
     * @param config 批处理配置
     * @return 最终进度快照
     */
    ProgressSnapshot processFolder(ProcessingConfig config);

    /**
     * 按当前配置生成单张图片的处理效果预览，不写入任何文件
     * 与批处理互不影响，运行中也可以调用
     *
     * @param config    批处理配置（只使用图片处理相关的设置）
     * @param imagePath 要预览的图片
     * @return PNG 数据（异步），长边不超过引擎参数中的预览尺寸
     */
    Mono<byte[]> preview(ProcessingConfig config, Path imagePath);
}
