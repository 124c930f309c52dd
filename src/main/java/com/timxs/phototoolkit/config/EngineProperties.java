package com.timxs.phototoolkit.config;

import lombok.Data;

import java.nio.file.Path;
import java.time.Duration;

/**
 * 引擎运行参数
 * 与单次批处理无关的全局设置
 */
@Data
public class EngineProperties {

    /**
     * 等待任务完成的轮询间隔，也是取消响应延迟的上限
     */
    private Duration pollInterval = Duration.ofSeconds(1);

    /**
     * 自动计算或手动指定的工作线程数上限
     */
    private int maxWorkerCeiling = 12;

    /**
     * 滑动窗口系数，同时在途的任务数不超过 工作线程数 × 该系数
     */
    private int windowFactor = 2;

    /**
     * 预览图最大边长（像素）
     */
    private int previewMaxSize = 800;

    /**
     * 设置文件路径
     */
    private Path settingsFile = Path.of(System.getProperty("user.home"), ".photo-batch-toolkit", "settings.json");
}
