package com.timxs.phototoolkit.service;

import com.timxs.phototoolkit.config.EngineProperties;
import com.timxs.phototoolkit.config.ProcessingConfig;
import reactor.core.publisher.Mono;

/**
 * 配置管理器接口
 * 从 JSON 设置文件中读取配置
 */
public interface SettingsManager {

    /**
     * 获取保存的批处理配置
     * 文件不存在或格式错误时返回默认配置
     *
     * @return 处理配置对象
     */
    Mono<ProcessingConfig> getConfig();

    /**
     * 获取引擎运行参数
     *
     * @return 引擎参数
     */
    Mono<EngineProperties> getEngineProperties();
}
