package com.timxs.phototoolkit.config;

import java.util.List;

/**
 * 配置校验失败
 * 消息为所有错误以 "; " 连接，完整列表通过 {@link #getErrors()} 获取
 */
public class ConfigValidationException extends IllegalArgumentException {

    private final List<String> errors;

    public ConfigValidationException(List<String> errors) {
        super(String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
