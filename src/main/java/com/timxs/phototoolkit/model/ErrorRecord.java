package com.timxs.phototoolkit.model;

/**
 * 错误记录
 *
 * @param file  出错的文件名，批处理级错误为 {@link #BATCH}
 * @param error 错误信息
 */
public record ErrorRecord(String file, String error) {

    /**
     * 批处理级错误的文件标识
     */
    public static final String BATCH = "BATCH";

    /**
     * 配置校验失败的文件标识
     */
    public static final String CONFIG = "CONFIG";
}
