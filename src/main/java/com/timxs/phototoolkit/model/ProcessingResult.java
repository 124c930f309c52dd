package com.timxs.phototoolkit.model;

import java.nio.file.Path;

/**
 * 单张图片处理结果
 *
 * @param success    是否成功
 * @param inputPath  输入文件
 * @param outputPath 输出文件
 * @param error      错误信息（成功时为 null）
 */
public record ProcessingResult(
    boolean success,
    Path inputPath,
    Path outputPath,
    String error
) {
    /**
     * 创建成功结果
     */
    public static ProcessingResult success(Path inputPath, Path outputPath) {
        return new ProcessingResult(true, inputPath, outputPath, null);
    }

    /**
     * 创建失败结果
     */
    public static ProcessingResult failed(Path inputPath, Path outputPath, String error) {
        return new ProcessingResult(false, inputPath, outputPath, error);
    }

    /**
     * 处理函数没有返回结果时按失败记录
     */
    public static ProcessingResult noResult(Path inputPath, Path outputPath) {
        return failed(inputPath, outputPath, "Worker error: no result");
    }
}
