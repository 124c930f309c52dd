package com.timxs.phototoolkit.model;

import java.nio.file.Path;

/**
 * 一个待处理的（输入，输出）文件对
 *
 * @param inputPath   输入文件
 * @param outputPath  根据命名规则计算出的输出文件
 * @param displayName 显示名称（输入文件名）
 */
public record WorkItem(Path inputPath, Path outputPath, String displayName) {
}
