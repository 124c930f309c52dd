package com.timxs.phototoolkit.model;

import java.util.List;

/**
 * 批处理进度快照（不可变）
 * 由进度聚合器生成，可安全地交给回调或其他线程读取
 *
 * @param totalFiles     待处理文件总数
 * @param processedCount 已处理数量（成功 + 失败 + 跳过）
 * @param successCount   成功数量
 * @param errorCount     失败数量
 * @param skippedCount   跳过数量
 * @param currentFile    当前处理的文件名，并行模式下为线程池概要
 * @param errors         错误记录（按追加顺序）
 * @param state          运行状态
 */
public record ProgressSnapshot(
    int totalFiles,
    int processedCount,
    int successCount,
    int errorCount,
    int skippedCount,
    String currentFile,
    List<ErrorRecord> errors,
    ProcessingState state
) {
    public ProgressSnapshot {
        errors = errors == null ? List.of() : List.copyOf(errors);
        currentFile = currentFile == null ? "" : currentFile;
    }

    /**
     * 初始空闲状态
     */
    public static ProgressSnapshot idle() {
        return new ProgressSnapshot(0, 0, 0, 0, 0, "", List.of(), ProcessingState.IDLE);
    }

    /**
     * 配置校验失败时返回的结果
     */
    public static ProgressSnapshot configError(String message) {
        return new ProgressSnapshot(0, 0, 0, 0, 0, "",
            List.of(new ErrorRecord(ErrorRecord.CONFIG, message)), ProcessingState.ERROR);
    }

    /**
     * 进度百分比（0-100），总数为 0 时返回 0
     */
    public double progressPercent() {
        if (totalFiles == 0) {
            return 0.0;
        }
        return processedCount * 100.0 / totalFiles;
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }
}
