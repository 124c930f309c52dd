package com.timxs.phototoolkit.service.impl;

import com.timxs.phototoolkit.model.ErrorRecord;
import com.timxs.phototoolkit.model.ProcessingResult;
import com.timxs.phototoolkit.model.ProcessingState;
import com.timxs.phototoolkit.model.ProgressSnapshot;
import com.timxs.phototoolkit.model.WorkItem;
import com.timxs.phototoolkit.service.ProgressListener;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 进度聚合器
 * 进度记录只由一个专属线程修改，其他组件通过提交消息与之交互，
 * 每条消息返回应用后的快照。消息按提交顺序执行，修改后立即通知观察者。
 */
@Slf4j
public class ProgressAggregator implements AutoCloseable {

    private final ExecutorService mailbox;

    private volatile Thread owner;

    private volatile ProgressListener listener = ProgressListener.NOOP;

    // 以下字段只在 owner 线程中读写
    private int totalFiles;
    private int processedCount;
    private int successCount;
    private int errorCount;
    private int skippedCount;
    private String currentFile = "";
    private final List<ErrorRecord> errors = new ArrayList<>();
    private ProcessingState state = ProcessingState.IDLE;

    public ProgressAggregator() {
        this.mailbox = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "progress-aggregator");
            thread.setDaemon(true);
            owner = thread;
            return thread;
        });
    }

    public void setListener(ProgressListener listener) {
        this.listener = listener == null ? ProgressListener.NOOP : listener;
    }

    /**
     * 清零所有计数并进入 running 状态，每次运行开始时调用一次
     */
    public CompletableFuture<ProgressSnapshot> reset() {
        return send(() -> {
            totalFiles = 0;
            processedCount = 0;
            successCount = 0;
            errorCount = 0;
            skippedCount = 0;
            currentFile = "";
            errors.clear();
            state = ProcessingState.RUNNING;
            return true;
        });
    }

    /**
     * 设置待处理文件总数
     */
    public CompletableFuture<ProgressSnapshot> begin(int total) {
        return send(() -> {
            if (state != ProcessingState.RUNNING) {
                return false;
            }
            totalFiles = total;
            return true;
        });
    }

    /**
     * 更新当前处理项的显示标签
     */
    public CompletableFuture<ProgressSnapshot> setCurrentFile(String label) {
        return send(() -> {
            if (state != ProcessingState.RUNNING) {
                return false;
            }
            currentFile = label == null ? "" : label;
            return true;
        });
    }

    /**
     * 记录一个跳过的工作项
     */
    public CompletableFuture<ProgressSnapshot> recordSkip(WorkItem item, String reason) {
        return send(() -> {
            if (state != ProcessingState.RUNNING) {
                return false;
            }
            processedCount++;
            skippedCount++;
            errors.add(new ErrorRecord(item.displayName(), reason));
            return true;
        });
    }

    /**
     * 合并一个工作项的处理结果
     */
    public CompletableFuture<ProgressSnapshot> recordResult(WorkItem item, ProcessingResult result) {
        ProcessingResult merged = result != null
            ? result
            : ProcessingResult.noResult(item.inputPath(), item.outputPath());
        return send(() -> {
            if (state != ProcessingState.RUNNING) {
                return false;
            }
            processedCount++;
            if (merged.success()) {
                successCount++;
            } else {
                errorCount++;
                errors.add(new ErrorRecord(item.displayName(), merged.error()));
            }
            return true;
        });
    }

    /**
     * 进入终态（completed / cancelled），已处于终态时忽略
     */
    public CompletableFuture<ProgressSnapshot> finish(ProcessingState terminal) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal state: " + terminal);
        }
        return send(() -> {
            if (state != ProcessingState.RUNNING) {
                return false;
            }
            state = terminal;
            currentFile = "";
            return true;
        });
    }

    /**
     * 批处理级错误：追加一条 BATCH 记录并进入 error 状态，已累计的结果保留
     */
    public CompletableFuture<ProgressSnapshot> fail(Throwable cause) {
        String message = "Fatal error: " + cause.getClass().getSimpleName() + ": " + cause.getMessage();
        return send(() -> {
            if (state != ProcessingState.RUNNING) {
                return false;
            }
            errors.add(new ErrorRecord(ErrorRecord.BATCH, message));
            state = ProcessingState.ERROR;
            currentFile = "";
            return true;
        });
    }

    /**
     * 获取当前进度快照
     * 在聚合器线程内（如观察者回调中）调用时直接返回
     */
    public CompletableFuture<ProgressSnapshot> snapshot() {
        if (Thread.currentThread() == owner) {
            return CompletableFuture.completedFuture(toSnapshot());
        }
        return CompletableFuture.supplyAsync(this::toSnapshot, mailbox);
    }

    @Override
    public void close() {
        mailbox.shutdown();
    }

    /**
     * 提交一条修改消息
     * mutation 返回 true 表示状态已变化，此时通知观察者；进入终态时额外触发完成回调
     */
    private CompletableFuture<ProgressSnapshot> send(Mutation mutation) {
        if (Thread.currentThread() == owner) {
            return CompletableFuture.completedFuture(apply(mutation));
        }
        return CompletableFuture.supplyAsync(() -> apply(mutation), mailbox)
            .whenComplete((snapshot, e) -> {
                if (e != null) {
                    log.warn("进度消息处理失败: {}", e.getMessage(), e);
                }
            });
    }

    private ProgressSnapshot apply(Mutation mutation) {
        boolean wasTerminal = state.isTerminal();
        boolean changed = mutation.apply();
        ProgressSnapshot snapshot = toSnapshot();
        if (changed) {
            notifyProgress(snapshot);
            if (!wasTerminal && state.isTerminal()) {
                notifyComplete(snapshot);
            }
        }
        return snapshot;
    }

    private ProgressSnapshot toSnapshot() {
        return new ProgressSnapshot(totalFiles, processedCount, successCount, errorCount, skippedCount,
            currentFile, errors, state);
    }

    private void notifyProgress(ProgressSnapshot snapshot) {
        try {
            listener.onProgress(snapshot);
        } catch (Exception e) {
            // 观察者异常不能影响处理
            log.warn("进度回调执行失败: {}", e.getMessage(), e);
        }
    }

    private void notifyComplete(ProgressSnapshot snapshot) {
        try {
            listener.onComplete(snapshot);
        } catch (Exception e) {
            log.warn("完成回调执行失败: {}", e.getMessage(), e);
        }
    }

    @FunctionalInterface
    private interface Mutation {
        boolean apply();
    }
}
