package com.timxs.phototoolkit.service.impl;

import com.timxs.phototoolkit.config.EngineProperties;
import com.timxs.phototoolkit.config.ImageTask;
import com.timxs.phototoolkit.config.ProcessingConfig;
import com.timxs.phototoolkit.model.CancellationToken;
import com.timxs.phototoolkit.model.ProcessingResult;
import com.timxs.phototoolkit.model.ProcessingState;
import com.timxs.phototoolkit.model.ProgressSnapshot;
import com.timxs.phototoolkit.model.WorkItem;
import com.timxs.phototoolkit.service.ImageProcessor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 批处理调度器
 * 在调用线程中执行一次完整的批处理：创建输出目录、枚举、跳过分类，
 * 然后顺序执行或在有界线程池中以滑动窗口方式并行执行
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BatchDispatcher {

    private final ImageProcessor imageProcessor;

    private final WorkItemScanner workItemScanner;

    private final EngineProperties properties;

    /**
     * 执行一次批处理，返回时聚合器已处于终态
     *
     * @param config     批处理配置（已校验）
     * @param token      取消令牌
     * @param aggregator 进度聚合器（已 reset）
     * @return 本次运行进入终态时的快照
     */
    public ProgressSnapshot run(ProcessingConfig config, CancellationToken token, ProgressAggregator aggregator) {
        try {
            Files.createDirectories(config.getOutputFolder());

            List<WorkItem> items = workItemScanner.enumerate(config);
            aggregator.begin(items.size());

            // 跳过分类在任何任务提交之前完成
            WorkItemScanner.Classification classification =
                workItemScanner.classify(items, config.isOverwriteExisting());
            for (WorkItem skipped : classification.skipped()) {
                aggregator.recordSkip(skipped, WorkItemScanner.SKIP_REASON_EXISTS);
            }
            if (!classification.skipped().isEmpty()) {
                log.info("跳过 {} 个已存在的输出文件", classification.skipped().size());
            }

            List<WorkItem> eligible = classification.eligible();
            int workers = config.isParallelProcessing() ? effectiveWorkers(config.getMaxWorkers()) : 1;
            log.info("开始批处理: 共 {} 个文件，待处理 {} 个，工作线程 {}", items.size(), eligible.size(), workers);

            ProcessingState terminal = workers == 1
                ? runSequential(config, eligible, token, aggregator)
                : runParallel(config, eligible, workers, token, aggregator);
            ProgressSnapshot finalSnapshot = aggregator.finish(terminal).join();
            log.info("批处理结束: {}", terminal.getValue());
            return finalSnapshot;
        } catch (Exception e) {
            log.error("批处理发生致命错误: {}", e.getMessage(), e);
            return aggregator.fail(e).join();
        }
    }

    /**
     * 顺序处理，同一时刻最多一个任务在执行
     */
    private ProcessingState runSequential(ProcessingConfig config, List<WorkItem> eligible,
                                          CancellationToken token, ProgressAggregator aggregator) {
        for (WorkItem item : eligible) {
            if (token.isRequested()) {
                log.info("检测到取消请求，停止顺序处理");
                return ProcessingState.CANCELLED;
            }
            aggregator.setCurrentFile(item.displayName());
            aggregator.recordResult(item, invoke(item, config));
        }
        return ProcessingState.COMPLETED;
    }

    /**
     * 并行处理
     * 在途任务数不超过 min(工作线程数 × 窗口系数, 剩余任务数)，每完成一个补充一个，
     * 等待完成时按轮询间隔超时，超时后重新检查取消标志
     */
    private ProcessingState runParallel(ProcessingConfig config, List<WorkItem> eligible, int workers,
                                        CancellationToken token, ProgressAggregator aggregator) {
        Deque<WorkItem> queue = new ArrayDeque<>(eligible);
        Map<Future<ProcessingResult>, WorkItem> inFlight = new HashMap<>();
        int window = Math.min(workers * Math.max(1, properties.getWindowFactor()), queue.size());
        long pollMillis = Math.max(1, properties.getPollInterval().toMillis());

        ExecutorService pool = Executors.newFixedThreadPool(workers, workerThreadFactory());
        CompletionService<ProcessingResult> completionService = newCompletionService(pool);
        try {
            aggregator.setCurrentFile("Processing with " + workers + " workers...");

            while (inFlight.size() < window && !queue.isEmpty() && !token.isRequested()) {
                submit(completionService, inFlight, queue.poll(), config);
            }

            while (!inFlight.isEmpty()) {
                if (token.isRequested()) {
                    return cancelInFlight(inFlight);
                }
                Future<ProcessingResult> done;
                try {
                    done = completionService.poll(pollMillis, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("等待任务完成时被中断，按取消处理");
                    return cancelInFlight(inFlight);
                }
                if (done == null) {
                    continue;
                }
                WorkItem item = inFlight.remove(done);
                aggregator.recordResult(item, resultOf(done, item));

                if (!queue.isEmpty() && !token.isRequested()) {
                    submit(completionService, inFlight, queue.poll(), config);
                }
            }
            return queue.isEmpty() ? ProcessingState.COMPLETED : ProcessingState.CANCELLED;
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * 计算实际工作线程数
     */
    public int effectiveWorkers(int maxWorkers) {
        return effectiveWorkers(maxWorkers, Runtime.getRuntime().availableProcessors(),
            properties.getMaxWorkerCeiling());
    }

    /**
     * 计算实际工作线程数
     * maxWorkers 为 0 时：≤2 核用 1 个，≤4 核用 核数-1，否则 min(核数-2, 上限)；
     * 手动指定时不超过上限
     *
     * @param maxWorkers 配置的最大工作线程数
     * @param cores      CPU 核数
     * @param ceiling    上限
     * @return 实际工作线程数（至少为 1）
     */
    static int effectiveWorkers(int maxWorkers, int cores, int ceiling) {
        int cap = Math.max(1, ceiling);
        if (maxWorkers > 0) {
            return Math.min(maxWorkers, cap);
        }
        if (cores <= 2) {
            return 1;
        }
        if (cores <= 4) {
            return cores - 1;
        }
        return Math.max(1, Math.min(cores - 2, cap));
    }

    /**
     * 创建并行路径使用的完成队列
     */
    CompletionService<ProcessingResult> newCompletionService(ExecutorService pool) {
        return new ExecutorCompletionService<>(pool);
    }

    private void submit(CompletionService<ProcessingResult> completionService,
                        Map<Future<ProcessingResult>, WorkItem> inFlight,
                        WorkItem item, ProcessingConfig config) {
        ImageTask task = ImageTask.from(item, config);
        Future<ProcessingResult> future = completionService.submit(() -> imageProcessor.process(task));
        inFlight.put(future, item);
    }

    /**
     * 取消所有在途任务，不等待其结束
     */
    private ProcessingState cancelInFlight(Map<Future<ProcessingResult>, WorkItem> inFlight) {
        log.info("检测到取消请求，放弃 {} 个在途任务", inFlight.size());
        inFlight.keySet().forEach(future -> future.cancel(true));
        inFlight.clear();
        return ProcessingState.CANCELLED;
    }

    /**
     * 在当前线程中执行一个工作项，执行框架级异常转换为该项的失败结果
     */
    private ProcessingResult invoke(WorkItem item, ProcessingConfig config) {
        try {
            ProcessingResult result = imageProcessor.process(ImageTask.from(item, config));
            return result == null ? ProcessingResult.noResult(item.inputPath(), item.outputPath()) : result;
        } catch (RuntimeException e) {
            log.warn("处理 {} 时发生未预期异常: {}", item.displayName(), e.getMessage());
            return workerError(item, e);
        }
    }

    /**
     * 获取已完成任务的结果，执行框架级异常转换为该项的失败结果
     */
    private ProcessingResult resultOf(Future<ProcessingResult> done, WorkItem item) {
        try {
            ProcessingResult result = done.get();
            return result == null ? ProcessingResult.noResult(item.inputPath(), item.outputPath()) : result;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("处理 {} 时工作线程异常: {}", item.displayName(), cause.getMessage());
            return workerError(item, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return workerError(item, e);
        } catch (RuntimeException e) {
            return workerError(item, e);
        }
    }

    private ProcessingResult workerError(WorkItem item, Throwable cause) {
        return ProcessingResult.failed(item.inputPath(), item.outputPath(),
            "Worker error: " + cause.getClass().getSimpleName() + ": " + cause.getMessage());
    }

    private ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "batch-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
