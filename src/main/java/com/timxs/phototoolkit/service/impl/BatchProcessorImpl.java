package com.timxs.phototoolkit.service.impl;

import com.timxs.phototoolkit.config.ConfigValidationException;
import com.timxs.phototoolkit.config.EngineProperties;
import com.timxs.phototoolkit.config.ImageTask;
import com.timxs.phototoolkit.config.ProcessingConfig;
import com.timxs.phototoolkit.model.CancellationToken;
import com.timxs.phototoolkit.model.ProcessingState;
import com.timxs.phototoolkit.model.ProgressSnapshot;
import com.timxs.phototoolkit.service.BatchProcessor;
import com.timxs.phototoolkit.service.ImageProcessor;
import com.timxs.phototoolkit.service.ProgressListener;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * 批处理服务实现
 * 每次运行使用独立的后台线程和取消令牌，进度由 {@link ProgressAggregator} 独占维护
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BatchProcessorImpl implements BatchProcessor, DisposableBean {

    private final BatchDispatcher dispatcher;

    private final ImageProcessor imageProcessor;

    private final EngineProperties properties;

    private final ProgressAggregator aggregator = new ProgressAggregator();

    /**
     * 保证 校验 -> 运行检查 -> 重置 -> 启动 的原子性
     */
    private final Object startLock = new Object();

    private volatile CancellationToken currentToken = new CancellationToken();

    private volatile Thread processingThread;

    private volatile Sinks.One<ProgressSnapshot> completionSink;

    @Override
    public void setProgressListener(ProgressListener listener) {
        aggregator.setListener(listener);
    }

    @Override
    public void start(ProcessingConfig config) {
        launch(config);
    }

    /**
     * 启动一次运行并返回该次运行专属的完成信号
     */
    private Sinks.One<ProgressSnapshot> launch(ProcessingConfig config) {
        List<String> errors = config.validate();
        if (!errors.isEmpty()) {
            log.warn("配置校验失败: {}", errors);
            throw new ConfigValidationException(errors);
        }

        synchronized (startLock) {
            if (isRunning()) {
                throw new IllegalStateException("Processing is already running");
            }

            aggregator.reset().join();

            CancellationToken token = new CancellationToken();
            Sinks.One<ProgressSnapshot> sink = Sinks.one();
            currentToken = token;
            completionSink = sink;

            Thread thread = new Thread(() -> runBatch(config, token, sink), "batch-processor");
            thread.setDaemon(true);
            processingThread = thread;
            thread.start();
            log.info("批处理已启动: {} -> {}", config.getInputFolder(), config.getOutputFolder());
            return sink;
        }
    }

    /**
     * 后台线程入口
     * 只发出本次运行进入终态时的快照，之后不再读取聚合器状态
     */
    private void runBatch(ProcessingConfig config, CancellationToken token, Sinks.One<ProgressSnapshot> sink) {
        ProgressSnapshot finalSnapshot;
        try {
            finalSnapshot = dispatcher.run(config, token, aggregator);
        } catch (Throwable t) {
            // 调度器在进入终态前异常退出，此时聚合器仍属于本次运行
            log.error("批处理线程异常终止: {}", t.getMessage(), t);
            finalSnapshot = aggregator.fail(t).join();
        }
        sink.tryEmitValue(finalSnapshot);
    }

    @Override
    public void cancel() {
        if (currentToken.request()) {
            log.info("已请求取消批处理");
        }
    }

    @Override
    public ProgressSnapshot getProgress() {
        return aggregator.snapshot().join();
    }

    @Override
    public boolean isRunning() {
        return getProgress().state() == ProcessingState.RUNNING;
    }

    @Override
    public boolean awaitCompletion(Duration timeout) {
        Thread thread = processingThread;
        if (thread == null) {
            return true;
        }
        try {
            thread.join(Math.max(1, timeout.toMillis()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return !thread.isAlive();
    }

    @Override
    public Mono<ProgressSnapshot> completion() {
        Sinks.One<ProgressSnapshot> sink = completionSink;
        if (sink == null) {
            return Mono.fromSupplier(this::getProgress);
        }
        return sink.asMono();
    }

    @Override
    public ProgressSnapshot processFolder(ProcessingConfig config) {
        Sinks.One<ProgressSnapshot> sink;
        try {
            sink = launch(config);
        } catch (IllegalArgumentException | IllegalStateException e) {
            return ProgressSnapshot.configError(e.getMessage());
        }
        return sink.asMono().block();
    }

    @Override
    public Mono<byte[]> preview(ProcessingConfig config, Path imagePath) {
        return Mono.fromCallable(() -> ImageTask.from(imagePath, null, config))
            .flatMap(task -> imageProcessor.preview(task, properties.getPreviewMaxSize()));
    }

    @Override
    public void destroy() {
        cancel();
        aggregator.close();
    }
}
