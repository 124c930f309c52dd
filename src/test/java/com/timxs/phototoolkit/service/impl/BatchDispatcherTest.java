package com.timxs.phototoolkit.service.impl;

import com.timxs.phototoolkit.config.EngineProperties;
import com.timxs.phototoolkit.config.ImageTask;
import com.timxs.phototoolkit.config.ProcessingConfig;
import com.timxs.phototoolkit.model.CancellationToken;
import com.timxs.phototoolkit.model.ErrorRecord;
import com.timxs.phototoolkit.model.ProcessingResult;
import com.timxs.phototoolkit.model.ProcessingState;
import com.timxs.phototoolkit.model.ProgressSnapshot;
import com.timxs.phototoolkit.service.ImageProcessor;
import com.timxs.phototoolkit.service.ProgressListener;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BatchDispatcherTest {

    @Mock
    ImageProcessor imageProcessor;

    @TempDir
    Path tempDir;

    private final ProgressAggregator aggregator = new ProgressAggregator();

    private BatchDispatcher dispatcher;

    private Path input;

    private Path output;

    @BeforeEach
    void setUp() throws IOException {
        EngineProperties properties = new EngineProperties();
        properties.setPollInterval(Duration.ofMillis(20));
        dispatcher = new BatchDispatcher(imageProcessor, new WorkItemScanner(), properties);
        input = Files.createDirectory(tempDir.resolve("in"));
        output = tempDir.resolve("out");
        aggregator.reset();
    }

    @AfterEach
    void tearDown() {
        aggregator.close();
    }

    @Test
    void effectiveWorkersFollowCoreCount() {
        assertEquals(1, BatchDispatcher.effectiveWorkers(0, 1, 12));
        assertEquals(1, BatchDispatcher.effectiveWorkers(0, 2, 12));
        assertEquals(2, BatchDispatcher.effectiveWorkers(0, 3, 12));
        assertEquals(3, BatchDispatcher.effectiveWorkers(0, 4, 12));
        assertEquals(6, BatchDispatcher.effectiveWorkers(0, 8, 12));
        assertEquals(12, BatchDispatcher.effectiveWorkers(0, 32, 12));
    }

    @Test
    void explicitWorkersCappedAtCeiling() {
        assertEquals(3, BatchDispatcher.effectiveWorkers(3, 2, 12));
        assertEquals(12, BatchDispatcher.effectiveWorkers(50, 64, 12));
        assertEquals(4, BatchDispatcher.effectiveWorkers(8, 64, 4));
    }

    @Test
    void sequentialRunProcessesInNameOrder() throws IOException {
        createImages(3);
        List<String> order = new CopyOnWriteArrayList<>();
        when(imageProcessor.process(any())).thenAnswer(invocation -> {
            ImageTask task = invocation.getArgument(0);
            order.add(task.inputPath().getFileName().toString());
            return ProcessingResult.success(task.inputPath(), task.outputPath());
        });

        ProgressSnapshot returned = dispatcher.run(config().build(), new CancellationToken(), aggregator);

        ProgressSnapshot snapshot = aggregator.snapshot().join();
        assertEquals(snapshot, returned);
        assertEquals(ProcessingState.COMPLETED, snapshot.state());
        assertEquals(3, snapshot.successCount());
        assertEquals(List.of("img000.jpg", "img001.jpg", "img002.jpg"), order);
        assertEquals("", snapshot.currentFile());
        assertTrue(Files.isDirectory(output));
    }

    @Test
    void skipsAreRecordedBeforeAnyProcessing() throws IOException {
        createImages(3);
        Files.createDirectories(output);
        Files.write(output.resolve("img001.jpg"), new byte[] {0});
        AtomicInteger skippedWhenFirstProcessed = new AtomicInteger(-1);
        when(imageProcessor.process(any())).thenAnswer(invocation -> {
            skippedWhenFirstProcessed.compareAndSet(-1, aggregator.snapshot().join().skippedCount());
            ImageTask task = invocation.getArgument(0);
            return ProcessingResult.success(task.inputPath(), task.outputPath());
        });

        dispatcher.run(config().build(), new CancellationToken(), aggregator);

        ProgressSnapshot snapshot = aggregator.snapshot().join();
        assertEquals(1, skippedWhenFirstProcessed.get());
        assertEquals(3, snapshot.totalFiles());
        assertEquals(2, snapshot.successCount());
        assertEquals(1, snapshot.skippedCount());
        assertEquals(new ErrorRecord("img001.jpg", WorkItemScanner.SKIP_REASON_EXISTS), snapshot.errors().get(0));
        verify(imageProcessor, times(2)).process(any());
    }

    @Test
    void parallelRunNeverExceedsWorkerCount() throws IOException {
        createImages(20);
        AtomicInteger active = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        Set<String> threads = ConcurrentHashMap.newKeySet();
        when(imageProcessor.process(any())).thenAnswer(invocation -> {
            int now = active.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            threads.add(Thread.currentThread().getName());
            Thread.sleep(5);
            active.decrementAndGet();
            ImageTask task = invocation.getArgument(0);
            return ProcessingResult.success(task.inputPath(), task.outputPath());
        });
        List<String> labels = new CopyOnWriteArrayList<>();
        aggregator.setListener(new ProgressListener() {
            @Override
            public void onProgress(ProgressSnapshot snapshot) {
                labels.add(snapshot.currentFile());
            }
        });

        dispatcher.run(config().parallelProcessing(true).maxWorkers(2).build(), new CancellationToken(), aggregator);

        ProgressSnapshot snapshot = aggregator.snapshot().join();
        assertEquals(ProcessingState.COMPLETED, snapshot.state());
        assertEquals(20, snapshot.successCount());
        assertEquals(20, snapshot.processedCount());
        assertTrue(peak.get() <= 2, "peak concurrency " + peak.get());
        assertTrue(threads.stream().allMatch(name -> name.startsWith("batch-worker-")));
        assertTrue(labels.contains("Processing with 2 workers..."));
    }

    @Test
    void sequentialNullResultCountsAsFailure() throws IOException {
        createImages(2);
        when(imageProcessor.process(any())).thenReturn(null);

        dispatcher.run(config().build(), new CancellationToken(), aggregator);

        ProgressSnapshot snapshot = aggregator.snapshot().join();
        assertEquals(ProcessingState.COMPLETED, snapshot.state());
        assertEquals(2, snapshot.processedCount());
        assertEquals(2, snapshot.errorCount());
        assertEquals(snapshot.processedCount(),
            snapshot.successCount() + snapshot.errorCount() + snapshot.skippedCount());
        assertEquals(new ErrorRecord("img000.jpg", "Worker error: no result"), snapshot.errors().get(0));
    }

    @Test
    void parallelNullResultCountsAsFailure() throws IOException {
        createImages(3);
        when(imageProcessor.process(any())).thenReturn(null);

        dispatcher.run(config().parallelProcessing(true).maxWorkers(2).build(), new CancellationToken(), aggregator);

        ProgressSnapshot snapshot = aggregator.snapshot().join();
        assertEquals(3, snapshot.processedCount());
        assertEquals(3, snapshot.errorCount());
        assertTrue(snapshot.errors().stream().allMatch(record -> record.error().equals("Worker error: no result")));
    }

    @Test
    void windowHoldsTwiceWorkersWhileWorkersAreBlocked() throws Exception {
        createImages(20);
        Semaphore gate = new Semaphore(0);
        when(imageProcessor.process(any())).thenAnswer(invocation -> {
            gate.acquire();
            ImageTask task = invocation.getArgument(0);
            return ProcessingResult.success(task.inputPath(), task.outputPath());
        });
        PendingTracker tracker = new PendingTracker();
        BatchDispatcher tracked = tracked(tracker);

        Thread runner = new Thread(() ->
            tracked.run(config().parallelProcessing(true).maxWorkers(2).build(), new CancellationToken(), aggregator));
        runner.start();

        awaitSubmitted(tracker, 4);
        Thread.sleep(200);
        assertEquals(4, tracker.submitted.get());

        // 每完成一个只补充一个
        gate.release();
        awaitSubmitted(tracker, 5);
        Thread.sleep(100);
        assertEquals(5, tracker.submitted.get());
        assertEquals(1, tracker.merged.get());

        gate.release(100);
        runner.join(TimeUnit.SECONDS.toMillis(10));
        assertFalse(runner.isAlive());

        assertEquals(20, tracker.submitted.get());
        assertEquals(4, tracker.peak.get());
        assertEquals(20, aggregator.snapshot().join().successCount());
    }

    @Test
    void windowShrinksToRemainingItems() throws IOException {
        createImages(20);
        when(imageProcessor.process(any())).thenAnswer(invocation -> {
            ImageTask task = invocation.getArgument(0);
            return ProcessingResult.success(task.inputPath(), task.outputPath());
        });
        PendingTracker tracker = new PendingTracker();

        tracked(tracker).run(config().parallelProcessing(true).maxWorkers(2).build(),
            new CancellationToken(), aggregator);

        List<Integer> expected = new ArrayList<>();
        for (int completed = 0; completed < 20; completed++) {
            expected.add(Math.min(4, 20 - completed));
        }
        assertEquals(expected, tracker.pendingAtMerge);
    }

    @Test
    void windowNeverExceedsItemCount() throws IOException {
        createImages(3);
        when(imageProcessor.process(any())).thenAnswer(invocation -> {
            ImageTask task = invocation.getArgument(0);
            return ProcessingResult.success(task.inputPath(), task.outputPath());
        });
        PendingTracker tracker = new PendingTracker();

        tracked(tracker).run(config().parallelProcessing(true).maxWorkers(2).build(),
            new CancellationToken(), aggregator);

        assertEquals(3, tracker.peak.get());
        assertEquals(List.of(3, 2, 1), tracker.pendingAtMerge);
    }

    @Test
    void workerExceptionBecomesItemFailure() throws IOException {
        createImages(2);
        when(imageProcessor.process(any())).thenThrow(new IllegalStateException("boom"));

        dispatcher.run(config().parallelProcessing(true).maxWorkers(2).build(), new CancellationToken(), aggregator);

        ProgressSnapshot snapshot = aggregator.snapshot().join();
        assertEquals(ProcessingState.COMPLETED, snapshot.state());
        assertEquals(2, snapshot.errorCount());
        assertEquals("Worker error: IllegalStateException: boom", snapshot.errors().get(0).error());
    }

    @Test
    void sequentialExceptionBecomesItemFailure() throws IOException {
        createImages(1);
        when(imageProcessor.process(any())).thenThrow(new IllegalStateException("boom"));

        dispatcher.run(config().build(), new CancellationToken(), aggregator);

        ProgressSnapshot snapshot = aggregator.snapshot().join();
        assertEquals(1, snapshot.errorCount());
        assertEquals(new ErrorRecord("img000.jpg", "Worker error: IllegalStateException: boom"), snapshot.errors().get(0));
    }

    @Test
    void cancelledBeforeStartProcessesNothing() throws IOException {
        createImages(5);
        CancellationToken token = new CancellationToken();
        token.request();

        dispatcher.run(config().build(), token, aggregator);

        ProgressSnapshot snapshot = aggregator.snapshot().join();
        assertEquals(ProcessingState.CANCELLED, snapshot.state());
        assertEquals(0, snapshot.processedCount());
        verify(imageProcessor, never()).process(any());
    }

    @Test
    void emptyFolderCompletesImmediately() {
        dispatcher.run(config().parallelProcessing(true).maxWorkers(4).build(), new CancellationToken(), aggregator);

        ProgressSnapshot snapshot = aggregator.snapshot().join();
        assertEquals(ProcessingState.COMPLETED, snapshot.state());
        assertEquals(0, snapshot.totalFiles());
    }

    @Test
    void outputFolderThatIsAFileIsFatal() throws IOException {
        createImages(1);
        Files.write(output, new byte[] {0});

        dispatcher.run(config().build(), new CancellationToken(), aggregator);

        ProgressSnapshot snapshot = aggregator.snapshot().join();
        assertEquals(ProcessingState.ERROR, snapshot.state());
        ErrorRecord last = snapshot.errors().get(snapshot.errors().size() - 1);
        assertEquals(ErrorRecord.BATCH, last.file());
        assertTrue(last.error().startsWith("Fatal error: FileAlreadyExistsException"), last.error());
        verify(imageProcessor, never()).process(any());
    }

    private BatchDispatcher tracked(PendingTracker tracker) {
        EngineProperties properties = new EngineProperties();
        properties.setPollInterval(Duration.ofMillis(20));
        return new BatchDispatcher(imageProcessor, new WorkItemScanner(), properties) {
            @Override
            CompletionService<ProcessingResult> newCompletionService(ExecutorService pool) {
                return tracker.wrap(new ExecutorCompletionService<>(pool));
            }
        };
    }

    private void awaitSubmitted(PendingTracker tracker, int count) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (tracker.submitted.get() < count && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
        assertEquals(count, tracker.submitted.get());
    }

    /**
     * 统计已提交但尚未被调度器取回的任务数
     */
    private static class PendingTracker {

        final AtomicInteger submitted = new AtomicInteger();

        final AtomicInteger merged = new AtomicInteger();

        final AtomicInteger peak = new AtomicInteger();

        final List<Integer> pendingAtMerge = new CopyOnWriteArrayList<>();

        CompletionService<ProcessingResult> wrap(CompletionService<ProcessingResult> delegate) {
            return new CompletionService<>() {
                @Override
                public Future<ProcessingResult> submit(Callable<ProcessingResult> task) {
                    Future<ProcessingResult> future = delegate.submit(task);
                    peak.accumulateAndGet(submitted.incrementAndGet() - merged.get(), Math::max);
                    return future;
                }

                @Override
                public Future<ProcessingResult> submit(Runnable task, ProcessingResult result) {
                    Future<ProcessingResult> future = delegate.submit(task, result);
                    peak.accumulateAndGet(submitted.incrementAndGet() - merged.get(), Math::max);
                    return future;
                }

                @Override
                public Future<ProcessingResult> take() throws InterruptedException {
                    return retrieved(delegate.take());
                }

                @Override
                public Future<ProcessingResult> poll() {
                    return retrieved(delegate.poll());
                }

                @Override
                public Future<ProcessingResult> poll(long timeout, TimeUnit unit) throws InterruptedException {
                    return retrieved(delegate.poll(timeout, unit));
                }
            };
        }

        private Future<ProcessingResult> retrieved(Future<ProcessingResult> future) {
            if (future != null) {
                pendingAtMerge.add(submitted.get() - merged.getAndIncrement());
            }
            return future;
        }
    }

    private ProcessingConfig.ProcessingConfigBuilder config() {
        return ProcessingConfig.builder().inputFolder(input).outputFolder(output);
    }

    private void createImages(int count) throws IOException {
        for (int i = 0; i < count; i++) {
            Files.write(input.resolve(String.format("img%03d.jpg", i)), new byte[] {1});
        }
    }
}
