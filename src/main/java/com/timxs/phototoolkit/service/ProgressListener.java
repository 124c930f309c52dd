package com.timxs.phototoolkit.service;

import com.timxs.phototoolkit.model.ProgressSnapshot;

/**
 * 批处理进度观察者
 * 回调在进度聚合器线程中串行执行，抛出的异常会被记录并忽略
 */
public interface ProgressListener {

    /**
     * 不做任何处理的默认实现
     */
    ProgressListener NOOP = new ProgressListener() {
    };

    /**
     * 每次计数变化后调用
     *
     * @param snapshot 当前进度快照
     */
    default void onProgress(ProgressSnapshot snapshot) {
    }

    /**
     * 运行到达终态时调用，每次运行恰好一次
     *
     * @param snapshot 最终进度快照
     */
    default void onComplete(ProgressSnapshot snapshot) {
    }
}
