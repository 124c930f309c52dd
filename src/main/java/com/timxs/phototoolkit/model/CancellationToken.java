package com.timxs.phototoolkit.model;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 取消令牌
 * 调用方与调度器共享的幂等标志，任何线程都可以设置
 */
public final class CancellationToken {

    private final AtomicBoolean requested = new AtomicBoolean(false);

    /**
     * 请求取消，重复调用无副作用
     *
     * @return 本次调用是否首次设置了标志
     */
    public boolean request() {
        return requested.compareAndSet(false, true);
    }

    public boolean isRequested() {
        return requested.get();
    }
}
