package com.timxs.phototoolkit.model;

/**
 * 批处理运行状态
 * idle -> running -> completed / cancelled / error，终态不再迁移
 */
public enum ProcessingState {
    /**
     * 尚未开始
     */
    IDLE("idle"),

    /**
     * 处理中
     */
    RUNNING("running"),

    /**
     * 全部处理完成
     */
    COMPLETED("completed"),

    /**
     * 已取消
     */
    CANCELLED("cancelled"),

    /**
     * 批处理级错误导致提前终止
     */
    ERROR("error");

    private final String value;

    ProcessingState(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * 是否为终态
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == ERROR;
    }
}
