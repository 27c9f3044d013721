package com.leadengine.domain.followup.model.valobj;

/**
 * 单轮跟进调度统计。
 */
public record CycleResult(int attempted, int succeeded, int failed) {

    public static CycleResult empty() {
        return new CycleResult(0, 0, 0);
    }
}
