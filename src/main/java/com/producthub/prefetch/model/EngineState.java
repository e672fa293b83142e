package com.producthub.prefetch.model;

/**
 * 引擎生命周期：UNINITIALIZED -> COLD | WARM -> RUNNING，reset 后经 COLD 回到 RUNNING
 */
public enum EngineState {
    UNINITIALIZED,
    /** 无可用快照 */
    COLD,
    /** 已从快照恢复 */
    WARM,
    RUNNING
}
