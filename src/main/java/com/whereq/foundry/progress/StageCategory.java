package com.whereq.foundry.progress;

/**
 * Coarse grouping of stages. The elapsed-time fallback picks its step size from it.
 */
public enum StageCategory {
    /**
     * Device selection, model and checkpoint loading. Fast early steps.
     */
    LOADING,

    /**
     * Token generation. Long and slow.
     */
    GENERATION,

    /**
     * Worker reported a problem. Progress is held.
     */
    ERROR,

    OTHER
}
