package com.whereq.foundry.cache;

/**
 * Operating mode of the cache, fixed once at startup
 */
public enum CacheMode {
    /**
     * Redis answered the startup probe; operations go to Redis
     */
    ACTIVE,

    /**
     * Redis is switched off or unreachable; every operation is a no-op
     */
    DISABLED
}
