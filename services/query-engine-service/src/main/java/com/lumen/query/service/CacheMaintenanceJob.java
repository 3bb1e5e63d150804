package com.lumen.query.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class CacheMaintenanceJob {
    private static final Logger log = LoggerFactory.getLogger(CacheMaintenanceJob.class);

    private final QueryResultCache resultCache;

    public CacheMaintenanceJob(QueryResultCache resultCache) {
        this.resultCache = resultCache;
    }

    @Scheduled(
        fixedDelayString = "${query.cache.cleanup-interval-ms:60000}",
        initialDelayString = "${query.cache.cleanup-interval-ms:60000}"
    )
    public void cleanupExpired() {
        int removed = resultCache.cleanupExpired();
        if (removed > 0) {
            log.info("result_cache_cleanup removed={}", removed);
        }
    }
}
