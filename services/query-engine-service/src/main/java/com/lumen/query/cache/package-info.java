/**
 * Exact and semantic result caches.
 *
 * <p>Every cache here owns a single lock. Critical sections only touch the in-memory
 * structures: anything that scans many entries (similarity scoring, stale lookups) copies
 * the entry array under the lock, releases it, does the work, and re-acquires the lock
 * only to record the outcome. No cache calls into another component while holding its lock.
 */
package com.lumen.query.cache;
