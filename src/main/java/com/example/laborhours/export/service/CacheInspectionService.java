package com.example.laborhours.export.service;

import com.github.benmanes.caffeine.cache.stats.CacheStats;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.cache.caffeine.CaffeineCache;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reports the size, cached template keys and hit statistics of a Caffeine-backed cache.
 */
@Service
@RequiredArgsConstructor
public class CacheInspectionService {
    private final CacheManager cacheManager;

    public Map<String, Object> inspectCache(String cacheName) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("cacheName", cacheName);

        Cache cache = cacheManager.getCache(cacheName);
        if (cache == null) {
            out.put("error", "Cache not found");
            return out;
        }

        if (cache instanceof CaffeineCache) {
            com.github.benmanes.caffeine.cache.Cache<Object, Object> nativeCache = ((CaffeineCache) cache).getNativeCache();
            out.put("estimatedSize", nativeCache.estimatedSize());
            out.put("keys", nativeCache.asMap().keySet());

            CacheStats stats = nativeCache.stats();
            Map<String, Object> statsMap = new LinkedHashMap<>();
            statsMap.put("hitCount", stats.hitCount());
            statsMap.put("missCount", stats.missCount());
            statsMap.put("evictionCount", stats.evictionCount());
            statsMap.put("hitRate", stats.hitRate());
            out.put("stats", statsMap);
        } else {
            out.put("message", "Cache is not a CaffeineCache; native inspection unavailable");
        }
        return out;
    }

    /**
     * Drops every cached template so the next export reads from disk.
     */
    public boolean clearCache(String cacheName) {
        Cache cache = cacheManager.getCache(cacheName);
        if (cache == null) {
            return false;
        }
        cache.clear();
        return true;
    }
}
