package com.toolgate.policy.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.toolgate.policy.model.Policy;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Loads and caches a policy file.
 * <p>
 * The cached snapshot expires after a short TTL so edits to the file are
 * picked up without restarting; callers always see one consistent
 * {@link Policy} per lookup.
 */
@Slf4j
public class PolicyService {

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMillis(200);

    private final PolicyLoader loader;
    private final Cache<String, Policy> cache;
    private final Path policyPath;

    public PolicyService(Path policyPath) {
        this(policyPath, DEFAULT_CACHE_TTL, new PolicyLoader());
    }

    public PolicyService(Path policyPath, Duration cacheTtl, PolicyLoader loader) {
        String pathStr = policyPath.toString();
        if (pathStr.startsWith("~")) {
            policyPath = Path.of(System.getProperty("user.home") + pathStr.substring(1));
        }
        this.policyPath = policyPath;
        this.loader = loader;
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build();
    }

    /**
     * Load the policy with caching.
     */
    public Policy loadPolicy() {
        return cache.get(policyPath.toString(), key -> loader.load(policyPath));
    }

    /**
     * Force reload, bypassing the cache. Always returns a new instance.
     */
    public Policy reloadPolicy() {
        cache.invalidateAll();
        log.debug("Policy cache invalidated for: {}", policyPath);
        return loadPolicy();
    }

    public Path getPolicyPath() {
        return policyPath;
    }
}
