package com.auscomply.api.config;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-client rate limits using Bucket4j. Report generation and job triggers get the
 * strict bucket, audit reads the high-volume one.
 */
@Configuration
public class RateLimitConfig {

    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();
    private final long defaultPerMinute;
    private final long strictPerMinute;
    private final long highVolumePerMinute;

    public RateLimitConfig(
            @Value("${auscomply.rate-limit.default-per-minute:100}") long defaultPerMinute,
            @Value("${auscomply.rate-limit.strict-per-minute:10}") long strictPerMinute,
            @Value("${auscomply.rate-limit.high-volume-per-minute:500}") long highVolumePerMinute) {
        this.defaultPerMinute = defaultPerMinute;
        this.strictPerMinute = strictPerMinute;
        this.highVolumePerMinute = highVolumePerMinute;
    }

    public Bucket resolveBucket(String clientId) {
        return buckets.computeIfAbsent(clientId, key -> perMinute(defaultPerMinute));
    }

    public Bucket resolveStrictBucket(String clientId) {
        return buckets.computeIfAbsent(clientId + ":strict", key -> perMinute(strictPerMinute));
    }

    public Bucket resolveHighVolumeBucket(String clientId) {
        return buckets.computeIfAbsent(clientId + ":high", key -> perMinute(highVolumePerMinute));
    }

    private Bucket perMinute(long capacity) {
        Bandwidth limit = Bandwidth.classic(capacity, Refill.greedy(capacity, Duration.ofMinutes(1)));
        return Bucket.builder().addLimit(limit).build();
    }
}
