package com.echelon.kernel.ratelimit;

import com.echelon.kernel.error.KernelException;
import com.echelon.observability.MetricFactory;
import com.echelon.security.TenantTier;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Multi-window rate limiter over API key, tenant and source IP.
 * <p>
 * Every configured (dimension, window) bucket is checked and incremented. The first breach
 * rejects the request with {@code RATE_LIMITED}, and the increments already taken for the
 * same request are handed back, so a rejected request never consumes quota.
 */
public class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private static final String KEY_PREFIX = "rl:";

    private final FixedWindowCounter counter;
    private final RateLimitPolicy policy;
    private final MetricFactory metrics;

    public RateLimiter(FixedWindowCounter counter, RateLimitPolicy policy, MetricFactory metrics) {
        this.counter = Objects.requireNonNull(counter, "counter");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.metrics = metrics;
    }

    /**
     * The subjects a request is counted against. A null {@code sourceIp} skips that dimension.
     */
    public record Subject(String credentialId, String tenantId, TenantTier tier, String sourceIp) {
    }

    /**
     * Checks and increments every bucket for the request.
     *
     * @throws KernelException {@code RATE_LIMITED} naming the breached dimension and window
     */
    public RateLimitDecision checkAndIncrement(Subject subject, String action) {
        List<WindowLease> taken = new ArrayList<>();
        long remaining = Long.MAX_VALUE;
        long limitOfRemaining = Long.MAX_VALUE;
        int multiplier = subject.tier() == null ? 1 : subject.tier().rateLimitMultiplier();

        List<Bucket> buckets = bucketsFor(subject, action, multiplier);
        for (Bucket bucket : buckets) {
            FixedWindowCounter.Acquisition acquisition;
            try {
                acquisition = counter.tryAcquire(bucket.key(), bucket.window().length(), bucket.limit());
            } catch (RuntimeException e) {
                compensate(taken);
                throw e;
            }
            if (!acquisition.allowed()) {
                compensate(taken);
                log.warn("Rate limit exceeded: dimension={} window={} limit={} action={} tenant={}",
                        bucket.dimension().value(), bucket.window().name(), bucket.limit(),
                        action, subject.tenantId());
                if (metrics != null) {
                    metrics.counter("echelon.ratelimit.rejections", "Requests rejected by the rate limiter",
                            "dimension", bucket.dimension().value(), "window", bucket.window().name())
                            .increment();
                }
                throw KernelException.rateLimited(bucket.dimension().value(), bucket.window().name(),
                        bucket.limit(), acquisition.retryAfterSeconds());
            }
            taken.add(acquisition.lease());
            if (acquisition.remaining() < remaining) {
                remaining = acquisition.remaining();
                limitOfRemaining = bucket.limit();
            }
        }
        return new RateLimitDecision(taken, remaining, limitOfRemaining);
    }

    /**
     * Hands back the increments of a request that was rejected later in the pipeline.
     */
    public void release(RateLimitDecision decision) {
        compensate(decision.leases());
    }

    private void compensate(List<WindowLease> taken) {
        for (WindowLease lease : taken) {
            counter.release(lease);
        }
    }

    private List<Bucket> bucketsFor(Subject subject, String action, int multiplier) {
        List<Bucket> buckets = new ArrayList<>();
        for (RateLimitRule rule : policy.rules()) {
            String subjectId = subjectId(rule.dimension(), subject);
            if (subjectId == null) {
                continue;
            }
            String key = KEY_PREFIX + rule.dimension().value() + ":" + rule.window().name() + ":" + subjectId;
            buckets.add(new Bucket(rule.dimension(), rule.window(), key, saturatedMultiply(rule.limit(), multiplier)));
        }
        Long override = policy.actionOverrides().get(action);
        if (override != null && subject.credentialId() != null) {
            RateLimitWindow window = RateLimitWindow.BURST;
            String key = KEY_PREFIX + "action:" + window.name() + ":" + subject.credentialId() + ":" + action;
            buckets.add(new Bucket(RateLimitDimension.API_KEY, window, key, override));
        }
        return buckets;
    }

    private static String subjectId(RateLimitDimension dimension, Subject subject) {
        switch (dimension) {
            case API_KEY:
                return subject.credentialId();
            case TENANT:
                return subject.tenantId();
            case SOURCE_IP:
                return subject.sourceIp() == null || subject.sourceIp().isBlank() ? null : subject.sourceIp();
            default:
                return null;
        }
    }

    private static long saturatedMultiply(long limit, int multiplier) {
        long result = limit * multiplier;
        return result / multiplier == limit ? result : Long.MAX_VALUE;
    }

    private record Bucket(RateLimitDimension dimension, RateLimitWindow window, String key, long limit) {
    }
}
