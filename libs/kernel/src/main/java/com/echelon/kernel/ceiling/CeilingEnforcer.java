package com.echelon.kernel.ceiling;

import com.echelon.kernel.error.KernelException;
import com.echelon.kernel.ratelimit.FixedWindowCounter;
import com.echelon.kernel.ratelimit.WindowLease;
import com.echelon.observability.MetricFactory;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Final, unconditional quota check against the hard ceilings.
 * <p>
 * Effective ceilings are {@code min(configured, hard constant)}; tenant tier plays no part.
 * A breach is logged at ERROR because it means a caller got past every configured limit.
 */
public class CeilingEnforcer {

    private static final Logger log = LoggerFactory.getLogger(CeilingEnforcer.class);

    private static final String KEY_PREFIX = "ceil:";
    private static final Duration SECOND = Duration.ofSeconds(1);
    private static final Duration DAY = Duration.ofDays(1);

    private final FixedWindowCounter counter;
    private final MetricFactory metrics;
    private final long tenantActionsPerSecond;
    private final Map<String, Long> actionDaily;

    public CeilingEnforcer(FixedWindowCounter counter, CeilingPolicy policy, MetricFactory metrics) {
        this.counter = Objects.requireNonNull(counter, "counter");
        this.metrics = metrics;
        this.tenantActionsPerSecond = clamp("tenant.actions_per_second",
                policy.tenantActionsPerSecond(), Ceilings.TENANT_ACTIONS_PER_SECOND);
        Map<String, Long> daily = new HashMap<>(Ceilings.ACTION_DAILY);
        policy.actionDaily().forEach((action, configured) ->
                daily.put(action, clamp(action + ".daily", configured, Ceilings.ACTION_DAILY.get(action))));
        this.actionDaily = Map.copyOf(daily);
    }

    /**
     * Checks and consumes the ceilings that apply to the action.
     *
     * @return leases that {@link #release(List)} hands back if the request is rejected later
     * @throws KernelException {@code CEILING_EXCEEDED}
     */
    public List<WindowLease> enforce(String tenantId, String action) {
        List<WindowLease> taken = new ArrayList<>();
        try {
            taken.add(acquire(KEY_PREFIX + "tenant_rps:" + tenantId, SECOND, tenantActionsPerSecond,
                    "tenant_actions_per_second", tenantId, action));
            Long daily = actionDaily.get(action);
            if (daily != null) {
                taken.add(acquire(KEY_PREFIX + "daily:" + action + ":" + tenantId, DAY, daily,
                        action + ".per_day", tenantId, action));
            }
            return taken;
        } catch (RuntimeException e) {
            release(taken);
            throw e;
        }
    }

    /**
     * Checks the ceilings without consuming them (dry runs).
     *
     * @throws KernelException {@code CEILING_EXCEEDED} if the action's daily ceiling is exhausted
     */
    public void check(String tenantId, String action) {
        Long daily = actionDaily.get(action);
        if (daily != null && counter.peek(KEY_PREFIX + "daily:" + action + ":" + tenantId, DAY) >= daily) {
            throw breach(action + ".per_day", daily, tenantId, action);
        }
    }

    public void release(List<WindowLease> leases) {
        for (WindowLease lease : leases) {
            counter.release(lease);
        }
    }

    /** Effective per-tenant per-second ceiling after clamping. */
    public long tenantActionsPerSecond() {
        return tenantActionsPerSecond;
    }

    /** Effective daily ceiling for the action, or null if none applies. */
    public Long dailyCeiling(String action) {
        return actionDaily.get(action);
    }

    private WindowLease acquire(String key, Duration window, long limit, String ceiling,
                                String tenantId, String action) {
        FixedWindowCounter.Acquisition acquisition = counter.tryAcquire(key, window, limit);
        if (!acquisition.allowed()) {
            throw breach(ceiling, limit, tenantId, action);
        }
        return acquisition.lease();
    }

    private KernelException breach(String ceiling, long limit, String tenantId, String action) {
        log.error("Hard ceiling exceeded: ceiling={} limit={} tenant={} action={}",
                ceiling, limit, tenantId, action);
        if (metrics != null) {
            metrics.counter("echelon.ceiling.breaches", "Requests rejected by a hard ceiling",
                    "ceiling", ceiling).increment();
        }
        return KernelException.ceilingExceeded(ceiling, limit);
    }

    private static long clamp(String name, long configured, Long hard) {
        if (hard == null) {
            return configured;
        }
        if (configured > hard) {
            log.warn("Configured ceiling {}={} exceeds hard ceiling {}; clamping", name, configured, hard);
            return hard;
        }
        return configured;
    }
}
