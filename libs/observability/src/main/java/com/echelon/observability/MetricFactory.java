package com.echelon.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.util.function.Supplier;

/**
 * Creates Micrometer meters that all carry the {@code service} tag.
 * <p>
 * Tenant IDs and credential IDs are never used as tags: both are unbounded and would explode
 * metric cardinality. Per-tenant detail belongs in the audit trail.
 */
public final class MetricFactory {

    public static final String TAG_SERVICE = "service";
    public static final String TAG_ACTION = "action";
    public static final String TAG_OUTCOME = "outcome";
    public static final String TAG_CODE = "code";

    private final MeterRegistry registry;
    private final String serviceName;

    public MetricFactory(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    /**
     * Returns the counter for the name and tags, registering it on first use.
     *
     * @param tags additional key-value pairs
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(tagsWith(tags))
                .register(registry);
    }

    /** Timer variant of {@link #counter(String, String, String...)}. */
    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name)
                .description(description)
                .tags(tagsWith(tags))
                .register(registry);
    }

    /**
     * Registers a gauge that samples {@code value} whenever the registry is scraped. The
     * supplier must be cheap and thread-safe.
     */
    public void gauge(String name, String description, Supplier<Number> value, String... tags) {
        Gauge.builder(name, value)
                .description(description)
                .tags(tagsWith(tags))
                .register(registry);
    }

    public MeterRegistry registry() {
        return registry;
    }

    public String serviceName() {
        return serviceName;
    }

    private Tags tagsWith(String... extra) {
        Tags tags = Tags.of(TAG_SERVICE, serviceName);
        return extra.length == 0 ? tags : tags.and(extra);
    }
}
