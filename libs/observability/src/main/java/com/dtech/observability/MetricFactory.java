package com.dtech.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

/**
 * Creates Micrometer meters that all carry a {@code service} tag.
 * <p>
 * Meters are registered lazily; asking twice for the same name and tags returns the same meter.
 */
public final class MetricFactory {

    public static final String TAG_SERVICE = "service";

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
     * @param tags additional key/value pairs, e.g. {@code "outcome", "granted"}
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(tags(tags))
                .register(registry);
    }

    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name)
                .description(description)
                .tags(tags(tags))
                .register(registry);
    }

    public MeterRegistry registry() {
        return registry;
    }

    public String serviceName() {
        return serviceName;
    }

    private Tags tags(String... extra) {
        if (extra.length % 2 != 0) {
            throw new IllegalArgumentException("tags must be key/value pairs");
        }
        return Tags.of(TAG_SERVICE, serviceName).and(extra);
    }
}
