package com.healthwatch.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Factory for Micrometer meters that carry the Healthwatch {@code component} tag.
 * <p>
 * Meters are registered on first use and reused afterwards (Micrometer deduplicates by name
 * and tags), so callers may look a meter up on every event.
 */
public final class MetricFactory {

    /** Tag key for the component that produced the metric. */
    public static final String TAG_COMPONENT = "component";

    private final MeterRegistry registry;
    private final String component;
    private final Map<String, AtomicLong> gaugeValues = new ConcurrentHashMap<>();

    /**
     * Creates a MetricFactory bound to the given registry and component name.
     *
     * @param registry  the Micrometer meter registry
     * @param component component name included as a default tag
     */
    public MetricFactory(MeterRegistry registry, String component) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (component == null || component.isBlank()) {
            throw new IllegalArgumentException("component must not be null or blank");
        }
        this.registry = registry;
        this.component = component;
    }

    /**
     * Returns a counter tagged with the component and the given key-value pairs.
     *
     * @param name        metric name (e.g., "healthwatch.probe.results")
     * @param description human-readable description
     * @param tags        additional tags (key-value pairs)
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Returns a timer tagged with the component and the given key-value pairs.
     *
     * @param name        metric name (e.g., "healthwatch.probe.duration")
     * @param description human-readable description
     * @param tags        additional tags (key-value pairs)
     */
    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Registers a gauge backed by an {@link AtomicLong}.
     * <p>
     * The holder is cached per name and tags, so asking twice for the same gauge returns the
     * holder the registry is actually reading.
     *
     * @return the value holder; setting it updates the gauge
     */
    public AtomicLong gauge(String name, String description, String... tags) {
        Tags gaugeTags = baseTags(tags);
        return gaugeValues.computeIfAbsent(name + gaugeTags, key -> {
            AtomicLong value = new AtomicLong(0);
            Gauge.builder(name, value, AtomicLong::doubleValue)
                    .description(description)
                    .tags(gaugeTags)
                    .strongReference(true)
                    .register(registry);
            return value;
        });
    }

    /** Returns the underlying meter registry. */
    public MeterRegistry registry() {
        return registry;
    }

    /** Returns the component name used as a default tag. */
    public String component() {
        return component;
    }

    private Tags baseTags(String... extraTags) {
        Tags tags = Tags.of(TAG_COMPONENT, component);
        if (extraTags.length > 0) {
            tags = tags.and(extraTags);
        }
        return tags;
    }
}
