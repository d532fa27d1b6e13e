package xyz.firestige.hotswap.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer 实现
 * <p>
 * 计数器按 名称 + 标签 缓存，避免每次递增都走一遍注册表查找；
 * 仪表值用 double 位模式存放在 AtomicLong 里，注册表只弱引用状态对象，这里负责强引用。
 */
public class MicrometerMetricsRegistry implements MetricsRegistry {

    private static final String BASE_TAG_KEY = "component";
    private static final String BASE_TAG_VALUE = "hotswap";

    private final MeterRegistry registry;
    private final Map<CounterKey, Counter> counters = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> gaugeBits = new ConcurrentHashMap<>();

    public MicrometerMetricsRegistry(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void incrementCounter(String name, String... tags) {
        if (tags.length % 2 != 0) {
            throw new IllegalArgumentException("标签必须成对出现: " + name + " " + Arrays.toString(tags));
        }
        counters.computeIfAbsent(new CounterKey(name, List.of(tags)), this::registerCounter).increment();
    }

    @Override
    public void setGauge(String name, double value) {
        gaugeBits.computeIfAbsent(name, this::registerGauge).set(Double.doubleToRawLongBits(value));
    }

    private Counter registerCounter(CounterKey key) {
        return Counter.builder(key.name())
                .tags(Tags.of(BASE_TAG_KEY, BASE_TAG_VALUE).and(key.tags().toArray(new String[0])))
                .register(registry);
    }

    private AtomicLong registerGauge(String name) {
        AtomicLong bits = new AtomicLong(Double.doubleToRawLongBits(0d));
        Gauge.builder(name, bits, b -> Double.longBitsToDouble(b.get()))
                .tags(BASE_TAG_KEY, BASE_TAG_VALUE)
                .register(registry);
        return bits;
    }

    private record CounterKey(String name, List<String> tags) {
    }
}
