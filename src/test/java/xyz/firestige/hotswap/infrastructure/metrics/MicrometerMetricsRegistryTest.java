package xyz.firestige.hotswap.infrastructure.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import xyz.firestige.hotswap.util.TimingExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@Tag("fast")
@ExtendWith(TimingExtension.class)
@DisplayName("MicrometerMetricsRegistry 单元测试")
class MicrometerMetricsRegistryTest {

    private SimpleMeterRegistry meterRegistry;
    private MicrometerMetricsRegistry metrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metrics = new MicrometerMetricsRegistry(meterRegistry);
    }

    @Test
    @DisplayName("场景: 不同环境标签的计数器分别累计")
    void taggedCounters_accumulatePerEnvironment() {
        // When
        metrics.incrementCounter(MetricsRegistry.LOCK_CONTENTION, MetricsRegistry.TAG_ENVIRONMENT, "PRODUCTION");
        metrics.incrementCounter(MetricsRegistry.LOCK_CONTENTION, MetricsRegistry.TAG_ENVIRONMENT, "PRODUCTION");
        metrics.incrementCounter(MetricsRegistry.LOCK_CONTENTION, MetricsRegistry.TAG_ENVIRONMENT, "QA");

        // Then
        assertThat(meterRegistry.get(MetricsRegistry.LOCK_CONTENTION)
                .tag(MetricsRegistry.TAG_ENVIRONMENT, "PRODUCTION").counter().count()).isEqualTo(2.0);
        assertThat(meterRegistry.get(MetricsRegistry.LOCK_CONTENTION)
                .tag(MetricsRegistry.TAG_ENVIRONMENT, "QA").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("场景: 无标签计数器带公共组件标签")
    void plainCounter_carriesComponentTag() {
        metrics.incrementCounter(MetricsRegistry.PIPELINE_STARTED);

        assertThat(meterRegistry.get(MetricsRegistry.PIPELINE_STARTED)
                .tag("component", "hotswap").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("场景: 仪表只注册一次并反映最新值")
    void gauge_reflectsLatestValue() {
        // When
        metrics.setGauge(MetricsRegistry.PIPELINE_ACTIVE, 3);
        metrics.setGauge(MetricsRegistry.PIPELINE_ACTIVE, 1.5);

        // Then
        assertThat(meterRegistry.find(MetricsRegistry.PIPELINE_ACTIVE).gauges()).hasSize(1);
        assertThat(meterRegistry.get(MetricsRegistry.PIPELINE_ACTIVE).gauge().value()).isEqualTo(1.5);
    }

    @Test
    @DisplayName("场景: 标签不成对时拒绝")
    void oddTags_rejected() {
        assertThatThrownBy(() -> metrics.incrementCounter(MetricsRegistry.ROLLBACK_ESCALATED, "environment"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
