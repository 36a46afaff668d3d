package xyz.vvrf.wdl.formatter.monitor;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.wdl.formatter.plan.RenderPlan;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * 将作用域装配耗时与结果记录为 Micrometer 指标的监听器。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class MicrometerAssemblyMonitorListener implements AssemblyMonitorListener {

    // 指标名称
    static final String METRIC_SCOPE_ASSEMBLY_TIME = "wdl.format.scope.assembly.time";
    static final String METRIC_SCOPE_ASSEMBLY_TOTAL = "wdl.format.scope.assembly.total";

    // 标签键
    static final String TAG_SCOPE_NAME = "scope.name";
    static final String TAG_STATUS = "status";
    static final String TAG_ERROR = "error";

    // 状态标签值
    static final String STATUS_SUCCESS = "SUCCESS";
    static final String STATUS_FAILURE = "FAILURE";

    private final MeterRegistry meterRegistry;

    public MicrometerAssemblyMonitorListener(MeterRegistry meterRegistry) {
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "MeterRegistry 不能为空");
    }

    @Override
    public void onScopeAssembled(String scopeName, int elementCount, Duration duration, RenderPlan plan) {
        Tags tags = Tags.of(
                Tag.of(TAG_SCOPE_NAME, scopeName),
                Tag.of(TAG_STATUS, STATUS_SUCCESS)
        );
        recordTimer(tags, duration);
        incrementCounter(tags);
    }

    @Override
    public void onScopeFailed(String scopeName, Duration duration, Throwable error) {
        String errorTagValue = error != null ? error.getClass().getSimpleName() : "Unknown";
        Tags tags = Tags.of(
                Tag.of(TAG_SCOPE_NAME, scopeName),
                Tag.of(TAG_STATUS, STATUS_FAILURE),
                Tag.of(TAG_ERROR, errorTagValue)
        );
        recordTimer(tags, duration);
        incrementCounter(tags);
    }

    private void recordTimer(Tags tags, Duration duration) {
        try {
            Timer timer = Timer.builder(METRIC_SCOPE_ASSEMBLY_TIME)
                    .tags(tags)
                    .description("作用域装配时间")
                    .register(meterRegistry);
            timer.record(duration.toNanos(), TimeUnit.NANOSECONDS);
        } catch (Exception e) {
            log.error("记录计时器指标失败: {}", e.getMessage(), e);
        }
    }

    private void incrementCounter(Tags tags) {
        try {
            Counter counter = Counter.builder(METRIC_SCOPE_ASSEMBLY_TOTAL)
                    .tags(tags)
                    .description("按状态统计的作用域装配总数")
                    .register(meterRegistry);
            counter.increment();
        } catch (Exception e) {
            log.error("增加计数器指标失败: {}", e.getMessage(), e);
        }
    }
}
