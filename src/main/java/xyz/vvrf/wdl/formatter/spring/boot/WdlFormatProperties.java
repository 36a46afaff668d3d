package xyz.vvrf.wdl.formatter.spring.boot;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import reactor.core.scheduler.Schedulers;
import xyz.vvrf.wdl.formatter.plan.BodyAssembler;

import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;

/**
 * WDL 格式化排序引擎的配置属性类。
 * 绑定 'wdl.format' 前缀下的属性。
 *
 * @author ruifeng.wen
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "wdl.format")
@Validated
public class WdlFormatProperties {

    @Valid
    private final Scope scope = new Scope();
    @Valid
    private final Diagnostics diagnostics = new Diagnostics();
    @Valid
    private final Monitor monitor = new Monitor();
    @Valid
    private final Parallel parallel = new Parallel();

    @Getter
    @Setter
    public static class Scope {
        /**
         * 未显式命名时顶层作用域的名称，出现在日志、异常与指标标签中。
         */
        @NotBlank
        private String rootName = BodyAssembler.DEFAULT_ROOT_SCOPE_NAME;
    }

    @Getter
    @Setter
    public static class Diagnostics {
        /**
         * 是否在 DEBUG 级别输出每个作用域依赖图的 DOT 描述。
         */
        private boolean logGraphDot = false;

        /**
         * 是否在 DEBUG 级别输出渲染计划的文本结构。
         */
        private boolean logRenderPlan = false;
    }

    @Getter
    @Setter
    public static class Monitor {
        /**
         * 是否注册基于日志的监听器。
         */
        private boolean loggingEnabled = false;
    }

    @Getter
    @Setter
    public static class Parallel {
        /**
         * 是否创建响应式装配器，并发装配同一作用域内各个块的嵌套主体。
         */
        private boolean enabled = false;

        @Valid
        private final SchedulerProps scheduler = new SchedulerProps();
    }

    @Getter
    @Setter
    public static class SchedulerProps {
        /**
         * 调度器类型。
         */
        @NotNull
        private SchedulerType type = SchedulerType.BOUNDED_ELASTIC;

        /**
         * 调度器线程名称前缀。
         */
        @NotBlank
        private String namePrefix = "wdl-format";

        @Min(1)
        private int threadCap = Schedulers.DEFAULT_BOUNDED_ELASTIC_SIZE;
        @Min(1)
        private int queuedTaskCap = Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE;
        @Min(0)
        private int ttlSeconds = 60;

        /**
         * PARALLEL 调度器的并行度。
         */
        @Min(1)
        private int parallelism = Runtime.getRuntime().availableProcessors();
    }

    public enum SchedulerType {
        BOUNDED_ELASTIC, PARALLEL, SINGLE
    }

    @Override
    public String toString() {
        return "WdlFormatProperties{" +
                "scope={rootName='" + scope.rootName + '\'' +
                "}, diagnostics={logGraphDot=" + diagnostics.logGraphDot +
                ", logRenderPlan=" + diagnostics.logRenderPlan +
                "}, monitor={loggingEnabled=" + monitor.loggingEnabled +
                "}, parallel={enabled=" + parallel.enabled +
                ", scheduler={type=" + parallel.scheduler.type +
                ", namePrefix='" + parallel.scheduler.namePrefix + '\'' +
                ", threadCap=" + parallel.scheduler.threadCap +
                ", queuedTaskCap=" + parallel.scheduler.queuedTaskCap +
                ", ttlSeconds=" + parallel.scheduler.ttlSeconds +
                ", parallelism=" + parallel.scheduler.parallelism +
                "}}}";
    }
}
