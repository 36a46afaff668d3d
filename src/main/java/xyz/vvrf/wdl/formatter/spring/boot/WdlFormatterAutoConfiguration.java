package xyz.vvrf.wdl.formatter.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfigureAfter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import xyz.vvrf.wdl.formatter.document.DocumentPlanner;
import xyz.vvrf.wdl.formatter.graph.CanonicalOrderProducer;
import xyz.vvrf.wdl.formatter.monitor.AssemblyMonitorListener;
import xyz.vvrf.wdl.formatter.monitor.LoggingAssemblyMonitorListener;
import xyz.vvrf.wdl.formatter.monitor.MicrometerAssemblyMonitorListener;
import xyz.vvrf.wdl.formatter.plan.BodyAssembler;
import xyz.vvrf.wdl.formatter.plan.ReactiveBodyAssembler;

import java.util.List;
import java.util.stream.Collectors;

/**
 * WDL 格式化排序引擎的 Spring Boot 自动配置类。
 * 职责:
 * 1. 启用并绑定 {@link WdlFormatProperties}。
 * 2. 提供 {@link CanonicalOrderProducer}、{@link BodyAssembler}、{@link DocumentPlanner} Bean。
 * 3. 当 'wdl.format.parallel.enabled=true' 时，提供调度器 "wdlFormatAssemblyScheduler"
 *    与 {@link ReactiveBodyAssembler}。
 * 4. 收集所有 {@link AssemblyMonitorListener} Bean 交给装配器；
 *    按配置注册日志监听器，存在 {@link MeterRegistry} 时注册 Micrometer 监听器。
 * <p>
 * 所有 Bean 均可由用户自定义同类型（或同名）Bean 覆盖。
 *
 * @author ruifeng.wen
 */
@Configuration
@EnableConfigurationProperties(WdlFormatProperties.class)
@AutoConfigureAfter(name = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@Slf4j
public class WdlFormatterAutoConfiguration {

    public static final String SCHEDULER_BEAN_NAME = "wdlFormatAssemblyScheduler";

    public WdlFormatterAutoConfiguration() {
        log.info("WDL 格式化自动配置 (WdlFormatterAutoConfiguration) 已加载。");
    }

    @Bean
    @ConditionalOnMissingBean
    public CanonicalOrderProducer canonicalOrderProducer() {
        return new CanonicalOrderProducer();
    }

    /**
     * 提供同步装配器，并注入上下文中全部的 AssemblyMonitorListener。
     */
    @Bean
    @ConditionalOnMissingBean
    public BodyAssembler bodyAssembler(WdlFormatProperties properties,
                                       CanonicalOrderProducer canonicalOrderProducer,
                                       ObjectProvider<AssemblyMonitorListener> listenersProvider) {
        List<AssemblyMonitorListener> listeners = listenersProvider.orderedStream().collect(Collectors.toList());
        if (listeners.isEmpty()) {
            log.info("在 Spring 上下文中未找到 AssemblyMonitorListener Bean。");
        } else {
            log.info("收集到 {} 个 AssemblyMonitorListener Bean: {}", listeners.size(),
                    listeners.stream().map(l -> l.getClass().getSimpleName()).collect(Collectors.joining(", ")));
        }
        log.info("正在创建 BodyAssembler Bean，配置: {}", properties);
        return new BodyAssembler(
                canonicalOrderProducer,
                listeners,
                properties.getScope().getRootName(),
                properties.getDiagnostics().isLogGraphDot(),
                properties.getDiagnostics().isLogRenderPlan());
    }

    @Bean
    @ConditionalOnMissingBean
    public DocumentPlanner documentPlanner(BodyAssembler bodyAssembler) {
        return new DocumentPlanner(bodyAssembler);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "wdl.format.monitor", name = "logging-enabled", havingValue = "true")
    public LoggingAssemblyMonitorListener loggingAssemblyMonitorListener() {
        return new LoggingAssemblyMonitorListener();
    }

    /**
     * 提供用于并发装配嵌套主体的调度器。
     * 调度器类型和参数可由 {@link WdlFormatProperties.SchedulerProps} 配置。
     */
    @Bean(name = SCHEDULER_BEAN_NAME, destroyMethod = "dispose")
    @ConditionalOnMissingBean(name = SCHEDULER_BEAN_NAME)
    @ConditionalOnProperty(prefix = "wdl.format.parallel", name = "enabled", havingValue = "true")
    public Scheduler wdlFormatAssemblyScheduler(WdlFormatProperties properties) {
        WdlFormatProperties.SchedulerProps schedulerProps = properties.getParallel().getScheduler();
        String namePrefix = schedulerProps.getNamePrefix();

        switch (schedulerProps.getType()) {
            case PARALLEL:
                log.info("正在创建 '{}' (Parallel): prefix={}, parallelism={}",
                        SCHEDULER_BEAN_NAME, namePrefix, schedulerProps.getParallelism());
                return Schedulers.newParallel(namePrefix, schedulerProps.getParallelism(), true);
            case SINGLE:
                log.info("正在创建 '{}' (Single): prefix={}", SCHEDULER_BEAN_NAME, namePrefix);
                return Schedulers.newSingle(namePrefix, true);
            case BOUNDED_ELASTIC:
            default:
                log.info("正在创建 '{}' (BoundedElastic): prefix={}, cap={}, queue={}, ttl={}s",
                        SCHEDULER_BEAN_NAME, namePrefix, schedulerProps.getThreadCap(),
                        schedulerProps.getQueuedTaskCap(), schedulerProps.getTtlSeconds());
                return Schedulers.newBoundedElastic(schedulerProps.getThreadCap(), schedulerProps.getQueuedTaskCap(),
                        namePrefix, schedulerProps.getTtlSeconds(), true);
        }
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "wdl.format.parallel", name = "enabled", havingValue = "true")
    public ReactiveBodyAssembler reactiveBodyAssembler(BodyAssembler bodyAssembler,
                                                       @Qualifier(SCHEDULER_BEAN_NAME) Scheduler scheduler) {
        return new ReactiveBodyAssembler(bodyAssembler, scheduler);
    }

    @Configuration
    @ConditionalOnClass(name = "io.micrometer.core.instrument.MeterRegistry")
    static class MicrometerMonitorConfiguration {

        @Bean
        @ConditionalOnMissingBean
        @ConditionalOnBean(MeterRegistry.class)
        public MicrometerAssemblyMonitorListener micrometerAssemblyMonitorListener(MeterRegistry meterRegistry) {
            log.info("检测到 MeterRegistry，正在创建 MicrometerAssemblyMonitorListener Bean。");
            return new MicrometerAssemblyMonitorListener(meterRegistry);
        }
    }
}
