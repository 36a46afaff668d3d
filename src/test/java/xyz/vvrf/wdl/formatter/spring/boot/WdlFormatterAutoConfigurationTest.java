package xyz.vvrf.wdl.formatter.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.test.StepVerifier;
import xyz.vvrf.wdl.formatter.document.DocumentPlanner;
import xyz.vvrf.wdl.formatter.graph.CanonicalOrderProducer;
import xyz.vvrf.wdl.formatter.monitor.LoggingAssemblyMonitorListener;
import xyz.vvrf.wdl.formatter.monitor.MicrometerAssemblyMonitorListener;
import xyz.vvrf.wdl.formatter.plan.BodyAssembler;
import xyz.vvrf.wdl.formatter.plan.ReactiveBodyAssembler;
import xyz.vvrf.wdl.formatter.plan.RenderPlan;

import static org.junit.jupiter.api.Assertions.*;
import static xyz.vvrf.wdl.formatter.test.util.BodyFixtures.*;

/**
 * WdlFormatterAutoConfiguration 测试：默认 Bean、属性绑定与条件注册。
 */
public class WdlFormatterAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(WdlFormatterAutoConfiguration.class));

    @Test
    public void testDefaultBeans() {
        contextRunner.run(context -> {
            assertNotNull(context.getBean(CanonicalOrderProducer.class));
            assertNotNull(context.getBean(DocumentPlanner.class));
            BodyAssembler assembler = context.getBean(BodyAssembler.class);
            assertEquals(BodyAssembler.DEFAULT_ROOT_SCOPE_NAME, assembler.getRootScopeName());
            assertTrue(assembler.getMonitorListeners().isEmpty());
            assertTrue(context.getBeansOfType(ReactiveBodyAssembler.class).isEmpty(), "默认不创建响应式装配器");
            assertFalse(context.containsBean(WdlFormatterAutoConfiguration.SCHEDULER_BEAN_NAME));
        });
    }

    @Test
    public void testRootScopeNameIsBound() {
        contextRunner.withPropertyValues("wdl.format.scope.root-name=main").run(context ->
                assertEquals("main", context.getBean(BodyAssembler.class).getRootScopeName()));
    }

    @Test
    public void testBlankRootScopeNameFailsValidation() {
        contextRunner.withPropertyValues("wdl.format.scope.root-name= ").run(context ->
                assertNotNull(context.getStartupFailure(), "空白的作用域名称应导致启动失败"));
    }

    @Test
    public void testParallelAssemblyBeans() {
        contextRunner.withPropertyValues(
                        "wdl.format.parallel.enabled=true",
                        "wdl.format.parallel.scheduler.type=PARALLEL",
                        "wdl.format.parallel.scheduler.parallelism=2")
                .run(context -> {
                    assertNotNull(context.getBean(WdlFormatterAutoConfiguration.SCHEDULER_BEAN_NAME, Scheduler.class));
                    ReactiveBodyAssembler reactive = context.getBean(ReactiveBodyAssembler.class);
                    RenderPlan expected = context.getBean(BodyAssembler.class)
                            .assemble(body(decl("a"), scatter("s", deps("a"), call("c"))));

                    StepVerifier.create(reactive.assemble(body(decl("a"), scatter("s", deps("a"), call("c")))))
                            .expectNext(expected)
                            .verifyComplete();
                });
    }

    @Test
    public void testLoggingListenerIsOptIn() {
        contextRunner.withPropertyValues("wdl.format.monitor.logging-enabled=true").run(context -> {
            LoggingAssemblyMonitorListener listener = context.getBean(LoggingAssemblyMonitorListener.class);
            assertTrue(context.getBean(BodyAssembler.class).getMonitorListeners().contains(listener));
        });
    }

    @Test
    public void testMicrometerListenerWhenMeterRegistryPresent() {
        contextRunner.withUserConfiguration(MeterRegistryConfiguration.class).run(context -> {
            MicrometerAssemblyMonitorListener listener = context.getBean(MicrometerAssemblyMonitorListener.class);
            assertTrue(context.getBean(BodyAssembler.class).getMonitorListeners().contains(listener));

            context.getBean(BodyAssembler.class).assemble(body(decl("a")));
            assertNotNull(context.getBean(MeterRegistry.class).find("wdl.format.scope.assembly.total").counter());
        });
    }

    @Test
    public void testUserDefinedAssemblerWins() {
        contextRunner.withUserConfiguration(CustomAssemblerConfiguration.class).run(context ->
                assertEquals("custom", context.getBean(BodyAssembler.class).getRootScopeName()));
    }

    @Configuration
    static class MeterRegistryConfiguration {
        @Bean
        public MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Configuration
    static class CustomAssemblerConfiguration {
        @Bean
        public BodyAssembler bodyAssembler() {
            return new BodyAssembler(new CanonicalOrderProducer(), null, "custom", false, false);
        }
    }
}
