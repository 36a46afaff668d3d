package xyz.vvrf.wdl.formatter.monitor;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import xyz.vvrf.wdl.formatter.core.CycleDetectedException;
import xyz.vvrf.wdl.formatter.graph.CanonicalOrderProducer;
import xyz.vvrf.wdl.formatter.plan.BodyAssembler;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;
import static xyz.vvrf.wdl.formatter.test.util.BodyFixtures.*;

/**
 * MicrometerAssemblyMonitorListener 单元测试：每个作用域记录一次计时与计数。
 */
public class MicrometerAssemblyMonitorListenerTest {

    private SimpleMeterRegistry meterRegistry;
    private BodyAssembler assembler;

    @BeforeEach
    public void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        assembler = new BodyAssembler(new CanonicalOrderProducer(),
                Collections.singletonList(new MicrometerAssemblyMonitorListener(meterRegistry)),
                "main", false, false);
    }

    @Test
    public void testRecordsSuccessPerScope() {
        assembler.assemble(body(decl("a"), scatter("s", deps("a"), call("c"))));

        Counter main = meterRegistry.find(MicrometerAssemblyMonitorListener.METRIC_SCOPE_ASSEMBLY_TOTAL)
                .tag(MicrometerAssemblyMonitorListener.TAG_SCOPE_NAME, "main")
                .tag(MicrometerAssemblyMonitorListener.TAG_STATUS, MicrometerAssemblyMonitorListener.STATUS_SUCCESS)
                .counter();
        assertNotNull(main);
        assertEquals(1.0, main.count());

        Timer nested = meterRegistry.find(MicrometerAssemblyMonitorListener.METRIC_SCOPE_ASSEMBLY_TIME)
                .tag(MicrometerAssemblyMonitorListener.TAG_SCOPE_NAME, "main/s")
                .timer();
        assertNotNull(nested, "嵌套作用域也应记录计时");
        assertEquals(1, nested.count());
    }

    @Test
    public void testRecordsFailureWithErrorTag() {
        assertThrows(CycleDetectedException.class, () -> assembler.assemble(body(call("a", "a"))));

        Counter failures = meterRegistry.find(MicrometerAssemblyMonitorListener.METRIC_SCOPE_ASSEMBLY_TOTAL)
                .tag(MicrometerAssemblyMonitorListener.TAG_STATUS, MicrometerAssemblyMonitorListener.STATUS_FAILURE)
                .tag(MicrometerAssemblyMonitorListener.TAG_ERROR, "CycleDetectedException")
                .counter();
        assertNotNull(failures);
        assertEquals(1.0, failures.count());
    }
}
