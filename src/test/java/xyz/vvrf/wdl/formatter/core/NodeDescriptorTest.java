package xyz.vvrf.wdl.formatter.core;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NodeDescriptor 单元测试：依赖集合复制与去重、嵌套主体约束、原始节点访问。
 */
public class NodeDescriptorTest {

    @Test
    public void testDependenciesAreCopiedInOrderWithoutDuplicates() {
        NodeDescriptor node = NodeDescriptor.invocation("c", "b", "a", "b");

        assertEquals(Arrays.asList("b", "a"), new ArrayList<>(node.getDependencies()), "依赖应去重并保持声明顺序");
        assertThrows(UnsupportedOperationException.class, () -> node.getDependencies().add("x"));
    }

    @Test
    public void testBodyIsRejectedForNonSectionKinds() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () ->
                new NodeDescriptor("d", NodeKind.DECLARATION, null,
                        Collections.singletonList(NodeDescriptor.declaration("inner")), null));
        assertTrue(e.getMessage().contains("'d'"));
    }

    @Test
    public void testSectionKeepsBodyOrder() {
        NodeDescriptor section = NodeDescriptor.iteration("s", Collections.singletonList("xs"),
                Arrays.asList(NodeDescriptor.invocation("c2"), NodeDescriptor.declaration("d1")));

        assertTrue(section.isSection());
        assertEquals("c2", section.getBody().get(0).getId());
        assertEquals("d1", section.getBody().get(1).getId());
    }

    @Test
    public void testNullIdIsRejected() {
        assertThrows(NullPointerException.class, () -> NodeDescriptor.declaration(null));
        assertThrows(NullPointerException.class, () -> NodeDescriptor.declaration("a", (String) null));
    }

    @Test
    public void testTypedSourceAccess() {
        NodeDescriptor section = NodeDescriptor.conditional("if_ok", Collections.singletonList("ok"), null)
                .withSource("ok == true");

        assertEquals(Optional.of("ok == true"), section.getSource(String.class));
        assertFalse(section.getSource(Integer.class).isPresent(), "类型不匹配时应返回空");
        assertFalse(NodeDescriptor.declaration("a").getSource().isPresent());
    }

    @Test
    public void testKindRanks() {
        assertTrue(NodeKind.DECLARATION.getRank() < NodeKind.INVOCATION.getRank());
        assertTrue(NodeKind.INVOCATION.getRank() < NodeKind.CONDITIONAL_SECTION.getRank());
        assertTrue(NodeKind.CONDITIONAL_SECTION.getRank() < NodeKind.ITERATION_SECTION.getRank());
        assertFalse(NodeKind.INVOCATION.isSection());
    }
}
