package xyz.vvrf.wdl.formatter.graph;

import org.junit.jupiter.api.Test;
import xyz.vvrf.wdl.formatter.core.DuplicateNodeException;
import xyz.vvrf.wdl.formatter.core.NodeKind;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;

import static org.junit.jupiter.api.Assertions.*;
import static xyz.vvrf.wdl.formatter.test.util.BodyFixtures.*;

/**
 * BodyGraphBuilder 单元测试
 *
 * 测试目标：
 * 1. HEAD 边与依赖边的建立
 * 2. 占位节点的创建与升级
 * 3. 排序键的分配（插入序号在首次出现时保留）
 * 4. 重复定义检测
 */
public class BodyGraphBuilderTest {

    @Test
    public void testElementsWithoutDependenciesHangOffHead() {
        BodyGraph graph = BodyGraphBuilder.of("wf", body(decl("a"), call("b", "a"), decl("c")));

        assertEquals(Arrays.asList("a", "c"), graph.getHead().getSuccessors(), "无依赖的元素应挂在 HEAD 下");
        assertEquals(Collections.singletonList("b"), graph.getNode("a").get().getSuccessors());
        assertEquals(3, graph.getEdgeCount());
        assertTrue(graph.getPlaceholderIds().isEmpty());
    }

    @Test
    public void testKeysCombineKindRankAndInsertionIndex() {
        BodyGraph graph = BodyGraphBuilder.of("wf", body(call("b"), decl("a")));

        TieBreakKey b = graph.getNode("b").get().getKey();
        TieBreakKey a = graph.getNode("a").get().getKey();
        assertEquals(NodeKind.INVOCATION.getRank(), b.getKindRank());
        assertEquals(1, b.getInsertionIndex());
        assertEquals(NodeKind.DECLARATION.getRank(), a.getKindRank());
        assertEquals(2, a.getInsertionIndex());
        assertTrue(a.compareTo(b) < 0, "声明的排序键应小于调用");
        assertTrue(graph.getHead().getKey().compareTo(a) < 0, "HEAD 的排序键应小于所有节点");
    }

    @Test
    public void testPlaceholderIsUpgradedAndKeepsItsInsertionSlot() {
        BodyGraph graph = BodyGraphBuilder.of("wf", body(call("c", "p"), decl("q"), decl("p")));

        GraphNode p = graph.getNode("p").get();
        assertTrue(p.isDefined(), "占位节点应获得完整定义");
        assertEquals(2, p.getKey().getInsertionIndex(), "插入序号应在首次被引用时确定");
        assertEquals(NodeKind.DECLARATION.getRank(), p.getKey().getKindRank());
        assertEquals(3, graph.getNode("q").get().getKey().getInsertionIndex());
        assertEquals(Collections.singletonList("c"), p.getSuccessors());
    }

    @Test
    public void testUndefinedDependencyStaysPlaceholder() {
        BodyGraph graph = BodyGraphBuilder.of("wf", body(decl("a", "ghost")));

        GraphNode ghost = graph.getNode("ghost").get();
        assertTrue(ghost.isPlaceholder());
        assertFalse(ghost.getDescriptor().isPresent());
        assertEquals(new LinkedHashSet<>(Collections.singletonList("ghost")), graph.getPlaceholderIds());
        assertEquals(1, graph.getDefinedNodes().size());
        assertTrue(graph.getHead().getSuccessors().isEmpty(), "有依赖的元素不应挂在 HEAD 下");
    }

    @Test
    public void testSecondFullDefinitionIsRejected() {
        BodyGraphBuilder builder = new BodyGraphBuilder("wf").add(decl("x"));

        DuplicateNodeException e = assertThrows(DuplicateNodeException.class, () -> builder.add(call("x")));
        assertEquals("x", e.getNodeId());
        assertEquals("wf", e.getScopeName());
    }

    @Test
    public void testDefinitionAfterPlaceholderThenAgainIsRejected() {
        BodyGraphBuilder builder = new BodyGraphBuilder("wf")
                .add(call("c", "x"))
                .add(decl("x"));

        assertThrows(DuplicateNodeException.class, () -> builder.add(decl("x")));
    }

    @Test
    public void testBuilderIsClosedAfterBuild() {
        BodyGraphBuilder builder = new BodyGraphBuilder("wf").add(decl("a"));
        builder.build();

        assertThrows(IllegalStateException.class, () -> builder.add(decl("b")));
    }

    @Test
    public void testEmptyScope() {
        BodyGraph graph = BodyGraphBuilder.of("wf", Collections.emptyList());

        assertTrue(graph.isEmpty());
        assertEquals(0, graph.getEdgeCount());
    }
}
