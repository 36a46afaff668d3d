package xyz.vvrf.wdl.formatter.util;

import org.junit.jupiter.api.Test;
import xyz.vvrf.wdl.formatter.graph.BodyGraphBuilder;

import static org.junit.jupiter.api.Assertions.*;
import static xyz.vvrf.wdl.formatter.test.util.BodyFixtures.*;

public class BodyGraphDotExporterTest {

    @Test
    public void testExportsHeadNodesPlaceholdersAndEdges() {
        String dot = BodyGraphDotExporter.toDot(BodyGraphBuilder.of("wf \"main\"",
                body(decl("a"), call("b", "a", "ghost"))));

        assertTrue(dot.startsWith("digraph \"wf \\\"main\\\"\" {\n"), "作用域名称中的引号应被转义");
        assertTrue(dot.contains("\"<HEAD>\" [shape=point];"));
        assertTrue(dot.contains("\"a\" [label=\"a\\nDECLARATION (0, 1)\"];"));
        assertTrue(dot.contains("\"ghost\" [label=\"ghost\\n(undefined)\", style=dashed, color=gray];"));
        assertTrue(dot.contains("\"<HEAD>\" -> \"a\";"));
        assertTrue(dot.contains("\"a\" -> \"b\";"));
        assertTrue(dot.contains("\"ghost\" -> \"b\" [style=dashed, color=gray];"));
        assertTrue(dot.endsWith("}\n"));
    }
}
