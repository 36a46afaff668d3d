package xyz.vvrf.wdl.formatter.util;

import xyz.vvrf.wdl.formatter.graph.BodyGraph;
import xyz.vvrf.wdl.formatter.graph.GraphNode;

/**
 * 将 {@link BodyGraph} 导出为 Graphviz DOT 描述，便于排查排序结果。
 * HEAD 画为实心点，悬空依赖（占位节点）画为虚线框。
 *
 * @author ruifeng.wen
 */
public final class BodyGraphDotExporter {

    private BodyGraphDotExporter() {}

    public static String toDot(BodyGraph graph) {
        StringBuilder dot = new StringBuilder();
        String safeScopeName = escapeDotString(graph.getScopeName());

        dot.append(String.format("digraph \"%s\" {\n", safeScopeName));
        dot.append("  rankdir=TB;\n");
        dot.append(String.format("  label=\"%s\";\n", safeScopeName));
        dot.append("  node [shape=box, style=rounded];\n");

        GraphNode head = graph.getHead();
        dot.append(String.format("  \"%s\" [shape=point];\n", escapeDotString(head.getId())));

        for (GraphNode node : graph.getNodes()) {
            String id = escapeDotString(node.getId());
            if (node.isPlaceholder()) {
                dot.append(String.format("  \"%s\" [label=\"%s\\n(undefined)\", style=dashed, color=gray];\n", id, id));
            } else {
                String kind = node.getDescriptor().map(d -> d.getKind().name()).orElse("");
                dot.append(String.format("  \"%s\" [label=\"%s\\n%s %s\"];\n", id, id, kind, node.getKey()));
            }
        }

        appendEdges(dot, head);
        for (GraphNode node : graph.getNodes()) {
            appendEdges(dot, node);
        }

        dot.append("}\n");
        return dot.toString();
    }

    private static void appendEdges(StringBuilder dot, GraphNode from) {
        String fromId = escapeDotString(from.getId());
        String style = from.isPlaceholder() ? " [style=dashed, color=gray]" : "";
        for (String to : from.getSuccessors()) {
            dot.append(String.format("  \"%s\" -> \"%s\"%s;\n", fromId, escapeDotString(to), style));
        }
    }

    private static String escapeDotString(String input) {
        if (input == null) {
            return "";
        }
        return input.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
