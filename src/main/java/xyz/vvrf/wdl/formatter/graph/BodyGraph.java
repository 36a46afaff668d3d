package xyz.vvrf.wdl.formatter.graph;

import java.util.*;
import java.util.stream.Collectors;

/**
 * 单个作用域的依赖图（不可变的数据结构）。
 * 由 {@link BodyGraphBuilder} 构建，由 {@link CanonicalOrderProducer} 读取。
 * 每个作用域（顶层主体或任一块的嵌套主体）各自拥有一张新图，互不共享。
 *
 * @author ruifeng.wen
 */
public final class BodyGraph {

    private final String scopeName;
    private final GraphNode head;
    private final Map<String, GraphNode> nodes; // 不含 HEAD，按首次出现顺序

    BodyGraph(String scopeName, GraphNode head, Map<String, GraphNode> nodes) {
        this.scopeName = scopeName;
        this.head = head;
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
    }

    public String getScopeName() {
        return scopeName;
    }

    /**
     * 合成入口节点，不会出现在排序结果中。
     */
    public GraphNode getHead() {
        return head;
    }

    public Optional<GraphNode> getNode(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    /**
     * 获取除 HEAD 外的所有节点（含占位节点），按首次出现的顺序。
     */
    public Collection<GraphNode> getNodes() {
        return nodes.values();
    }

    /**
     * 获取拥有完整定义的节点。
     */
    public List<GraphNode> getDefinedNodes() {
        return nodes.values().stream()
                .filter(GraphNode::isDefined)
                .collect(Collectors.toList());
    }

    /**
     * 获取只被引用、从未定义的标识（悬空依赖）。
     */
    public Set<String> getPlaceholderIds() {
        return nodes.values().stream()
                .filter(GraphNode::isPlaceholder)
                .map(GraphNode::getId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public int getEdgeCount() {
        int count = head.getSuccessors().size();
        for (GraphNode node : nodes.values()) {
            count += node.getSuccessors().size();
        }
        return count;
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("BodyGraph[scope=%s, nodes=%d, edges=%d]", scopeName, nodes.size(), getEdgeCount());
    }
}
