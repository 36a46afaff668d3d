package xyz.vvrf.wdl.formatter.graph;

import xyz.vvrf.wdl.formatter.core.NodeDescriptor;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * {@link BodyGraph} 中的一个节点（不可变）。
 * 三种形态：合成入口 HEAD、拥有完整定义的真实节点、
 * 只作为依赖被引用过的占位节点（descriptor 为 null）。
 *
 * @author ruifeng.wen
 */
public final class GraphNode {

    static final String HEAD_ID = "<HEAD>";

    private final String id;
    private final boolean head;
    private final NodeDescriptor descriptor;
    private final TieBreakKey key;
    private final List<String> successors; // 本节点 -> 依赖本节点的元素

    GraphNode(String id, boolean head, NodeDescriptor descriptor, TieBreakKey key, List<String> successors) {
        this.id = id;
        this.head = head;
        this.descriptor = descriptor;
        this.key = key;
        this.successors = Collections.unmodifiableList(successors);
    }

    public String getId() {
        return id;
    }

    public boolean isHead() {
        return head;
    }

    /**
     * 是否拥有完整定义。HEAD 与占位节点返回 false。
     */
    public boolean isDefined() {
        return descriptor != null;
    }

    public boolean isPlaceholder() {
        return !head && descriptor == null;
    }

    public Optional<NodeDescriptor> getDescriptor() {
        return Optional.ofNullable(descriptor);
    }

    public TieBreakKey getKey() {
        return key;
    }

    /**
     * 出边目标（依赖本节点的元素标识），按加边顺序。
     */
    public List<String> getSuccessors() {
        return successors;
    }

    @Override
    public String toString() {
        String state = head ? "HEAD" : (descriptor == null ? "placeholder" : descriptor.getKind().name());
        return String.format("GraphNode[id=%s, %s, key=%s, out=%s]", id, state, key, successors);
    }
}
