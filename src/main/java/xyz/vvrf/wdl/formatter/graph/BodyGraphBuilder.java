package xyz.vvrf.wdl.formatter.graph;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.wdl.formatter.core.DuplicateNodeException;
import xyz.vvrf.wdl.formatter.core.NodeDescriptor;

import java.util.*;

/**
 * 以编程方式构建单个作用域的 {@link BodyGraph}。
 * <p>
 * 元素按调用方给出的顺序加入；该顺序只决定插入序号，不携带其他语义。
 * 依赖可以先于其定义出现（此时创建占位节点），但同一标识只能有一个完整定义。
 * 构建阶段不检测循环，循环由 {@link CanonicalOrderProducer} 在排序时发现。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class BodyGraphBuilder {

    private final String scopeName;
    private final Map<String, Slot> slots = new LinkedHashMap<>();
    private final List<String> headSuccessors = new ArrayList<>();
    private int nextInsertionIndex = 1; // 0 保留给 HEAD
    private boolean built = false;

    public BodyGraphBuilder(String scopeName) {
        this.scopeName = Objects.requireNonNull(scopeName, "作用域名称不能为空");
    }

    /**
     * 便捷方法：按顺序加入全部元素并构建。
     */
    public static BodyGraph of(String scopeName, Collection<NodeDescriptor> elements) {
        return new BodyGraphBuilder(scopeName).addAll(elements).build();
    }

    public BodyGraphBuilder addAll(Collection<NodeDescriptor> elements) {
        Objects.requireNonNull(elements, "元素列表不能为空");
        for (NodeDescriptor element : elements) {
            add(element);
        }
        return this;
    }

    /**
     * 注册一个元素的完整定义，并为其依赖加边。
     *
     * @throws DuplicateNodeException 如果该标识已有完整定义
     */
    public BodyGraphBuilder add(NodeDescriptor element) {
        Objects.requireNonNull(element, "元素不能为空");
        if (built) {
            throw new IllegalStateException(String.format("Scope '%s': 图已构建，无法继续添加元素 '%s'。", scopeName, element.getId()));
        }

        String id = element.getId();
        Slot slot = slots.get(id);
        if (slot == null) {
            slot = newSlot(id);
        } else if (slot.descriptor != null) {
            throw new DuplicateNodeException(scopeName, id);
        } else {
            log.debug("Scope '{}': 占位节点 '{}' 获得完整定义 (插入序号 {})", scopeName, id, slot.insertionIndex);
        }
        slot.descriptor = element;

        if (element.getDependencies().isEmpty()) {
            headSuccessors.add(id);
        } else {
            for (String dep : element.getDependencies()) {
                Slot depSlot = slots.get(dep);
                if (depSlot == null) {
                    depSlot = newSlot(dep);
                    log.debug("Scope '{}': 为依赖 '{}' 创建占位节点 (被 '{}' 引用)", scopeName, dep, id);
                }
                depSlot.successors.add(id);
            }
        }
        return this;
    }

    public BodyGraph build() {
        built = true;
        GraphNode head = new GraphNode(GraphNode.HEAD_ID, true, null, TieBreakKey.HEAD, new ArrayList<>(headSuccessors));

        Map<String, GraphNode> nodes = new LinkedHashMap<>();
        for (Slot slot : slots.values()) {
            TieBreakKey key = (slot.descriptor == null)
                    ? TieBreakKey.placeholder(slot.insertionIndex)
                    : TieBreakKey.of(slot.descriptor.getKind(), slot.insertionIndex);
            nodes.put(slot.id, new GraphNode(slot.id, false, slot.descriptor, key, new ArrayList<>(slot.successors)));
        }

        BodyGraph graph = new BodyGraph(scopeName, head, nodes);
        log.debug("Scope '{}': 依赖图构建完成。{} 个节点, {} 条边, 悬空依赖: {}",
                scopeName, nodes.size(), graph.getEdgeCount(), graph.getPlaceholderIds());
        return graph;
    }

    private Slot newSlot(String id) {
        Slot slot = new Slot(id, nextInsertionIndex++);
        slots.put(id, slot);
        return slot;
    }

    // 构建期间的可变节点，build() 时冻结为 GraphNode
    private static final class Slot {
        final String id;
        final int insertionIndex;
        final List<String> successors = new ArrayList<>();
        NodeDescriptor descriptor;

        Slot(String id, int insertionIndex) {
            this.id = id;
            this.insertionIndex = insertionIndex;
        }
    }
}
