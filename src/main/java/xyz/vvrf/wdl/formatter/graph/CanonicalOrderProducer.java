package xyz.vvrf.wdl.formatter.graph;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import xyz.vvrf.wdl.formatter.core.CycleDetectedException;
import xyz.vvrf.wdl.formatter.core.NodeDescriptor;
import xyz.vvrf.wdl.formatter.core.OrderingInvariantException;

import java.util.*;
import java.util.stream.Collectors;

/**
 * 对 {@link BodyGraph} 做确定性的拓扑排序。
 * <p>
 * 使用按字典序的 Kahn 算法：可输出集合（入度为 0 且未输出的节点）按
 * {@link TieBreakKey} 排序，每次取出最小者。HEAD 作为第一个被取出的节点在内部消费，
 * 从不返回给调用方；悬空依赖（占位节点）及其出边在排序前被剪除。
 * <p>
 * 本类无状态，可安全地被多个作用域共享。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class CanonicalOrderProducer {

    /**
     * 返回惰性的单次迭代器。每次调用都会从同一张不可变图重新推导出新的序列。
     * 循环在迭代到无法继续时以 {@link CycleDetectedException} 抛出。
     */
    public Iterator<NodeDescriptor> order(BodyGraph graph) {
        Objects.requireNonNull(graph, "依赖图不能为空");
        return new CanonicalOrder(graph);
    }

    /**
     * 完整消费 {@link #order(BodyGraph)} 并返回不可变列表。
     */
    public List<NodeDescriptor> orderedList(BodyGraph graph) {
        List<NodeDescriptor> sorted = new ArrayList<>();
        order(graph).forEachRemaining(sorted::add);
        log.debug("Scope '{}': Topological sort successful. Order: {}", graph.getScopeName(),
                sorted.stream().map(NodeDescriptor::getId).collect(Collectors.toList()));
        return Collections.unmodifiableList(sorted);
    }

    /**
     * 响应式版本：每个订阅者都会得到一次新的排序。
     */
    public Flux<NodeDescriptor> orderFlux(BodyGraph graph) {
        Objects.requireNonNull(graph, "依赖图不能为空");
        return Flux.fromIterable(() -> order(graph));
    }

    private static final class CanonicalOrder implements Iterator<NodeDescriptor> {
        private static final Comparator<GraphNode> BY_KEY = Comparator.comparing(GraphNode::getKey);

        private final BodyGraph graph;
        private final Map<String, Integer> inDegree = new HashMap<>();
        private final NavigableSet<GraphNode> frontier = new TreeSet<>(BY_KEY);
        private final int total;
        private int emitted = 0;
        private boolean started = false;

        CanonicalOrder(BodyGraph graph) {
            this.graph = graph;
            List<GraphNode> defined = graph.getDefinedNodes();
            this.total = defined.size();

            // 只统计来自 HEAD 与已定义节点的边，占位节点的出边随其一并剪除
            for (GraphNode node : defined) {
                inDegree.put(node.getId(), 0);
            }
            countEdges(graph.getHead());
            for (GraphNode node : defined) {
                countEdges(node);
            }

            frontier.add(graph.getHead());
            for (GraphNode node : defined) {
                if (inDegree.get(node.getId()) == 0) {
                    frontier.add(node);
                }
            }
        }

        private void countEdges(GraphNode from) {
            for (String to : from.getSuccessors()) {
                inDegree.merge(to, 1, Integer::sum);
            }
        }

        @Override
        public boolean hasNext() {
            if (!started) {
                consumeHead();
            }
            if (!frontier.isEmpty()) {
                return true;
            }
            if (emitted < total) {
                throw new CycleDetectedException(graph.getScopeName(), unresolvedIds());
            }
            return false;
        }

        @Override
        public NodeDescriptor next() {
            if (!hasNext()) {
                throw new NoSuchElementException("Scope '" + graph.getScopeName() + "' 的排序已结束");
            }
            GraphNode node = frontier.pollFirst();
            release(node);
            emitted++;
            return node.getDescriptor()
                    .orElseThrow(() -> new OrderingInvariantException(graph.getScopeName(),
                            "Frontier yielded undefined node '" + node.getId() + "'."));
        }

        private void consumeHead() {
            started = true;
            GraphNode first = frontier.pollFirst();
            if (first == null || !first.isHead()) {
                throw new OrderingInvariantException(graph.getScopeName(),
                        "Sorted order did not start with HEAD, got " + first + ".");
            }
            release(first);
        }

        private void release(GraphNode node) {
            for (String successorId : node.getSuccessors()) {
                int remaining = inDegree.merge(successorId, -1, Integer::sum);
                if (remaining == 0) {
                    graph.getNode(successorId)
                            .filter(GraphNode::isDefined)
                            .ifPresent(frontier::add);
                }
            }
        }

        private List<String> unresolvedIds() {
            return graph.getDefinedNodes().stream()
                    .filter(node -> inDegree.get(node.getId()) > 0)
                    .sorted(BY_KEY)
                    .map(GraphNode::getId)
                    .collect(Collectors.toList());
        }
    }
}
