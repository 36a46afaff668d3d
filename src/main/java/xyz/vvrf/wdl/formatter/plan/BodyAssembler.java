package xyz.vvrf.wdl.formatter.plan;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.wdl.formatter.core.BodyOrderingException;
import xyz.vvrf.wdl.formatter.core.NodeDescriptor;
import xyz.vvrf.wdl.formatter.graph.BodyGraph;
import xyz.vvrf.wdl.formatter.graph.BodyGraphBuilder;
import xyz.vvrf.wdl.formatter.graph.CanonicalOrderProducer;
import xyz.vvrf.wdl.formatter.monitor.AssemblyMonitorListener;
import xyz.vvrf.wdl.formatter.util.BodyGraphDotExporter;
import xyz.vvrf.wdl.formatter.util.RenderPlanPrinter;

import java.time.Duration;
import java.util.*;

/**
 * 将一个作用域的元素装配为 {@link RenderPlan}。
 * <p>
 * 每个作用域都构建一张新的依赖图并求出规范顺序，随后沿该顺序：
 * 连续的声明合并为一个 {@link DeclarationBatch}；调用直接输出为 {@link InvocationItem}；
 * 条件块和迭代块对其嵌套主体递归装配后输出为 {@link SectionItem}。
 * 排序错误在检测到的作用域记录一次，然后原样向上传播。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class BodyAssembler {

    public static final String DEFAULT_ROOT_SCOPE_NAME = "workflow";

    private final CanonicalOrderProducer orderProducer;
    private final List<AssemblyMonitorListener> monitorListeners;
    private final String rootScopeName;
    private final boolean logGraphDot;
    private final boolean logRenderPlan;

    public BodyAssembler() {
        this(new CanonicalOrderProducer(), Collections.emptyList(), DEFAULT_ROOT_SCOPE_NAME, false, false);
    }

    /**
     * @param orderProducer    规范顺序生成器
     * @param monitorListeners 监听器列表 (可为空)
     * @param rootScopeName    未显式命名时顶层作用域的名称
     * @param logGraphDot      是否在 DEBUG 级别输出每个作用域依赖图的 DOT 描述
     * @param logRenderPlan    是否在 DEBUG 级别输出顶层渲染计划的文本结构
     */
    public BodyAssembler(CanonicalOrderProducer orderProducer,
                         List<AssemblyMonitorListener> monitorListeners,
                         String rootScopeName,
                         boolean logGraphDot,
                         boolean logRenderPlan) {
        this.orderProducer = Objects.requireNonNull(orderProducer, "CanonicalOrderProducer 不能为空");
        this.monitorListeners = (monitorListeners != null)
                ? Collections.unmodifiableList(new ArrayList<>(monitorListeners))
                : Collections.emptyList();
        this.rootScopeName = Objects.requireNonNull(rootScopeName, "顶层作用域名称不能为空");
        this.logGraphDot = logGraphDot;
        this.logRenderPlan = logRenderPlan;
    }

    public RenderPlan assemble(List<NodeDescriptor> elements) {
        return assemble(rootScopeName, elements);
    }

    /**
     * 装配指定名称的作用域。
     *
     * @throws xyz.vvrf.wdl.formatter.core.DuplicateNodeException      同一作用域内的重复定义
     * @throws xyz.vvrf.wdl.formatter.core.CycleDetectedException      作用域内的依赖循环
     * @throws xyz.vvrf.wdl.formatter.core.OrderingInvariantException 排序内部一致性错误
     */
    public RenderPlan assemble(String scopeName, List<NodeDescriptor> elements) {
        Objects.requireNonNull(scopeName, "作用域名称不能为空");
        Objects.requireNonNull(elements, "元素列表不能为空");

        RenderPlan plan = assembleScope(scopeName, elements);
        if (logRenderPlan && log.isDebugEnabled()) {
            log.debug("Scope '{}' 渲染计划:\n{}", scopeName, RenderPlanPrinter.print(plan));
        }
        return plan;
    }

    public String getRootScopeName() {
        return rootScopeName;
    }

    public List<AssemblyMonitorListener> getMonitorListeners() {
        return monitorListeners;
    }

    boolean isLogRenderPlan() {
        return logRenderPlan;
    }

    CanonicalOrderProducer getOrderProducer() {
        return orderProducer;
    }

    private RenderPlan assembleScope(String scopeName, List<NodeDescriptor> elements) {
        long startNanos = System.nanoTime();
        try {
            BodyGraph graph = buildGraph(scopeName, elements);
            // 先完成本作用域的排序，再递归进入嵌套主体
            List<NodeDescriptor> order = orderProducer.orderedList(graph);
            List<RenderInstruction> instructions = walk(order.iterator(), new ItemFactory<RenderInstruction>() {
                @Override
                public RenderInstruction batch(List<NodeDescriptor> declarations) {
                    return new DeclarationBatch(declarations);
                }

                @Override
                public RenderInstruction invocation(NodeDescriptor invocation) {
                    return new InvocationItem(invocation);
                }

                @Override
                public RenderInstruction section(NodeDescriptor section) {
                    return new SectionItem(section, assembleScope(nestedScopeName(scopeName, section), section.getBody()));
                }
            });

            RenderPlan plan = new RenderPlan(instructions);
            Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
            log.debug("Scope '{}': 装配完成。{} 个元素 -> {} 条指令, 耗时 {}ms",
                    scopeName, elements.size(), plan.size(), duration.toMillis());
            notifyAssembled(monitorListeners, scopeName, elements.size(), duration, plan);
            return plan;
        } catch (BodyOrderingException e) {
            if (scopeName.equals(e.getScopeName())) {
                log.error("Scope '{}' 排序失败: {}", scopeName, e.getMessage());
                notifyFailed(monitorListeners, scopeName, Duration.ofNanos(System.nanoTime() - startNanos), e);
            }
            throw e;
        }
    }

    BodyGraph buildGraph(String scopeName, List<NodeDescriptor> elements) {
        BodyGraph graph = BodyGraphBuilder.of(scopeName, elements);
        if (logGraphDot && log.isDebugEnabled()) {
            log.debug("Scope '{}' DOT 图形描述:\n--- DOT BEGIN ---\n{}--- DOT END ---",
                    scopeName, BodyGraphDotExporter.toDot(graph));
        }
        return graph;
    }

    static String nestedScopeName(String parentScopeName, NodeDescriptor section) {
        return parentScopeName + "/" + section.getId();
    }

    /**
     * 沿规范顺序遍历，合并连续声明，其余元素逐个交给工厂。
     * 同步与响应式装配器共用此逻辑。
     */
    static <T> List<T> walk(Iterator<NodeDescriptor> order, ItemFactory<T> factory) {
        List<T> items = new ArrayList<>();
        List<NodeDescriptor> openBatch = new ArrayList<>();

        while (order.hasNext()) {
            NodeDescriptor node = order.next();
            switch (node.getKind()) {
                case DECLARATION:
                    openBatch.add(node);
                    break;
                case INVOCATION:
                    flush(openBatch, items, factory);
                    items.add(factory.invocation(node));
                    break;
                case CONDITIONAL_SECTION:
                case ITERATION_SECTION:
                    flush(openBatch, items, factory);
                    items.add(factory.section(node));
                    break;
                default:
                    throw new IllegalStateException("未知的元素种类: " + node.getKind());
            }
        }
        flush(openBatch, items, factory);
        return items;
    }

    private static <T> void flush(List<NodeDescriptor> openBatch, List<T> items, ItemFactory<T> factory) {
        if (!openBatch.isEmpty()) {
            items.add(factory.batch(new ArrayList<>(openBatch)));
            openBatch.clear();
        }
    }

    static void notifyAssembled(List<AssemblyMonitorListener> listeners, String scopeName, int elementCount,
                                Duration duration, RenderPlan plan) {
        for (AssemblyMonitorListener listener : listeners) {
            try {
                listener.onScopeAssembled(scopeName, elementCount, duration, plan);
            } catch (Exception e) {
                log.error("监听器 {} 处理 onScopeAssembled 失败 (scope '{}')", listener.getClass().getSimpleName(), scopeName, e);
            }
        }
    }

    static void notifyFailed(List<AssemblyMonitorListener> listeners, String scopeName, Duration duration, Throwable error) {
        for (AssemblyMonitorListener listener : listeners) {
            try {
                listener.onScopeFailed(scopeName, duration, error);
            } catch (Exception e) {
                log.error("监听器 {} 处理 onScopeFailed 失败 (scope '{}')", listener.getClass().getSimpleName(), scopeName, e);
            }
        }
    }

    interface ItemFactory<T> {
        T batch(List<NodeDescriptor> declarations);

        T invocation(NodeDescriptor invocation);

        T section(NodeDescriptor section);
    }
}
