package xyz.vvrf.wdl.formatter.core;

import java.util.*;

/**
 * 描述工作流主体中的一个元素（不可变数据类）。
 * 包含作用域内唯一的标识、元素种类、所依赖的标识集合，
 * 以及（仅限条件块 / 迭代块）其独占的嵌套主体。
 * <p>
 * {@code source} 为来自文档模型的原始节点（例如条件表达式或 scatter 源），
 * 排序过程从不读取它，只原样交给渲染阶段。
 *
 * @author ruifeng.wen
 */
public final class NodeDescriptor {
    private final String id;
    private final NodeKind kind;
    private final Set<String> dependencies;
    private final List<NodeDescriptor> body;
    private final Object source;

    /**
     * 创建元素描述。
     *
     * @param id           作用域内唯一标识 (非空)。
     * @param kind         元素种类 (非空)。
     * @param dependencies 依赖的标识集合 (可为 null 或空，表示仅依赖作用域入口；将被复制并保持顺序)。
     * @param body         嵌套主体 (仅块类型可非空；可为 null)。
     * @param source       原始文档节点 (可为 null)。
     * @throws IllegalArgumentException 如果非块类型携带了嵌套主体
     */
    public NodeDescriptor(String id, NodeKind kind, Collection<String> dependencies,
                          List<NodeDescriptor> body, Object source) {
        this.id = Objects.requireNonNull(id, "元素标识不能为空");
        this.kind = Objects.requireNonNull(kind, "元素种类不能为空");
        Set<String> deps = new LinkedHashSet<>();
        if (dependencies != null) {
            for (String dep : dependencies) {
                deps.add(Objects.requireNonNull(dep, "元素 '" + id + "' 的依赖标识不能为空"));
            }
        }
        this.dependencies = Collections.unmodifiableSet(deps);
        if (body != null && !body.isEmpty() && !kind.isSection()) {
            throw new IllegalArgumentException(String.format("元素 '%s' 的种类 %s 不能拥有嵌套主体。", id, kind));
        }
        this.body = (body == null)
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(body));
        this.source = source;
    }

    public static NodeDescriptor declaration(String id, String... dependencies) {
        return new NodeDescriptor(id, NodeKind.DECLARATION, Arrays.asList(dependencies), null, null);
    }

    public static NodeDescriptor invocation(String id, String... dependencies) {
        return new NodeDescriptor(id, NodeKind.INVOCATION, Arrays.asList(dependencies), null, null);
    }

    public static NodeDescriptor conditional(String id, Collection<String> dependencies, List<NodeDescriptor> body) {
        return new NodeDescriptor(id, NodeKind.CONDITIONAL_SECTION, dependencies, body, null);
    }

    public static NodeDescriptor iteration(String id, Collection<String> dependencies, List<NodeDescriptor> body) {
        return new NodeDescriptor(id, NodeKind.ITERATION_SECTION, dependencies, body, null);
    }

    /**
     * 返回附带了原始文档节点的副本。
     */
    public NodeDescriptor withSource(Object source) {
        return new NodeDescriptor(id, kind, dependencies, body, source);
    }

    // --- Getters ---

    public String getId() {
        return id;
    }

    public NodeKind getKind() {
        return kind;
    }

    /**
     * 获取依赖标识集合（不可变，保持声明顺序）。
     * 空集合表示仅依赖作用域入口。
     */
    public Set<String> getDependencies() {
        return dependencies;
    }

    /**
     * 获取嵌套主体（不可变）。非块类型总是返回空列表。
     */
    public List<NodeDescriptor> getBody() {
        return body;
    }

    public Optional<Object> getSource() {
        return Optional.ofNullable(source);
    }

    /**
     * 安全获取特定类型原始节点的辅助方法。
     *
     * @param expectedType 期望的类型 Class 对象。
     * @return 包含原始节点的 Optional，如果为 null 或类型不匹配则为空。
     */
    public <T> Optional<T> getSource(Class<T> expectedType) {
        return getSource()
                .filter(expectedType::isInstance)
                .map(expectedType::cast);
    }

    public boolean isSection() {
        return kind.isSection();
    }

    // --- equals, hashCode, toString ---

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NodeDescriptor that = (NodeDescriptor) o;
        return id.equals(that.id) &&
                kind == that.kind &&
                dependencies.equals(that.dependencies) &&
                body.equals(that.body) &&
                Objects.equals(source, that.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, kind, dependencies, body, source);
    }

    @Override
    public String toString() {
        return String.format("Node[id=%s, kind=%s, deps=%s, body=%d]",
                id, kind, dependencies, body.size());
    }
}
