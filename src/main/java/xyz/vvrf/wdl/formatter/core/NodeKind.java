package xyz.vvrf.wdl.formatter.core;

/**
 * 工作流主体中元素的种类。
 * 声明顺序即排序优先级 (rank)：同一作用域内互不依赖的元素，
 * rank 较小的先输出。
 *
 * @author ruifeng.wen
 */
public enum NodeKind {
    /**
     * 变量声明。
     */
    DECLARATION(0),

    /**
     * 子单元调用 (call)。
     */
    INVOCATION(1),

    /**
     * 条件块 (if)，拥有嵌套主体。
     */
    CONDITIONAL_SECTION(2),

    /**
     * 迭代块 (scatter)，拥有嵌套主体。
     */
    ITERATION_SECTION(3);

    private final int rank;

    NodeKind(int rank) {
        this.rank = rank;
    }

    public int getRank() {
        return rank;
    }

    /**
     * 是否为拥有嵌套主体的块。
     */
    public boolean isSection() {
        return this == CONDITIONAL_SECTION || this == ITERATION_SECTION;
    }
}
