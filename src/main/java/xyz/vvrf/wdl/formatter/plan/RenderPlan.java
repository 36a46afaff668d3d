package xyz.vvrf.wdl.formatter.plan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 单个作用域的有序渲染指令序列（不可变）。
 * 块指令内嵌其主体的计划，整体构成与文档嵌套结构一致的树。
 *
 * @author ruifeng.wen
 */
public final class RenderPlan {

    private static final RenderPlan EMPTY = new RenderPlan(Collections.emptyList());

    private final List<RenderInstruction> instructions;

    public RenderPlan(List<RenderInstruction> instructions) {
        Objects.requireNonNull(instructions, "渲染指令列表不能为空");
        this.instructions = Collections.unmodifiableList(new ArrayList<>(instructions));
    }

    public static RenderPlan empty() {
        return EMPTY;
    }

    public List<RenderInstruction> getInstructions() {
        return instructions;
    }

    public int size() {
        return instructions.size();
    }

    public boolean isEmpty() {
        return instructions.isEmpty();
    }

    /**
     * 依次对每条指令应用访问者，结果保持指令顺序。
     */
    public <R> List<R> accept(RenderPlanVisitor<R> visitor) {
        List<R> results = new ArrayList<>(instructions.size());
        for (RenderInstruction instruction : instructions) {
            results.add(instruction.accept(visitor));
        }
        return results;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return instructions.equals(((RenderPlan) o).instructions);
    }

    @Override
    public int hashCode() {
        return instructions.hashCode();
    }

    @Override
    public String toString() {
        return "RenderPlan" + instructions;
    }
}
