package xyz.vvrf.wdl.formatter.plan;

import xyz.vvrf.wdl.formatter.core.NodeDescriptor;
import xyz.vvrf.wdl.formatter.core.NodeKind;

import java.util.Objects;

/**
 * 单个调用。
 *
 * @author ruifeng.wen
 */
public final class InvocationItem extends RenderInstruction {

    private final NodeDescriptor invocation;

    public InvocationItem(NodeDescriptor invocation) {
        this.invocation = Objects.requireNonNull(invocation, "调用元素不能为空");
        if (invocation.getKind() != NodeKind.INVOCATION) {
            throw new IllegalArgumentException("期望调用元素，实际为: " + invocation);
        }
    }

    public NodeDescriptor getInvocation() {
        return invocation;
    }

    @Override
    public <R> R accept(RenderPlanVisitor<R> visitor) {
        return visitor.visitInvocation(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return invocation.equals(((InvocationItem) o).invocation);
    }

    @Override
    public int hashCode() {
        return invocation.hashCode();
    }

    @Override
    public String toString() {
        return "Invocation[" + invocation.getId() + "]";
    }
}
