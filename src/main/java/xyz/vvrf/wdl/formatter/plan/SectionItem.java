package xyz.vvrf.wdl.formatter.plan;

import xyz.vvrf.wdl.formatter.core.NodeDescriptor;

import java.util.Objects;

/**
 * 条件块或迭代块，携带块本身（用于渲染块头，如条件表达式或迭代源）
 * 以及其嵌套主体的独立渲染计划。
 *
 * @author ruifeng.wen
 */
public final class SectionItem extends RenderInstruction {

    private final NodeDescriptor section;
    private final RenderPlan body;

    public SectionItem(NodeDescriptor section, RenderPlan body) {
        this.section = Objects.requireNonNull(section, "块元素不能为空");
        this.body = Objects.requireNonNull(body, "块 '" + section.getId() + "' 的嵌套计划不能为空");
        if (!section.isSection()) {
            throw new IllegalArgumentException("期望条件块或迭代块，实际为: " + section);
        }
    }

    public NodeDescriptor getSection() {
        return section;
    }

    public RenderPlan getBody() {
        return body;
    }

    @Override
    public <R> R accept(RenderPlanVisitor<R> visitor) {
        return visitor.visitSection(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SectionItem that = (SectionItem) o;
        return section.equals(that.section) && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(section, body);
    }

    @Override
    public String toString() {
        return "Section[" + section.getId() + " " + section.getKind() + " " + body + "]";
    }
}
