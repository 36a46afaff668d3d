package xyz.vvrf.wdl.formatter.plan;

import xyz.vvrf.wdl.formatter.core.NodeDescriptor;
import xyz.vvrf.wdl.formatter.core.NodeKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 连续声明组成的一批，渲染时作为一个紧凑的声明块输出。
 *
 * @author ruifeng.wen
 */
public final class DeclarationBatch extends RenderInstruction {

    private final List<NodeDescriptor> declarations;

    public DeclarationBatch(List<NodeDescriptor> declarations) {
        if (declarations == null || declarations.isEmpty()) {
            throw new IllegalArgumentException("声明批次不能为空");
        }
        for (NodeDescriptor declaration : declarations) {
            if (declaration.getKind() != NodeKind.DECLARATION) {
                throw new IllegalArgumentException("声明批次只能包含声明，实际为: " + declaration);
            }
        }
        this.declarations = Collections.unmodifiableList(new ArrayList<>(declarations));
    }

    public List<NodeDescriptor> getDeclarations() {
        return declarations;
    }

    @Override
    public <R> R accept(RenderPlanVisitor<R> visitor) {
        return visitor.visitDeclarationBatch(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return declarations.equals(((DeclarationBatch) o).declarations);
    }

    @Override
    public int hashCode() {
        return declarations.hashCode();
    }

    @Override
    public String toString() {
        return "DeclarationBatch" + declarations.stream().map(NodeDescriptor::getId).collect(Collectors.toList());
    }
}
