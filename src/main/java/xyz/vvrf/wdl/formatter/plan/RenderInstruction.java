package xyz.vvrf.wdl.formatter.plan;

/**
 * 渲染计划中的一条指令。
 * 仅有 {@link DeclarationBatch}、{@link InvocationItem}、{@link SectionItem} 三种实现，
 * 构造器为包私有以保持类型封闭。
 *
 * @author ruifeng.wen
 */
public abstract class RenderInstruction {

    RenderInstruction() {
    }

    public abstract <R> R accept(RenderPlanVisitor<R> visitor);
}
