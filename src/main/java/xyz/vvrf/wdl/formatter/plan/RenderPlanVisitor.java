package xyz.vvrf.wdl.formatter.plan;

/**
 * 渲染计划的访问者。外部文本渲染器实现此接口，
 * 三种指令各有一个方法，新增指令类型时编译器会强制所有实现补齐。
 *
 * @param <R> 访问结果类型
 * @author ruifeng.wen
 */
public interface RenderPlanVisitor<R> {

    R visitDeclarationBatch(DeclarationBatch batch);

    R visitInvocation(InvocationItem invocation);

    R visitSection(SectionItem section);
}
