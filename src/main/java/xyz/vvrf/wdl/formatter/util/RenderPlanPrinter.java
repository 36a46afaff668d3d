package xyz.vvrf.wdl.formatter.util;

import xyz.vvrf.wdl.formatter.core.NodeDescriptor;
import xyz.vvrf.wdl.formatter.plan.DeclarationBatch;
import xyz.vvrf.wdl.formatter.plan.InvocationItem;
import xyz.vvrf.wdl.formatter.plan.RenderPlan;
import xyz.vvrf.wdl.formatter.plan.RenderPlanVisitor;
import xyz.vvrf.wdl.formatter.plan.SectionItem;

import java.util.stream.Collectors;

/**
 * 以缩进文本输出渲染计划的结构，每条指令一行。例如：
 * <pre>
 * decls [a, b]
 * call c
 * scatter s
 *   call d
 * </pre>
 *
 * @author ruifeng.wen
 */
public final class RenderPlanPrinter {

    private static final String INDENT = "  ";

    private RenderPlanPrinter() {}

    public static String print(RenderPlan plan) {
        StringBuilder out = new StringBuilder();
        print(plan, 0, out);
        return out.toString();
    }

    private static void print(RenderPlan plan, int depth, StringBuilder out) {
        plan.accept(new RenderPlanVisitor<Void>() {
            @Override
            public Void visitDeclarationBatch(DeclarationBatch batch) {
                line(out, depth, "decls " + batch.getDeclarations().stream()
                        .map(NodeDescriptor::getId)
                        .collect(Collectors.toList()));
                return null;
            }

            @Override
            public Void visitInvocation(InvocationItem invocation) {
                line(out, depth, "call " + invocation.getInvocation().getId());
                return null;
            }

            @Override
            public Void visitSection(SectionItem section) {
                NodeDescriptor node = section.getSection();
                String keyword;
                switch (node.getKind()) {
                    case CONDITIONAL_SECTION:
                        keyword = "if";
                        break;
                    case ITERATION_SECTION:
                        keyword = "scatter";
                        break;
                    default:
                        throw new IllegalStateException("非块元素出现在块指令中: " + node);
                }
                line(out, depth, keyword + " " + node.getId());
                print(section.getBody(), depth + 1, out);
                return null;
            }
        });
    }

    private static void line(StringBuilder out, int depth, String text) {
        for (int i = 0; i < depth; i++) {
            out.append(INDENT);
        }
        out.append(text).append('\n');
    }
}
