package xyz.vvrf.wdl.formatter.util;

import org.junit.jupiter.api.Test;
import xyz.vvrf.wdl.formatter.plan.BodyAssembler;
import xyz.vvrf.wdl.formatter.plan.RenderPlan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static xyz.vvrf.wdl.formatter.test.util.BodyFixtures.*;

public class RenderPlanPrinterTest {

    @Test
    public void testPrintsNestedOutline() {
        RenderPlan plan = new BodyAssembler().assemble(body(
                decl("a"),
                decl("b"),
                call("c", "a"),
                scatter("s", deps("c"), call("d"), cond("if_x", deps("d"), decl("y")))));

        String expected = "decls [a, b]\n" +
                "call c\n" +
                "scatter s\n" +
                "  call d\n" +
                "  if if_x\n" +
                "    decls [y]\n";
        assertEquals(expected, RenderPlanPrinter.print(plan));
    }

    @Test
    public void testEmptyPlanPrintsNothing() {
        assertEquals("", RenderPlanPrinter.print(RenderPlan.empty()));
    }
}
