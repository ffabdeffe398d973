package com.modeling.dae.visitor;

import com.modeling.dae.ast.*;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static com.modeling.dae.ast.Expression.*;
import static org.junit.Assert.*;

public class TreeWalkerTest {

    /** Records enter/exit events by node label. */
    private static final class Recorder implements Visitor {
        final List<String> events = new ArrayList<>();

        @Override
        public void enterEquation(Equation node) {
            events.add("enterEq");
        }

        @Override
        public void exitEquation(Equation node) {
            events.add("exitEq");
        }

        @Override
        public void enterExpression(Expression node) {
            events.add("enter:" + ExpressionPrinter.print(node));
        }

        @Override
        public void exitExpression(Expression node) {
            events.add("exit:" + ExpressionPrinter.print(node));
        }

        @Override
        public void enterComponentRef(ComponentRef node) {
            events.add("ref:" + node);
        }
    }

    @Test
    public void testPreOrderEnterPostOrderExit() {
        Equation eq = Equation.simple(ref("y"), binary(BinaryOp.ADD, ref("a"), num(1)));
        List<String> events = TreeWalker.walk(eq, new Recorder()).events;

        assertEquals(List.of(
                "enterEq",
                "enter:y", "ref:y", "exit:y",
                "enter:a + 1",
                "enter:a", "ref:a", "exit:a",
                "enter:1", "exit:1",
                "exit:a + 1",
                "exitEq"), events);
    }

    @Test
    public void testWalksComponentsBeforeEquations() {
        ClassDefinition c = ClassDefinition.builder("M")
                .addComponent(Component.real("x").withStart(ref("x0")))
                .addEquation(Equation.simple(der("x"), ref("k")))
                .addAlgorithm(List.of(new Statement.Assignment(ref("z"), num(0))))
                .build();

        List<String> refs = new ArrayList<>();
        TreeWalker.walk(c, new Visitor() {
            @Override
            public void enterComponentRef(ComponentRef node) {
                refs.add(node.toString());
            }
        });
        assertEquals(List.of("x0", "x", "k", "z"), refs);
    }

    @Test
    public void testSubscriptsAreVisited() {
        ComponentRef r = new ComponentRef(List.of(new RefPart("a", List.of(ref("i")))));
        List<String> refs = new ArrayList<>();
        TreeWalker.walk(r, new Visitor() {
            @Override
            public void enterComponentRef(ComponentRef node) {
                refs.add(node.name());
            }
        });
        assertEquals(List.of("a", "i"), refs);
    }

    @Test
    public void testWhenBranchesAreVisited() {
        Equation w = new Equation.When(List.of(
                new Equation.EquationBlock(ref("c1"), List.of(Equation.simple(ref("a"), num(1)))),
                new Equation.EquationBlock(ref("c2"), List.of(Equation.call("reinit", ref("b"), num(0))))));
        List<String> refs = new ArrayList<>();
        int[] equations = new int[1];
        TreeWalker.walk(w, new Visitor() {
            @Override
            public void enterEquation(Equation node) {
                equations[0]++;
            }

            @Override
            public void enterComponentRef(ComponentRef node) {
                refs.add(node.name());
            }
        });
        assertEquals(3, equations[0]);
        assertEquals(List.of("c1", "a", "c2", "b"), refs);
    }
}
