package com.modeling.dae.balance;

import com.modeling.dae.ast.*;
import com.modeling.dae.dae.Dae;
import com.modeling.dae.dae.DaeCreator;
import org.junit.Test;

import java.util.List;

import static com.modeling.dae.ast.Expression.*;
import static org.junit.Assert.*;

public class BalanceCheckerTest {

    private final BalanceChecker checker = new BalanceChecker();

    private static Equation.For loop(Expression range, Equation... body) {
        return new Equation.For(List.of(new Equation.ForIndex("i", range)), List.of(body));
    }

    @Test
    public void testOneStateBalanced() {
        ClassDefinition c = ClassDefinition.builder("M")
                .addComponent(Component.real("x"))
                .addEquation(Equation.simple(der("x"), num(1)))
                .build();

        BalanceCheckResult r = checker.checkClassBalance(c);

        assertTrue(r.balanced());
        assertEquals(1, r.numEquations());
        assertEquals(1, r.numUnknowns());
        assertEquals(1, r.numStates());
        assertEquals(0, r.numAlgebraic());
        assertEquals(0, r.difference());
        assertEquals("Model is balanced: 1 equations, 1 unknowns (1 states, 0 algebraic)", r.statusMessage());
    }

    @Test
    public void testOverDetermined() {
        ClassDefinition c = ClassDefinition.builder("M")
                .addComponent(Component.real("x"))
                .addEquation(Equation.simple(ref("x"), num(1)))
                .addEquation(Equation.simple(ref("x"), num(2)))
                .build();

        BalanceCheckResult r = checker.checkClassBalance(c);

        assertFalse(r.balanced());
        assertEquals(1, r.difference());
        assertEquals("Model is over-determined: 2 equations, 1 unknowns (1 extra equations)", r.statusMessage());
    }

    @Test
    public void testUnderDetermined() {
        ClassDefinition c = ClassDefinition.builder("M")
                .addComponent(Component.real("x"))
                .addComponent(Component.real("y"))
                .addEquation(Equation.simple(ref("x"), num(1)))
                .build();

        BalanceCheckResult r = checker.checkClassBalance(c);

        assertEquals(-1, r.difference());
        assertTrue(r.statusMessage().startsWith("Model is under-determined"));
        assertTrue(r.statusMessage().contains("1 missing equations"));
    }

    @Test
    public void testParametersAndInputsAreNotUnknowns() {
        ClassDefinition c = ClassDefinition.builder("M")
                .addComponent(Component.builder("k", "Real").variability(Variability.PARAMETER).build())
                .addComponent(Component.builder("pi", "Real").variability(Variability.CONSTANT).build())
                .addComponent(Component.builder("u", "Real").causality(Causality.INPUT).build())
                .addComponent(Component.real("y"))
                .addEquation(Equation.simple(ref("y"), binary(BinaryOp.MUL, ref("k"), ref("u"))))
                .build();

        BalanceCheckResult r = checker.checkClassBalance(c);

        assertTrue(r.balanced());
        assertEquals(2, r.numParameters());
        assertEquals(1, r.numInputs());
        assertEquals(1, r.numAlgebraic());
    }

    @Test
    public void testIfEquationCounting() {
        Equation.EquationBlock branch = new Equation.EquationBlock(ref("c"),
                List.of(Equation.simple(ref("a"), num(1)), Equation.simple(ref("b"), num(1))));
        Equation withElse = new Equation.If(List.of(branch), List.of(Equation.simple(ref("a"), num(0))));
        Equation withoutElse = new Equation.If(List.of(branch), List.of());

        assertEquals(1, checker.countEquation(withElse));
        assertEquals(2, checker.countEquation(withoutElse));
    }

    @Test
    public void testWhenAndCallEquationsCountZero() {
        Equation when = new Equation.When(List.of(new Equation.EquationBlock(ref("c"),
                List.of(Equation.simple(ref("a"), num(1))))));
        assertEquals(0, checker.countEquation(when));
        assertEquals(0, checker.countEquation(Equation.call("assert", ref("ok"))));
        assertEquals(1, checker.countEquation(new Equation.Connect(ref("a"), ref("b"))));
    }

    @Test
    public void testForBodyCountedOnceByDefault() {
        Equation f = loop(new Range(num(1), null, num(5)), Equation.simple(ref("x"), ref("i")));
        assertEquals(1, checker.countEquation(f));
    }

    @Test
    public void testForExpandsLiteralRanges() {
        BalanceChecker expanding = new BalanceChecker(ForCountingPolicy.EXPAND_LITERAL_RANGES);

        assertEquals(5, expanding.countEquation(
                loop(new Range(num(1), null, num(5)), Equation.simple(ref("x"), ref("i")))));
        assertEquals(3, expanding.countEquation(
                loop(new Range(num(1), num(2), num(5)), Equation.simple(ref("x"), ref("i")))));
        assertEquals(6, expanding.countEquation(
                loop(new ArrayLiteral(List.of(num(1), num(2), num(3))),
                        Equation.simple(ref("x"), ref("i")), Equation.simple(ref("y"), ref("i")))));
        // bound not known statically
        assertEquals(1, expanding.countEquation(
                loop(new Range(num(1), null, ref("n")), Equation.simple(ref("x"), ref("i")))));
        assertEquals(0, expanding.countEquation(
                loop(new Range(num(5), null, num(1)), Equation.simple(ref("x"), ref("i")))));
    }

    @Test
    public void testHugeRangeFallsBackToBodyOnce() {
        BalanceChecker expanding = new BalanceChecker(ForCountingPolicy.EXPAND_LITERAL_RANGES);
        Expression threeBillion = new Literal(Literal.Kind.INTEGER, "3000000000");

        assertEquals(1, expanding.countEquation(
                loop(new Range(num(1), null, threeBillion), Equation.simple(ref("x"), ref("i")))));
        Equation.For nested = new Equation.For(List.of(
                new Equation.ForIndex("i", new Range(num(1), null, new Literal(Literal.Kind.INTEGER, "100000"))),
                new Equation.ForIndex("j", new Range(num(1), null, new Literal(Literal.Kind.INTEGER, "100000")))),
                List.of(Equation.simple(ref("x"), ref("i"))));
        assertEquals(1, expanding.countEquation(nested));
    }

    @Test
    public void testIntegerLiteralBeyondLongIsNotStatic() {
        BalanceChecker expanding = new BalanceChecker(ForCountingPolicy.EXPAND_LITERAL_RANGES);
        Expression tooBig = new Literal(Literal.Kind.INTEGER, "99999999999999999999");

        assertEquals(-1, BalanceChecker.literalLength(new Range(num(1), null, tooBig)));
        assertEquals(1, expanding.countEquation(
                loop(new Range(num(1), null, tooBig), Equation.simple(ref("x"), ref("i")))));
    }

    @Test
    public void testDaeBalanceUsesAssembledBuckets() {
        ClassDefinition flat = ClassDefinition.builder("Ball")
                .addComponent(Component.builder("g", "Real").variability(Variability.PARAMETER).build())
                .addComponent(Component.real("h"))
                .addComponent(Component.real("v"))
                .addEquation(Equation.simple(der("h"), ref("v")))
                .addEquation(Equation.simple(der("v"), new Unary(UnaryOp.MINUS, ref("g"))))
                .addEquation(new Equation.When(List.of(new Equation.EquationBlock(
                        binary(BinaryOp.LT, ref("h"), num(0)), List.of(Equation.call("reinit", ref("v"), num(0)))))))
                .build();
        Dae dae = new DaeCreator().create(flat);

        BalanceCheckResult r = checker.checkDaeBalance(dae);

        assertTrue(r.balanced());
        assertEquals(2, r.numEquations());
        assertEquals(2, r.numStates());
        assertEquals(1, r.numParameters());
        assertEquals(r, checker.checkClassBalance(flat));
    }

    @Test
    public void testResultOfComputesDerivedFields() {
        BalanceCheckResult r = BalanceCheckResult.of(3, 4, 1, 2, 0);
        assertEquals(3, r.numAlgebraic());
        assertFalse(r.balanced());
        assertEquals(-1, r.difference());
        assertEquals(r.statusMessage(), r.toString());
    }
}
