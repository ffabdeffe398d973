package com.modeling.dae.blt;

import com.modeling.dae.ast.*;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.modeling.dae.ast.Expression.*;
import static org.junit.Assert.*;

public class BltOrdererTest {

    private final BltOrderer orderer = new BltOrderer();

    /** Same equations, in any order and with either orientation. */
    private static void assertSameEquations(List<Equation> expected, List<Equation> actual) {
        assertEquals(expected.size(), actual.size());
        List<Equation> remaining = new ArrayList<>(actual);
        for (Equation eq : expected) {
            boolean removed = remaining.remove(eq);
            if (!removed && eq instanceof Equation.Simple s)
                removed = remaining.remove(s.swapped());
            assertTrue("missing " + ExpressionPrinter.print(eq), removed);
        }
    }

    @Test
    public void testChainIsOrderedByDependency() {
        Equation z = Equation.simple(ref("z"), binary(BinaryOp.ADD, ref("y"), num(1)));
        Equation y = Equation.simple(ref("y"), binary(BinaryOp.MUL, ref("x"), num(2)));
        Equation x = Equation.simple(ref("x"), num(3));

        BltResult result = orderer.order(List.of(z, y, x));

        assertEquals(List.of(x, y, z), result.equations());
        assertEquals(List.of(List.of(2), List.of(1), List.of(0)), result.blocks());
        assertEquals(Map.of(0, "z", 1, "y", 2, "x"), result.matching());
        assertTrue(result.completeMatching());
        assertTrue(result.algebraicLoops().isEmpty());
    }

    @Test
    public void testAlgebraicLoopFormsOneBlock() {
        Equation a = Equation.simple(ref("a"), binary(BinaryOp.ADD, ref("b"), num(1)));
        Equation b = Equation.simple(ref("b"), binary(BinaryOp.MUL, ref("a"), num(2)));
        Equation c = Equation.simple(ref("c"), ref("a"));

        BltResult result = orderer.order(List.of(a, b, c));

        assertEquals(List.of(List.of(0, 1), List.of(2)), result.blocks());
        assertEquals(List.of(a, b, c), result.equations());
        assertEquals(1, result.algebraicLoops().size());
    }

    @Test
    public void testDerivativeOnRightIsSwapped() {
        Equation eq = Equation.simple(ref("v"), der("h"));
        Equation other = Equation.simple(der("v"), new Unary(UnaryOp.MINUS, ref("g")));

        BltResult result = orderer.order(List.of(eq, other));

        assertTrue(result.equations().contains(Equation.simple(der("h"), ref("v"))));
        assertFalse(result.equations().contains(eq));
        assertTrue(result.equations().contains(other));
    }

    @Test
    public void testDerivativeCoefficientIsNormalized() {
        Equation eq = Equation.simple(binary(BinaryOp.MUL, ref("C"), der("v")), ref("i"));

        BltResult normalized = orderer.order(List.of(eq));
        assertEquals(Equation.simple(der("v"), binary(BinaryOp.DIV, ref("i"), ref("C"))),
                normalized.equations().get(0));
        assertEquals("der(v)", normalized.matching().get(0));

        BltResult kept = new BltOrderer(true, false).order(List.of(eq));
        assertEquals(eq, kept.equations().get(0));
    }

    @Test
    public void testUnanalyzableEquationsAppendedInInputOrder() {
        Equation when = new Equation.When(List.of(new Equation.EquationBlock(ref("c"),
                List.of(Equation.call("reinit", ref("x"), num(0))))));
        Equation x = Equation.simple(ref("x"), num(1));
        Equation connect = new Equation.Connect(ref("a"), ref("b"));

        BltResult result = orderer.order(List.of(when, x, connect));

        assertEquals(List.of(x, when, connect), result.equations());
        assertEquals(List.of(List.of(1), List.of(0), List.of(2)), result.blocks());
        assertFalse(result.completeMatching());
    }

    @Test
    public void testImplicitEquationIsMatched() {
        Equation implicit = Equation.simple(binary(BinaryOp.ADD, ref("x"), ref("y")), num(3));
        Equation y = Equation.simple(ref("y"), num(1));

        BltResult result = orderer.order(List.of(implicit, y));

        assertEquals(List.of(y, Equation.simple(ref("x"), binary(BinaryOp.SUB, num(3), ref("y")))),
                result.equations());
        assertEquals("x", result.matching().get(0));
        assertTrue(result.completeMatching());

        BltResult unmatched = new BltOrderer(false, true).order(List.of(implicit, y));
        assertEquals(List.of(y, implicit), unmatched.equations());
        assertNull(unmatched.matching().get(0));
        assertFalse(unmatched.completeMatching());
    }

    @Test
    public void testMatchedEquationIsSolvedForItsVariable() {
        Equation sum = Equation.simple(binary(BinaryOp.ADD, ref("a"), ref("b")), num(0));
        Equation b = Equation.simple(ref("b"), num(2));

        BltResult result = orderer.order(List.of(sum, b));

        assertEquals(List.of(b, Equation.simple(ref("a"), new Unary(UnaryOp.MINUS, ref("b")))),
                result.equations());
        assertEquals(Map.of(0, "a", 1, "b"), result.matching());
    }

    @Test
    public void testNonlinearMatchStaysImplicit() {
        Equation square = Equation.simple(binary(BinaryOp.MUL, ref("a"), ref("a")), ref("b"));
        Equation b = Equation.simple(ref("b"), num(4));

        BltResult result = orderer.order(List.of(square, b));

        assertEquals(List.of(b, square), result.equations());
        assertEquals("a", result.matching().get(0));
    }

    @Test
    public void testExcludedVariablesAreNeverMatched() {
        Equation eq = Equation.simple(binary(BinaryOp.MUL, ref("k"), ref("x")), ref("time"));
        BltResult result = orderer.order(List.of(eq), Set.of("k", "time"));
        assertEquals("x", result.matching().get(0));
        assertEquals(Equation.simple(ref("x"), binary(BinaryOp.DIV, ref("time"), ref("k"))),
                result.equations().get(0));
    }

    @Test
    public void testEquationsArePreserved() {
        List<Equation> input = List.of(
                Equation.simple(ref("r_i"), binary(BinaryOp.DIV, ref("r_v"), ref("R"))),
                Equation.simple(ref("c_i"), ref("r_i")),
                Equation.simple(ref("r_v"), binary(BinaryOp.SUB, num(10), ref("c_v"))),
                Equation.simple(ref("w"), der("c_v")),
                Equation.simple(der("c_v"), ref("c_i")),
                new Equation.If(List.of(new Equation.EquationBlock(ref("s"),
                        List.of(Equation.simple(ref("q"), num(1))))), List.of(Equation.simple(ref("q"), num(2)))));

        BltResult result = new BltOrderer(true, false).order(input);

        assertSameEquations(input, result.equations());
        List<Integer> all = result.blocks().stream().flatMap(List::stream).sorted().toList();
        assertEquals(List.of(0, 1, 2, 3, 4, 5), all);
    }

    @Test
    public void testOrderingIsDeterministic() {
        List<Equation> input = List.of(
                Equation.simple(binary(BinaryOp.ADD, ref("a"), ref("b")), num(1)),
                Equation.simple(binary(BinaryOp.SUB, ref("a"), ref("b")), num(0)),
                Equation.simple(ref("c"), binary(BinaryOp.MUL, ref("a"), ref("b"))));

        BltResult first = orderer.order(input);
        BltResult second = orderer.order(input);
        assertEquals(first, second);
        assertEquals(1, first.algebraicLoops().size());
        assertEquals(List.of(0, 1), first.algebraicLoops().get(0));
    }

    @Test
    public void testDefiningVariable() {
        assertEquals("x", BltOrderer.definingVariable(ref("x")));
        assertEquals("der(x)", BltOrderer.definingVariable(der("x")));
        assertEquals("der(x)", BltOrderer.definingVariable(binary(BinaryOp.MUL, num(2), der("x"))));
        assertNull(BltOrderer.definingVariable(binary(BinaryOp.ADD, ref("x"), ref("y"))));
    }

    @Test
    public void testEmptyInput() {
        BltResult result = orderer.order(List.of());
        assertTrue(result.equations().isEmpty());
        assertTrue(result.blocks().isEmpty());
        assertTrue(result.completeMatching());
    }
}
