package com.modeling.dae.dae;

import com.modeling.dae.ast.*;
import com.modeling.dae.flatten.ReservedIdentifiers;
import com.modeling.dae.visitor.TreeWalker;
import org.junit.Test;

import java.util.List;

import static com.modeling.dae.ast.Expression.*;
import static org.junit.Assert.*;

public class DaeCreatorTest {

    private final DaeCreator creator = new DaeCreator();

    private static Component declare(String name, String type, Variability v) {
        return Component.builder(name, type).variability(v).build();
    }

    private static ClassDefinition mixed() {
        Equation.EquationBlock onCross = new Equation.EquationBlock(binary(BinaryOp.GT, ref("x"), num(1)), List.of(
                Equation.simple(ref("zr"), binary(BinaryOp.ADD, call("pre", ref("zr")), num(1))),
                Equation.simple(ref("n"), binary(BinaryOp.ADD, call("pre", ref("n")), num(1))),
                Equation.call("reinit", ref("x"), num(0))));
        return ClassDefinition.builder("Mixed")
                .addComponent(declare("p", "Real", Variability.PARAMETER))
                .addComponent(declare("c", "Real", Variability.CONSTANT))
                .addComponent(Component.real("x"))
                .addComponent(Component.real("y"))
                .addComponent(Component.builder("u", "Real").causality(Causality.INPUT).build())
                .addComponent(declare("zr", "Real", Variability.DISCRETE))
                .addComponent(declare("n", "Integer", Variability.DISCRETE))
                .addEquation(Equation.simple(der("x"),
                        binary(BinaryOp.SUB, binary(BinaryOp.MUL, ref("p"), ref("u")), ref("y"))))
                .addEquation(Equation.simple(ref("y"), binary(BinaryOp.MUL, ref("c"), ref("x"))))
                .addEquation(new Equation.When(List.of(onCross)))
                .build();
    }

    @Test
    public void testVariablesAreBucketed() {
        Dae dae = creator.create(mixed());

        assertEquals("Mixed", dae.getName());
        assertEquals(List.of("p"), List.copyOf(dae.getP().keySet()));
        assertEquals(List.of("c"), List.copyOf(dae.getCp().keySet()));
        assertEquals(List.of("x"), List.copyOf(dae.getX().keySet()));
        assertEquals(List.of("der_x"), List.copyOf(dae.getXDot().keySet()));
        assertEquals(List.of("pre_x"), List.copyOf(dae.getPreX().keySet()));
        assertEquals(List.of("y"), List.copyOf(dae.getY().keySet()));
        assertEquals(List.of("u"), List.copyOf(dae.getU().keySet()));
        assertTrue(dae.getZ().isEmpty());
        assertTrue(dae.getPreZ().isEmpty());
        assertEquals(List.of("zr", "n"), List.copyOf(dae.getM().keySet()));
        assertEquals(List.of("pre_zr", "pre_n"), List.copyOf(dae.getPreM().keySet()));
        assertEquals("t", dae.getT().name());
        assertEquals(4, dae.unknownCount());
    }

    @Test
    public void testEveryEquationCopiedToFxInOrder() {
        ClassDefinition flat = mixed();
        Dae dae = creator.create(flat);
        assertEquals(flat.getEquations(), dae.getFx());
    }

    @Test
    public void testWhenEquationIsDecomposed() {
        Dae dae = creator.create(mixed());

        assertEquals(1, dae.getFc().size());
        assertEquals(binary(BinaryOp.GT, ref("x"), num(1)), dae.getFc().get("__c0"));
        assertTrue(dae.getFz().isEmpty());
        assertEquals(List.of(
                Equation.simple(ref("zr"), binary(BinaryOp.ADD, call("pre", ref("zr")), num(1))),
                Equation.simple(ref("n"), binary(BinaryOp.ADD, call("pre", ref("n")), num(1)))),
                dae.getFm());
        assertEquals(List.of(new Statement.Assignment(ref("x"), num(0))), dae.getFr().get("__c0"));
    }

    @Test
    public void testDiscreteRealsSplitIntoZWhenEnabled() {
        Dae dae = new DaeCreator(ReservedIdentifiers.DEFAULT, true).create(mixed());

        assertEquals(List.of("zr"), List.copyOf(dae.getZ().keySet()));
        assertEquals(List.of("pre_zr"), List.copyOf(dae.getPreZ().keySet()));
        assertEquals(List.of("n"), List.copyOf(dae.getM().keySet()));
        assertEquals(List.of("pre_n"), List.copyOf(dae.getPreM().keySet()));
        assertEquals(List.of(Equation.simple(ref("zr"), binary(BinaryOp.ADD, call("pre", ref("zr")), num(1)))),
                dae.getFz());
        assertEquals(List.of(Equation.simple(ref("n"), binary(BinaryOp.ADD, call("pre", ref("n")), num(1)))),
                dae.getFm());
        assertEquals(4, dae.unknownCount());
    }

    @Test
    public void testElsewhenBranchesGetTheirOwnConditions() {
        Equation.When w1 = new Equation.When(List.of(
                new Equation.EquationBlock(ref("a"), List.of(Equation.call("reinit", ref("x"), num(1)))),
                new Equation.EquationBlock(ref("b"), List.of(Equation.call("reinit", ref("x"), num(2))))));
        Equation.When w2 = new Equation.When(List.of(
                new Equation.EquationBlock(ref("a"), List.of(Equation.call("reinit", ref("x"), num(3))))));
        ClassDefinition flat = ClassDefinition.builder("W")
                .addComponent(Component.real("x"))
                .addComponent(declare("a", "Boolean", Variability.DISCRETE))
                .addComponent(declare("b", "Boolean", Variability.DISCRETE))
                .addEquation(Equation.simple(der("x"), num(-1)))
                .addEquation(w1)
                .addEquation(w2)
                .build();

        Dae dae = creator.create(flat);
        assertEquals(List.of("__c0", "__c1", "__c2"), List.copyOf(dae.getFc().keySet()));
        assertEquals(new Statement.Assignment(ref("x"), num(2)), dae.getFr().get("__c1").get(0));
        assertEquals(new Statement.Assignment(ref("x"), num(3)), dae.getFr().get("__c2").get(0));
    }

    @Test
    public void testMalformedReinit() {
        ClassDefinition oneArg = ClassDefinition.builder("R")
                .addComponent(Component.real("x"))
                .addEquation(new Equation.When(List.of(new Equation.EquationBlock(ref("c"),
                        List.of(Equation.call("reinit", ref("x")))))))
                .build();
        try {
            creator.create(oneArg);
            fail("Should reject reinit with one argument");
        } catch (AssemblyException e) {
            assertTrue(e.getMessage().contains("reinit"));
        }

        ClassDefinition badTarget = ClassDefinition.builder("R")
                .addComponent(Component.real("x"))
                .addEquation(new Equation.When(List.of(new Equation.EquationBlock(ref("c"),
                        List.of(Equation.call("reinit", binary(BinaryOp.ADD, ref("x"), num(1)), num(0)))))))
                .build();
        try {
            creator.create(badTarget);
            fail("Should reject reinit of an expression");
        } catch (AssemblyException expected) {
            // expected
        }
    }

    @Test
    public void testReferenceToExpandedInstanceRejected() {
        ClassDefinition flat = ClassDefinition.builder("Top")
                .addComponent(Component.real("a_x"))
                .addEquation(Equation.simple(ref("a.x"), num(1)))
                .build();
        try {
            creator.create(flat);
            fail("Should reject dotted reference into an expanded instance");
        } catch (AssemblyException e) {
            assertTrue(e.getMessage().contains("a_x"));
        }
    }

    @Test
    public void testDottedReferenceToUnknownHeadRejected() {
        ClassDefinition flat = ClassDefinition.builder("Top")
                .addComponent(Component.real("y"))
                .addEquation(Equation.simple(ref("y"), ref("foo.bar")))
                .build();
        try {
            creator.create(flat);
            fail("Should reject a dotted reference left in the flat class");
        } catch (AssemblyException e) {
            assertTrue(e.getMessage().contains("foo.bar"));
        }
    }

    @Test
    public void testDottedReferenceIntoComponentAccepted() {
        ClassDefinition flat = ClassDefinition.builder("Top")
                .addComponent(Component.builder("rec", "Point").build())
                .addComponent(Component.real("y"))
                .addEquation(Equation.simple(ref("y"), ref("rec.x")))
                .build();

        Dae dae = creator.create(flat);
        assertEquals(1, dae.getFx().size());
    }

    @Test
    public void testLoopIndexMatchingAPrefixIsAccepted() {
        Equation loop = new Equation.For(List.of(new Equation.ForIndex("k", new Range(num(1), null, num(2)))),
                List.of(Equation.simple(new ComponentRef(List.of(new RefPart("k_v", List.of(ref("k"))))), ref("k"))));
        ClassDefinition flat = ClassDefinition.builder("Top")
                .addComponent(Component.builder("k_v", "Real").shape(List.of(num(2))).build())
                .addEquation(loop)
                .build();

        Dae dae = creator.create(flat);
        assertEquals(List.of("k_v"), List.copyOf(dae.getY().keySet()));
    }

    @Test
    public void testStateFinderLooksInsideExpressions() {
        Expression e = binary(BinaryOp.ADD, binary(BinaryOp.MUL, num(2), der("a")), call("sin", der("b")));
        assertEquals(List.of("a", "b"), List.copyOf(TreeWalker.walk(e, new StateFinder()).states()));
    }

    @Test
    public void testWithFxKeepsBuckets() {
        Dae dae = creator.create(mixed());
        Dae reordered = dae.withFx(List.of(dae.getFx().get(1), dae.getFx().get(0)));

        assertEquals(2, reordered.getFx().size());
        assertEquals(dae.getX(), reordered.getX());
        assertEquals(dae.getFc(), reordered.getFc());
        assertEquals(3, dae.getFx().size());
    }
}
