package com.modeling.dae.dae;

import com.modeling.dae.ast.*;
import com.modeling.dae.flatten.ReservedIdentifiers;
import com.modeling.dae.visitor.TreeWalker;
import com.modeling.dae.visitor.Visitor;

import java.util.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Classifies the components and equations of a flat class into a {@link Dae}.
 *
 * <p>
 * Variables: parameters go to {@code p}, constants to {@code cp}, discrete
 * variables to {@code m}. With {@code discreteRealsInZ} set, discrete reals go
 * to {@code z} instead. A continuous
 * variable found inside {@code der()} is a state ({@code x}); otherwise an
 * input goes to {@code u} and everything else to {@code y}.
 *
 * <p>
 * Equations: every equation is copied to {@code fx} unchanged and in order.
 * When-equations are in addition split up: each branch condition is named into
 * {@code fc}, {@code reinit(v, e)} calls become assignments in {@code fr}, and
 * the remaining branch equations go to {@code fm}, or to {@code fz} when the
 * left side is a {@code z} variable.
 */
public final class DaeCreator {
    private static final Logger log = LogManager.getLogger(DaeCreator.class);

    private final ReservedIdentifiers reserved;
    private final boolean discreteRealsInZ;

    public DaeCreator() {
        this(ReservedIdentifiers.DEFAULT, false);
    }

    public DaeCreator(ReservedIdentifiers reserved, boolean discreteRealsInZ) {
        this.reserved = reserved;
        this.discreteRealsInZ = discreteRealsInZ;
    }

    /**
     * @throws AssemblyException if an equation still refers to an expanded
     *                           instance or a reinit call is malformed
     */
    public Dae create(ClassDefinition flat) {
        checkReferences(flat);

        Set<String> states = TreeWalker.walk(flat, new StateFinder()).states();
        ConditionFinder conditions = TreeWalker.walkEquations(flat.getEquations(), new ConditionFinder());

        Dae.Builder dae = Dae.builder(flat.getName());
        for (Component c : flat.getComponents().values()) {
            switch (c.variability()) {
                case PARAMETER -> dae.parameter(c);
                case CONSTANT -> dae.constant(c);
                case DISCRETE -> {
                    if (discreteRealsInZ && "Real".equals(c.typeName()))
                        dae.discreteReal(c);
                    else
                        dae.discrete(c);
                }
                case CONTINUOUS -> {
                    if (states.contains(c.name()))
                        dae.state(c);
                    else if (c.causality() == Causality.INPUT)
                        dae.input(c);
                    else
                        dae.algebraic(c);
                }
            }
        }

        conditions.conditions().forEach(dae::condition);
        for (Equation eq : flat.getEquations()) {
            dae.continuousEquation(eq);
            if (eq instanceof Equation.When when)
                splitWhen(when, conditions, dae);
        }

        Dae built = dae.build();
        log.debug("DAE {}: x={} y={} z={} m={} u={} p={} cp={} fx={} fc={}", built.getName(),
                built.getX().size(), built.getY().size(), built.getZ().size(), built.getM().size(),
                built.getU().size(), built.getP().size(), built.getCp().size(), built.getFx().size(),
                built.getFc().size());
        return built;
    }

    private void splitWhen(Equation.When when, ConditionFinder conditions, Dae.Builder dae) {
        for (Equation.EquationBlock block : when.blocks()) {
            String cond = conditions.nameOf(block);
            for (Equation inner : block.equations()) {
                if (inner instanceof Equation.FunctionCallEquation call && "reinit".equals(call.name())) {
                    dae.reset(cond, toAssignment(call));
                } else if (inner instanceof Equation.Simple s && s.lhs() instanceof Expression.ComponentRef ref
                        && dae.isDiscreteReal(ref.name())) {
                    dae.discreteRealEquation(inner);
                } else {
                    dae.discreteEquation(inner);
                }
            }
        }
    }

    private static Statement.Assignment toAssignment(Equation.FunctionCallEquation call) {
        if (call.args().size() != 2)
            throw new AssemblyException("reinit expects 2 arguments, got " + call.args().size() + ": "
                    + ExpressionPrinter.print(call));
        if (!(call.args().get(0) instanceof Expression.ComponentRef target))
            throw new AssemblyException("reinit target must be a variable reference: "
                    + ExpressionPrinter.print(call));
        return new Statement.Assignment(target, call.args().get(1));
    }

    /**
     * Rejects references that flattening should have resolved: a dotted
     * reference whose head is not a component of the flat class, or a reference
     * to an instance that was already expanded (the instance name is gone but
     * {@code name_...} components exist).
     */
    private void checkReferences(ClassDefinition flat) {
        Set<String> names = flat.getComponents().keySet();
        Set<String> expandedPrefixes = new HashSet<>();
        for (String n : names) {
            int i = n.indexOf('_');
            while (i > 0) {
                expandedPrefixes.add(n.substring(0, i));
                i = n.indexOf('_', i + 1);
            }
        }
        expandedPrefixes.removeAll(names);
        Set<String> loopIndices = new HashSet<>();
        TreeWalker.walk(flat, new Visitor() {
            @Override
            public void enterEquation(Equation node) {
                if (node instanceof Equation.For f)
                    f.indices().forEach(idx -> loopIndices.add(idx.name()));
            }

            @Override
            public void enterStatement(Statement node) {
                if (node instanceof Statement.ForStatement f)
                    f.indices().forEach(idx -> loopIndices.add(idx.name()));
            }
        });

        Visitor check = new Visitor() {
            @Override
            public void enterComponentRef(Expression.ComponentRef ref) {
                String head = ref.head();
                if (reserved.contains(head) || loopIndices.contains(head))
                    return;
                if (expandedPrefixes.contains(head))
                    throw new AssemblyException("Equation in " + flat.getName()
                            + " references expanded instance " + ref + "; expected a flat name such as "
                            + ref.name().replace('.', '_'));
                if (ref.isDotted() && !names.contains(head))
                    throw new AssemblyException("Equation in " + flat.getName() + " has unresolved reference "
                            + ref + "; " + head + " is not a component of the flat class");
            }
        };
        TreeWalker.walkEquations(flat.getEquations(), check);
        TreeWalker.walkEquations(flat.getInitialEquations(), check);
    }
}
