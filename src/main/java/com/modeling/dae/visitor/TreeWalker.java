package com.modeling.dae.visitor;

import com.modeling.dae.ast.ClassDefinition;
import com.modeling.dae.ast.Component;
import com.modeling.dae.ast.Equation;
import com.modeling.dae.ast.Expression;
import com.modeling.dae.ast.Statement;

import java.util.List;

/**
 * Drives a {@link Visitor} over a tree in one fixed order: pre-order enter,
 * children left to right, post-order exit.
 * <p>
 * Class order: components (shape, then start value), equations, initial
 * equations, algorithms, initial algorithms.
 */
public final class TreeWalker {
    private final Visitor visitor;

    private TreeWalker(Visitor visitor) {
        this.visitor = visitor;
    }

    public static <V extends Visitor> V walk(ClassDefinition node, V visitor) {
        new TreeWalker(visitor).classDefinition(node);
        return visitor;
    }

    public static <V extends Visitor> V walk(Equation node, V visitor) {
        new TreeWalker(visitor).equation(node);
        return visitor;
    }

    public static <V extends Visitor> V walkEquations(List<Equation> nodes, V visitor) {
        TreeWalker w = new TreeWalker(visitor);
        for (Equation eq : nodes)
            w.equation(eq);
        return visitor;
    }

    public static <V extends Visitor> V walk(Expression node, V visitor) {
        new TreeWalker(visitor).expression(node);
        return visitor;
    }

    public static <V extends Visitor> V walk(Statement node, V visitor) {
        new TreeWalker(visitor).statement(node);
        return visitor;
    }

    private void classDefinition(ClassDefinition c) {
        visitor.enterClass(c);
        for (Component comp : c.getComponents().values())
            component(comp);
        for (Equation eq : c.getEquations())
            equation(eq);
        for (Equation eq : c.getInitialEquations())
            equation(eq);
        for (List<Statement> block : c.getAlgorithms())
            for (Statement st : block)
                statement(st);
        for (List<Statement> block : c.getInitialAlgorithms())
            for (Statement st : block)
                statement(st);
        visitor.exitClass(c);
    }

    private void component(Component c) {
        visitor.enterComponent(c);
        for (Expression dim : c.shape())
            expression(dim);
        if (c.start() != null)
            expression(c.start());
        visitor.exitComponent(c);
    }

    private void equation(Equation eq) {
        visitor.enterEquation(eq);
        if (eq instanceof Equation.Simple s) {
            expression(s.lhs());
            expression(s.rhs());
        } else if (eq instanceof Equation.Connect c) {
            expression(c.lhs());
            expression(c.rhs());
        } else if (eq instanceof Equation.For f) {
            for (Equation.ForIndex idx : f.indices())
                expression(idx.range());
            for (Equation inner : f.equations())
                equation(inner);
        } else if (eq instanceof Equation.When w) {
            blocks(w.blocks());
        } else if (eq instanceof Equation.If i) {
            blocks(i.blocks());
            for (Equation inner : i.elseEquations())
                equation(inner);
        } else if (eq instanceof Equation.FunctionCallEquation c) {
            for (Expression arg : c.args())
                expression(arg);
        }
        visitor.exitEquation(eq);
    }

    private void blocks(List<Equation.EquationBlock> blocks) {
        for (Equation.EquationBlock b : blocks) {
            expression(b.condition());
            for (Equation inner : b.equations())
                equation(inner);
        }
    }

    private void statement(Statement st) {
        visitor.enterStatement(st);
        if (st instanceof Statement.Assignment a) {
            expression(a.target());
            expression(a.value());
        } else if (st instanceof Statement.ForStatement f) {
            for (Equation.ForIndex idx : f.indices())
                expression(idx.range());
            for (Statement inner : f.body())
                statement(inner);
        } else if (st instanceof Statement.WhileStatement w) {
            expression(w.condition());
            for (Statement inner : w.body())
                statement(inner);
        } else if (st instanceof Statement.CallStatement c) {
            for (Expression arg : c.args())
                expression(arg);
        }
        visitor.exitStatement(st);
    }

    private void expression(Expression e) {
        if (e == null)
            return;
        visitor.enterExpression(e);
        if (e instanceof Expression.ComponentRef ref) {
            visitor.enterComponentRef(ref);
            for (Expression.RefPart part : ref.parts())
                for (Expression sub : part.subscripts())
                    expression(sub);
            visitor.exitComponentRef(ref);
        } else if (e instanceof Expression.Unary u) {
            expression(u.operand());
        } else if (e instanceof Expression.Binary b) {
            expression(b.lhs());
            expression(b.rhs());
        } else if (e instanceof Expression.FunctionCall c) {
            for (Expression arg : c.args())
                expression(arg);
        } else if (e instanceof Expression.ArrayLiteral a) {
            for (Expression el : a.elements())
                expression(el);
        } else if (e instanceof Expression.Tuple t) {
            for (Expression el : t.elements())
                expression(el);
        } else if (e instanceof Expression.Range r) {
            expression(r.start());
            expression(r.step());
            expression(r.end());
        } else if (e instanceof Expression.Conditional c) {
            for (Expression.Branch br : c.branches()) {
                expression(br.condition());
                expression(br.value());
            }
            expression(c.elseValue());
        }
        visitor.exitExpression(e);
    }
}
