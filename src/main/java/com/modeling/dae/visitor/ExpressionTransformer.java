package com.modeling.dae.visitor;

import com.modeling.dae.ast.ClassDefinition;
import com.modeling.dae.ast.Component;
import com.modeling.dae.ast.Equation;
import com.modeling.dae.ast.Expression;
import com.modeling.dae.ast.Statement;

import java.util.ArrayList;
import java.util.List;

/**
 * Pure bottom-up rewrite of a tree.
 * <p>
 * Children are rewritten first, then the hook for the node itself runs on the
 * rebuilt node. Inputs are never modified; every call returns a new tree (or the
 * same instance where nothing changed, since nodes are immutable values).
 * Subclasses override the hooks, all of which default to identity.
 */
public abstract class ExpressionTransformer {

    /** Rewrites a reference after its subscripts were rewritten. */
    protected Expression.ComponentRef transformRef(Expression.ComponentRef ref) {
        return ref;
    }

    /** Rewrites any expression node after its children were rewritten. */
    protected Expression transformExpression(Expression e) {
        return e;
    }

    /** Rewrites an equation after its children were rewritten. */
    protected Equation transformEquation(Equation eq) {
        return eq;
    }

    public ClassDefinition apply(ClassDefinition c) {
        ClassDefinition.Builder b = c.toBuilder().clearComponents();
        for (Component comp : c.getComponents().values())
            b.putComponent(apply(comp));
        b.equations(applyAll(c.getEquations()));
        b.initialEquations(applyAll(c.getInitialEquations()));
        b.algorithms(applyBlocks(c.getAlgorithms()));
        b.initialAlgorithms(applyBlocks(c.getInitialAlgorithms()));
        return b.build();
    }

    public Component apply(Component c) {
        Expression start = c.start() == null ? null : apply(c.start());
        return c.withShape(applyExpressions(c.shape())).withStart(start);
    }

    public List<Equation> applyAll(List<Equation> eqs) {
        List<Equation> out = new ArrayList<>(eqs.size());
        for (Equation eq : eqs)
            out.add(apply(eq));
        return out;
    }

    public Equation apply(Equation eq) {
        Equation rebuilt;
        if (eq instanceof Equation.Simple s) {
            rebuilt = new Equation.Simple(apply(s.lhs()), apply(s.rhs()));
        } else if (eq instanceof Equation.Connect c) {
            rebuilt = new Equation.Connect(applyRef(c.lhs()), applyRef(c.rhs()));
        } else if (eq instanceof Equation.For f) {
            rebuilt = new Equation.For(applyIndices(f.indices()), applyAll(f.equations()));
        } else if (eq instanceof Equation.When w) {
            rebuilt = new Equation.When(applyBlocksOf(w.blocks()));
        } else if (eq instanceof Equation.If i) {
            rebuilt = new Equation.If(applyBlocksOf(i.blocks()), applyAll(i.elseEquations()));
        } else if (eq instanceof Equation.FunctionCallEquation c) {
            rebuilt = new Equation.FunctionCallEquation(c.name(), applyExpressions(c.args()));
        } else {
            throw new IllegalArgumentException("Unsupported equation: " + eq.getClass().getSimpleName());
        }
        return transformEquation(rebuilt);
    }

    public Statement apply(Statement st) {
        if (st instanceof Statement.Assignment a)
            return new Statement.Assignment(applyRef(a.target()), apply(a.value()));
        if (st instanceof Statement.ForStatement f)
            return new Statement.ForStatement(applyIndices(f.indices()), applyStatements(f.body()));
        if (st instanceof Statement.WhileStatement w)
            return new Statement.WhileStatement(apply(w.condition()), applyStatements(w.body()));
        if (st instanceof Statement.CallStatement c)
            return new Statement.CallStatement(c.name(), applyExpressions(c.args()));
        return st;
    }

    public Expression apply(Expression e) {
        if (e == null)
            return null;
        Expression rebuilt;
        if (e instanceof Expression.ComponentRef ref) {
            rebuilt = applyRef(ref);
        } else if (e instanceof Expression.Unary u) {
            rebuilt = new Expression.Unary(u.op(), apply(u.operand()));
        } else if (e instanceof Expression.Binary b) {
            rebuilt = new Expression.Binary(b.op(), apply(b.lhs()), apply(b.rhs()));
        } else if (e instanceof Expression.FunctionCall c) {
            rebuilt = new Expression.FunctionCall(c.name(), applyExpressions(c.args()));
        } else if (e instanceof Expression.ArrayLiteral a) {
            rebuilt = new Expression.ArrayLiteral(applyExpressions(a.elements()));
        } else if (e instanceof Expression.Tuple t) {
            rebuilt = new Expression.Tuple(applyExpressions(t.elements()));
        } else if (e instanceof Expression.Range r) {
            rebuilt = new Expression.Range(apply(r.start()), apply(r.step()), apply(r.end()));
        } else if (e instanceof Expression.Conditional c) {
            List<Expression.Branch> branches = new ArrayList<>(c.branches().size());
            for (Expression.Branch br : c.branches())
                branches.add(new Expression.Branch(apply(br.condition()), apply(br.value())));
            rebuilt = new Expression.Conditional(branches, apply(c.elseValue()));
        } else {
            rebuilt = e;
        }
        return transformExpression(rebuilt);
    }

    private Expression.ComponentRef applyRef(Expression.ComponentRef ref) {
        List<Expression.RefPart> parts = new ArrayList<>(ref.parts().size());
        for (Expression.RefPart p : ref.parts())
            parts.add(new Expression.RefPart(p.name(), applyExpressions(p.subscripts())));
        return transformRef(new Expression.ComponentRef(parts));
    }

    private List<Expression> applyExpressions(List<Expression> es) {
        List<Expression> out = new ArrayList<>(es.size());
        for (Expression e : es)
            out.add(apply(e));
        return out;
    }

    private List<Statement> applyStatements(List<Statement> sts) {
        List<Statement> out = new ArrayList<>(sts.size());
        for (Statement st : sts)
            out.add(apply(st));
        return out;
    }

    private List<List<Statement>> applyBlocks(List<List<Statement>> blocks) {
        List<List<Statement>> out = new ArrayList<>(blocks.size());
        for (List<Statement> block : blocks)
            out.add(applyStatements(block));
        return out;
    }

    private List<Equation.EquationBlock> applyBlocksOf(List<Equation.EquationBlock> blocks) {
        List<Equation.EquationBlock> out = new ArrayList<>(blocks.size());
        for (Equation.EquationBlock b : blocks)
            out.add(new Equation.EquationBlock(apply(b.condition()), applyAll(b.equations())));
        return out;
    }

    private List<Equation.ForIndex> applyIndices(List<Equation.ForIndex> indices) {
        List<Equation.ForIndex> out = new ArrayList<>(indices.size());
        for (Equation.ForIndex idx : indices)
            out.add(new Equation.ForIndex(idx.name(), apply(idx.range())));
        return out;
    }
}
