package com.modeling.dae.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.modeling.dae.ast.*;

import java.util.*;

/**
 * Converts equation, statement and expression trees between JSON and the AST.
 *
 * <p>
 * Expression forms:
 * <ul>
 * <li>{@code "x.y"} or {@code {"ref": "x.y"}}; subscripted parts as
 * {@code {"ref": [{"name": "x", "sub": [1]}]}}</li>
 * <li>JSON numbers and booleans, or {@code {"int": "1"}}, {@code {"real": "2.5"}},
 * {@code {"bool": "true"}}, {@code {"string": "s"}}</li>
 * <li>{@code {"call": "der", "args": [...]}}</li>
 * <li>{@code {"op": "+", "lhs": ..., "rhs": ...}},
 * {@code {"unary": "-", "operand": ...}}</li>
 * <li>{@code {"array": [...]}}, {@code {"tuple": [...]}},
 * {@code {"range": {"start": ..., "step": ..., "end": ...}}}</li>
 * <li>{@code {"if": [{"cond": ..., "then": ...}], "else": ...}}</li>
 * </ul>
 * Equation forms: {@code {"simple": {"lhs", "rhs"}}} (or just
 * {@code {"lhs", "rhs"}}), {@code {"connect": {"lhs", "rhs"}}},
 * {@code {"for": {"indices": [{"name", "range"}], "equations"}}},
 * {@code {"when": [{"cond", "equations"}]}},
 * {@code {"if": {"branches": [{"cond", "equations"}], "else": [...]}}},
 * {@code {"call": name, "args": [...]}}.
 * Statement forms: {@code {"assign": {"target", "value"}}},
 * {@code {"call", "args"}}, {@code {"for": {"indices", "body"}}},
 * {@code {"while": {"cond", "body"}}}, {@code {"return": true}},
 * {@code {"break": true}}.
 *
 * <p>
 * Encoding always writes the long forms, so encoded output decodes back to
 * equal trees.
 */
public final class AstJsonCodec {
    private static final JsonNodeFactory F = JsonNodeFactory.instance;

    private AstJsonCodec() {
        // Utility class
    }

    // ---- decoding ----

    public static Expression expression(JsonNode n, String at) {
        if (n == null || n.isNull())
            throw new DefinitionException(at, "missing expression");
        if (n.isTextual())
            return Expression.ComponentRef.of(n.asText());
        if (n.isIntegralNumber())
            return new Expression.Literal(Expression.Literal.Kind.INTEGER, n.asText());
        if (n.isNumber())
            return new Expression.Literal(Expression.Literal.Kind.REAL, n.asText());
        if (n.isBoolean())
            return Expression.Literal.ofBool(n.asBoolean());
        if (!n.isObject())
            throw new DefinitionException(at, "expected an expression object, got " + n.getNodeType());

        if (n.has("ref"))
            return ref(n.get("ref"), at);
        if (n.has("int"))
            return new Expression.Literal(Expression.Literal.Kind.INTEGER, n.get("int").asText());
        if (n.has("real"))
            return new Expression.Literal(Expression.Literal.Kind.REAL, n.get("real").asText());
        if (n.has("bool"))
            return new Expression.Literal(Expression.Literal.Kind.BOOLEAN, n.get("bool").asText());
        if (n.has("string"))
            return Expression.Literal.ofString(n.get("string").asText());
        if (n.has("call"))
            return new Expression.FunctionCall(n.get("call").asText(), expressions(n.get("args"), at + ".args"));
        if (n.has("op"))
            return new Expression.Binary(binaryOp(n.get("op").asText(), at),
                    expression(n.get("lhs"), at + ".lhs"), expression(n.get("rhs"), at + ".rhs"));
        if (n.has("unary"))
            return new Expression.Unary(unaryOp(n.get("unary").asText(), at),
                    expression(n.get("operand"), at + ".operand"));
        if (n.has("array"))
            return new Expression.ArrayLiteral(expressions(n.get("array"), at + ".array"));
        if (n.has("tuple"))
            return new Expression.Tuple(expressions(n.get("tuple"), at + ".tuple"));
        if (n.has("range")) {
            JsonNode r = n.get("range");
            JsonNode step = r.get("step");
            return new Expression.Range(expression(r.get("start"), at + ".start"),
                    step == null || step.isNull() ? null : expression(step, at + ".step"),
                    expression(r.get("end"), at + ".end"));
        }
        if (n.has("if")) {
            List<Expression.Branch> branches = new ArrayList<>();
            int i = 0;
            for (JsonNode b : n.get("if")) {
                String bat = at + ".if[" + i++ + "]";
                branches.add(new Expression.Branch(expression(b.get("cond"), bat + ".cond"),
                        expression(b.get("then"), bat + ".then")));
            }
            return new Expression.Conditional(branches, expression(n.get("else"), at + ".else"));
        }
        throw new DefinitionException(at, "unrecognized expression " + fieldNames(n));
    }

    public static Equation equation(JsonNode n, String at) {
        if (n == null || !n.isObject())
            throw new DefinitionException(at, "expected an equation object");
        if (n.has("simple"))
            return simple(n.get("simple"), at);
        if (n.has("lhs") && n.has("rhs"))
            return simple(n, at);
        if (n.has("connect")) {
            JsonNode c = n.get("connect");
            return new Equation.Connect(ref(c.get("lhs"), at + ".lhs"), ref(c.get("rhs"), at + ".rhs"));
        }
        if (n.has("for")) {
            JsonNode f = n.get("for");
            return new Equation.For(indices(f.get("indices"), at), equations(f.get("equations"), at + ".for"));
        }
        if (n.has("when"))
            return new Equation.When(blocks(n.get("when"), at + ".when"));
        if (n.has("if")) {
            JsonNode i = n.get("if");
            return new Equation.If(blocks(i.get("branches"), at + ".if"), equations(i.get("else"), at + ".else"));
        }
        if (n.has("call"))
            return new Equation.FunctionCallEquation(n.get("call").asText(), expressions(n.get("args"), at + ".args"));
        throw new DefinitionException(at, "unrecognized equation " + fieldNames(n));
    }

    public static List<Equation> equations(JsonNode arr, String at) {
        List<Equation> out = new ArrayList<>();
        if (arr == null || arr.isNull())
            return out;
        int i = 0;
        for (JsonNode e : arr) {
            out.add(equation(e, at + "[" + i + "]"));
            i++;
        }
        return out;
    }

    public static Statement statement(JsonNode n, String at) {
        if (n == null || !n.isObject())
            throw new DefinitionException(at, "expected a statement object");
        if (n.has("assign")) {
            JsonNode a = n.get("assign");
            return new Statement.Assignment(ref(a.get("target"), at + ".target"), expression(a.get("value"), at + ".value"));
        }
        if (n.has("call"))
            return new Statement.CallStatement(n.get("call").asText(), expressions(n.get("args"), at + ".args"));
        if (n.has("for")) {
            JsonNode f = n.get("for");
            return new Statement.ForStatement(indices(f.get("indices"), at), statements(f.get("body"), at + ".body"));
        }
        if (n.has("while")) {
            JsonNode w = n.get("while");
            return new Statement.WhileStatement(expression(w.get("cond"), at + ".cond"),
                    statements(w.get("body"), at + ".body"));
        }
        if (n.has("return"))
            return new Statement.Return();
        if (n.has("break"))
            return new Statement.Break();
        throw new DefinitionException(at, "unrecognized statement " + fieldNames(n));
    }

    public static List<Statement> statements(JsonNode arr, String at) {
        List<Statement> out = new ArrayList<>();
        if (arr == null || arr.isNull())
            return out;
        int i = 0;
        for (JsonNode s : arr) {
            out.add(statement(s, at + "[" + i + "]"));
            i++;
        }
        return out;
    }

    private static Equation.Simple simple(JsonNode s, String at) {
        return new Equation.Simple(expression(s.get("lhs"), at + ".lhs"), expression(s.get("rhs"), at + ".rhs"));
    }

    private static Expression.ComponentRef ref(JsonNode n, String at) {
        if (n == null || n.isNull())
            throw new DefinitionException(at, "missing reference");
        if (n.isTextual())
            return Expression.ComponentRef.of(n.asText());
        if (n.isObject() && n.has("ref"))
            return ref(n.get("ref"), at);
        if (!n.isArray())
            throw new DefinitionException(at, "expected a reference");
        List<Expression.RefPart> parts = new ArrayList<>();
        int i = 0;
        for (JsonNode p : n) {
            String pat = at + "[" + i++ + "]";
            if (p.isTextual())
                parts.add(Expression.RefPart.of(p.asText()));
            else
                parts.add(new Expression.RefPart(p.path("name").asText(), expressions(p.get("sub"), pat + ".sub")));
        }
        return new Expression.ComponentRef(parts);
    }

    private static List<Expression> expressions(JsonNode arr, String at) {
        List<Expression> out = new ArrayList<>();
        if (arr == null || arr.isNull())
            return out;
        int i = 0;
        for (JsonNode e : arr) {
            out.add(expression(e, at + "[" + i + "]"));
            i++;
        }
        return out;
    }

    private static List<Equation.ForIndex> indices(JsonNode arr, String at) {
        List<Equation.ForIndex> out = new ArrayList<>();
        if (arr == null)
            throw new DefinitionException(at, "for requires indices");
        int i = 0;
        for (JsonNode idx : arr) {
            String iat = at + ".indices[" + i++ + "]";
            out.add(new Equation.ForIndex(idx.path("name").asText(), expression(idx.get("range"), iat + ".range")));
        }
        return out;
    }

    private static List<Equation.EquationBlock> blocks(JsonNode arr, String at) {
        List<Equation.EquationBlock> out = new ArrayList<>();
        if (arr == null)
            throw new DefinitionException(at, "missing branches");
        int i = 0;
        for (JsonNode b : arr) {
            String bat = at + "[" + i++ + "]";
            out.add(new Equation.EquationBlock(expression(b.get("cond"), bat + ".cond"),
                    equations(b.get("equations"), bat + ".equations")));
        }
        return out;
    }

    private static BinaryOp binaryOp(String s, String at) {
        try {
            return BinaryOp.fromSymbol(s);
        } catch (IllegalArgumentException e) {
            throw new DefinitionException(at, e.getMessage(), e);
        }
    }

    private static UnaryOp unaryOp(String s, String at) {
        try {
            return UnaryOp.fromSymbol(s);
        } catch (IllegalArgumentException e) {
            throw new DefinitionException(at, e.getMessage(), e);
        }
    }

    private static String fieldNames(JsonNode n) {
        List<String> names = new ArrayList<>();
        n.fieldNames().forEachRemaining(names::add);
        return names.toString();
    }

    // ---- encoding ----

    public static JsonNode encode(Expression e) {
        if (e == null)
            return F.nullNode();
        ObjectNode o = F.objectNode();
        if (e instanceof Expression.Literal lit) {
            String key = switch (lit.kind()) {
                case INTEGER -> "int";
                case REAL -> "real";
                case BOOLEAN -> "bool";
                case STRING -> "string";
            };
            o.put(key, lit.text());
        } else if (e instanceof Expression.ComponentRef ref) {
            if (ref.parts().stream().allMatch(p -> p.subscripts().isEmpty())) {
                o.put("ref", ref.name());
            } else {
                ArrayNode parts = o.putArray("ref");
                for (Expression.RefPart p : ref.parts()) {
                    ObjectNode pn = parts.addObject().put("name", p.name());
                    if (!p.subscripts().isEmpty())
                        pn.set("sub", encodeExpressions(p.subscripts()));
                }
            }
        } else if (e instanceof Expression.Unary u) {
            o.put("unary", u.op().symbol());
            o.set("operand", encode(u.operand()));
        } else if (e instanceof Expression.Binary b) {
            o.put("op", b.op().symbol());
            o.set("lhs", encode(b.lhs()));
            o.set("rhs", encode(b.rhs()));
        } else if (e instanceof Expression.FunctionCall c) {
            o.put("call", c.name());
            o.set("args", encodeExpressions(c.args()));
        } else if (e instanceof Expression.ArrayLiteral a) {
            o.set("array", encodeExpressions(a.elements()));
        } else if (e instanceof Expression.Tuple t) {
            o.set("tuple", encodeExpressions(t.elements()));
        } else if (e instanceof Expression.Range r) {
            ObjectNode rn = o.putObject("range");
            rn.set("start", encode(r.start()));
            if (r.step() != null)
                rn.set("step", encode(r.step()));
            rn.set("end", encode(r.end()));
        } else if (e instanceof Expression.Conditional c) {
            ArrayNode branches = o.putArray("if");
            for (Expression.Branch b : c.branches()) {
                ObjectNode bn = branches.addObject();
                bn.set("cond", encode(b.condition()));
                bn.set("then", encode(b.value()));
            }
            o.set("else", encode(c.elseValue()));
        }
        return o;
    }

    public static JsonNode encode(Equation eq) {
        ObjectNode o = F.objectNode();
        if (eq instanceof Equation.Simple s) {
            ObjectNode sn = o.putObject("simple");
            sn.set("lhs", encode(s.lhs()));
            sn.set("rhs", encode(s.rhs()));
        } else if (eq instanceof Equation.Connect c) {
            ObjectNode cn = o.putObject("connect");
            cn.set("lhs", encode(c.lhs()));
            cn.set("rhs", encode(c.rhs()));
        } else if (eq instanceof Equation.For f) {
            ObjectNode fn = o.putObject("for");
            fn.set("indices", encodeIndices(f.indices()));
            fn.set("equations", encodeEquations(f.equations()));
        } else if (eq instanceof Equation.When w) {
            o.set("when", encodeBlocks(w.blocks()));
        } else if (eq instanceof Equation.If i) {
            ObjectNode in = o.putObject("if");
            in.set("branches", encodeBlocks(i.blocks()));
            if (!i.elseEquations().isEmpty())
                in.set("else", encodeEquations(i.elseEquations()));
        } else if (eq instanceof Equation.FunctionCallEquation c) {
            o.put("call", c.name());
            o.set("args", encodeExpressions(c.args()));
        }
        return o;
    }

    public static ArrayNode encodeEquations(List<Equation> eqs) {
        ArrayNode arr = F.arrayNode();
        for (Equation eq : eqs)
            arr.add(encode(eq));
        return arr;
    }

    public static JsonNode encode(Statement st) {
        ObjectNode o = F.objectNode();
        if (st instanceof Statement.Assignment a) {
            ObjectNode an = o.putObject("assign");
            an.set("target", encode(a.target()));
            an.set("value", encode(a.value()));
        } else if (st instanceof Statement.CallStatement c) {
            o.put("call", c.name());
            o.set("args", encodeExpressions(c.args()));
        } else if (st instanceof Statement.ForStatement f) {
            ObjectNode fn = o.putObject("for");
            fn.set("indices", encodeIndices(f.indices()));
            fn.set("body", encodeStatements(f.body()));
        } else if (st instanceof Statement.WhileStatement w) {
            ObjectNode wn = o.putObject("while");
            wn.set("cond", encode(w.condition()));
            wn.set("body", encodeStatements(w.body()));
        } else if (st instanceof Statement.Return) {
            o.put("return", true);
        } else if (st instanceof Statement.Break) {
            o.put("break", true);
        }
        return o;
    }

    public static ArrayNode encodeStatements(List<Statement> sts) {
        ArrayNode arr = F.arrayNode();
        for (Statement st : sts)
            arr.add(encode(st));
        return arr;
    }

    private static ArrayNode encodeExpressions(List<Expression> es) {
        ArrayNode arr = F.arrayNode();
        for (Expression e : es)
            arr.add(encode(e));
        return arr;
    }

    private static ArrayNode encodeIndices(List<Equation.ForIndex> indices) {
        ArrayNode arr = F.arrayNode();
        for (Equation.ForIndex idx : indices) {
            ObjectNode in = arr.addObject().put("name", idx.name());
            in.set("range", encode(idx.range()));
        }
        return arr;
    }

    private static ArrayNode encodeBlocks(List<Equation.EquationBlock> blocks) {
        ArrayNode arr = F.arrayNode();
        for (Equation.EquationBlock b : blocks) {
            ObjectNode bn = arr.addObject();
            bn.set("cond", encode(b.condition()));
            bn.set("equations", encodeEquations(b.equations()));
        }
        return arr;
    }
}
