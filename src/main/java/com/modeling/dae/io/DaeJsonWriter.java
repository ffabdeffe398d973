package com.modeling.dae.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.modeling.dae.CompilationResult;
import com.modeling.dae.ast.Component;
import com.modeling.dae.ast.Equation;
import com.modeling.dae.ast.ExpressionPrinter;
import com.modeling.dae.blt.BltResult;
import com.modeling.dae.dae.Dae;

import java.util.List;
import java.util.Map;

/**
 * Exports an assembled DAE as pretty-printed JSON. Expressions and equations
 * are rendered as infix text; components keep their full declaration.
 */
public final class DaeJsonWriter {
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private DaeJsonWriter() {
        // Utility class
    }

    public static String write(Dae dae) {
        return render(toJson(dae));
    }

    public static String write(CompilationResult result) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("model", result.name());
        root.put("modelHash", result.modelHash());
        root.set("dae", toJson(result.dae()));
        root.set("balance", MAPPER.valueToTree(result.balance()));
        if (result.blt() != null)
            root.set("blt", toJson(result.blt()));
        ObjectNode timings = root.putObject("timingsNanos");
        result.timings().forEach((stage, nanos) -> timings.put(stage.name(), nanos));
        return render(root);
    }

    public static ObjectNode toJson(Dae dae) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("name", dae.getName());
        root.put("version", dae.getVersion());
        root.put("modelHash", dae.getModelHash());
        ObjectNode vars = root.putObject("variables");
        vars.set("t", component(dae.getT()));
        bucket(vars, "p", dae.getP());
        bucket(vars, "cp", dae.getCp());
        bucket(vars, "x", dae.getX());
        bucket(vars, "x_dot", dae.getXDot());
        bucket(vars, "y", dae.getY());
        bucket(vars, "z", dae.getZ());
        bucket(vars, "m", dae.getM());
        bucket(vars, "u", dae.getU());
        bucket(vars, "pre_x", dae.getPreX());
        bucket(vars, "pre_z", dae.getPreZ());
        bucket(vars, "pre_m", dae.getPreM());
        ObjectNode eqs = root.putObject("equations");
        equations(eqs, "fx", dae.getFx());
        equations(eqs, "fz", dae.getFz());
        equations(eqs, "fm", dae.getFm());
        ObjectNode fc = eqs.putObject("fc");
        dae.getFc().forEach((k, v) -> fc.put(k, ExpressionPrinter.print(v)));
        ObjectNode fr = eqs.putObject("fr");
        dae.getFr().forEach((k, v) -> {
            ArrayNode arr = fr.putArray(k);
            v.forEach(st -> arr.add(ExpressionPrinter.print(st)));
        });
        return root;
    }

    private static ObjectNode toJson(BltResult blt) {
        ObjectNode node = MAPPER.createObjectNode();
        ArrayNode blocks = node.putArray("blocks");
        for (List<Integer> block : blt.blocks()) {
            ArrayNode b = blocks.addArray();
            block.forEach(b::add);
        }
        ObjectNode matching = node.putObject("matching");
        blt.matching().forEach((i, v) -> matching.put(String.valueOf(i), v));
        node.put("completeMatching", blt.completeMatching());
        node.put("algebraicLoops", blt.algebraicLoops().size());
        return node;
    }

    private static void bucket(ObjectNode parent, String key, Map<String, Component> vars) {
        ArrayNode arr = parent.putArray(key);
        vars.values().forEach(c -> arr.add(component(c)));
    }

    private static ObjectNode component(Component c) {
        return MAPPER.valueToTree(ClassTableLoader.toComponentDef(c));
    }

    private static void equations(ObjectNode parent, String key, List<Equation> eqs) {
        ArrayNode arr = parent.putArray(key);
        eqs.forEach(eq -> arr.add(ExpressionPrinter.print(eq)));
    }

    private static String render(ObjectNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new DefinitionException("", "cannot encode DAE", e);
        }
    }
}
