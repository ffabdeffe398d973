package com.modeling.dae.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.modeling.dae.ast.*;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Reads class table documents and converts them to and from the AST.
 */
public final class ClassTableLoader {
    static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private ClassTableLoader() {
        // Utility class
    }

    /** Parses a JSON file into a ClassTableDefinition. */
    public static ClassTableDefinition parseFile(Path path) throws IOException {
        return parse(Files.readString(path));
    }

    /** Parses a JSON string into a ClassTableDefinition. */
    public static ClassTableDefinition parse(String json) {
        try {
            ClassTableDefinition def = MAPPER.readValue(json, ClassTableDefinition.class);
            if (def == null || def.getClasses() == null)
                throw new DefinitionException("", "Missing 'classes' key");
            return def;
        } catch (JsonProcessingException e) {
            throw new DefinitionException("", "Malformed class table: " + e.getOriginalMessage(), e);
        }
    }

    /** Parses a classpath resource, e.g. {@code /models/integrator.json}. */
    public static ClassTableDefinition parseResource(String resource) {
        try (InputStream in = ClassTableLoader.class.getResourceAsStream(resource)) {
            if (in == null)
                throw new DefinitionException(resource, "resource not found");
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new DefinitionException(resource, "cannot read resource", e);
        }
    }

    public static Map<String, ClassDefinition> loadFile(Path path) throws IOException {
        return toClassTable(parseFile(path));
    }

    public static Map<String, ClassDefinition> loadResource(String resource) {
        return toClassTable(parseResource(resource));
    }

    /** Decodes every class, keeping document order. */
    public static Map<String, ClassDefinition> toClassTable(ClassTableDefinition def) {
        Map<String, ClassDefinition> table = new LinkedHashMap<>();
        int i = 0;
        for (ClassTableDefinition.ClassDef cd : def.getClasses()) {
            String at = cd.getName() == null ? "classes[" + i + "]" : cd.getName();
            if (cd.getName() == null || cd.getName().isBlank())
                throw new DefinitionException(at, "class requires a name");
            if (table.containsKey(cd.getName()))
                throw new DefinitionException(at, "duplicate class");
            table.put(cd.getName(), toClass(cd, at));
            i++;
        }
        return table;
    }

    private static ClassDefinition toClass(ClassTableDefinition.ClassDef cd, String at) {
        ClassDefinition.Builder b;
        try {
            b = ClassDefinition.builder(cd.getName())
                    .classType(ClassType.fromString(cd.getType()))
                    .partial(cd.isPartial())
                    .encapsulated(cd.isEncapsulated())
                    .description(cd.getDescription());
        } catch (IllegalArgumentException e) {
            throw new DefinitionException(at, e.getMessage(), e);
        }
        for (String base : orEmpty(cd.getExtendsClauses()))
            b.addExtends(base);
        for (ClassTableDefinition.ComponentDef c : orEmpty(cd.getComponents())) {
            String cat = at + "." + c.getName();
            try {
                b.addComponent(toComponent(c, cat));
            } catch (IllegalArgumentException e) {
                throw new DefinitionException(cat, e.getMessage(), e);
            }
        }
        b.equations(decodeEquations(cd.getEquations(), at + ".equations"));
        b.initialEquations(decodeEquations(cd.getInitialEquations(), at + ".initial_equations"));
        int k = 0;
        for (List<JsonNode> block : orEmpty(cd.getAlgorithms()))
            b.addAlgorithm(decodeStatements(block, at + ".algorithms[" + k++ + "]"));
        k = 0;
        for (List<JsonNode> block : orEmpty(cd.getInitialAlgorithms()))
            b.addInitialAlgorithm(decodeStatements(block, at + ".initial_algorithms[" + k++ + "]"));
        return b.build();
    }

    private static Component toComponent(ClassTableDefinition.ComponentDef c, String at) {
        List<Expression> shape = new ArrayList<>();
        int i = 0;
        for (JsonNode dim : orEmpty(c.getShape()))
            shape.add(AstJsonCodec.expression(dim, at + ".shape[" + i++ + "]"));
        JsonNode start = c.getStart();
        return Component.builder(c.getName(), c.getType())
                .variability(Variability.fromString(c.getVariability()))
                .causality(Causality.fromString(c.getCausality()))
                .connection(Connection.fromString(c.getConnection()))
                .shape(shape)
                .start(start == null || start.isNull() ? null : AstJsonCodec.expression(start, at + ".start"))
                .description(c.getDescription())
                .build();
    }

    private static List<Equation> decodeEquations(List<JsonNode> nodes, String at) {
        List<Equation> out = new ArrayList<>();
        int i = 0;
        for (JsonNode n : orEmpty(nodes))
            out.add(AstJsonCodec.equation(n, at + "[" + i++ + "]"));
        return out;
    }

    private static List<Statement> decodeStatements(List<JsonNode> nodes, String at) {
        List<Statement> out = new ArrayList<>();
        int i = 0;
        for (JsonNode n : orEmpty(nodes))
            out.add(AstJsonCodec.statement(n, at + "[" + i++ + "]"));
        return out;
    }

    /** Encodes a class table back into its document form. */
    public static ClassTableDefinition toDefinition(String name, Map<String, ClassDefinition> table) {
        ClassTableDefinition def = new ClassTableDefinition();
        def.setName(name);
        List<ClassTableDefinition.ClassDef> classes = new ArrayList<>();
        for (ClassDefinition c : table.values())
            classes.add(toClassDef(c));
        def.setClasses(classes);
        return def;
    }

    private static ClassTableDefinition.ClassDef toClassDef(ClassDefinition c) {
        ClassTableDefinition.ClassDef cd = new ClassTableDefinition.ClassDef();
        cd.setName(c.getName());
        cd.setType(c.getClassType().name().toLowerCase());
        cd.setDescription(c.getDescription());
        cd.setPartial(c.isPartial());
        cd.setEncapsulated(c.isEncapsulated());
        cd.setExtendsClauses(c.getExtendsClauses().stream().map(Extend::baseName).toList());
        List<ClassTableDefinition.ComponentDef> comps = new ArrayList<>();
        for (Component comp : c.getComponents().values())
            comps.add(toComponentDef(comp));
        cd.setComponents(comps);
        cd.setEquations(c.getEquations().stream().map(AstJsonCodec::encode).toList());
        cd.setInitialEquations(c.getInitialEquations().stream().map(AstJsonCodec::encode).toList());
        cd.setAlgorithms(c.getAlgorithms().stream()
                .map(block -> block.stream().map(AstJsonCodec::encode).toList()).toList());
        cd.setInitialAlgorithms(c.getInitialAlgorithms().stream()
                .map(block -> block.stream().map(AstJsonCodec::encode).toList()).toList());
        return cd;
    }

    static ClassTableDefinition.ComponentDef toComponentDef(Component comp) {
        ClassTableDefinition.ComponentDef d = new ClassTableDefinition.ComponentDef();
        d.setName(comp.name());
        d.setType(comp.typeName());
        d.setVariability(comp.variability().name().toLowerCase());
        d.setCausality(comp.causality().name().toLowerCase());
        d.setConnection(comp.connection() == Connection.NONE ? null : comp.connection().name().toLowerCase());
        d.setDescription(comp.description());
        d.setStart(comp.start() == null ? null : AstJsonCodec.encode(comp.start()));
        d.setShape(comp.shape().stream().map(AstJsonCodec::encode).toList());
        return d;
    }

    /** Canonical JSON text of a class table, stable for identical input. */
    public static String toJson(String name, Map<String, ClassDefinition> table) {
        try {
            return MAPPER.writeValueAsString(toDefinition(name, table));
        } catch (JsonProcessingException e) {
            throw new DefinitionException(name, "cannot encode class table", e);
        }
    }

    private static <T> List<T> orEmpty(List<T> l) {
        return l == null ? List.of() : l;
    }
}
