package com.modeling.dae.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.modeling.dae.ast.*;
import org.junit.Test;

import java.util.List;
import java.util.Map;

import static com.modeling.dae.ast.Expression.*;
import static org.junit.Assert.*;

public class ClassTableLoaderTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    public void testLoadsFixture() {
        Map<String, ClassDefinition> table = ClassTableLoader.loadResource("/models/rc_circuit.json");

        assertEquals(List.of("RC", "TwoPin", "Resistor", "Capacitor"), List.copyOf(table.keySet()));
        ClassDefinition resistor = table.get("Resistor");
        assertEquals("TwoPin", resistor.getExtendsClauses().get(0).baseName());
        assertEquals(Variability.PARAMETER, resistor.component("R").variability());
        assertEquals(num(100.0), resistor.component("R").start());
        assertEquals(Equation.simple(ref("i"), binary(BinaryOp.DIV, ref("v"), ref("R"))),
                resistor.getEquations().get(0));
        assertTrue(table.get("TwoPin").isPartial());
    }

    @Test
    public void testShortAndLongExpressionForms() throws Exception {
        JsonNode shortForm = MAPPER.readTree("{\"op\": \"+\", \"lhs\": \"a.b\", \"rhs\": 2}");
        JsonNode longForm = MAPPER.readTree("{\"op\": \"+\", \"lhs\": {\"ref\": \"a.b\"}, \"rhs\": {\"int\": \"2\"}}");

        Expression expected = binary(BinaryOp.ADD, ref("a.b"), num(2));
        assertEquals(expected, AstJsonCodec.expression(shortForm, "e"));
        assertEquals(expected, AstJsonCodec.expression(longForm, "e"));
    }

    @Test
    public void testSubscriptedReference() throws Exception {
        JsonNode n = MAPPER.readTree("{\"ref\": [\"a\", {\"name\": \"x\", \"sub\": [\"i\", 1]}]}");
        ComponentRef r = (ComponentRef) AstJsonCodec.expression(n, "e");
        assertEquals("a.x[i,1]", r.toString());
    }

    @Test
    public void testEncodedWhenEquationDecodesToEqualTree() {
        Equation when = new Equation.When(List.of(new Equation.EquationBlock(
                binary(BinaryOp.LT, ref("h"), num(0)),
                List.of(Equation.call("reinit", ref("v"),
                        binary(BinaryOp.MUL, new Unary(UnaryOp.MINUS, ref("e")), call("pre", ref("v"))))))));

        assertEquals(when, AstJsonCodec.equation(AstJsonCodec.encode(when), "eq"));
    }

    @Test
    public void testWriteThenLoadKeepsClasses() {
        Map<String, ClassDefinition> table = ClassTableLoader.loadResource("/models/bouncing_ball.json");
        String json = ClassTableLoader.toJson("bouncing_ball", table);
        assertEquals(table, ClassTableLoader.toClassTable(ClassTableLoader.parse(json)));
    }

    @Test
    public void testUnknownEquationReportsLocation() {
        String json = "{\"classes\": [{\"name\": \"M\", \"equations\": [{\"lhs\": \"x\", \"rhs\": 1}, {\"bogus\": 1}]}]}";
        try {
            ClassTableLoader.toClassTable(ClassTableLoader.parse(json));
            fail("Should reject unknown equation form");
        } catch (DefinitionException e) {
            assertEquals("M.equations[1]", e.getLocation());
            assertTrue(e.getMessage().contains("bogus"));
        }
    }

    @Test
    public void testUnknownOperatorReportsLocation() {
        String json = "{\"classes\": [{\"name\": \"M\", \"equations\": [{\"lhs\": \"x\", \"rhs\": {\"op\": \"%\", \"lhs\": 1, \"rhs\": 2}}]}]}";
        try {
            ClassTableLoader.toClassTable(ClassTableLoader.parse(json));
            fail("Should reject unknown operator");
        } catch (DefinitionException e) {
            assertEquals("M.equations[0].rhs", e.getLocation());
        }
    }

    @Test
    public void testDuplicateClassRejected() {
        String json = "{\"classes\": [{\"name\": \"A\"}, {\"name\": \"A\"}]}";
        try {
            ClassTableLoader.toClassTable(ClassTableLoader.parse(json));
            fail("Should reject duplicate class");
        } catch (DefinitionException e) {
            assertTrue(e.getMessage().contains("duplicate"));
        }
    }

    @Test
    public void testMalformedDocument() {
        try {
            ClassTableLoader.parse("{\"classes\": [");
            fail("Should reject malformed JSON");
        } catch (DefinitionException expected) {
            // expected
        }
        try {
            ClassTableLoader.parse("{\"name\": \"empty\"}");
            fail("Should require classes");
        } catch (DefinitionException e) {
            assertTrue(e.getMessage().contains("classes"));
        }
    }

    @Test
    public void testMissingResource() {
        try {
            ClassTableLoader.loadResource("/models/does_not_exist.json");
            fail("Should report missing resource");
        } catch (DefinitionException e) {
            assertEquals("/models/does_not_exist.json", e.getLocation());
        }
    }
}
