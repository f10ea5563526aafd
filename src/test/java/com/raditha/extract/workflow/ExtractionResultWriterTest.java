package com.raditha.extract.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raditha.extract.model.ErrorKind;
import com.raditha.extract.model.ExtractionPreview;
import com.raditha.extract.model.ExtractionResult;
import com.raditha.extract.model.MethodCharacteristics;
import com.raditha.extract.model.ParameterSpec;
import com.raditha.extract.model.VariableRole;
import com.raditha.extract.model.Warning;
import org.junit.jupiter.api.Test;

import java.io.StringWriter;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExtractionResultWriterTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void testFailureOmitsAbsentFields() throws Exception {
        String json = new ExtractionResultWriter().toJson(
                ExtractionResult.failure(ErrorKind.NAME_COLLISION, "A method named 'load' already exists in Loader"));

        assertTrue(json.contains("\"errorCode\":\"NAME_COLLISION\""));
        JsonNode node = mapper.readTree(json);
        assertFalse(node.get("success").asBoolean());
        assertFalse(node.has("methodName"));
        assertFalse(node.has("preview"));
        assertFalse(node.has("newVersion"));
        assertEquals(ErrorKind.NAME_COLLISION.suggestion(), node.get("suggestions").get(0).asText());
    }

    @Test
    void testSuccess() throws Exception {
        ExtractionResult result = new ExtractionResult(
                true,
                "helper",
                "private static int helper(int a) {\n    return a;\n}",
                "int y = helper(a);",
                "int",
                List.of(ParameterSpec.of("a", "int", VariableRole.BY_VALUE)),
                new MethodCharacteristics(false, true, false, false, false, true, false, false, 1),
                new ExtractionPreview("before", "after", "diff"),
                2L,
                List.of(Warning.of(Warning.BOUNDARY_EXPANDED, "Selection expanded to the whole try statement", 4)),
                null,
                null,
                List.of());

        JsonNode node = mapper.readTree(new ExtractionResultWriter().toJson(result));

        assertTrue(node.get("success").asBoolean());
        assertEquals("helper", node.get("methodName").asText());
        assertEquals("int", node.get("parameters").get(0).get("type").asText());
        assertEquals("BY_VALUE", node.get("parameters").get(0).get("role").asText());
        assertTrue(node.get("characteristics").get("staticMethod").asBoolean());
        assertEquals("after", node.get("preview").get("modifiedSource").asText());
        assertEquals(2, node.get("newVersion").asLong());
        assertEquals(4, node.get("warnings").get(0).get("line").asInt());
        assertFalse(node.has("errorCode"));
    }

    @Test
    void testPrettyWriter() throws Exception {
        StringWriter out = new StringWriter();
        new ExtractionResultWriter(true).write(ExtractionResult.failure(ErrorKind.CANCELLED, "Cancelled before VALIDATING"), out);

        assertTrue(out.toString().contains("\n"));
        assertEquals("CANCELLED", mapper.readTree(out.toString()).get("errorCode").asText());
    }
}
