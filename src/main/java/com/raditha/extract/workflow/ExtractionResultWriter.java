package com.raditha.extract.workflow;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.raditha.extract.model.ExtractionResult;

import java.io.IOException;
import java.io.Writer;

/**
 * Serializes extraction results as JSON for the protocol layer.
 * Absent optional fields are left out of the output.
 */
public class ExtractionResultWriter {

    private final ObjectMapper mapper;

    public ExtractionResultWriter() {
        this(false);
    }

    public ExtractionResultWriter(boolean pretty) {
        this.mapper = new ObjectMapper()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(SerializationFeature.INDENT_OUTPUT, pretty);
    }

    public String toJson(ExtractionResult result) throws JsonProcessingException {
        return mapper.writeValueAsString(result);
    }

    public void write(ExtractionResult result, Writer out) throws IOException {
        mapper.writeValue(out, result);
    }
}
