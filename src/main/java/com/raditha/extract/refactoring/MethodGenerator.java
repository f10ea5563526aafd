package com.raditha.extract.refactoring;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.raditha.extract.model.ExtractedSignature;
import com.raditha.extract.model.ParameterSpec;
import com.raditha.extract.util.SourceParser;
import org.jspecify.annotations.NonNull;

import java.util.stream.Collectors;

/**
 * Builds the declaration text of the extracted method and of its result record.
 * Text is parsed once and printed back, so whatever is returned is known to parse.
 */
public class MethodGenerator {

    private final SourceParser parser;

    public MethodGenerator(SourceParser parser) {
        this.parser = parser;
    }

    public GeneratedCode generate(ExtractedSignature signature, TransformedBody body, Node enclosingType) {
        String method = parser.parseBodyDeclaration(header(signature) + " {\n"
                + MethodBodyTransformer.indent(String.join("\n", body.statements())) + "\n}").toString();
        String aggregate = signature.hasAggregate()
                ? parser.parseBodyDeclaration(record(signature, enclosingType)).toString()
                : null;
        return new GeneratedCode(method, aggregate);
    }

    /**
     * Modifiers, type parameters, return type, name, parameters and throws clause.
     */
    static @NonNull String header(ExtractedSignature signature) {
        StringBuilder header = new StringBuilder();
        String access = signature.accessibility().keyword();
        if (!access.isEmpty()) {
            header.append(access).append(' ');
        }
        if (signature.staticMethod()) {
            header.append("static ");
        }
        if (!signature.typeParameters().isEmpty()) {
            header.append('<').append(String.join(", ", signature.typeParameters())).append("> ");
        }
        header.append(signature.returnType()).append(' ').append(signature.name()).append('(')
                .append(signature.parameters().stream()
                        .map(ParameterSpec::toParameterDeclaration)
                        .collect(Collectors.joining(", ")))
                .append(')');
        if (!signature.thrownTypes().isEmpty()) {
            header.append(" throws ").append(String.join(", ", signature.thrownTypes()));
        }
        return header.toString();
    }

    static String record(ExtractedSignature signature, Node enclosingType) {
        boolean inInterface = enclosingType instanceof ClassOrInterfaceDeclaration type && type.isInterface();
        StringBuilder record = new StringBuilder(inInterface ? "" : "private ");
        record.append("record ").append(signature.aggregateName());
        if (!signature.aggregateTypeParameters().isEmpty()) {
            record.append('<').append(String.join(", ", signature.aggregateTypeParameters())).append('>');
        }
        record.append('(')
                .append(signature.components().stream()
                        .map(c -> c.type() + " " + c.name())
                        .collect(Collectors.joining(", ")))
                .append(") {\n}");
        return record.toString();
    }
}
