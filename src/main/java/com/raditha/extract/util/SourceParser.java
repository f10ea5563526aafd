package com.raditha.extract.util;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.type.Type;
import com.github.javaparser.symbolsolver.JavaSymbolSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.CombinedTypeSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.ReflectionTypeSolver;
import com.raditha.extract.model.ErrorKind;
import com.raditha.extract.model.ExtractionException;

import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Java 17 parser with the JavaParser symbol solver attached.
 * Not thread safe; create one per request.
 */
public class SourceParser {

    private final JavaParser parser;

    public SourceParser() {
        ParserConfiguration configuration = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17)
                .setSymbolResolver(new JavaSymbolSolver(new CombinedTypeSolver(new ReflectionTypeSolver())));
        this.parser = new JavaParser(configuration);
    }

    /**
     * Parse a complete source file.
     *
     * @throws ExtractionException INTERNAL_ANALYSIS_FAILURE when the text does not parse
     */
    public CompilationUnit parseCompilationUnit(String source) {
        return require(parser.parse(source), source);
    }

    public Statement parseStatement(String text) {
        return require(parser.parseStatement(text), text);
    }

    public BlockStmt parseBlock(String text) {
        return require(parser.parseBlock(text), text);
    }

    public Expression parseExpression(String text) {
        return require(parser.parseExpression(text), text);
    }

    public BodyDeclaration<?> parseBodyDeclaration(String text) {
        return require(parser.parseBodyDeclaration(text), text);
    }

    /**
     * Parse a type, returning empty when the text is not a valid type.
     */
    public Optional<Type> tryParseType(String text) {
        ParseResult<Type> result = parser.parseType(text);
        if (result.isSuccessful()) {
            return result.getResult();
        }
        return Optional.empty();
    }

    /**
     * Parse a complete source file, leaving failure handling to the caller.
     */
    public ParseResult<CompilationUnit> tryParseCompilationUnit(String source) {
        return parser.parse(source);
    }

    private static <T extends Node> T require(ParseResult<T> result, String text) {
        if (result.isSuccessful() && result.getResult().isPresent()) {
            return result.getResult().get();
        }
        String problems = result.getProblems().stream()
                .map(Problem::getVerboseMessage)
                .collect(Collectors.joining("; "));
        throw new ExtractionException(ErrorKind.INTERNAL_ANALYSIS_FAILURE,
                "Generated or supplied code does not parse: " + problems + "\n" + text);
    }
}
