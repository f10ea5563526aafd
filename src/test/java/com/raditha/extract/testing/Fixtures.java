package com.raditha.extract.testing;

import com.github.javaparser.ast.CompilationUnit;
import com.raditha.extract.analysis.ControlFlowClassifier;
import com.raditha.extract.analysis.DataFlowAnalyzer;
import com.raditha.extract.analysis.LocalScopeResolver;
import com.raditha.extract.analysis.TypeResolver;
import com.raditha.extract.config.ExtractionConfig;
import com.raditha.extract.extraction.SelectionValidator;
import com.raditha.extract.model.AnalysisContext;
import com.raditha.extract.model.ControlFlowSummary;
import com.raditha.extract.model.DataFlowSummary;
import com.raditha.extract.model.NormalizedSelection;
import com.raditha.extract.source.LineIndex;
import com.raditha.extract.source.SourceSnapshot;
import com.raditha.extract.util.SourceParser;

import java.nio.file.Path;

/**
 * Runs the analysis phases over marked source so tests can inspect their output.
 */
public final class Fixtures {

    public static final Path FILE = Path.of("src/main/java/sample/Sample.java");

    private Fixtures() {
    }

    /**
     * Parsed source with the selection validated and analyzed.
     */
    public record Analyzed(
            MarkedSource source,
            SourceSnapshot snapshot,
            SourceParser parser,
            LocalScopeResolver scopes,
            TypeResolver types,
            NormalizedSelection selection,
            ControlFlowSummary flow,
            DataFlowSummary data) {
    }

    public static AnalysisContext context(MarkedSource source, SourceParser parser, ExtractionConfig config) {
        SourceSnapshot snapshot = new SourceSnapshot(FILE, source.text(), 1);
        CompilationUnit cu = parser.parseCompilationUnit(source.text());
        return new AnalysisContext(snapshot, cu, LineIndex.of(source.text()), config);
    }

    public static NormalizedSelection select(String marked) {
        MarkedSource source = MarkedSource.of(marked);
        SourceParser parser = new SourceParser();
        AnalysisContext context = context(source, parser, ExtractionConfig.defaults());
        return new SelectionValidator(new LocalScopeResolver()).validate(context, source.range());
    }

    public static Analyzed analyze(String marked) {
        return analyze(marked, ExtractionConfig.defaults());
    }

    public static Analyzed analyze(String marked, ExtractionConfig config) {
        MarkedSource source = MarkedSource.of(marked);
        SourceParser parser = new SourceParser();
        AnalysisContext context = context(source, parser, config);
        LocalScopeResolver scopes = new LocalScopeResolver();
        TypeResolver types = new TypeResolver(scopes, parser);
        NormalizedSelection selection = new SelectionValidator(scopes).validate(context, source.range());
        ControlFlowSummary flow = new ControlFlowClassifier().classify(selection, config);
        DataFlowSummary data = new DataFlowAnalyzer(scopes, types).analyze(selection, flow);
        return new Analyzed(source, context.snapshot(), parser, scopes, types, selection, flow, data);
    }
}
