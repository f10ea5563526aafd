package com.raditha.extract.workflow;

import com.github.javaparser.Position;
import com.github.javaparser.ast.CompilationUnit;
import com.raditha.extract.analysis.ControlFlowClassifier;
import com.raditha.extract.analysis.DataFlowAnalyzer;
import com.raditha.extract.analysis.InstanceStateAnalyzer;
import com.raditha.extract.analysis.LocalScopeResolver;
import com.raditha.extract.analysis.TypeResolver;
import com.raditha.extract.config.ExtractionConfig;
import com.raditha.extract.config.ExtractorSettings;
import com.raditha.extract.extraction.SelectionValidator;
import com.raditha.extract.model.AnalysisContext;
import com.raditha.extract.model.ControlFlowSummary;
import com.raditha.extract.model.DataFlowSummary;
import com.raditha.extract.model.ErrorKind;
import com.raditha.extract.model.ExtractedSignature;
import com.raditha.extract.model.ExtractionException;
import com.raditha.extract.model.ExtractionMode;
import com.raditha.extract.model.ExtractionPreview;
import com.raditha.extract.model.ExtractionRequest;
import com.raditha.extract.model.ExtractionResult;
import com.raditha.extract.model.MethodCharacteristics;
import com.raditha.extract.model.NormalizedSelection;
import com.raditha.extract.model.Warning;
import com.raditha.extract.refactoring.CallSiteGenerator;
import com.raditha.extract.refactoring.DiffGenerator;
import com.raditha.extract.refactoring.GeneratedCode;
import com.raditha.extract.refactoring.GeneratedCodeVerifier;
import com.raditha.extract.refactoring.GeneratedCodeVerifier.VerificationResult;
import com.raditha.extract.refactoring.MethodBodyTransformer;
import com.raditha.extract.refactoring.MethodGenerator;
import com.raditha.extract.refactoring.NameAllocator;
import com.raditha.extract.refactoring.SignatureInferencer;
import com.raditha.extract.refactoring.TransformedBody;
import com.raditha.extract.source.EditApplier;
import com.raditha.extract.source.EditOutcome;
import com.raditha.extract.source.LineIndex;
import com.raditha.extract.source.SourceAccess;
import com.raditha.extract.source.SourceSnapshot;
import com.raditha.extract.source.TextEdit;
import com.raditha.extract.util.Indentation;
import com.raditha.extract.util.SourceParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Runs one extraction request from selection to preview or applied edit.
 * <p>
 * The orchestrator keeps no per-request state: every collaborator that caches
 * analysis results is created for the request and dropped afterwards, so a single
 * instance may serve requests from several threads.
 */
public class ExtractionOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(ExtractionOrchestrator.class);

    private final SourceAccess sources;
    private final EditApplier applier;
    private final ExtractionConfig config;
    private final DiffGenerator diffs = new DiffGenerator();

    /**
     * Creates an orchestrator configured from extractor.yml on the classpath.
     */
    public ExtractionOrchestrator(SourceAccess sources, EditApplier applier) {
        this(sources, applier, ExtractorSettings.loadConfig());
    }

    /**
     * Creates a new orchestrator.
     *
     * @param sources supplies versioned snapshots
     * @param applier applies the final edits atomically
     * @param config  extraction configuration used for every request
     */
    public ExtractionOrchestrator(SourceAccess sources, EditApplier applier, ExtractionConfig config) {
        this.sources = sources;
        this.applier = applier;
        this.config = config;
    }

    public ExtractionResult execute(ExtractionRequest request) {
        return execute(request, () -> false);
    }

    /**
     * Execute a request, checking the cancellation hook before every phase.
     * Never throws; every failure is reported in the result.
     */
    public ExtractionResult execute(ExtractionRequest request, BooleanSupplier cancelled) {
        PhaseTracker tracker = new PhaseTracker(request.filePath(), cancelled);
        try {
            ExtractionResult result = run(request, tracker);
            tracker.enter(ExtractionPhase.DONE);
            return result;
        } catch (ExtractionException e) {
            tracker.fail(e.getKind());
            logger.warn("Extraction in {} at {} failed: {}", request.filePath(), request.range(), e.getMessage());
            return ExtractionResult.failure(e);
        } catch (RuntimeException e) {
            tracker.fail(ErrorKind.INTERNAL_ANALYSIS_FAILURE);
            logger.warn("Extraction in {} at {} failed unexpectedly", request.filePath(), request.range(), e);
            return ExtractionResult.failure(ErrorKind.INTERNAL_ANALYSIS_FAILURE,
                    e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private ExtractionResult run(ExtractionRequest request, PhaseTracker tracker) {
        tracker.enter(ExtractionPhase.VALIDATING);
        SourceSnapshot snapshot = read(request);
        SourceParser parser = new SourceParser();
        CompilationUnit cu = parser.parseCompilationUnit(snapshot.text());
        LineIndex lines = LineIndex.of(snapshot.text());
        AnalysisContext context = new AnalysisContext(snapshot, cu, lines, config);

        LocalScopeResolver scopes = new LocalScopeResolver();
        TypeResolver types = new TypeResolver(scopes, parser);
        NormalizedSelection selection = new SelectionValidator(scopes).validate(context, request.range());

        tracker.enter(ExtractionPhase.ANALYZING_FLOW);
        ControlFlowSummary flow = new ControlFlowClassifier().classify(selection, config);
        DataFlowSummary data = new DataFlowAnalyzer(scopes, types).analyze(selection, flow);

        tracker.enter(ExtractionPhase.INFERRING_SIGNATURE);
        NameAllocator names = new NameAllocator(selection.enclosingType());
        ExtractedSignature signature = new SignatureInferencer(
                types, new InstanceStateAnalyzer(scopes), parser, names, config)
                .infer(selection, flow, data, request);

        tracker.enter(ExtractionPhase.TRANSFORMING);
        TransformedBody body = new MethodBodyTransformer(parser, names, config)
                .transform(snapshot, selection, flow, data, signature);

        tracker.enter(ExtractionPhase.GENERATING);
        GeneratedCode code = new MethodGenerator(parser).generate(signature, body, selection.enclosingType());
        String callSite = new CallSiteGenerator(names).generate(selection, signature);
        List<TextEdit> edits = edits(selection, lines, code, callSite);
        String modified = TextEdit.applyAll(snapshot.text(), edits);

        VerificationResult verification = new GeneratedCodeVerifier(parser)
                .verify(code, callSite, selection.mode(), modified, signature.name());
        if (!verification.isValid()) {
            throw new ExtractionException(ErrorKind.INTERNAL_ANALYSIS_FAILURE,
                    String.join("\n", verification.getErrors()));
        }
        verification.getWarnings().forEach(w -> logger.debug("{}: {}", request.filePath(), w));

        List<Warning> warnings = new ArrayList<>(selection.warnings());
        warnings.addAll(signature.warnings());
        ExtractionPreview preview = new ExtractionPreview(snapshot.text(), modified,
                diffs.generateUnifiedDiff(snapshot.path(), snapshot.text(), modified));

        Long newVersion = null;
        if (request.mode() == ExtractionMode.APPLY) {
            tracker.enter(ExtractionPhase.APPLYING);
            newVersion = apply(snapshot, edits);
            logger.info("Extracted {}() in {} (version {} -> {})",
                    signature.name(), snapshot.path(), snapshot.version(), newVersion);
        } else {
            tracker.enter(ExtractionPhase.PREVIEWING);
        }

        return new ExtractionResult(
                true,
                signature.name(),
                code.hasAggregate() ? code.method() + lines.lineSeparator() + lines.lineSeparator() + code.aggregate()
                        : code.method(),
                callSite,
                signature.returnType(),
                signature.parameters(),
                MethodCharacteristics.of(signature, flow),
                preview,
                newVersion,
                warnings,
                null,
                null,
                List.of());
    }

    private SourceSnapshot read(ExtractionRequest request) {
        try {
            return sources.snapshot(request.filePath());
        } catch (IOException e) {
            throw new ExtractionException(ErrorKind.INTERNAL_ANALYSIS_FAILURE,
                    "Cannot read " + request.filePath() + ": " + e.getMessage(), e);
        }
    }

    /**
     * The call site replaces the selection; the method, and its result record when there
     * is one, go after the member holding the selection.
     */
    static List<TextEdit> edits(NormalizedSelection selection, LineIndex lines, GeneratedCode code, String callSite) {
        String separator = lines.lineSeparator();
        String callIndent = lines.indentationOf(lines.lineOf(selection.startOffset()));
        String replacement = Indentation.reindent(callSite, callIndent, separator, true);

        Position memberBegin = selection.member().getBegin()
                .orElseThrow(() -> new ExtractionException(ErrorKind.INTERNAL_ANALYSIS_FAILURE,
                        "Enclosing member has no position"));
        Position memberEnd = selection.member().getEnd()
                .orElseThrow(() -> new ExtractionException(ErrorKind.INTERNAL_ANALYSIS_FAILURE,
                        "Enclosing member has no position"));
        String memberIndent = lines.indentationOf(memberBegin.line);
        int insertAt = lines.offset(memberEnd) + 1;

        StringBuilder inserted = new StringBuilder();
        inserted.append(separator).append(separator)
                .append(Indentation.reindent(code.method(), memberIndent, separator, false));
        if (code.hasAggregate()) {
            inserted.append(separator).append(separator)
                    .append(Indentation.reindent(code.aggregate(), memberIndent, separator, false));
        }

        return List.of(
                TextEdit.replace(selection.startOffset(), selection.endOffset(), replacement),
                TextEdit.insert(insertAt, inserted.toString()));
    }

    private long apply(SourceSnapshot snapshot, List<TextEdit> edits) {
        EditOutcome outcome;
        try {
            outcome = applier.apply(snapshot.path(), snapshot.version(), edits);
        } catch (IOException e) {
            throw new ExtractionException(ErrorKind.INTERNAL_ANALYSIS_FAILURE,
                    "Could not write " + snapshot.path() + ": " + e.getMessage(), e);
        }
        if (!outcome.applied()) {
            throw new ExtractionException(ErrorKind.STALE_SNAPSHOT, outcome.detail());
        }
        return outcome.version();
    }
}
