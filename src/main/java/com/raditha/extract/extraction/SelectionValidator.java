package com.raditha.extract.extraction;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.SwitchExpr;
import com.github.javaparser.ast.expr.ThisExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.BreakStmt;
import com.github.javaparser.ast.stmt.ContinueStmt;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ExplicitConstructorInvocationStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.LabeledStmt;
import com.github.javaparser.ast.stmt.LocalClassDeclarationStmt;
import com.github.javaparser.ast.stmt.LocalRecordDeclarationStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.github.javaparser.ast.stmt.SynchronizedStmt;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.resolution.types.ResolvedType;
import com.raditha.extract.analysis.JumpTargets;
import com.raditha.extract.analysis.LocalScopeResolver;
import com.raditha.extract.model.AnalysisContext;
import com.raditha.extract.model.ErrorKind;
import com.raditha.extract.model.ExtractionException;
import com.raditha.extract.model.NormalizedSelection;
import com.raditha.extract.model.Range;
import com.raditha.extract.model.SelectionMode;
import com.raditha.extract.model.Warning;
import com.raditha.extract.source.LineIndex;
import com.raditha.extract.util.ASTUtility;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns a raw character range into a validated selection of whole statements or
 * a single expression.
 *
 * Rules are applied in order: the range must sit inside one method, constructor or
 * lambda body; partially covered loops, try and synchronized statements are expanded
 * with a warning while any other partial statement is rejected; case labels may not
 * be crossed; and only one case group may be selected.
 */
public class SelectionValidator {
    private static final Logger logger = LoggerFactory.getLogger(SelectionValidator.class);

    private final LocalScopeResolver scopes;

    public SelectionValidator(LocalScopeResolver scopes) {
        this.scopes = scopes;
    }

    /**
     * Character span of the selection, end exclusive.
     */
    private record Span(int start, int end) {
    }

    /**
     * Intermediate result of matching the span against the tree.
     */
    private record Match(List<Statement> statements, Expression expression, boolean slot) {
        static Match of(List<Statement> statements, boolean slot) {
            return new Match(List.copyOf(statements), null, slot);
        }

        static Match of(Expression expression) {
            return new Match(List.of(), expression, false);
        }
    }

    /**
     * Validate and normalize a requested range.
     *
     * @throws ExtractionException when the range cannot be extracted
     */
    public NormalizedSelection validate(AnalysisContext context, Range range) {
        LineIndex lines = context.lineIndex();
        CompilationUnit cu = context.compilationUnit();
        Span span = trim(toSpan(range, lines), lines, cu);

        Node callable = findCallable(cu, span, lines).orElseThrow(() -> new ExtractionException(
                ErrorKind.EMPTY_SELECTION, "The selection " + range + " is not inside a method body"));
        Node body = bodyOf(callable);

        List<Warning> warnings = new ArrayList<>();
        Matcher matcher = new Matcher(lines, span, callable, warnings);
        Match match = body instanceof BlockStmt block
                ? matcher.match(block)
                : matcher.matchExpressionBody(((LambdaExpr) callable).getExpressionBody().orElseThrow());

        NormalizedSelection selection = build(match, callable, lines, warnings);
        checkJumps(selection);
        checkDeclarations(selection, body, lines);
        checkConstructorState(selection);

        logger.debug("Normalized selection {} to {} ({} mode)", range, selection.range(), selection.mode());
        return selection;
    }

    private static Span toSpan(Range range, LineIndex lines) {
        if (!range.isOrdered() || range.startLine() > lines.lineCount() || range.endLine() > lines.lineCount()) {
            throw new ExtractionException(ErrorKind.EMPTY_SELECTION,
                    "The selection " + range + " lies outside the file");
        }
        int start = lines.offset(range.startLine(), range.startColumn());
        int end = Math.min(lines.offset(range.endLine(), range.endColumn()) + 1, lines.lineEnd(range.endLine()));
        return new Span(start, Math.max(start, end));
    }

    /**
     * Drop surrounding whitespace and comments.
     */
    private static Span trim(Span span, LineIndex lines, CompilationUnit cu) {
        String text = lines.text();
        List<Span> comments = new ArrayList<>();
        for (Comment comment : cu.getAllContainedComments()) {
            comment.getRange().ifPresent(r -> comments.add(new Span(lines.offset(r.begin), lines.offset(r.end) + 1)));
        }
        int start = span.start();
        int end = span.end();
        boolean changed = true;
        while (changed) {
            changed = false;
            while (start < end && Character.isWhitespace(text.charAt(start))) {
                start++;
            }
            while (end > start && Character.isWhitespace(text.charAt(end - 1))) {
                end--;
            }
            for (Span comment : comments) {
                if (comment.start() == start && comment.end() <= end) {
                    start = comment.end();
                    changed = true;
                } else if (comment.end() == end && comment.start() >= start) {
                    end = comment.start();
                    changed = true;
                }
            }
        }
        if (start >= end) {
            throw new ExtractionException(ErrorKind.EMPTY_SELECTION, "The selection covers no code");
        }
        return new Span(start, end);
    }

    private static Optional<Node> findCallable(CompilationUnit cu, Span span, LineIndex lines) {
        Node best = null;
        int bestOpen = -1;
        for (Node candidate : cu.findAll(Node.class, n -> n instanceof MethodDeclaration
                || n instanceof ConstructorDeclaration || n instanceof LambdaExpr)) {
            Node body = candidate instanceof LambdaExpr lambda && lambda.getExpressionBody().isPresent()
                    ? lambda.getExpressionBody().get()
                    : bodyOf(candidate);
            if (body == null || body.getRange().isEmpty()) {
                continue;
            }
            int open = ASTUtility.beginOffset(body, lines);
            int close = ASTUtility.endOffset(body, lines);
            boolean contains = body instanceof BlockStmt
                    ? open < span.start() && span.end() <= close - 1
                    : open <= span.start() && span.end() <= close;
            if (contains && open >= bestOpen) {
                best = candidate;
                bestOpen = open;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Block body of a method, constructor or lambda, or the statement wrapping a lambda's expression body.
     */
    static Node bodyOf(Node callable) {
        if (callable instanceof MethodDeclaration method) {
            return method.getBody().orElse(null);
        }
        if (callable instanceof ConstructorDeclaration constructor) {
            return constructor.getBody();
        }
        if (callable instanceof LambdaExpr lambda) {
            return lambda.getBody();
        }
        return null;
    }

    /**
     * Walks down from the callable body to the statements or expression the span denotes.
     */
    private final class Matcher {
        private final LineIndex lines;
        private final String text;
        private final Span span;
        private final Node callable;
        private final List<Warning> warnings;

        Matcher(LineIndex lines, Span span, Node callable, List<Warning> warnings) {
            this.lines = lines;
            this.text = lines.text();
            this.span = span;
            this.callable = callable;
            this.warnings = warnings;
        }

        Match match(BlockStmt body) {
            Node container = innermostContainer(body);
            if (container instanceof SwitchEntry entry) {
                return matchEntry(entry);
            }
            return matchList(((BlockStmt) container).getStatements(), false);
        }

        /**
         * The body of an expression lambda holds no statements, so only an expression inside it can match.
         */
        Match matchExpressionBody(Expression body) {
            for (Expression candidate : ASTUtility.findSameCallable(body, Expression.class)) {
                if (candidate.getRange().isPresent() && begin(candidate) == span.start()
                        && end(candidate) == span.end()) {
                    return expressionMatch(candidate);
                }
            }
            throw new ExtractionException(ErrorKind.INCOMPLETE_SELECTION,
                    "The selection covers part of the lambda expression at line " + ASTUtility.line(body));
        }

        private Node innermostContainer(BlockStmt body) {
            Node best = body;
            int bestBegin = begin(body);
            List<Node> candidates = new ArrayList<>();
            candidates.addAll(body.findAll(BlockStmt.class));
            candidates.addAll(body.findAll(SwitchEntry.class));
            for (Node candidate : candidates) {
                if (candidate.getRange().isEmpty() || !inSameCallable(candidate)) {
                    continue;
                }
                boolean contains = candidate instanceof BlockStmt
                        ? begin(candidate) < span.start() && span.end() <= end(candidate) - 1
                        : begin(candidate) <= span.start() && span.end() <= end(candidate);
                if (contains && begin(candidate) >= bestBegin && candidate != body) {
                    best = candidate;
                    bestBegin = begin(candidate);
                }
            }
            if (!inSameCallable(best)) {
                throw new ExtractionException(ErrorKind.EMPTY_SELECTION, "The selection is not inside a method body");
            }
            return best;
        }

        private Match matchEntry(SwitchEntry entry) {
            boolean inSwitchExpression = entry.getParentNode().orElse(null) instanceof SwitchExpr;
            List<Statement> statements = entry.getStatements();
            int firstStatement = statements.isEmpty() ? end(entry) : begin(statements.get(0));
            if (span.start() < firstStatement) {
                if (span.start() <= begin(entry) && span.end() >= end(entry) && !statements.isEmpty()) {
                    warnings.add(Warning.of(Warning.CASE_LABEL_EXCLUDED,
                            "The case label stays in place; only the statements of the group are extracted",
                            ASTUtility.line(entry)));
                    if (inSwitchExpression && entry.getType() != SwitchEntry.Type.STATEMENT_GROUP) {
                        return expressionArm(entry, statements.get(0));
                    }
                    return Match.of(statements, entry.getType() != SwitchEntry.Type.STATEMENT_GROUP);
                }
                throw new ExtractionException(ErrorKind.INCOMPLETE_SELECTION,
                        "The selection covers part of the case label at line " + ASTUtility.line(entry));
            }
            if (inSwitchExpression && entry.getType() != SwitchEntry.Type.STATEMENT_GROUP) {
                Match inner = matchList(statements, true);
                if (inner.expression() != null) {
                    return inner;
                }
                return expressionArm(entry, inner.statements().get(0));
            }
            return matchList(statements, entry.getType() != SwitchEntry.Type.STATEMENT_GROUP);
        }

        /**
         * An arm of a switch expression must keep producing a value, so only its expression can move.
         */
        private Match expressionArm(SwitchEntry entry, Statement statement) {
            if (statement instanceof ExpressionStmt expressionStmt) {
                return expressionMatch(expressionStmt.getExpression());
            }
            throw new ExtractionException(ErrorKind.INCOMPLETE_SELECTION,
                    "Select the value of the switch expression arm at line " + ASTUtility.line(entry));
        }

        private Match matchList(List<Statement> list, boolean slot) {
            List<Statement> overlapped = list.stream()
                    .filter(s -> begin(s) < span.end() && end(s) > span.start())
                    .toList();
            if (overlapped.isEmpty()) {
                throw new ExtractionException(ErrorKind.EMPTY_SELECTION, "The selection does not cover any statement");
            }
            Statement first = overlapped.get(0);
            Statement last = overlapped.get(overlapped.size() - 1);
            if (overlapped.size() == 1 && !covers(first)) {
                return matchInside(first);
            }
            if (span.start() > begin(first)) {
                expandOrFail(first);
            }
            if (!coversEnd(last)) {
                expandOrFail(last);
            }
            return Match.of(overlapped, slot);
        }

        private Match matchInside(Statement statement) {
            Optional<Statement> exact = exactStatement(statement);
            if (exact.isPresent()) {
                return Match.of(List.of(exact.get()), true);
            }
            Optional<Expression> expression = exactExpression(statement);
            if (expression.isPresent()) {
                return expressionMatch(expression.get());
            }
            Optional<Node> switchNode = innermostSwitch(statement);
            if (switchNode.isPresent()) {
                throw switchCrossing(switchNode.get());
            }
            expandOrFail(statement);
            return Match.of(List.of(statement), false);
        }

        private Match expressionMatch(Expression expression) {
            Node parent = expression.getParentNode().orElse(null);
            if (parent instanceof ExpressionStmt statement && !isSwitchExpressionArm(statement)
                    && !(statement.getParentNode().orElse(null) instanceof LambdaExpr)) {
                Node holder = statement.getParentNode().orElse(null);
                boolean slot = !(holder instanceof BlockStmt)
                        && !(holder instanceof SwitchEntry entry && entry.getType() == SwitchEntry.Type.STATEMENT_GROUP);
                return Match.of(List.of(statement), slot);
            }
            if (parent instanceof AssignExpr assign && assign.getTarget() == expression
                    || parent instanceof UnaryExpr unary && isIncrementOrDecrement(unary)) {
                throw new ExtractionException(ErrorKind.INCOMPLETE_SELECTION,
                        "The selected expression is the target of an assignment");
            }
            if (expression instanceof VariableDeclarationExpr || expression instanceof AnnotationExpr
                    || expression.findAncestor(AnnotationExpr.class).isPresent()) {
                throw new ExtractionException(ErrorKind.INCOMPLETE_SELECTION,
                        "The selection is a declaration, not a value");
            }
            if (isCaseLabel(expression)) {
                throw new ExtractionException(ErrorKind.INCOMPLETE_SELECTION,
                        "Case labels must stay constant expressions");
            }
            if (isTypeName(expression)) {
                throw new ExtractionException(ErrorKind.INCOMPLETE_SELECTION,
                        "The selection names a type or package, not a value");
            }
            if (isVoid(expression)) {
                throw new ExtractionException(ErrorKind.INCOMPLETE_SELECTION,
                        "The selected expression has no value");
            }
            return Match.of(expression);
        }

        private Optional<Statement> exactStatement(Statement within) {
            for (Statement candidate : ASTUtility.findSameCallable(within, Statement.class)) {
                if (candidate != within && candidate.getRange().isPresent()
                        && begin(candidate) == span.start() && coversEnd(candidate) && end(candidate) >= span.end()) {
                    return Optional.of(candidate);
                }
            }
            return Optional.empty();
        }

        private Optional<Expression> exactExpression(Statement within) {
            int end = span.end();
            int trimmed = text.charAt(end - 1) == ';' ? end - 1 : end;
            while (trimmed > span.start() && Character.isWhitespace(text.charAt(trimmed - 1))) {
                trimmed--;
            }
            for (Expression candidate : ASTUtility.findSameCallable(within, Expression.class)) {
                if (candidate.getRange().isPresent() && begin(candidate) == span.start()
                        && (end(candidate) == end || end(candidate) == trimmed)) {
                    return Optional.of(candidate);
                }
            }
            return Optional.empty();
        }

        private Optional<Node> innermostSwitch(Statement within) {
            Node best = null;
            for (Node candidate : ASTUtility.findSameCallable(within, Node.class)) {
                if ((candidate instanceof SwitchStmt || candidate instanceof SwitchExpr)
                        && candidate.getRange().isPresent()
                        && begin(candidate) <= span.start() && span.end() <= end(candidate)
                        && entriesOf(candidate).stream().filter(this::overlaps).count() > 1) {
                    best = candidate;
                }
            }
            return Optional.ofNullable(best);
        }

        private ExtractionException switchCrossing(Node switchNode) {
            List<SwitchEntry> touched = entriesOf(switchNode).stream().filter(this::overlaps).toList();
            SwitchEntry first = touched.get(0);
            SwitchEntry last = touched.get(touched.size() - 1);
            if (span.start() > begin(first) || span.end() < end(last)) {
                return new ExtractionException(ErrorKind.UNSUPPORTED_JUMP_CONSTRUCT,
                        "The selection crosses the case label at line " + ASTUtility.line(touched.get(1)));
            }
            return new ExtractionException(ErrorKind.MULTIPLE_ENTRY_POINTS,
                    "The selection covers " + touched.size() + " case groups, each with its own entry");
        }

        private void expandOrFail(Statement statement) {
            if (statement instanceof SwitchStmt switchStmt && boundaryInsideEntry(switchStmt)) {
                List<SwitchEntry> touched = switchStmt.getEntries().stream().filter(this::overlaps).toList();
                if (touched.size() > 1 && span.start() >= begin(touched.get(0)) && span.end() <= end(switchStmt) - 1) {
                    throw switchCrossing(switchStmt);
                }
                throw new ExtractionException(ErrorKind.UNSUPPORTED_JUMP_CONSTRUCT,
                        "The selection crosses a case label of the switch at line " + ASTUtility.line(switchStmt));
            }
            if (isStructured(statement)) {
                warnings.add(Warning.of(Warning.BOUNDARY_EXPANDED,
                        "Selection expanded to the whole " + describe(statement) + " at line " + ASTUtility.line(statement),
                        ASTUtility.line(statement)));
                return;
            }
            throw new ExtractionException(ErrorKind.INCOMPLETE_SELECTION,
                    "The selection covers part of the statement at line " + ASTUtility.line(statement));
        }

        private boolean boundaryInsideEntry(SwitchStmt switchStmt) {
            for (SwitchEntry entry : switchStmt.getEntries()) {
                if (begin(entry) < span.start() && span.start() < end(entry)
                        || begin(entry) < span.end() && span.end() < end(entry)) {
                    return true;
                }
            }
            return false;
        }

        private boolean covers(Statement statement) {
            return span.start() <= begin(statement) && coversEnd(statement);
        }

        /**
         * The span reaches the end of the statement, allowing a missing final semicolon.
         */
        private boolean coversEnd(Node node) {
            int end = end(node);
            if (span.end() >= end) {
                return true;
            }
            return text.substring(span.end(), end).replace(";", "").isBlank();
        }

        private boolean overlaps(Node node) {
            return begin(node) < span.end() && end(node) > span.start();
        }

        private boolean inSameCallable(Node node) {
            Node current = node;
            while (current != null && current != callable) {
                if (ASTUtility.isScopeBoundary(current)) {
                    return false;
                }
                current = current.getParentNode().orElse(null);
            }
            return current == callable;
        }

        private int begin(Node node) {
            return ASTUtility.beginOffset(node, lines);
        }

        private int end(Node node) {
            return ASTUtility.endOffset(node, lines);
        }
    }

    private static List<SwitchEntry> entriesOf(Node switchNode) {
        if (switchNode instanceof SwitchStmt switchStmt) {
            return switchStmt.getEntries();
        }
        return ((SwitchExpr) switchNode).getEntries();
    }

    static boolean isStructured(Statement statement) {
        if (statement instanceof LabeledStmt labeled) {
            return isStructured(labeled.getStatement());
        }
        return statement instanceof WhileStmt || statement instanceof DoStmt
                || statement instanceof ForStmt || statement instanceof ForEachStmt
                || statement instanceof TryStmt || statement instanceof SynchronizedStmt;
    }

    private static String describe(Statement statement) {
        if (statement instanceof LabeledStmt labeled) {
            return "labeled " + describe(labeled.getStatement());
        }
        if (statement instanceof TryStmt tryStmt) {
            return tryStmt.getResources().isEmpty() ? "try statement" : "try-with-resources statement";
        }
        if (statement instanceof SynchronizedStmt) {
            return "synchronized block";
        }
        return "loop";
    }

    private static boolean isSwitchExpressionArm(ExpressionStmt statement) {
        return statement.getParentNode().orElse(null) instanceof SwitchEntry entry
                && entry.getType() != SwitchEntry.Type.STATEMENT_GROUP
                && entry.getParentNode().orElse(null) instanceof SwitchExpr;
    }

    private static boolean isIncrementOrDecrement(UnaryExpr unary) {
        return switch (unary.getOperator()) {
            case PREFIX_INCREMENT, PREFIX_DECREMENT, POSTFIX_INCREMENT, POSTFIX_DECREMENT -> true;
            default -> false;
        };
    }

    private static boolean isCaseLabel(Expression expression) {
        Node child = expression;
        Node current = expression.getParentNode().orElse(null);
        while (current != null && !(current instanceof Statement)) {
            if (current instanceof SwitchEntry entry) {
                return ASTUtility.indexOf(entry.getLabels(), child) >= 0;
            }
            child = current;
            current = current.getParentNode().orElse(null);
        }
        return false;
    }

    private boolean isTypeName(Expression expression) {
        if (!(expression instanceof NameExpr || expression instanceof FieldAccessExpr)) {
            return false;
        }
        Node parent = expression.getParentNode().orElse(null);
        boolean qualifier = parent instanceof FieldAccessExpr access && access.getScope() == expression
                || parent instanceof MethodCallExpr call && call.getScope().orElse(null) == expression;
        if (!qualifier) {
            return false;
        }
        if (expression instanceof NameExpr name && scopes.resolve(name).isPresent()) {
            return false;
        }
        String last = expression instanceof NameExpr name
                ? name.getNameAsString()
                : ((FieldAccessExpr) expression).getNameAsString();
        return Character.isUpperCase(last.charAt(0)) || Character.isLowerCase(last.charAt(0))
                && expression instanceof NameExpr name && !isKnownValue(name);
    }

    private boolean isKnownValue(NameExpr name) {
        try {
            name.resolve();
            return true;
        } catch (RuntimeException e) {
            return false;
        }
    }

    private static boolean isVoid(Expression expression) {
        if (!(expression instanceof MethodCallExpr)) {
            return false;
        }
        try {
            ResolvedType type = expression.calculateResolvedType();
            return type.isVoid();
        } catch (RuntimeException e) {
            return false;
        }
    }

    private NormalizedSelection build(Match match, Node callable, LineIndex lines, List<Warning> warnings) {
        Node enclosingType = ASTUtility.enclosingType(callable);
        BodyDeclaration<?> member = memberOf(callable, enclosingType);
        if (enclosingType == null || member == null) {
            throw new ExtractionException(ErrorKind.EMPTY_SELECTION, "The selection is not inside a type member");
        }
        if (match.expression() != null) {
            Expression expression = match.expression();
            return new NormalizedSelection(SelectionMode.EXPRESSION, List.of(), expression, callable, member,
                    enclosingType, ASTUtility.beginOffset(expression, lines), ASTUtility.endOffset(expression, lines),
                    Range.from(expression.getRange().orElseThrow()), false, warnings);
        }
        List<Statement> statements = match.statements();
        Statement first = statements.get(0);
        Statement last = statements.get(statements.size() - 1);
        for (Statement statement : statements) {
            if (statement instanceof ExplicitConstructorInvocationStmt) {
                throw new ExtractionException(ErrorKind.INCOMPLETE_SELECTION,
                        "The explicit constructor call at line " + ASTUtility.line(statement) + " cannot move to a method");
            }
        }
        return new NormalizedSelection(SelectionMode.STATEMENTS, statements, null, callable, member, enclosingType,
                ASTUtility.beginOffset(first, lines), ASTUtility.endOffset(last, lines),
                Range.spanning(first, last), match.slot(), warnings);
    }

    private static BodyDeclaration<?> memberOf(Node callable, Node enclosingType) {
        Node current = callable;
        while (current != null) {
            Node parent = current.getParentNode().orElse(null);
            if (parent == enclosingType && current instanceof BodyDeclaration<?> declaration) {
                return declaration;
            }
            current = parent;
        }
        return null;
    }

    /**
     * Labels inside the selection must not be jump targets from outside, and a
     * continue may not target the label of a selected loop.
     */
    private static void checkJumps(NormalizedSelection selection) {
        Node body = bodyOf(selection.callable());
        for (Statement jump : ASTUtility.findSameCallable(body, Statement.class)) {
            if (!(jump instanceof BreakStmt || jump instanceof ContinueStmt)) {
                continue;
            }
            Node target = JumpTargets.targetOf(jump).orElse(null);
            if (target instanceof LabeledStmt labeled) {
                boolean jumpInside = selection.contains(jump);
                if (!jumpInside && selection.contains(labeled)) {
                    throw new ExtractionException(ErrorKind.UNSUPPORTED_JUMP_CONSTRUCT,
                            "The label '" + labeled.getLabel() + "' is targeted from outside the selection");
                }
                if (jumpInside && jump instanceof ContinueStmt && !selection.contains(labeled)
                        && selection.contains(labeled.getStatement())) {
                    throw new ExtractionException(ErrorKind.UNSUPPORTED_JUMP_CONSTRUCT,
                            "continue " + labeled.getLabel() + " needs the labeled loop to stay in place");
                }
            }
        }
    }

    /**
     * Local classes declared in the selection cannot be referenced after it.
     */
    private static void checkDeclarations(NormalizedSelection selection, Node body, LineIndex lines) {
        for (Statement statement : selection.statements()) {
            String name = null;
            if (statement instanceof LocalClassDeclarationStmt local) {
                name = local.getClassDeclaration().getNameAsString();
            } else if (statement instanceof LocalRecordDeclarationStmt local) {
                name = local.getRecordDeclaration().getNameAsString();
            }
            if (name == null) {
                continue;
            }
            for (ClassOrInterfaceType type : body.findAll(ClassOrInterfaceType.class)) {
                if (type.getNameAsString().equals(name) && !selection.contains(type)
                        && ASTUtility.beginOffset(type, lines) >= selection.endOffset()) {
                    throw new ExtractionException(ErrorKind.UNSUPPORTED_COMBINATION,
                            "The local class " + name + " is used after the selection");
                }
            }
        }
    }

    /**
     * Final fields may only be assigned directly in a constructor.
     */
    private void checkConstructorState(NormalizedSelection selection) {
        if (!(selection.callable() instanceof ConstructorDeclaration)) {
            return;
        }
        for (Node root : selection.nodes()) {
            for (AssignExpr assign : ASTUtility.findSameCallable(root, AssignExpr.class)) {
                Expression target = assign.getTarget();
                String name = null;
                if (target instanceof FieldAccessExpr access && access.getScope() instanceof ThisExpr) {
                    name = access.getNameAsString();
                } else if (target instanceof NameExpr nameExpr && scopes.resolve(nameExpr)
                        .filter(d -> !LocalScopeResolver.isLocalDeclaration(d)).isPresent()) {
                    name = nameExpr.getNameAsString();
                }
                if (name != null && isFinalField(selection.enclosingType(), name)) {
                    throw new ExtractionException(ErrorKind.UNSUPPORTED_COMBINATION,
                            "The final field '" + name + "' must be assigned in the constructor itself");
                }
            }
        }
    }

    private static boolean isFinalField(Node type, String name) {
        for (BodyDeclaration<?> member : ASTUtility.membersOf(type)) {
            if (member instanceof FieldDeclaration field && field.isFinal()) {
                for (VariableDeclarator variable : field.getVariables()) {
                    if (variable.getNameAsString().equals(name)) {
                        return true;
                    }
                }
            }
        }
        return false;
    }
}
