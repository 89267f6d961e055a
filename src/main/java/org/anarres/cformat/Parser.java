/*
 * Anarres C Preprocessor
 * Copyright (c) 2007-2015, Shevek
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied.  See the License for the specific language governing
 * permissions and limitations under the License.
 */
package org.anarres.cformat;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;
import org.pcollections.Empty;
import org.pcollections.PVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import static org.anarres.cformat.TokenType.*;

/**
 * A recursive-descent parser for C source.
 *
 * The parser consumes the lossless token list produced by the
 * {@link Lexer} and builds a tree of {@link Node Nodes} rooted at a
 * {@link NodeKind#PROGRAM} node. Comments and blank lines are
 * attached to the nodes they precede or follow, so that the
 * {@link Formatter} can put them back.
 *
 * The parser never gives up on a file. When a construct cannot be
 * parsed, the parser rewinds to its start, scans forward to a safe
 * resumption point, and keeps the text in between as an
 * {@link NodeKind#UNPARSED} node. Each such region counts as one
 * error; see {@link #getErrorCount()}.
 *
 * Identifiers are taken as type names when they were declared with
 * {@code typedef} earlier in the file, are one of the platform
 * typedefs known to the {@link SymbolTable}, or appear in the shape
 * {@code name *name;} (also with {@code ,}, {@code =} or {@code [}
 * after the second name). That last rule reads {@code a * b;} as a
 * declaration.
 */
public class Parser {

    private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

    private static final Set<String> QUALIFIER_NAMES = new HashSet<String>(Arrays.asList(
            "inline", "__inline", "__inline__", "_Noreturn"));
    private static final Set<String> POINTER_QUALIFIER_NAMES = new HashSet<String>(Arrays.asList(
            "restrict", "__restrict", "__restrict__"));
    private static final Set<String> ATTRIBUTE_NAMES = new HashSet<String>(Arrays.asList(
            "__attribute__", "__attribute"));

    /* Which identifiers a declaration-specifier run accepts as its type name. */
    private static enum Mode {
        /* Typedef names, and the pointer-declaration shape. */
        DECLARATION,
        /* Any identifier followed by another identifier or a star. */
        MEMBER,
        FUNCTION,
        /* Any identifier. */
        PARAMETER
    }

    private static final class Mark {

        private final int current;
        private final int errors;
        private final int failures;
        private final int lastLine;
        private final PVector<Token> pending;
        private final PVector<Report> reports;

        private Mark(int current, int errors, int failures, int lastLine,
                @Nonnull PVector<Token> pending, @Nonnull PVector<Report> reports) {
            this.current = current;
            this.errors = errors;
            this.failures = failures;
            this.lastLine = lastLine;
            this.pending = pending;
            this.reports = reports;
        }
    }

    /* A recovered region, reported to the listener once parsing is done. */
    private static final class Report {

        private final Token token;
        private final String message;

        private Report(@Nonnull Token token, @Nonnull String message) {
            this.token = token;
            this.message = message;
        }
    }

    private final List<Token> tokens;
    private final SymbolTable symbols;
    private final Set<Feature> features;
    private ParseListener listener;
    private String sourceName;

    private int current;
    private int errors;
    private int failures;
    private int lastLine;
    private String lastError;
    private Token lastErrorToken;
    private PVector<Token> pending;
    private PVector<Report> reports;
    private Node program;

    /**
     * Creates a parser over the given tokens, which must end with
     * exactly one {@link TokenType#EOF} token.
     */
    public Parser(@Nonnull List<Token> tokens) {
        if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(EOF))
            throw new IllegalArgumentException("Token list must end with EOF.");
        this.tokens = new ArrayList<Token>(tokens);
        this.symbols = new SymbolTable();
        this.features = EnumSet.noneOf(Feature.class);
        this.listener = null;
        this.sourceName = "<input>";
        this.current = 0;
        this.errors = 0;
        this.failures = 0;
        this.lastLine = 1;
        this.pending = Empty.vector();
        this.reports = Empty.vector();
    }

    public Parser(@Nonnull String source) {
        this(Lexer.tokenize(source));
    }

    /**
     * Sets the ParseListener which is told about each region
     * the parser keeps verbatim.
     */
    public void setListener(@CheckForNull ParseListener listener) {
        this.listener = listener;
    }

    @CheckForNull
    public ParseListener getListener() {
        return listener;
    }

    /** Sets the name used for the source in diagnostics. */
    public void setSourceName(@Nonnull String sourceName) {
        this.sourceName = sourceName;
    }

    public void addFeature(@Nonnull Feature f) {
        features.add(f);
    }

    public void addFeatures(@Nonnull Collection<Feature> f) {
        features.addAll(f);
    }

    public boolean getFeature(@Nonnull Feature f) {
        return features.contains(f);
    }

    /**
     * Declares a name as a type before parsing, as if a
     * {@code typedef} for it had been seen.
     */
    public void addTypedef(@Nonnull String name) {
        symbols.add(SymbolTable.GLOBAL, name, SymbolKind.TYPEDEF);
    }

    @Nonnull
    public SymbolTable getSymbolTable() {
        return symbols;
    }

    /**
     * Returns the number of regions which could not be parsed and
     * were kept verbatim.
     *
     * A non-zero count means the tree, and any output formatted
     * from it, should be treated with suspicion.
     */
    @Nonnegative
    public int getErrorCount() {
        return errors;
    }

    /**
     * Parses the whole token list.
     *
     * This method never fails on malformed input; it may be called
     * only once per parser.
     */
    @Nonnull
    public Node parse() {
        if (program != null)
            throw new IllegalStateException("Parser has already run.");
        program = new Node(NodeKind.PROGRAM, null);
        for (;;) {
            skip();
            if (atEnd())
                break;
            int start = current;
            PVector<Token> leading = takePending();
            Node item = parseTopLevel(start);
            finish(item, leading);
            item.setBlankLineBefore(blankBefore(start));
            program.addChild(item);
        }
        program.getFooterComments().addAll(takePending());
        if (listener != null) {
            for (Report report : reports)
                listener.handleError(sourceName, report.token.getLine(), report.token.getColumn(), report.message);
        }
        if (getFeature(Feature.DEBUG))
            LOG.debug(sourceName + ": parsed " + program.getChildCount() + " top-level items, " + errors + " errors");
        return program;
    }

    /* Cursor */

    @Nonnull
    private Token peek() {
        return tokens.get(current);
    }

    private boolean atEnd() {
        return peek().is(EOF);
    }

    @Nonnull
    private Token advance() {
        Token tok = tokens.get(current);
        if (!tok.is(EOF))
            current++;
        if (!tok.is(WHITESPACE) && !tok.is(NEWLINE))
            lastLine = tok.getLine();
        return tok;
    }

    /* Skips trivia, collecting comments into the pending buffer. */
    private void skip() {
        for (;;) {
            Token tok = tokens.get(current);
            if (!tok.isTrivia())
                return;
            if (tok.isComment())
                pending = pending.plus(tok);
            advance();
        }
    }

    /* Returns the index of the first significant token at or after idx. */
    private int significantFrom(int idx) {
        int i = idx;
        while (tokens.get(i).isTrivia())
            i++;
        return i;
    }

    /* Returns the index of the first significant token after idx. */
    private int nextSignificant(int idx) {
        if (tokens.get(idx).is(EOF))
            return idx;
        return significantFrom(idx + 1);
    }

    @Nonnull
    private Token peekSignificant() {
        return tokens.get(significantFrom(current));
    }

    private boolean check(@Nonnull TokenType type) {
        skip();
        return peek().is(type);
    }

    private boolean match(@Nonnull TokenType type) {
        if (!check(type))
            return false;
        advance();
        return true;
    }

    @CheckForNull
    private Token expect(@Nonnull TokenType type, @Nonnull String what) {
        if (check(type))
            return advance();
        error("expected " + what + " but found '" + peek().getText() + "'");
        return null;
    }

    private void error(@Nonnull String msg) {
        failures++;
        lastError = msg;
        lastErrorToken = peek();
        if (getFeature(Feature.DEBUG))
            LOG.debug(sourceName + ":" + lastErrorToken.getLine() + ":" + lastErrorToken.getColumn() + ": " + msg);
    }

    @Nonnull
    private Mark mark() {
        return new Mark(current, errors, failures, lastLine, pending, reports);
    }

    private void reset(@Nonnull Mark mark) {
        current = mark.current;
        errors = mark.errors;
        failures = mark.failures;
        lastLine = mark.lastLine;
        pending = mark.pending;
        reports = mark.reports;
    }

    @Nonnull
    private PVector<Token> takePending() {
        PVector<Token> out = pending;
        pending = Empty.vector();
        return out;
    }

    /* Trivia */

    /*
     * Comments met inside a construct trail it; so do comments
     * after its last token on the same line.
     */
    private void finish(@Nonnull Node node, @Nonnull List<Token> leading) {
        node.getLeadingComments().addAll(leading);
        node.getTrailingComments().addAll(takePending());
        for (;;) {
            Token tok = peek();
            if (tok.is(WHITESPACE)) {
                advance();
            } else if (tok.isComment() && tok.getLine() == lastLine) {
                node.getTrailingComments().add(advance());
            } else {
                return;
            }
        }
    }

    /*
     * Two consecutive newlines in the trivia before start make one
     * blank line. A comment between them breaks the run.
     */
    private boolean blankBefore(int start) {
        int newlines = 0;
        for (int i = start - 1; i >= 0 && tokens.get(i).isTrivia(); i--) {
            Token tok = tokens.get(i);
            if (tok.is(NEWLINE)) {
                if (++newlines > 1)
                    return true;
            } else if (tok.isComment()) {
                newlines = 0;
            }
        }
        return false;
    }

    /* Recovery */

    @Nonnull
    private ParseOutcome attempt(@Nonnull Supplier<Node> production) {
        Mark mark = mark();
        Node node = production.get();
        if (node != null && failures == mark.failures)
            return ParseOutcome.parsed(node);
        ParseOutcome outcome;
        if (failures > mark.failures)
            outcome = ParseOutcome.failed(lastError, lastErrorToken);
        else
            outcome = ParseOutcome.notApplicable();
        reset(mark);
        return outcome;
    }

    /*
     * Keeps tokens [start, end) verbatim, less any trailing trivia,
     * which is left for the caller to attach. A region recovered inside
     * an attempt which is later rewound is forgotten with it.
     */
    @Nonnull
    private Node recover(int start, int end, @Nonnull ParseOutcome outcome) {
        if (end <= start)
            end = start + 1;
        int textEnd = end;
        while (textEnd > start + 1 && tokens.get(textEnd - 1).isTrivia())
            textEnd--;
        Token first = tokens.get(start);
        Token last = tokens.get(textEnd - 1);
        String text = Tokens.raw(tokens, start, textEnd);
        int endLine = first.getLine();
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n')
                endLine++;
        }
        current = textEnd;
        lastLine = last.getLine();
        errors++;

        String msg = outcome.getMessage();
        if (msg == null)
            msg = "unexpected '" + first.getText() + "'";
        Token at = outcome.getToken();
        if (at == null)
            at = first;
        if (getFeature(Feature.DEBUG))
            LOG.debug(sourceName + ": keeping lines " + first.getLine() + "-" + endLine + " verbatim");
        reports = reports.plus(new Report(at, msg + "; lines " + first.getLine() + "-" + endLine + " kept verbatim"));
        return new Node(NodeKind.UNPARSED, first, new UnparsedData(text, first.getLine(), endLine));
    }

    /* Stops after a ';' or after the '}' of a skipped block, balancing braces. */
    private int scanTopLevel(int from) {
        int depth = 0;
        int i = from;
        for (;;) {
            Token tok = tokens.get(i);
            switch (tok.getType()) {
                case EOF:
                    return i;
                case PREPROCESSOR:
                    if (depth == 0 && i > from)
                        return i;
                    break;
                case LBRACE:
                    depth++;
                    break;
                case RBRACE:
                    if (depth > 0)
                        depth--;
                    if (depth == 0)
                        return semicolonOnLine(i + 1, tok.getLine());
                    break;
                case SEMICOLON:
                    if (depth == 0)
                        return i + 1;
                    break;
                default:
                    break;
            }
            i++;
        }
    }

    /*
     * Stops after a ';' outside any brackets, before an unmatched '}',
     * or after the '}' closing a block opened in the statement.
     */
    private int scanStatement(int from) {
        int braces = 0;
        int parens = 0;
        int i = from;
        for (;;) {
            Token tok = tokens.get(i);
            switch (tok.getType()) {
                case EOF:
                    return i;
                case PREPROCESSOR:
                    if (braces == 0 && parens == 0 && i > from)
                        return i;
                    break;
                case LPAREN:
                case LBRACKET:
                    parens++;
                    break;
                case RPAREN:
                case RBRACKET:
                    if (parens > 0)
                        parens--;
                    break;
                case LBRACE:
                    braces++;
                    break;
                case RBRACE:
                    if (braces == 0)
                        return i;
                    braces--;
                    if (braces == 0 && parens == 0)
                        return semicolonOnLine(i + 1, tok.getLine());
                    break;
                case SEMICOLON:
                    if (braces == 0 && parens == 0)
                        return i + 1;
                    break;
                default:
                    break;
            }
            i++;
        }
    }

    /* Stops after a ',' or before a '}' at zero nesting. */
    private int scanEnumerator(int from) {
        int depth = 0;
        int i = from;
        for (;;) {
            Token tok = tokens.get(i);
            switch (tok.getType()) {
                case EOF:
                    return i;
                case LPAREN:
                case LBRACKET:
                case LBRACE:
                    depth++;
                    break;
                case RPAREN:
                case RBRACKET:
                    if (depth > 0)
                        depth--;
                    break;
                case RBRACE:
                    if (depth == 0)
                        return i;
                    depth--;
                    break;
                case COMMA:
                    if (depth == 0)
                        return i + 1;
                    break;
                case SEMICOLON:
                    if (depth == 0)
                        return i;
                    break;
                default:
                    break;
            }
            i++;
        }
    }

    /* Extends a region ending at idx over a ';' later on the same line. */
    private int semicolonOnLine(int idx, int line) {
        int i = idx;
        while (tokens.get(i).is(WHITESPACE))
            i++;
        Token tok = tokens.get(i);
        if (tok.is(SEMICOLON) && tok.getLine() == line)
            return i + 1;
        return idx;
    }

    /* Classification */

    private static boolean isBaseTypeKeyword(@Nonnull TokenType type) {
        switch (type) {
            case VOID:
            case CHAR_KW:
            case SHORT:
            case INT:
            case LONG:
            case FLOAT_KW:
            case DOUBLE:
            case SIGNED:
            case UNSIGNED:
                return true;
            default:
                return false;
        }
    }

    private static boolean isTypeKeyword(@Nonnull TokenType type) {
        switch (type) {
            case CONST:
            case VOLATILE:
            case STATIC:
            case EXTERN:
            case AUTO:
            case REGISTER:
            case STRUCT:
            case UNION:
            case ENUM:
                return true;
            default:
                return isBaseTypeKeyword(type);
        }
    }

    private static boolean isQualifier(@Nonnull Token tok) {
        switch (tok.getType()) {
            case CONST:
            case VOLATILE:
            case STATIC:
            case EXTERN:
            case AUTO:
            case REGISTER:
                return true;
            case IDENTIFIER:
                return QUALIFIER_NAMES.contains(tok.getText());
            default:
                return false;
        }
    }

    private static boolean isPointerQualifier(@Nonnull Token tok) {
        if (tok.is(CONST) || tok.is(VOLATILE))
            return true;
        return tok.is(IDENTIFIER) && POINTER_QUALIFIER_NAMES.contains(tok.getText());
    }

    private static boolean isTag(@Nonnull Token tok) {
        return tok.is(STRUCT) || tok.is(UNION) || tok.is(ENUM);
    }

    private boolean isTypedefName(@Nonnull Token tok) {
        return tok.is(IDENTIFIER) && symbols.isTypedef(SymbolTable.GLOBAL, tok.getText());
    }

    /* IDENTIFIER STAR+ IDENTIFIER, then one of ; , = [ */
    private boolean looksLikePointerDeclaration(int idx) {
        int i = nextSignificant(idx);
        if (!tokens.get(i).is(STAR))
            return false;
        while (tokens.get(i).is(STAR))
            i = nextSignificant(i);
        if (!tokens.get(i).is(IDENTIFIER))
            return false;
        switch (tokens.get(nextSignificant(i)).getType()) {
            case SEMICOLON:
            case COMMA:
            case ASSIGN:
            case LBRACKET:
                return true;
            default:
                return false;
        }
    }

    /* At the current token, which must be significant. */
    private boolean startsDeclaration() {
        Token tok = peek();
        if (isTypeKeyword(tok.getType()) || isQualifier(tok))
            return true;
        if (!tok.is(IDENTIFIER))
            return false;
        return isTypedefName(tok) || looksLikePointerDeclaration(current);
    }

    /* "struct {", "struct name {" and "struct name ;" define or declare the tag. */
    private boolean isTagDefinitionAhead() {
        if (!isTag(peek()))
            return false;
        int i = nextSignificant(current);
        Token next = tokens.get(i);
        if (next.is(LBRACE))
            return true;
        if (!next.is(IDENTIFIER))
            return false;
        Token after = tokens.get(nextSignificant(i));
        return after.is(LBRACE) || after.is(SEMICOLON);
    }

    /*
     * Whether the parenthesis at idx holds nothing but a type name:
     * type keywords, tags, typedef names, stars and array brackets.
     */
    private boolean looksLikeTypeInParens(int idx) {
        int i = nextSignificant(idx);
        Token first = tokens.get(i);
        if (!isTypeKeyword(first.getType()) && !isTypedefName(first))
            return false;
        boolean afterTag = false;
        int brackets = 0;
        for (;;) {
            Token tok = tokens.get(i);
            switch (tok.getType()) {
                case RPAREN:
                    return brackets == 0;
                case STAR:
                    break;
                case LBRACKET:
                    brackets++;
                    break;
                case RBRACKET:
                    if (brackets == 0)
                        return false;
                    brackets--;
                    break;
                case INTEGER:
                    if (brackets == 0)
                        return false;
                    break;
                case IDENTIFIER:
                    if (!afterTag && brackets == 0 && !isTypedefName(tok))
                        return false;
                    break;
                default:
                    if (!isTypeKeyword(tok.getType()))
                        return false;
                    break;
            }
            afterTag = isTag(tok);
            i = nextSignificant(i);
            if (tokens.get(i).is(EOF))
                return false;
        }
    }

    private boolean acceptsTypeName(@Nonnull Mode mode) {
        if (isTypedefName(peek()))
            return true;
        switch (mode) {
            case PARAMETER:
                return true;
            case DECLARATION:
                return looksLikePointerDeclaration(current);
            default:
                Token next = tokens.get(nextSignificant(current));
                return next.is(IDENTIFIER) || next.is(STAR);
        }
    }

    /* Top level */

    @Nonnull
    private Node parseTopLevel(int start) {
        Token tok = peek();
        if (tok.is(PREPROCESSOR)) {
            advance();
            return new Node(NodeKind.PREPROCESSOR, tok);
        }
        ParseOutcome outcome;
        if (tok.is(TYPEDEF)) {
            outcome = attempt(this::parseTypedef);
        } else if (isTagDefinitionAhead()) {
            outcome = attempt(this::parseTagStatement);
        } else {
            outcome = attempt(this::parseFunction);
            if (outcome.isNotApplicable() && startsDeclaration())
                outcome = attempt(this::parseDeclaration);
        }
        if (outcome.isParsed())
            return outcome.getNode();
        return recover(start, scanTopLevel(start), outcome);
    }

    @CheckForNull
    private Node parseFunction() {
        PVector<Token> type = parseSpecifiers(Mode.FUNCTION);
        if (type.isEmpty())
            return null;
        PVector<Token> pointers = parsePointers();
        skip();
        if (!peek().is(IDENTIFIER) || !tokens.get(nextSignificant(current)).is(LPAREN))
            return null;
        Token name = advance();
        skip();
        advance();

        PVector<Node> params = parseParameters();
        if (params == null)
            return null;
        if (!skipAttributes())
            return null;
        if (match(SEMICOLON))
            return new Node(NodeKind.FUNCTION, name, new FunctionData(type, pointers, name, params, false));
        if (!check(LBRACE)) {
            error("expected ';' or '{' after the signature of " + name.getText() + " but found '" + peek().getText() + "'");
            return null;
        }
        Node body = parseBlock();
        if (body == null)
            return null;
        Node node = new Node(NodeKind.FUNCTION, name, new FunctionData(type, pointers, name, params, true));
        node.addChild(body);
        return node;
    }

    /* After the opening parenthesis; consumes the closing one. */
    @CheckForNull
    private PVector<Node> parseParameters() {
        PVector<Node> params = Empty.vector();
        if (match(RPAREN))
            return params;
        for (;;) {
            Node param = parseParameter();
            if (param == null)
                return null;
            params = params.plus(param);
            if (match(COMMA))
                continue;
            if (match(RPAREN))
                return params;
            error("expected ',' or ')' in parameter list but found '" + peek().getText() + "'");
            return null;
        }
    }

    @CheckForNull
    private Node parseParameter() {
        skip();
        Token first = peek();
        if (first.is(ELLIPSIS)) {
            advance();
            return new Node(NodeKind.PARAMETER, first, new ParamData(Empty.<Token>vector(),
                    Empty.<Token>vector(), null, Empty.<Token>vector(), true, false));
        }
        if (hasParenthesisInParameter(current))
            return parseOpaqueParameter(first);

        PVector<Token> type = parseSpecifiers(Mode.PARAMETER);
        PVector<Token> pointers = parsePointers();
        Token name = null;
        if (check(IDENTIFIER))
            name = advance();
        PVector<Token> arrays = parseArrays();
        if (arrays == null)
            return null;
        if (type.isEmpty() && name == null) {
            error("expected parameter but found '" + peek().getText() + "'");
            return null;
        }
        return new Node(NodeKind.PARAMETER, name != null ? name : first,
                new ParamData(type, pointers, name, arrays, false, false));
    }

    private boolean hasParenthesisInParameter(int from) {
        for (int i = from;; i++) {
            switch (tokens.get(i).getType()) {
                case LPAREN:
                    return true;
                case COMMA:
                case RPAREN:
                case SEMICOLON:
                case LBRACE:
                case RBRACE:
                case EOF:
                    return false;
                default:
                    break;
            }
        }
    }

    /* Function-pointer parameters and the like: the token run up to ',' or ')'. */
    @CheckForNull
    private Node parseOpaqueParameter(@Nonnull Token first) {
        PVector<Token> run = Empty.vector();
        int depth = 0;
        for (;;) {
            skip();
            Token tok = peek();
            switch (tok.getType()) {
                case LPAREN:
                    depth++;
                    break;
                case RPAREN:
                    if (depth == 0)
                        return new Node(NodeKind.PARAMETER, first, new ParamData(run,
                                Empty.<Token>vector(), null, Empty.<Token>vector(), false, true));
                    depth--;
                    break;
                case COMMA:
                    if (depth == 0)
                        return new Node(NodeKind.PARAMETER, first, new ParamData(run,
                                Empty.<Token>vector(), null, Empty.<Token>vector(), false, true));
                    break;
                case SEMICOLON:
                case LBRACE:
                case RBRACE:
                case EOF:
                    error("unterminated parameter");
                    return null;
                default:
                    break;
            }
            run = run.plus(advance());
        }
    }

    /* Skips GNU __attribute__((...)) annotations. */
    private boolean skipAttributes() {
        for (;;) {
            skip();
            Token tok = peek();
            if (!tok.is(IDENTIFIER) || !ATTRIBUTE_NAMES.contains(tok.getText()))
                return true;
            advance();
            if (expect(LPAREN, "'(' after " + tok.getText()) == null)
                return false;
            int depth = 1;
            while (depth > 0) {
                skip();
                Token t = peek();
                if (t.is(EOF) || t.is(SEMICOLON) || t.is(LBRACE)) {
                    error("unterminated " + tok.getText());
                    return false;
                }
                if (t.is(LPAREN))
                    depth++;
                else if (t.is(RPAREN))
                    depth--;
                advance();
            }
        }
    }

    /* Declarations */

    @Nonnull
    private PVector<Token> parseSpecifiers(@Nonnull Mode mode) {
        PVector<Token> run = Empty.vector();
        boolean base = false;
        for (;;) {
            skip();
            Token tok = peek();
            if (isQualifier(tok)) {
                run = run.plus(advance());
            } else if (isBaseTypeKeyword(tok.getType())) {
                run = run.plus(advance());
                base = true;
            } else if (!base && isTag(tok)) {
                run = run.plus(advance());
                if (check(IDENTIFIER))
                    run = run.plus(advance());
                base = true;
            } else if (!base && tok.is(IDENTIFIER) && acceptsTypeName(mode)) {
                run = run.plus(advance());
                base = true;
            } else {
                return run;
            }
        }
    }

    @Nonnull
    private PVector<Token> parsePointers() {
        PVector<Token> pointers = Empty.vector();
        for (;;) {
            skip();
            Token tok = peek();
            if (tok.is(STAR) || (!pointers.isEmpty() && isPointerQualifier(tok)))
                pointers = pointers.plus(advance());
            else
                return pointers;
        }
    }

    /* Array suffixes, kept as tokens. Returns null on an unterminated bracket. */
    @CheckForNull
    private PVector<Token> parseArrays() {
        PVector<Token> arrays = Empty.vector();
        while (check(LBRACKET)) {
            arrays = arrays.plus(advance());
            int depth = 1;
            while (depth > 0) {
                skip();
                Token tok = peek();
                switch (tok.getType()) {
                    case EOF:
                    case SEMICOLON:
                    case LBRACE:
                    case RBRACE:
                        error("expected ']' but found '" + tok.getText() + "'");
                        return null;
                    case LBRACKET:
                        depth++;
                        break;
                    case RBRACKET:
                        depth--;
                        break;
                    default:
                        break;
                }
                arrays = arrays.plus(advance());
            }
        }
        return arrays;
    }

    @CheckForNull
    private Node parseDeclaration() {
        return parseVarDeclaration(Mode.DECLARATION);
    }

    @CheckForNull
    private Node parseVarDeclaration(@Nonnull Mode mode) {
        PVector<Token> type = parseSpecifiers(mode);
        if (type.isEmpty())
            return null;
        PVector<Token> pointers = parsePointers();
        skip();
        if (peek().is(LPAREN) && tokens.get(nextSignificant(current)).is(STAR)) {
            Node fp = parseFunctionPointer(type.plusAll(pointers));
            if (fp == null || expect(SEMICOLON, "';' after declaration") == null)
                return null;
            return fp;
        }
        Token name = expect(IDENTIFIER, "declaration name");
        if (name == null)
            return null;
        VarDeclData first = parseDeclarator(type, pointers, name);
        if (first == null)
            return null;

        PVector<VarDeclData> declarators = Empty.vector();
        while (match(COMMA)) {
            PVector<Token> p = parsePointers();
            Token n = expect(IDENTIFIER, "declaration name after ','");
            if (n == null)
                return null;
            VarDeclData d = parseDeclarator(Empty.<Token>vector(), p, n);
            if (d == null)
                return null;
            declarators = declarators.plus(d);
        }
        if (expect(SEMICOLON, "';' after declaration") == null)
            return null;

        VarDeclData data = new VarDeclData(type, pointers, name, first.arrays,
                first.bitWidth, first.initializer, declarators);
        Node node = new Node(NodeKind.VAR_DECL, name, data);
        if (data.initializer != null)
            node.addChild(data.initializer);
        return node;
    }

    /* Array suffixes, bit-field width and initializer of one declarator. */
    @CheckForNull
    private VarDeclData parseDeclarator(@Nonnull PVector<Token> type, @Nonnull PVector<Token> pointers, @Nonnull Token name) {
        PVector<Token> arrays = parseArrays();
        if (arrays == null)
            return null;
        Node width = null;
        if (match(COLON)) {
            width = expectExpression("bit-field width");
            if (width == null)
                return null;
        }
        Node init = null;
        if (match(ASSIGN)) {
            init = parseInitializer();
            if (init == null) {
                error("expected initializer for " + name.getText() + " but found '" + peek().getText() + "'");
                return null;
            }
        }
        return new VarDeclData(type, pointers, name, arrays, width, init, Empty.<VarDeclData>vector());
    }

    /* (*name)(params), at the opening parenthesis. The caller consumes any ';'. */
    @CheckForNull
    private Node parseFunctionPointer(@Nonnull PVector<Token> returnType) {
        if (expect(LPAREN, "'('") == null || expect(STAR, "'*'") == null)
            return null;
        Token name = expect(IDENTIFIER, "function pointer name");
        if (name == null)
            return null;
        if (expect(RPAREN, "')' after " + name.getText()) == null)
            return null;
        if (expect(LPAREN, "'(' before parameters of " + name.getText()) == null)
            return null;
        PVector<Token> params = Empty.vector();
        int depth = 1;
        for (;;) {
            skip();
            Token tok = peek();
            if (tok.is(EOF) || tok.is(SEMICOLON) || tok.is(LBRACE) || tok.is(RBRACE)) {
                error("unterminated parameters of " + name.getText());
                return null;
            }
            if (tok.is(LPAREN)) {
                depth++;
            } else if (tok.is(RPAREN)) {
                depth--;
                if (depth == 0) {
                    advance();
                    break;
                }
            }
            params = params.plus(advance());
        }
        return new Node(NodeKind.FUNC_PTR, name, new FuncPtrData(returnType, name, params));
    }

    @CheckForNull
    private Node parseInitializer() {
        skip();
        Token open = peek();
        if (!open.is(LBRACE))
            return parseExpression();
        advance();
        Node list = new Node(NodeKind.INIT_LIST, open);
        for (;;) {
            if (check(RBRACE))
                break;
            Node element = parseInitializer();
            if (element == null) {
                error("expected initializer element but found '" + peek().getText() + "'");
                return null;
            }
            list.addChild(element);
            if (!match(COMMA))
                break;
        }
        if (expect(RBRACE, "'}' after initializer list") == null)
            return null;
        return list;
    }

    @CheckForNull
    private Node parseTypedef() {
        Token keyword = advance();
        skip();
        if (isTagDefinitionAhead()) {
            Node tag = parseTagDefinition(false);
            if (tag == null)
                return null;
            PVector<Token> pointers = parsePointers();
            Token alias = expect(IDENTIFIER, "typedef name");
            if (alias == null)
                return null;
            PVector<Token> arrays = parseArrays();
            if (arrays == null || expect(SEMICOLON, "';' after typedef") == null)
                return null;
            return typedef(alias, new TypedefData(Empty.<Token>vector(), pointers, alias, arrays), tag);
        }

        PVector<Token> base = parseSpecifiers(Mode.PARAMETER);
        if (base.isEmpty()) {
            error("expected type after '" + keyword.getText() + "' but found '" + peek().getText() + "'");
            return null;
        }
        PVector<Token> pointers = parsePointers();
        skip();
        if (peek().is(LPAREN)) {
            Node fp = parseFunctionPointer(base.plusAll(pointers));
            if (fp == null || expect(SEMICOLON, "';' after typedef") == null)
                return null;
            Token name = fp.getToken();
            return typedef(name, new TypedefData(Empty.<Token>vector(), Empty.<Token>vector(),
                    null, Empty.<Token>vector()), fp);
        }
        Token alias = expect(IDENTIFIER, "typedef name");
        if (alias == null)
            return null;
        PVector<Token> arrays = parseArrays();
        if (arrays == null || expect(SEMICOLON, "';' after typedef") == null)
            return null;
        return typedef(alias, new TypedefData(base, pointers, alias, arrays), null);
    }

    @Nonnull
    private Node typedef(@CheckForNull Token name, @Nonnull TypedefData data, @CheckForNull Node inner) {
        if (name != null)
            symbols.add(SymbolTable.GLOBAL, name.getText(), SymbolKind.TYPEDEF);
        Node node = new Node(NodeKind.TYPEDEF, name, data);
        if (inner != null)
            node.addChild(inner);
        return node;
    }

    @CheckForNull
    private Node parseTagStatement() {
        return parseTagDefinition(true);
    }

    /*
     * struct, union or enum with optional name and body. When standalone,
     * also takes the declarators after the body and the closing ';'.
     */
    @CheckForNull
    private Node parseTagDefinition(boolean standalone) {
        skip();
        Token keyword = advance();
        NodeKind kind = keyword.is(STRUCT) ? NodeKind.STRUCT : keyword.is(UNION) ? NodeKind.UNION : NodeKind.ENUM;
        Token name = null;
        if (check(IDENTIFIER))
            name = advance();
        List<Node> members = new ArrayList<Node>();
        List<Token> footer = new ArrayList<Token>();
        boolean body = false;
        if (match(LBRACE)) {
            body = true;
            boolean ok = kind == NodeKind.ENUM ? parseEnumerators(members, footer) : parseMembers(members, footer);
            if (!ok)
                return null;
        }
        PVector<Token> declarators = Empty.vector();
        if (standalone) {
            for (;;) {
                skip();
                Token tok = peek();
                if (tok.is(SEMICOLON))
                    break;
                if (tok.is(EOF) || tok.is(LBRACE) || tok.is(RBRACE) || tok.is(PREPROCESSOR)) {
                    error("expected ';' after " + keyword.getText() + " but found '" + tok.getText() + "'");
                    return null;
                }
                declarators = declarators.plus(advance());
            }
            advance();
        }
        Node node = new Node(kind, name != null ? name : keyword, new TagData(keyword, name, body, declarators));
        for (Node member : members)
            node.addChild(member);
        node.getFooterComments().addAll(footer);
        return node;
    }

    /* After the '{'; consumes the '}'. */
    private boolean parseMembers(@Nonnull List<Node> members, @Nonnull List<Token> footer) {
        for (;;) {
            skip();
            if (peek().is(RBRACE) || atEnd())
                break;
            members.add(parseWrapped(this::parseMember));
        }
        footer.addAll(takePending());
        return expect(RBRACE, "'}'") != null;
    }

    @CheckForNull
    private Node parseMember() {
        Token tok = peek();
        if (tok.is(PREPROCESSOR)) {
            advance();
            return new Node(NodeKind.PREPROCESSOR, tok);
        }
        if (isTagDefinitionAhead())
            return parseTagStatement();
        return parseVarDeclaration(Mode.MEMBER);
    }

    /* After the '{'; consumes the '}'. */
    private boolean parseEnumerators(@Nonnull List<Node> values, @Nonnull List<Token> footer) {
        for (;;) {
            skip();
            if (peek().is(RBRACE) || atEnd())
                break;
            int start = current;
            PVector<Token> leading = takePending();
            ParseOutcome outcome = attempt(this::parseEnumerator);
            Node value;
            if (outcome.isParsed()) {
                value = outcome.getNode();
            } else {
                int end = scanEnumerator(start);
                if (end == start) {
                    error("expected enumerator but found '" + peek().getText() + "'");
                    return false;
                }
                value = recover(start, end, outcome);
            }
            finish(value, leading);
            value.setBlankLineBefore(blankBefore(start));
            values.add(value);
        }
        footer.addAll(takePending());
        return expect(RBRACE, "'}' after enumerators") != null;
    }

    @CheckForNull
    private Node parseEnumerator() {
        Token name = expect(IDENTIFIER, "enumerator name");
        if (name == null)
            return null;
        Node value = new Node(NodeKind.ENUM_VALUE, name);
        if (match(ASSIGN)) {
            Node expr = expectExpression("enumerator value");
            if (expr == null)
                return null;
            value.addChild(expr);
        }
        if (match(COMMA) || check(RBRACE))
            return value;
        error("expected ',' or '}' after enumerator but found '" + peek().getText() + "'");
        return null;
    }

    /* Statements */

    @Nonnull
    private Node parseStatement() {
        return parseWrapped(this::parseStatementBody);
    }

    /*
     * Parses one statement-like construct, keeping it verbatim if it
     * fails, and attaches its comments and blank-line flag.
     */
    @Nonnull
    private Node parseWrapped(@Nonnull Supplier<Node> production) {
        skip();
        int start = current;
        PVector<Token> leading = takePending();
        ParseOutcome outcome = attempt(production);
        Node node;
        if (outcome.isParsed())
            node = outcome.getNode();
        else
            node = recover(start, scanStatement(start), outcome);
        finish(node, leading);
        node.setBlankLineBefore(blankBefore(start));
        return node;
    }

    @CheckForNull
    private Node parseStatementBody() {
        Token tok = peek();
        switch (tok.getType()) {
            case PREPROCESSOR:
                advance();
                return new Node(NodeKind.PREPROCESSOR, tok);
            case LBRACE:
                return parseBlock();
            case IF:
                return parseIf();
            case WHILE:
                return parseWhile();
            case DO:
                return parseDoWhile();
            case FOR:
                return parseFor();
            case SWITCH:
                return parseSwitch();
            case CASE:
            case DEFAULT:
                return parseCase();
            case RETURN:
                return parseReturn();
            case BREAK:
                return parseJump(NodeKind.BREAK);
            case CONTINUE:
                return parseJump(NodeKind.CONTINUE);
            case GOTO:
                return parseGoto();
            case TYPEDEF:
                return parseTypedef();
            case SEMICOLON:
                advance();
                return new Node(NodeKind.EXPR_STMT, tok);
            case IDENTIFIER:
                if (tokens.get(nextSignificant(current)).is(COLON)) {
                    advance();
                    skip();
                    advance();
                    return new Node(NodeKind.LABEL, tok);
                }
                break;
            default:
                break;
        }
        if (isTagDefinitionAhead())
            return parseTagStatement();
        if (startsDeclaration())
            return parseDeclaration();

        Node expr = parseExpression();
        if (expr == null) {
            error("expected statement but found '" + tok.getText() + "'");
            return null;
        }
        if (expect(SEMICOLON, "';' after expression") == null)
            return null;
        Node stmt = new Node(NodeKind.EXPR_STMT, null);
        stmt.addChild(expr);
        return stmt;
    }

    /* At the '{'; consumes the '}'. */
    @CheckForNull
    private Node parseBlock() {
        Token open = expect(LBRACE, "'{'");
        if (open == null)
            return null;
        Node block = new Node(NodeKind.BLOCK, open);
        for (;;) {
            skip();
            if (peek().is(RBRACE) || atEnd())
                break;
            block.addChild(parseStatement());
        }
        block.getFooterComments().addAll(takePending());
        if (expect(RBRACE, "'}'") == null)
            return null;
        return block;
    }

    /* ( expression ) */
    @CheckForNull
    private Node parseCondition(@Nonnull Token keyword) {
        if (expect(LPAREN, "'(' after " + keyword.getText()) == null)
            return null;
        Node cond = expectExpression("condition");
        if (cond == null)
            return null;
        if (expect(RPAREN, "')' after condition") == null)
            return null;
        return cond;
    }

    @CheckForNull
    private Node parseIf() {
        Token keyword = advance();
        Node cond = parseCondition(keyword);
        if (cond == null)
            return null;
        Node node = new Node(NodeKind.IF, keyword);
        node.addChild(cond);
        node.addChild(parseStatement());
        if (peekSignificant().is(ELSE)) {
            skip();
            advance();
            node.addChild(parseStatement());
        }
        return node;
    }

    @CheckForNull
    private Node parseWhile() {
        Token keyword = advance();
        Node cond = parseCondition(keyword);
        if (cond == null)
            return null;
        Node node = new Node(NodeKind.WHILE, keyword);
        node.addChild(cond);
        node.addChild(parseStatement());
        return node;
    }

    @CheckForNull
    private Node parseDoWhile() {
        Token keyword = advance();
        Node body = parseStatement();
        Token loop = expect(WHILE, "'while' after do body");
        if (loop == null)
            return null;
        Node cond = parseCondition(loop);
        if (cond == null || expect(SEMICOLON, "';' after do-while") == null)
            return null;
        Node node = new Node(NodeKind.DO_WHILE, keyword);
        node.addChild(body);
        node.addChild(cond);
        return node;
    }

    @CheckForNull
    private Node parseFor() {
        Token keyword = advance();
        if (expect(LPAREN, "'(' after for") == null)
            return null;

        PVector<Node> init = Empty.vector();
        Node initDeclaration = null;
        skip();
        if (peek().is(SEMICOLON)) {
            advance();
        } else if (startsDeclaration()) {
            initDeclaration = parseDeclaration();
            if (initDeclaration == null)
                return null;
        } else {
            init = parseExpressionList();
            if (init == null || expect(SEMICOLON, "';' after for initializer") == null)
                return null;
        }

        Node cond = null;
        if (!check(SEMICOLON)) {
            cond = expectExpression("loop condition");
            if (cond == null)
                return null;
        }
        if (expect(SEMICOLON, "';' after loop condition") == null)
            return null;

        PVector<Node> update = Empty.vector();
        if (!check(RPAREN)) {
            update = parseExpressionList();
            if (update == null)
                return null;
        }
        if (expect(RPAREN, "')' after for header") == null)
            return null;

        Node node = new Node(NodeKind.FOR, keyword, new ForData(init, initDeclaration, cond, update));
        node.addChild(parseStatement());
        return node;
    }

    @CheckForNull
    private PVector<Node> parseExpressionList() {
        PVector<Node> list = Empty.vector();
        do {
            Node expr = expectExpression("expression");
            if (expr == null)
                return null;
            list = list.plus(expr);
        } while (match(COMMA));
        return list;
    }

    @CheckForNull
    private Node parseSwitch() {
        Token keyword = advance();
        Node cond = parseCondition(keyword);
        if (cond == null)
            return null;
        Node node = new Node(NodeKind.SWITCH, keyword);
        node.addChild(cond);
        node.addChild(parseStatement());
        return node;
    }

    /* A case or default label; the statements after it are its siblings. */
    @CheckForNull
    private Node parseCase() {
        Token keyword = advance();
        Node node = new Node(NodeKind.CASE, keyword);
        if (keyword.is(CASE)) {
            Node value = expectExpression("case value");
            if (value == null)
                return null;
            node.addChild(value);
        }
        if (expect(COLON, "':' after " + keyword.getText()) == null)
            return null;
        return node;
    }

    @CheckForNull
    private Node parseReturn() {
        Token keyword = advance();
        Node node = new Node(NodeKind.RETURN, keyword);
        if (!check(SEMICOLON)) {
            Node value = expectExpression("return value");
            if (value == null)
                return null;
            node.addChild(value);
        }
        if (expect(SEMICOLON, "';' after return") == null)
            return null;
        return node;
    }

    @CheckForNull
    private Node parseJump(@Nonnull NodeKind kind) {
        Token keyword = advance();
        if (expect(SEMICOLON, "';' after " + keyword.getText()) == null)
            return null;
        return new Node(kind, keyword);
    }

    @CheckForNull
    private Node parseGoto() {
        advance();
        Token label = expect(IDENTIFIER, "label after goto");
        if (label == null || expect(SEMICOLON, "';' after goto") == null)
            return null;
        return new Node(NodeKind.GOTO, label);
    }

    /* Expressions */

    @CheckForNull
    private Node parseExpression() {
        return parseBinary(0);
    }

    @CheckForNull
    private Node expectExpression(@Nonnull String what) {
        Node expr = parseExpression();
        if (expr == null)
            error("expected " + what + " but found '" + peek().getText() + "'");
        return expr;
    }

    /* Precedence climbing; the ternary binds just above assignment. */
    @CheckForNull
    private Node parseBinary(int minPrecedence) {
        Node left = parseUnary();
        if (left == null)
            return null;
        for (;;) {
            skip();
            Token op = peek();
            if (op.is(QUESTION)) {
                if (minPrecedence > 1)
                    return left;
                advance();
                Node then = expectExpression("expression after '?'");
                if (then == null || expect(COLON, "':' in conditional expression") == null)
                    return null;
                Node otherwise = parseBinary(minPrecedence);
                if (otherwise == null) {
                    error("expected expression after ':' but found '" + peek().getText() + "'");
                    return null;
                }
                Node ternary = new Node(NodeKind.TERNARY, op);
                ternary.addChild(left);
                ternary.addChild(then);
                ternary.addChild(otherwise);
                left = ternary;
                continue;
            }
            int precedence = op.getType().getPrecedence();
            if (precedence < 0 || precedence < minPrecedence)
                return left;
            advance();
            Node right = parseBinary(op.getType().isAssignment() ? precedence : precedence + 1);
            if (right == null) {
                error("expected expression after '" + op.getText() + "' but found '" + peek().getText() + "'");
                return null;
            }
            Node binary = new Node(NodeKind.BINARY, op);
            binary.addChild(left);
            binary.addChild(right);
            left = binary;
        }
    }

    @CheckForNull
    private Node parseUnary() {
        skip();
        Token op = peek();
        switch (op.getType()) {
            case NOT:
            case BIT_NOT:
            case PLUS:
            case MINUS:
            case STAR:
            case BIT_AND:
            case INCREMENT:
            case DECREMENT:
                advance();
                Node operand = parseUnary();
                if (operand == null) {
                    error("expected operand after '" + op.getText() + "' but found '" + peek().getText() + "'");
                    return null;
                }
                Node unary = new Node(NodeKind.UNARY, op, new UnaryData(false));
                unary.addChild(operand);
                return unary;
            case SIZEOF:
                return parseSizeof();
            default:
                return parsePostfix();
        }
    }

    @CheckForNull
    private Node parseSizeof() {
        Token keyword = advance();
        skip();
        if (peek().is(LPAREN) && looksLikeTypeInParens(current))
            return new Node(NodeKind.SIZEOF, keyword, new TypeData(parseParenthesizedType()));
        Node operand = parseUnary();
        if (operand == null) {
            error("expected operand of sizeof but found '" + peek().getText() + "'");
            return null;
        }
        Node node = new Node(NodeKind.SIZEOF, keyword, new TypeData(Empty.<Token>vector()));
        node.addChild(operand);
        return node;
    }

    /* At a '(' known to hold a type name; consumes through the ')'. */
    @Nonnull
    private PVector<Token> parseParenthesizedType() {
        advance();
        PVector<Token> type = Empty.vector();
        while (!check(RPAREN))
            type = type.plus(advance());
        advance();
        return type;
    }

    @CheckForNull
    private Node parsePostfix() {
        Node node = parsePrimary();
        if (node == null)
            return null;
        for (;;) {
            skip();
            Token tok = peek();
            switch (tok.getType()) {
                case LBRACKET: {
                    advance();
                    Node index = expectExpression("array index");
                    if (index == null || expect(RBRACKET, "']' after array index") == null)
                        return null;
                    Node access = new Node(NodeKind.ARRAY_ACCESS, tok);
                    access.addChild(node);
                    access.addChild(index);
                    node = access;
                    break;
                }
                case LPAREN: {
                    advance();
                    Node call = new Node(NodeKind.CALL, node.getToken());
                    call.addChild(node);
                    if (!parseArguments(call))
                        return null;
                    node = call;
                    break;
                }
                case DOT:
                case ARROW: {
                    advance();
                    Token member = expect(IDENTIFIER, "member name after '" + tok.getText() + "'");
                    if (member == null)
                        return null;
                    Node access = new Node(NodeKind.MEMBER_ACCESS, member, new MemberData(tok.is(ARROW)));
                    access.addChild(node);
                    node = access;
                    break;
                }
                case INCREMENT:
                case DECREMENT: {
                    advance();
                    Node unary = new Node(NodeKind.UNARY, tok, new UnaryData(true));
                    unary.addChild(node);
                    node = unary;
                    break;
                }
                default:
                    return node;
            }
        }
    }

    /* After the '('; consumes the ')'. */
    private boolean parseArguments(@Nonnull Node call) {
        if (match(RPAREN))
            return true;
        for (;;) {
            Node arg = parseArgument();
            if (arg == null) {
                error("expected argument but found '" + peek().getText() + "'");
                return false;
            }
            call.addChild(arg);
            if (match(COMMA))
                continue;
            return expect(RPAREN, "')' after arguments") != null;
        }
    }

    /* An expression, or a type name as taken by va_arg and offsetof. */
    @CheckForNull
    private Node parseArgument() {
        skip();
        Token first = peek();
        if (!isTypeKeyword(first.getType()))
            return parseExpression();
        PVector<Token> type = Empty.vector();
        int depth = 0;
        for (;;) {
            skip();
            Token tok = peek();
            switch (tok.getType()) {
                case LPAREN:
                    depth++;
                    break;
                case RPAREN:
                    if (depth == 0)
                        return new Node(NodeKind.TYPE_EXPR, first, new TypeData(type));
                    depth--;
                    break;
                case COMMA:
                    if (depth == 0)
                        return new Node(NodeKind.TYPE_EXPR, first, new TypeData(type));
                    break;
                case SEMICOLON:
                case LBRACE:
                case RBRACE:
                case EOF:
                    return null;
                default:
                    break;
            }
            type = type.plus(advance());
        }
    }

    @CheckForNull
    private Node parsePrimary() {
        skip();
        Token tok = peek();
        switch (tok.getType()) {
            case INTEGER:
            case FLOAT:
            case CHAR:
                advance();
                return new Node(NodeKind.LITERAL, tok, new LiteralData(Empty.<Token>vector().plus(tok)));
            case STRING: {
                PVector<Token> pieces = Empty.vector();
                pieces = pieces.plus(advance());
                while (peekSignificant().is(STRING)) {
                    skip();
                    pieces = pieces.plus(advance());
                }
                return new Node(NodeKind.LITERAL, tok, new LiteralData(pieces));
            }
            case IDENTIFIER:
                advance();
                return new Node(NodeKind.IDENTIFIER, tok);
            case LPAREN: {
                if (looksLikeTypeInParens(current)) {
                    PVector<Token> type = parseParenthesizedType();
                    Node operand = parseUnary();
                    if (operand == null) {
                        error("expected expression after cast but found '" + peek().getText() + "'");
                        return null;
                    }
                    Node cast = new Node(NodeKind.CAST, tok, new TypeData(type));
                    cast.addChild(operand);
                    return cast;
                }
                advance();
                Node inner = expectExpression("expression after '('");
                if (inner == null || expect(RPAREN, "')'") == null)
                    return null;
                Node paren = new Node(NodeKind.PAREN, tok);
                paren.addChild(inner);
                return paren;
            }
            default:
                return null;
        }
    }
}
