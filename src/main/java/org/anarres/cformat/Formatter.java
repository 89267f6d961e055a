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

import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints a tree built by the {@link Parser} in house style.
 *
 * Blocks are indented with one tab per level and braces go on
 * their own lines, except that {@code do} keeps its brace and
 * prints {@code } while (cond);}. Line comments become block
 * comments unless {@link Feature#LINECOMMENTS} is set. Regions the
 * parser kept verbatim are printed verbatim.
 *
 * Formatting never fails on a tree the parser produced.
 */
public class Formatter {

    private static final Logger LOG = LoggerFactory.getLogger(Formatter.class);

    /* Top-level items of different groups are separated by a blank line. */
    private static enum Group {
        DIRECTIVE, PROTOTYPE, VARIABLE, TYPEDEF, BLOCK, UNPARSED, OTHER
    }

    /* The text being built, with the column of the open line. */
    private static final class Output {

        private final StringBuilder buf = new StringBuilder();
        private final int tabWidth;
        private final int maxLineLength;
        @CheckForNull
        private final ParseListener listener;
        private final String sourceName;
        private boolean open = false;
        private int line = 1;
        private int column = 0;
        private int longLines = 0;

        private Output(int tabWidth, int maxLineLength, @CheckForNull ParseListener listener, @Nonnull String sourceName) {
            this.tabWidth = tabWidth;
            this.maxLineLength = maxLineLength;
            this.listener = listener;
            this.sourceName = sourceName;
        }

        /* Starts a new line at the given indent. */
        private void line(@Nonnegative int indent) {
            close();
            for (int i = 0; i < indent; i++)
                write("\t");
            open = true;
        }

        private void write(@Nonnull String s) {
            open = true;
            for (int i = 0; i < s.length(); i++) {
                char c = s.charAt(i);
                if (c == '\n') {
                    endLine();
                } else if (c == '\t') {
                    column += tabWidth - column % tabWidth;
                } else {
                    column++;
                }
                buf.append(c);
            }
        }

        private void endLine() {
            if (column > maxLineLength) {
                longLines++;
                if (listener != null)
                    listener.handleWarning(sourceName, line, maxLineLength + 1,
                            "formatted line is " + column + " columns long");
            }
            line++;
            column = 0;
        }

        private void close() {
            if (!open)
                return;
            endLine();
            buf.append('\n');
            open = false;
        }

        /* At most one blank line, and none at the top. */
        private void blank() {
            close();
            int len = buf.length();
            if (len == 0)
                return;
            if (len >= 2 && buf.charAt(len - 1) == '\n' && buf.charAt(len - 2) == '\n')
                return;
            buf.append('\n');
            line++;
        }

        @Nonnull
        private String finish() {
            close();
            while (buf.length() >= 2 && buf.charAt(buf.length() - 1) == '\n' && buf.charAt(buf.length() - 2) == '\n')
                buf.setLength(buf.length() - 1);
            return buf.toString();
        }
    }

    private final Set<Feature> features;
    private int tabWidth = 8;
    private int maxLineLength = 80;
    @CheckForNull
    private ParseListener listener;
    private String sourceName = "<input>";

    public Formatter() {
        this.features = EnumSet.noneOf(Feature.class);
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

    /** Sets the width of a tab, used only to measure line length. */
    public void setTabWidth(@Nonnegative int tabWidth) {
        if (tabWidth < 1)
            throw new IllegalArgumentException("Tab width must be positive: " + tabWidth);
        this.tabWidth = tabWidth;
    }

    public int getTabWidth() {
        return tabWidth;
    }

    /**
     * Sets the line length above which lines are reported.
     * Long lines are never broken.
     */
    public void setMaxLineLength(@Nonnegative int maxLineLength) {
        this.maxLineLength = maxLineLength;
    }

    public int getMaxLineLength() {
        return maxLineLength;
    }

    /**
     * Sets the listener told about each formatted line longer than
     * the maximum line length.
     */
    public void setListener(@CheckForNull ParseListener listener) {
        this.listener = listener;
    }

    @CheckForNull
    public ParseListener getListener() {
        return listener;
    }

    /** Sets the name used in warnings. */
    public void setSourceName(@Nonnull String sourceName) {
        this.sourceName = sourceName;
    }

    /**
     * Formats a {@link NodeKind#PROGRAM} tree.
     *
     * The result ends with exactly one newline, or is empty if the
     * program has neither items nor comments.
     */
    @Nonnull
    public String format(@Nonnull Node program) {
        if (!program.is(NodeKind.PROGRAM))
            throw new IllegalArgumentException("Not a program: " + program.getKind());
        Output out = new Output(tabWidth, maxLineLength, listener, sourceName);
        Node prev = null;
        for (Node item : program.getChildren()) {
            if (prev != null && isBlankBetween(prev, item))
                out.blank();
            statement(out, item, 0);
            prev = item;
        }
        if (!program.getFooterComments().isEmpty()) {
            out.blank();
            footer(out, program, 0);
        }
        String text = out.finish();
        if (out.longLines > 0)
            LOG.debug(sourceName + ": " + out.longLines + " lines longer than " + maxLineLength + " columns");
        return text;
    }

    /* Top level */

    @Nonnull
    private static Group group(@Nonnull Node node) {
        switch (node.getKind()) {
            case PREPROCESSOR:
                return Group.DIRECTIVE;
            case FUNCTION:
                return node.getFunction().definition ? Group.BLOCK : Group.PROTOTYPE;
            case STRUCT:
            case UNION:
            case ENUM:
                return node.getTag().body ? Group.BLOCK : Group.PROTOTYPE;
            case TYPEDEF:
                if (node.getChildCount() > 0) {
                    Node inner = node.getChild(0);
                    if (!inner.is(NodeKind.FUNC_PTR) && inner.getTag().body)
                        return Group.BLOCK;
                }
                return Group.TYPEDEF;
            case VAR_DECL:
            case FUNC_PTR:
                return Group.VARIABLE;
            case UNPARSED:
                return Group.UNPARSED;
            default:
                return Group.OTHER;
        }
    }

    private static boolean isBlankBetween(@Nonnull Node prev, @Nonnull Node next) {
        Group a = group(prev);
        Group b = group(next);
        if (a == Group.DIRECTIVE && b == Group.DIRECTIVE)
            return next.isBlankLineBefore();
        if (a == Group.BLOCK || b == Group.BLOCK)
            return true;
        if (a != b)
            return true;
        return next.isBlankLineBefore();
    }

    /* Comments */

    @Nonnull
    private String comment(@Nonnull Token tok) {
        if (!tok.is(TokenType.COMMENT_LINE) || getFeature(Feature.LINECOMMENTS))
            return tok.getText();
        String body = tok.getText().substring(2).trim().replace("*/", "* /");
        if (body.isEmpty())
            return "/* */";
        return "/* " + body + " */";
    }

    private void comments(@Nonnull Output out, @Nonnull List<Token> comments, int indent) {
        for (Token tok : comments) {
            out.line(indent);
            out.write(comment(tok));
        }
    }

    private void footer(@Nonnull Output out, @Nonnull Node node, int indent) {
        comments(out, node.getFooterComments(), indent);
    }

    private void trailing(@Nonnull Output out, @Nonnull Node node) {
        for (Token tok : node.getTrailingComments())
            out.write(" " + comment(tok));
    }

    /* Statements */

    private static int indentOf(@Nonnull Node node, int indent) {
        if (node.is(NodeKind.CASE) || node.is(NodeKind.LABEL))
            return Math.max(0, indent - 1);
        return indent;
    }

    private void statement(@Nonnull Output out, @Nonnull Node node, int indent) {
        comments(out, node.getLeadingComments(), indent);
        switch (node.getKind()) {
            case PREPROCESSOR:
                out.line(0);
                out.write(node.getText());
                break;
            case UNPARSED:
                out.line(indent);
                out.write(node.getUnparsed().text);
                break;
            case FUNCTION:
                function(out, node, indent);
                break;
            case VAR_DECL:
            case FUNC_PTR:
                out.line(indent);
                out.write(declaration(node) + ";");
                break;
            case TYPEDEF:
                typedef(out, node, indent);
                break;
            case STRUCT:
            case UNION:
            case ENUM:
                out.line(indent);
                tag(out, node, indent, "");
                out.write(declarators(node.getTag()) + ";");
                break;
            case BLOCK:
                block(out, node, indent);
                break;
            case IF:
                out.line(indent);
                ifChain(out, node, indent);
                break;
            case WHILE:
                out.line(indent);
                out.write("while (" + expression(node.getChild(0)) + ")");
                body(out, node.getChild(1), indent);
                break;
            case FOR:
                out.line(indent);
                out.write("for (" + forHeader(node.getFor()) + ")");
                body(out, node.getChild(0), indent);
                break;
            case DO_WHILE:
                doWhile(out, node, indent);
                break;
            case SWITCH:
                out.line(indent);
                out.write("switch (" + expression(node.getChild(0)) + ")");
                body(out, node.getChild(1), indent);
                break;
            case CASE:
                out.line(indentOf(node, indent));
                if (node.getChildCount() > 0)
                    out.write("case " + expression(node.getChild(0)) + ":");
                else
                    out.write("default:");
                break;
            case LABEL:
                out.line(indentOf(node, indent));
                out.write(node.getText() + ":");
                break;
            case RETURN:
                out.line(indent);
                out.write(returnText(node));
                break;
            case BREAK:
                out.line(indent);
                out.write("break;");
                break;
            case CONTINUE:
                out.line(indent);
                out.write("continue;");
                break;
            case GOTO:
                out.line(indent);
                out.write("goto " + node.getText() + ";");
                break;
            case EXPR_STMT:
                out.line(indent);
                if (node.getChildCount() > 0)
                    out.write(expression(node.getChild(0)));
                out.write(";");
                break;
            default:
                throw new IllegalStateException("Not a statement: " + node.getKind());
        }
        trailing(out, node);
    }

    /*
     * Inside a block, blank lines the user left between declarations
     * are dropped, and the first statement after them is preceded by
     * exactly one blank line. From there on the user's blank lines
     * are kept. Directives do not end the declarations.
     */
    private void statements(@Nonnull Output out, @Nonnull List<Node> nodes, int indent) {
        // The first statement which is neither a declaration nor a directive.
        int first = 0;
        int lastDeclaration = -1;
        for (; first < nodes.size(); first++) {
            Node node = nodes.get(first);
            if (node.getKind().isDeclaration())
                lastDeclaration = first;
            else if (!node.is(NodeKind.PREPROCESSOR))
                break;
        }
        // Directives between the declarations and that statement follow the blank.
        int transition = lastDeclaration >= 0 && first < nodes.size() ? lastDeclaration + 1 : -1;
        for (int i = 0; i < nodes.size(); i++) {
            Node node = nodes.get(i);
            boolean blank;
            if (i == transition)
                blank = true;
            else if (i <= first)
                blank = false;
            else
                blank = node.isBlankLineBefore();
            if (blank && i > 0)
                out.blank();
            statement(out, node, indent);
        }
    }

    private void block(@Nonnull Output out, @Nonnull Node block, int indent) {
        out.line(indent);
        out.write("{");
        statements(out, block.getChildren(), indent + 1);
        footer(out, block, indent + 1);
        out.line(indent);
        out.write("}");
    }

    /* The body of a control statement: blocks at the same indent, others one deeper. */
    private void body(@Nonnull Output out, @Nonnull Node body, int indent) {
        if (body.is(NodeKind.EXPR_STMT) && body.getChildCount() == 0 && body.getLeadingComments().isEmpty()) {
            out.write(";");
            trailing(out, body);
        } else if (body.is(NodeKind.BLOCK)) {
            statement(out, body, indent);
        } else {
            statement(out, body, indent + 1);
        }
    }

    private void ifChain(@Nonnull Output out, @Nonnull Node node, int indent) {
        out.write("if (" + expression(node.getChild(0)) + ")");
        body(out, node.getChild(1), indent);
        if (node.getChildCount() < 3)
            return;
        Node otherwise = node.getChild(2);
        out.line(indent);
        out.write("else");
        if (otherwise.is(NodeKind.IF) && otherwise.getLeadingComments().isEmpty()) {
            out.write(" ");
            ifChain(out, otherwise, indent);
            trailing(out, otherwise);
        } else {
            body(out, otherwise, indent);
        }
    }

    private void doWhile(@Nonnull Output out, @Nonnull Node node, int indent) {
        Node body = node.getChild(0);
        String tail = "while (" + expression(node.getChild(1)) + ");";
        if (!body.is(NodeKind.BLOCK)) {
            out.line(indent);
            out.write("do");
            statement(out, body, indent + 1);
            out.line(indent);
            out.write(tail);
            return;
        }
        comments(out, body.getLeadingComments(), indent);
        out.line(indent);
        out.write("do {");
        statements(out, body.getChildren(), indent + 1);
        footer(out, body, indent + 1);
        out.line(indent);
        out.write("} " + tail);
        trailing(out, body);
    }

    @Nonnull
    private String forHeader(@Nonnull ForData data) {
        String init = data.initDeclaration != null ? declaration(data.initDeclaration) : join(data.init);
        String condition = data.condition != null ? expression(data.condition) : "";
        String update = join(data.update);
        StringBuilder buf = new StringBuilder(init).append(';');
        if (!condition.isEmpty())
            buf.append(' ').append(condition);
        buf.append(';');
        if (!update.isEmpty())
            buf.append(' ').append(update);
        return buf.toString();
    }

    @Nonnull
    private String returnText(@Nonnull Node node) {
        if (node.getChildCount() == 0)
            return "return;";
        Node value = node.getChild(0);
        if (value.is(NodeKind.PAREN))
            return "return " + expression(value) + ";";
        return "return (" + expression(value) + ");";
    }

    /* Declarations */

    private void function(@Nonnull Output out, @Nonnull Node node, int indent) {
        FunctionData data = node.getFunction();
        StringBuilder buf = new StringBuilder();
        String type = Tokens.typeText(data.returnType);
        buf.append(type).append(' ').append(Tokens.pointerText(data.pointers)).append(data.name.getText());
        buf.append('(');
        for (int i = 0; i < data.parameters.size(); i++) {
            if (i > 0)
                buf.append(", ");
            buf.append(parameter(data.parameters.get(i)));
        }
        buf.append(')');
        out.line(indent);
        out.write(buf.toString());
        if (data.definition)
            block(out, node.getChild(0), indent);
        else
            out.write(";");
    }

    @Nonnull
    private String parameter(@Nonnull Node node) {
        if (node.is(NodeKind.UNPARSED))
            return node.getUnparsed().text;
        ParamData data = node.getParam();
        if (data.variadic)
            return "...";
        if (data.opaque)
            return Tokens.spaced(data.typeTokens);
        StringBuilder buf = new StringBuilder(Tokens.typeText(data.typeTokens));
        String pointers = Tokens.pointerText(data.pointers);
        if (buf.length() > 0 && (!pointers.isEmpty() || data.name != null))
            buf.append(' ');
        buf.append(pointers);
        if (data.name != null)
            buf.append(data.name.getText());
        buf.append(Tokens.typeText(data.arrays));
        return buf.toString().trim();
    }

    /* A variable or function-pointer declaration, without the ';'. */
    @Nonnull
    private String declaration(@Nonnull Node node) {
        if (node.is(NodeKind.FUNC_PTR))
            return functionPointer(node.getFuncPtr());
        VarDeclData data = node.getVarDecl();
        StringBuilder buf = new StringBuilder(Tokens.typeText(data.typeTokens));
        buf.append(' ').append(declarator(data));
        for (VarDeclData next : data.declarators)
            buf.append(", ").append(declarator(next));
        return buf.toString();
    }

    @Nonnull
    private String declarator(@Nonnull VarDeclData data) {
        StringBuilder buf = new StringBuilder();
        buf.append(Tokens.pointerText(data.pointers)).append(data.name.getText());
        buf.append(Tokens.typeText(data.arrays));
        if (data.bitWidth != null)
            buf.append(" : ").append(expression(data.bitWidth));
        if (data.initializer != null)
            buf.append(" = ").append(expression(data.initializer));
        return buf.toString();
    }

    @Nonnull
    private static String functionPointer(@Nonnull FuncPtrData data) {
        StringBuilder buf = new StringBuilder(Tokens.typeText(data.returnType));
        boolean star = !data.returnType.isEmpty()
                && data.returnType.get(data.returnType.size() - 1).is(TokenType.STAR);
        buf.append(star ? "(*" : " (*");
        buf.append(data.name.getText()).append(")(");
        buf.append(Tokens.spaced(data.parameters)).append(')');
        return buf.toString();
    }

    private void typedef(@Nonnull Output out, @Nonnull Node node, int indent) {
        TypedefData data = node.getTypedef();
        out.line(indent);
        if (node.getChildCount() == 0) {
            out.write("typedef " + Tokens.typeText(data.baseTokens) + " " + alias(data) + ";");
            return;
        }
        Node inner = node.getChild(0);
        if (inner.is(NodeKind.FUNC_PTR)) {
            out.write("typedef " + functionPointer(inner.getFuncPtr()) + ";");
            return;
        }
        tag(out, inner, indent, "typedef ");
        out.write(" " + alias(data) + ";");
    }

    @Nonnull
    private static String alias(@Nonnull TypedefData data) {
        String name = data.alias != null ? data.alias.getText() : "";
        return Tokens.pointerText(data.pointers) + name + Tokens.typeText(data.arrays);
    }

    @Nonnull
    private static String declarators(@Nonnull TagData data) {
        if (data.declarators.isEmpty())
            return "";
        return " " + Tokens.spaced(data.declarators);
    }

    /* Prints the tag up to its closing brace, leaving the line open. */
    private void tag(@Nonnull Output out, @Nonnull Node node, int indent, @Nonnull String prefix) {
        TagData data = node.getTag();
        StringBuilder header = new StringBuilder(prefix).append(data.keyword.getText());
        if (data.name != null)
            header.append(' ').append(data.name.getText());
        out.write(header.toString());
        if (!data.body)
            return;
        out.line(indent);
        out.write("{");
        if (node.is(NodeKind.ENUM)) {
            enumerators(out, node.getChildren(), indent + 1);
        } else {
            for (int i = 0; i < node.getChildCount(); i++) {
                Node member = node.getChild(i);
                if (i > 0 && member.isBlankLineBefore())
                    out.blank();
                statement(out, member, indent + 1);
            }
        }
        footer(out, node, indent + 1);
        out.line(indent);
        out.write("}");
    }

    private void enumerators(@Nonnull Output out, @Nonnull List<Node> values, int indent) {
        for (int i = 0; i < values.size(); i++) {
            Node value = values.get(i);
            if (i > 0 && value.isBlankLineBefore())
                out.blank();
            comments(out, value.getLeadingComments(), indent);
            out.line(indent);
            if (value.is(NodeKind.UNPARSED)) {
                out.write(value.getUnparsed().text);
            } else {
                out.write(value.getText());
                if (value.getChildCount() > 0)
                    out.write(" = " + expression(value.getChild(0)));
                if (i < values.size() - 1)
                    out.write(",");
            }
            trailing(out, value);
        }
    }

    /* Expressions */

    @Nonnull
    private String join(@Nonnull List<Node> nodes) {
        StringBuilder buf = new StringBuilder();
        for (int i = 0; i < nodes.size(); i++) {
            if (i > 0)
                buf.append(", ");
            buf.append(expression(nodes.get(i)));
        }
        return buf.toString();
    }

    @Nonnull
    private String expression(@Nonnull Node node) {
        switch (node.getKind()) {
            case IDENTIFIER:
                return node.getText();
            case LITERAL: {
                StringBuilder buf = new StringBuilder();
                for (Token piece : node.getLiteral().pieces) {
                    if (buf.length() > 0)
                        buf.append(' ');
                    buf.append(piece.getText());
                }
                return buf.toString();
            }
            case BINARY:
                return expression(node.getChild(0)) + " " + node.getText() + " " + expression(node.getChild(1));
            case UNARY: {
                String operand = expression(node.getChild(0));
                if (node.getUnary().postfix)
                    return operand + node.getText();
                return node.getText() + (isFused(node.getText(), operand) ? " " : "") + operand;
            }
            case CALL:
                return expression(node.getChild(0)) + "(" + join(node.getChildren().subList(1, node.getChildCount())) + ")";
            case MEMBER_ACCESS:
                return expression(node.getChild(0)) + (node.getMember().arrow ? "->" : ".") + node.getText();
            case ARRAY_ACCESS:
                return expression(node.getChild(0)) + "[" + expression(node.getChild(1)) + "]";
            case CAST:
                return "(" + Tokens.typeText(node.getTypeData().tokens) + ")" + expression(node.getChild(0));
            case SIZEOF: {
                TypeData data = node.getTypeData();
                if (data.isType())
                    return "sizeof(" + Tokens.typeText(data.tokens) + ")";
                Node operand = node.getChild(0);
                return "sizeof" + (operand.is(NodeKind.PAREN) ? "" : " ") + expression(operand);
            }
            case TERNARY:
                return expression(node.getChild(0)) + " ? " + expression(node.getChild(1)) + " : " + expression(node.getChild(2));
            case PAREN:
                return "(" + expression(node.getChild(0)) + ")";
            case INIT_LIST:
                return "{" + join(node.getChildren()) + "}";
            case TYPE_EXPR:
                return Tokens.typeText(node.getTypeData().tokens);
            case UNPARSED:
                return node.getUnparsed().text;
            default:
                throw new IllegalStateException("Not an expression: " + node.getKind());
        }
    }

    /* Whether "- -x" would print as "--x". */
    private static boolean isFused(@Nonnull String op, @Nonnull String operand) {
        if (operand.isEmpty())
            return false;
        char last = op.charAt(op.length() - 1);
        char first = operand.charAt(0);
        return last == first && (last == '-' || last == '+' || last == '&');
    }
}
