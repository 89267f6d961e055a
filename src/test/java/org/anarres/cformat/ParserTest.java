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

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import static org.junit.jupiter.api.Assertions.*;

public class ParserTest {

    private static final Logger LOG = LoggerFactory.getLogger(ParserTest.class);

    private static Node parse(String source) {
        Parser parser = new Parser(source);
        Node program = parser.parse();
        LOG.info("Parsed:\n" + program.dump());
        assertEquals(0, parser.getErrorCount(), "Unexpected errors in:\n" + source);
        return program;
    }

    /* Parses the body of a function wrapped around the given statements. */
    private static Node body(String statements) {
        Node program = parse("void f(void)\n{\n" + statements + "\n}\n");
        Node function = program.getChild(0);
        assertEquals(NodeKind.FUNCTION, function.getKind());
        return function.getChild(0);
    }

    /* The expression of the first statement in the body. */
    private static Node expression(String statement) {
        Node stmt = body(statement).getChild(0);
        assertEquals(NodeKind.EXPR_STMT, stmt.getKind());
        return stmt.getChild(0);
    }

    @Test
    public void testSimpleFunction() {
        Node program = parse("int main(void)\n{\nreturn 0;\n}");
        assertEquals(NodeKind.PROGRAM, program.getKind());
        assertEquals(1, program.getChildCount());
        Node main = program.getChild(0);
        assertEquals(NodeKind.FUNCTION, main.getKind());
        assertEquals("main", main.getText());
        assertTrue(main.getFunction().definition);
        assertEquals(1, main.getFunction().parameters.size());
        assertEquals(1, main.getChildCount());
        Node block = main.getChild(0);
        assertEquals(NodeKind.BLOCK, block.getKind());
        assertEquals(1, block.getChildCount());
        Node ret = block.getChild(0);
        assertEquals(NodeKind.RETURN, ret.getKind());
        assertEquals(NodeKind.LITERAL, ret.getChild(0).getKind());
    }

    @Test
    public void testEnum() {
        Node program = parse("enum color { RED, GREEN, BLUE };");
        Node e = program.getChild(0);
        assertEquals(NodeKind.ENUM, e.getKind());
        assertEquals("color", e.getText());
        assertEquals(3, e.getChildCount());
        List<String> names = Arrays.asList("RED", "GREEN", "BLUE");
        for (int i = 0; i < 3; i++) {
            Node value = e.getChild(i);
            assertEquals(NodeKind.ENUM_VALUE, value.getKind());
            assertEquals(names.get(i), value.getText());
            assertEquals(0, value.getChildCount());
        }
    }

    @Test
    public void testEnumWithValues() {
        Node e = parse("enum { A = 1, B = A << 2, };").getChild(0);
        assertEquals(2, e.getChildCount());
        assertEquals(NodeKind.BINARY, e.getChild(1).getChild(0).getKind());
        assertNull(e.getTag().name);
    }

    @Test
    public void testChainedDeclarators() {
        Node decl = parse("int i, j, k;").getChild(0);
        assertEquals(NodeKind.VAR_DECL, decl.getKind());
        VarDeclData data = decl.getVarDecl();
        assertEquals("i", data.name.getText());
        assertEquals(2, data.declarators.size());
        assertEquals("j", data.declarators.get(0).name.getText());
        assertEquals("k", data.declarators.get(1).name.getText());
    }

    @Test
    public void testDeclarationWithInitializerAndArrays() {
        Node decl = parse("static char *names[10] = { \"a\", \"b\" };").getChild(0);
        VarDeclData data = decl.getVarDecl();
        assertEquals("names", data.name.getText());
        assertEquals(1, data.pointers.size());
        assertEquals(3, data.arrays.size());
        assertNotNull(data.initializer);
        assertEquals(NodeKind.INIT_LIST, data.initializer.getKind());
        assertEquals(2, data.initializer.getChildCount());
        assertSame(data.initializer, decl.getChild(0));
    }

    @Test
    public void testTypedefRegistersName() {
        Parser parser = new Parser("typedef unsigned long ulong;\nulong *p;\n");
        Node program = parser.parse();
        assertEquals(0, parser.getErrorCount());
        assertTrue(parser.getSymbolTable().isTypedef(SymbolTable.GLOBAL, "ulong"));
        assertEquals(NodeKind.TYPEDEF, program.getChild(0).getKind());
        assertEquals("ulong", program.getChild(0).getTypedef().alias.getText());
        assertEquals(NodeKind.VAR_DECL, program.getChild(1).getKind());
    }

    @Test
    public void testTypedefStruct() {
        Node program = parse("typedef struct point { int x; int y; } point_t;\npoint_t origin;\n");
        Node typedef = program.getChild(0);
        assertEquals(NodeKind.TYPEDEF, typedef.getKind());
        Node tag = typedef.getChild(0);
        assertEquals(NodeKind.STRUCT, tag.getKind());
        assertEquals("point", tag.getText());
        assertEquals(2, tag.getChildCount());
        assertEquals(NodeKind.VAR_DECL, program.getChild(1).getKind());
    }

    @Test
    public void testTypedefFunctionPointer() {
        Parser parser = new Parser("typedef void (*cb_t)(void *, int);");
        Node typedef = parser.parse().getChild(0);
        assertEquals(0, parser.getErrorCount());
        assertEquals(NodeKind.FUNC_PTR, typedef.getChild(0).getKind());
        assertEquals("cb_t", typedef.getText());
        assertTrue(parser.getSymbolTable().isTypedef(SymbolTable.GLOBAL, "cb_t"));
    }

    @Test
    public void testFunctionPointerDeclaration() {
        Node fp = parse("int (*handler)(int, char *);").getChild(0);
        assertEquals(NodeKind.FUNC_PTR, fp.getKind());
        assertEquals("handler", fp.getFuncPtr().name.getText());
        assertEquals(4, fp.getFuncPtr().parameters.size());
    }

    @Test
    public void testStructWithDeclarators() {
        Node s = parse("struct p { int x : 3; struct { int y; } inner; } origin;").getChild(0);
        assertEquals(NodeKind.STRUCT, s.getKind());
        assertEquals(1, s.getTag().declarators.size());
        assertEquals(2, s.getChildCount());
        assertNotNull(s.getChild(0).getVarDecl().bitWidth);
        assertEquals(NodeKind.STRUCT, s.getChild(1).getKind());
    }

    @Test
    public void testPrototypeParameters() {
        Node f = parse("static const char *name(struct foo *f, int n, ...);").getChild(0);
        FunctionData data = f.getFunction();
        assertFalse(data.definition);
        assertEquals(0, f.getChildCount());
        assertEquals(3, data.parameters.size());
        assertEquals("f", data.parameters.get(0).getParam().name.getText());
        assertTrue(data.parameters.get(2).getParam().variadic);
    }

    @Test
    public void testFunctionPointerParameter() {
        Node f = parse("void sort(int (*cmp)(const void *, const void *), int n);").getChild(0);
        ParamData param = f.getFunction().parameters.get(0).getParam();
        assertTrue(param.opaque);
    }

    @Test
    public void testAttributeSkipped() {
        Node f = parse("void die(void) __attribute__((noreturn));").getChild(0);
        assertEquals(NodeKind.FUNCTION, f.getKind());
        assertFalse(f.getFunction().definition);
    }

    @Test
    public void testPrecedence() {
        Node assign = expression("x = a + b * c;");
        assertEquals("=", assign.getText());
        Node plus = assign.getChild(1);
        assertEquals("+", plus.getText());
        assertEquals("*", plus.getChild(1).getText());
    }

    @Test
    public void testAssociativity() {
        Node assign = expression("a = b = c;");
        assertEquals(NodeKind.IDENTIFIER, assign.getChild(0).getKind());
        assertEquals("=", assign.getChild(1).getText());

        Node minus = expression("a - b - c;");
        assertEquals("-", minus.getChild(0).getText());
        assertEquals("c", minus.getChild(1).getText());
    }

    @Test
    public void testTernary() {
        Node assign = expression("x = a ? b : c ? d : e;");
        Node ternary = assign.getChild(1);
        assertEquals(NodeKind.TERNARY, ternary.getKind());
        assertEquals(NodeKind.TERNARY, ternary.getChild(2).getKind());
    }

    @Test
    public void testUnaryAndPostfix() {
        Node assign = expression("p->q.r[i] = -y++;");
        Node index = assign.getChild(0);
        assertEquals(NodeKind.ARRAY_ACCESS, index.getKind());
        Node dot = index.getChild(0);
        assertEquals(NodeKind.MEMBER_ACCESS, dot.getKind());
        assertFalse(dot.getMember().arrow);
        assertTrue(dot.getChild(0).getMember().arrow);

        Node neg = assign.getChild(1);
        assertFalse(neg.getUnary().postfix);
        assertTrue(neg.getChild(0).getUnary().postfix);
    }

    @Test
    public void testCastAndParen() {
        assertEquals(NodeKind.CAST, expression("x = (int)y;").getChild(1).getKind());
        assertEquals(NodeKind.CAST, expression("x = (struct foo *)y;").getChild(1).getKind());
        assertEquals(NodeKind.CAST, expression("x = (size_t)y;").getChild(1).getKind());
        Node sum = expression("x = (y) + 1;").getChild(1);
        assertEquals(NodeKind.PAREN, sum.getChild(0).getKind());
    }

    @Test
    public void testSizeof() {
        Node type = expression("n = sizeof(int *);").getChild(1);
        assertEquals(NodeKind.SIZEOF, type.getKind());
        assertTrue(type.getTypeData().isType());
        assertEquals(0, type.getChildCount());

        Node expr = expression("n = sizeof x;").getChild(1);
        assertFalse(expr.getTypeData().isType());
        assertEquals(1, expr.getChildCount());
    }

    @Test
    public void testCallWithTypeArgument() {
        Node call = expression("v = va_arg(ap, int);").getChild(1);
        assertEquals(NodeKind.CALL, call.getKind());
        assertEquals(3, call.getChildCount());
        assertEquals(NodeKind.TYPE_EXPR, call.getChild(2).getKind());
    }

    @Test
    public void testAdjacentStrings() {
        Node decl = body("const char *s = \"a\" \"b\";").getChild(0);
        Node literal = decl.getVarDecl().initializer;
        assertEquals(2, literal.getLiteral().pieces.size());
    }

    @Test
    public void testPointerDeclarationHeuristic() {
        assertEquals(NodeKind.VAR_DECL, body("a * b;").getChild(0).getKind());
        Node stmt = body("a * b + c;").getChild(0);
        assertEquals(NodeKind.EXPR_STMT, stmt.getKind());
        assertEquals(NodeKind.EXPR_STMT, body("x = a * b;").getChild(0).getKind());
    }

    @Test
    public void testExtraTypedef() {
        Parser plain = new Parser("void f(void)\n{\n\thandle h;\n}\n");
        plain.parse();
        assertEquals(1, plain.getErrorCount());

        Parser parser = new Parser("void f(void)\n{\n\thandle h;\n}\n");
        parser.addTypedef("handle");
        Node block = parser.parse().getChild(0).getChild(0);
        assertEquals(0, parser.getErrorCount());
        assertEquals(NodeKind.VAR_DECL, block.getChild(0).getKind());
    }

    @Test
    public void testControlFlow() {
        Node block = body("if (x) y(); else if (z) { w(); } else v();\n"
                + "while (x--) ;\n"
                + "for (int i = 0; i < n; i++) x++;\n"
                + "do { x++; } while (x < 10);\n"
                + "goto out;\n"
                + "out:\n"
                + "return;");
        Node ifNode = block.getChild(0);
        assertEquals(NodeKind.IF, ifNode.getKind());
        assertEquals(3, ifNode.getChildCount());
        assertEquals(NodeKind.IF, ifNode.getChild(2).getKind());
        assertEquals(3, ifNode.getChild(2).getChildCount());

        Node whileNode = block.getChild(1);
        assertEquals(NodeKind.WHILE, whileNode.getKind());
        assertEquals(0, whileNode.getChild(1).getChildCount());

        Node forNode = block.getChild(2);
        ForData data = forNode.getFor();
        assertNotNull(data.initDeclaration);
        assertNotNull(data.condition);
        assertEquals(1, data.update.size());

        Node doNode = block.getChild(3);
        assertEquals(NodeKind.DO_WHILE, doNode.getKind());
        assertEquals(NodeKind.BLOCK, doNode.getChild(0).getKind());

        assertEquals(NodeKind.GOTO, block.getChild(4).getKind());
        assertEquals("out", block.getChild(4).getText());
        assertEquals(NodeKind.LABEL, block.getChild(5).getKind());
        assertEquals(0, block.getChild(6).getChildCount());
    }

    @Test
    public void testSwitchCasesAreSiblings() {
        Node sw = body("switch (x) {\ncase 1:\nx = 2;\nbreak;\ndefault:\nx = 0;\n}").getChild(0);
        assertEquals(NodeKind.SWITCH, sw.getKind());
        Node block = sw.getChild(1);
        assertEquals(5, block.getChildCount());
        assertEquals(NodeKind.CASE, block.getChild(0).getKind());
        assertEquals(1, block.getChild(0).getChildCount());
        assertEquals(NodeKind.CASE, block.getChild(3).getKind());
        assertEquals(0, block.getChild(3).getChildCount());
    }

    @Test
    public void testComments() {
        Node program = parse("int x; /* trailing */\n/* leading */\nint y;\n/* footer */\n");
        Node x = program.getChild(0);
        Node y = program.getChild(1);
        assertEquals(1, x.getTrailingComments().size());
        assertEquals("/* trailing */", x.getTrailingComments().get(0).getText());
        assertEquals(1, y.getLeadingComments().size());
        assertEquals("/* leading */", y.getLeadingComments().get(0).getText());
        assertEquals(1, program.getFooterComments().size());
    }

    @Test
    public void testBlockFooterComment() {
        Node block = body("x();\n/* end */");
        assertEquals(1, block.getChildCount());
        assertEquals(1, block.getFooterComments().size());
    }

    @Test
    public void testBlankLines() {
        Node program = parse("int a;\nint b;\n\n\n\nint c;\n");
        assertFalse(program.getChild(0).isBlankLineBefore());
        assertFalse(program.getChild(1).isBlankLineBefore());
        assertTrue(program.getChild(2).isBlankLineBefore());
    }

    @Test
    public void testBlankLinesAroundComments() {
        Node program = parse("int x;\n/* about y */\nint y;\n\n/* about z */\nint z;\n");
        assertFalse(program.getChild(1).isBlankLineBefore());
        assertTrue(program.getChild(2).isBlankLineBefore());
    }

    @Test
    public void testDirectives() {
        Node program = parse("#include <stdio.h>\n#define MAX 100");
        assertEquals(2, program.getChildCount());
        assertEquals(NodeKind.PREPROCESSOR, program.getChild(0).getKind());
        assertEquals("#define MAX 100", program.getChild(1).getText());
    }

    @Test
    public void testStatementRecovery() {
        String source = "int f(void)\n{\n\tint a = ({ int t = 1; t; });\n\treturn a;\n}\n";
        DefaultParseListener listener = new DefaultParseListener();
        Parser parser = new Parser(source);
        parser.setListener(listener);
        Node program = parser.parse();
        assertEquals(1, parser.getErrorCount());
        assertEquals(1, listener.getErrors());

        Node function = program.getChild(0);
        assertEquals(NodeKind.FUNCTION, function.getKind());
        Node block = function.getChild(0);
        assertEquals(2, block.getChildCount());
        Node unparsed = block.getChild(0);
        assertEquals(NodeKind.UNPARSED, unparsed.getKind());
        assertEquals("int a = ({ int t = 1; t; });", unparsed.getUnparsed().text);
        assertEquals(3, unparsed.getUnparsed().firstLine);
        assertEquals(NodeKind.RETURN, block.getChild(1).getKind());
    }

    @Test
    public void testTopLevelRecovery() {
        Parser parser = new Parser("MODULE_LICENSE(\"GPL\");\nint x;\n");
        Node program = parser.parse();
        assertEquals(1, parser.getErrorCount());
        assertEquals(NodeKind.UNPARSED, program.getChild(0).getKind());
        assertEquals("MODULE_LICENSE(\"GPL\");", program.getChild(0).getUnparsed().text);
        assertEquals(NodeKind.VAR_DECL, program.getChild(1).getKind());
    }

    @Test
    public void testEnumeratorRecoveryConsumesComma() {
        Parser parser = new Parser("enum e { A = , B, C };\nint z;\n");
        Node program = parser.parse();
        assertEquals(1, parser.getErrorCount());
        assertEquals(2, program.getChildCount());
        Node e = program.getChild(0);
        assertEquals(NodeKind.ENUM, e.getKind());
        assertEquals(3, e.getChildCount());
        assertEquals(NodeKind.UNPARSED, e.getChild(0).getKind());
        assertEquals("A = ,", e.getChild(0).getUnparsed().text);
        assertEquals(NodeKind.ENUM_VALUE, e.getChild(1).getKind());
        assertEquals("B", e.getChild(1).getText());
        assertEquals(NodeKind.ENUM_VALUE, e.getChild(2).getKind());
        assertEquals("C", e.getChild(2).getText());
        assertEquals(NodeKind.VAR_DECL, program.getChild(1).getKind());
        assertEquals("z", program.getChild(1).getText());
    }

    @Test
    public void testEnumeratorRecoveryStopsAtBrace() {
        Parser parser = new Parser("enum e { A, B = ) };\nint z;\n");
        Node program = parser.parse();
        assertEquals(1, parser.getErrorCount());
        assertEquals(2, program.getChildCount());
        Node e = program.getChild(0);
        assertEquals(NodeKind.ENUM, e.getKind());
        assertEquals(2, e.getChildCount());
        assertEquals(NodeKind.ENUM_VALUE, e.getChild(0).getKind());
        assertEquals(NodeKind.UNPARSED, e.getChild(1).getKind());
        assertEquals("B = )", e.getChild(1).getUnparsed().text);
        assertEquals(NodeKind.VAR_DECL, program.getChild(1).getKind());
    }

    @Test
    public void testMemberRecovery() {
        Parser parser = new Parser("struct s { int a; int b + 1; int c; };\nint z;\n");
        Node program = parser.parse();
        assertEquals(1, parser.getErrorCount());
        assertEquals(2, program.getChildCount());
        Node s = program.getChild(0);
        assertEquals(NodeKind.STRUCT, s.getKind());
        assertEquals(3, s.getChildCount());
        assertEquals(NodeKind.VAR_DECL, s.getChild(0).getKind());
        assertEquals("a", s.getChild(0).getText());
        assertEquals(NodeKind.UNPARSED, s.getChild(1).getKind());
        assertEquals("int b + 1;", s.getChild(1).getUnparsed().text);
        assertEquals(NodeKind.VAR_DECL, s.getChild(2).getKind());
        assertEquals("c", s.getChild(2).getText());
        assertEquals(NodeKind.VAR_DECL, program.getChild(1).getKind());
    }

    @Test
    public void testUnterminatedFunction() {
        Parser parser = new Parser("int f(void) {\n\tx = 1;\n");
        Node program = parser.parse();
        assertEquals(1, program.getChildCount());
        assertEquals(NodeKind.UNPARSED, program.getChild(0).getKind());
        assertEquals(1, parser.getErrorCount());
    }

    @Test
    public void testForwardProgress() {
        String[] garbage = {
            "}}}} ))) int x;",
            "((((((",
            "int int int = = = ;;; { { }",
            "struct { int",
            "enum { A = , B };",
            "typedef ;",
            "x ? : ;",
            "@@@ # \"open",
            "void f(void) { case default: ] } }"
        };
        for (String source : garbage) {
            Parser parser = new Parser(source);
            Node program = parser.parse();
            LOG.info(source + " -> " + parser.getErrorCount() + " errors\n" + program.dump());
            assertNotNull(program);
            assertTrue(parser.getErrorCount() > 0, source);
        }
    }

    @Test
    public void testParseOnce() {
        Parser parser = new Parser("int x;");
        parser.parse();
        assertThrows(IllegalStateException.class, parser::parse);
    }

    @Test
    public void testRequiresEof() {
        List<Token> tokens = Lexer.tokenize("int x;");
        assertThrows(IllegalArgumentException.class, () -> new Parser(tokens.subList(0, 2)));
    }
}
