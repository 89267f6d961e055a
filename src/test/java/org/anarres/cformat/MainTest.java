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

import com.google.gson.JsonArray;
import com.google.gson.JsonParser;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import static org.junit.jupiter.api.Assertions.*;

public class MainTest {

    private static final String UGLY = "int main(void)\n{\nreturn 0;\n}";
    private static final String PRETTY = "int main(void)\n{\n\treturn (0);\n}\n";

    @TempDir
    File dir;

    private final ByteArrayOutputStream buf = new ByteArrayOutputStream();

    private int run(String stdin, String... args) {
        InputStream in = new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8));
        PrintStream out = new PrintStream(buf, true);
        return Main.run(args, in, out);
    }

    private String output() {
        return new String(buf.toByteArray(), StandardCharsets.UTF_8);
    }

    private File write(String name, String text) throws IOException {
        File file = new File(dir, name);
        FileUtils.writeStringToFile(file, text, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    public void testStdin() {
        assertEquals(Main.EXIT_OK, run(UGLY));
        assertEquals(PRETTY, output());
    }

    @Test
    public void testFileToStdout() throws IOException {
        File file = write("a.c", UGLY);
        assertEquals(Main.EXIT_OK, run("", file.getPath()));
        assertEquals(PRETTY, output());
    }

    @Test
    public void testCheck() throws IOException {
        File ugly = write("ugly.c", UGLY);
        File pretty = write("pretty.c", PRETTY);
        assertEquals(Main.EXIT_OK, run("", "--check", pretty.getPath()));
        assertEquals(Main.EXIT_FAILURE, run("", "-c", pretty.getPath(), ugly.getPath()));
        assertTrue(output().contains("ugly.c"));
        assertFalse(output().contains("pretty.c"));
        assertEquals(UGLY, FileUtils.readFileToString(ugly, StandardCharsets.UTF_8));
    }

    @Test
    public void testInPlace() throws IOException {
        File file = write("a.c", UGLY);
        assertEquals(Main.EXIT_OK, run("", "--in-place", file.getPath()));
        assertEquals(PRETTY, FileUtils.readFileToString(file, StandardCharsets.UTF_8));
        assertEquals("", output());
        assertEquals(Main.EXIT_OK, run("", "-c", file.getPath()));
    }

    @Test
    public void testOutputFile() throws IOException {
        File input = write("a.c", UGLY);
        File output = new File(dir, "out.c");
        assertEquals(Main.EXIT_OK, run("", "-o", output.getPath(), input.getPath()));
        assertEquals(PRETTY, FileUtils.readFileToString(output, StandardCharsets.UTF_8));
    }

    @Test
    public void testDiff() throws IOException {
        File file = write("ugly.c", UGLY + "\n");
        assertEquals(Main.EXIT_OK, run("", "--diff", file.getPath()));
        String diff = output();
        assertTrue(diff.startsWith("--- " + file.getPath() + " (original)\n"
                + "+++ " + file.getPath() + " (formatted)\n"), diff);
        assertTrue(diff.contains("\n-return 0;\n"), diff);
        assertTrue(diff.contains("\n+\treturn (0);\n"), diff);
        assertFalse(diff.contains("\n-int main(void)\n"), diff);
        assertEquals(UGLY + "\n", FileUtils.readFileToString(file, StandardCharsets.UTF_8));
    }

    @Test
    public void testDiffQuietWhenUnchanged() throws IOException {
        File pretty = write("pretty.c", PRETTY);
        assertEquals(Main.EXIT_OK, run("", "-d", pretty.getPath()));
        assertEquals("", output());

        File garbage = write("garbage.c", "@@@ }}}\nint   x;\n");
        assertEquals(Main.EXIT_OK, run("", "-d", garbage.getPath()));
        assertEquals("", output());
    }

    @Test
    public void testMaxUnparsedLeavesFileAlone() throws IOException {
        String garbage = "@@@ }}}\nint   x;\n";
        File file = write("g.c", garbage);
        assertEquals(Main.EXIT_OK, run("", "-i", file.getPath()));
        assertEquals(garbage, FileUtils.readFileToString(file, StandardCharsets.UTF_8));

        assertEquals(Main.EXIT_OK, run("", "-i", "--max-unparsed", "1", file.getPath()));
        assertEquals("@@@ }\n}\n}\n\nint x;\n", FileUtils.readFileToString(file, StandardCharsets.UTF_8));
    }

    @Test
    public void testTypedefOption() {
        assertEquals(Main.EXIT_OK, run("void f(void)\n{\nhandle   h;\n}\n", "-T", "handle"));
        assertEquals("void f(void)\n{\n\thandle h;\n}\n", output());
    }

    @Test
    public void testLineComments() {
        assertEquals(Main.EXIT_OK, run("int x; // x\n", "--line-comments"));
        assertEquals("int x; // x\n", output());
    }

    @Test
    public void testDumpTokens() {
        assertEquals(Main.EXIT_OK, run("int x;", "--dump-tokens"));
        JsonArray array = JsonParser.parseString(output()).getAsJsonArray();
        assertEquals(5, array.size());
        assertEquals("INT", array.get(0).getAsJsonObject().get("type").getAsString());
        assertEquals("EOF", array.get(4).getAsJsonObject().get("type").getAsString());
    }

    @Test
    public void testDumpAst() {
        assertEquals(Main.EXIT_OK, run("int x;", "--dump-ast"));
        assertEquals("PROGRAM [1 children]\n  VAR_DECL \"x\" (int x)\n", output());
    }

    @Test
    public void testHelpAndVersion() {
        assertEquals(Main.EXIT_OK, run("", "--help"));
        assertTrue(output().contains("--in-place"));
        buf.reset();
        assertEquals(Main.EXIT_OK, run("", "-v"));
        assertTrue(output().contains("Anarres C Formatter"));
    }

    @Test
    public void testUsageErrors() {
        assertEquals(Main.EXIT_USAGE, run("", "--no-such-option"));
        assertEquals(Main.EXIT_USAGE, run("", "--check", "--in-place", "a.c"));
        assertEquals(Main.EXIT_USAGE, run("", "--in-place"));
        assertEquals(Main.EXIT_USAGE, run("", "--diff", "--check", "a.c"));
        assertEquals(Main.EXIT_USAGE, run("", "--max-unparsed", "2"));
    }

    @Test
    public void testMissingFile() {
        assertEquals(Main.EXIT_FAILURE, run("", new File(dir, "missing.c").getPath()));
    }
}
