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

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.apache.commons.io.IOUtils;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import static org.junit.jupiter.api.Assertions.*;

public class SourceFormatterTest {

    private static final Logger LOG = LoggerFactory.getLogger(SourceFormatterTest.class);

    private static String resource(String name) throws IOException {
        try (InputStream in = SourceFormatterTest.class.getResourceAsStream("/samples/" + name)) {
            assertNotNull(in, "No such sample: " + name);
            return IOUtils.toString(in, StandardCharsets.UTF_8);
        }
    }

    @Test
    public void testWellFormattedSampleIsFixedPoint() throws IOException {
        String source = resource("list.c");
        FormatResult result = new SourceFormatter().format(source, "list.c");
        LOG.info("Result: " + result);
        assertEquals(0, result.getErrorCount());
        assertEquals(source, result.getText());
        assertFalse(result.isChanged());
        assertEquals(0, result.getUnparsedTokenCount());
        assertEquals(0.0, result.getUnparsedRatio());
    }

    @Test
    public void testMessySample() throws IOException {
        String source = resource("messy.c");
        String expected = resource("messy.expected.c");
        SourceFormatter formatter = new SourceFormatter();
        FormatResult result = formatter.format(source, "messy.c");
        assertEquals(expected, result.getText());
        assertTrue(result.isChanged());
        assertEquals(1, result.getErrorCount());
        /* int x = ( { int t = 1 ; t ; } ) ; */
        assertEquals(15, result.getUnparsedTokenCount());
        assertTrue(result.getUnparsedRatio() > 0 && result.getUnparsedRatio() < 0.2);

        FormatResult again = formatter.format(result.getText(), "messy.c");
        assertEquals(result.getText(), again.getText());
        assertFalse(again.isChanged());
    }

    @Test
    public void testGarbageIsMostlyUnparsed() throws IOException {
        String source = resource("garbage.c");
        FormatResult result = new SourceFormatter().format(source, "garbage.c");
        LOG.info("Result: " + result);
        assertTrue(result.getErrorCount() > 0);
        assertTrue(result.getUnparsedRatio() > 0.5);
    }

    @Test
    public void testTypedefOption() {
        String source = "void f(void)\n{\n\thandle h;\n}\n";
        SourceFormatter formatter = new SourceFormatter();
        assertEquals(1, formatter.format(source).getErrorCount());
        formatter.addTypedef("handle");
        FormatResult result = formatter.format(source);
        assertEquals(0, result.getErrorCount());
        assertEquals(source, result.getText());
    }

    @Test
    public void testListener() {
        DefaultParseListener listener = new DefaultParseListener();
        SourceFormatter formatter = new SourceFormatter();
        formatter.setListener(listener);
        formatter.format("MODULE_LICENSE(\"GPL\");\nFOO BAR BAZ;\nint x;\n");
        assertEquals(2, listener.getErrors());
        listener.clear();
        assertEquals(0, listener.getErrors());
    }

    @Test
    public void testLongLineWarnings() {
        final List<Integer> lines = new ArrayList<Integer>();
        DefaultParseListener listener = new DefaultParseListener() {
            @Override
            public void handleWarning(String source, int line, int column, String msg) {
                super.handleWarning(source, line, column, msg);
                assertEquals("long.c", source);
                assertEquals(41, column);
                lines.add(line);
            }
        };
        SourceFormatter formatter = new SourceFormatter();
        formatter.setListener(listener);
        formatter.setMaxLineLength(40);
        String source = "void f(void)\n{\n\tcall_with_a_long_name(first_argument, second_argument);\n}\n";
        FormatResult result = formatter.format(source, "long.c");
        assertEquals(source, result.getText());
        assertEquals(1, listener.getWarnings());
        assertEquals(0, listener.getErrors());
        assertEquals(Arrays.asList(3), lines);
    }

    @Test
    public void testLineCommentsFeature() {
        SourceFormatter formatter = new SourceFormatter();
        assertEquals("int x; /* x */\n", formatter.format("int x; // x\n").getText());
        formatter.addFeature(Feature.LINECOMMENTS);
        assertTrue(formatter.getFeature(Feature.LINECOMMENTS));
        assertEquals("int x; // x\n", formatter.format("int x; // x\n").getText());
    }

    @Test
    public void testEmptySource() {
        FormatResult result = new SourceFormatter().format("");
        assertEquals("", result.getText());
        assertEquals(0, result.getSignificantTokenCount());
        assertEquals(0.0, result.getUnparsedRatio());
        assertFalse(result.isChanged());
    }
}
