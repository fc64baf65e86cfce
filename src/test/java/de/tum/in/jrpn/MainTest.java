/*
 * This file is part of JRPN (https://github.com/incaseoftrouble/jrpn).
 * Copyright (c) 2023 Tobias Meggendorfer.
 *
 * JRPN is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JRPN is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JRPN. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.jrpn;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Random;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class MainTest {
    @TempDir
    Path directory;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String... args) {
        Main main = new Main(ImmutableEngineConfiguration.builder().tableWorkers(2).build(),
            new RandomFormulaGenerator(new Random(0)), directory);
        return main.run(args,
            new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String output() {
        return out.toString(StandardCharsets.UTF_8).replace(System.lineSeparator(), "\n");
    }

    @Test
    public void testEval() {
        assertThat(run("eval", "1011||="), is(Main.EXIT_OK));
        assertThat(output(), is("true\n"));
    }

    @Test
    public void testRewriters() {
        assertThat(run("nnf", "AB>"), is(Main.EXIT_OK));
        assertThat(run("cnf", "AB&C|"), is(Main.EXIT_OK));
        assertThat(run("minimize", "AB|C&"), is(Main.EXIT_OK));
        assertThat(output(), is("A!B|\nAC|BC|&\nAB|C&\n"));
    }

    @Test
    public void testTable() {
        assertThat(run("table", "AB&"), is(Main.EXIT_OK));
        assertThat(output(), is("| A | B | = |\n|---|---|---|\n| 0 | 0 | 0 |\n| 0 | 1 | 0 |\n"
            + "| 1 | 0 | 0 |\n| 1 | 1 | 1 |\n"));
    }

    @Test
    public void testColorizedTable() {
        assertThat(run("table", "-c", "A"), is(Main.EXIT_OK));
        assertThat(output(), containsString("\u001B[32m1\u001B[0m"));
    }

    @Test
    public void testSat() {
        assertThat(run("sat", "AA!&"), is(Main.EXIT_OK));
        assertThat(output(), is("false\n"));
    }

    @Test
    public void testSets() {
        assertThat(run("sets", "AB^", "0,1,2", "0,3,4"), is(Main.EXIT_OK));
        assertThat(output(), is("[1, 2, 3, 4]\n"));
    }

    @Test
    public void testNegativeSetElements() {
        assertThat(run("sets", "AB|", "-1,2", "3"), is(Main.EXIT_OK));
        assertThat(output(), is("[-1, 2, 3]\n"));
        assertThat(Main.Arguments.isFlags("-dc"), is(true));
        assertThat(Main.Arguments.isFlags("-4"), is(false));
        assertThat(Main.Arguments.isFlags("-x,"), is(false));
    }

    @Test
    public void testRandom() {
        assertThat(run("eval", "-r"), is(Main.EXIT_OK));
        String[] lines = output().split("\n");
        assertThat(lines.length, is(2));
        assertThat(lines[1].equals("true") || lines[1].equals("false"), is(true));
    }

    @Test
    public void testRandomSets() {
        assertThat(run("sets", "-r"), is(Main.EXIT_OK));
        assertThat(output().endsWith("]\n"), is(true));
    }

    @Test
    public void testGraphs() {
        assertThat(run("nnf", "-dc", "AB>"), is(Main.EXIT_OK));
        assertThat(Files.exists(directory.resolve("nnf_in.dot")), is(true));
        assertThat(Files.exists(directory.resolve("nnf_out.dot")), is(true));
    }

    @Test
    public void testParseError() {
        assertThat(run("eval", "1&"), is(Main.EXIT_PARSE_ERROR));
        assertThat(err.toString(StandardCharsets.UTF_8), containsString("Missing operand"));
        assertThat(run("cnf", "1x|"), is(Main.EXIT_PARSE_ERROR));
        assertThat(err.toString(StandardCharsets.UTF_8), containsString("Invalid character: 'x'"));
    }

    @Test
    public void testUsageErrors() {
        assertThat(run(), is(Main.EXIT_USAGE));
        assertThat(run("frobnicate", "A"), is(Main.EXIT_USAGE));
        assertThat(run("eval"), is(Main.EXIT_USAGE));
        assertThat(run("eval", "-r", "AB&"), is(Main.EXIT_USAGE));
        assertThat(run("eval", "AB&", "-r"), is(Main.EXIT_USAGE));
        assertThat(run("eval", "-x", "A"), is(Main.EXIT_USAGE));
        assertThat(run("eval", "A", "B"), is(Main.EXIT_USAGE));
        assertThat(run("sets", "A", "1,x"), is(Main.EXIT_USAGE));
        assertThat(run("sets", "A", "1", "2"), is(Main.EXIT_USAGE));
        assertThat(err.toString(StandardCharsets.UTF_8), containsString("Usage: jrpn"));
        assertThat(out.size(), is(0));
    }
}
