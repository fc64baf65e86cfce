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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Renders formula trees as Graphviz graphs. Every tree node is drawn as a plain label, negations
 * as a chain of {@code !} nodes above the negated node. Node ids are the label followed by a
 * counter per label character, written in bijective base 52 ({@code A} to {@code Z}, {@code a} to
 * {@code z}, {@code AA}, ...).
 */
public final class DotGraph {
    private static final Logger logger = Logger.getLogger(DotGraph.class.getName());

    private static final int ID_BASE = 52;

    private final StringBuilder builder = new StringBuilder();
    private final Map<Character, Integer> counters = new HashMap<>();

    private DotGraph() {}

    public static String render(Node node) {
        DotGraph graph = new DotGraph();
        graph.builder.append("digraph {\n")
            .append("\tnode [shape=none];\n")
            .append("\tedge [arrowhead=none];\n")
            .append('\n');
        graph.append(node);
        graph.builder.append("}\n");
        return graph.builder.toString();
    }

    /**
     * Writes {@code <base>.dot} and runs {@code dot} to create {@code <base>.svg}. Failures are
     * logged and otherwise ignored.
     *
     * @return whether the svg file has been created.
     */
    public static boolean write(Node node, Path base) {
        Path dotFile = base.resolveSibling(base.getFileName() + ".dot");
        Path svgFile = base.resolveSibling(base.getFileName() + ".svg");
        try {
            Files.writeString(dotFile, render(node), StandardCharsets.UTF_8);
        } catch (IOException e) {
            logger.log(Level.WARNING, "Failed to write " + dotFile, e);
            return false;
        }
        logger.log(Level.INFO, "Created dot file {0}", dotFile);

        ProcessBuilder process = new ProcessBuilder("dot", "-Tsvg", "-o", svgFile.toString(),
            dotFile.toString()).redirectErrorStream(true);
        try {
            Process dot = process.start();
            byte[] output = dot.getInputStream().readAllBytes();
            int exitCode = dot.waitFor();
            if (exitCode != 0) {
                logger.log(Level.WARNING, "dot exited with {0} on {1}: {2}", new Object[] {
                    exitCode, dotFile, new String(output, StandardCharsets.UTF_8).trim()});
                return false;
            }
        } catch (IOException e) {
            logger.log(Level.WARNING, "Failed to run dot on " + dotFile + ", image not created", e);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.log(Level.WARNING, "Interrupted while running dot on {0}", dotFile);
            return false;
        }
        logger.log(Level.INFO, "Created {0}", svgFile);
        return true;
    }

    /**
     * Appends the nodes and edges of {@code node} and returns the id of its topmost graph node.
     */
    private String append(Node node) {
        String[] negations = new String[node.negations()];
        for (int i = 0; i < negations.length; i++) {
            negations[i] = declare('!');
        }

        Literal literal = node.literal();
        String id;
        if (literal instanceof Literal.Constant) {
            id = declare(((Literal.Constant) literal).value() ? '1' : '0');
        } else if (literal instanceof Literal.Variable) {
            id = declare(((Literal.Variable) literal).name());
        } else {
            Literal.Operation operation = (Literal.Operation) literal;
            id = declare(operation.operator().symbol());
            for (Node child : operation.children()) {
                String childId = append(child);
                edge(id, childId);
            }
        }

        // The outermost negation is declared first and drawn on top
        for (int i = negations.length - 1; i >= 0; i--) {
            edge(negations[i], id);
            id = negations[i];
        }
        return id;
    }

    private String declare(char label) {
        String id = String.format("\"%c%s\"", label, identifier(next(label)));
        builder.append('\t').append(id).append(" [label=\"").append(label).append("\"];\n");
        return id;
    }

    private int next(char label) {
        int counter = counters.getOrDefault(label, 0);
        counters.put(label, counter + 1);
        return counter;
    }

    /**
     * Writes {@code counter} in bijective base 52, so 0 is {@code A}, 51 is {@code z} and 52 is
     * {@code AA}.
     */
    static String identifier(int counter) {
        assert counter >= 0;
        StringBuilder digits = new StringBuilder();
        long remaining = counter + 1L;
        while (remaining > 0) {
            remaining -= 1;
            int digit = (int) (remaining % ID_BASE);
            digits.append(digit < 26 ? (char) ('A' + digit) : (char) ('a' + digit - 26));
            remaining /= ID_BASE;
        }
        return digits.reverse().toString();
    }

    private void edge(String parent, String child) {
        builder.append('\t').append(parent).append(" -> ").append(child).append(";\n");
    }
}
