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
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Prints the truth table of a formula as a markdown table:
 *
 * <pre>
 * | A | B | = |
 * |---|---|---|
 * | 0 | 0 | 0 |
 * ...
 * </pre>
 *
 * <p>Rows are formatted by {@link EngineConfiguration#tableWorkers() several workers}, each of
 * which parses its own copy of the formula and handles a contiguous slice of the rows. Every worker
 * hands its rows to the printing thread through a bounded queue, and the printing thread drains
 * the queues slice by slice, so the output is always in row order.</p>
 */
public class TruthTablePrinter {
    private static final Logger logger = Logger.getLogger(TruthTablePrinter.class.getName());

    static final String RED = "\u001B[31m";
    static final String GREEN = "\u001B[32m";
    static final String BLUE = "\u001B[34m";
    static final String RESET = "\u001B[0m";

    private static final long POLL_MILLISECONDS = 100;

    private final EngineConfiguration configuration;
    private final boolean colorize;

    public TruthTablePrinter(EngineConfiguration configuration, boolean colorize) {
        this.configuration = configuration;
        this.colorize = colorize;
    }

    public String toString(String rpn) throws RpnParser.ParseException {
        StringBuilder builder = new StringBuilder();
        try {
            print(rpn, builder);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return builder.toString();
    }

    public void print(String rpn, Appendable out) throws RpnParser.ParseException, IOException {
        Formula formula = RpnParser.parse(rpn);
        List<Character> variables = formula.variables();
        if (variables.size() > TruthTable.MAX_VARIABLES) {
            throw new IllegalArgumentException("Too many variables: " + variables.size());
        }
        int rows = 1 << variables.size();

        printHeader(variables, out);
        int workers = Math.min(configuration.tableWorkers(), rows);
        if (workers == 1) {
            for (int row = 0; row < rows; row++) {
                out.append(formatRow(formula, variables, row));
            }
            return;
        }
        printConcurrently(rpn, variables, rows, workers, out);
    }

    private void printConcurrently(String rpn, List<Character> variables, int rows, int workers,
        Appendable out) throws IOException {
        logger.log(Level.FINER, "Printing {0} rows of {1} with {2} workers",
            new Object[] {rows, rpn, workers});

        ExecutorService executor = Executors.newFixedThreadPool(workers);
        List<Future<?>> futures = new ArrayList<>(workers);
        List<BlockingQueue<String>> queues = new ArrayList<>(workers);
        int[] bounds = new int[workers + 1];
        try {
            for (int worker = 0; worker < workers; worker++) {
                int from = (int) ((long) rows * worker / workers);
                int to = (int) ((long) rows * (worker + 1) / workers);
                bounds[worker] = from;
                bounds[worker + 1] = to;

                BlockingQueue<String> queue = new ArrayBlockingQueue<>(configuration.tableQueueDepth());
                queues.add(queue);
                futures.add(executor.submit(() -> {
                    formatSlice(rpn, variables, from, to, queue);
                    return null;
                }));
                logger.log(Level.FINEST, "Worker {0} handles rows [{1}, {2})",
                    new Object[] {worker, from, to});
            }

            for (int worker = 0; worker < workers; worker++) {
                int expected = bounds[worker + 1] - bounds[worker];
                for (int i = 0; i < expected; i++) {
                    out.append(take(queues.get(worker), futures.get(worker)));
                }
            }
        } finally {
            executor.shutdownNow();
        }
    }

    private String take(BlockingQueue<String> queue, Future<?> future) {
        try {
            while (true) {
                String row = queue.poll(POLL_MILLISECONDS, TimeUnit.MILLISECONDS);
                if (row != null) {
                    return row;
                }
                if (future.isDone()) {
                    future.get();
                    // The worker may have finished between the poll and the check
                    row = queue.poll();
                    if (row != null) {
                        return row;
                    }
                    throw new IllegalStateException("Worker finished without producing all rows");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while printing truth table", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Truth table worker failed", e.getCause());
        }
    }

    private void formatSlice(String rpn, List<Character> variables, int from, int to,
        BlockingQueue<String> queue) throws InterruptedException {
        Formula formula;
        try {
            formula = RpnParser.parse(rpn);
        } catch (RpnParser.ParseException e) {
            throw new IllegalStateException(e);
        }
        for (int row = from; row < to; row++) {
            queue.put(formatRow(formula, variables, row));
        }
    }

    private void printHeader(List<Character> variables, Appendable out) throws IOException {
        StringBuilder header = new StringBuilder();
        StringBuilder separator = new StringBuilder();
        header.append(bar());
        separator.append(bar());
        for (char variable : variables) {
            header.append(' ').append(variable).append(' ').append(bar());
            separator.append("---").append(bar());
        }
        header.append(" = ").append(bar()).append('\n');
        separator.append("---").append(bar()).append('\n');
        out.append(header).append(separator);
    }

    /**
     * Formats a single row. Called concurrently by the workers, each with its own formula.
     */
    String formatRow(Formula formula, List<Character> variables, int row) {
        TruthTable.assign(formula.table(), variables, row);
        StringBuilder builder = new StringBuilder(4 * variables.size() + 6);
        builder.append(bar());
        int width = variables.size();
        for (int position = 0; position < width; position++) {
            boolean value = ((row >>> (width - position - 1)) & 1) == 1;
            builder.append(' ').append(cell(value)).append(' ').append(bar());
        }
        builder.append(' ').append(cell(formula.evaluate())).append(' ').append(bar()).append('\n');
        return builder.toString();
    }

    private String cell(boolean value) {
        if (!colorize) {
            return value ? "1" : "0";
        }
        return value ? GREEN + '1' + RESET : RED + '0' + RESET;
    }

    private String bar() {
        return colorize ? BLUE + '|' + RESET : "|";
    }
}
