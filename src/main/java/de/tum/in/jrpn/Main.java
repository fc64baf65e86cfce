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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Command line front end.
 *
 * <pre>
 * jrpn &lt;command&gt; &lt;formula | -r&gt; [-dc] [sets...]
 * </pre>
 */
public final class Main {
    private static final Logger logger = Logger.getLogger(Main.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_PARSE_ERROR = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE = "Usage: jrpn <eval|table|nnf|cnf|minimize|sat|sets> <formula | -r> [-dc] [sets...]\n"
        + "  -r  use a random formula\n"
        + "  -d  write graphviz graphs of the formula\n"
        + "  -c  colorize the truth table\n"
        + "  sets are comma separated integer lists, one per variable in alphabetical order";

    private final EngineConfiguration configuration;
    private final RandomFormulaGenerator generator;
    private final Path graphDirectory;

    Main(EngineConfiguration configuration, RandomFormulaGenerator generator, Path graphDirectory) {
        this.configuration = configuration;
        this.generator = generator;
        this.graphDirectory = graphDirectory;
    }

    public static void main(String[] args) {
        Main main = new Main(ImmutableEngineConfiguration.builder().build(),
            RandomFormulaGenerator.fromEntropy(), Path.of(""));
        System.exit(main.run(args, System.out, System.err));
    }

    int run(String[] args, PrintStream out, PrintStream err) {
        Arguments arguments;
        try {
            arguments = Arguments.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }

        String rpn = arguments.formula;
        if (arguments.random) {
            rpn = generator.generate(configuration.randomMaxDepth(),
                configuration.randomMaxVariables()).toString();
            out.println(rpn);
        }
        assert rpn != null;

        try {
            execute(arguments, rpn, out);
        } catch (RpnParser.ParseException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_PARSE_ERROR;
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        } catch (IOException e) {
            logger.log(Level.WARNING, "Failed to write output", e);
            return EXIT_USAGE;
        }
        return EXIT_OK;
    }

    private void execute(Arguments arguments, String rpn, PrintStream out)
        throws RpnParser.ParseException, IOException {
        Formula formula = RpnParser.parse(rpn);
        Command command = arguments.command;

        switch (command) {
            case EVAL:
                graph(arguments, command.label, formula.root());
                out.println(formula.evaluate());
                break;
            case TABLE:
                graph(arguments, command.label, formula.root());
                new TruthTablePrinter(configuration, arguments.colorize).print(rpn, out);
                break;
            case NNF:
                rewrite(arguments, formula, NegationNormalForm.of(formula.root()), out);
                break;
            case CNF:
                rewrite(arguments, formula, ConjunctiveNormalForm.of(formula.root()), out);
                break;
            case MINIMIZE:
                rewrite(arguments, formula, QuineMcCluskey.minimize(TruthTable.of(formula)), out);
                break;
            case SAT:
                graph(arguments, command.label, formula.root());
                out.println(Satisfiability.isSatisfiable(formula));
                break;
            case SETS:
                graph(arguments, command.label, formula.root());
                List<ImmutableSortedSet<Integer>> sets = arguments.sets;
                if (arguments.random && sets.isEmpty()) {
                    sets = generator.randomSets(formula.variables().size(), configuration.randomSetSize());
                    for (int i = 0; i < sets.size(); i++) {
                        out.println(formula.variables().get(i) + " = " + sets.get(i));
                    }
                }
                formula.assignSets(sets);
                out.println(SetEvaluator.evaluate(formula));
                break;
            default:
                throw new AssertionError(command);
        }
    }

    private void rewrite(Arguments arguments, Formula input, Node result, PrintStream out) {
        String name = arguments.command.label;
        graph(arguments, name + "_in", input.root());
        graph(arguments, name + "_out", result);
        out.println(result);
    }

    private void graph(Arguments arguments, String name, Node node) {
        if (arguments.graph) {
            DotGraph.write(node, graphDirectory.resolve(name));
        }
    }

    enum Command {
        EVAL, TABLE, NNF, CNF, MINIMIZE, SAT, SETS;

        final String label = name().toLowerCase(Locale.ROOT);

        @Nullable
        static Command of(String label) {
            for (Command command : values()) {
                if (command.label.equals(label)) {
                    return command;
                }
            }
            return null;
        }
    }

    static final class Arguments {
        final Command command;
        @Nullable
        final String formula;
        final boolean random;
        final boolean graph;
        final boolean colorize;
        final ImmutableList<ImmutableSortedSet<Integer>> sets;

        private Arguments(Command command, @Nullable String formula, boolean random, boolean graph,
            boolean colorize, List<ImmutableSortedSet<Integer>> sets) {
            this.command = command;
            this.formula = formula;
            this.random = random;
            this.graph = graph;
            this.colorize = colorize;
            this.sets = ImmutableList.copyOf(sets);
        }

        static Arguments parse(String[] args) {
            if (args.length == 0) {
                throw new IllegalArgumentException("Missing command");
            }
            Command command = Command.of(args[0]);
            if (command == null) {
                throw new IllegalArgumentException("Unknown command: " + args[0]);
            }

            String formula = null;
            boolean random = false;
            boolean graph = false;
            boolean colorize = false;
            List<ImmutableSortedSet<Integer>> sets = new ArrayList<>();
            for (int i = 1; i < args.length; i++) {
                String argument = args[i];
                if (isFlags(argument)) {
                    for (int j = 1; j < argument.length(); j++) {
                        char flag = argument.charAt(j);
                        switch (flag) {
                            case 'r':
                                random = true;
                                break;
                            case 'd':
                                graph = true;
                                break;
                            case 'c':
                                colorize = true;
                                break;
                            default:
                                throw new IllegalArgumentException("Unknown flag: -" + flag);
                        }
                    }
                } else if (formula == null && !random) {
                    formula = argument;
                } else if (command == Command.SETS) {
                    sets.add(parseSet(argument));
                } else {
                    throw new IllegalArgumentException("Unexpected argument: " + argument);
                }
            }

            if (random && formula != null) {
                throw new IllegalArgumentException("A formula cannot be combined with -r");
            }
            if (!random && formula == null) {
                throw new IllegalArgumentException("Missing formula");
            }
            return new Arguments(command, formula, random, graph, colorize, sets);
        }

        /**
         * Whether {@code argument} is a cluster of flags. Negative set elements like {@code -1,2}
         * also start with a dash, so a dash followed by a digit or any comma marks a set.
         */
        static boolean isFlags(String argument) {
            return argument.length() > 1 && argument.charAt(0) == '-'
                && !Character.isDigit(argument.charAt(1)) && argument.indexOf(',') < 0;
        }

        static ImmutableSortedSet<Integer> parseSet(String argument) {
            ImmutableSortedSet.Builder<Integer> builder = ImmutableSortedSet.naturalOrder();
            for (String element : argument.split(",", -1)) {
                String trimmed = element.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                try {
                    builder.add(Integer.parseInt(trimmed));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Invalid set element: " + trimmed, e);
                }
            }
            return builder.build();
        }
    }
}
