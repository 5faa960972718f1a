package com.jmerl;

import com.jmerl.json.EnvironmentReader;
import com.jmerl.output.SourcePrinter;
import com.jmerl.output.TreeFormatter;
import com.jmerl.quote.FragmentParser;
import com.jmerl.syntax.Position;
import com.jmerl.syntax.Tree;
import com.jmerl.template.Environment;
import com.jmerl.template.Template;
import org.eclipse.collections.api.list.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(name = "jmerl", mixinStandardHelpOptions = true, version = "1.0",
         description = "Parse, substitute into and match Erlang source fragments")
public class JMerl implements Callable<Integer> {
    private static final Logger LOGGER = LoggerFactory.getLogger(JMerl.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", arity = "0..1", description = "Source text (default: --file or stdin)")
    private String text;

    @Option(names = {"-f", "--file"}, description = "Read the source text from a file")
    private File inputFile;

    @Option(names = {"-l", "--line"}, description = "Line number of the first line (default: ${DEFAULT-VALUE})")
    private int line = 1;

    @Option(names = {"--column"}, description = "Column of the first character; 0 disables column tracking")
    private int column = 0;

    @Option(names = {"-e", "--env"}, description = "JSON file of bindings to substitute into the parsed trees")
    private File envFile;

    @Option(names = {"-m", "--match"}, description = "Match each parsed tree against this pattern and print the bindings")
    private String pattern;

    @Option(names = {"-t", "--tree"}, description = "Print the tree structure instead of source text")
    private boolean treeOutput = false;

    @Option(names = {"-c", "--compact"}, description = "Compact tree output")
    private boolean compactOutput = false;

    @Option(names = {"-C", "--color"}, description = "Colorize tree output")
    private boolean colorOutput = false;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new JMerl()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            FragmentParser parser = new FragmentParser();
            ImmutableList<Tree> trees = parser.parse(readSource(), new Position(line, column));

            if (envFile != null) {
                Environment env;
                try (InputStream input = new FileInputStream(envFile)) {
                    env = new EnvironmentReader().read(input);
                }
                trees = Merl.subst(trees, env);
            }

            TreeFormatter formatter = new TreeFormatter(!compactOutput, colorOutput);
            if (pattern != null) {
                return printMatches(parser, trees, formatter, out);
            }

            SourcePrinter printer = new SourcePrinter();
            for (Tree tree : trees) {
                out.println(treeOutput ? formatter.format(tree) : printer.print(tree));
            }
            out.flush();
            return 0;
        } catch (Exception e) {
            LOGGER.debug("jmerl failed", e);
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        }
    }

    private int printMatches(FragmentParser parser, ImmutableList<Tree> trees, TreeFormatter formatter, PrintWriter out) {
        ImmutableList<Tree> patterns = parser.parse(pattern);
        if (patterns.size() != 1) {
            throw new MerlException("pattern must be a single tree, got " + patterns.size());
        }
        Template template = Merl.template(patterns.getOnly());
        for (Tree tree : trees) {
            Optional<Environment> env = Merl.match(template, tree);
            if (env.isEmpty()) {
                out.println("no match");
                out.flush();
                return 1;
            }
            out.println(formatter.format(env.get()));
        }
        out.flush();
        return 0;
    }

    private String readSource() throws IOException {
        if (text != null) {
            return text;
        }
        if (inputFile == null) {
            return read(System.in);
        }
        try (InputStream input = new FileInputStream(inputFile)) {
            return read(input);
        }
    }

    private static String read(InputStream input) throws IOException {
        return new String(input.readAllBytes(), StandardCharsets.UTF_8);
    }
}
