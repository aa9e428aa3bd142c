package com.bashnorm;

import com.bashnorm.ast.RootNode;
import com.bashnorm.codec.TreeCodec;
import com.bashnorm.grammar.UtilityGrammar;
import com.bashnorm.grammar.UtilityGrammarLoader;
import com.bashnorm.normalize.ArgumentTypeResolver;
import com.bashnorm.normalize.CommandNormalizer;
import com.bashnorm.normalize.FlagSplitPolicy;
import com.bashnorm.normalize.NormalizationResult;
import com.bashnorm.normalize.NormalizerOptions;
import com.bashnorm.output.CommandRenderer;
import com.bashnorm.output.RenderOptions;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.BufferedReader;
import java.io.File;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Callable;

@Command(name = "bashnorm", mixinStandardHelpOptions = true, version = "1.0",
         description = "Normalize bash commands into typed command trees")
public class BashNorm implements Callable<Integer> {
    @Parameters(index = "0", arity = "0..1", description = "The command to normalize (default: one command per line from stdin)")
    private String command;

    @Option(names = "--no-digits", description = "Keep digits in arguments")
    private boolean noDigits = false;

    @Option(names = "--no-long-pattern", description = "Keep arguments containing whitespace")
    private boolean noLongPattern = false;

    @Option(names = "--no-quotes", description = "Drop quotes from quoted words")
    private boolean noQuotes = false;

    @Option(names = "--no-split-flags", description = "Keep clustered short options such as -la together")
    private boolean noSplitFlags = false;

    @Option(names = "--strict", description = "Fail on malformed trees when rendering")
    private boolean strict = false;

    @Option(names = "--lexical-flags", description = "Render the flags of each command in lexical order")
    private boolean lexicalFlags = false;

    @Option(names = "--template", description = "Output templates with argument types instead of values")
    private boolean template = false;

    @Option(names = "--linear", description = "Output the linearized symbol sequence")
    private boolean linear = false;

    @Option(names = "--tree", description = "Output the indented command tree")
    private boolean tree = false;

    @Option(names = "--grammar", description = "Utility grammar JSON file (default: bundled grammar)")
    private File grammarFile;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new BashNorm()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        try {
            UtilityGrammarLoader loader = new UtilityGrammarLoader();
            UtilityGrammar grammar = grammarFile != null ? loader.load(grammarFile.toPath()) : loader.loadDefault();

            NormalizerOptions options = NormalizerOptions.defaults()
                .withNormalizeDigits(!noDigits)
                .withNormalizeLongPattern(!noLongPattern)
                .withRecoverQuotation(!noQuotes)
                .withFlagSplitPolicy(noSplitFlags ? FlagSplitPolicy.NEVER : FlagSplitPolicy.CLUSTERED_SHORT_OPTIONS);
            CommandNormalizer normalizer = new CommandNormalizer(grammar, options);
            TreeCodec codec = new TreeCodec(new ArgumentTypeResolver(grammar));
            CommandRenderer renderer = new CommandRenderer(new RenderOptions(strict,
                lexicalFlags ? RenderOptions.FlagOrder.LEXICAL : RenderOptions.FlagOrder.ORIGINAL,
                RenderOptions.ValueMode.LITERAL));

            int failures = 0;
            for (String cmd : commands()) {
                NormalizationResult result = normalizer.normalize(cmd);
                if (result instanceof NormalizationResult.Failure failure) {
                    System.err.println("Error: " + failure.kind() + ": " + failure.message());
                    failures++;
                    continue;
                }
                RootNode root = ((NormalizationResult.Success) result).tree();
                if (tree) {
                    System.out.print(CommandRenderer.prettyPrint(root));
                }
                if (linear) {
                    System.out.println(codec.linearize(root).makeString(" "));
                }
                if (template) {
                    System.out.println(CommandRenderer.toTemplate(root));
                }
                if (!tree && !linear && !template) {
                    System.out.println(renderer.toCommand(root));
                }
            }
            return failures == 0 ? 0 : 1;
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private MutableList<String> commands() throws Exception {
        if (command != null) {
            return Lists.mutable.of(command);
        }
        MutableList<String> lines = Lists.mutable.empty();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.isBlank()) {
                    lines.add(line);
                }
            }
        }
        return lines;
    }
}
