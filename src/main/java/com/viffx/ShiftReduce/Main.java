package com.viffx.ShiftReduce;

import com.martiansoftware.jsap.FlaggedOption;
import com.martiansoftware.jsap.JSAP;
import com.martiansoftware.jsap.JSAPException;
import com.martiansoftware.jsap.JSAPResult;
import com.martiansoftware.jsap.Switch;
import com.martiansoftware.jsap.UnflaggedOption;
import com.martiansoftware.jsap.stringparsers.EnumeratedStringParser;
import com.martiansoftware.jsap.stringparsers.FileStringParser;
import com.martiansoftware.jsap.stringparsers.LongStringParser;
import com.martiansoftware.jsap.stringparsers.StringStringParser;
import com.viffx.ShiftReduce.Grammar.CfgGrammar;
import com.viffx.ShiftReduce.Grammar.DependencyGrammar;
import com.viffx.ShiftReduce.Output.DerivationPrinter;
import com.viffx.ShiftReduce.Parser.CfgSystem;
import com.viffx.ShiftReduce.Parser.DependencySystem;
import com.viffx.ShiftReduce.Parser.DerivationSearch;
import com.viffx.ShiftReduce.Parser.ParsingSystem;
import com.viffx.ShiftReduce.Parser.SearchLimitExceededException;

import java.io.File;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Locale;

/**
 * Command line entry point: loads a grammar, parses one sentence and prints every derivation.
 * <pre>
 *   Main [-t cfg|dep] [-s START] [-e ENCODING] [-l LIMIT] [-o FILE] GRAMMAR WORD...
 * </pre>
 */
public class Main {
    public static final int EXIT_OK = 0;
    public static final int EXIT_BAD_CONFIGURATION = 1;
    public static final int EXIT_LIMIT_EXCEEDED = 2;

    public enum GrammarType { CFG, DEP }

    /**
     * Everything the command line decides.
     */
    public record Settings(GrammarType type, Path grammar, String startSymbol, Charset charset,
                           long limit, Path output, String input) {}

    public static void main(String[] args) throws Exception {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Runs the program and returns its exit status instead of exiting.
     */
    public static int run(String[] args, PrintStream out, PrintStream err) throws IOException, JSAPException {
        JSAP jsap = new JSAP();
        Settings settings;
        try {
            settings = configure(jsap, args);
        } catch (ConfigureException e) {
            err.println(e.getMessage());
            err.println("Usage: Main " + jsap.getUsage());
            return EXIT_BAD_CONFIGURATION;
        }
        if (settings == null) {
            out.println("Usage: Main " + jsap.getUsage());
            out.println(jsap.getHelp());
            return EXIT_OK;
        }

        ParsingSystem system = switch (settings.type()) {
            case CFG -> new CfgSystem(CfgGrammar.load(settings.grammar(), settings.charset(), settings.startSymbol()));
            case DEP -> new DependencySystem(DependencyGrammar.load(settings.grammar(), settings.charset()));
        };
        DerivationSearch search = new DerivationSearch(settings.limit());

        Writer writer = settings.output() == null
                ? new OutputStreamWriter(out, settings.charset())
                : Files.newBufferedWriter(settings.output(), settings.charset());
        try {
            search.parse(system, settings.input(), new DerivationPrinter(writer));
        } catch (SearchLimitExceededException e) {
            err.println(e.getMessage());
            return EXIT_LIMIT_EXCEEDED;
        } finally {
            if (settings.output() == null) writer.flush();
            else writer.close();
        }
        return EXIT_OK;
    }

    /**
     * Registers the options on {@code jsap} and parses {@code args}.
     *
     * @return the settings, or {@code null} if only help was requested
     * @throws ConfigureException if the arguments are malformed or contradict each other
     */
    public static Settings configure(JSAP jsap, String[] args) throws ConfigureException, JSAPException {
        // HELP OPTION
        jsap.registerParameter(new Switch("help",
                'h',
                "help",
                "print this help message"));

        // OPTIONS REGARDING THE GRAMMAR
        jsap.registerParameter(new FlaggedOption("type",
                EnumeratedStringParser.getParser("cfg;dep"),
                "cfg",
                true,
                't',
                "type",
                "grammar formalism of the rule file: cfg (LHS => word, LHS --> RHS...) "
                        + "or dep (WORD1:WORD2:LA|RA:RELATION)"));

        jsap.registerParameter(new FlaggedOption("start",
                StringStringParser.getParser(),
                null,
                false,
                's',
                "start",
                "start symbol an accepted CFG parse reduces to. Default is " + CfgGrammar.DEFAULT_START_SYMBOL));

        jsap.registerParameter(new FlaggedOption("encoding",
                StringStringParser.getParser(),
                "utf-8",
                true,
                'e',
                "encoding",
                "encoding of the grammar file and the output"));

        // OPTIONS REGARDING THE SEARCH
        jsap.registerParameter(new FlaggedOption("limit",
                LongStringParser.getParser(),
                "0",
                true,
                'l',
                "limit",
                "stop with an error after expanding this many configurations. 0 = no limit"));

        // OPTIONS REGARDING OUTPUT
        jsap.registerParameter(new FlaggedOption("output",
                FileStringParser.getParser(),
                null,
                false,
                'o',
                "output",
                "file to write the derivations to. If absent, writing is done to stdout"));

        // POSITIONAL ARGUMENTS
        jsap.registerParameter(new UnflaggedOption("grammar",
                FileStringParser.getParser().setMustExist(true).setMustBeFile(true),
                null,
                false,
                false,
                "grammar rule file"));

        jsap.registerParameter(new UnflaggedOption("words",
                StringStringParser.getParser(),
                null,
                false,
                true,
                "the sentence to parse, one word per argument (a single quoted argument is split on whitespace)"));

        JSAPResult config = jsap.parse(args);
        if (config.getBoolean("help")) return null;
        if (!config.success()) {
            StringBuilder message = new StringBuilder();
            for (Iterator<?> errors = config.getErrorMessageIterator(); errors.hasNext(); ) {
                if (message.length() > 0) message.append('\n');
                message.append(errors.next());
            }
            throw new ConfigureException(message.toString());
        }

        if (!config.contains("grammar")) throw new ConfigureException("A grammar file is required");
        String[] words = config.contains("words") ? config.getStringArray("words") : new String[0];
        if (words.length == 0) throw new ConfigureException("An input sentence is required");

        GrammarType type = GrammarType.valueOf(config.getString("type").toUpperCase(Locale.ROOT));
        if (type == GrammarType.DEP && config.contains("start")) {
            throw new ConfigureException("--start only applies to --type cfg");
        }
        String startSymbol = config.contains("start") ? config.getString("start") : CfgGrammar.DEFAULT_START_SYMBOL;

        long limit = config.getLong("limit");
        if (limit < 0) throw new ConfigureException("--limit cannot be negative: " + limit);

        Charset charset;
        try {
            charset = Charset.forName(config.getString("encoding"));
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            throw new ConfigureException("Unknown encoding: " + config.getString("encoding"), e);
        }

        File output = config.contains("output") ? config.getFile("output") : null;
        return new Settings(type,
                config.getFile("grammar").toPath(),
                startSymbol,
                charset,
                limit,
                output == null ? null : output.toPath(),
                String.join(" ", words));
    }
}
