package com.viffx.ShiftReduce.Grammar;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Unmodifiable;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * A context free grammar stored as two lookup tables.
 * <ul>
 *     <li>the <b>lexicon</b> maps a terminal (a word) to the categories it can be rewritten to</li>
 *     <li>the <b>rules</b> map a sequence of right hand side symbols, in stack order, to the
 *     non-terminals that can replace it</li>
 * </ul>
 * Both tables keep every left hand side in the order it was added, so a key with several
 * candidates models an ambiguity. A grammar is immutable once built.
 *
 * <p>Rule files are read line by line:
 * <pre>
 *   LHS =&gt; TERMINAL
 *   LHS --&gt; RHS1 RHS2 ...
 * </pre>
 * Any other line is skipped.
 */
public final class CfgGrammar {
    private static final Logger logger = Logger.getLogger(CfgGrammar.class.getName());

    public static final String DEFAULT_START_SYMBOL = "S";
    public static final String TERMINAL_ARROW = "=>";
    public static final String RULE_ARROW = "-->";

    // ====== INSTANCE FIELDS ====== //
    private final String startSymbol;
    private final Map<String, List<String>> lexicon;
    private final Map<List<String>, List<String>> rules;

    // ====== CONSTRUCTORS ====== //
    private CfgGrammar(Builder builder) {
        this.startSymbol = builder.startSymbol;
        this.lexicon = freeze(builder.lexicon);
        this.rules = freeze(builder.rules);
    }

    @NotNull
    @Contract(" -> new")
    public static Builder builder() {
        return new Builder();
    }

    @NotNull
    public static CfgGrammar load(@NotNull String filePath) throws IOException {
        return load(Path.of(filePath), StandardCharsets.UTF_8, DEFAULT_START_SYMBOL);
    }

    @NotNull
    public static CfgGrammar load(@NotNull Path path, @NotNull Charset charset, @NotNull String startSymbol) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, charset)) {
            return load(reader, startSymbol);
        }
    }

    /**
     * Reads rules from {@code reader} until it is exhausted. The reader is not closed.
     *
     * @param reader      source of rule lines
     * @param startSymbol the category an accepted parse must reduce to
     * @return the loaded grammar
     * @throws IOException if reading fails
     */
    @NotNull
    public static CfgGrammar load(@NotNull Reader reader, @NotNull String startSymbol) throws IOException {
        Builder builder = builder().startSymbol(startSymbol);
        BufferedReader lines = reader instanceof BufferedReader b ? b : new BufferedReader(reader);

        int skipped = 0;
        String line;
        while ((line = lines.readLine()) != null) {
            if (!builder.addLine(line)) skipped++;
        }

        CfgGrammar grammar = builder.build();
        int ignored = skipped;
        logger.fine(() -> "Loaded CFG: " + grammar.lexicon.size() + " terminals, "
                + grammar.rules.size() + " rule keys, " + ignored + " lines skipped");
        return grammar;
    }

    // ====== PUBLIC API ====== //
    public String startSymbol() {
        return startSymbol;
    }

    /**
     * Returns the categories {@code terminal} can be shifted as, empty if the word is unknown.
     */
    @NotNull
    @Unmodifiable
    public List<String> lexicon(@NotNull String terminal) {
        return lexicon.getOrDefault(terminal, List.of());
    }

    /**
     * Returns the non-terminals that {@code constituents} reduce to, empty if no rule matches.
     *
     * @param constituents right hand side symbols, left to right as they appear on the stack
     */
    @NotNull
    @Unmodifiable
    public List<String> rules(@NotNull List<String> constituents) {
        return rules.getOrDefault(constituents, List.of());
    }

    @NotNull
    @Unmodifiable
    public Map<String, List<String>> lexicon() {
        return lexicon;
    }

    @NotNull
    @Unmodifiable
    public Map<List<String>, List<String>> rules() {
        return rules;
    }

    @Override
    public String toString() {
        return "CfgGrammar{" +
                "startSymbol='" + startSymbol +
                "', lexicon=" + lexicon +
                ", rules=" + rules +
                '}';
    }

    private static <K> Map<K, List<String>> freeze(Map<K, List<String>> table) {
        Map<K, List<String>> copy = new LinkedHashMap<>();
        table.forEach((key, values) -> copy.put(key, List.copyOf(values)));
        return Collections.unmodifiableMap(copy);
    }

    // ====== BUILDER ====== //
    public static final class Builder {
        private String startSymbol = DEFAULT_START_SYMBOL;
        private final Map<String, List<String>> lexicon = new LinkedHashMap<>();
        private final Map<List<String>, List<String>> rules = new LinkedHashMap<>();

        private Builder() {}

        public Builder startSymbol(@NotNull String startSymbol) {
            this.startSymbol = Objects.requireNonNull(startSymbol, "startSymbol cannot be null");
            return this;
        }

        /**
         * Adds {@code lhs => terminal}.
         */
        public Builder addTerminal(@NotNull String lhs, @NotNull String terminal) {
            Objects.requireNonNull(lhs, "lhs cannot be null");
            Objects.requireNonNull(terminal, "terminal cannot be null");
            lexicon.computeIfAbsent(terminal, t -> new ArrayList<>()).add(lhs);
            return this;
        }

        /**
         * Adds {@code lhs --> rhs...}.
         *
         * @throws IllegalArgumentException if {@code rhs} is empty
         */
        public Builder addRule(@NotNull String lhs, @NotNull List<String> rhs) {
            Objects.requireNonNull(lhs, "lhs cannot be null");
            if (rhs.isEmpty()) throw new IllegalArgumentException("A rule for " + lhs + " needs at least one constituent");
            rules.computeIfAbsent(List.copyOf(rhs), k -> new ArrayList<>()).add(lhs);
            return this;
        }

        public Builder addRule(@NotNull String lhs, @NotNull String... rhs) {
            return addRule(lhs, List.of(rhs));
        }

        /**
         * Parses one rule file line.
         *
         * @return {@code false} if the line is not a rule and was ignored
         */
        public boolean addLine(@NotNull String line) {
            String[] elements = line.strip().split("\\s+");
            if (elements.length < 3) return false;

            switch (elements[1]) {
                case TERMINAL_ARROW -> addTerminal(elements[0], elements[2]);
                case RULE_ARROW -> addRule(elements[0], List.of(elements).subList(2, elements.length));
                default -> {
                    return false;
                }
            }
            return true;
        }

        @NotNull
        @Contract(" -> new")
        public CfgGrammar build() {
            return new CfgGrammar(this);
        }
    }
}
