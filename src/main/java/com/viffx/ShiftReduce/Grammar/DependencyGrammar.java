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
 * A dependency grammar: for an ordered pair of words (second from the top of the stack, top of
 * the stack) it lists the arcs that may be drawn between them.
 *
 * <p>Rule files hold one rule per line, {@code WORD1:WORD2:DIR:RELATION} with {@code DIR} being
 * {@code LA} or {@code RA}. Lines of any other shape are skipped.
 */
public final class DependencyGrammar {
    private static final Logger logger = Logger.getLogger(DependencyGrammar.class.getName());

    public static final String FIELD_SEPARATOR = ":";

    private final Map<List<String>, List<Dependency>> rules;

    private DependencyGrammar(Builder builder) {
        Map<List<String>, List<Dependency>> copy = new LinkedHashMap<>();
        builder.rules.forEach((key, values) -> copy.put(key, List.copyOf(values)));
        this.rules = Collections.unmodifiableMap(copy);
    }

    @NotNull
    @Contract(" -> new")
    public static Builder builder() {
        return new Builder();
    }

    @NotNull
    public static DependencyGrammar load(@NotNull String filePath) throws IOException {
        return load(Path.of(filePath), StandardCharsets.UTF_8);
    }

    @NotNull
    public static DependencyGrammar load(@NotNull Path path, @NotNull Charset charset) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, charset)) {
            return load(reader);
        }
    }

    /**
     * Reads rules from {@code reader} until it is exhausted. The reader is not closed.
     */
    @NotNull
    public static DependencyGrammar load(@NotNull Reader reader) throws IOException {
        Builder builder = builder();
        BufferedReader lines = reader instanceof BufferedReader b ? b : new BufferedReader(reader);

        int skipped = 0;
        String line;
        while ((line = lines.readLine()) != null) {
            if (!builder.addLine(line)) skipped++;
        }

        DependencyGrammar grammar = builder.build();
        int ignored = skipped;
        logger.fine(() -> "Loaded dependency grammar: " + grammar.rules.size() + " word pairs, "
                + ignored + " lines skipped");
        return grammar;
    }

    /**
     * Returns the arcs allowed between {@code second} (below the top) and {@code top}, empty if
     * the pair is unknown.
     */
    @NotNull
    @Unmodifiable
    public List<Dependency> rules(@NotNull String second, @NotNull String top) {
        return rules.getOrDefault(List.of(second, top), List.of());
    }

    @NotNull
    @Unmodifiable
    public Map<List<String>, List<Dependency>> rules() {
        return rules;
    }

    @Override
    public String toString() {
        return "DependencyGrammar{rules=" + rules + '}';
    }

    public static final class Builder {
        private final Map<List<String>, List<Dependency>> rules = new LinkedHashMap<>();

        private Builder() {}

        public Builder addDependency(@NotNull String second, @NotNull String top, @NotNull ArcDirection direction, @NotNull String relation) {
            Objects.requireNonNull(second, "second cannot be null");
            Objects.requireNonNull(top, "top cannot be null");
            rules.computeIfAbsent(List.of(second, top), k -> new ArrayList<>()).add(new Dependency(direction, relation));
            return this;
        }

        /**
         * Parses one rule file line.
         *
         * @return {@code false} if the line is not a rule and was ignored
         */
        public boolean addLine(@NotNull String line) {
            String[] elements = line.strip().split(FIELD_SEPARATOR, -1);
            if (elements.length != 4) return false;

            ArcDirection direction = ArcDirection.fromToken(elements[2]);
            if (direction == null) return false;

            addDependency(elements[0], elements[1], direction, elements[3]);
            return true;
        }

        @NotNull
        @Contract(" -> new")
        public DependencyGrammar build() {
            return new DependencyGrammar(this);
        }
    }
}
