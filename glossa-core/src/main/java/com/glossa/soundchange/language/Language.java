/*
 * Copyright (c) 2025 Glossa Sound Change Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.glossa.soundchange.language;

import com.glossa.soundchange.api.ISoundChangeEngine;
import com.glossa.soundchange.api.model.DerivationResult;
import com.glossa.soundchange.api.model.MatchSpec;
import com.glossa.soundchange.compiler.LanguageCompiler;
import com.glossa.soundchange.compiler.RuleFormatter;
import com.glossa.soundchange.infra.config.GeneratorConfig;
import com.glossa.soundchange.runtime.evaluation.SoundChangeEvaluator;
import com.glossa.soundchange.runtime.model.LanguageModel;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.logging.Logger;

/**
 * Builds words for one compiled language and keeps its lexicon.
 *
 * <p>A word is built in this order: syllables from the template, affixes,
 * {@code #} at both ends, the rule set, boundaries removed, and finally proper
 * name formatting if requested.
 *
 * <p>The random generator is owned by the language; build words from one thread
 * when a seeded configuration must reproduce the same words.
 */
public final class Language {
    private static final Logger logger = Logger.getLogger(Language.class.getName());

    private final LanguageModel model;
    private final ISoundChangeEngine engine;
    private final SyllableTemplate template;
    private final Affixes affixes;
    private final Lexicon lexicon = new Lexicon();
    private final GeneratorConfig config;
    private final Random random;

    public Language(LanguageModel model, ISoundChangeEngine engine, GeneratorConfig config) {
        this.model = model;
        this.engine = engine;
        this.config = config;
        this.template = new SyllableTemplate(model.syllableStructures(), model.inventory());
        this.affixes = new Affixes(model.affixes());
        this.random = config.newRandom();
    }

    public Language(LanguageModel model, GeneratorConfig config, Tracer tracer) {
        this(model, new SoundChangeEvaluator(model, tracer), config);
    }

    public Language(LanguageModel model, GeneratorConfig config) {
        this(model, config, OpenTelemetry.noop().getTracer("glossa-core"));
    }

    /**
     * Compiles a JSON language definition and wraps it for word building.
     */
    public static Language load(Path definitionPath, GeneratorConfig config) throws IOException {
        LanguageModel model = new LanguageCompiler().compile(definitionPath);
        return new Language(model, config);
    }

    public String getName() {
        return model.name();
    }

    public LanguageModel getModel() {
        return model;
    }

    public Lexicon getLexicon() {
        return lexicon;
    }

    /**
     * Builds a common word with the configured number of syllables.
     */
    public List<String> buildWord(String... affixProperties) {
        return buildWord(config.getSyllables(), false, affixProperties);
    }

    public List<String> buildWord(int syllables, boolean proper, String... affixProperties) {
        return deriveWord(syllables, proper, affixProperties).surface();
    }

    /**
     * Builds a word and returns its whole history. Underlying and surface forms
     * are unbounded; the steps show the bounded forms the rules saw.
     */
    public DerivationResult deriveWord(int syllables, boolean proper, String... affixProperties) {
        if (syllables < 1) {
            throw new IllegalArgumentException("A word needs at least one syllable, got " + syllables);
        }
        List<String> word = template.buildRoot(syllables, random);
        for (String property : affixProperties) {
            word = affixes.attach(word, property);
        }

        DerivationResult derivation = engine.applyWithTrace(bound(word));
        List<String> surface = unbound(derivation.surface());
        if (proper) {
            surface = NameFormatter.format(surface);
        }
        if (config.isTraceDerivations()) {
            logDerivation(word, surface, derivation);
        }
        return new DerivationResult(word, surface, derivation.steps());
    }

    public void addEntry(List<String> word, String translation) {
        lexicon.addEntry(word, translation);
    }

    public Optional<List<String>> lookup(String translation) {
        return lexicon.lookup(translation);
    }

    public Optional<String> translate(String spelling) {
        return lexicon.translate(spelling);
    }

    public String printLexicon() {
        return lexicon.print();
    }

    public static String spell(List<String> word) {
        return Lexicon.spell(word);
    }

    private static List<String> bound(List<String> word) {
        List<String> bounded = new ArrayList<>(word.size() + 2);
        bounded.add(MatchSpec.BOUNDARY_SYMBOL);
        bounded.addAll(word);
        bounded.add(MatchSpec.BOUNDARY_SYMBOL);
        return bounded;
    }

    private static List<String> unbound(List<String> word) {
        List<String> stripped = new ArrayList<>(word.size());
        for (String symbol : word) {
            if (!MatchSpec.BOUNDARY_SYMBOL.equals(symbol)) {
                stripped.add(symbol);
            }
        }
        return stripped;
    }

    private void logDerivation(List<String> underlying, List<String> surface, DerivationResult derivation) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("/%s/ -> [%s]", spell(underlying), spell(surface)));
        for (DerivationResult.DerivationStep step : derivation.steps()) {
            String notation = model.ruleSet().get(step.ruleId()).map(RuleFormatter::notation).orElse(step.ruleId());
            sb.append(String.format("%n  %s: %s -> %s", notation, spell(step.before()), spell(step.after())));
        }
        logger.info(sb.toString());
    }
}
