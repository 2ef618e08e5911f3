/*
 * Copyright (c) 2025 Glossa Sound Change Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.glossa.soundchange.compiler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.glossa.soundchange.api.ILanguageCompiler;
import com.glossa.soundchange.api.exceptions.CompilationException;
import com.glossa.soundchange.api.exceptions.MalformedRuleException;
import com.glossa.soundchange.api.model.FeatureTaxonomy;
import com.glossa.soundchange.api.model.LanguageDefinition;
import com.glossa.soundchange.api.model.MatchSpec;
import com.glossa.soundchange.api.model.RuleDefinition;
import com.glossa.soundchange.api.model.SoundChangeRule;
import com.glossa.soundchange.api.model.SoundClass;
import com.glossa.soundchange.runtime.model.Inventory;
import com.glossa.soundchange.runtime.model.LanguageModel;
import com.glossa.soundchange.runtime.model.RuleSet;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Compiles a JSON language definition into a validated {@link LanguageModel}.
 *
 * <p>Letters are registered first so that rule slots naming a letter resolve to
 * literals. Rules keep their file order, which is their application order.
 */
public class LanguageCompiler implements ILanguageCompiler {
    private static final Logger logger = Logger.getLogger(LanguageCompiler.class.getName());
    private static final String AFFIX_STEM = "-";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final FeatureTaxonomy taxonomy;
    private Tracer tracer;

    public LanguageCompiler(Tracer tracer, FeatureTaxonomy taxonomy) {
        this.tracer = tracer;
        this.taxonomy = taxonomy;
    }

    public LanguageCompiler(Tracer tracer) {
        this(tracer, FeatureTaxonomy.standard());
    }

    public LanguageCompiler() {
        this(OpenTelemetry.noop().getTracer("glossa-compiler"));
    }

    @Override
    public void setTracer(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public LanguageModel compile(Path definitionPath) throws IOException {
        Span span = tracer.spanBuilder("compile-language").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("definitionPath", definitionPath.toString());
            LanguageDefinition definition = loadDefinition(definitionPath);
            LanguageModel model = build(definition);
            span.setAttribute("letterCount", model.inventory().size());
            span.setAttribute("ruleCount", model.ruleSet().size());
            return model;
        } catch (IOException | CompilationException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public LanguageModel compile(LanguageDefinition definition) {
        Span span = tracer.spanBuilder("compile-language").startSpan();
        try (Scope scope = span.makeCurrent()) {
            return build(definition);
        } catch (CompilationException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private LanguageDefinition loadDefinition(Path definitionPath) throws IOException {
        String content = Files.readString(definitionPath);
        return objectMapper.readValue(content, LanguageDefinition.class);
    }

    private LanguageModel build(LanguageDefinition definition) {
        if (definition == null) {
            throw new CompilationException("Language definition cannot be null");
        }
        long startTime = System.nanoTime();

        Inventory inventory = buildInventory(definition);
        MatchSpecParser parser = new MatchSpecParser(inventory);
        RuleSet ruleSet = buildRules(definition.rules(), parser);
        validateSyllables(definition.syllables(), parser, inventory);
        validateAffixes(definition.affixes());

        String name = definition.name() != null ? definition.name() : "";
        logger.info(String.format("Compiled language '%s': %d letters, %d rules, %d syllable shapes, %d affixes in %d ms",
                name, inventory.size(), ruleSet.size(), definition.syllables().size(),
                definition.affixes().size(), (System.nanoTime() - startTime) / 1_000_000));

        return new LanguageModel(name, inventory, ruleSet, definition.syllables(), definition.affixes());
    }

    private Inventory buildInventory(LanguageDefinition definition) {
        Inventory.Builder builder = Inventory.builder(taxonomy);
        for (LanguageDefinition.SoundDefinition sound : definition.consonants()) {
            builder.register(sound.symbol(), SoundClass.CONSONANT, featuresOf(sound));
        }
        for (LanguageDefinition.SoundDefinition sound : definition.vowels()) {
            builder.register(sound.symbol(), SoundClass.VOWEL, featuresOf(sound));
        }
        return builder.build();
    }

    private static List<String> featuresOf(LanguageDefinition.SoundDefinition sound) {
        return sound.features() != null ? sound.features() : List.of();
    }

    private RuleSet buildRules(List<RuleDefinition> definitions, MatchSpecParser parser) {
        RuleSet ruleSet = new RuleSet();
        for (int i = 0; i < definitions.size(); i++) {
            RuleDefinition definition = definitions.get(i);
            try {
                if (definition.source() == null || definition.target() == null) {
                    throw new MalformedRuleException("source and target are required");
                }
                List<MatchSpec> source = parser.parseAll(definition.source());
                List<MatchSpec> target = parser.parseAll(definition.target());
                List<MatchSpec> environment = parser.parseEnvironment(definition.environment());
                if (definition.id() == null || definition.id().isBlank()) {
                    ruleSet.addRule(source, target, environment);
                } else {
                    ruleSet.add(new SoundChangeRule(definition.id(), source, target, environment));
                }
            } catch (MalformedRuleException e) {
                throw new MalformedRuleException("Rule at index " + i + ": " + e.getMessage(), e);
            }
        }
        return ruleSet;
    }

    private static void validateSyllables(List<List<String>> syllables, MatchSpecParser parser, Inventory inventory) {
        for (List<String> structure : syllables) {
            if (structure == null || structure.isEmpty()) {
                throw new CompilationException("Syllable structure cannot be empty");
            }
            for (String slot : structure) {
                MatchSpec spec = parser.parse(slot);
                if (spec instanceof MatchSpec.Boundary || spec instanceof MatchSpec.Focus) {
                    throw new CompilationException("Syllable structure " + structure + " cannot contain '" + slot + "'");
                }
                if (spec instanceof MatchSpec.Literal literal && !inventory.isLetter(literal.symbol())) {
                    throw new CompilationException("Syllable structure " + structure + " uses unknown letter '" + slot + "'");
                }
                if (spec instanceof MatchSpec.Features features && inventory.symbolsWithAll(features.features()).isEmpty()) {
                    logger.warning(String.format("No letter has features %s used in syllable structure %s",
                            features.features(), structure));
                }
            }
        }
    }

    private static void validateAffixes(Map<String, List<String>> affixes) {
        for (Map.Entry<String, List<String>> entry : affixes.entrySet()) {
            List<String> letters = entry.getValue();
            if (letters == null || letters.size() < 2) {
                throw new CompilationException("Affix '" + entry.getKey() + "' needs letters and a '-' marker");
            }
            long markers = letters.stream().filter(AFFIX_STEM::equals).count();
            boolean attached = AFFIX_STEM.equals(letters.get(0)) || AFFIX_STEM.equals(letters.get(letters.size() - 1));
            if (markers != 1 || !attached) {
                throw new CompilationException("Affix '" + entry.getKey()
                        + "' must have exactly one '-' at its start or end, got " + letters);
            }
        }
    }
}
