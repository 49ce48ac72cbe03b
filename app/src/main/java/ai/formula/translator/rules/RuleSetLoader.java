package ai.formula.translator.rules;

import ai.formula.translator.locale.FormulaLocale;
import ai.formula.translator.mapping.FunctionMapEntry;
import ai.formula.translator.mapping.FunctionMapTable;
import ai.formula.translator.rewrite.ArgumentPredicate;
import ai.formula.translator.rewrite.CallMatcher;
import ai.formula.translator.rewrite.IncompatibilityRule;
import ai.formula.translator.rewrite.RewriteTemplate;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a {@link RuleSet} from YAML.
 */
public class RuleSetLoader {

    public static final String DEFAULT_RESOURCE = "rules/formula-rules.yaml";

    private static final Logger LOGGER = LoggerFactory.getLogger(RuleSetLoader.class);

    private final ObjectMapper yamlMapper;

    public RuleSetLoader() {
        this(new ObjectMapper(new YAMLFactory()));
    }

    RuleSetLoader(ObjectMapper yamlMapper) {
        this.yamlMapper = yamlMapper;
    }

    public RuleSet loadDefault() {
        ClassLoader classLoader = RuleSetLoader.class.getClassLoader();
        try (InputStream stream = classLoader.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (stream == null) {
                throw new RuleLoadException("Default rule resource not found: " + DEFAULT_RESOURCE);
            }
            return load(stream.readAllBytes(), DEFAULT_RESOURCE);
        } catch (IOException ex) {
            throw new RuleLoadException("Failed to read default rules", ex);
        }
    }

    public RuleSet load(Path path) {
        try {
            return load(Files.readAllBytes(path), path.toString());
        } catch (IOException ex) {
            throw new RuleLoadException("Failed to read rules from " + path, ex);
        }
    }

    public RuleSet load(byte[] content) {
        return load(content, "inline rules");
    }

    private RuleSet load(byte[] content, String origin) {
        RuleDocument document;
        try {
            document = yamlMapper.readValue(content, RuleDocument.class);
        } catch (IOException ex) {
            throw new RuleLoadException("Malformed rule data in " + origin + ": " + ex.getMessage(), ex);
        }
        if (document == null) {
            throw new RuleLoadException("Rule data in " + origin + " is empty");
        }
        try {
            RuleSet ruleSet = toRuleSet(document);
            LOGGER.info("Loaded {} locales, {} functions and {} incompatibility rules from {}",
                    ruleSet.locales().size(), ruleSet.functions().size(), ruleSet.incompatibilities().size(), origin);
            return ruleSet;
        } catch (IllegalArgumentException ex) {
            throw new RuleLoadException("Invalid rule data in " + origin + ": " + ex.getMessage(), ex);
        }
    }

    private RuleSet toRuleSet(RuleDocument document) {
        if (document.locales() == null || document.locales().isEmpty()) {
            throw new IllegalArgumentException("at least one locale must be declared");
        }
        Map<String, FormulaLocale> locales = new LinkedHashMap<>();
        document.locales().forEach((tag, definition) -> {
            if (definition == null) {
                throw new IllegalArgumentException("locale " + tag + " has no separators");
            }
            FormulaLocale locale = new FormulaLocale(tag,
                    singleCharacter(definition.argumentSeparator(), tag + ".argumentSeparator"),
                    singleCharacter(definition.decimalSeparator(), tag + ".decimalSeparator"));
            if (definition.arrayColumnSeparator() != null || definition.arrayRowSeparator() != null) {
                locale = new FormulaLocale(tag, locale.argumentSeparator(), locale.decimalSeparator(),
                        definition.arrayColumnSeparator() == null ? locale.arrayColumnSeparator()
                                : singleCharacter(definition.arrayColumnSeparator(), tag + ".arrayColumnSeparator"),
                        definition.arrayRowSeparator() == null ? locale.arrayRowSeparator()
                                : singleCharacter(definition.arrayRowSeparator(), tag + ".arrayRowSeparator"));
            }
            locales.put(tag, locale);
        });

        List<FunctionMapEntry> entries = new ArrayList<>();
        Map<String, Map<String, String>> functions = document.functions() == null ? Map.of() : document.functions();
        functions.forEach((name, localized) -> {
            Map<String, String> names = localized == null ? Map.of() : localized;
            for (String tag : names.keySet()) {
                if (!locales.containsKey(tag)) {
                    throw new IllegalArgumentException("function " + name + " uses undeclared locale " + tag);
                }
            }
            entries.add(new FunctionMapEntry(name, names));
        });

        List<IncompatibilityRule> rules = new ArrayList<>();
        List<RuleDefinition> definitions = document.incompatibilities() == null ? List.of() : document.incompatibilities();
        for (RuleDefinition definition : definitions) {
            rules.add(toRule(definition));
        }
        return new RuleSet(locales, FunctionMapTable.of(entries), rules);
    }

    private IncompatibilityRule toRule(RuleDefinition definition) {
        if (definition == null || definition.match() == null) {
            throw new IllegalArgumentException("every incompatibility rule needs a match section");
        }
        String name = definition.name() == null ? "<unnamed>" : definition.name();
        MatchDefinition match = definition.match();
        if (match.function() == null || match.function().isBlank()) {
            throw new IllegalArgumentException("rule " + name + " has no match function");
        }
        Map<Integer, ArgumentPredicate> predicates = new LinkedHashMap<>();
        if (match.arguments() != null) {
            match.arguments().forEach((position, predicate) -> {
                if (position == null) {
                    throw new IllegalArgumentException("rule " + name + " has an argument predicate without position");
                }
                predicates.put(position, ArgumentPredicate.from(predicate));
            });
        }
        CallMatcher matcher = new CallMatcher(
                match.function(),
                Optional.ofNullable(match.enclosedBy()),
                match.arity() == null ? OptionalInt.empty() : OptionalInt.of(match.arity()),
                match.minArity() == null ? OptionalInt.empty() : OptionalInt.of(match.minArity()),
                predicates);
        if (definition.rewrite() == null) {
            throw new IllegalArgumentException("rule " + name + " has no rewrite template");
        }
        return new IncompatibilityRule(definition.name(), definition.description(), matcher,
                RewriteTemplate.parse(definition.rewrite()));
    }

    private static char singleCharacter(String value, String field) {
        if (value == null || value.length() != 1) {
            throw new IllegalArgumentException(field + " must be a single character");
        }
        return value.charAt(0);
    }

    record RuleDocument(Map<String, LocaleDefinition> locales,
                        Map<String, Map<String, String>> functions,
                        List<RuleDefinition> incompatibilities) {
    }

    record LocaleDefinition(String argumentSeparator,
                            String decimalSeparator,
                            String arrayColumnSeparator,
                            String arrayRowSeparator) {
    }

    record RuleDefinition(String name, String description, MatchDefinition match, String rewrite) {
    }

    record MatchDefinition(String function,
                           String enclosedBy,
                           Integer arity,
                           Integer minArity,
                           Map<Integer, String> arguments) {
    }
}
