package com.bashnorm.grammar;

import com.bashnorm.ast.ArgType;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.api.set.MutableSet;
import org.eclipse.collections.impl.factory.Maps;
import org.eclipse.collections.impl.factory.Sets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a {@link UtilityGrammar} from JSON of the form
 * <pre>
 * { "shellWrappers": ["sh", "xargs"],
 *   "commands": { "find": { "arguments": ["File"], "flags": { "-name": "Pattern", "-print": null } } } }
 * </pre>
 * A flag mapped to {@code null} takes no argument.
 */
public class UtilityGrammarLoader {
    private static final Logger logger = LoggerFactory.getLogger(UtilityGrammarLoader.class);

    public static final String DEFAULT_RESOURCE = "grammar/utility-grammar.json";

    private final JsonFactory factory = new JsonFactory();

    public UtilityGrammar loadDefault() throws IOException {
        try (InputStream input = UtilityGrammarLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (input == null) {
                throw new IOException("Grammar resource not found on classpath: " + DEFAULT_RESOURCE);
            }
            return load(input);
        }
    }

    public UtilityGrammar load(Path path) throws IOException {
        try (InputStream input = Files.newInputStream(path)) {
            return load(input);
        }
    }

    public UtilityGrammar load(InputStream input) throws IOException {
        try (JsonParser parser = factory.createParser(input)) {
            expect(parser.nextToken(), JsonToken.START_OBJECT, parser);

            MutableMap<String, UtilityGrammar.Utility> utilities = Maps.mutable.empty();
            MutableSet<String> wrappers = Sets.mutable.empty();

            while (parser.nextToken() != JsonToken.END_OBJECT) {
                String field = parser.getCurrentName();
                parser.nextToken();
                switch (field) {
                    case "shellWrappers" -> wrappers.addAll(parseStrings(parser));
                    case "commands" -> parseCommands(parser, utilities);
                    default -> {
                        logger.warn("Ignoring unknown grammar field '{}'", field);
                        parser.skipChildren();
                    }
                }
            }

            logger.debug("Loaded grammar for {} utilities, {} shell wrappers", utilities.size(), wrappers.size());
            return new UtilityGrammar(utilities.toImmutable(), wrappers.toImmutable());
        }
    }

    private void parseCommands(JsonParser parser, MutableMap<String, UtilityGrammar.Utility> utilities) throws IOException {
        expect(parser.currentToken(), JsonToken.START_OBJECT, parser);
        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String name = parser.getCurrentName();
            parser.nextToken();
            utilities.put(name, parseUtility(parser, name));
        }
    }

    private UtilityGrammar.Utility parseUtility(JsonParser parser, String name) throws IOException {
        expect(parser.currentToken(), JsonToken.START_OBJECT, parser);
        var argumentTypes = Sets.mutable.<ArgType>empty();
        var flags = Maps.mutable.<String, ArgType>empty();

        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String field = parser.getCurrentName();
            parser.nextToken();
            switch (field) {
                case "arguments" -> {
                    for (String tag : parseStrings(parser)) {
                        argumentTypes.add(toArgType(tag, name, parser));
                    }
                }
                case "flags" -> {
                    expect(parser.currentToken(), JsonToken.START_OBJECT, parser);
                    while (parser.nextToken() != JsonToken.END_OBJECT) {
                        String flag = parser.getCurrentName();
                        JsonToken token = parser.nextToken();
                        if (token == JsonToken.VALUE_STRING) {
                            flags.put(flag, toArgType(parser.getText(), name, parser));
                        } else if (token != JsonToken.VALUE_NULL) {
                            throw new IOException("Flag " + flag + " of " + name + " must map to a type or null at "
                                + parser.getCurrentLocation());
                        }
                    }
                }
                default -> {
                    logger.warn("Ignoring unknown field '{}' of utility '{}'", field, name);
                    parser.skipChildren();
                }
            }
        }
        return new UtilityGrammar.Utility(argumentTypes.toImmutable(), flags.toImmutable());
    }

    private MutableSet<String> parseStrings(JsonParser parser) throws IOException {
        expect(parser.currentToken(), JsonToken.START_ARRAY, parser);
        MutableSet<String> values = Sets.mutable.empty();
        while (parser.nextToken() != JsonToken.END_ARRAY) {
            expect(parser.currentToken(), JsonToken.VALUE_STRING, parser);
            values.add(parser.getText());
        }
        return values;
    }

    private ArgType toArgType(String tag, String utility, JsonParser parser) throws IOException {
        try {
            return ArgType.fromTag(tag);
        } catch (IllegalArgumentException e) {
            throw new IOException("Utility " + utility + " uses unknown argument type '" + tag + "' at "
                + parser.getCurrentLocation(), e);
        }
    }

    private void expect(JsonToken actual, JsonToken expected, JsonParser parser) throws IOException {
        if (actual != expected) {
            throw new IOException("Expected " + expected + " but got " + actual + " at " + parser.getCurrentLocation());
        }
    }
}
