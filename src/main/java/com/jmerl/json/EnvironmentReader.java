package com.jmerl.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.jmerl.Merl;
import com.jmerl.MerlException;
import com.jmerl.syntax.Tree;
import com.jmerl.template.Environment;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads an {@link Environment} from a JSON object. Each member binds a name: a string is quoted as
 * a single expression, an array of strings binds a group with one expression per element.
 *
 * <pre>{@code {"fn": "foo", "args": ["1", "X + 2"]}}</pre>
 */
public class EnvironmentReader {
    private final JsonFactory factory = new JsonFactory();

    public Environment read(InputStream input) throws IOException {
        try (JsonParser parser = factory.createParser(input)) {
            return readObject(parser);
        }
    }

    public Environment read(String json) throws IOException {
        try (JsonParser parser = factory.createParser(json)) {
            return readObject(parser);
        }
    }

    private Environment readObject(JsonParser parser) throws IOException {
        JsonToken token = parser.nextToken();
        if (token != JsonToken.START_OBJECT) {
            throw new IOException("Expected a JSON object of bindings, got: " + token);
        }

        Environment env = Environment.empty();
        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String name = parser.currentName();
            JsonToken value = parser.nextToken();
            switch (value) {
                case VALUE_STRING -> env = env.with(name, expression(name, parser.getText()));
                case START_ARRAY -> env = env.with(name, readGroup(name, parser));
                default -> throw new IOException("Unexpected JSON token for '" + name + "': " + value);
            }
        }

        if (parser.nextToken() != null) {
            throw new IOException("Trailing content after the bindings object");
        }
        return env;
    }

    private MutableList<Tree> readGroup(String name, JsonParser parser) throws IOException {
        MutableList<Tree> trees = Lists.mutable.empty();

        while (true) {
            JsonToken token = parser.nextToken();
            if (token == JsonToken.END_ARRAY) {
                break;
            }
            if (token != JsonToken.VALUE_STRING) {
                throw new IOException("Unexpected JSON token in group '" + name + "': " + token);
            }
            trees.add(expression(name, parser.getText()));
        }

        return trees;
    }

    private static Tree expression(String name, String source) throws IOException {
        ImmutableList<Tree> trees;
        try {
            trees = Merl.quote(source);
        } catch (MerlException e) {
            throw new IOException("Cannot read value of '" + name + "': " + e.getMessage(), e);
        }
        if (trees.size() != 1) {
            throw new IOException("Value of '" + name + "' must be a single expression: " + source);
        }
        return trees.getOnly();
    }
}
