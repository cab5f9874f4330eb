package org.netpreserve.consolescan.util;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Accepts either a list of arguments or a single string split the way a shell would split it, so
 * {@code "--proxy-server='http://proxy:3128' --lang=en"} becomes two arguments.
 */
public class ShellCommandDeserializer extends JsonDeserializer<List<String>> {
    @Override
    public List<String> deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        JsonNode node = parser.getCodec().readTree(parser);
        if (node.isArray()) {
            var args = new ArrayList<String>(node.size());
            node.forEach(element -> args.add(element.asText()));
            return args;
        }
        if (!node.isTextual()) {
            throw JsonMappingException.from(parser, "Expected a string or a list of strings, not " + node);
        }
        try {
            return split(node.asText());
        } catch (IllegalArgumentException e) {
            throw JsonMappingException.from(parser, e.getMessage(), e);
        }
    }

    public static List<String> split(String commandLine) {
        var args = new ArrayList<String>();
        var current = new StringBuilder();
        char quote = 0;
        boolean inArg = false;
        for (char c : commandLine.toCharArray()) {
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                } else {
                    current.append(c);
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
                inArg = true;
            } else if (Character.isWhitespace(c)) {
                if (inArg) {
                    args.add(current.toString());
                    current.setLength(0);
                    inArg = false;
                }
            } else {
                current.append(c);
                inArg = true;
            }
        }
        if (quote != 0) throw new IllegalArgumentException("Unterminated quote in: " + commandLine);
        if (inArg) args.add(current.toString());
        return args;
    }
}
