package work.shellformats.toml.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import work.shellformats.toml.value.Span;
import work.shellformats.toml.value.Value;
import work.shellformats.toml.value.Value.BinaryValue;
import work.shellformats.toml.value.Value.BoolValue;
import work.shellformats.toml.value.Value.FloatValue;
import work.shellformats.toml.value.Value.IntValue;
import work.shellformats.toml.value.Value.ListValue;
import work.shellformats.toml.value.Value.NothingValue;
import work.shellformats.toml.value.Value.RecordValue;
import work.shellformats.toml.value.Value.StringValue;

/**
 * Turns CLI input text into a pipeline value.
 */
final class InputReader {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    enum Format {
        JSON,
        YAML;

        static Format from(String value) {
            try {
                return Format.valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException ex) {
                throw new IllegalArgumentException("Unsupported input format: " + value);
            }
        }
    }

    private InputReader() {}

    /**
     * Wraps raw text as a string value spanning the whole input.
     */
    static Value readText(String text) {
        return new StringValue(text, new Span(0, text.length()));
    }

    static Value read(String text, Format format) throws IOException {
        ObjectMapper mapper = format == Format.YAML ? YAML : JSON;
        JsonNode node = mapper.readTree(text);
        if (node == null || node.isMissingNode()) {
            return new NothingValue(Span.unknown());
        }
        return toValue(node);
    }

    static Value toValue(JsonNode node) {
        if (node.isObject()) {
            var builder = RecordValue.builder();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                var field = fields.next();
                builder.put(field.getKey(), toValue(field.getValue()));
            }
            return builder.build();
        }
        if (node.isArray()) {
            List<Value> items = new ArrayList<>(node.size());
            for (JsonNode item : node) {
                items.add(toValue(item));
            }
            return new ListValue(items, Span.unknown());
        }
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return new IntValue(node.longValue(), Span.unknown());
        }
        if (node.isNumber()) {
            return new FloatValue(node.doubleValue(), Span.unknown());
        }
        if (node.isBoolean()) {
            return new BoolValue(node.booleanValue(), Span.unknown());
        }
        if (node.isBinary()) {
            try {
                return new BinaryValue(node.binaryValue(), Span.unknown());
            } catch (IOException ex) {
                throw new IllegalArgumentException("Unreadable binary input: " + ex.getMessage(), ex);
            }
        }
        if (node.isTextual()) {
            return new StringValue(node.textValue(), Span.unknown());
        }
        return new NothingValue(Span.unknown());
    }
}
