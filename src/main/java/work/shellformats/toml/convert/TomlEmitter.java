package work.shellformats.toml.convert;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JsonSerializable;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.jsontype.TypeSerializer;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.shellformats.toml.doc.DocValue;
import work.shellformats.toml.doc.DocValue.DocArray;
import work.shellformats.toml.doc.DocValue.DocBoolean;
import work.shellformats.toml.doc.DocValue.DocFloat;
import work.shellformats.toml.doc.DocValue.DocInteger;
import work.shellformats.toml.doc.DocValue.DocString;
import work.shellformats.toml.doc.DocValue.TableLike;
import work.shellformats.toml.error.CantConvertException;
import work.shellformats.toml.value.Span;

/**
 * Writes a document tree as TOML text through Jackson's TOML generator.
 *
 * <p>A TOML document is a table. A root that is not table-shaped is written under the configured
 * root key, or refused when there is none.
 */
public final class TomlEmitter {
    private static final Logger LOGGER = LoggerFactory.getLogger(TomlEmitter.class);
    private static final TomlMapper TOML = new TomlMapper();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final Optional<String> rootArrayKey;

    public TomlEmitter(Optional<String> rootArrayKey) {
        this.rootArrayKey = rootArrayKey;
    }

    /**
     * @param sourceType type name of the pipeline value the tree came from, for error messages
     * @param span location of that value
     */
    public String emit(DocValue root, String sourceType, Span span) {
        ObjectNode document;
        if (root instanceof TableLike table) {
            document = toObject(table.entries());
        } else if (rootArrayKey.isPresent()) {
            LOGGER.debug("Writing non-table root under key '{}'", rootArrayKey.get());
            document = NODES.objectNode();
            document.set(rootArrayKey.get(), toNode(root));
        } else {
            throw new CantConvertException("TOML", sourceType, span);
        }
        if (document.isEmpty()) {
            return "";
        }
        try {
            return TOML.writeValueAsString(document);
        } catch (JsonProcessingException ex) {
            throw new CantConvertException("TOML", sourceType, span, ex);
        }
    }

    private static ObjectNode toObject(Map<String, DocValue> entries) {
        ObjectNode node = NODES.objectNode();
        for (Map.Entry<String, DocValue> entry : entries.entrySet()) {
            node.set(entry.getKey(), toNode(entry.getValue()));
        }
        return node;
    }

    private static JsonNode toNode(DocValue value) {
        if (value instanceof TableLike table) {
            return toObject(table.entries());
        }
        if (value instanceof DocArray array) {
            ArrayNode node = NODES.arrayNode(array.size());
            for (DocValue item : array.items()) {
                node.add(toNode(item));
            }
            return node;
        }
        if (value instanceof DocString str) {
            return NODES.textNode(str.value());
        }
        if (value instanceof DocInteger number) {
            return NODES.numberNode(number.value());
        }
        if (value instanceof DocFloat number) {
            double val = number.value();
            if (Double.isNaN(val)) {
                return NODES.pojoNode(NonFiniteFloat.NAN);
            }
            if (Double.isInfinite(val)) {
                return NODES.pojoNode(val > 0 ? NonFiniteFloat.POSITIVE_INFINITY : NonFiniteFloat.NEGATIVE_INFINITY);
            }
            return NODES.numberNode(val);
        }
        if (value instanceof DocBoolean bool) {
            return NODES.booleanNode(bool.value());
        }
        throw new IllegalStateException("Unexpected document value: " + value);
    }

    /**
     * TOML spelling of the non-finite floats; the generator would otherwise write {@code NaN} and {@code Infinity}.
     */
    private enum NonFiniteFloat implements JsonSerializable {
        NAN("nan"),
        POSITIVE_INFINITY("inf"),
        NEGATIVE_INFINITY("-inf");

        private final String literal;

        NonFiniteFloat(String literal) {
            this.literal = literal;
        }

        @Override
        public void serialize(JsonGenerator gen, SerializerProvider serializers) throws IOException {
            gen.writeNumber(literal);
        }

        @Override
        public void serializeWithType(JsonGenerator gen, SerializerProvider serializers, TypeSerializer typeSer)
            throws IOException {
            serialize(gen, serializers);
        }
    }
}
