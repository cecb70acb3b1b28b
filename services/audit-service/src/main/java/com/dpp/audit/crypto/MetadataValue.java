package com.dpp.audit.crypto;

import com.dpp.audit.exception.MalformedEventFieldException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Structured audit metadata.
 *
 * <p>The set of shapes is closed: text, integer, boolean, null, list and
 * object. Floating point numbers are not representable; callers encode
 * decimals as text. Integers are limited to the I-JSON safe range so every
 * JSON consumer reads them back exactly. These limits keep the canonical
 * form used for hashing identical across platforms.
 */
public abstract class MetadataValue {

    public static final long MAX_SAFE_INTEGER = 9_007_199_254_740_991L;

    private MetadataValue() {
    }

    abstract void appendCanonical(StringBuilder out);

    public static MetadataValue text(String value) {
        return new TextValue(value);
    }

    public static MetadataValue integer(long value) {
        return new IntegerValue(value);
    }

    public static MetadataValue bool(boolean value) {
        return value ? BooleanValue.TRUE : BooleanValue.FALSE;
    }

    public static MetadataValue nullValue() {
        return NullValue.INSTANCE;
    }

    public static MetadataValue list(List<? extends MetadataValue> items) {
        return new ListValue(items);
    }

    public static ObjectValue object(Map<String, ? extends MetadataValue> fields) {
        return new ObjectValue(fields);
    }

    /**
     * Converts plain Java values (maps with string keys, collections, strings,
     * booleans, integral numbers and null) into metadata.
     *
     * @throws MalformedEventFieldException for any other type or an out-of-range number
     */
    public static MetadataValue from(Object raw) {
        if (raw == null) {
            return NullValue.INSTANCE;
        }
        if (raw instanceof MetadataValue) {
            return (MetadataValue) raw;
        }
        if (raw instanceof String) {
            return new TextValue((String) raw);
        }
        if (raw instanceof Boolean) {
            return bool((Boolean) raw);
        }
        if (raw instanceof Long || raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
            return new IntegerValue(((Number) raw).longValue());
        }
        if (raw instanceof BigInteger) {
            return new IntegerValue(toSafeLong((BigInteger) raw));
        }
        if (raw instanceof Map) {
            Map<String, MetadataValue> fields = new TreeMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) raw).entrySet()) {
                if (!(entry.getKey() instanceof String)) {
                    throw new MalformedEventFieldException("Metadata object keys must be strings, got: " + entry.getKey());
                }
                fields.put((String) entry.getKey(), from(entry.getValue()));
            }
            return new ObjectValue(fields);
        }
        if (raw instanceof Collection) {
            List<MetadataValue> items = new ArrayList<>();
            for (Object item : (Collection<?>) raw) {
                items.add(from(item));
            }
            return new ListValue(items);
        }
        throw new MalformedEventFieldException("Unsupported metadata value type: " + raw.getClass().getName());
    }

    /**
     * Reads metadata back from a parsed JSON tree.
     */
    public static MetadataValue fromJson(JsonNode node) {
        if (node == null || node.isNull()) {
            return NullValue.INSTANCE;
        }
        if (node.isTextual()) {
            return new TextValue(node.textValue());
        }
        if (node.isBoolean()) {
            return bool(node.booleanValue());
        }
        if (node.isIntegralNumber()) {
            return new IntegerValue(toSafeLong(node.bigIntegerValue()));
        }
        if (node.isArray()) {
            List<MetadataValue> items = new ArrayList<>();
            for (JsonNode item : node) {
                items.add(fromJson(item));
            }
            return new ListValue(items);
        }
        if (node.isObject()) {
            Map<String, MetadataValue> fields = new TreeMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                fields.put(entry.getKey(), fromJson(entry.getValue()));
            }
            return new ObjectValue(fields);
        }
        throw new MalformedEventFieldException("Unsupported metadata JSON node: " + node.getNodeType());
    }

    private static long toSafeLong(BigInteger value) {
        if (value.abs().compareTo(BigInteger.valueOf(MAX_SAFE_INTEGER)) > 0) {
            throw new MalformedEventFieldException("Metadata integer outside safe range: " + value);
        }
        return value.longValue();
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class TextValue extends MetadataValue {
        private final String value;

        private TextValue(String value) {
            if (value == null) {
                throw new MalformedEventFieldException("Metadata text must not be null");
            }
            CanonicalJson.requireWellFormed(value);
            this.value = value;
        }

        @Override
        void appendCanonical(StringBuilder out) {
            CanonicalJson.appendString(out, value);
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class IntegerValue extends MetadataValue {
        private final long value;

        private IntegerValue(long value) {
            if (Math.abs(value) > MAX_SAFE_INTEGER) {
                throw new MalformedEventFieldException("Metadata integer outside safe range: " + value);
            }
            this.value = value;
        }

        @Override
        void appendCanonical(StringBuilder out) {
            out.append(value);
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class BooleanValue extends MetadataValue {
        private static final BooleanValue TRUE = new BooleanValue(true);
        private static final BooleanValue FALSE = new BooleanValue(false);

        private final boolean value;

        private BooleanValue(boolean value) {
            this.value = value;
        }

        @Override
        void appendCanonical(StringBuilder out) {
            out.append(value ? "true" : "false");
        }
    }

    @EqualsAndHashCode(callSuper = false)
    public static final class NullValue extends MetadataValue {
        private static final NullValue INSTANCE = new NullValue();

        private NullValue() {
        }

        @Override
        void appendCanonical(StringBuilder out) {
            out.append("null");
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class ListValue extends MetadataValue {
        private final List<MetadataValue> items;

        private ListValue(List<? extends MetadataValue> items) {
            List<MetadataValue> copy = new ArrayList<>(items.size());
            for (MetadataValue item : items) {
                copy.add(item != null ? item : NullValue.INSTANCE);
            }
            this.items = Collections.unmodifiableList(copy);
        }

        @Override
        void appendCanonical(StringBuilder out) {
            out.append('[');
            for (int i = 0; i < items.size(); i++) {
                if (i > 0) {
                    out.append(',');
                }
                items.get(i).appendCanonical(out);
            }
            out.append(']');
        }
    }

    /**
     * Object with members kept in canonical key order (UTF-16 code units).
     */
    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class ObjectValue extends MetadataValue {
        private final SortedMap<String, MetadataValue> fields;

        private ObjectValue(Map<String, ? extends MetadataValue> fields) {
            SortedMap<String, MetadataValue> sorted = new TreeMap<>();
            for (Map.Entry<String, ? extends MetadataValue> entry : fields.entrySet()) {
                if (entry.getKey() == null) {
                    throw new MalformedEventFieldException("Metadata object keys must not be null");
                }
                CanonicalJson.requireWellFormed(entry.getKey());
                sorted.put(entry.getKey(), entry.getValue() != null ? entry.getValue() : NullValue.INSTANCE);
            }
            this.fields = Collections.unmodifiableSortedMap(sorted);
        }

        @Override
        void appendCanonical(StringBuilder out) {
            out.append('{');
            boolean first = true;
            for (Map.Entry<String, MetadataValue> entry : fields.entrySet()) {
                if (!first) {
                    out.append(',');
                }
                first = false;
                CanonicalJson.appendString(out, entry.getKey());
                out.append(':');
                entry.getValue().appendCanonical(out);
            }
            out.append('}');
        }
    }
}
