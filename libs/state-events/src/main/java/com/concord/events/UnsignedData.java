package com.concord.events;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.math.BigInteger;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Key-value data attached to an event outside its signature, such as {@code age} or
 * {@code transaction_id}.
 *
 * <p>Immutable. Values are held in a canonical JSON form so that data built in memory compares
 * equal to the same data decoded from the wire.
 */
public final class UnsignedData {

    public static final String AGE = "age";
    public static final String TRANSACTION_ID = "transaction_id";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final UnsignedData EMPTY = new UnsignedData(NODES.objectNode());

    private final ObjectNode fields;

    private UnsignedData(ObjectNode canonicalFields) {
        this.fields = canonicalFields;
    }

    /** Data with no keys; never encoded. */
    public static UnsignedData empty() {
        return EMPTY;
    }

    /** Copies the given JSON object. */
    public static UnsignedData of(ObjectNode fields) {
        Objects.requireNonNull(fields, "fields");
        return fields.isEmpty() ? EMPTY : new UnsignedData((ObjectNode) canonical(fields));
    }

    /** Returns a copy with {@code key} set to {@code value}. */
    public UnsignedData with(String key, JsonNode value) {
        Objects.requireNonNull(key, "key");
        ObjectNode copy = fields.deepCopy();
        copy.set(key, canonical(Objects.requireNonNull(value, "value")));
        return new UnsignedData(copy);
    }

    /** Returns a copy with {@code age}, the milliseconds elapsed since the event was sent. */
    public UnsignedData withAge(long age) {
        return with(AGE, NODES.numberNode(age));
    }

    /** Returns a copy with the client-supplied {@code transaction_id}. */
    public UnsignedData withTransactionId(String transactionId) {
        return with(TRANSACTION_ID, NODES.textNode(transactionId));
    }

    public Optional<Long> age() {
        JsonNode node = fields.get(AGE);
        return node != null && node.canConvertToLong() && node.isIntegralNumber()
                ? Optional.of(node.longValue())
                : Optional.empty();
    }

    public Optional<String> transactionId() {
        JsonNode node = fields.get(TRANSACTION_ID);
        return node != null && node.isTextual() ? Optional.of(node.textValue()) : Optional.empty();
    }

    /** The value stored under {@code key}, as a detached copy. */
    public Optional<JsonNode> get(String key) {
        return Optional.ofNullable(fields.get(key)).map(JsonNode::deepCopy);
    }

    public Set<String> keys() {
        Set<String> keys = new LinkedHashSet<>();
        fields.fieldNames().forEachRemaining(keys::add);
        return Set.copyOf(keys);
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    /** A detached copy of the data as a JSON object. */
    public ObjectNode toJson() {
        return fields.deepCopy();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof UnsignedData other && fields.equals(other.fields));
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "UnsignedData" + fields;
    }

    // Integers become the narrowest node a parser would produce; decimals keep their exact value.
    private static JsonNode canonical(JsonNode node) {
        if (node.isObject()) {
            ObjectNode copy = NODES.objectNode();
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                copy.set(entry.getKey(), canonical(entry.getValue()));
            }
            return copy;
        }
        if (node.isArray()) {
            ArrayNode copy = NODES.arrayNode();
            node.forEach(element -> copy.add(canonical(element)));
            return copy;
        }
        if (node.isIntegralNumber()) {
            BigInteger value = node.bigIntegerValue();
            if (value.bitLength() < Integer.SIZE) {
                return NODES.numberNode(value.intValue());
            }
            if (value.bitLength() < Long.SIZE) {
                return NODES.numberNode(value.longValue());
            }
            return NODES.numberNode(value);
        }
        if (node.isFloatingPointNumber()) {
            if (!node.isBigDecimal() && !Double.isFinite(node.doubleValue())) {
                return node.deepCopy();
            }
            return NODES.numberNode(node.decimalValue().stripTrailingZeros());
        }
        return node.deepCopy();
    }
}
