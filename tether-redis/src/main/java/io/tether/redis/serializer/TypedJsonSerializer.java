package io.tether.redis.serializer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * JSON serializer for values of arbitrary type, using Jackson.
 *
 * <p>A cache store holds results of many client types, so the concrete class
 * is stored next to the payload:</p>
 * <pre>
 * {"type":"com.acme.quotes.Quote","payload":{"pair":"EUR/USD","bid":1.0842}}
 * </pre>
 *
 * <p>Only types whose name starts with one of the allowed package prefixes,
 * plus strings, boxed primitives and {@code BigDecimal}/{@code BigInteger},
 * are written or read back. Anything else fails with
 * {@link CacheValueSerializer.SerializationException}.</p>
 *
 * @since 1.0.0
 */
public class TypedJsonSerializer implements CacheValueSerializer {

    static final String TYPE_FIELD = "type";
    static final String PAYLOAD_FIELD = "payload";

    private static final Set<Class<?>> SCALAR_TYPES = Set.of(
            String.class, Boolean.class, Character.class, Byte.class, Short.class,
            Integer.class, Long.class, Float.class, Double.class,
            BigDecimal.class, BigInteger.class);

    private final ObjectMapper objectMapper;
    private final List<String> allowedTypePrefixes;

    /**
     * @param allowedTypePrefixes package prefixes of the value types to accept,
     *        e.g. {@code "com.acme.quotes."}
     */
    public TypedJsonSerializer(List<String> allowedTypePrefixes) {
        this(allowedTypePrefixes, createDefaultObjectMapper());
    }

    public TypedJsonSerializer(List<String> allowedTypePrefixes, ObjectMapper objectMapper) {
        this.allowedTypePrefixes = List.copyOf(allowedTypePrefixes);
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    private static ObjectMapper createDefaultObjectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    @Override
    public byte[] serialize(Object value) {
        if (value == null) {
            return null;
        }
        String typeName = value.getClass().getName();
        if (!accepts(value.getClass())) {
            throw new SerializationException("Type " + typeName + " is not allowed in the cache");
        }

        ObjectNode envelope = objectMapper.createObjectNode();
        envelope.put(TYPE_FIELD, typeName);
        try {
            envelope.set(PAYLOAD_FIELD, objectMapper.valueToTree(value));
            return objectMapper.writeValueAsBytes(envelope);
        } catch (IllegalArgumentException | JsonProcessingException e) {
            throw new SerializationException("Failed to serialize " + typeName + " to JSON", e);
        }
    }

    @Override
    public Object deserialize(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return null;
        }

        JsonNode envelope;
        try {
            envelope = objectMapper.readTree(bytes);
        } catch (IOException e) {
            throw new SerializationException("Cached value is not valid JSON", e);
        }

        JsonNode typeNode = envelope.get(TYPE_FIELD);
        if (typeNode == null || !typeNode.isTextual() || !envelope.has(PAYLOAD_FIELD)) {
            throw new SerializationException("Cached value has no type envelope");
        }

        String typeName = typeNode.asText();
        Class<?> type = resolve(typeName);
        try {
            return objectMapper.treeToValue(envelope.get(PAYLOAD_FIELD), type);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to deserialize JSON to " + typeName, e);
        }
    }

    private Class<?> resolve(String typeName) {
        boolean prefixed = allowedTypePrefixes.stream().anyMatch(typeName::startsWith);
        if (!prefixed && SCALAR_TYPES.stream().noneMatch(t -> t.getName().equals(typeName))) {
            throw new SerializationException("Type " + typeName + " is not allowed in the cache");
        }
        try {
            ClassLoader loader = Thread.currentThread().getContextClassLoader();
            return Class.forName(typeName, false, loader != null ? loader : getClass().getClassLoader());
        } catch (ClassNotFoundException e) {
            throw new SerializationException("Unknown cached type " + typeName, e);
        }
    }

    @Override
    public boolean accepts(Class<?> type) {
        String typeName = type.getName();
        return SCALAR_TYPES.contains(type) || allowedTypePrefixes.stream().anyMatch(typeName::startsWith);
    }

    /**
     * Returns the package prefixes accepted by this serializer.
     */
    public List<String> getAllowedTypePrefixes() {
        return allowedTypePrefixes;
    }
}
