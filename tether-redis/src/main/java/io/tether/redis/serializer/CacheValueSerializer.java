package io.tether.redis.serializer;

/**
 * Encodes cached invocation results for storage in Redis.
 *
 * <p>A store shares one serializer across every client type it caches, so a
 * serializer decides up front which result types it can restore exactly and
 * refuses the others. Implementations must be thread-safe.</p>
 *
 * @since 1.0.0
 */
public interface CacheValueSerializer {

    /**
     * Returns true if results of this type can be written and read back as
     * the same type.
     */
    boolean accepts(Class<?> type);

    /**
     * @throws SerializationException if the type is not accepted or encoding fails
     */
    byte[] serialize(Object value);

    /**
     * @return the restored result, or null for null or empty input
     * @throws SerializationException if the bytes do not hold an accepted type
     */
    Object deserialize(byte[] bytes);

    /**
     * Thrown when a cached result cannot be encoded or restored.
     */
    class SerializationException extends RuntimeException {
        public SerializationException(String message) {
            super(message);
        }

        public SerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
