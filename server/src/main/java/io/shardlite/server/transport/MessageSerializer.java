// file: server/src/main/java/io/shardlite/server/transport/MessageSerializer.java
package io.shardlite.server.transport;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.jsontype.BasicPolymorphicTypeValidator;
import com.fasterxml.jackson.databind.jsontype.PolymorphicTypeValidator;
import io.shardlite.core.exception.MessageEncodingException;

import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * JSON wire encoding of transport messages.
 * <p>
 * Design:
 *  - The top-level class name travels next to the body ({@link Encoded#type()}).
 *  - Fields declared as {@code Object} (e.g. the payload of a
 *    {@link io.shardlite.core.ShardingEnvelope}) carry an "@class" property.
 *  - Only classes under the allowed package prefixes are ever instantiated;
 *    everything else is rejected with {@link MessageEncodingException}.
 */
public final class MessageSerializer {

    public static final List<String> DEFAULT_ALLOWED = List.of("io.shardlite.", "java.lang.", "java.util.");

    /** Encoded message: class name and JSON body. */
    public record Encoded(String type, byte[] body) {
    }

    private final List<String> allowedPrefixes;
    private final ObjectMapper mapper;

    public MessageSerializer() {
        this(DEFAULT_ALLOWED);
    }

    public MessageSerializer(List<String> allowedPrefixes) {
        this.allowedPrefixes = List.copyOf(allowedPrefixes);
        BasicPolymorphicTypeValidator.Builder ptv = BasicPolymorphicTypeValidator.builder();
        for (String prefix : this.allowedPrefixes) {
            ptv.allowIfSubType(prefix);
        }
        PolymorphicTypeValidator validator = ptv.build();
        this.mapper = new ObjectMapper()
                .activateDefaultTyping(validator, ObjectMapper.DefaultTyping.JAVA_LANG_OBJECT, JsonTypeInfo.As.PROPERTY);
    }

    public Encoded encode(Object message) {
        Objects.requireNonNull(message, "message");
        String type = message.getClass().getName();
        requireAllowed(type);
        try {
            return new Encoded(type, mapper.writeValueAsBytes(message));
        } catch (JsonProcessingException e) {
            throw new MessageEncodingException(type, "cannot serialize " + type, e);
        }
    }

    public Object decode(String type, byte[] body) {
        requireAllowed(type);
        try {
            Class<?> cls = Class.forName(type, false, MessageSerializer.class.getClassLoader());
            return mapper.readValue(body, cls);
        } catch (ClassNotFoundException e) {
            throw new MessageEncodingException(type, "unknown message type " + type, e);
        } catch (IOException e) {
            throw new MessageEncodingException(type, "cannot deserialize " + type, e);
        }
    }

    private void requireAllowed(String type) {
        for (String prefix : allowedPrefixes) {
            if (type.startsWith(prefix)) {
                return;
            }
        }
        throw new MessageEncodingException(type, "message type not allowed on the wire: " + type);
    }
}
