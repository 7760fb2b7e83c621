package org.abstractica.textworld.impl.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.abstractica.textworld.Protocol;

import java.lang.reflect.RecordComponent;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JSON-lines implementation of the Protocol interface.
 *
 * <p>Scans sealed interface hierarchies to build type registries and a
 * protocol hash. Every message travels as one JSON object on one line,
 * carrying its record components plus a {@code type} field holding the
 * record's simple name in lower camel case ({@code Move} becomes
 * {@code "move"}).</p>
 */
public final class JsonProtocol implements Protocol
{
    /**
     * Name of the field carrying the message type.
     */
    public static final String TYPE_FIELD = "type";

    private final String hash;
    private final ObjectMapper mapper;
    private final Map<Class<?>, String> typeToName;
    private final Map<String, Class<? extends Record>> clientTypes;
    private final Map<String, Class<? extends Record>> serverTypes;

    private JsonProtocol(
            String hash,
            Map<Class<?>, String> typeToName,
            Map<String, Class<? extends Record>> clientTypes,
            Map<String, Class<? extends Record>> serverTypes
    )
    {
        this.hash = hash;
        this.typeToName = Map.copyOf(typeToName);
        this.clientTypes = Map.copyOf(clientTypes);
        this.serverTypes = Map.copyOf(serverTypes);
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
    }

    @Override
    public String getHash()
    {
        return hash;
    }

    /**
     * Gets the wire type name for a message class.
     *
     * @param messageClass the message class
     * @return the type name
     * @throws IllegalArgumentException if the class is not registered
     */
    public String getTypeName(Class<?> messageClass)
    {
        String name = typeToName.get(messageClass);
        if (name == null)
        {
            throw new IllegalArgumentException("Unknown message type: " + messageClass.getName());
        }
        return name;
    }

    /**
     * Encodes a message to a single line of JSON (without line terminator).
     *
     * @param message the message record
     * @return encoded JSON text
     * @throws IllegalArgumentException if the message type is not registered
     */
    public String encode(Object message)
    {
        Objects.requireNonNull(message, "message");
        String typeName = getTypeName(message.getClass());

        ObjectNode node = mapper.createObjectNode();
        node.put(TYPE_FIELD, typeName);
        JsonNode body = mapper.valueToTree(message);
        if (body instanceof ObjectNode objectBody)
        {
            objectBody.remove(TYPE_FIELD);
            node.setAll(objectBody);
        }

        try
        {
            return mapper.writeValueAsString(node);
        }
        catch (JsonProcessingException e)
        {
            throw new IllegalArgumentException("Cannot encode " + typeName, e);
        }
    }

    /**
     * Decodes a line received from a client.
     *
     * @param line one JSON object
     * @return decoded client message
     * @throws IllegalArgumentException if the line is not valid JSON, has no
     *                                  known type, or does not fit the record
     */
    public Record decodeClientMessage(String line)
    {
        return decode(line, clientTypes);
    }

    /**
     * Decodes a line received from the server.
     *
     * @param line one JSON object
     * @return decoded server message
     * @throws IllegalArgumentException if the line cannot be decoded
     */
    public Record decodeServerMessage(String line)
    {
        return decode(line, serverTypes);
    }

    private Record decode(String line, Map<String, Class<? extends Record>> registry)
    {
        Objects.requireNonNull(line, "line");

        JsonNode node;
        try
        {
            node = mapper.readTree(line);
        }
        catch (JsonProcessingException e)
        {
            throw new IllegalArgumentException("Malformed JSON: " + e.getOriginalMessage(), e);
        }

        if (node == null || !node.isObject())
        {
            throw new IllegalArgumentException("Message must be a JSON object");
        }

        JsonNode typeNode = node.get(TYPE_FIELD);
        if (typeNode == null || !typeNode.isTextual())
        {
            throw new IllegalArgumentException("Message has no '" + TYPE_FIELD + "' field");
        }

        Class<? extends Record> type = registry.get(typeNode.asText());
        if (type == null)
        {
            throw new IllegalArgumentException("Unknown message type: " + typeNode.asText());
        }

        ObjectNode body = ((ObjectNode) node).deepCopy();
        body.remove(TYPE_FIELD);
        try
        {
            return mapper.treeToValue(body, type);
        }
        catch (JsonProcessingException | IllegalArgumentException e)
        {
            throw new IllegalArgumentException("Invalid " + typeNode.asText() + " message: " + e.getMessage(), e);
        }
    }

    // ========== Builder ==========

    /**
     * Builder for constructing a JsonProtocol.
     */
    public static class Builder implements Protocol.Builder
    {
        private Class<?> clientMessageType;
        private Class<?> serverMessageType;

        @Override
        public Builder clientMessages(Class<?> sealedInterface)
        {
            this.clientMessageType = Objects.requireNonNull(sealedInterface, "sealedInterface");
            return this;
        }

        @Override
        public Builder serverMessages(Class<?> sealedInterface)
        {
            this.serverMessageType = Objects.requireNonNull(sealedInterface, "sealedInterface");
            return this;
        }

        @Override
        public JsonProtocol build()
        {
            if (clientMessageType == null)
            {
                throw new IllegalStateException("Client message type not set");
            }
            if (serverMessageType == null)
            {
                throw new IllegalStateException("Server message type not set");
            }

            validateSealedInterface(clientMessageType);
            validateSealedInterface(serverMessageType);

            List<Class<? extends Record>> clientList = collectPermittedTypes(clientMessageType);
            List<Class<? extends Record>> serverList = collectPermittedTypes(serverMessageType);

            Map<Class<?>, String> typeToName = new HashMap<>();
            Map<String, Class<? extends Record>> clientTypes = register(clientList, typeToName);
            Map<String, Class<? extends Record>> serverTypes = register(serverList, typeToName);

            return new JsonProtocol(computeHash(clientList, serverList), typeToName, clientTypes, serverTypes);
        }

        private Map<String, Class<? extends Record>> register(
                List<Class<? extends Record>> types,
                Map<Class<?>, String> typeToName
        )
        {
            Map<String, Class<? extends Record>> byName = new HashMap<>();
            for (Class<? extends Record> type : types)
            {
                String name = typeName(type);
                Class<? extends Record> previous = byName.putIfAbsent(name, type);
                if (previous != null)
                {
                    throw new IllegalArgumentException("Duplicate message type name '" + name + "': "
                            + previous.getName() + " and " + type.getName());
                }
                typeToName.put(type, name);
            }
            return byName;
        }

        private void validateSealedInterface(Class<?> clazz)
        {
            if (!clazz.isSealed())
            {
                throw new IllegalArgumentException("Not a sealed interface: " + clazz.getName());
            }
            if (!clazz.isInterface())
            {
                throw new IllegalArgumentException("Not an interface: " + clazz.getName());
            }
        }

        private List<Class<? extends Record>> collectPermittedTypes(Class<?> sealedInterface)
        {
            List<Class<? extends Record>> types = new ArrayList<>();
            collectPermittedTypesRecursive(sealedInterface, types);

            // Sort by fully-qualified name for a deterministic hash
            types.sort(Comparator.comparing(Class::getName));

            return types;
        }

        @SuppressWarnings("unchecked")
        private void collectPermittedTypesRecursive(Class<?> sealedInterface, List<Class<? extends Record>> types)
        {
            Class<?>[] permitted = sealedInterface.getPermittedSubclasses();
            if (permitted == null)
            {
                return;
            }

            for (Class<?> subclass : permitted)
            {
                if (subclass.isRecord())
                {
                    types.add((Class<? extends Record>) subclass);
                }
                else if (subclass.isSealed())
                {
                    collectPermittedTypesRecursive(subclass, types);
                }
                else
                {
                    throw new IllegalArgumentException(
                            "Permitted type must be a record or sealed interface: " + subclass.getName());
                }
            }
        }

        private String computeHash(List<Class<? extends Record>> clientTypes, List<Class<? extends Record>> serverTypes)
        {
            try
            {
                MessageDigest digest = MessageDigest.getInstance("SHA-256");
                for (Class<? extends Record> type : clientTypes)
                {
                    appendTypeToDigest(digest, type);
                }
                for (Class<? extends Record> type : serverTypes)
                {
                    appendTypeToDigest(digest, type);
                }
                return HexFormat.of().formatHex(digest.digest());
            }
            catch (NoSuchAlgorithmException e)
            {
                throw new IllegalStateException("SHA-256 not available", e);
            }
        }

        private void appendTypeToDigest(MessageDigest digest, Class<? extends Record> type)
        {
            digest.update(typeName(type).getBytes(StandardCharsets.UTF_8));
            for (RecordComponent component : type.getRecordComponents())
            {
                digest.update(component.getName().getBytes(StandardCharsets.UTF_8));
                digest.update(component.getGenericType().getTypeName().getBytes(StandardCharsets.UTF_8));
            }
        }
    }

    static String typeName(Class<?> type)
    {
        String simple = type.getSimpleName();
        return Character.toLowerCase(simple.charAt(0)) + simple.substring(1);
    }
}
