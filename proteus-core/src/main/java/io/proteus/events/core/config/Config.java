package io.proteus.events.core.config;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import static java.util.Locale.ENGLISH;

/**
 * System configuration as a mutable JSON object with typed accessors.
 *
 * Keys stay flat ({@code database.type}). Values are converted with Jackson,
 * so {@code "30"} reads as an int.
 */
public class Config
{
    private static final Map<Class<?>, String> TYPE_NAMES = ImmutableMap.<Class<?>, String>builder()
        .put(String.class, "string type")
        .put(int.class, "integer (int) type")
        .put(Integer.class, "integer (int) type")
        .put(long.class, "integer (long) type")
        .put(Long.class, "integer (long) type")
        .put(boolean.class, "'true' or 'false'")
        .put(Boolean.class, "'true' or 'false'")
        .build();

    private final ObjectMapper mapper;
    private final ObjectNode object;

    Config(ObjectMapper mapper)
    {
        this(mapper, JsonNodeFactory.instance.objectNode());
    }

    Config(ObjectMapper mapper, ObjectNode object)
    {
        this.mapper = mapper;
        this.object = object;
    }

    /**
     * Sets a value. A null value removes the key.
     */
    public Config set(String key, Object value)
    {
        if (value == null) {
            object.remove(key);
        }
        else {
            object.set(key, mapper.valueToTree(value));
        }
        return this;
    }

    public List<String> getKeys()
    {
        return ImmutableList.copyOf(object.fieldNames());
    }

    public boolean has(String key)
    {
        return object.has(key);
    }

    /**
     * @throws ConfigException if the key is missing, null or not convertible to type
     */
    public <E> E get(String key, Class<E> type)
    {
        JsonNode value = object.get(key);
        if (value == null || value.isNull()) {
            throw new ConfigException("Parameter '" + key + "' is required but " + (value == null ? "not set" : "null"));
        }
        return convert(key, value, mapper.getTypeFactory().constructType(type));
    }

    public <E> E get(String key, Class<E> type, E defaultValue)
    {
        return getOptional(key, type).or(defaultValue);
    }

    public <E> Optional<E> getOptional(String key, Class<E> type)
    {
        Optional<JsonNode> value = lookup(key);
        if (!value.isPresent()) {
            return Optional.absent();
        }
        return Optional.of(convert(key, value.get(), mapper.getTypeFactory().constructType(type)));
    }

    public <E> List<E> getListOrEmpty(String key, Class<E> elementType)
    {
        Optional<JsonNode> value = lookup(key);
        if (!value.isPresent()) {
            return ImmutableList.of();
        }
        return convert(key, value.get(), mapper.getTypeFactory().constructCollectionType(List.class, elementType));
    }

    private Optional<JsonNode> lookup(String key)
    {
        JsonNode value = object.get(key);
        if (value == null || value.isNull()) {
            return Optional.absent();
        }
        return Optional.of(value);
    }

    private <E> E convert(String key, JsonNode value, JavaType type)
    {
        try {
            return mapper.readValue(mapper.treeAsTokens(value), type);
        }
        catch (Exception ex) {
            throw new ConfigException(String.format(ENGLISH, "Expected %s for key '%s' but got %s (%s)",
                        describe(type), key, abbreviate(value.toString()),
                        value.getNodeType().toString().toLowerCase(ENGLISH)),
                    ex);
        }
    }

    private static String describe(JavaType type)
    {
        String name = TYPE_NAMES.get(type.getRawClass());
        if (name != null) {
            return name;
        }
        if (type.isCollectionLikeType()) {
            return "array type";
        }
        if (type.isMapLikeType()) {
            return "object type";
        }
        return type.toString();
    }

    private static String abbreviate(String json)
    {
        return json.length() < 100 ? json : json.substring(0, 97) + "...";
    }

    @Override
    public String toString()
    {
        return object.toString();
    }

    @Override
    public boolean equals(Object other)
    {
        return other instanceof Config && object.equals(((Config) other).object);
    }

    @Override
    public int hashCode()
    {
        return object.hashCode();
    }
}
