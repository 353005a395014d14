package io.proteus.events.core.database;

import java.io.IOException;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.google.inject.Inject;
import org.jdbi.v3.core.argument.AbstractArgumentFactory;
import org.jdbi.v3.core.argument.Argument;
import org.jdbi.v3.core.config.ConfigRegistry;

/**
 * Maps task arguments to a JSON text column. Any JSON value is stored as its text,
 * including {@code {}} and {@code null}. A NULL column reads back as a JSON null.
 */
public class JsonNodeMapper
{
    private final ObjectMapper mapper;

    @Inject
    public JsonNodeMapper(ObjectMapper mapper)
    {
        this.mapper = mapper;
    }

    public JsonNode fromResultSet(ResultSet rs, String column)
            throws SQLException
    {
        String text = rs.getString(column);
        if (text == null) {
            return NullNode.getInstance();
        }
        try {
            return mapper.readTree(text);
        }
        catch (IOException ex) {
            throw new SQLException("Column " + column + " does not hold valid JSON", ex);
        }
    }

    public String toBinding(JsonNode node)
    {
        if (node == null) {
            return null;
        }
        return node.toString();
    }

    public AbstractArgumentFactory<JsonNode> getArgumentFactory()
    {
        return new AbstractArgumentFactory<JsonNode>(Types.CLOB) {
            @Override
            protected Argument build(JsonNode value, ConfigRegistry registry)
            {
                String text = toBinding(value);
                return (position, statement, ctx) -> {
                    if (text == null) {
                        statement.setNull(position, Types.CLOB);
                    }
                    else {
                        statement.setString(position, text);
                    }
                };
            }
        };
    }
}
