package io.proteus.events.core.database;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import io.proteus.events.core.ThrowablesUtil;

import java.io.IOException;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

/**
 * Stores a list of strings (target countries, target platforms) as a JSON array.
 */
class StringListMapper
{
    private static final TypeReference<List<String>> LIST_OF_STRING = new TypeReference<List<String>>() { };

    private final ObjectMapper jsonTreeMapper = new ObjectMapper();

    public List<String> fromResultSetOrEmpty(ResultSet rs, String column)
        throws SQLException
    {
        String text = rs.getString(column);
        if (rs.wasNull()) {
            return ImmutableList.of();
        }
        else {
            return fromText(text);
        }
    }

    private List<String> fromText(String text)
    {
        try {
            return ImmutableList.copyOf(jsonTreeMapper.readValue(text, LIST_OF_STRING));
        }
        catch (IOException ex) {
            throw ThrowablesUtil.propagate(ex);
        }
    }

    public String toBinding(List<String> values)
    {
        if (values.isEmpty()) {
            return null;
        }
        try {
            return jsonTreeMapper.writeValueAsString(values);
        }
        catch (IOException ex) {
            throw ThrowablesUtil.propagate(ex);
        }
    }
}
