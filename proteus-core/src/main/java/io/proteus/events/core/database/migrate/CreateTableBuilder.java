package io.proteus.events.core.database.migrate;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Joiner;

/**
 * Builds a CREATE TABLE statement with column types that work on both H2 and PostgreSQL.
 */
public class CreateTableBuilder
{
    private enum ColumnType
    {
        ID("varchar(255) primary key", "text primary key"),
        STRING("varchar(255)", "text"),
        TEXT("clob", "text"),
        SMALLINT("smallint", "smallint"),
        INT("int", "int"),
        BIGINT("bigint", "bigint"),
        BOOLEAN("boolean", "boolean"),
        TIMESTAMP("timestamp", "timestamp with time zone");

        private final String h2;
        private final String postgres;

        ColumnType(String h2, String postgres)
        {
            this.h2 = h2;
            this.postgres = postgres;
        }
    }

    private final boolean postgres;
    private final String name;
    private final List<String> columns = new ArrayList<>();

    CreateTableBuilder(boolean postgres, String name)
    {
        this.postgres = postgres;
        this.name = name;
    }

    private CreateTableBuilder column(String column, ColumnType type, String options)
    {
        String sqlType = postgres ? type.postgres : type.h2;
        columns.add((column + " " + sqlType + " " + options).trim());
        return this;
    }

    public CreateTableBuilder addStringId(String column)
    {
        return column(column, ColumnType.ID, "");
    }

    public CreateTableBuilder addShort(String column, String options)
    {
        return column(column, ColumnType.SMALLINT, options);
    }

    public CreateTableBuilder addInt(String column, String options)
    {
        return column(column, ColumnType.INT, options);
    }

    public CreateTableBuilder addLong(String column, String options)
    {
        return column(column, ColumnType.BIGINT, options);
    }

    public CreateTableBuilder addBoolean(String column, String options)
    {
        return column(column, ColumnType.BOOLEAN, options);
    }

    public CreateTableBuilder addString(String column, String options)
    {
        return column(column, ColumnType.STRING, options);
    }

    // JSON documents and free text
    public CreateTableBuilder addMediumText(String column, String options)
    {
        return column(column, ColumnType.TEXT, options);
    }

    public CreateTableBuilder addTimestamp(String column, String options)
    {
        return column(column, ColumnType.TIMESTAMP, options);
    }

    public String build()
    {
        return "CREATE TABLE " + name + " (\n  " + Joiner.on(",\n  ").join(columns) + "\n)";
    }
}
