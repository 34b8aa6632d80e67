/**********************************************************************
Copyright (c) 2019 Contributors. All rights reserved.
Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

    http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.

Contributors:
    ...
**********************************************************************/
package org.datanucleus.store.oracle.sql;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import org.datanucleus.exceptions.NucleusUserException;
import org.datanucleus.store.oracle.OracleAdapterConfiguration;
import org.datanucleus.store.oracle.TablespaceType;
import org.datanucleus.store.oracle.adapter.OracleDialect;
import org.datanucleus.store.oracle.identifier.OracleIdentifierResolver;
import org.datanucleus.store.oracle.types.ColumnType;
import org.datanucleus.store.oracle.types.NativeType;
import org.datanucleus.util.Localiser;
import org.datanucleus.util.StringUtils;

/**
 * Generates the Oracle-specific parts of SQL statements : result range restriction, DISTINCT with ORDER BY,
 * tablespace clauses, column types, and sequence statements.
 */
public class OracleSQLTranslator
{
    private static final Pattern ORDER_DIRECTION = Pattern.compile("\\s+(ASC|DESC)\\s*?", Pattern.CASE_INSENSITIVE);

    private static final Pattern TABLESPACE_CLAUSE = Pattern.compile("\\sTABLESPACE\\s", Pattern.CASE_INSENSITIVE);

    protected final OracleDialect dialect;

    protected final Map<ColumnType, NativeType> nativeTypes;

    public OracleSQLTranslator(OracleDialect dialect, Map<ColumnType, NativeType> nativeTypes)
    {
        this.dialect = dialect;
        this.nativeTypes = nativeTypes;
    }

    /**
     * Restrict the query to a range of its results. From Oracle 12 this uses OFFSET/FETCH, otherwise
     * (or when the old visitor is configured) the query is wrapped in selects of ROWNUM.
     * @param query The query
     * @param offset Number of rows to skip (null for none)
     * @param limit Maximum number of rows (null for no limit)
     * @return The query restricted to the range
     * @throws NucleusUserException if the offset or limit is negative
     */
    public SQLText applyRange(SQLText query, Long offset, Long limit)
    {
        if ((offset != null && offset < 0) || (limit != null && limit < 0))
        {
            throw new NucleusUserException(Localiser.msg("059008", offset, limit));
        }
        if (offset == null && limit == null)
        {
            return query;
        }

        SQLText stmt = new SQLText();
        if (dialect.supportsFetchFirstNRowsAndOffset())
        {
            stmt.append(query);
            if (offset != null)
            {
                stmt.append(" OFFSET ").append(offset.longValue()).append(" ROWS");
            }
            if (limit != null)
            {
                stmt.append(" FETCH NEXT ").append(limit.longValue()).append(" ROWS ONLY");
            }
        }
        else if (offset != null && limit != null)
        {
            stmt.append("SELECT * FROM (SELECT raw_sql_.*, ROWNUM raw_rnum_ FROM (").append(query);
            stmt.append(") raw_sql_ WHERE ROWNUM <= ").append(upperRowBound(offset.longValue(), limit.longValue()));
            stmt.append(") WHERE raw_rnum_ > ").append(offset.longValue());
        }
        else if (limit != null)
        {
            stmt.append("SELECT * FROM (").append(query).append(") WHERE ROWNUM <= ").append(limit.longValue());
        }
        else
        {
            stmt.append("SELECT * FROM (SELECT raw_sql_.*, ROWNUM raw_rnum_ FROM (").append(query);
            stmt.append(") raw_sql_) WHERE raw_rnum_ > ").append(offset.longValue());
        }
        return stmt;
    }

    /**
     * Last ROWNUM of a range, capped at Long.MAX_VALUE.
     */
    private static long upperRowBound(long offset, long limit)
    {
        try
        {
            return Math.addExact(offset, limit);
        }
        catch (ArithmeticException ae)
        {
            return Long.MAX_VALUE;
        }
    }

    /**
     * Select list for a DISTINCT query that also orders by the given expressions. Oracle requires the
     * ORDER BY expressions to be selected, so each is added as FIRST_VALUE over the distinct columns, which
     * doesn't change the distinct rows.
     * @param columns The distinct columns, comma-separated
     * @param orders The ORDER BY expressions, optionally with ASC/DESC
     * @return The select list
     */
    public String columnsForDistinct(String columns, List<String> orders)
    {
        List<String> orderColumns = new ArrayList<>();
        for (String order : orders)
        {
            if (order == null || StringUtils.isWhitespace(order))
            {
                continue;
            }
            String column = ORDER_DIRECTION.matcher(order).replaceAll("");
            if (!StringUtils.isWhitespace(column))
            {
                orderColumns.add(column);
            }
        }

        StringBuilder str = new StringBuilder(columns);
        for (int i = 0; i < orderColumns.size(); i++)
        {
            String column = orderColumns.get(i);
            str.append(", FIRST_VALUE(").append(column).append(") OVER (PARTITION BY ").append(columns);
            str.append(" ORDER BY ").append(column).append(") AS alias_").append(i).append("__");
        }
        return str.toString();
    }

    /**
     * Convert a column default as held in the catalog into its value. Quotes in string literals are
     * stored doubled, so are undoubled here.
     * @param defaultValue The default
     * @return The value
     */
    public static Object extractValueFromDefault(Object defaultValue)
    {
        if (defaultValue instanceof String)
        {
            return ((String)defaultValue).replace("''", "'");
        }
        return defaultValue;
    }

    /**
     * Tablespace clause for a new table or index, using the explicit tablespace if provided
     * otherwise the configured default for the type.
     * @param type Type of segment
     * @param tablespace Explicit tablespace (optional)
     * @return The clause (with leading space), or the empty string when there is no tablespace to use
     */
    public String tablespaceClause(TablespaceType type, String tablespace)
    {
        String name = tablespace != null ? tablespace : dialect.getConfiguration().getDefaultTablespace(type);
        return name != null ? " TABLESPACE " + name : "";
    }

    /**
     * Add a tablespace clause to a CREATE TABLE or CREATE INDEX statement, unless it already has one.
     * @param createStmt The statement
     * @param type Type of segment
     * @param tablespace Explicit tablespace (optional)
     * @return The statement
     */
    public String addTablespace(String createStmt, TablespaceType type, String tablespace)
    {
        if (TABLESPACE_CLAUSE.matcher(createStmt).find())
        {
            return createStmt;
        }
        return createStmt + tablespaceClause(type, tablespace);
    }

    /**
     * LOB storage clauses for the large object columns of a new table, placing each in the default
     * tablespace configured for its type.
     * @param columns Column types keyed by column name, in table order
     * @return The clauses (each with a leading space), or the empty string
     */
    public String lobStorageClauses(Map<String, ColumnType> columns)
    {
        OracleAdapterConfiguration config = dialect.getConfiguration();
        StringBuilder str = new StringBuilder();
        for (Map.Entry<String, ColumnType> entry : columns.entrySet())
        {
            TablespaceType lobType = getLobTablespaceType(entry.getValue());
            if (lobType == null)
            {
                continue;
            }
            String tablespace = config.getDefaultTablespace(lobType);
            if (tablespace != null)
            {
                str.append(" LOB (").append(OracleIdentifierResolver.quoteColumnName(entry.getKey()));
                str.append(") STORE AS (TABLESPACE ").append(tablespace).append(")");
            }
        }
        return str.toString();
    }

    private static TablespaceType getLobTablespaceType(ColumnType type)
    {
        switch (type)
        {
            case TEXT :
                return TablespaceType.CLOB;
            case NTEXT :
                return TablespaceType.NCLOB;
            case BINARY :
                return TablespaceType.BLOB;
            default :
                return null;
        }
    }

    /**
     * Native type for a column of the given logical type.
     * @param type The logical column type
     * @param limit Length (overrides the default length of the type)
     * @param precision Precision for numeric and timestamp types
     * @param scale Scale for numeric types
     * @return The native type, e.g "VARCHAR2(255)"
     */
    public String typeToSql(ColumnType type, Integer limit, Integer precision, Integer scale)
    {
        NativeType nativeType = nativeTypes.get(type);
        if (nativeType == null)
        {
            throw new NucleusUserException("No native type known for column type " + type);
        }

        String name = nativeType.getName();
        if (type == ColumnType.PRIMARY_KEY)
        {
            return name;
        }
        if (type == ColumnType.DECIMAL || (type == ColumnType.INTEGER && precision != null))
        {
            if (precision == null)
            {
                return scale != null ? name + "(38," + scale + ")" : name;
            }
            return name + "(" + precision + (scale != null ? "," + scale : "") + ")";
        }
        if (name.startsWith("TIMESTAMP"))
        {
            return precision != null ? "TIMESTAMP(" + precision + ")" + name.substring("TIMESTAMP".length()) : name;
        }

        Integer length = limit != null ? limit : nativeType.getLimit();
        return length != null ? name + "(" + length + ")" : name;
    }

    /**
     * Statement to create a sequence.
     * @param sequenceName Name of the sequence
     * @param start Start value
     * @return The statement
     */
    public String getSequenceCreateStmt(String sequenceName, long start)
    {
        if (sequenceName == null)
        {
            throw new NucleusUserException(Localiser.msg("059007"));
        }
        return "CREATE SEQUENCE " + OracleIdentifierResolver.quoteTableName(sequenceName) + " START WITH " + start;
    }

    public String getSequenceDropStmt(String sequenceName)
    {
        if (sequenceName == null)
        {
            throw new NucleusUserException(Localiser.msg("059007"));
        }
        return "DROP SEQUENCE " + OracleIdentifierResolver.quoteTableName(sequenceName);
    }

    public String getSequenceNextStmt(String sequenceName)
    {
        if (sequenceName == null)
        {
            throw new NucleusUserException(Localiser.msg("059007"));
        }
        return "SELECT " + OracleIdentifierResolver.quoteTableName(sequenceName) + ".NEXTVAL FROM dual";
    }

    public String toString()
    {
        return "OracleSQLTranslator for " + dialect.getVendorID() + " " + dialect.getDatastoreMajorVersion() + "." +
            dialect.getDatastoreMinorVersion();
    }
}
