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
package org.datanucleus.store.oracle.schema;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.datanucleus.store.oracle.SQLController;
import org.datanucleus.store.oracle.adapter.OracleDialect;
import org.datanucleus.store.oracle.exceptions.StatementInvalidException;
import org.datanucleus.store.oracle.identifier.OracleIdentifierResolver;
import org.datanucleus.store.oracle.identifier.TableIdentifier;
import org.datanucleus.store.oracle.sql.OracleSQLTranslator;
import org.datanucleus.store.oracle.sql.SQLText;
import org.datanucleus.store.oracle.types.OracleTypeRegistry;
import org.datanucleus.util.Localiser;
import org.datanucleus.util.NucleusLogger;
import org.datanucleus.util.StringUtils;

/**
 * Handler for reading the schema of an Oracle datastore from the data dictionary (the ALL_* views), as
 * needed to build the schema cache of the ORM. Every call queries the dictionary; nothing is cached.
 * Table references are resolved through {@link OracleIdentifierResolver#describe(String)}, so synonyms
 * and objects of other schemas are supported.
 */
public class OracleSchemaHandler
{
    private static final Pattern CONTEXT_INDEX_PARAMETERS = Pattern.compile("-- add_context_index_parameters (.+)\n");

    private static final Pattern TRAILING_SPACE = Pattern.compile("\\s*$");

    private static final Pattern QUOTED = Pattern.compile("^'(.*)'$", Pattern.DOTALL);

    private static final Pattern NO_DEFAULT = Pattern.compile("^(null|empty_[bc]lob\\(\\))$", Pattern.CASE_INSENSITIVE);

    protected final SQLController sqlController;

    protected final OracleDialect dialect;

    protected final OracleIdentifierResolver identifierResolver;

    protected final OracleTypeRegistry typeRegistry;

    public OracleSchemaHandler(SQLController sqlController, OracleDialect dialect, OracleIdentifierResolver identifierResolver,
            OracleTypeRegistry typeRegistry)
    {
        this.sqlController = sqlController;
        this.dialect = dialect;
        this.identifierResolver = identifierResolver;
        this.typeRegistry = typeRegistry;
    }

    /**
     * Accessor for the columns of a table (or view), in column order. Hidden columns are excluded.
     * @param tableName The table reference
     * @return The columns
     */
    public List<OracleColumnInfo> getColumns(String tableName)
    {
        TableIdentifier ident = identifierResolver.describe(tableName);
        String dbLink = ident.getDbLink();

        SQLText stmt = new SQLText("SELECT cols.column_name AS name, cols.data_type AS sql_type,");
        stmt.append(" cols.data_default, cols.nullable, cols.virtual_column, cols.hidden_column,");
        stmt.append(" cols.data_type_owner AS sql_type_owner,");
        stmt.append(" DECODE(cols.data_type, 'NUMBER', data_precision, 'FLOAT', data_precision,");
        stmt.append(" 'VARCHAR2', DECODE(char_used, 'C', char_length, data_length),");
        stmt.append(" 'RAW', DECODE(char_used, 'C', char_length, data_length),");
        stmt.append(" 'CHAR', DECODE(char_used, 'C', char_length, data_length), NULL) AS limit,");
        stmt.append(" DECODE(data_type, 'NUMBER', data_scale, NULL) AS scale,");
        stmt.append(" comments.comments AS column_comment");
        stmt.append(" FROM all_tab_cols").append(dbLink).append(" cols, all_col_comments").append(dbLink).append(" comments");
        stmt.append(" WHERE cols.owner = ").appendParameter("owner", ident.getOwner());
        stmt.append(" AND cols.table_name = ").appendParameter("table_name", ident.getName());
        stmt.append(" AND cols.hidden_column = 'NO'");
        stmt.append(" AND cols.owner = comments.owner AND cols.table_name = comments.table_name");
        stmt.append(" AND cols.column_name = comments.column_name");
        stmt.append(" ORDER BY cols.column_id");

        List<OracleColumnInfo> columns = new ArrayList<>();
        for (Map<String, Object> row : sqlController.selectAll(stmt, "Column definitions"))
        {
            columns.add(newColumnInfo(tableName, row));
        }
        return columns;
    }

    /**
     * Create the column information for a row of the column definitions query.
     * @param tableName The table reference
     * @param row The row
     * @return The column information
     */
    protected OracleColumnInfo newColumnInfo(String tableName, Map<String, Object> row)
    {
        Integer limit = toInteger(row.get("limit"));
        Integer scale = toInteger(row.get("scale"));
        String sqlType = (String)row.get("sql_type");
        if (limit != null || scale != null)
        {
            int scaleValue = scale != null ? scale.intValue() : 0;
            sqlType += "(" + (limit != null ? limit.intValue() : 38) + (scaleValue > 0 ? "," + scaleValue + ")" : ")");
        }
        String sqlTypeOwner = (String)row.get("sql_type_owner");
        if (sqlTypeOwner != null)
        {
            sqlType = sqlTypeOwner + "." + sqlType;
        }

        boolean virtual = "YES".equals(row.get("virtual_column"));
        Object defaultValue = null;
        if (!virtual)
        {
            defaultValue = OracleSQLTranslator.extractValueFromDefault(cleanDefault((String)row.get("data_default")));
        }

        return new OracleColumnInfo(tableName, OracleIdentifierResolver.oracleDowncase((String)row.get("name")), sqlType,
            "Y".equals(row.get("nullable")), defaultValue, virtual, limit, scale, sqlTypeOwner,
            (String)row.get("column_comment"), typeRegistry.resolve(sqlType));
    }

    /**
     * Clean up a default as stored by Oracle : trailing white space and the quotes of string literals are
     * removed, and "null" or empty LOB defaults mean there is no default. With booleans emulated by strings
     * a default of "N" is false.
     * @param dataDefault The default in the dictionary
     * @return The default, or null
     */
    protected Object cleanDefault(String dataDefault)
    {
        if (dataDefault == null)
        {
            return null;
        }
        String value = TRAILING_SPACE.matcher(dataDefault).replaceFirst("");
        Matcher quoted = QUOTED.matcher(value);
        if (quoted.matches())
        {
            value = quoted.group(1);
        }
        if (NO_DEFAULT.matcher(value).matches())
        {
            return null;
        }
        if ("N".equals(value) && dialect.getConfiguration().isEmulateBooleansFromStrings())
        {
            return Boolean.FALSE;
        }
        return value;
    }

    /**
     * Accessor for the indexes of a table, excluding the index of its primary key.
     * @param tableName The table reference
     * @return The indexes, ordered by name
     */
    public List<OracleIndexInfo> getIndexes(String tableName)
    {
        TableIdentifier ident = identifierResolver.describe(tableName);
        String owner = ident.getOwner();
        String dbLink = ident.getDbLink();
        String defaultTablespace = getDefaultTablespace();

        SQLText stmt = new SQLText("SELECT LOWER(i.table_name) AS table_name, LOWER(i.index_name) AS index_name, i.uniqueness,");
        stmt.append(" i.index_type, i.ityp_owner, i.ityp_name, i.parameters,");
        stmt.append(" LOWER(i.tablespace_name) AS tablespace_name,");
        stmt.append(" LOWER(c.column_name) AS column_name, e.column_expression, atc.virtual_column");
        stmt.append(" FROM all_indexes").append(dbLink).append(" i");
        stmt.append(" JOIN all_ind_columns").append(dbLink).append(" c ON c.index_name = i.index_name AND c.index_owner = i.owner");
        stmt.append(" LEFT OUTER JOIN all_ind_expressions").append(dbLink).append(" e ON e.index_name = i.index_name");
        stmt.append(" AND e.index_owner = i.owner AND e.column_position = c.column_position");
        stmt.append(" LEFT OUTER JOIN all_tab_cols").append(dbLink).append(" atc ON i.table_name = atc.table_name");
        stmt.append(" AND c.column_name = atc.column_name AND i.owner = atc.owner AND atc.hidden_column = 'NO'");
        stmt.append(" WHERE i.owner = ").appendParameter("owner", owner);
        stmt.append(" AND i.table_owner = ").appendParameter("owner", owner);
        stmt.append(" AND NOT EXISTS (SELECT uc.index_name FROM all_constraints uc");
        stmt.append(" WHERE uc.index_name = i.index_name AND uc.owner = i.owner AND uc.constraint_type = 'P')");
        stmt.append(" ORDER BY i.index_name, c.column_position");

        // One row per index column, so group the rows of each index
        List<OracleIndexInfo> allIndexes = new ArrayList<>();
        OracleIndexInfo current = null;
        for (Map<String, Object> row : sqlController.selectAll(stmt, "indexes"))
        {
            String indexName = (String)row.get("index_name");
            if (current == null || !current.getIndexName().equals(indexName))
            {
                String indexType = (String)row.get("index_type");
                String itypOwner = (String)row.get("ityp_owner");
                String itypName = (String)row.get("ityp_name");
                String statementParameters = null;
                if ("DOMAIN".equals(indexType) && "CTXSYS".equals(itypOwner) && "CONTEXT".equals(itypName))
                {
                    statementParameters = getContextIndexParameters(owner, dbLink, indexName);
                }

                String tablespace = (String)row.get("tablespace_name");
                current = new OracleIndexInfo((String)row.get("table_name"), indexName, "UNIQUE".equals(row.get("uniqueness")),
                    "DOMAIN".equals(indexType) ? itypOwner + "." + itypName : null, (String)row.get("parameters"),
                    statementParameters, tablespace != null && tablespace.equals(defaultTablespace) ? null : tablespace);
                allIndexes.add(current);
            }

            // Function-based indexes on virtual columns must be recreated using the column, not its expression
            String expression = (String)row.get("column_expression");
            if (expression != null && !"YES".equals(row.get("virtual_column")))
            {
                current.addColumn(expression);
            }
            else
            {
                current.addColumn(((String)row.get("column_name")).toLowerCase(Locale.ENGLISH));
            }
        }

        String requestedTable = ident.getName().toLowerCase(Locale.ENGLISH);
        List<OracleIndexInfo> indexes = new ArrayList<>();
        for (OracleIndexInfo index : allIndexes)
        {
            if (requestedTable.equals(index.getTableName()))
            {
                indexes.add(index);
            }
        }
        if (NucleusLogger.DATASTORE_SCHEMA.isDebugEnabled())
        {
            NucleusLogger.DATASTORE_SCHEMA.debug(Localiser.msg("059016", indexes.size(), tableName));
        }
        return indexes;
    }

    /**
     * Read the parameters of an Oracle Text context index, recorded as a comment in the source of its
     * datastore procedure.
     */
    protected String getContextIndexParameters(String owner, String dbLink, String indexName)
    {
        String procedureName = dialect.getDefaultDatastoreProcedure(indexName).toUpperCase(Locale.ENGLISH);
        SQLText stmt = new SQLText("SELECT text FROM all_source");
        stmt.append(dbLink);
        stmt.append(" WHERE owner = ").appendParameter("owner", owner);
        stmt.append(" AND name = ").appendParameter("procedure_name", procedureName);
        stmt.append(" ORDER BY line");

        StringBuilder source = new StringBuilder();
        for (Object line : sqlController.selectValues(stmt, "procedure"))
        {
            if (line != null)
            {
                source.append(line);
            }
        }
        Matcher m = CONTEXT_INDEX_PARAMETERS.matcher(source);
        return m.find() ? m.group(1) : null;
    }

    /**
     * Accessor for the primary key and its sequence, for tables with a single column primary key.
     * The sequence is the one of the default name ("&lt;table&gt;_seq"), when it exists.
     * @param tableName The table reference
     * @return The binding, or null if the table has no primary key or a composite one
     */
    public SequenceBinding getPkAndSequence(String tableName)
    {
        return getPkAndSequence(tableName, identifierResolver.describe(tableName));
    }

    /**
     * Accessor for the primary key and its sequence, for an already described table.
     * @param tableName The table reference
     * @param ident The described table
     * @return The binding, or null if the table has no primary key or a composite one
     */
    public SequenceBinding getPkAndSequence(String tableName, TableIdentifier ident)
    {
        String dbLink = ident.getDbLink();
        SQLText seqStmt = new SQLText("SELECT us.sequence_name FROM all_sequences");
        seqStmt.append(dbLink).append(" us WHERE us.sequence_owner = ").appendParameter("owner", ident.getOwner());
        seqStmt.append(" AND us.sequence_name = ").appendParameter("sequence_name",
            dialect.getDefaultSequenceName(ident.getName()).toUpperCase(Locale.ENGLISH));
        List<Object> seqs = sqlController.selectValues(seqStmt, "Sequence");

        List<String> pks = selectPrimaryKeyColumns(ident, false);
        if (pks.size() > 1)
        {
            NucleusLogger.DATASTORE_SCHEMA.warn(Localiser.msg("059003", tableName, StringUtils.collectionToString(pks)));
        }
        if (pks.size() != 1)
        {
            return null;
        }
        return new SequenceBinding(OracleIdentifierResolver.oracleDowncase(pks.get(0)),
            seqs.isEmpty() ? null : OracleIdentifierResolver.oracleDowncase((String)seqs.get(0)));
    }

    /**
     * Accessor for the primary key column of a table.
     * @param tableName The table reference
     * @return The column, or null if there is no single column primary key
     */
    public String getPrimaryKey(String tableName)
    {
        SequenceBinding binding = getPkAndSequence(tableName);
        return binding != null ? binding.getPrimaryKey() : null;
    }

    /**
     * Accessor for all columns of the primary key of a table, in key order.
     * @param tableName The table reference
     * @return The columns (empty if no primary key)
     */
    public List<String> getPrimaryKeys(String tableName)
    {
        List<String> pks = new ArrayList<>();
        for (String pk : selectPrimaryKeyColumns(identifierResolver.describe(tableName), true))
        {
            pks.add(OracleIdentifierResolver.oracleDowncase(pk));
        }
        return pks;
    }

    private List<String> selectPrimaryKeyColumns(TableIdentifier ident, boolean ordered)
    {
        String dbLink = ident.getDbLink();
        SQLText stmt = new SQLText("SELECT cc.column_name FROM all_constraints");
        stmt.append(dbLink).append(" c, all_cons_columns").append(dbLink).append(" cc");
        stmt.append(" WHERE c.owner = ").appendParameter("owner", ident.getOwner());
        stmt.append(" AND c.table_name = ").appendParameter("table_name", ident.getName());
        stmt.append(" AND c.constraint_type = 'P' AND cc.owner = c.owner AND cc.constraint_name = c.constraint_name");
        if (ordered)
        {
            stmt.append(" ORDER BY cc.position");
        }

        List<String> columns = new ArrayList<>();
        for (Object value : sqlController.selectValues(stmt, ordered ? "Primary Keys" : "Primary Key"))
        {
            columns.add((String)value);
        }
        return columns;
    }

    /**
     * Whether the table has an enabled trigger of the default name ("&lt;table&gt;_pkt") populating its key.
     * @param tableName The table reference
     * @return Whether there is such a trigger
     */
    public boolean hasPrimaryKeyTrigger(String tableName)
    {
        return hasPrimaryKeyTrigger(tableName, identifierResolver.describe(tableName));
    }

    public boolean hasPrimaryKeyTrigger(String tableName, TableIdentifier ident)
    {
        String triggerName = dialect.getDefaultTriggerName(tableName).toUpperCase(Locale.ENGLISH);
        SQLText stmt = new SQLText("SELECT trigger_name FROM all_triggers");
        stmt.append(ident.getDbLink());
        stmt.append(" WHERE owner = ").appendParameter("owner", ident.getOwner());
        stmt.append(" AND trigger_name = ").appendParameter("trigger_name", triggerName);
        stmt.append(" AND table_owner = ").appendParameter("owner", ident.getOwner());
        stmt.append(" AND table_name = ").appendParameter("table_name", ident.getName());
        stmt.append(" AND status = 'ENABLED'");
        if (sqlController.selectValue(stmt, "Primary Key Trigger") != null)
        {
            if (NucleusLogger.DATASTORE_SCHEMA.isDebugEnabled())
            {
                NucleusLogger.DATASTORE_SCHEMA.debug(Localiser.msg("059017", tableName, triggerName));
            }
            return true;
        }
        return false;
    }

    /**
     * Accessor for the synonyms owned by the session user.
     * @return The synonyms, with names presented as for tables
     */
    public List<SynonymInfo> getSynonyms()
    {
        SQLText stmt = new SQLText("SELECT synonym_name, table_owner, table_name, db_link FROM all_synonyms");
        stmt.append(" WHERE owner = SYS_CONTEXT('userenv', 'session_user')");
        List<SynonymInfo> synonyms = new ArrayList<>();
        for (Map<String, Object> row : sqlController.selectAll(stmt, "SCHEMA"))
        {
            synonyms.add(new SynonymInfo(OracleIdentifierResolver.oracleDowncase((String)row.get("synonym_name")),
                OracleIdentifierResolver.oracleDowncase((String)row.get("table_owner")),
                OracleIdentifierResolver.oracleDowncase((String)row.get("table_name")),
                OracleIdentifierResolver.oracleDowncase((String)row.get("db_link"))));
        }
        return synonyms;
    }

    /**
     * Accessor for the tables of the current schema (excluding secondary tables of domain indexes).
     * @return The table names
     */
    public List<String> getTables()
    {
        return selectStrings("SELECT DECODE(table_name, UPPER(table_name), LOWER(table_name), table_name)" +
            " FROM all_tables WHERE owner = SYS_CONTEXT('userenv', 'current_schema') AND secondary = 'N'");
    }

    public List<String> getViews()
    {
        return selectStrings("SELECT LOWER(view_name) FROM all_views WHERE owner = SYS_CONTEXT('userenv', 'current_schema')");
    }

    public List<String> getMaterializedViews()
    {
        return selectStrings("SELECT LOWER(mview_name) FROM all_mviews WHERE owner = SYS_CONTEXT('userenv', 'current_schema')");
    }

    /**
     * Accessor for everything that can be selected from : tables, views and synonyms.
     * @return The names, without duplicates
     */
    public List<String> getDataSources()
    {
        Set<String> names = new LinkedHashSet<>(getTables());
        names.addAll(getViews());
        for (SynonymInfo synonym : getSynonyms())
        {
            names.add(synonym.getName());
        }
        return new ArrayList<>(names);
    }

    private List<String> selectStrings(String sql)
    {
        List<String> names = new ArrayList<>();
        for (Object value : sqlController.selectValues(new SQLText(sql), "SCHEMA"))
        {
            names.add((String)value);
        }
        return names;
    }

    /**
     * Whether a table of that name exists. References over a database link are never tables.
     * @param tableName The table reference
     * @return Whether it exists
     */
    public boolean tableExists(String tableName)
    {
        if (tableName.indexOf('@') >= 0)
        {
            return false;
        }

        TableIdentifier ident = identifierResolver.resolve(tableName);
        SQLText stmt = new SQLText("SELECT owner, table_name FROM all_tables WHERE owner = ");
        stmt.appendParameter("owner", ident.getOwner());
        stmt.append(" AND table_name = ").appendParameter("table_name", ident.getName());
        return !sqlController.selectValues(stmt, "SCHEMA").isEmpty();
    }

    /**
     * Whether the reference resolves to a table, view or synonym. Any failure to resolve it means it doesn't.
     * @param tableName The table reference
     * @return Whether it exists
     */
    public boolean dataSourceExists(String tableName)
    {
        try
        {
            identifierResolver.describe(tableName);
            return true;
        }
        catch (RuntimeException e)
        {
            NucleusLogger.DATASTORE_SCHEMA.debug(Localiser.msg("059014", tableName, e.getMessage()));
            return false;
        }
    }

    /**
     * Whether the table (of the session user) is a global temporary table.
     * @param tableName The table name
     * @return Whether temporary
     */
    public boolean isTemporaryTable(String tableName)
    {
        SQLText stmt = new SQLText("SELECT temporary FROM all_tables WHERE table_name = ");
        stmt.appendParameter("table_name", tableName.toUpperCase(Locale.ENGLISH));
        stmt.append(" AND owner = SYS_CONTEXT('userenv', 'session_user')");
        return "Y".equals(sqlController.selectString(stmt, "temp tables"));
    }

    /**
     * Accessor for the default tablespace of the current schema.
     * @return The tablespace (lower case)
     */
    public String getDefaultTablespace()
    {
        return sqlController.selectString(new SQLText("SELECT LOWER(default_tablespace) FROM user_users" +
            " WHERE username = SYS_CONTEXT('userenv', 'current_schema')"), "SCHEMA");
    }

    public String getCurrentSchema()
    {
        return identifierResolver.getCurrentSchema();
    }

    public String getCurrentUser()
    {
        return sqlController.selectString(new SQLText("SELECT SYS_CONTEXT('userenv', 'session_user') FROM dual"), "SCHEMA");
    }

    /**
     * Accessor for the name of the database. This is the container name for pluggable databases, and the
     * database name for servers that don't know about containers.
     * @return The database name
     */
    public String getCurrentDatabase()
    {
        try
        {
            return sqlController.selectString(new SQLText("SELECT SYS_CONTEXT('userenv', 'con_name') FROM dual"), "SCHEMA");
        }
        catch (StatementInvalidException sie)
        {
            NucleusLogger.DATASTORE_SCHEMA.debug(Localiser.msg("059013", sie.getMessage()));
            return sqlController.selectString(new SQLText("SELECT SYS_CONTEXT('userenv', 'db_name') FROM dual"), "SCHEMA");
        }
    }

    private static Integer toInteger(Object value)
    {
        if (value == null)
        {
            return null;
        }
        if (value instanceof Number)
        {
            return Integer.valueOf(((Number)value).intValue());
        }
        return Integer.valueOf(value.toString().trim());
    }
}
