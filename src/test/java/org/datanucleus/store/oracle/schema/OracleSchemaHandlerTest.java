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

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import junit.framework.TestCase;

import org.datanucleus.store.oracle.OracleAdapterConfiguration;
import org.datanucleus.store.oracle.SQLController;
import org.datanucleus.store.oracle.adapter.OracleDialect;
import org.datanucleus.store.oracle.exceptions.MissingObjectException;
import org.datanucleus.store.oracle.exceptions.StatementInvalidException;
import org.datanucleus.store.oracle.identifier.OracleIdentifierResolver;
import org.datanucleus.store.oracle.identifier.TableIdentifier;
import org.datanucleus.store.oracle.sql.SQLText;
import org.datanucleus.store.oracle.types.LogicalTypeKind;
import org.datanucleus.store.oracle.types.OracleTypeRegistry;
import org.mockito.ArgumentMatcher;

/**
 * Tests for reading the schema from the data dictionary, with the dictionary queries stubbed.
 */
public class OracleSchemaHandlerTest extends TestCase
{
    private static final TableIdentifier EMPLOYEES = new TableIdentifier("HR", "EMPLOYEES", "");

    private SQLController sqlController;

    private OracleIdentifierResolver resolver;

    private OracleSchemaHandler handler;

    @Override
    protected void setUp() throws Exception
    {
        super.setUp();
        sqlController = mock(SQLController.class);
        resolver = mock(OracleIdentifierResolver.class);
        when(resolver.describe("employees")).thenReturn(EMPLOYEES);
        handler = createHandler(new OracleAdapterConfiguration());
    }

    /**
     * Runs the key lookup for "employees" and returns the number of WARNING records logged to the schema category.
     */
    private int countSchemaWarnings()
    {
        final List<LogRecord> records = new ArrayList<>();
        Handler collector = new Handler()
        {
            public void publish(LogRecord record)
            {
                records.add(record);
            }

            public void flush()
            {
            }

            public void close()
            {
            }
        };
        Logger logger = Logger.getLogger("DataNucleus.Datastore.Schema");
        logger.addHandler(collector);
        try
        {
            handler.getPkAndSequence("employees");
        }
        finally
        {
            logger.removeHandler(collector);
        }

        int warnings = 0;
        for (LogRecord record : records)
        {
            if (record.getLevel() == Level.WARNING)
            {
                warnings++;
            }
        }
        return warnings;
    }

    private OracleSchemaHandler createHandler(OracleAdapterConfiguration config)
    {
        return new OracleSchemaHandler(sqlController, new OracleDialect(19, 0, config), resolver, new OracleTypeRegistry(config));
    }

    private static Map<String, Object> row(Object... nameValues)
    {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < nameValues.length; i += 2)
        {
            row.put((String)nameValues[i], nameValues[i + 1]);
        }
        return row;
    }

    private static ArgumentMatcher<SQLText> sqlContaining(final String text)
    {
        return new ArgumentMatcher<SQLText>()
        {
            public boolean matches(SQLText stmt)
            {
                return stmt != null && stmt.toSQL().contains(text);
            }
        };
    }

    private static Map<String, Object> indexRow(String index, String column, String tablespace)
    {
        return row("table_name", "employees", "index_name", index, "uniqueness", "NONUNIQUE", "index_type", "NORMAL",
            "ityp_owner", null, "ityp_name", null, "parameters", null, "tablespace_name", tablespace,
            "column_name", column, "column_expression", null, "virtual_column", "NO");
    }

    public void testIndexesGroupedByName()
    {
        List<Map<String, Object>> rows = new ArrayList<>();
        rows.add(indexRow("idx_name", "last_name", "users"));
        rows.add(indexRow("idx_name", "first_name", "users"));
        rows.add(indexRow("idx_name", "middle_name", "users"));
        rows.add(indexRow("idx_salary", "salary", "idx_tbs"));
        rows.add(indexRow("idx_salary", "dept_id", "idx_tbs"));
        when(sqlController.selectAll(any(SQLText.class), eq("indexes"))).thenReturn(rows);
        when(sqlController.selectString(any(SQLText.class), eq("SCHEMA"))).thenReturn("users");

        List<OracleIndexInfo> indexes = handler.getIndexes("employees");
        assertEquals(2, indexes.size());

        OracleIndexInfo first = indexes.get(0);
        assertEquals("idx_name", first.getIndexName());
        assertEquals("employees", first.getTableName());
        assertEquals(Arrays.asList("last_name", "first_name", "middle_name"), first.getColumns());
        assertFalse(first.isUnique());
        assertNull(first.getType());
        assertNull("Default tablespace is not reported", first.getTablespace());

        OracleIndexInfo second = indexes.get(1);
        assertEquals("idx_salary", second.getIndexName());
        assertEquals(Arrays.asList("salary", "dept_id"), second.getColumns());
        assertEquals("idx_tbs", second.getTablespace());

        verify(sqlController, never()).selectValues(any(SQLText.class), eq("procedure"));
    }

    public void testIndexesOfOtherTablesAreFiltered()
    {
        Map<String, Object> other = indexRow("idx_dept", "name", "users");
        other.put("table_name", "departments");
        when(sqlController.selectAll(any(SQLText.class), eq("indexes"))).thenReturn(
            Arrays.asList(indexRow("idx_name", "last_name", "users"), other));

        List<OracleIndexInfo> indexes = handler.getIndexes("employees");
        assertEquals(1, indexes.size());
        assertEquals("idx_name", indexes.get(0).getIndexName());
    }

    public void testFunctionBasedAndVirtualColumnIndexes()
    {
        Map<String, Object> function = indexRow("idx_upper", "sys_nc00005$", null);
        function.put("column_expression", "UPPER(\"LAST_NAME\")");
        function.put("virtual_column", "YES");
        Map<String, Object> functionOnly = indexRow("idx_upper2", "sys_nc00006$", null);
        functionOnly.put("column_expression", "UPPER(\"FIRST_NAME\")");
        functionOnly.put("virtual_column", null);
        function.put("uniqueness", "UNIQUE");
        when(sqlController.selectAll(any(SQLText.class), eq("indexes"))).thenReturn(Arrays.asList(function, functionOnly));

        List<OracleIndexInfo> indexes = handler.getIndexes("employees");
        assertEquals(Collections.singletonList("sys_nc00005$"), indexes.get(0).getColumns());
        assertTrue(indexes.get(0).isUnique());
        assertEquals(Collections.singletonList("UPPER(\"FIRST_NAME\")"), indexes.get(1).getColumns());
    }

    public void testContextIndexParameters()
    {
        Map<String, Object> context = indexRow("idx_text", "description", "users");
        context.put("index_type", "DOMAIN");
        context.put("ityp_owner", "CTXSYS");
        context.put("ityp_name", "CONTEXT");
        context.put("parameters", "DATASTORE idx_text_ds");
        when(sqlController.selectAll(any(SQLText.class), eq("indexes"))).thenReturn(Collections.singletonList(context));
        when(sqlController.selectValues(any(SQLText.class), eq("procedure"))).thenReturn(Arrays.<Object>asList(
            "PROCEDURE idx_text_prc(p_rowid IN ROWID, p_clob IN OUT NOCOPY CLOB) IS\n",
            "  -- add_context_index_parameters , sync(on commit)\n",
            "BEGIN NULL; END;\n"));

        OracleIndexInfo index = handler.getIndexes("employees").get(0);
        assertEquals("CTXSYS.CONTEXT", index.getType());
        assertEquals("DATASTORE idx_text_ds", index.getParameters());
        assertEquals(", sync(on commit)", index.getStatementParameters());
        verify(sqlController).selectValues(argThat(sqlContaining("all_source")), eq("procedure"));
    }

    public void testPkAndSequenceForSingleColumnKey()
    {
        when(sqlController.selectValues(any(SQLText.class), eq("Sequence"))).thenReturn(Arrays.<Object>asList("EMPLOYEES_SEQ"));
        when(sqlController.selectValues(any(SQLText.class), eq("Primary Key"))).thenReturn(Arrays.<Object>asList("ID"));

        SequenceBinding binding = handler.getPkAndSequence("employees");
        assertEquals("id", binding.getPrimaryKey());
        assertEquals("employees_seq", binding.getSequenceName());
        assertTrue(binding.hasSequence());
        assertFalse(binding.isTriggerPopulated());
        assertEquals("employees_seq", binding.getProperty("sequence_name"));
        assertEquals(Boolean.TRUE, binding.withTriggerPopulated().getProperty("trigger_populated"));
        assertEquals("id", handler.getPrimaryKey("employees"));
    }

    public void testPkWithoutSequence()
    {
        when(sqlController.selectValues(any(SQLText.class), eq("Sequence"))).thenReturn(new ArrayList<Object>());
        when(sqlController.selectValues(any(SQLText.class), eq("Primary Key"))).thenReturn(Arrays.<Object>asList("ID"));

        SequenceBinding binding = handler.getPkAndSequence("employees");
        assertEquals("id", binding.getPrimaryKey());
        assertNull(binding.getSequenceName());
        assertFalse(binding.hasSequence());
    }

    public void testCompositeKeyIsIgnored()
    {
        when(sqlController.selectValues(any(SQLText.class), eq("Sequence"))).thenReturn(new ArrayList<Object>());
        when(sqlController.selectValues(any(SQLText.class), eq("Primary Key"))).thenReturn(Arrays.<Object>asList("DEPT_ID", "EMP_NO"));

        assertNull(handler.getPkAndSequence("employees"));
        assertNull(handler.getPrimaryKey("employees"));
    }

    public void testCompositeKeyLogsOneWarning()
    {
        when(sqlController.selectValues(any(SQLText.class), eq("Sequence"))).thenReturn(new ArrayList<Object>());
        when(sqlController.selectValues(any(SQLText.class), eq("Primary Key"))).thenReturn(Arrays.<Object>asList("DEPT_ID", "EMP_NO"));

        assertEquals(1, countSchemaWarnings());
    }

    public void testSingleColumnKeyLogsNoWarning()
    {
        when(sqlController.selectValues(any(SQLText.class), eq("Sequence"))).thenReturn(Arrays.<Object>asList("EMPLOYEES_SEQ"));
        when(sqlController.selectValues(any(SQLText.class), eq("Primary Key"))).thenReturn(Arrays.<Object>asList("ID"));

        assertEquals(0, countSchemaWarnings());
    }

    public void testNoKey()
    {
        when(sqlController.selectValues(any(SQLText.class), anyString())).thenReturn(new ArrayList<Object>());
        assertNull(handler.getPkAndSequence("employees"));
    }

    public void testPrimaryKeysInOrder()
    {
        when(sqlController.selectValues(argThat(sqlContaining("ORDER BY cc.position")), eq("Primary Keys")))
            .thenReturn(Arrays.<Object>asList("DEPT_ID", "EMP_NO"));
        assertEquals(Arrays.asList("dept_id", "emp_no"), handler.getPrimaryKeys("employees"));
    }

    public void testColumns()
    {
        List<Map<String, Object>> rows = new ArrayList<>();
        rows.add(row("name", "ID", "sql_type", "NUMBER", "data_default", null, "nullable", "N", "virtual_column", "NO",
            "hidden_column", "NO", "sql_type_owner", null, "limit", null, "scale", new BigDecimal(0), "column_comment", null));
        rows.add(row("name", "SALARY", "sql_type", "NUMBER", "data_default", "0 ", "nullable", "Y", "virtual_column", "NO",
            "hidden_column", "NO", "sql_type_owner", null, "limit", new BigDecimal(10), "scale", new BigDecimal(2), "column_comment", "Monthly"));
        rows.add(row("name", "LAST_NAME", "sql_type", "VARCHAR2", "data_default", "'O''Brien'  \n", "nullable", "Y",
            "virtual_column", "NO", "hidden_column", "NO", "sql_type_owner", null, "limit", new BigDecimal(50), "scale", null,
            "column_comment", null));
        rows.add(row("name", "NOTES", "sql_type", "CLOB", "data_default", "empty_clob() ", "nullable", "Y", "virtual_column", "NO",
            "hidden_column", "NO", "sql_type_owner", null, "limit", null, "scale", null, "column_comment", null));
        rows.add(row("name", "FULL_NAME", "sql_type", "VARCHAR2", "data_default", "\"FIRST_NAME\"||' '||\"LAST_NAME\"",
            "nullable", "Y", "virtual_column", "YES", "hidden_column", "NO", "sql_type_owner", null, "limit", new BigDecimal(101),
            "scale", null, "column_comment", null));
        rows.add(row("name", "Location", "sql_type", "SDO_GEOMETRY", "data_default", "NULL", "nullable", "Y", "virtual_column", "NO",
            "hidden_column", "NO", "sql_type_owner", "MDSYS", "limit", null, "scale", null, "column_comment", null));
        when(sqlController.selectAll(any(SQLText.class), eq("Column definitions"))).thenReturn(rows);

        List<OracleColumnInfo> columns = handler.getColumns("employees");
        assertEquals(6, columns.size());

        OracleColumnInfo id = columns.get(0);
        assertEquals("id", id.getColumnName());
        assertEquals("NUMBER(38)", id.getSqlType());
        assertFalse(id.isNullable());
        assertNull(id.getDefaultValue());
        assertEquals(LogicalTypeKind.INTEGER, id.getLogicalType().getKind());

        OracleColumnInfo salary = columns.get(1);
        assertEquals("NUMBER(10,2)", salary.getSqlType());
        assertEquals("0", salary.getDefaultValue());
        assertEquals("Monthly", salary.getComment());
        assertEquals(LogicalTypeKind.DECIMAL, salary.getLogicalType().getKind());
        assertEquals(Integer.valueOf(10), salary.getPrecision());

        OracleColumnInfo lastName = columns.get(2);
        assertEquals("VARCHAR2(50)", lastName.getSqlType());
        assertEquals("O'Brien", lastName.getDefaultValue());

        assertNull(columns.get(3).getDefaultValue());

        OracleColumnInfo fullName = columns.get(4);
        assertTrue(fullName.isVirtual());
        assertNull(fullName.getDefaultValue());

        OracleColumnInfo location = columns.get(5);
        assertEquals("Location", location.getColumnName());
        assertEquals("MDSYS.SDO_GEOMETRY", location.getSqlType());
        assertNull(location.getDefaultValue());
        assertEquals(LogicalTypeKind.VALUE, location.getLogicalType().getKind());
    }

    public void testBooleanStringDefault()
    {
        Properties props = new Properties();
        props.setProperty("datanucleus.oracle.emulateBooleansFromStrings", "true");
        handler = createHandler(new OracleAdapterConfiguration(props));
        when(sqlController.selectAll(any(SQLText.class), eq("Column definitions"))).thenReturn(Collections.singletonList(
            row("name", "ACTIVE", "sql_type", "VARCHAR2", "data_default", "'N'", "nullable", "Y", "virtual_column", "NO",
                "hidden_column", "NO", "sql_type_owner", null, "limit", new BigDecimal(1), "scale", null, "column_comment", null)));

        OracleColumnInfo active = handler.getColumns("employees").get(0);
        assertEquals(Boolean.FALSE, active.getDefaultValue());
        assertEquals(LogicalTypeKind.BOOLEAN, active.getLogicalType().getKind());
    }

    public void testHasPrimaryKeyTrigger()
    {
        when(sqlController.selectValue(argThat(sqlContaining("all_triggers")), eq("Primary Key Trigger"))).thenReturn("EMPLOYEES_PKT");
        assertTrue(handler.hasPrimaryKeyTrigger("employees"));

        when(sqlController.selectValue(any(SQLText.class), eq("Primary Key Trigger"))).thenReturn(null);
        assertFalse(handler.hasPrimaryKeyTrigger("employees"));
    }

    public void testTriggerNameIsBound()
    {
        when(sqlController.selectValue(any(SQLText.class), eq("Primary Key Trigger"))).thenReturn(null);
        handler.hasPrimaryKeyTrigger("employees");
        verify(sqlController).selectValue(argThat(new ArgumentMatcher<SQLText>()
        {
            public boolean matches(SQLText stmt)
            {
                stmt.toSQL();
                return "EMPLOYEES_PKT".equals(stmt.getParametersForStatement().get(1).getValue());
            }
        }), eq("Primary Key Trigger"));
    }

    public void testSynonyms()
    {
        when(sqlController.selectAll(argThat(sqlContaining("all_synonyms")), eq("SCHEMA"))).thenReturn(Collections.singletonList(
            row("synonym_name", "EMPS", "table_owner", "HR", "table_name", "EMPLOYEES", "db_link", null)));

        List<SynonymInfo> synonyms = handler.getSynonyms();
        assertEquals(1, synonyms.size());
        assertEquals("emps", synonyms.get(0).getName());
        assertEquals("hr", synonyms.get(0).getTableOwner());
        assertEquals("employees", synonyms.get(0).getTableName());
        assertNull(synonyms.get(0).getDbLink());
    }

    public void testDataSources()
    {
        when(sqlController.selectValues(argThat(sqlContaining("all_tables")), eq("SCHEMA"))).thenReturn(Arrays.<Object>asList("employees", "MixedCase"));
        when(sqlController.selectValues(argThat(sqlContaining("all_views")), eq("SCHEMA"))).thenReturn(Arrays.<Object>asList("emp_view"));
        when(sqlController.selectAll(argThat(sqlContaining("all_synonyms")), eq("SCHEMA"))).thenReturn(Collections.singletonList(
            row("synonym_name", "EMPLOYEES", "table_owner", "HR", "table_name", "EMPLOYEES", "db_link", null)));

        assertEquals(Arrays.asList("employees", "MixedCase", "emp_view"), handler.getDataSources());
    }

    public void testTableExists()
    {
        when(resolver.resolve("employees")).thenReturn(EMPLOYEES);
        when(sqlController.selectValues(argThat(sqlContaining("all_tables")), eq("SCHEMA"))).thenReturn(Arrays.<Object>asList("HR"));
        assertTrue(handler.tableExists("employees"));
        assertFalse(handler.tableExists("employees@remote"));
        verify(resolver, never()).resolve("employees@remote");
    }

    public void testDataSourceExists()
    {
        when(resolver.describe("missing")).thenThrow(new MissingObjectException("HR", "MISSING"));
        assertTrue(handler.dataSourceExists("employees"));
        assertFalse(handler.dataSourceExists("missing"));
    }

    public void testTemporaryTable()
    {
        when(sqlController.selectString(any(SQLText.class), eq("temp tables"))).thenReturn("Y");
        assertTrue(handler.isTemporaryTable("session_data"));
        when(sqlController.selectString(any(SQLText.class), eq("temp tables"))).thenReturn("N");
        assertFalse(handler.isTemporaryTable("employees"));
    }

    public void testCurrentDatabaseFallsBackToDbName()
    {
        when(sqlController.selectString(argThat(sqlContaining("con_name")), eq("SCHEMA")))
            .thenThrow(new StatementInvalidException("ORA-02003: invalid USERENV parameter"));
        when(sqlController.selectString(argThat(sqlContaining("db_name")), eq("SCHEMA"))).thenReturn("ORCL");
        assertEquals("ORCL", handler.getCurrentDatabase());
    }

    public void testCurrentDatabase()
    {
        when(sqlController.selectString(argThat(sqlContaining("con_name")), eq("SCHEMA"))).thenReturn("PDB1");
        assertEquals("PDB1", handler.getCurrentDatabase());
    }
}
