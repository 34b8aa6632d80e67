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

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;

import junit.framework.TestCase;

import org.datanucleus.exceptions.NucleusUserException;
import org.datanucleus.store.oracle.OracleAdapterConfiguration;
import org.datanucleus.store.oracle.TablespaceType;
import org.datanucleus.store.oracle.adapter.OracleDialect;
import org.datanucleus.store.oracle.types.ColumnType;
import org.datanucleus.store.oracle.types.OracleTypeRegistry;

/**
 * Tests for the Oracle specific SQL generated by the translator.
 */
public class OracleSQLTranslatorTest extends TestCase
{
    private static OracleSQLTranslator translator(int majorVersion, Properties props)
    {
        OracleAdapterConfiguration config = new OracleAdapterConfiguration(props);
        return new OracleSQLTranslator(new OracleDialect(majorVersion, 0, config), new OracleTypeRegistry(config).getNativeDatabaseTypes());
    }

    private static OracleSQLTranslator translator(int majorVersion)
    {
        return translator(majorVersion, new Properties());
    }

    public void testRangeWithRownum()
    {
        SQLText query = new SQLText("SELECT id FROM employees ORDER BY id");
        assertEquals("SELECT * FROM (SELECT raw_sql_.*, ROWNUM raw_rnum_ FROM (SELECT id FROM employees ORDER BY id) raw_sql_" +
            " WHERE ROWNUM <= 30) WHERE raw_rnum_ > 20", translator(11).applyRange(query, 20L, 10L).toSQL());
    }

    public void testRownumRangeSaturatesAtLongMax()
    {
        String sql = translator(11).applyRange(new SQLText("SELECT id FROM employees"), 10L, Long.MAX_VALUE).toSQL();
        assertTrue(sql, sql.contains("ROWNUM <= " + Long.MAX_VALUE + ")"));
        assertTrue(sql, sql.endsWith("WHERE raw_rnum_ > 10"));
    }

    public void testLimitWithRownum()
    {
        SQLText query = new SQLText("SELECT id FROM employees");
        assertEquals("SELECT * FROM (SELECT id FROM employees) WHERE ROWNUM <= 5", translator(11).applyRange(query, null, 5L).toSQL());
    }

    public void testOffsetWithRownum()
    {
        SQLText query = new SQLText("SELECT id FROM employees");
        assertEquals("SELECT * FROM (SELECT raw_sql_.*, ROWNUM raw_rnum_ FROM (SELECT id FROM employees) raw_sql_) WHERE raw_rnum_ > 5",
            translator(11).applyRange(query, 5L, null).toSQL());
    }

    public void testRangeWithFetchFirst()
    {
        SQLText query = new SQLText("SELECT id FROM employees ORDER BY id");
        assertEquals("SELECT id FROM employees ORDER BY id OFFSET 20 ROWS FETCH NEXT 10 ROWS ONLY",
            translator(12).applyRange(query, 20L, 10L).toSQL());
        assertEquals("SELECT id FROM employees ORDER BY id FETCH NEXT 10 ROWS ONLY",
            translator(19).applyRange(new SQLText("SELECT id FROM employees ORDER BY id"), null, 10L).toSQL());
    }

    public void testOldVisitorUsesRownum()
    {
        Properties props = new Properties();
        props.setProperty("datanucleus.oracle.useOldOracleVisitor", "true");
        String sql = translator(19, props).applyRange(new SQLText("SELECT id FROM employees"), null, 5L).toSQL();
        assertEquals("SELECT * FROM (SELECT id FROM employees) WHERE ROWNUM <= 5", sql);
    }

    public void testRangeKeepsParameters()
    {
        SQLText query = new SQLText("SELECT id FROM employees WHERE dept_id = ");
        query.appendParameter("dept_id", Long.valueOf(7));
        SQLText ranged = translator(11).applyRange(query, 0L, 10L);
        assertTrue(ranged.toSQL().contains("dept_id = ?"));
        assertEquals(1, ranged.getParametersForStatement().size());
    }

    public void testNoRange()
    {
        SQLText query = new SQLText("SELECT id FROM employees");
        assertSame(query, translator(19).applyRange(query, null, null));
    }

    public void testNegativeRangeRejected()
    {
        try
        {
            translator(19).applyRange(new SQLText("SELECT 1 FROM dual"), -1L, 10L);
            fail("Expected NucleusUserException");
        }
        catch (NucleusUserException nue)
        {
            // expected
        }
    }

    public void testColumnsForDistinct()
    {
        OracleSQLTranslator translator = translator(19);
        assertEquals("a, FIRST_VALUE(b) OVER (PARTITION BY a ORDER BY b) AS alias_0__",
            translator.columnsForDistinct("a", Collections.singletonList("b DESC")));
        assertEquals("a, c, FIRST_VALUE(b) OVER (PARTITION BY a, c ORDER BY b) AS alias_0__," +
            " FIRST_VALUE(d) OVER (PARTITION BY a, c ORDER BY d) AS alias_1__",
            translator.columnsForDistinct("a, c", Arrays.asList("b asc", "  ", "d")));
        assertEquals("a", translator.columnsForDistinct("a", Collections.<String>emptyList()));
    }

    public void testExtractValueFromDefault()
    {
        assertEquals("O'Brien", OracleSQLTranslator.extractValueFromDefault("O''Brien"));
        assertEquals(Integer.valueOf(5), OracleSQLTranslator.extractValueFromDefault(Integer.valueOf(5)));
        assertEquals(Boolean.FALSE, OracleSQLTranslator.extractValueFromDefault(Boolean.FALSE));
        assertNull(OracleSQLTranslator.extractValueFromDefault(null));
    }

    public void testTablespaces()
    {
        Properties props = new Properties();
        props.setProperty("datanucleus.oracle.defaultTablespace.table", "data_tbs");
        props.setProperty("datanucleus.oracle.defaultTablespace.index", "idx_tbs");
        props.setProperty("datanucleus.oracle.defaultTablespace.clob", "lob_tbs");
        OracleSQLTranslator translator = translator(19, props);

        assertEquals("CREATE TABLE t (id NUMBER(38)) TABLESPACE data_tbs",
            translator.addTablespace("CREATE TABLE t (id NUMBER(38))", TablespaceType.TABLE, null));
        assertEquals("CREATE INDEX i ON t (a) TABLESPACE other",
            translator.addTablespace("CREATE INDEX i ON t (a)", TablespaceType.INDEX, "other"));
        assertEquals("CREATE INDEX i ON t (a) TABLESPACE mine",
            translator.addTablespace("CREATE INDEX i ON t (a) TABLESPACE mine", TablespaceType.INDEX, null));
        assertEquals("", translator.tablespaceClause(TablespaceType.BLOB, null));

        Map<String, ColumnType> columns = new LinkedHashMap<>();
        columns.put("id", ColumnType.INTEGER);
        columns.put("notes", ColumnType.TEXT);
        columns.put("photo", ColumnType.BINARY);
        assertEquals(" LOB (\"NOTES\") STORE AS (TABLESPACE lob_tbs)", translator.lobStorageClauses(columns));
    }

    public void testTypeToSql()
    {
        OracleSQLTranslator translator = translator(19);
        assertEquals("VARCHAR2(255)", translator.typeToSql(ColumnType.STRING, null, null, null));
        assertEquals("VARCHAR2(40)", translator.typeToSql(ColumnType.STRING, 40, null, null));
        assertEquals("NUMBER(38)", translator.typeToSql(ColumnType.INTEGER, null, null, null));
        assertEquals("NUMBER(10)", translator.typeToSql(ColumnType.INTEGER, null, 10, null));
        assertEquals("DECIMAL(10,2)", translator.typeToSql(ColumnType.DECIMAL, null, 10, 2));
        assertEquals("DECIMAL", translator.typeToSql(ColumnType.DECIMAL, null, null, null));
        assertEquals("TIMESTAMP(3) WITH TIME ZONE", translator.typeToSql(ColumnType.TIMESTAMPTZ, null, 3, null));
        assertEquals("TIMESTAMP", translator.typeToSql(ColumnType.DATETIME, null, null, null));
        assertEquals("CLOB", translator.typeToSql(ColumnType.TEXT, null, null, null));
        assertEquals("NUMBER(1)", translator.typeToSql(ColumnType.BOOLEAN, null, null, null));
        assertEquals("NUMBER(38) NOT NULL PRIMARY KEY", translator.typeToSql(ColumnType.PRIMARY_KEY, null, null, null));
    }

    public void testSequenceStatements()
    {
        OracleSQLTranslator translator = translator(19);
        assertEquals("CREATE SEQUENCE \"EMPLOYEES_SEQ\" START WITH 10000", translator.getSequenceCreateStmt("employees_seq", 10000));
        assertEquals("DROP SEQUENCE \"HR\".\"EMPLOYEES_SEQ\"", translator.getSequenceDropStmt("hr.employees_seq"));
        assertEquals("SELECT \"EMPLOYEES_SEQ\".NEXTVAL FROM dual", translator.getSequenceNextStmt("employees_seq"));
        try
        {
            translator.getSequenceNextStmt(null);
            fail("Expected NucleusUserException");
        }
        catch (NucleusUserException nue)
        {
            // expected
        }
    }
}
