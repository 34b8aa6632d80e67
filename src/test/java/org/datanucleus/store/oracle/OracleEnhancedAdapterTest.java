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
package org.datanucleus.store.oracle;

import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import junit.framework.TestCase;

import org.datanucleus.exceptions.NucleusDataStoreException;
import org.datanucleus.store.oracle.adapter.OracleDialect;
import org.datanucleus.store.oracle.exceptions.ConnectionException;
import org.datanucleus.store.oracle.exceptions.OracleExceptionClassifier;
import org.datanucleus.store.oracle.exceptions.RecordNotUniqueException;
import org.datanucleus.store.oracle.sql.SQLText;
import org.datanucleus.store.oracle.types.ColumnType;

/**
 * Tests for the adapter as a whole, against an in-memory H2 database in Oracle mode.
 */
public class OracleEnhancedAdapterTest extends TestCase
{
    private static final AtomicInteger DB_COUNTER = new AtomicInteger();

    private String url;

    private ConnectionProvider connectionProvider;

    @Override
    protected void setUp() throws Exception
    {
        url = "jdbc:h2:mem:adapter" + DB_COUNTER.incrementAndGet() + ";MODE=Oracle;DB_CLOSE_DELAY=-1";
        connectionProvider = new ConnectionProvider()
        {
            public Connection getConnection() throws SQLException
            {
                return DriverManager.getConnection(url);
            }
        };
    }

    @Override
    protected void tearDown() throws Exception
    {
        Connection conn = DriverManager.getConnection(url);
        try
        {
            conn.createStatement().execute("SHUTDOWN");
        }
        finally
        {
            conn.close();
        }
    }

    public void testConnect()
    {
        OracleEnhancedAdapter adapter = new OracleEnhancedAdapter(connectionProvider, new OracleAdapterConfiguration());
        assertEquals("OracleEnhanced", adapter.getAdapterName());
        assertEquals("oracle", adapter.getDialect().getVendorID());
        assertTrue(adapter.isActive());

        adapter.disconnect();
        // Next use connects again
        assertTrue(adapter.isActive());
        adapter.reconnect();
        assertTrue(adapter.isActive());
        adapter.disconnect();
    }

    public void testInactiveWhenPingFails()
    {
        SQLController sqlController = mock(SQLController.class);
        doThrow(new ConnectionException("ORA-03113: end-of-file on communication channel")).when(sqlController).ping();
        OracleEnhancedAdapter adapter = new OracleEnhancedAdapter(sqlController, new OracleDialect(19, 0, new OracleAdapterConfiguration()));
        assertFalse(adapter.isActive());
    }

    public void testReconnectFailureIsLogged()
    {
        SQLController sqlController = mock(SQLController.class);
        doThrow(new ConnectionException("ORA-12541: TNS:no listener")).when(sqlController).reconnect();
        OracleEnhancedAdapter adapter = new OracleEnhancedAdapter(sqlController, new OracleDialect(19, 0, new OracleAdapterConfiguration()));
        adapter.reconnect();
        verify(sqlController).reconnect();
    }

    public void testTranslateException()
    {
        SQLController sqlController = new SQLController(connectionProvider, new OracleExceptionClassifier(), false);
        OracleEnhancedAdapter adapter = new OracleEnhancedAdapter(sqlController, new OracleDialect(19, 0, new OracleAdapterConfiguration()));
        NucleusDataStoreException ex = adapter.translateException(
            new SQLException("ORA-00001: unique constraint (APP.PK_EMP) violated", "23000", 1), "insert");
        assertTrue(ex instanceof RecordNotUniqueException);
        adapter.disconnect();
    }

    public void testRangeAndSequences()
    {
        SQLController sqlController = new SQLController(connectionProvider, new OracleExceptionClassifier(), false);
        OracleEnhancedAdapter adapter = new OracleEnhancedAdapter(sqlController, new OracleDialect(19, 0, new OracleAdapterConfiguration()));
        assertTrue(adapter.supportsFetchFirstNRowsAndOffset());

        sqlController.execute("CREATE TABLE employees (id " + adapter.typeToSql(ColumnType.INTEGER, null, null, null) + " PRIMARY KEY, " +
            "name " + adapter.typeToSql(ColumnType.STRING, 50, null, null) + ")", "DDL");
        String sequence = adapter.createPkSequence("employees");
        assertEquals("employees_seq", sequence);
        for (String name : new String[] {"Adams", "Baker", "Clark", "Davis", "Evans"})
        {
            SQLText insert = new SQLText("INSERT INTO employees VALUES (");
            insert.appendParameter("id", adapter.nextSequenceValue(sequence)).append(", ").appendParameter("name", name).append(")");
            sqlController.executeUpdate(insert, "insert");
        }

        SQLText query = adapter.applyRange(new SQLText("SELECT name FROM employees ORDER BY id"), 1L, 2L);
        List<Object> names = sqlController.selectValues(query, "page");
        assertEquals(2, names.size());
        assertEquals("Baker", names.get(0));
        assertEquals("Clark", names.get(1));
        assertEquals(Long.valueOf(10005), adapter.nextSequenceValue(sequence));
        adapter.disconnect();
    }
}
