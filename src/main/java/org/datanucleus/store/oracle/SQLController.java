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

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.datanucleus.exceptions.NucleusDataStoreException;
import org.datanucleus.store.oracle.exceptions.ConnectionException;
import org.datanucleus.store.oracle.exceptions.OracleExceptionClassifier;
import org.datanucleus.store.oracle.sql.SQLText;
import org.datanucleus.util.Localiser;
import org.datanucleus.util.NucleusLogger;
import org.datanucleus.util.StringUtils;

/**
 * Controller for execution of SQL statements on the session owned by the adapter.
 * Every statement is executed with a label (used in the log) and its bind parameters, and every
 * driver failure is passed through the {@link OracleExceptionClassifier}, so no SQLException escapes.
 * <p>
 * Statements are executed synchronously; each call consumes all rows and closes the statement
 * before returning. When auto-retry is enabled and the connection is found to be lost while in
 * autocommit mode, the controller reconnects and retries the statement once.
 * </p>
 */
public class SQLController
{
    static
    {
        Localiser.registerBundle("org.datanucleus.store.oracle.Localisation", SQLController.class.getClassLoader());
    }

    /** Seconds to wait for a ping to complete. */
    public static final int PING_TIMEOUT_SECONDS = 5;

    protected final ConnectionProvider connectionProvider;

    protected final OracleExceptionClassifier exceptionClassifier;

    protected final boolean autoRetry;

    /** Current session, obtained on first use. */
    protected Connection connection;

    /**
     * Constructor.
     * @param connectionProvider Provider of the connection
     * @param exceptionClassifier Classifier for driver errors
     * @param autoRetry Whether to reconnect and retry once when the connection is lost in autocommit mode
     */
    public SQLController(ConnectionProvider connectionProvider, OracleExceptionClassifier exceptionClassifier, boolean autoRetry)
    {
        this.connectionProvider = connectionProvider;
        this.exceptionClassifier = exceptionClassifier;
        this.autoRetry = autoRetry;
    }

    public OracleExceptionClassifier getExceptionClassifier()
    {
        return exceptionClassifier;
    }

    /**
     * Accessor for the connection of the session, establishing it if not yet connected.
     * @return The connection
     * @throws ConnectionException if the connection cannot be established
     */
    public Connection getConnection()
    {
        if (connection == null)
        {
            try
            {
                connection = connectionProvider.getConnection();
            }
            catch (SQLException sqle)
            {
                throw new ConnectionException(sqle.getMessage(), sqle);
            }
            if (connection == null)
            {
                throw new ConnectionException("Connection provider returned no connection");
            }
        }
        return connection;
    }

    /**
     * Check that the session is still alive.
     * @throws ConnectionException if the server does not answer
     */
    public void ping()
    {
        try
        {
            if (!getConnection().isValid(PING_TIMEOUT_SECONDS))
            {
                throw new ConnectionException(Localiser.msg("059010", "connection is not valid"));
            }
        }
        catch (SQLException sqle)
        {
            throw new ConnectionException(Localiser.msg("059010", sqle.getMessage()), sqle);
        }
    }

    /**
     * Drop the current connection (ignoring failures to close it) and obtain a new one.
     * @throws ConnectionException if a new connection cannot be established
     */
    public void reconnect()
    {
        close();
        getConnection();
    }

    /**
     * Close the current connection, if any.
     */
    public void close()
    {
        if (connection != null)
        {
            try
            {
                connection.close();
            }
            catch (SQLException sqle)
            {
                NucleusLogger.CONNECTION.debug("Exception closing connection : " + sqle.getMessage());
            }
            finally
            {
                connection = null;
            }
        }
    }

    /**
     * Execute a query, passing its ResultSet to the processor.
     * @param stmt The statement (with bind parameters)
     * @param label Label for the statement, used in logging and error messages
     * @param processor Consumer of the rows
     * @return The value produced by the processor
     * @param <T> Type of the value produced
     * @throws NucleusDataStoreException (classified) if the statement fails
     */
    public <T> T executeQuery(SQLText stmt, String label, ResultSetProcessor<T> processor)
    {
        try
        {
            return doExecuteQuery(stmt, label, processor);
        }
        catch (SQLException sqle)
        {
            if (shouldRetry(sqle))
            {
                NucleusLogger.CONNECTION.warn(Localiser.msg("059011", label));
                reconnect();
                try
                {
                    return doExecuteQuery(stmt, label, processor);
                }
                catch (SQLException sqle2)
                {
                    throw translate(sqle2, label);
                }
            }
            throw translate(sqle, label);
        }
    }

    /**
     * Execute a DDL or DML statement.
     * @param stmt The statement (with bind parameters)
     * @param label Label for the statement, used in logging and error messages
     * @return Number of rows affected (0 for DDL)
     * @throws NucleusDataStoreException (classified) if the statement fails
     */
    public int executeUpdate(SQLText stmt, String label)
    {
        try
        {
            return doExecuteUpdate(stmt, label);
        }
        catch (SQLException sqle)
        {
            if (shouldRetry(sqle))
            {
                NucleusLogger.CONNECTION.warn(Localiser.msg("059011", label));
                reconnect();
                try
                {
                    return doExecuteUpdate(stmt, label);
                }
                catch (SQLException sqle2)
                {
                    throw translate(sqle2, label);
                }
            }
            throw translate(sqle, label);
        }
    }

    /**
     * Convenience method to execute DDL with no bind parameters.
     * @param sql The statement text
     * @param label Label for the statement
     */
    public void execute(String sql, String label)
    {
        executeUpdate(new SQLText(sql), label);
    }

    /**
     * Execute a query and return all rows, each keyed by the lowercase column label in select order.
     * @param stmt The statement
     * @param label The label
     * @return The rows
     */
    public List<Map<String, Object>> selectAll(SQLText stmt, String label)
    {
        return executeQuery(stmt, label, new ResultSetProcessor<List<Map<String, Object>>>()
        {
            public List<Map<String, Object>> process(ResultSet rs) throws SQLException
            {
                ResultSetMetaData rsmd = rs.getMetaData();
                int numCols = rsmd.getColumnCount();
                String[] names = new String[numCols];
                for (int i = 0; i < numCols; i++)
                {
                    names[i] = rsmd.getColumnLabel(i + 1).toLowerCase(Locale.ENGLISH);
                }

                List<Map<String, Object>> rows = new ArrayList<>();
                while (rs.next())
                {
                    Map<String, Object> row = new LinkedHashMap<>();
                    for (int i = 0; i < numCols; i++)
                    {
                        row.put(names[i], rs.getObject(i + 1));
                    }
                    rows.add(row);
                }
                return rows;
            }
        });
    }

    /**
     * Execute a query and return its first row.
     * @param stmt The statement
     * @param label The label
     * @return The first row, or null if the query returned no rows
     */
    public Map<String, Object> selectOne(SQLText stmt, String label)
    {
        List<Map<String, Object>> rows = selectAll(stmt, label);
        return rows.isEmpty() ? null : rows.get(0);
    }

    /**
     * Execute a query and return the values of its first column.
     * @param stmt The statement
     * @param label The label
     * @return The values, in row order
     */
    public List<Object> selectValues(SQLText stmt, String label)
    {
        return executeQuery(stmt, label, new ResultSetProcessor<List<Object>>()
        {
            public List<Object> process(ResultSet rs) throws SQLException
            {
                List<Object> values = new ArrayList<>();
                while (rs.next())
                {
                    values.add(rs.getObject(1));
                }
                return values;
            }
        });
    }

    /**
     * Execute a query and return the value of the first column of the first row.
     * @param stmt The statement
     * @param label The label
     * @return The value, or null if no rows were returned
     */
    public Object selectValue(SQLText stmt, String label)
    {
        return executeQuery(stmt, label, new ResultSetProcessor<Object>()
        {
            public Object process(ResultSet rs) throws SQLException
            {
                return rs.next() ? rs.getObject(1) : null;
            }
        });
    }

    /**
     * Convenience accessor for a single String value.
     * @param stmt The statement
     * @param label The label
     * @return The value as a String, or null
     */
    public String selectString(SQLText stmt, String label)
    {
        Object value = selectValue(stmt, label);
        return value == null ? null : value.toString();
    }

    protected <T> T doExecuteQuery(SQLText stmt, String label, ResultSetProcessor<T> processor)
    throws SQLException
    {
        String sql = stmt.toSQL();
        logStatement(stmt, label);
        PreparedStatement ps = getConnection().prepareStatement(sql);
        try
        {
            stmt.applyParametersToStatement(ps);
            ResultSet rs = ps.executeQuery();
            try
            {
                return processor.process(rs);
            }
            finally
            {
                rs.close();
            }
        }
        finally
        {
            ps.close();
        }
    }

    protected int doExecuteUpdate(SQLText stmt, String label)
    throws SQLException
    {
        String sql = stmt.toSQL();
        logStatement(stmt, label);
        PreparedStatement ps = getConnection().prepareStatement(sql);
        try
        {
            stmt.applyParametersToStatement(ps);
            return ps.executeUpdate();
        }
        finally
        {
            ps.close();
        }
    }

    protected void logStatement(SQLText stmt, String label)
    {
        if (NucleusLogger.DATASTORE_NATIVE.isDebugEnabled())
        {
            String sql = stmt.toSQL();
            if (stmt.getParametersForStatement().isEmpty())
            {
                NucleusLogger.DATASTORE_NATIVE.debug("[" + label + "] " + sql);
            }
            else
            {
                NucleusLogger.DATASTORE_NATIVE.debug("[" + label + "] " + sql + " " +
                    StringUtils.collectionToString(stmt.getParametersForStatement()));
            }
        }
    }

    /**
     * Whether a failed statement should be retried on a new connection.
     * Only done when enabled, for lost connections, and when in autocommit (so no transaction state is lost).
     * @param sqle The failure
     * @return Whether to retry
     */
    protected boolean shouldRetry(SQLException sqle)
    {
        if (!autoRetry || !exceptionClassifier.isLostConnection(sqle) || connection == null)
        {
            return false;
        }
        try
        {
            return connection.getAutoCommit();
        }
        catch (SQLException e)
        {
            // Connection is unusable, so we cannot know the transaction state
            NucleusLogger.CONNECTION.debug("Unable to determine autocommit mode : " + e.getMessage());
            return false;
        }
    }

    protected NucleusDataStoreException translate(SQLException sqle, String label)
    {
        return exceptionClassifier.translate(sqle, label + ": " + sqle.getMessage());
    }
}
