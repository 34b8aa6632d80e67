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

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Representation of a snippet of an SQL statement. May contain parameters.
 * A 'parameter' in this context is a bind value of the statement (which will map on to a JDBC '?'
 * in the resultant SQL).
 * Call "applyParametersToStatement()" to set the parameter values in the PreparedStatement.
 */
public class SQLText
{
    /** Cached SQL if already generated. */
    private String sql;

    private List<SQLStatementParameter> parameters = null;

    private List<Object> appended;

    /**
     * Constructor
     */
    public SQLText()
    {
        appended = new ArrayList<>();
    }

    /**
     * Constructor
     * @param initialSQLText SQL text to start from
     */
    public SQLText(String initialSQLText)
    {
        this();
        append(initialSQLText);
    }

    public SQLText append(String s)
    {
        sql = null;
        appended.add(s);
        return this;
    }

    public SQLText append(long value)
    {
        sql = null;
        appended.add(Long.valueOf(value));
        return this;
    }

    /**
     * Append a SQLText, including its parameters.
     * @param st the SQLText
     * @return the SQLText
     */
    public SQLText append(SQLText st)
    {
        sql = null;
        appended.add(st);
        return this;
    }

    /**
     * Append a bind parameter.
     * @param name The parameter name
     * @param value the parameter value
     * @return the SQLText
     */
    public SQLText appendParameter(String name, Object value)
    {
        sql = null;
        appended.add(new SQLStatementParameter(name, value));
        return this;
    }

    /**
     * Append a bind parameter of a specific JDBC type.
     * @param name The parameter name
     * @param value the parameter value
     * @param jdbcType JDBC type used when the value is null
     * @return the SQLText
     */
    public SQLText appendParameter(String name, Object value, int jdbcType)
    {
        sql = null;
        appended.add(new SQLStatementParameter(name, value, jdbcType));
        return this;
    }

    /**
     * Method to set the parameters in the supplied PreparedStatement, in the order they appear in the SQL.
     * @param ps The PreparedStatement
     * @throws SQLException if a value is rejected by the driver
     */
    public void applyParametersToStatement(PreparedStatement ps) throws SQLException
    {
        int num = 1;
        for (SQLStatementParameter param : getParametersForStatement())
        {
            param.setInStatement(ps, num++);
        }
    }

    /**
     * Accessor for the parameters for this SQLText (including all sub SQLText)
     * @return The list of parameters (in the order they appear in the SQL)
     */
    public List<SQLStatementParameter> getParametersForStatement()
    {
        toSQL();
        return parameters == null ? Collections.<SQLStatementParameter>emptyList() : parameters;
    }

    /**
     * Accessor for the SQL of the statement.
     * @return The SQL text
     */
    public String toSQL()
    {
        if (sql != null)
        {
            // Use cached
            return sql;
        }

        parameters = null;
        StringBuilder str = new StringBuilder();
        for (Object item : appended)
        {
            if (item instanceof SQLStatementParameter)
            {
                str.append('?');
                if (parameters == null)
                {
                    parameters = new ArrayList<>();
                }
                parameters.add((SQLStatementParameter)item);
            }
            else if (item instanceof SQLText)
            {
                SQLText st = (SQLText)item;
                str.append(st.toSQL());
                if (st.parameters != null)
                {
                    if (parameters == null)
                    {
                        parameters = new ArrayList<>();
                    }
                    parameters.addAll(st.parameters);
                }
            }
            else
            {
                str.append(item);
            }
        }
        this.sql = str.toString();

        return this.sql;
    }

    /**
     * Accessor for the string form of the statement.
     * @return String form of the statement
     */
    public String toString()
    {
        return toSQL();
    }
}
