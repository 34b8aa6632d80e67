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
import java.sql.Types;

/**
 * Representation of a bind parameter of a statement.
 */
public class SQLStatementParameter
{
    /** Name of the parameter, used for logging only since binding is positional. */
    final String name;

    /** Value to use for the parameter. */
    final Object value;

    /** JDBC type to use when binding a null value. */
    final int jdbcType;

    /**
     * Constructor for a VARCHAR parameter, which is what all the data dictionary queries need.
     * @param name Name of the parameter
     * @param value The value of the parameter
     */
    public SQLStatementParameter(String name, Object value)
    {
        this(name, value, Types.VARCHAR);
    }

    /**
     * Constructor for a parameter with an explicit JDBC type.
     * @param name Name of the parameter
     * @param value The value of the parameter
     * @param jdbcType JDBC type (see {@link Types}) used when the value is null
     */
    public SQLStatementParameter(String name, Object value, int jdbcType)
    {
        this.name = name;
        this.value = value;
        this.jdbcType = jdbcType;
    }

    public String getName()
    {
        return name;
    }

    public Object getValue()
    {
        return value;
    }

    public int getJdbcType()
    {
        return jdbcType;
    }

    /**
     * Set the value of this parameter in the statement.
     * @param ps The statement
     * @param position Position of the parameter (1-based)
     * @throws SQLException if the driver rejects the value
     */
    public void setInStatement(PreparedStatement ps, int position) throws SQLException
    {
        if (value == null)
        {
            ps.setNull(position, jdbcType);
        }
        else if (value instanceof String)
        {
            ps.setString(position, (String)value);
        }
        else
        {
            ps.setObject(position, value);
        }
    }

    public String toString()
    {
        return name + "=" + (value instanceof String ? "'" + value + "'" : String.valueOf(value));
    }
}
