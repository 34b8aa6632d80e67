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

import org.datanucleus.store.oracle.types.LogicalType;
import org.datanucleus.store.schema.StoreSchemaData;

/**
 * Represents the metadata of a specific column of a table, as read from ALL_TAB_COLS.
 * Supports the following properties.
 * <ul>
 * <li>table_name</li>
 * <li>column_name</li>
 * <li>sql_type</li>
 * <li>nullable</li>
 * <li>default_value</li>
 * <li>virtual</li>
 * <li>precision</li>
 * <li>scale</li>
 * <li>limit</li>
 * <li>sql_type_owner</li>
 * <li>comment</li>
 * </ul>
 * Instances are immutable.
 */
public class OracleColumnInfo implements StoreSchemaData
{
    final String tableName;

    final String columnName;

    /** Native type, including any "(limit[,scale])" suffix and owner prefix of object types. */
    final String sqlType;

    final boolean nullable;

    /** Default value (with quotes removed and escaping undone), or null when there is none. */
    final Object defaultValue;

    final boolean virtual;

    final Integer limit;

    final Integer scale;

    final String sqlTypeOwner;

    final String comment;

    final LogicalType logicalType;

    public OracleColumnInfo(String tableName, String columnName, String sqlType, boolean nullable, Object defaultValue,
            boolean virtual, Integer limit, Integer scale, String sqlTypeOwner, String comment, LogicalType logicalType)
    {
        this.tableName = tableName;
        this.columnName = columnName;
        this.sqlType = sqlType;
        this.nullable = nullable;
        this.defaultValue = defaultValue;
        this.virtual = virtual;
        this.limit = limit;
        this.scale = scale;
        this.sqlTypeOwner = sqlTypeOwner;
        this.comment = comment;
        this.logicalType = logicalType;
    }

    public String getTableName()
    {
        return tableName;
    }

    public String getColumnName()
    {
        return columnName;
    }

    public String getSqlType()
    {
        return sqlType;
    }

    public boolean isNullable()
    {
        return nullable;
    }

    public Object getDefaultValue()
    {
        return defaultValue;
    }

    public boolean isVirtual()
    {
        return virtual;
    }

    /**
     * Hidden columns are never returned by the introspection, so this is always false.
     * @return false
     */
    public boolean isHidden()
    {
        return false;
    }

    public Integer getLimit()
    {
        return limit;
    }

    public Integer getScale()
    {
        return scale;
    }

    public Integer getPrecision()
    {
        return logicalType != null ? logicalType.getPrecision() : null;
    }

    public String getSqlTypeOwner()
    {
        return sqlTypeOwner;
    }

    public String getComment()
    {
        return comment;
    }

    public LogicalType getLogicalType()
    {
        return logicalType;
    }

    /**
     * Column descriptors are immutable.
     * @throws UnsupportedOperationException always
     */
    public void addProperty(String name, Object value)
    {
        throw new UnsupportedOperationException("Column information is read-only");
    }

    public Object getProperty(String name)
    {
        switch (name)
        {
            case "table_name" :
                return tableName;
            case "column_name" :
                return columnName;
            case "sql_type" :
                return sqlType;
            case "nullable" :
                return Boolean.valueOf(nullable);
            case "default_value" :
                return defaultValue;
            case "virtual" :
                return Boolean.valueOf(virtual);
            case "precision" :
                return getPrecision();
            case "scale" :
                return scale;
            case "limit" :
                return limit;
            case "sql_type_owner" :
                return sqlTypeOwner;
            case "comment" :
                return comment;
            default :
                return null;
        }
    }

    public String toString()
    {
        StringBuilder str = new StringBuilder("OracleColumnInfo : ");
        str.append(tableName).append('.').append(columnName).append(' ').append(sqlType);
        str.append(nullable ? " NULL" : " NOT NULL");
        if (defaultValue != null)
        {
            str.append(" DEFAULT ").append(defaultValue);
        }
        if (virtual)
        {
            str.append(" VIRTUAL");
        }
        return str.toString();
    }
}
