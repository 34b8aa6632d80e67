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
package org.datanucleus.store.oracle.types;

/**
 * Dialect-neutral data type of a column, as resolved from its native Oracle type string.
 * Carries the precision, scale and limit extracted from the native type where relevant.
 * Instances are immutable.
 */
public class LogicalType
{
    protected final LogicalTypeKind kind;

    /** Native type string that this was resolved from. */
    protected final String sqlType;

    protected final Integer precision;

    protected final Integer scale;

    protected final Integer limit;

    public LogicalType(LogicalTypeKind kind, String sqlType)
    {
        this(kind, sqlType, null, null, null);
    }

    public LogicalType(LogicalTypeKind kind, String sqlType, Integer precision, Integer scale, Integer limit)
    {
        this.kind = kind;
        this.sqlType = sqlType;
        this.precision = precision;
        this.scale = scale;
        this.limit = limit;
    }

    public LogicalTypeKind getKind()
    {
        return kind;
    }

    public String getSqlType()
    {
        return sqlType;
    }

    public Integer getPrecision()
    {
        return precision;
    }

    public Integer getScale()
    {
        return scale;
    }

    public Integer getLimit()
    {
        return limit;
    }

    /**
     * Whether values of this type are binary, so have to be written through a BLOB handle.
     * @return Whether binary
     */
    public boolean isBinary()
    {
        return kind == LogicalTypeKind.BINARY || kind == LogicalTypeKind.RAW;
    }

    /**
     * Whether this type converts the attribute value into a storable form before it is written.
     * @return Whether serializing
     */
    public boolean isSerializing()
    {
        return false;
    }

    /**
     * Convert the attribute value into the form stored in the column.
     * @param value The value
     * @return The value to store
     */
    public Object serialize(Object value)
    {
        return value;
    }

    public boolean equals(Object obj)
    {
        if (obj == this)
        {
            return true;
        }
        if (obj == null || obj.getClass() != getClass())
        {
            return false;
        }
        LogicalType other = (LogicalType)obj;
        return kind == other.kind && same(sqlType, other.sqlType) && same(precision, other.precision) &&
            same(scale, other.scale) && same(limit, other.limit);
    }

    private static boolean same(Object a, Object b)
    {
        return a == null ? b == null : a.equals(b);
    }

    public int hashCode()
    {
        return kind.hashCode() ^ (sqlType != null ? sqlType.hashCode() : 0);
    }

    public String toString()
    {
        StringBuilder str = new StringBuilder(kind.toString());
        if (precision != null)
        {
            str.append(" precision=").append(precision);
        }
        if (scale != null)
        {
            str.append(" scale=").append(scale);
        }
        if (limit != null)
        {
            str.append(" limit=").append(limit);
        }
        return str.toString();
    }
}
