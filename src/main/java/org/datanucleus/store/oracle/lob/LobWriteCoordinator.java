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
package org.datanucleus.store.oracle.lob;

import java.nio.charset.StandardCharsets;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.datanucleus.exceptions.NucleusDataStoreException;
import org.datanucleus.store.oracle.OracleEnhancedAdapter;
import org.datanucleus.store.oracle.ResultSetProcessor;
import org.datanucleus.store.oracle.SQLController;
import org.datanucleus.store.oracle.exceptions.RecordNotFoundException;
import org.datanucleus.store.oracle.identifier.OracleIdentifierResolver;
import org.datanucleus.store.oracle.schema.OracleColumnInfo;
import org.datanucleus.store.oracle.sql.SQLText;
import org.datanucleus.store.oracle.types.LogicalType;
import org.datanucleus.store.oracle.types.OracleTypeRegistry;
import org.datanucleus.util.Localiser;
import org.datanucleus.util.NucleusLogger;
import org.datanucleus.util.StringUtils;

/**
 * Writes the values of large object columns of a row. Rows are inserted and updated with empty LOBs,
 * and the values are then written through the LOB locators, selected with a row lock.
 */
public class LobWriteCoordinator
{
    protected final OracleEnhancedAdapter adapter;

    protected final SQLController sqlController;

    public LobWriteCoordinator(OracleEnhancedAdapter adapter, SQLController sqlController)
    {
        this.adapter = adapter;
        this.sqlController = sqlController;
    }

    /**
     * Select the LOB columns of the table that have a change to write for the object.
     * @param model The object
     * @param columns Columns of its table
     * @return The changed LOB columns
     */
    public List<OracleColumnInfo> recordChangedLobs(PersistentModel model, Collection<OracleColumnInfo> columns)
    {
        List<OracleColumnInfo> lobColumns = new ArrayList<>();
        for (OracleColumnInfo col : columns)
        {
            String name = col.getColumnName();
            if (OracleTypeRegistry.isLob(col.getSqlType()) && model.willSaveChangeToAttribute(name) && !model.isReadonlyAttribute(name))
            {
                lobColumns.add(col);
            }
        }
        return lobColumns;
    }

    /**
     * Write the changed LOB columns of an object after it has been saved. Does nothing when the object isn't
     * persisted by this adapter, or is persisted by custom SQL.
     * @param model The object
     * @param changedLobColumns The changed LOB columns (see {@link #recordChangedLobs})
     * @return Whether the LOBs were written
     */
    public boolean enhancedWriteLobs(PersistentModel model, List<OracleColumnInfo> changedLobColumns)
    {
        if (model.getAdapter() != adapter || model.hasCustomCreateMethod() || model.hasCustomUpdateMethod())
        {
            return false;
        }
        if (!changedLobColumns.isEmpty())
        {
            writeLobs(model, changedLobColumns);
        }
        return true;
    }

    /**
     * Write the values of the LOB columns of an object. Blank values are skipped, since the row already
     * holds an empty (or null) LOB.
     * @param model The object
     * @param columns The LOB columns
     * @throws RecordNotFoundException if the row of the object doesn't exist
     */
    public void writeLobs(PersistentModel model, List<OracleColumnInfo> columns)
    {
        String pk = model.getPrimaryKey();
        Object id = model.getAttribute(pk);
        for (final OracleColumnInfo col : columns)
        {
            Object value = model.getAttribute(col.getColumnName());
            if (isBlank(value))
            {
                continue;
            }
            LogicalType attrType = model.getAttributeType(col.getColumnName());
            if (attrType != null && attrType.isSerializing())
            {
                value = attrType.serialize(value);
            }

            SQLText stmt = new SQLText("SELECT ");
            stmt.append(OracleIdentifierResolver.quoteColumnName(col.getColumnName()));
            stmt.append(" FROM ").append(OracleIdentifierResolver.quoteTableName(model.getTableName()));
            stmt.append(" WHERE ").append(OracleIdentifierResolver.quoteColumnName(pk)).append(" = ");
            stmt.appendParameter(pk, id, sqlTypeOfKey(id));
            stmt.append(" FOR UPDATE");

            if (NucleusLogger.DATASTORE_PERSIST.isDebugEnabled())
            {
                NucleusLogger.DATASTORE_PERSIST.debug(Localiser.msg("059012", col.getColumnName(), model.getTableName(), id));
            }

            final Object lobValue = value;
            final boolean binary = col.getLogicalType() != null && col.getLogicalType().isBinary();
            Boolean written = sqlController.executeQuery(stmt, "Writable Large Object", new ResultSetProcessor<Boolean>()
            {
                public Boolean process(ResultSet rs) throws SQLException
                {
                    if (!rs.next())
                    {
                        return Boolean.FALSE;
                    }
                    writeLob(rs.getObject(1), lobValue, binary);
                    return Boolean.TRUE;
                }
            });
            if (!written.booleanValue())
            {
                throw new RecordNotFoundException(Localiser.msg("059006", stmt.toSQL(), col.getColumnName()));
            }
        }
    }

    /**
     * Replace the content of a LOB with the value.
     * @param lob The LOB locator
     * @param value The value
     * @param binary Whether to write bytes (BLOB) rather than characters (CLOB/NCLOB)
     * @throws SQLException if the write fails
     */
    protected void writeLob(Object lob, Object value, boolean binary)
    throws SQLException
    {
        if (binary && lob instanceof Blob)
        {
            byte[] bytes = value instanceof byte[] ? (byte[])value : value.toString().getBytes(StandardCharsets.UTF_8);
            Blob blob = (Blob)lob;
            blob.setBytes(1, bytes);
            if (blob.length() > bytes.length)
            {
                blob.truncate(bytes.length);
            }
        }
        else if (!binary && lob instanceof Clob)
        {
            String str = value.toString();
            Clob clob = (Clob)lob;
            clob.setString(1, str);
            if (clob.length() > str.length())
            {
                clob.truncate(str.length());
            }
        }
        else
        {
            if (lob == null)
            {
                throw new NucleusDataStoreException("Column holds NULL rather than an empty " + (binary ? "BLOB" : "CLOB") + " so cannot be written");
            }
            throw new NucleusDataStoreException("Column value of type " + lob.getClass().getName() + " is not a " + (binary ? "BLOB" : "CLOB"));
        }
    }

    private static int sqlTypeOfKey(Object id)
    {
        return id instanceof Number ? Types.NUMERIC : Types.VARCHAR;
    }

    /**
     * Whether a value is blank : null, false, an empty or white space string, or an empty array.
     */
    static boolean isBlank(Object value)
    {
        if (value == null || Boolean.FALSE.equals(value))
        {
            return true;
        }
        if (value instanceof String)
        {
            return StringUtils.isWhitespace((String)value);
        }
        if (value instanceof byte[])
        {
            return ((byte[])value).length == 0;
        }
        if (value instanceof Collection)
        {
            return ((Collection<?>)value).isEmpty();
        }
        return false;
    }
}
