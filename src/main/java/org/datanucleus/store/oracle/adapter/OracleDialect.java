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
package org.datanucleus.store.oracle.adapter;

import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.util.StringTokenizer;

import org.datanucleus.exceptions.NucleusDataStoreException;
import org.datanucleus.store.oracle.OracleAdapterConfiguration;
import org.datanucleus.util.NucleusLogger;

/**
 * Describes the capabilities of the connected Oracle server. All version-dependent decisions of the
 * adapter (pagination syntax, identifier lengths, virtual columns etc) are taken here, from the version
 * reported by the server at connection time.
 */
public class OracleDialect
{
    /** Server version from which OFFSET ... FETCH NEXT ... is available. */
    public static final int FETCH_FIRST_MIN_MAJOR_VERSION = 12;

    /** Maximum identifier length prior to 12.2. */
    public static final int IDENTIFIER_MAX_LENGTH = 30;

    /** Maximum identifier length from 12.2 onwards. */
    public static final int LONG_IDENTIFIER_MAX_LENGTH = 128;

    protected final OracleAdapterConfiguration config;

    protected int datastoreMajorVersion;

    protected int datastoreMinorVersion;

    protected String datastoreProductVersion;

    protected String driverName;

    /**
     * Constructs a dialect based on the given JDBC metadata.
     * @param metadata the database metadata
     * @param config Configuration of the adapter
     * @throws NucleusDataStoreException if the metadata cannot be read
     */
    public OracleDialect(DatabaseMetaData metadata, OracleAdapterConfiguration config)
    {
        this.config = config;
        try
        {
            driverName = metadata.getDriverName();
            datastoreProductVersion = metadata.getDatabaseProductVersion();
            datastoreMajorVersion = metadata.getDatabaseMajorVersion();
            datastoreMinorVersion = metadata.getDatabaseMinorVersion();
            if (datastoreMajorVersion <= 0 && datastoreProductVersion != null)
            {
                // Driver doesn't report the version, so parse it out of the product version
                // e.g "Oracle Database 11g Enterprise Edition Release 11.2.0.4.0 - 64bit Production"
                parseProductVersion(datastoreProductVersion);
            }
        }
        catch (SQLException sqle)
        {
            throw new NucleusDataStoreException("Can't read JDBC metadata of the Oracle connection", sqle).setFatal();
        }

        if (NucleusLogger.DATASTORE.isDebugEnabled())
        {
            NucleusLogger.DATASTORE.debug(toString());
        }
    }

    /**
     * Constructs a dialect for a known server version.
     * @param majorVersion Major version of the server (e.g 19)
     * @param minorVersion Minor version of the server
     * @param config Configuration of the adapter
     */
    public OracleDialect(int majorVersion, int minorVersion, OracleAdapterConfiguration config)
    {
        this.config = config;
        this.datastoreMajorVersion = majorVersion;
        this.datastoreMinorVersion = minorVersion;
        this.datastoreProductVersion = majorVersion + "." + minorVersion;
    }

    private void parseProductVersion(String productVersion)
    {
        int releasePos = productVersion.indexOf("Release ");
        String version = releasePos >= 0 ? productVersion.substring(releasePos + 8) : productVersion;
        StringBuilder stripped = new StringBuilder();
        for (int i = 0; i < version.length(); i++)
        {
            char c = version.charAt(i);
            if (Character.isDigit(c) || c == '.')
            {
                stripped.append(c);
            }
            else if (stripped.length() > 0)
            {
                break;
            }
        }

        StringTokenizer parts = new StringTokenizer(stripped.toString(), ".");
        try
        {
            if (parts.hasMoreTokens())
            {
                datastoreMajorVersion = Integer.parseInt(parts.nextToken());
            }
            if (parts.hasMoreTokens())
            {
                datastoreMinorVersion = Integer.parseInt(parts.nextToken());
            }
        }
        catch (NumberFormatException nfe)
        {
            datastoreMajorVersion = -1; //unknown
        }
    }

    public OracleAdapterConfiguration getConfiguration()
    {
        return config;
    }

    public String getVendorID()
    {
        return "oracle";
    }

    public int getDatastoreMajorVersion()
    {
        return datastoreMajorVersion;
    }

    public int getDatastoreMinorVersion()
    {
        return datastoreMinorVersion;
    }

    /**
     * Whether pagination can use "OFFSET n ROWS FETCH NEXT m ROWS ONLY".
     * True from Oracle 12 onwards unless the old (ROWNUM) style is forced by configuration.
     * @return Whether OFFSET/FETCH is supported
     */
    public boolean supportsFetchFirstNRowsAndOffset()
    {
        return !config.isUseOldOracleVisitor() && datastoreMajorVersion >= FETCH_FIRST_MIN_MAJOR_VERSION;
    }

    /**
     * Whether "INSERT ALL" multi-row inserts are supported (11.2+).
     * @return Whether multi-row inserts are supported
     */
    public boolean supportsMultiInsert()
    {
        return datastoreMajorVersion > 11 || (datastoreMajorVersion == 11 && datastoreMinorVersion >= 2);
    }

    public boolean supportsVirtualColumns()
    {
        return datastoreMajorVersion >= 11;
    }

    /**
     * Whether "IS JSON" check constraints are available (12+). There is no JSON column type,
     * JSON values are stored in VARCHAR2 or CLOB columns.
     * @return Whether JSON is supported
     */
    public boolean supportsJson()
    {
        return datastoreMajorVersion >= 12;
    }

    /**
     * Maximum length of an identifier, used when deriving sequence and trigger names from table names.
     * @return The maximum identifier length
     */
    public int getIdentifierMaxLength()
    {
        if (config.getIdentifierMaxLength() != null)
        {
            return config.getIdentifierMaxLength().intValue();
        }
        if (datastoreMajorVersion > 12 || (datastoreMajorVersion == 12 && datastoreMinorVersion >= 2))
        {
            return LONG_IDENTIFIER_MAX_LENGTH;
        }
        return IDENTIFIER_MAX_LENGTH;
    }

    /**
     * Name of the sequence providing key values for a table, "&lt;table&gt;_seq", with the table part
     * truncated so the whole name fits in an identifier. An owner prefix is kept.
     * @param tableName The table, optionally owner-qualified
     * @return The sequence name
     */
    public String getDefaultSequenceName(String tableName)
    {
        String prefix = "";
        String name = tableName;
        int dotPos = tableName.lastIndexOf('.');
        if (dotPos >= 0)
        {
            prefix = tableName.substring(0, dotPos + 1);
            name = tableName.substring(dotPos + 1);
        }
        return prefix + truncate(name, getIdentifierMaxLength() - 4) + "_seq";
    }

    /**
     * Name of the trigger that populates the primary key of a table, "&lt;table&gt;_pkt".
     * @param tableName The table
     * @return The trigger name
     */
    public String getDefaultTriggerName(String tableName)
    {
        return truncate(tableName, getIdentifierMaxLength() - 4) + "_pkt";
    }

    /**
     * Name of the procedure holding the datastore of an Oracle Text context index.
     * @param indexName The index
     * @return The procedure name
     */
    public String getDefaultDatastoreProcedure(String indexName)
    {
        return indexName + "_prc";
    }

    private static String truncate(String name, int length)
    {
        return name.length() > length ? name.substring(0, length) : name;
    }

    public String toString()
    {
        return "OracleDialect : version=\"" + datastoreProductVersion + "\" (major=" + datastoreMajorVersion +
            ", minor=" + datastoreMinorVersion + ") driver=\"" + driverName + "\"";
    }
}
