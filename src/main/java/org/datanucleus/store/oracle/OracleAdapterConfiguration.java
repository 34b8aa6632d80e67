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

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

import org.datanucleus.exceptions.NucleusUserException;
import org.datanucleus.util.Localiser;
import org.datanucleus.util.StringUtils;

/**
 * Configuration of the Oracle adapter. Instances are immutable and are passed to the components
 * that need them, so two adapters with different settings can coexist in one JVM.
 * See {@link OraclePropertyNames} for the supported properties.
 */
public class OracleAdapterConfiguration
{
    static
    {
        Localiser.registerBundle("org.datanucleus.store.oracle.Localisation", OracleAdapterConfiguration.class.getClassLoader());
    }

    public static final long DEFAULT_SEQUENCE_START_VALUE = 10000;

    private final boolean emulateBooleans;

    private final boolean emulateBooleansFromStrings;

    private final boolean useOldOracleVisitor;

    private final boolean autoRetry;

    private final long defaultSequenceStartValue;

    /** Identifier length to use when deriving names, or null to use that of the server. */
    private final Integer identifierMaxLength;

    private final Map<TablespaceType, String> defaultTablespaces;

    /**
     * Constructor for a configuration with all defaults.
     */
    public OracleAdapterConfiguration()
    {
        this(new Properties());
    }

    /**
     * Constructor taking the properties to use. Property names are case-insensitive.
     * @param props The properties
     * @throws NucleusUserException if a numeric property has an invalid value
     */
    public OracleAdapterConfiguration(Properties props)
    {
        Map<String, String> values = new HashMap<>();
        for (String name : props.stringPropertyNames())
        {
            values.put(name.toLowerCase(Locale.ENGLISH), props.getProperty(name));
        }

        emulateBooleans = getBoolean(values, OraclePropertyNames.PROPERTY_ORACLE_EMULATE_BOOLEANS, true);
        emulateBooleansFromStrings = getBoolean(values, OraclePropertyNames.PROPERTY_ORACLE_EMULATE_BOOLEANS_FROM_STRINGS, false);
        useOldOracleVisitor = getBoolean(values, OraclePropertyNames.PROPERTY_ORACLE_USE_OLD_ORACLE_VISITOR, false);
        autoRetry = getBoolean(values, OraclePropertyNames.PROPERTY_ORACLE_AUTO_RETRY, false);

        String startValue = values.get(OraclePropertyNames.PROPERTY_ORACLE_DEFAULT_SEQUENCE_START_VALUE);
        defaultSequenceStartValue = StringUtils.isWhitespace(startValue) ? DEFAULT_SEQUENCE_START_VALUE :
            parseLong(OraclePropertyNames.PROPERTY_ORACLE_DEFAULT_SEQUENCE_START_VALUE, startValue);

        String maxLength = values.get(OraclePropertyNames.PROPERTY_ORACLE_IDENTIFIER_MAX_LENGTH);
        if (StringUtils.isWhitespace(maxLength))
        {
            identifierMaxLength = null;
        }
        else
        {
            long length = parseLong(OraclePropertyNames.PROPERTY_ORACLE_IDENTIFIER_MAX_LENGTH, maxLength);
            if (length < 5)
            {
                // Need room for at least one character plus a "_seq" / "_pkt" suffix
                throw new NucleusUserException(Localiser.msg("059009", OraclePropertyNames.PROPERTY_ORACLE_IDENTIFIER_MAX_LENGTH, maxLength));
            }
            identifierMaxLength = Integer.valueOf((int)length);
        }

        Map<TablespaceType, String> tablespaces = new EnumMap<>(TablespaceType.class);
        for (TablespaceType type : TablespaceType.values())
        {
            String tablespace = values.get(OraclePropertyNames.PROPERTY_ORACLE_DEFAULT_TABLESPACE_PREFIX + type.name().toLowerCase(Locale.ENGLISH));
            if (!StringUtils.isWhitespace(tablespace))
            {
                tablespaces.put(type, tablespace.trim());
            }
        }
        defaultTablespaces = Collections.unmodifiableMap(tablespaces);
    }

    private static boolean getBoolean(Map<String, String> values, String name, boolean defaultValue)
    {
        String value = values.get(name);
        if (StringUtils.isWhitespace(value))
        {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    private static long parseLong(String name, String value)
    {
        try
        {
            return Long.parseLong(value.trim());
        }
        catch (NumberFormatException nfe)
        {
            throw new NucleusUserException(Localiser.msg("059009", name, value), nfe);
        }
    }

    /**
     * Whether NUMBER(1) columns (or VARCHAR2(1) when emulating from strings) are treated as booleans.
     * @return Whether booleans are emulated
     */
    public boolean isEmulateBooleans()
    {
        return emulateBooleans;
    }

    /**
     * Whether booleans are stored in VARCHAR2(1) columns rather than NUMBER(1).
     * @return Whether booleans are emulated using strings
     */
    public boolean isEmulateBooleansFromStrings()
    {
        return emulateBooleansFromStrings;
    }

    /**
     * Whether pagination should always use nested selects with ROWNUM, even on servers that support
     * OFFSET/FETCH.
     * @return Whether to force ROWNUM pagination
     */
    public boolean isUseOldOracleVisitor()
    {
        return useOldOracleVisitor;
    }

    public boolean isAutoRetry()
    {
        return autoRetry;
    }

    public long getDefaultSequenceStartValue()
    {
        return defaultSequenceStartValue;
    }

    public Integer getIdentifierMaxLength()
    {
        return identifierMaxLength;
    }

    /**
     * Accessor for the configured default tablespace for a kind of object.
     * @param type Kind of object
     * @return The tablespace, or null if the user's default tablespace should be used
     */
    public String getDefaultTablespace(TablespaceType type)
    {
        return defaultTablespaces.get(type);
    }

    public Map<TablespaceType, String> getDefaultTablespaces()
    {
        return defaultTablespaces;
    }

    public String toString()
    {
        return "OracleAdapterConfiguration[emulateBooleans=" + emulateBooleans +
            ", emulateBooleansFromStrings=" + emulateBooleansFromStrings +
            ", useOldOracleVisitor=" + useOldOracleVisitor +
            ", autoRetry=" + autoRetry +
            ", defaultSequenceStartValue=" + defaultSequenceStartValue +
            ", identifierMaxLength=" + identifierMaxLength +
            ", defaultTablespaces=" + StringUtils.mapToString(defaultTablespaces) + "]";
    }
}
