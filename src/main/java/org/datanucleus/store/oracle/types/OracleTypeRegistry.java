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

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.datanucleus.store.oracle.OracleAdapterConfiguration;
import org.datanucleus.util.NucleusLogger;

/**
 * Registry resolving native Oracle type strings (as found in the catalog, e.g "NUMBER(10,2)" or
 * "TIMESTAMP(6) WITH TIME ZONE") to logical types. Mappings are tried in registration order and the first
 * match wins, so the more specific (national character, time zone qualified) variants come first.
 * The boolean emulation toggles are read once from the configuration at construction.
 */
public class OracleTypeRegistry
{
    private static final Pattern BIGINT_PATTERN = Pattern.compile("^bigint", Pattern.CASE_INSENSITIVE);
    private static final Pattern LIMIT_PATTERN = Pattern.compile("\\((.*)\\)");
    private static final Pattern PRECISION_PATTERN = Pattern.compile("\\((\\d+)(,\\d+)?\\)");
    private static final Pattern ZERO_SCALE_PATTERN = Pattern.compile("\\((\\d+)\\)");
    private static final Pattern SCALE_PATTERN = Pattern.compile("\\((\\d+)(,(\\d+))\\)");
    private static final Pattern LOB_PATTERN = Pattern.compile("LOB$", Pattern.CASE_INSENSITIVE);

    protected final OracleAdapterConfiguration config;

    protected final List<TypeMapping> mappings = new ArrayList<>();

    public OracleTypeRegistry(OracleAdapterConfiguration config)
    {
        this.config = config;
        initializeMappings();
    }

    protected void initializeMappings()
    {
        if (config.isEmulateBooleans())
        {
            String booleanRegex = config.isEmulateBooleansFromStrings() ? "^VARCHAR2\\(1\\)" : "^NUMBER\\(1\\)";
            register(booleanRegex, new TypeMapping.Factory()
            {
                public LogicalType create(String sqlType)
                {
                    return new LogicalType(LogicalTypeKind.BOOLEAN, sqlType);
                }
            });
        }

        register("WITH TIME ZONE", new TypeMapping.Factory()
        {
            public LogicalType create(String sqlType)
            {
                return new LogicalType(LogicalTypeKind.TIMESTAMP_TZ, sqlType, extractPrecision(sqlType), null, null);
            }
        });
        register("WITH LOCAL TIME ZONE", new TypeMapping.Factory()
        {
            public LogicalType create(String sqlType)
            {
                return new LogicalType(LogicalTypeKind.TIMESTAMP_LTZ, sqlType, extractPrecision(sqlType), null, null);
            }
        });
        register("RAW", limited(LogicalTypeKind.RAW));
        register("NCHAR|NVARCHAR2", limited(LogicalTypeKind.NATIONAL_STRING));
        register("NCLOB", limited(LogicalTypeKind.NATIONAL_TEXT));
        register("CHAR", limited(LogicalTypeKind.STRING));
        register("CLOB", limited(LogicalTypeKind.TEXT));
        register("NUMBER", new TypeMapping.Factory()
        {
            public LogicalType create(String sqlType)
            {
                Integer scale = extractScale(sqlType);
                Integer precision = extractPrecision(sqlType);
                if (scale != null && scale.intValue() == 0)
                {
                    return new LogicalType(LogicalTypeKind.INTEGER, sqlType, precision, null, extractLimit(sqlType));
                }
                return new LogicalType(LogicalTypeKind.DECIMAL, sqlType, precision, scale, null);
            }
        });

        // Generic types
        register("BLOB", limited(LogicalTypeKind.BINARY));
        register("TIMESTAMP", new TypeMapping.Factory()
        {
            public LogicalType create(String sqlType)
            {
                return new LogicalType(LogicalTypeKind.TIMESTAMP, sqlType, extractPrecision(sqlType), null, null);
            }
        });
        register("DATE", plain(LogicalTypeKind.DATE));
        register("FLOAT|DOUBLE", new TypeMapping.Factory()
        {
            public LogicalType create(String sqlType)
            {
                return new LogicalType(LogicalTypeKind.FLOAT, sqlType, extractPrecision(sqlType), null, null);
            }
        });
        register("DECIMAL|NUMERIC", new TypeMapping.Factory()
        {
            public LogicalType create(String sqlType)
            {
                return new LogicalType(LogicalTypeKind.DECIMAL, sqlType, extractPrecision(sqlType), extractScale(sqlType), null);
            }
        });
        register("^(INTEGER|INT|SMALLINT|BIGINT)\\b", new TypeMapping.Factory()
        {
            public LogicalType create(String sqlType)
            {
                return new LogicalType(LogicalTypeKind.INTEGER, sqlType, extractPrecision(sqlType), null, extractLimit(sqlType));
            }
        });
    }

    /**
     * Adds a mapping after the existing ones.
     * @param regex Pattern of the native type
     * @param factory Factory for the logical type
     */
    public void register(String regex, TypeMapping.Factory factory)
    {
        mappings.add(new TypeMapping(regex, factory));
    }

    private TypeMapping.Factory limited(final LogicalTypeKind kind)
    {
        return new TypeMapping.Factory()
        {
            public LogicalType create(String sqlType)
            {
                return new LogicalType(kind, sqlType, null, null, extractLimit(sqlType));
            }
        };
    }

    private TypeMapping.Factory plain(final LogicalTypeKind kind)
    {
        return new TypeMapping.Factory()
        {
            public LogicalType create(String sqlType)
            {
                return new LogicalType(kind, sqlType);
            }
        };
    }

    /**
     * Resolve the native type string to its logical type.
     * @param sqlType The native type (e.g "VARCHAR2(30)")
     * @return The logical type, of kind VALUE when no mapping matches
     */
    public LogicalType resolve(String sqlType)
    {
        if (sqlType == null)
        {
            return new LogicalType(LogicalTypeKind.VALUE, null);
        }
        for (TypeMapping mapping : mappings)
        {
            if (mapping.matches(sqlType))
            {
                return mapping.create(sqlType);
            }
        }

        if (NucleusLogger.DATASTORE_SCHEMA.isDebugEnabled())
        {
            NucleusLogger.DATASTORE_SCHEMA.debug("No logical type registered for native type \"" + sqlType + "\"");
        }
        return new LogicalType(LogicalTypeKind.VALUE, sqlType);
    }

    /**
     * Whether the native type is a large object (BLOB, CLOB, NCLOB).
     * @param sqlType The native type
     * @return Whether it is a LOB
     */
    public static boolean isLob(String sqlType)
    {
        return sqlType != null && LOB_PATTERN.matcher(sqlType).find();
    }

    /**
     * Extract the limit of a native type, so "VARCHAR2(20)" gives 20.
     * @param sqlType The native type
     * @return The limit, or null if none
     */
    public static Integer extractLimit(String sqlType)
    {
        if (BIGINT_PATTERN.matcher(sqlType).find())
        {
            return 19;
        }
        Matcher m = LIMIT_PATTERN.matcher(sqlType);
        if (m.find())
        {
            return leadingInt(m.group(1));
        }
        return null;
    }

    public static Integer extractPrecision(String sqlType)
    {
        Matcher m = PRECISION_PATTERN.matcher(sqlType);
        if (m.find())
        {
            return Integer.valueOf(m.group(1));
        }
        return null;
    }

    /**
     * Extract the scale of a native type. "NUMBER(10)" gives 0, "NUMBER(10,2)" gives 2 and "NUMBER" gives null.
     * @param sqlType The native type
     * @return The scale
     */
    public static Integer extractScale(String sqlType)
    {
        if (ZERO_SCALE_PATTERN.matcher(sqlType).find())
        {
            return 0;
        }
        Matcher m = SCALE_PATTERN.matcher(sqlType);
        if (m.find())
        {
            return Integer.valueOf(m.group(3));
        }
        return null;
    }

    private static int leadingInt(String str)
    {
        String trimmed = str.trim();
        int end = 0;
        while (end < trimmed.length() && Character.isDigit(trimmed.charAt(end)))
        {
            end++;
        }
        return end == 0 ? 0 : Integer.parseInt(trimmed.substring(0, end));
    }

    /**
     * Native types used for each logical column type when generating DDL.
     * @return The native types, keyed by column type
     */
    public Map<ColumnType, NativeType> getNativeDatabaseTypes()
    {
        Map<ColumnType, NativeType> types = new EnumMap<>(ColumnType.class);
        types.put(ColumnType.PRIMARY_KEY, new NativeType("NUMBER(38) NOT NULL PRIMARY KEY"));
        types.put(ColumnType.STRING, new NativeType("VARCHAR2", 255));
        types.put(ColumnType.TEXT, new NativeType("CLOB"));
        types.put(ColumnType.NTEXT, new NativeType("NCLOB"));
        types.put(ColumnType.INTEGER, new NativeType("NUMBER", 38));
        types.put(ColumnType.FLOAT, new NativeType("BINARY_FLOAT"));
        types.put(ColumnType.DECIMAL, new NativeType("DECIMAL"));
        types.put(ColumnType.DATETIME, new NativeType("TIMESTAMP"));
        types.put(ColumnType.TIMESTAMP, new NativeType("TIMESTAMP"));
        types.put(ColumnType.TIME, new NativeType("TIMESTAMP"));
        types.put(ColumnType.TIMESTAMPTZ, new NativeType("TIMESTAMP WITH TIME ZONE"));
        types.put(ColumnType.TIMESTAMPLTZ, new NativeType("TIMESTAMP WITH LOCAL TIME ZONE"));
        types.put(ColumnType.DATE, new NativeType("DATE"));
        types.put(ColumnType.BINARY, new NativeType("BLOB"));
        types.put(ColumnType.RAW, new NativeType("RAW", 2000));
        types.put(ColumnType.BIGINT, new NativeType("NUMBER", 19));
        if (config.isEmulateBooleansFromStrings())
        {
            types.put(ColumnType.BOOLEAN, new NativeType("VARCHAR2", 1));
        }
        else
        {
            types.put(ColumnType.BOOLEAN, new NativeType("NUMBER", 1));
        }
        return Collections.unmodifiableMap(types);
    }
}
