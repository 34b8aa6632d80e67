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
package org.datanucleus.store.oracle.identifier;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

import org.datanucleus.store.oracle.SQLController;
import org.datanucleus.store.oracle.exceptions.MissingObjectException;
import org.datanucleus.store.oracle.sql.SQLText;
import org.datanucleus.util.Localiser;
import org.datanucleus.util.NucleusLogger;

/**
 * Resolves table references as written by the user ("employees", "hr.employees", "EMPLOYEES@REMOTE") into
 * catalog identifiers, and quotes identifiers for use in SQL.
 * <p>
 * Oracle stores unquoted identifiers in upper case. Any name that would be valid unquoted, and is not in
 * mixed case, is therefore upper-cased before looking it up; any other name is taken as-is.
 * Names read back from the catalog are presented in lower case unless they contain lower-case characters
 * (see {@link #oracleDowncase(String)}).
 * </p>
 */
public class OracleIdentifierResolver
{
    private static final Pattern VALID_TABLE_NAME = Pattern.compile(
        "^(?:[A-Z][A-Z0-9_$#]*\\.)?[A-Z][A-Z0-9_$#]*(?:@[A-Z][A-Z0-9_$#.-]*)?$", Pattern.CASE_INSENSITIVE);

    private static final Pattern LOWER_CASE_NAME = Pattern.compile("^[a-z][a-z_0-9$#]*$");

    private static final Pattern HAS_LOWER = Pattern.compile("[a-z]");

    private static final Pattern HAS_UPPER = Pattern.compile("[A-Z]");

    protected final SQLController sqlController;

    public OracleIdentifierResolver(SQLController sqlController)
    {
        this.sqlController = sqlController;
    }

    /**
     * Accessor for the schema that unqualified names resolve against in this session.
     * @return The current schema
     */
    public String getCurrentSchema()
    {
        return sqlController.selectString(new SQLText("SELECT SYS_CONTEXT('userenv', 'current_schema') FROM dual"), "SCHEMA");
    }

    /**
     * Whether the name is a valid unquoted table reference (optionally owner-qualified and with a db link),
     * and the object name is not mixed case.
     * @param name The name
     * @return Whether valid
     */
    public static boolean isValidTableName(String name)
    {
        return name != null && VALID_TABLE_NAME.matcher(name).matches() && !isMixedCase(name);
    }

    private static boolean isMixedCase(String name)
    {
        String objectName = name;
        int dotPos = objectName.indexOf('.');
        if (dotPos >= 0)
        {
            objectName = objectName.substring(dotPos + 1);
        }
        return HAS_UPPER.matcher(objectName).find() && HAS_LOWER.matcher(objectName).find();
    }

    /**
     * Lower-case a catalog name for presentation, unless it contains lower-case characters in which
     * case it was created quoted and is returned unchanged.
     * @param name The name (may be null)
     * @return The presented name
     */
    public static String oracleDowncase(String name)
    {
        if (name == null)
        {
            return null;
        }
        return HAS_LOWER.matcher(name).find() ? name : name.toLowerCase(Locale.ENGLISH);
    }

    /**
     * Resolve a table reference without consulting the catalog, other than for the session schema when
     * the reference is not owner-qualified.
     * @param tableRef The reference, e.g "hr.employees" or "employees@remote"
     * @return The identifier
     */
    public TableIdentifier resolve(String tableRef)
    {
        String realName = isValidTableName(tableRef) ? tableRef.toUpperCase(Locale.ENGLISH) : tableRef;

        String dbLink = "";
        int atPos = realName.indexOf('@');
        if (atPos >= 0)
        {
            dbLink = realName.substring(atPos);
            realName = realName.substring(0, atPos);
        }

        int dotPos = realName.indexOf('.');
        if (dotPos >= 0)
        {
            return new TableIdentifier(realName.substring(0, dotPos), realName.substring(dotPos + 1), dbLink);
        }
        return new TableIdentifier(getCurrentSchema(), realName, dbLink);
    }

    /**
     * Resolve a table reference against the catalog. Tables, views and materialized views are found directly,
     * otherwise a private (or public) synonym of that name is followed one level.
     * @param tableRef The reference
     * @return The identifier of the object actually holding the data
     * @throws MissingObjectException if no such object is visible
     */
    public TableIdentifier describe(String tableRef)
    {
        TableIdentifier ident = resolve(tableRef);
        TableIdentifier found = findObject(ident);
        if (found != null)
        {
            return found;
        }

        SQLText synStmt = new SQLText("SELECT table_owner, table_name, db_link FROM all_synonyms");
        synStmt.append(ident.getDbLink());
        synStmt.append(" WHERE synonym_name = ").appendParameter("synonym_name", ident.getName());
        synStmt.append(" AND (owner = ").appendParameter("owner", ident.getOwner());
        synStmt.append(" OR owner = 'PUBLIC') ORDER BY DECODE(owner, 'PUBLIC', 1, 0)");
        Map<String, Object> synonym = sqlController.selectOne(synStmt, "CONNECTION");
        if (synonym != null)
        {
            String targetOwner = (String)synonym.get("table_owner");
            String targetName = (String)synonym.get("table_name");
            String synLink = (String)synonym.get("db_link");
            String targetLink = synLink != null ? "@" + synLink : ident.getDbLink();
            if (NucleusLogger.DATASTORE_SCHEMA.isDebugEnabled())
            {
                NucleusLogger.DATASTORE_SCHEMA.debug("Synonym " + ident + " refers to " + targetOwner + "." + targetName + targetLink);
            }

            TableIdentifier target = new TableIdentifier(targetOwner, targetName, targetLink);
            if (synLink != null)
            {
                // Can't look into the remote catalog reliably, so trust the synonym
                return target;
            }
            found = findObject(target);
            if (found != null)
            {
                return found;
            }
        }

        NucleusLogger.DATASTORE_SCHEMA.debug(Localiser.msg("059002", ident.getOwner(), ident.getName()));
        throw new MissingObjectException(ident.getOwner(), ident.getName());
    }

    protected TableIdentifier findObject(TableIdentifier ident)
    {
        SQLText stmt = new SQLText("SELECT owner, object_name FROM all_objects");
        stmt.append(ident.getDbLink());
        stmt.append(" WHERE owner = ").appendParameter("owner", ident.getOwner());
        stmt.append(" AND object_name = ").appendParameter("object_name", ident.getName());
        stmt.append(" AND object_type IN ('TABLE', 'VIEW', 'MATERIALIZED VIEW')");
        Map<String, Object> row = sqlController.selectOne(stmt, "CONNECTION");
        if (row == null)
        {
            return null;
        }
        return new TableIdentifier((String)row.get("owner"), (String)row.get("object_name"), ident.getDbLink());
    }

    /**
     * Quote a column name. Lower-case names that are valid unquoted are upper-cased, so that they refer to
     * the column created without quotes.
     * @param name The column name
     * @return The quoted name
     */
    public static String quoteColumnName(String name)
    {
        if (LOWER_CASE_NAME.matcher(name).matches())
        {
            return "\"" + name.toUpperCase(Locale.ENGLISH) + "\"";
        }
        return "\"" + name + "\"";
    }

    /**
     * Quote a table reference, quoting the owner and table parts separately and leaving any db link as-is.
     * @param name The table reference, e.g "hr.employees@remote"
     * @return The quoted reference
     */
    public static String quoteTableName(String name)
    {
        String tableName = name;
        String dbLink = null;
        int atPos = name.indexOf('@');
        if (atPos >= 0)
        {
            tableName = name.substring(0, atPos);
            dbLink = name.substring(atPos + 1);
        }

        StringBuilder str = new StringBuilder();
        String[] parts = tableName.split("\\.");
        for (int i = 0; i < parts.length; i++)
        {
            if (i > 0)
            {
                str.append('.');
            }
            str.append(quoteColumnName(parts[i]));
        }
        if (dbLink != null)
        {
            str.append('@').append(dbLink);
        }
        return str.toString();
    }
}
