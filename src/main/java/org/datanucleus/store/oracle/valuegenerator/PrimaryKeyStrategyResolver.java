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
package org.datanucleus.store.oracle.valuegenerator;

import org.datanucleus.store.oracle.OracleAdapterConfiguration;
import org.datanucleus.store.oracle.SQLController;
import org.datanucleus.store.oracle.adapter.OracleDialect;
import org.datanucleus.store.oracle.identifier.OracleIdentifierResolver;
import org.datanucleus.store.oracle.identifier.TableIdentifier;
import org.datanucleus.store.oracle.schema.OracleSchemaHandler;
import org.datanucleus.store.oracle.schema.SequenceBinding;
import org.datanucleus.store.oracle.sql.OracleSQLTranslator;
import org.datanucleus.store.oracle.sql.SQLText;
import org.datanucleus.util.Localiser;
import org.datanucleus.util.NucleusLogger;

/**
 * Decides how primary key values are provided for a table, and generates them from sequences.
 * Oracle (before identity columns) has no auto-increment, so keys are either fetched from the sequence of
 * the table ("&lt;table&gt;_seq") before the insert, or set by a trigger ("&lt;table&gt;_pkt") during it.
 * Nothing is cached, the strategy is worked out from the data dictionary on each call.
 */
public class PrimaryKeyStrategyResolver
{
    /** Sequence name that a model can configure to state that its key is populated by a trigger. */
    public static final String AUTOGENERATED_SEQUENCE_NAME = "autogenerated";

    protected final SQLController sqlController;

    protected final OracleDialect dialect;

    protected final OracleSchemaHandler schemaHandler;

    protected final OracleIdentifierResolver identifierResolver;

    protected final OracleSQLTranslator translator;

    public PrimaryKeyStrategyResolver(SQLController sqlController, OracleDialect dialect, OracleSchemaHandler schemaHandler,
            OracleIdentifierResolver identifierResolver, OracleSQLTranslator translator)
    {
        this.sqlController = sqlController;
        this.dialect = dialect;
        this.schemaHandler = schemaHandler;
        this.identifierResolver = identifierResolver;
        this.translator = translator;
    }

    /**
     * Accessor for the key binding of a table, flagged as trigger populated when the model configured the
     * "autogenerated" sequence name, or when the table has a primary key trigger.
     * @param tableName The table reference
     * @param configuredSequenceName Sequence name configured for the model (optional)
     * @return The binding, or null when the table has no single column primary key
     */
    public SequenceBinding getSequenceBinding(String tableName, String configuredSequenceName)
    {
        TableIdentifier ident = identifierResolver.describe(tableName);
        SequenceBinding binding = schemaHandler.getPkAndSequence(tableName, ident);
        if (binding == null)
        {
            return null;
        }
        if (AUTOGENERATED_SEQUENCE_NAME.equals(configuredSequenceName) || schemaHandler.hasPrimaryKeyTrigger(tableName, ident))
        {
            return binding.withTriggerPopulated();
        }
        if (configuredSequenceName != null)
        {
            return new SequenceBinding(binding.getPrimaryKey(), configuredSequenceName);
        }
        return binding;
    }

    /**
     * Accessor for how keys of the table are provided.
     * @param tableName The table reference
     * @param configuredSequenceName Sequence name configured for the model (optional)
     * @return The strategy
     */
    public PrimaryKeyStrategy getStrategy(String tableName, String configuredSequenceName)
    {
        SequenceBinding binding = getSequenceBinding(tableName, configuredSequenceName);
        if (binding == null)
        {
            return PrimaryKeyStrategy.NO_KEY;
        }
        return binding.isTriggerPopulated() ? PrimaryKeyStrategy.TRIGGER_POPULATED : PrimaryKeyStrategy.SEQUENCE_PREFETCH;
    }

    /**
     * Whether key values have to be fetched before inserting into the table.
     * Without a table the answer is the general one for Oracle, which is yes.
     * @param tableName The table reference (optional)
     * @return Whether to prefetch
     */
    public boolean prefetchPrimaryKey(String tableName)
    {
        if (tableName == null)
        {
            return true;
        }
        TableIdentifier ident = identifierResolver.describe(tableName);
        boolean hasPrimaryKey = schemaHandler.getPkAndSequence(tableName, ident) != null;
        return hasPrimaryKey && !schemaHandler.hasPrimaryKeyTrigger(tableName, ident);
    }

    /**
     * Fetch the next value of a sequence.
     * @param sequenceName The sequence
     * @return The value, or null when the sequence name is "autogenerated" (key set by a trigger)
     */
    public Long nextSequenceValue(String sequenceName)
    {
        if (AUTOGENERATED_SEQUENCE_NAME.equals(sequenceName))
        {
            return null;
        }
        Object value = sqlController.selectValue(new SQLText(translator.getSequenceNextStmt(sequenceName)), "Sequence");
        if (NucleusLogger.VALUEGENERATION.isDebugEnabled())
        {
            NucleusLogger.VALUEGENERATION.debug("Sequence " + sequenceName + " returned " + value);
        }
        return value != null ? Long.valueOf(((Number)value).longValue()) : null;
    }

    /**
     * Reset the sequence of a table so that it next returns a value above the current maximum key.
     * The sequence is dropped and recreated, so a concurrent insert can fail in between.
     * @param tableName The table reference
     * @param primaryKey The key column (optional, found from the table if not given)
     * @param sequenceName The sequence (optional, defaults to "&lt;table&gt;_seq")
     */
    public void resetPkSequence(String tableName, String primaryKey, String sequenceName)
    {
        if (!schemaHandler.dataSourceExists(tableName))
        {
            return;
        }

        String pk = primaryKey;
        String sequence = sequenceName;
        if (pk == null || sequence == null)
        {
            SequenceBinding binding = schemaHandler.getPkAndSequence(tableName);
            pk = binding != null ? binding.getPrimaryKey() : null;
            if (sequence == null)
            {
                sequence = dialect.getDefaultSequenceName(tableName);
            }
        }

        if (pk != null && sequence == null)
        {
            NucleusLogger.VALUEGENERATION.warn(Localiser.msg("059004", tableName, pk));
        }
        if (pk == null || sequence == null)
        {
            return;
        }

        SQLText maxStmt = new SQLText("SELECT NVL(MAX(");
        maxStmt.append(OracleIdentifierResolver.quoteColumnName(pk)).append("), 0) + 1 FROM ");
        maxStmt.append(OracleIdentifierResolver.quoteTableName(tableName));
        Object newStart = sqlController.selectValue(maxStmt, "Sequence start");
        long startValue = ((Number)newStart).longValue();

        NucleusLogger.VALUEGENERATION.info(Localiser.msg("059005", sequence, tableName, String.valueOf(startValue)));
        sqlController.execute(translator.getSequenceDropStmt(sequence), "Sequence");
        sqlController.execute(translator.getSequenceCreateStmt(sequence, startValue), "Sequence");
    }

    /**
     * Create the sequence for a new table, starting at the configured default start value.
     * @param tableName The table
     * @return Name of the sequence created
     */
    public String createPkSequence(String tableName)
    {
        OracleAdapterConfiguration config = dialect.getConfiguration();
        String sequence = dialect.getDefaultSequenceName(tableName);
        sqlController.execute(translator.getSequenceCreateStmt(sequence, config.getDefaultSequenceStartValue()), "Sequence");
        return sequence;
    }

    /**
     * Accessor for the name of the sequence of a table.
     * @param tableName The table
     * @return The default sequence name
     */
    public String getDefaultSequenceName(String tableName)
    {
        return dialect.getDefaultSequenceName(tableName);
    }

    public String getDefaultTriggerName(String tableName)
    {
        return dialect.getDefaultTriggerName(tableName);
    }
}
