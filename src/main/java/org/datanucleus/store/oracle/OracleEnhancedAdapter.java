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

import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

import org.datanucleus.exceptions.NucleusDataStoreException;
import org.datanucleus.store.oracle.adapter.OracleDialect;
import org.datanucleus.store.oracle.exceptions.ConnectionException;
import org.datanucleus.store.oracle.exceptions.OracleExceptionClassifier;
import org.datanucleus.store.oracle.identifier.OracleIdentifierResolver;
import org.datanucleus.store.oracle.identifier.TableIdentifier;
import org.datanucleus.store.oracle.lob.LobWriteCoordinator;
import org.datanucleus.store.oracle.lob.PersistentModel;
import org.datanucleus.store.oracle.schema.OracleColumnInfo;
import org.datanucleus.store.oracle.schema.OracleIndexInfo;
import org.datanucleus.store.oracle.schema.OracleSchemaHandler;
import org.datanucleus.store.oracle.schema.SequenceBinding;
import org.datanucleus.store.oracle.schema.SynonymInfo;
import org.datanucleus.store.oracle.sql.OracleSQLTranslator;
import org.datanucleus.store.oracle.sql.SQLText;
import org.datanucleus.store.oracle.types.ColumnType;
import org.datanucleus.store.oracle.types.LogicalType;
import org.datanucleus.store.oracle.types.NativeType;
import org.datanucleus.store.oracle.types.OracleTypeRegistry;
import org.datanucleus.store.oracle.valuegenerator.PrimaryKeyStrategy;
import org.datanucleus.store.oracle.valuegenerator.PrimaryKeyStrategyResolver;
import org.datanucleus.util.Localiser;
import org.datanucleus.util.NucleusLogger;

/**
 * Adapter between an object-relational mapping layer and an Oracle database, for one session.
 * Provides introspection of the schema, Oracle-specific SQL, generation of primary key values,
 * classification of errors, and writing of large objects. The work is delegated to the components
 * created here, which are all available through accessors.
 */
public class OracleEnhancedAdapter
{
    static
    {
        Localiser.registerBundle("org.datanucleus.store.oracle.Localisation", OracleEnhancedAdapter.class.getClassLoader());
    }

    public static final String ADAPTER_NAME = "OracleEnhanced";

    protected final OracleAdapterConfiguration config;

    protected final SQLController sqlController;

    protected final OracleDialect dialect;

    protected final OracleTypeRegistry typeRegistry;

    protected final OracleIdentifierResolver identifierResolver;

    protected final OracleSchemaHandler schemaHandler;

    protected final OracleSQLTranslator translator;

    protected final PrimaryKeyStrategyResolver pkStrategyResolver;

    protected final LobWriteCoordinator lobWriter;

    /**
     * Constructor for an adapter that connects using the provider, reading the server version from the
     * metadata of the connection.
     * @param connectionProvider Provider of the connection
     * @param config Configuration
     * @throws ConnectionException if the connection cannot be established
     */
    public OracleEnhancedAdapter(ConnectionProvider connectionProvider, OracleAdapterConfiguration config)
    {
        this(new SQLController(connectionProvider, new OracleExceptionClassifier(), config.isAutoRetry()), config);
    }

    private OracleEnhancedAdapter(SQLController sqlController, OracleAdapterConfiguration config)
    {
        this(sqlController, new OracleDialect(readMetaData(sqlController), config));
    }

    /**
     * Constructor for an adapter using the statement controller, for a server of known version.
     * @param sqlController The statement controller
     * @param dialect The dialect of the server
     */
    public OracleEnhancedAdapter(SQLController sqlController, OracleDialect dialect)
    {
        this.config = dialect.getConfiguration();
        this.sqlController = sqlController;
        this.dialect = dialect;
        this.typeRegistry = new OracleTypeRegistry(config);
        this.identifierResolver = new OracleIdentifierResolver(sqlController);
        this.schemaHandler = new OracleSchemaHandler(sqlController, dialect, identifierResolver, typeRegistry);
        this.translator = new OracleSQLTranslator(dialect, typeRegistry.getNativeDatabaseTypes());
        this.pkStrategyResolver = new PrimaryKeyStrategyResolver(sqlController, dialect, schemaHandler, identifierResolver, translator);
        this.lobWriter = new LobWriteCoordinator(this, sqlController);

        if (NucleusLogger.DATASTORE.isDebugEnabled())
        {
            NucleusLogger.DATASTORE.debug("Initialised " + ADAPTER_NAME + " adapter : " + dialect + " " + config);
        }
    }

    private static DatabaseMetaData readMetaData(SQLController sqlController)
    {
        try
        {
            return sqlController.getConnection().getMetaData();
        }
        catch (SQLException sqle)
        {
            throw new NucleusDataStoreException("Can't read JDBC metadata of the Oracle connection", sqle).setFatal();
        }
    }

    public String getAdapterName()
    {
        return ADAPTER_NAME;
    }

    public OracleAdapterConfiguration getConfiguration()
    {
        return config;
    }

    public SQLController getSQLController()
    {
        return sqlController;
    }

    public OracleDialect getDialect()
    {
        return dialect;
    }

    public OracleTypeRegistry getTypeRegistry()
    {
        return typeRegistry;
    }

    public OracleIdentifierResolver getIdentifierResolver()
    {
        return identifierResolver;
    }

    public OracleSchemaHandler getSchemaHandler()
    {
        return schemaHandler;
    }

    public OracleSQLTranslator getTranslator()
    {
        return translator;
    }

    public PrimaryKeyStrategyResolver getPrimaryKeyStrategyResolver()
    {
        return pkStrategyResolver;
    }

    public LobWriteCoordinator getLobWriter()
    {
        return lobWriter;
    }

    // --------------------------------- Connection ---------------------------------

    /**
     * Whether the session is still usable, checked by pinging the server.
     * @return Whether active
     */
    public boolean isActive()
    {
        try
        {
            sqlController.ping();
            return true;
        }
        catch (ConnectionException ce)
        {
            NucleusLogger.CONNECTION.debug(ce.getMessage());
            return false;
        }
    }

    /**
     * Replace the connection of the session with a new one. A failure to reconnect is logged, and the
     * next statement will try to connect again.
     */
    public void reconnect()
    {
        try
        {
            sqlController.reconnect();
        }
        catch (ConnectionException ce)
        {
            NucleusLogger.CONNECTION.warn(Localiser.msg("059015", ce.getMessage()));
        }
    }

    public void disconnect()
    {
        sqlController.close();
    }

    /**
     * Convert a driver error into the exception for its kind.
     * @param sqle The driver error
     * @param message Message for the exception
     * @return The exception
     */
    public NucleusDataStoreException translateException(SQLException sqle, String message)
    {
        return sqlController.getExceptionClassifier().translate(sqle, message);
    }

    // --------------------------------- Capabilities ---------------------------------

    public boolean supportsFetchFirstNRowsAndOffset()
    {
        return dialect.supportsFetchFirstNRowsAndOffset();
    }

    public boolean supportsMultiInsert()
    {
        return dialect.supportsMultiInsert();
    }

    public boolean supportsVirtualColumns()
    {
        return dialect.supportsVirtualColumns();
    }

    public boolean supportsJson()
    {
        return dialect.supportsJson();
    }

    public Map<ColumnType, NativeType> getNativeDatabaseTypes()
    {
        return typeRegistry.getNativeDatabaseTypes();
    }

    public LogicalType lookupType(String sqlType)
    {
        return typeRegistry.resolve(sqlType);
    }

    // --------------------------------- Schema ---------------------------------

    public TableIdentifier describe(String tableName)
    {
        return identifierResolver.describe(tableName);
    }

    public List<OracleColumnInfo> getColumns(String tableName)
    {
        return schemaHandler.getColumns(tableName);
    }

    public List<OracleIndexInfo> getIndexes(String tableName)
    {
        return schemaHandler.getIndexes(tableName);
    }

    public SequenceBinding getPkAndSequence(String tableName)
    {
        return schemaHandler.getPkAndSequence(tableName);
    }

    public String getPrimaryKey(String tableName)
    {
        return schemaHandler.getPrimaryKey(tableName);
    }

    public boolean hasPrimaryKey(String tableName)
    {
        return schemaHandler.getPkAndSequence(tableName) != null;
    }

    public List<String> getPrimaryKeys(String tableName)
    {
        return schemaHandler.getPrimaryKeys(tableName);
    }

    public boolean hasPrimaryKeyTrigger(String tableName)
    {
        return schemaHandler.hasPrimaryKeyTrigger(tableName);
    }

    public List<String> getTables()
    {
        return schemaHandler.getTables();
    }

    public List<String> getViews()
    {
        return schemaHandler.getViews();
    }

    public List<String> getMaterializedViews()
    {
        return schemaHandler.getMaterializedViews();
    }

    public List<SynonymInfo> getSynonyms()
    {
        return schemaHandler.getSynonyms();
    }

    public List<String> getDataSources()
    {
        return schemaHandler.getDataSources();
    }

    public boolean tableExists(String tableName)
    {
        return schemaHandler.tableExists(tableName);
    }

    public boolean dataSourceExists(String tableName)
    {
        return schemaHandler.dataSourceExists(tableName);
    }

    public boolean isTemporaryTable(String tableName)
    {
        return schemaHandler.isTemporaryTable(tableName);
    }

    public String getCurrentDatabase()
    {
        return schemaHandler.getCurrentDatabase();
    }

    public String getCurrentUser()
    {
        return schemaHandler.getCurrentUser();
    }

    public String getCurrentSchema()
    {
        return schemaHandler.getCurrentSchema();
    }

    public String getDefaultTablespace()
    {
        return schemaHandler.getDefaultTablespace();
    }

    // --------------------------------- SQL ---------------------------------

    public SQLText applyRange(SQLText query, Long offset, Long limit)
    {
        return translator.applyRange(query, offset, limit);
    }

    public String columnsForDistinct(String columns, List<String> orders)
    {
        return translator.columnsForDistinct(columns, orders);
    }

    public String typeToSql(ColumnType type, Integer limit, Integer precision, Integer scale)
    {
        return translator.typeToSql(type, limit, precision, scale);
    }

    public String quoteTableName(String name)
    {
        return OracleIdentifierResolver.quoteTableName(name);
    }

    public String quoteColumnName(String name)
    {
        return OracleIdentifierResolver.quoteColumnName(name);
    }

    // --------------------------------- Primary keys ---------------------------------

    public PrimaryKeyStrategy getPrimaryKeyStrategy(String tableName, String configuredSequenceName)
    {
        return pkStrategyResolver.getStrategy(tableName, configuredSequenceName);
    }

    public boolean prefetchPrimaryKey(String tableName)
    {
        return pkStrategyResolver.prefetchPrimaryKey(tableName);
    }

    public Long nextSequenceValue(String sequenceName)
    {
        return pkStrategyResolver.nextSequenceValue(sequenceName);
    }

    public void resetPkSequence(String tableName, String primaryKey, String sequenceName)
    {
        pkStrategyResolver.resetPkSequence(tableName, primaryKey, sequenceName);
    }

    public String createPkSequence(String tableName)
    {
        return pkStrategyResolver.createPkSequence(tableName);
    }

    public String getDefaultSequenceName(String tableName)
    {
        return dialect.getDefaultSequenceName(tableName);
    }

    // --------------------------------- LOBs ---------------------------------

    public List<OracleColumnInfo> recordChangedLobs(PersistentModel model, List<OracleColumnInfo> columns)
    {
        return lobWriter.recordChangedLobs(model, columns);
    }

    public boolean enhancedWriteLobs(PersistentModel model, List<OracleColumnInfo> changedLobColumns)
    {
        return lobWriter.enhancedWriteLobs(model, changedLobColumns);
    }

    public void writeLobs(PersistentModel model, List<OracleColumnInfo> columns)
    {
        lobWriter.writeLobs(model, columns);
    }

    public String toString()
    {
        return ADAPTER_NAME + " " + dialect;
    }
}
