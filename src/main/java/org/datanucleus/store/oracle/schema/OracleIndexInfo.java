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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.datanucleus.store.schema.StoreSchemaData;

/**
 * Represents the metadata of an index of a table (other than the primary key index).
 * The columns are in index order; for function-based indexes the column is the indexed expression.
 * Domain indexes carry their index type ("owner.name"), and Oracle Text context indexes the parameters
 * that were passed when creating them.
 */
public class OracleIndexInfo implements StoreSchemaData
{
    final String tableName;

    final String indexName;

    final boolean unique;

    final List<String> columns = new ArrayList<>();

    final String type;

    final String parameters;

    final String statementParameters;

    final String tablespace;

    /**
     * @param tableName Table (lower case)
     * @param indexName Index name (lower case)
     * @param unique Whether unique
     * @param type Index type for domain indexes, otherwise null
     * @param parameters Raw PARAMETERS of the index
     * @param statementParameters Parameters of the context index, otherwise null
     * @param tablespace Tablespace, or null when that is the user's default tablespace
     */
    public OracleIndexInfo(String tableName, String indexName, boolean unique, String type, String parameters,
            String statementParameters, String tablespace)
    {
        this.tableName = tableName;
        this.indexName = indexName;
        this.unique = unique;
        this.type = type;
        this.parameters = parameters;
        this.statementParameters = statementParameters;
        this.tablespace = tablespace;
    }

    void addColumn(String column)
    {
        columns.add(column);
    }

    public String getTableName()
    {
        return tableName;
    }

    public String getIndexName()
    {
        return indexName;
    }

    public boolean isUnique()
    {
        return unique;
    }

    public List<String> getColumns()
    {
        return Collections.unmodifiableList(columns);
    }

    public String getType()
    {
        return type;
    }

    public String getParameters()
    {
        return parameters;
    }

    public String getStatementParameters()
    {
        return statementParameters;
    }

    public String getTablespace()
    {
        return tablespace;
    }

    public void addProperty(String name, Object value)
    {
        throw new UnsupportedOperationException("Index information is read-only");
    }

    public Object getProperty(String name)
    {
        switch (name)
        {
            case "table_name" :
                return tableName;
            case "index_name" :
                return indexName;
            case "unique" :
                return Boolean.valueOf(unique);
            case "columns" :
                return getColumns();
            case "type" :
                return type;
            case "parameters" :
                return parameters;
            case "statement_parameters" :
                return statementParameters;
            case "tablespace" :
                return tablespace;
            default :
                return null;
        }
    }

    public String toString()
    {
        return "OracleIndexInfo : " + (unique ? "UNIQUE " : "") + indexName + " ON " + tableName + " " + columns +
            (type != null ? " INDEXTYPE IS " + type : "") + (tablespace != null ? " TABLESPACE " + tablespace : "");
    }
}
