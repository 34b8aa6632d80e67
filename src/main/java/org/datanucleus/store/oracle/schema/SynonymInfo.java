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

import org.datanucleus.store.schema.StoreSchemaData;

/**
 * Represents a synonym owned by the session user.
 */
public class SynonymInfo implements StoreSchemaData
{
    final String name;

    final String tableOwner;

    final String tableName;

    final String dbLink;

    public SynonymInfo(String name, String tableOwner, String tableName, String dbLink)
    {
        this.name = name;
        this.tableOwner = tableOwner;
        this.tableName = tableName;
        this.dbLink = dbLink;
    }

    public String getName()
    {
        return name;
    }

    public String getTableOwner()
    {
        return tableOwner;
    }

    public String getTableName()
    {
        return tableName;
    }

    /**
     * Accessor for the database link of the target.
     * @return The link, or null when the target is local
     */
    public String getDbLink()
    {
        return dbLink;
    }

    public void addProperty(String name, Object value)
    {
        throw new UnsupportedOperationException("Synonym information is read-only");
    }

    public Object getProperty(String propName)
    {
        switch (propName)
        {
            case "name" :
                return name;
            case "table_owner" :
                return tableOwner;
            case "table_name" :
                return tableName;
            case "db_link" :
                return dbLink;
            default :
                return null;
        }
    }

    public String toString()
    {
        return "SynonymInfo : " + name + " FOR " + (tableOwner != null ? tableOwner + "." : "") + tableName +
            (dbLink != null ? "@" + dbLink : "");
    }
}
