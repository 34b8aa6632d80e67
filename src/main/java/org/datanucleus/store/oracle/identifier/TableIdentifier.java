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

/**
 * Fully resolved reference to a table (or view) : owning schema, object name as stored in the catalog,
 * and the database link suffix ("@LINK", or empty when the object is local).
 */
public class TableIdentifier
{
    final String owner;

    final String name;

    final String dbLink;

    public TableIdentifier(String owner, String name, String dbLink)
    {
        this.owner = owner;
        this.name = name;
        this.dbLink = dbLink != null ? dbLink : "";
    }

    public String getOwner()
    {
        return owner;
    }

    public String getName()
    {
        return name;
    }

    /**
     * Accessor for the database link suffix, to be appended to catalog view names.
     * @return "@LINK" or the empty string
     */
    public String getDbLink()
    {
        return dbLink;
    }

    public boolean isRemote()
    {
        return dbLink.length() > 0;
    }

    public boolean equals(Object obj)
    {
        if (obj == this)
        {
            return true;
        }
        if (!(obj instanceof TableIdentifier))
        {
            return false;
        }
        TableIdentifier other = (TableIdentifier)obj;
        return (owner == null ? other.owner == null : owner.equals(other.owner)) && name.equals(other.name) && dbLink.equals(other.dbLink);
    }

    public int hashCode()
    {
        return (owner != null ? owner.hashCode() : 0) ^ name.hashCode() ^ dbLink.hashCode();
    }

    public String toString()
    {
        return (owner != null ? owner + "." : "") + name + dbLink;
    }
}
