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

/**
 * Native Oracle type used for a {@link ColumnType} in DDL, with its default limit (if any).
 */
public class NativeType
{
    final String name;

    final Integer limit;

    public NativeType(String name)
    {
        this(name, null);
    }

    public NativeType(String name, Integer limit)
    {
        this.name = name;
        this.limit = limit;
    }

    public String getName()
    {
        return name;
    }

    /**
     * Accessor for the default limit of the type.
     * @return The limit, or null when the type takes no length
     */
    public Integer getLimit()
    {
        return limit;
    }

    public boolean equals(Object obj)
    {
        if (obj == this)
        {
            return true;
        }
        if (!(obj instanceof NativeType))
        {
            return false;
        }
        NativeType other = (NativeType)obj;
        return name.equals(other.name) && (limit == null ? other.limit == null : limit.equals(other.limit));
    }

    public int hashCode()
    {
        return name.hashCode() ^ (limit == null ? 0 : limit.hashCode());
    }

    public String toString()
    {
        return limit != null ? (name + "(" + limit + ")") : name;
    }
}
