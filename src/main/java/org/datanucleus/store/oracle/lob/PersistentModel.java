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
package org.datanucleus.store.oracle.lob;

import org.datanucleus.store.oracle.OracleEnhancedAdapter;
import org.datanucleus.store.oracle.types.LogicalType;

/**
 * View of a persistent object (a row of a table) as needed to write its large object columns after the
 * row has been inserted or updated.
 */
public interface PersistentModel
{
    /**
     * Accessor for the adapter that persists this object.
     * @return The adapter
     */
    OracleEnhancedAdapter getAdapter();

    String getTableName();

    /**
     * Accessor for the primary key column of the table.
     * @return The column name
     */
    String getPrimaryKey();

    /**
     * Accessor for the current value of an attribute.
     * @param name Column name of the attribute
     * @return The value
     */
    Object getAttribute(String name);

    /**
     * Accessor for the type of an attribute, which may be a serializing type.
     * @param name Column name of the attribute
     * @return The type, or null if not known
     */
    LogicalType getAttributeType(String name);

    boolean isReadonlyAttribute(String name);

    /**
     * Whether the attribute has a change that will be written by the next save.
     * @param name Column name of the attribute
     * @return Whether changed
     */
    boolean willSaveChangeToAttribute(String name);

    /**
     * Whether the object is created by custom SQL rather than by the adapter.
     * @return Whether there is a custom create
     */
    boolean hasCustomCreateMethod();

    boolean hasCustomUpdateMethod();
}
