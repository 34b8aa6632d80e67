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
 * The single-column primary key of a table, with the sequence that provides its values.
 * The sequence is null when the table has no sequence of the default name. A key that is populated by
 * a trigger on insert is flagged as such, in which case no value is fetched before inserting.
 */
public class SequenceBinding implements StoreSchemaData
{
    final String primaryKey;

    final String sequenceName;

    final boolean triggerPopulated;

    public SequenceBinding(String primaryKey, String sequenceName)
    {
        this(primaryKey, sequenceName, false);
    }

    public SequenceBinding(String primaryKey, String sequenceName, boolean triggerPopulated)
    {
        this.primaryKey = primaryKey;
        this.sequenceName = sequenceName;
        this.triggerPopulated = triggerPopulated;
    }

    public String getPrimaryKey()
    {
        return primaryKey;
    }

    public String getSequenceName()
    {
        return sequenceName;
    }

    public boolean hasSequence()
    {
        return sequenceName != null;
    }

    public boolean isTriggerPopulated()
    {
        return triggerPopulated;
    }

    /**
     * Copy of this binding flagged as populated by a trigger.
     * @return The binding
     */
    public SequenceBinding withTriggerPopulated()
    {
        return new SequenceBinding(primaryKey, sequenceName, true);
    }

    public void addProperty(String name, Object value)
    {
        throw new UnsupportedOperationException("Sequence binding is read-only");
    }

    public Object getProperty(String propName)
    {
        switch (propName)
        {
            case "primary_key" :
                return primaryKey;
            case "sequence_name" :
                return sequenceName;
            case "trigger_populated" :
                return Boolean.valueOf(triggerPopulated);
            default :
                return null;
        }
    }

    public boolean equals(Object obj)
    {
        if (obj == this)
        {
            return true;
        }
        if (!(obj instanceof SequenceBinding))
        {
            return false;
        }
        SequenceBinding other = (SequenceBinding)obj;
        return primaryKey.equals(other.primaryKey) && triggerPopulated == other.triggerPopulated &&
            (sequenceName == null ? other.sequenceName == null : sequenceName.equals(other.sequenceName));
    }

    public int hashCode()
    {
        return primaryKey.hashCode() ^ (sequenceName != null ? sequenceName.hashCode() : 0);
    }

    public String toString()
    {
        return "SequenceBinding pk=" + primaryKey + " sequence=" + sequenceName + (triggerPopulated ? " (trigger)" : "");
    }
}
