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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectOutputStream;
import java.io.Serializable;

import org.datanucleus.exceptions.NucleusUserException;

/**
 * Type of an attribute whose value is serialized before being stored in a column of the underlying type.
 * Binary columns receive the Java serialized form, character columns the string form of the value.
 */
public class SerializedType extends LogicalType
{
    private final LogicalType subtype;

    public SerializedType(LogicalType subtype)
    {
        super(subtype.getKind(), subtype.getSqlType(), subtype.getPrecision(), subtype.getScale(), subtype.getLimit());
        this.subtype = subtype;
    }

    @Override
    public boolean isSerializing()
    {
        return true;
    }

    @Override
    public Object serialize(Object value)
    {
        if (value == null)
        {
            return null;
        }
        if (!subtype.isBinary())
        {
            return value.toString();
        }
        if (!(value instanceof Serializable))
        {
            throw new NucleusUserException("Value of type " + value.getClass().getName() + " is not Serializable so can't be stored in " + subtype);
        }

        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(bytes))
        {
            out.writeObject(value);
        }
        catch (IOException ioe)
        {
            throw new NucleusUserException("Failed to serialize value of type " + value.getClass().getName(), ioe);
        }
        return bytes.toByteArray();
    }
}
