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
package org.datanucleus.store.oracle.exceptions;

import org.datanucleus.exceptions.NucleusDataStoreException;

/**
 * Thrown when a row that is expected to exist cannot be found, for example when the row whose
 * LOB columns are being populated was deleted before it could be locked.
 */
public class RecordNotFoundException extends NucleusDataStoreException
{
    private static final long serialVersionUID = 2286913370217146902L;

    public RecordNotFoundException(String msg)
    {
        super(msg);
    }
}
