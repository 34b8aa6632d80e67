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

import org.datanucleus.util.Localiser;

/**
 * A <tt>MissingObjectException</tt> is thrown if a table, view or synonym that a statement refers to
 * cannot be found in the Oracle data dictionary.
 */
public class MissingObjectException extends StatementInvalidException
{
    private static final long serialVersionUID = -5327406110917628164L;

    /**
     * Constructs a missing object exception.
     * @param owner Schema which was searched
     * @param name Name of the object that was missing
     */
    public MissingObjectException(String owner, String name)
    {
        super(Localiser.msg("059002", owner, name));
    }
}
