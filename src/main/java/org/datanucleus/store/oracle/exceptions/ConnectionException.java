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
 * A <tt>ConnectionException</tt> is thrown when the connection to Oracle is lost or unavailable
 * (ORA-03113, ORA-03114 and friends, or any SQLState of class 08).
 */
public class ConnectionException extends NucleusDataStoreException
{
    private static final long serialVersionUID = -1733417296215367470L;

    public ConnectionException(String msg)
    {
        super(msg);
    }

    public ConnectionException(String msg, Throwable cause)
    {
        super(msg, cause);
    }
}
