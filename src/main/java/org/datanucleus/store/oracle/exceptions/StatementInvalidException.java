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
 * A <tt>StatementInvalidException</tt> is thrown when Oracle rejects a statement, for example because
 * it references a missing table or an invalid identifier. It is also the base class of the more
 * specific constraint violations, and the fallback for Oracle errors without a dedicated classification.
 */
public class StatementInvalidException extends NucleusDataStoreException
{
    private static final long serialVersionUID = 4431675227329847650L;

    /** Oracle error code (the NNNNN in ORA-NNNNN), or 0 when not known. */
    private final int errorCode;

    /**
     * Constructs a statement invalid exception with the specified detail message.
     * @param msg the detail message
     */
    public StatementInvalidException(String msg)
    {
        super(msg);
        this.errorCode = 0;
    }

    /**
     * Constructs a statement invalid exception for a driver failure.
     * @param msg the detail message
     * @param errorCode Oracle error code
     * @param cause the driver exception
     */
    public StatementInvalidException(String msg, int errorCode, Throwable cause)
    {
        super(msg, cause);
        this.errorCode = errorCode;
    }

    /**
     * Accessor for the Oracle error code that caused this exception.
     * @return The error code, or 0 when not raised by the driver
     */
    public int getErrorCode()
    {
        return errorCode;
    }
}
