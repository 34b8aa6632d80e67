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

/**
 * Thrown when an insert or update violates a unique constraint (ORA-00001).
 */
public class RecordNotUniqueException extends StatementInvalidException
{
    private static final long serialVersionUID = 7329810446120934528L;

    /**
     * Constructs the exception for a driver failure.
     * @param msg the detail message
     * @param errorCode Oracle error code
     * @param cause the driver exception
     */
    public RecordNotUniqueException(String msg, int errorCode, Throwable cause)
    {
        super(msg, errorCode, cause);
    }
}
