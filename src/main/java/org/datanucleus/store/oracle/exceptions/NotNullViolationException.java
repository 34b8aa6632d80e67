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
 * Thrown when a NULL is inserted into a column declared NOT NULL (ORA-01400).
 */
public class NotNullViolationException extends StatementInvalidException
{
    private static final long serialVersionUID = -2051781366513322104L;

    /**
     * Constructs the exception for a driver failure.
     * @param msg the detail message
     * @param errorCode Oracle error code
     * @param cause the driver exception
     */
    public NotNullViolationException(String msg, int errorCode, Throwable cause)
    {
        super(msg, errorCode, cause);
    }
}
