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

import java.sql.SQLException;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import org.datanucleus.exceptions.NucleusDataStoreException;

/**
 * Maps Oracle error codes onto the exception hierarchy of the adapter.
 * <table>
 * <caption>Classified codes</caption>
 * <tr><th>Code</th><th>Meaning</th><th>Exception</th></tr>
 * <tr><td>1</td><td>unique constraint violated</td><td>{@link RecordNotUniqueException}</td></tr>
 * <tr><td>942, 955, 1418</td><td>missing table, name in use, missing index</td><td>{@link StatementInvalidException}</td></tr>
 * <tr><td>1400</td><td>cannot insert NULL</td><td>{@link NotNullViolationException}</td></tr>
 * <tr><td>2291</td><td>parent key not found</td><td>{@link InvalidForeignKeyException}</td></tr>
 * <tr><td>12899</td><td>value too large for column</td><td>{@link ValueTooLongException}</td></tr>
 * </table>
 * Any other code is UNCLASSIFIED and handed to the generic translation, which detects lost connections
 * and otherwise produces a plain {@link StatementInvalidException}.
 */
public class OracleExceptionClassifier
{
    public static final int UNIQUE_CONSTRAINT_VIOLATED = 1;
    public static final int TABLE_OR_VIEW_DOES_NOT_EXIST = 942;
    public static final int NAME_ALREADY_USED = 955;
    public static final int INDEX_DOES_NOT_EXIST = 1418;
    public static final int CANNOT_INSERT_NULL = 1400;
    public static final int PARENT_KEY_NOT_FOUND = 2291;
    public static final int VALUE_TOO_LARGE = 12899;

    /** User requested cancel of current operation. Raised when a statement timeout fires. */
    public static final int USER_REQUESTED_CANCEL = 1013;

    /** Error codes signalling that the session is gone. */
    public static final Set<Integer> LOST_CONNECTION_ERROR_CODES =
        Collections.unmodifiableSet(new HashSet<>(Arrays.asList(28, 1012, 3113, 3114, 3135)));

    /**
     * Classify an Oracle error code.
     * @param errorCode The vendor code of the error
     * @param message The error message (not used for classification, kept for symmetry with translate)
     * @return The classification
     */
    public ErrorClassification classify(int errorCode, String message)
    {
        switch (errorCode)
        {
            case UNIQUE_CONSTRAINT_VIOLATED:
                return ErrorClassification.UNIQUE_VIOLATION;
            case TABLE_OR_VIEW_DOES_NOT_EXIST:
            case NAME_ALREADY_USED:
            case INDEX_DOES_NOT_EXIST:
                return ErrorClassification.STATEMENT_INVALID;
            case CANNOT_INSERT_NULL:
                return ErrorClassification.NOT_NULL_VIOLATION;
            case PARENT_KEY_NOT_FOUND:
                return ErrorClassification.INVALID_FOREIGN_KEY;
            case VALUE_TOO_LARGE:
                return ErrorClassification.VALUE_TOO_LONG;
            default:
                return ErrorClassification.UNCLASSIFIED;
        }
    }

    /**
     * Convert a driver exception into the exception to throw to the caller.
     * @param sqle The driver exception
     * @param message Message to use (normally the driver message prefixed by the statement label)
     * @return The exception to throw
     */
    public NucleusDataStoreException translate(SQLException sqle, String message)
    {
        int errorCode = sqle.getErrorCode();
        switch (classify(errorCode, message))
        {
            case UNIQUE_VIOLATION:
                return new RecordNotUniqueException(message, errorCode, sqle);
            case STATEMENT_INVALID:
                return new StatementInvalidException(message, errorCode, sqle);
            case NOT_NULL_VIOLATION:
                return new NotNullViolationException(message, errorCode, sqle);
            case INVALID_FOREIGN_KEY:
                return new InvalidForeignKeyException(message, errorCode, sqle);
            case VALUE_TOO_LONG:
                return new ValueTooLongException(message, errorCode, sqle);
            default:
                return translateGeneric(sqle, message);
        }
    }

    /**
     * Translation applied to errors without a dedicated classification.
     * @param sqle The driver exception
     * @param message The message
     * @return The exception to throw
     */
    protected NucleusDataStoreException translateGeneric(SQLException sqle, String message)
    {
        if (isLostConnection(sqle))
        {
            return new ConnectionException(message, sqle);
        }
        return new StatementInvalidException(message, sqle.getErrorCode(), sqle);
    }

    /**
     * Whether the exception signals that the connection to the server was lost.
     * @param sqle The driver exception
     * @return Whether the session is gone
     */
    public boolean isLostConnection(SQLException sqle)
    {
        if (LOST_CONNECTION_ERROR_CODES.contains(sqle.getErrorCode()))
        {
            return true;
        }
        String sqlState = sqle.getSQLState();
        return sqlState != null && sqlState.startsWith("08");
    }

    /**
     * Whether the exception is the result of a statement timeout.
     * @param sqle The driver exception
     * @return Whether the statement was cancelled due to its timeout
     */
    public boolean isStatementTimeout(SQLException sqle)
    {
        return sqle.getSQLState() != null && sqle.getSQLState().equalsIgnoreCase("72000") &&
            sqle.getErrorCode() == USER_REQUESTED_CANCEL;
    }
}
