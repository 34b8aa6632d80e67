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

import junit.framework.TestCase;

import org.datanucleus.exceptions.NucleusDataStoreException;

/**
 * Tests for the classification of Oracle error codes.
 */
public class OracleExceptionClassifierTest extends TestCase
{
    private final OracleExceptionClassifier classifier = new OracleExceptionClassifier();

    public void testClassifyKnownCodes()
    {
        assertEquals(ErrorClassification.UNIQUE_VIOLATION, classifier.classify(1, "ORA-00001: unique constraint violated"));
        assertEquals(ErrorClassification.STATEMENT_INVALID, classifier.classify(942, "ORA-00942"));
        assertEquals(ErrorClassification.STATEMENT_INVALID, classifier.classify(955, "ORA-00955"));
        assertEquals(ErrorClassification.STATEMENT_INVALID, classifier.classify(1418, "ORA-01418"));
        assertEquals(ErrorClassification.NOT_NULL_VIOLATION, classifier.classify(1400, "ORA-01400"));
        assertEquals(ErrorClassification.INVALID_FOREIGN_KEY, classifier.classify(2291, "ORA-02291"));
        assertEquals(ErrorClassification.VALUE_TOO_LONG, classifier.classify(12899, "ORA-12899"));
    }

    public void testClassifyOtherCodes()
    {
        assertEquals(ErrorClassification.UNCLASSIFIED, classifier.classify(0, null));
        assertEquals(ErrorClassification.UNCLASSIFIED, classifier.classify(904, "ORA-00904: invalid identifier"));
        assertEquals(ErrorClassification.UNCLASSIFIED, classifier.classify(3113, "ORA-03113"));
    }

    public void testTranslateBuildsDedicatedExceptions()
    {
        assertTrue(classifier.translate(new SQLException("dup", "23000", 1), "insert") instanceof RecordNotUniqueException);
        assertTrue(classifier.translate(new SQLException("null", "23000", 1400), "insert") instanceof NotNullViolationException);
        assertTrue(classifier.translate(new SQLException("fk", "23000", 2291), "insert") instanceof InvalidForeignKeyException);
        assertTrue(classifier.translate(new SQLException("long", "72000", 12899), "insert") instanceof ValueTooLongException);

        NucleusDataStoreException ex = classifier.translate(new SQLException("missing", "42000", 942), "select");
        assertEquals(StatementInvalidException.class, ex.getClass());
        assertEquals(942, ((StatementInvalidException)ex).getErrorCode());
    }

    public void testTranslateKeepsCause()
    {
        SQLException sqle = new SQLException("dup", "23000", 1);
        NucleusDataStoreException ex = classifier.translate(sqle, "insert");
        assertSame(sqle, ex.getCause());
    }

    public void testDedicatedExceptionsAreStatementInvalid()
    {
        assertTrue(classifier.translate(new SQLException("dup", "23000", 1), "x") instanceof StatementInvalidException);
        assertTrue(classifier.translate(new SQLException("long", "72000", 12899), "x") instanceof StatementInvalidException);
    }

    public void testTranslateLostConnection()
    {
        assertTrue(classifier.translate(new SQLException("end of file", null, 3113), "select") instanceof ConnectionException);
        assertTrue(classifier.translate(new SQLException("killed", null, 28), "select") instanceof ConnectionException);
        assertTrue(classifier.translate(new SQLException("refused", "08006", 17002), "select") instanceof ConnectionException);
    }

    public void testTranslateUnclassified()
    {
        NucleusDataStoreException ex = classifier.translate(new SQLException("invalid identifier", "42000", 904), "select");
        assertEquals(StatementInvalidException.class, ex.getClass());
    }

    public void testIsLostConnection()
    {
        for (int code : new int[] {28, 1012, 3113, 3114, 3135})
        {
            assertTrue("code " + code, classifier.isLostConnection(new SQLException("x", null, code)));
        }
        assertFalse(classifier.isLostConnection(new SQLException("x", "42000", 942)));
        assertFalse(classifier.isLostConnection(new SQLException("x")));
    }

    public void testIsStatementTimeout()
    {
        assertTrue(classifier.isStatementTimeout(new SQLException("cancel", "72000", 1013)));
        assertFalse(classifier.isStatementTimeout(new SQLException("cancel", "HY008", 1013)));
        assertFalse(classifier.isStatementTimeout(new SQLException("other", "72000", 12899)));
    }
}
