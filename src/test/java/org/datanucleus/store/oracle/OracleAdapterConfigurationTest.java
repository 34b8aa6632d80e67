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
package org.datanucleus.store.oracle;

import java.util.Locale;
import java.util.Properties;

import junit.framework.TestCase;

import org.datanucleus.exceptions.NucleusUserException;

/**
 * Tests for reading the adapter configuration from properties.
 */
public class OracleAdapterConfigurationTest extends TestCase
{
    public void testDefaults()
    {
        OracleAdapterConfiguration config = new OracleAdapterConfiguration();
        assertTrue(config.isEmulateBooleans());
        assertFalse(config.isEmulateBooleansFromStrings());
        assertFalse(config.isUseOldOracleVisitor());
        assertFalse(config.isAutoRetry());
        assertEquals(10000L, config.getDefaultSequenceStartValue());
        assertNull(config.getIdentifierMaxLength());
        assertTrue(config.getDefaultTablespaces().isEmpty());
        assertNull(config.getDefaultTablespace(TablespaceType.TABLE));
    }

    public void testPropertiesAreCaseInsensitive()
    {
        Properties props = new Properties();
        props.setProperty("datanucleus.oracle.emulateBooleans", "false");
        props.setProperty("DATANUCLEUS.ORACLE.AUTORETRY", "true");
        props.setProperty("datanucleus.oracle.useOldOracleVisitor", " true ");
        props.setProperty("datanucleus.oracle.defaultSequenceStartValue", "1");
        props.setProperty("datanucleus.oracle.identifierMaxLength", "128");
        OracleAdapterConfiguration config = new OracleAdapterConfiguration(props);

        assertFalse(config.isEmulateBooleans());
        assertTrue(config.isAutoRetry());
        assertTrue(config.isUseOldOracleVisitor());
        assertEquals(1L, config.getDefaultSequenceStartValue());
        assertEquals(Integer.valueOf(128), config.getIdentifierMaxLength());
    }

    public void testPropertiesIgnoreDefaultLocale()
    {
        Locale defaultLocale = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try
        {
            Properties props = new Properties();
            props.setProperty("DATANUCLEUS.ORACLE.IDENTIFIERMAXLENGTH", "64");
            props.setProperty("datanucleus.oracle.defaultTablespace.index", "idx_tbs");
            OracleAdapterConfiguration config = new OracleAdapterConfiguration(props);

            assertEquals(Integer.valueOf(64), config.getIdentifierMaxLength());
            assertEquals("idx_tbs", config.getDefaultTablespace(TablespaceType.INDEX));
        }
        finally
        {
            Locale.setDefault(defaultLocale);
        }
    }

    public void testDefaultTablespaces()
    {
        Properties props = new Properties();
        props.setProperty("datanucleus.oracle.defaultTablespace.table", "tbs_data");
        props.setProperty("datanucleus.oracle.defaultTablespace.CLOB", "tbs_lob");
        props.setProperty("datanucleus.oracle.defaultTablespace.index", "  ");
        OracleAdapterConfiguration config = new OracleAdapterConfiguration(props);

        assertEquals("tbs_data", config.getDefaultTablespace(TablespaceType.TABLE));
        assertEquals("tbs_lob", config.getDefaultTablespace(TablespaceType.CLOB));
        assertNull(config.getDefaultTablespace(TablespaceType.INDEX));
        assertEquals(2, config.getDefaultTablespaces().size());
    }

    public void testInvalidNumber()
    {
        Properties props = new Properties();
        props.setProperty("datanucleus.oracle.defaultSequenceStartValue", "ten");
        try
        {
            new OracleAdapterConfiguration(props);
            fail("Expected NucleusUserException");
        }
        catch (NucleusUserException nue)
        {
            // expected
        }
    }

    public void testIdentifierLengthTooShort()
    {
        Properties props = new Properties();
        props.setProperty("datanucleus.oracle.identifierMaxLength", "4");
        try
        {
            new OracleAdapterConfiguration(props);
            fail("Expected NucleusUserException");
        }
        catch (NucleusUserException nue)
        {
            // expected
        }
    }
}
