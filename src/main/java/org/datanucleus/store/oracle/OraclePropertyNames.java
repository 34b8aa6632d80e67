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

/**
 * Utility providing convenience naming of Oracle adapter properties.
 */
public class OraclePropertyNames
{
    private OraclePropertyNames(){}

    public static final String PROPERTY_ORACLE_EMULATE_BOOLEANS = "datanucleus.oracle.emulateBooleans".toLowerCase(Locale.ENGLISH);
    public static final String PROPERTY_ORACLE_EMULATE_BOOLEANS_FROM_STRINGS = "datanucleus.oracle.emulateBooleansFromStrings".toLowerCase(Locale.ENGLISH);
    public static final String PROPERTY_ORACLE_USE_OLD_ORACLE_VISITOR = "datanucleus.oracle.useOldOracleVisitor".toLowerCase(Locale.ENGLISH);
    public static final String PROPERTY_ORACLE_DEFAULT_SEQUENCE_START_VALUE = "datanucleus.oracle.defaultSequenceStartValue".toLowerCase(Locale.ENGLISH);
    public static final String PROPERTY_ORACLE_AUTO_RETRY = "datanucleus.oracle.autoRetry".toLowerCase(Locale.ENGLISH);
    public static final String PROPERTY_ORACLE_IDENTIFIER_MAX_LENGTH = "datanucleus.oracle.identifierMaxLength".toLowerCase(Locale.ENGLISH);

    /** Prefix for the default tablespaces, suffixed by the (lowercase) name of a {@link TablespaceType}. */
    public static final String PROPERTY_ORACLE_DEFAULT_TABLESPACE_PREFIX = "datanucleus.oracle.defaultTablespace.".toLowerCase(Locale.ENGLISH);
}
