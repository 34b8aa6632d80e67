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
package org.datanucleus.store.oracle.types;

/**
 * Dialect-neutral kinds of column data that a native Oracle type can resolve to.
 */
public enum LogicalTypeKind
{
    BOOLEAN,
    STRING,
    TEXT,
    NATIONAL_STRING,
    NATIONAL_TEXT,
    INTEGER,
    DECIMAL,
    FLOAT,
    DATE,
    TIMESTAMP,
    TIMESTAMP_TZ,
    TIMESTAMP_LTZ,
    BINARY,
    RAW,
    /** Type not known to the adapter, the raw SQL type is retained. */
    VALUE
}
