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
 * Logical column types used when generating DDL, each one mapping to a native Oracle type.
 */
public enum ColumnType
{
    PRIMARY_KEY,
    STRING,
    TEXT,
    NTEXT,
    INTEGER,
    FLOAT,
    DECIMAL,
    DATETIME,
    TIMESTAMP,
    TIME,
    TIMESTAMPTZ,
    TIMESTAMPLTZ,
    DATE,
    BINARY,
    BOOLEAN,
    RAW,
    BIGINT
}
