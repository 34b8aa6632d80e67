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
package org.datanucleus.store.oracle.valuegenerator;

/**
 * How values of the primary key of a table are provided on insert.
 */
public enum PrimaryKeyStrategy
{
    /** Table has no (single column) primary key, so nothing is generated. */
    NO_KEY,
    /** A trigger populates the key on insert. */
    TRIGGER_POPULATED,
    /** The key value is fetched from the sequence of the table before inserting. */
    SEQUENCE_PREFETCH
}
