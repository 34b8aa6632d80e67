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
 * Classification of an Oracle error code.
 */
public enum ErrorClassification
{
    UNIQUE_VIOLATION,
    STATEMENT_INVALID,
    NOT_NULL_VIOLATION,
    INVALID_FOREIGN_KEY,
    VALUE_TOO_LONG,
    /** No dedicated classification; handled by the generic translation. */
    UNCLASSIFIED
}
