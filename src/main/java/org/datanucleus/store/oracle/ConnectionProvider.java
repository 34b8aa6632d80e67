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

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Source of the JDBC connection used by the adapter. The adapter works on a single session, and only
 * asks for a new connection when first used or after the previous one was lost.
 * The provider is not a pooling mechanism; pooling belongs to the caller.
 */
public interface ConnectionProvider
{
    /**
     * Obtain a connection to the Oracle server.
     * @return The connection
     * @throws SQLException if no connection can be established
     */
    Connection getConnection() throws SQLException;
}
