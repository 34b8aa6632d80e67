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

import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Callback that consumes the ResultSet of a query executed by the {@link SQLController}.
 * The ResultSet (and its statement) are closed by the controller once the callback returns.
 * @param <T> Type of the value produced from the rows
 */
public interface ResultSetProcessor<T>
{
    T process(ResultSet rs) throws SQLException;
}
