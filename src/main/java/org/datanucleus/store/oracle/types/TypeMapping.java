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

import java.util.regex.Pattern;

/**
 * Entry of the type map : a pattern over the native type string, and the factory for the logical type
 * of the types matching it.
 */
public class TypeMapping
{
    /**
     * Creates the logical type for a matched native type.
     */
    public interface Factory
    {
        LogicalType create(String sqlType);
    }

    final Pattern pattern;

    final Factory factory;

    /**
     * @param regex Regular expression matched (case-insensitively) anywhere in the native type string
     * @param factory Factory for the logical type
     */
    public TypeMapping(String regex, Factory factory)
    {
        this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        this.factory = factory;
    }

    public boolean matches(String sqlType)
    {
        return pattern.matcher(sqlType).find();
    }

    public LogicalType create(String sqlType)
    {
        return factory.create(sqlType);
    }

    public String toString()
    {
        return "TypeMapping " + pattern.pattern();
    }
}
