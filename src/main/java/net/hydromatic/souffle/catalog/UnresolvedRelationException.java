/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.souffle.catalog;

import static java.util.Objects.requireNonNull;

import net.hydromatic.souffle.util.SouffleException;

/** Thrown when an analysis refers to a relation that is not in the
 * {@link SchemaCatalog}. */
public class UnresolvedRelationException extends RuntimeException
    implements SouffleException {
  public final String relationName;

  public UnresolvedRelationException(String relationName) {
    super("relation '" + relationName + "' is not declared");
    this.relationName = requireNonNull(relationName);
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append(getMessage());
  }
}

// End UnresolvedRelationException.java
