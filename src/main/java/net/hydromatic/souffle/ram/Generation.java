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
package net.hydromatic.souffle.ram;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Generation of a relation during semi-naive evaluation.
 *
 * <p>The compiler creates auxiliary copies of a recursive relation, and
 * distinguishes them by a prefix on the relation's name: "@delta_path" is the
 * tuples found in the current iteration, "@new_path" the tuples found in the
 * next.
 */
public enum Generation {
  CURRENT("@delta_"),
  NEXT("@new_"),
  DELETE("@delete_"),
  REJECT("@reject_"),
  NONE("");

  /** Prefix of the relation name in RAM text. */
  public final String prefix;

  Generation(String prefix) {
    this.prefix = prefix;
  }

  /** Returns the generation whose prefix is a given token, or null. */
  public static @Nullable Generation ofPrefix(String token) {
    for (Generation generation : values()) {
      if (generation != NONE && generation.prefix.equals(token)) {
        return generation;
      }
    }
    return null;
  }
}

// End Generation.java
