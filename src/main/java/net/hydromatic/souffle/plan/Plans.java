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
package net.hydromatic.souffle.plan;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.souffle.catalog.SchemaCatalog;
import net.hydromatic.souffle.ram.Ram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Utilities for rendering plans. */
public abstract class Plans {
  private static final Logger LOGGER = LoggerFactory.getLogger(Plans.class);

  private Plans() {}

  /** Renders the subroutines of a program, in stratum order. */
  public static ImmutableList<PlanNode> render(Ram.Program program,
      SchemaCatalog catalog, Notation notation) {
    final ImmutableList<PlanNode> nodes =
        new PlanWriter(catalog, notation).program(program);
    LOGGER.debug("rendered {} subroutines using {}", nodes.size(),
        notation.getClass().getSimpleName());
    return nodes;
  }

  /** Converts rendered nodes to text, indenting each level of children by
   * {@code indent} spaces. */
  public static String toText(List<PlanNode> nodes, int indent) {
    final StringBuilder buf = new StringBuilder();
    for (PlanNode node : nodes) {
      node.unparse(buf, 0, indent);
    }
    return buf.toString();
  }
}

// End Plans.java
