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
package net.hydromatic.souffle.util;

/**
 * Error that aborts the processing of one input program.
 *
 * <p>Every exception thrown deliberately by the tools implements this
 * interface, so that the command line can report it without a stack trace.
 */
public interface SouffleException {
  /** Appends a description of this error, including its context. */
  StringBuilder describeTo(StringBuilder buf);
}

// End SouffleException.java
