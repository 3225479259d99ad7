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
package net.hydromatic.lpdoc.ast;

import com.google.common.base.CaseFormat;

/** Name of a structural field of an {@link AstNode}. */
public enum Field {
  HEAD,
  BODY,
  CONDITION,
  LITERAL,
  ATOM,
  SYMBOL,
  ARGUMENT,
  ARGUMENTS,
  ELEMENTS,
  TERMS,
  TERM,
  LEFT,
  RIGHT,
  LEFT_GUARD,
  RIGHT_GUARD,
  VALUE,
  WEIGHT,
  PRIORITY,
  EXTERNAL_TYPE;

  /** Returns the name of this field in lower camel case, e.g. "leftGuard". */
  public String camelName() {
    return CaseFormat.UPPER_UNDERSCORE.to(CaseFormat.LOWER_CAMEL, name());
  }
}

// End Field.java
