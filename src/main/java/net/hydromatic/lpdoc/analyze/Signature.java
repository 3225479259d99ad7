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
package net.hydromatic.lpdoc.analyze;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.Objects;

/**
 * Name and arity of a predicate, such as "{@code edge/2}".
 *
 * <p>Two references with the same signature denote the same predicate.
 */
public class Signature implements Comparable<Signature> {
  public final String name;
  public final int arity;

  private Signature(String name, int arity) {
    this.name = requireNonNull(name);
    this.arity = arity;
    checkArgument(arity >= 0, "negative arity");
  }

  /** Creates a signature. */
  public static Signature of(String name, int arity) {
    return new Signature(name, arity);
  }

  /** Parses a signature of the form "name/arity", such as "edge/2". */
  public static Signature parse(String s) {
    final int i = s.lastIndexOf('/');
    checkArgument(i > 0, "not a signature: %s", s);
    return new Signature(s.substring(0, i), Integer.parseInt(s.substring(i + 1)));
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, arity);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Signature
            && name.equals(((Signature) o).name)
            && arity == ((Signature) o).arity;
  }

  @Override
  public int compareTo(Signature o) {
    final int c = name.compareTo(o.name);
    return c != 0 ? c : Integer.compare(arity, o.arity);
  }

  @Override
  public String toString() {
    return name + "/" + arity;
  }
}

// End Signature.java
