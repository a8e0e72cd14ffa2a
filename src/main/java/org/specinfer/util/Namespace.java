/*
 * Copyright 2025 The Specinfer Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.specinfer.util;

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * A Namespace hands out identifiers that are distinct from each other and from any identifier that
 * was explicitly reserved, regardless of the base names they were derived from.
 *
 * <p>Identifiers are formed by appending {@code _k} to a base name, where {@code k} is taken from a
 * per-base counter that only increases. A Namespace is not thread-safe; each build uses its own.
 */
public final class Namespace {

  /** For each base, the smallest suffix that has not yet been tried. */
  private final Map<String, Integer> counters = new HashMap<>();

  /** Every identifier that has been issued or reserved. */
  private final Set<String> identifiers = new HashSet<>();

  /**
   * Marks {@code identifier} as taken, so that it will never be issued. Returns false if it had
   * already been issued or reserved.
   */
  @CanIgnoreReturnValue
  public boolean reserve(String identifier) {
    return identifiers.add(identifier);
  }

  /** Returns true if {@code identifier} has been issued or reserved. */
  public boolean contains(String identifier) {
    return identifiers.contains(identifier);
  }

  /**
   * Returns a fresh identifier derived from {@code base}: {@code base} itself if it is still
   * available, otherwise {@code base_k} for the next available {@code k}.
   */
  public String fresh(String base) {
    if (!counters.containsKey(base) && reserve(base)) {
      counters.put(base, 0);
      return base;
    }
    return fresh(base, 0);
  }

  /**
   * Returns a fresh identifier {@code base_k}, where {@code k} is at least {@code hint} and at
   * least one more than any suffix previously issued for {@code base}.
   */
  public String fresh(String base, int hint) {
    Preconditions.checkArgument(hint >= 0);
    int k = Math.max(hint, counters.getOrDefault(base, 0));
    String identifier = base + "_" + k;
    while (!reserve(identifier)) {
      identifier = base + "_" + ++k;
    }
    counters.put(base, k + 1);
    return identifier;
  }
}
