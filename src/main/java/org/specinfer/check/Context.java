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

package org.specinfer.check;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import org.specinfer.inference.Instance;

/**
 * A Context records, for each state label in a check program, the specification instances whose
 * snapshots were taken there and whether each was being inhaled or exhaled. The example extractor
 * replays a verifier's counterexample model against these labels.
 *
 * <p>A Context only grows; each {@link CheckBuilder#basicCheck} call starts a new one.
 */
public final class Context {

  /** Whether a specification was granted (inhaled) or discharged (exhaled) at a label. */
  public enum Role {
    INHALED,
    EXHALED
  }

  /** One instance recorded at a label. */
  public record Entry(Instance instance, Role role) {
    public Entry {
      Preconditions.checkNotNull(instance);
      Preconditions.checkNotNull(role);
    }

    @Override
    public String toString() {
      return role + " " + instance;
    }
  }

  /** Labels in the order they were first added, each with its entries in the order added. */
  private final ListMultimap<String, Entry> entries =
      MultimapBuilder.linkedHashKeys().arrayListValues().build();

  /** Records that {@code instance} was inhaled at the state labelled {@code label}. */
  public void addInhaled(String label, Instance instance) {
    entries.put(label, new Entry(instance, Role.INHALED));
  }

  /** Records that {@code instance} was exhaled at the state labelled {@code label}. */
  public void addExhaled(String label, Instance instance) {
    entries.put(label, new Entry(instance, Role.EXHALED));
  }

  /** Returns the entries recorded at {@code label}; empty if the label is unknown. */
  public ImmutableList<Entry> entries(String label) {
    return ImmutableList.copyOf(entries.get(label));
  }

  /** Returns the instances recorded at {@code label} with the given role. */
  public ImmutableList<Instance> instances(String label, Role role) {
    return entries.get(label).stream()
        .filter(e -> e.role() == role)
        .map(Entry::instance)
        .collect(ImmutableList.toImmutableList());
  }

  /** Returns all labels, in the order they were added. */
  public ImmutableSet<String> labels() {
    return ImmutableSet.copyOf(entries.keySet());
  }

  /** Returns the total number of entries. */
  public int size() {
    return entries.size();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  @Override
  public String toString() {
    return entries.asMap().toString();
  }
}
