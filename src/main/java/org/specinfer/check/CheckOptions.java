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

/**
 * The settings that control how check programs are built. CheckOptions are immutable; use the
 * {@code with*} methods to derive modified copies.
 */
public final class CheckOptions {

  /** The system property read by {@link #fromSystemProperties} for {@link #useBranching}. */
  public static final String USE_BRANCHING_PROPERTY = "specinfer.useBranching";

  /** The system property read by {@link #fromSystemProperties} for {@link #verbose}. */
  public static final String VERBOSE_PROPERTY = "specinfer.verbose";

  public static final CheckOptions DEFAULT = new CheckOptions(false, false);

  /**
   * If true, boolean values are saved in snapshots by branching on them ({@code if (e) { s :=
   * true } else { s := false }}) rather than by a single assignment, so that verifiers that reason
   * more precisely about branches than about boolean terms record the decision in their models.
   */
  public final boolean useBranching;

  /** If true, each build prints a summary and the resulting program to standard output. */
  public final boolean verbose;

  private CheckOptions(boolean useBranching, boolean verbose) {
    this.useBranching = useBranching;
    this.verbose = verbose;
  }

  /** Returns options configured from the {@code specinfer.*} system properties. */
  public static CheckOptions fromSystemProperties() {
    return new CheckOptions(
        Boolean.parseBoolean(System.getProperty(USE_BRANCHING_PROPERTY, "false")),
        Boolean.parseBoolean(System.getProperty(VERBOSE_PROPERTY, "false")));
  }

  public CheckOptions withBranching(boolean useBranching) {
    return new CheckOptions(useBranching, verbose);
  }

  public CheckOptions withVerbose(boolean verbose) {
    return new CheckOptions(useBranching, verbose);
  }

  @Override
  public String toString() {
    return String.format("CheckOptions(useBranching=%s, verbose=%s)", useBranching, verbose);
  }
}
