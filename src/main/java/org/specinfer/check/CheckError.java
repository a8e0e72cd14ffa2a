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

import org.jspecify.annotations.Nullable;

/**
 * All failures detected while building a check program throw a CheckError. A CheckError aborts the
 * whole {@link CheckBuilder#basicCheck} call; no partial program is returned.
 */
public class CheckError extends RuntimeException {
  public final String msg;

  /** Describes the check template being instrumented when the error was detected, or null. */
  public final @Nullable String template;

  public CheckError(String msg, @Nullable String template) {
    super(msg);
    this.msg = msg;
    this.template = template;
  }

  @Override
  public String getMessage() {
    return (template == null) ? msg : String.format("%s (in %s)", msg, template);
  }
}
