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

import static com.google.common.truth.Truth.assertThat;

import org.junit.After;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class CheckOptionsTest {

  @After
  public void clearProperties() {
    System.clearProperty(CheckOptions.USE_BRANCHING_PROPERTY);
    System.clearProperty(CheckOptions.VERBOSE_PROPERTY);
  }

  @Test
  public void defaults() {
    assertThat(CheckOptions.DEFAULT.useBranching).isFalse();
    assertThat(CheckOptions.DEFAULT.verbose).isFalse();
    CheckOptions options = CheckOptions.fromSystemProperties();
    assertThat(options.useBranching).isFalse();
    assertThat(options.verbose).isFalse();
  }

  @Test
  public void fromSystemProperties() {
    System.setProperty(CheckOptions.USE_BRANCHING_PROPERTY, "true");
    CheckOptions options = CheckOptions.fromSystemProperties();
    assertThat(options.useBranching).isTrue();
    assertThat(options.verbose).isFalse();
    System.setProperty(CheckOptions.VERBOSE_PROPERTY, "TRUE");
    assertThat(CheckOptions.fromSystemProperties().verbose).isTrue();
  }

  @Test
  public void with() {
    CheckOptions options = CheckOptions.DEFAULT.withBranching(true);
    assertThat(options.useBranching).isTrue();
    assertThat(options.withVerbose(true).useBranching).isTrue();
    assertThat(CheckOptions.DEFAULT.useBranching).isFalse();
    assertThat(options.withVerbose(true).toString())
        .isEqualTo("CheckOptions(useBranching=true, verbose=true)");
  }
}
