/*
 * Copyright 2025 The Tapegraph Authors
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

package org.tapegraph.util;

import java.util.List;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/** Static-only class with methods for formatting values in IR listings and trace dumps. */
public class StringUtil {

  private StringUtil() {}

  /**
   * Calls {@link #safeToString} on each element of {@code elements}, separating them with {@code
   * ", "}, and adds the given prefix and suffix.
   */
  public static String joinElements(String prefix, String suffix, List<?> elements) {
    return elements.stream()
        .map(StringUtil::safeToString)
        .collect(Collectors.joining(", ", prefix, suffix));
  }

  /**
   * Returns a readable rendering of a constant appearing in IR or in a trace: strings are quoted,
   * everything else goes through {@link #safeToString}.
   */
  public static String literal(@Nullable Object x) {
    if (x instanceof String s) {
      return "\"" + s.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n") + "\"";
    }
    return safeToString(x);
  }

  /**
   * Call {@link String#valueOf} but swallow any errors; values recorded from a running program
   * may have arbitrary (and arbitrarily broken) {@code toString()} implementations.
   */
  public static String safeToString(@Nullable Object x) {
    try {
      return String.valueOf(x);
    } catch (RuntimeException | AssertionError nested) {
      return "(can't print)";
    }
  }
}
