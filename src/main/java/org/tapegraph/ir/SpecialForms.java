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

package org.tapegraph.ir;

import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** Maps the head of each supported {@link Expr.Special} to the function that evaluates it. */
public final class SpecialForms {

  /**
   * The special forms supported by default:
   *
   * <ul>
   *   <li>{@code tuple(x...)}: an unmodifiable list of its arguments.
   *   <li>{@code getindex(tuple, i)}: element {@code i} (1-based) of a tuple.
   *   <li>{@code boundscheck(...)}: always {@code true}.
   *   <li>{@code meta(...)}: a no-op annotation, evaluates to null.
   * </ul>
   */
  public static final SpecialForms DEFAULT =
      builder()
          .add("tuple", args -> Collections.unmodifiableList(new ArrayList<>(args)))
          .add("getindex", SpecialForms::getIndex)
          .add("boundscheck", args -> Boolean.TRUE)
          .add("meta", args -> null)
          .build();

  private final ImmutableMap<String, Primitive> forms;

  private SpecialForms(ImmutableMap<String, Primitive> forms) {
    this.forms = forms;
  }

  /** Evaluates the special form with the given head; throws an IrException if it is unknown. */
  public @Nullable Object evaluate(String head, List<@Nullable Object> args) {
    Primitive form = forms.get(head);
    if (form == null) {
      throw new IrException("Unknown special form: " + head);
    }
    return form.apply(args);
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns a Builder that starts with all of this object's forms. */
  public Builder toBuilder() {
    Builder result = new Builder();
    result.forms.putAll(forms);
    return result;
  }

  private static @Nullable Object getIndex(List<@Nullable Object> args) {
    if (args.size() != 2 || !(args.get(0) instanceof List<?> tuple)) {
      throw new IrException("getindex expects a tuple and an index, got " + args);
    }
    if (!(args.get(1) instanceof Integer i) || i < 1 || i > tuple.size()) {
      throw new IrException("Invalid tuple index " + args.get(1) + " for " + tuple);
    }
    return tuple.get(i - 1);
  }

  /** A builder for SpecialForms; adding a head that is already present replaces it. */
  public static final class Builder {
    private final Map<String, Primitive> forms = new LinkedHashMap<>();

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder add(String head, Primitive form) {
      forms.put(head, form);
      return this;
    }

    public SpecialForms build() {
      return new SpecialForms(ImmutableMap.copyOf(forms));
    }
  }
}
