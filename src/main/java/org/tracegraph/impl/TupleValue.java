/*
 * Copyright 2025 The Retrospect Authors
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

package org.tracegraph.impl;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.tracegraph.source.Guard;
import org.tracegraph.util.StringUtil;

/** An immutable tuple of traced values. */
public final class TupleValue extends BaseValue {
  private final ImmutableList<TracedValue> items;

  public TupleValue(List<? extends TracedValue> items, ImmutableSet<Guard> guards) {
    super(guards, null);
    this.items = ImmutableList.copyOf(items);
  }

  public ImmutableList<TracedValue> items() {
    return items;
  }

  public TracedValue get(int i) {
    return items.get(i);
  }

  public int size() {
    return items.size();
  }

  @Override
  public boolean isConstant() {
    return items.stream().allMatch(TracedValue::isConstant);
  }

  @Override
  public List<@Nullable Object> asConstant() {
    List<@Nullable Object> result = new ArrayList<>(items.size());
    for (TracedValue item : items) {
      result.add(item.asConstant());
    }
    return Collections.unmodifiableList(result);
  }

  @Override
  public String typeName() {
    return "tuple";
  }

  @Override
  public String toString() {
    return StringUtil.joinElements("(", ")", items.size(), items::get);
  }
}
