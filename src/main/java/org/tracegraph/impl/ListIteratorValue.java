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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import org.tracegraph.source.Guard;
import org.tracegraph.util.StringUtil;

/**
 * A mutable iterator over a list of traced values. Each call to {@link #next} consumes one element;
 * the engine tracks the iterator's position as trace-local mutable state.
 */
public final class ListIteratorValue extends BaseValue {
  private final List<TracedValue> items;
  private int index;

  public ListIteratorValue(List<? extends TracedValue> items, ImmutableSet<Guard> guards) {
    super(guards, null);
    this.items = new ArrayList<>(items);
  }

  /** All of the elements, including any that have already been consumed. */
  public ImmutableList<TracedValue> items() {
    return ImmutableList.copyOf(items);
  }

  public boolean hasNext() {
    return index < items.size();
  }

  public TracedValue next() {
    checkState(hasNext(), "Iterator exhausted");
    return items.get(index++);
  }

  @Override
  public String typeName() {
    return "list_iterator";
  }

  @Override
  public String toString() {
    return StringUtil.joinElements("iter[", "]", items.size(), items::get);
  }
}
