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
package net.hydromatic.cat.eval;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The events of one candidate execution.
 *
 * <p>Every {@link Value} is defined over a universe; sets and relations are
 * bit sets indexed by {@link Event#ordinal}.
 */
public final class EventUniverse {
  private final ImmutableList<Event> events;
  private final ImmutableMap<String, Event> eventsByName;
  /** Members of each class, keyed by class name. */
  private final ImmutableMap<String, BitSet> classes;

  private EventUniverse(ImmutableList<Event> events,
      ImmutableMap<String, BitSet> classes) {
    this.events = events;
    final ImmutableMap.Builder<String, Event> b = ImmutableMap.builder();
    events.forEach(e -> b.put(e.name, e));
    this.eventsByName = b.build();
    this.classes = classes;
  }

  /** Creates a builder. */
  public static Builder builder() {
    return new Builder();
  }

  /** Returns the number of events. */
  public int size() {
    return events.size();
  }

  public List<Event> events() {
    return events;
  }

  /** Returns the event with a given ordinal. */
  public Event event(int ordinal) {
    return events.get(ordinal);
  }

  /** Returns the event with a given name; throws if there is none. */
  public Event event(String name) {
    final @Nullable Event event = eventsByName.get(name);
    checkArgument(event != null, "unknown event %s", name);
    return event;
  }

  /** Returns the names of the classes known to this universe. */
  public Set<String> classNames() {
    return classes.keySet();
  }

  /** Returns the set of events in a class, or null if the class is not
   * known. */
  public @Nullable EventSet classSet(String name) {
    final @Nullable BitSet bits = classes.get(name);
    return bits == null ? null : new EventSet(this, (BitSet) bits.clone());
  }

  /** Returns the set of all events. */
  public EventSet all() {
    final BitSet bits = new BitSet(size());
    bits.set(0, size());
    return new EventSet(this, bits);
  }

  @Override
  public String toString() {
    return events.toString();
  }

  /** Builder for {@link EventUniverse}. */
  public static final class Builder {
    private final Map<String, Set<String>> events = new LinkedHashMap<>();
    private final Set<String> classNames = new LinkedHashSet<>();

    private Builder() {}

    /** Adds an event, with the classes it belongs to. */
    public Builder event(String name, String... classes) {
      checkArgument(!events.containsKey(name), "duplicate event %s", name);
      events.put(name, ImmutableSet.copyOf(classes));
      classNames.addAll(Arrays.asList(classes));
      return this;
    }

    /** Declares a class, which may have no events. */
    public Builder declareClass(String name) {
      classNames.add(name);
      return this;
    }

    public EventUniverse build() {
      final List<Event> list = new ArrayList<>();
      final Map<String, BitSet> classMap = new LinkedHashMap<>();
      classNames.forEach(c -> classMap.put(c, new BitSet()));
      events.forEach((name, classes) -> {
        final int ordinal = list.size();
        list.add(new Event(name, ordinal, classes));
        classes.forEach(c -> classMap.get(c).set(ordinal));
      });
      return new EventUniverse(ImmutableList.copyOf(list),
          ImmutableMap.copyOf(classMap));
    }
  }
}

// End EventUniverse.java
