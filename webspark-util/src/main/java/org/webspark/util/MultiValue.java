//
// ========================================================================
// Copyright (c) 1995-2022 Mort Bay Consulting Pty Ltd and others.
//
// This program and the accompanying materials are made available under the
// terms of the Eclipse Public License v. 2.0 which is available at
// https://www.eclipse.org/legal/epl-2.0, or the Apache License, Version 2.0
// which is available at https://www.apache.org/licenses/LICENSE-2.0.
//
// SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
// ========================================================================
//

package org.webspark.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A value that is either a single item or an ordered list of items.
 * <p>
 * Repeated names in a form submission are represented the same way a lazy list
 * represents them: the first occurrence is held as a single item, and the
 * value is promoted to a list only when the same name is seen again.
 * Unlike an opaque lazy list, the shape is explicit: {@link #isList()}
 * tells the two cases apart, and {@link #getValues()} always gives a list
 * view for callers that do not care about the distinction.
 *
 * <p><h4>Usage</h4>
 * <pre>
 *   Map&lt;String, MultiValue&lt;String&gt;&gt; map = new LinkedHashMap&lt;&gt;();
 *   MultiValue.add(map, "color", "red");   // Single(red)
 *   MultiValue.add(map, "color", "blue");  // Many([red, blue])
 * </pre>
 *
 * @param <T> the item type
 */
public abstract class MultiValue<T>
{
    /**
     * @param value the first item
     * @param <T> the item type
     * @return a single valued instance
     */
    public static <T> MultiValue<T> of(T value)
    {
        return new Single<>(value);
    }

    /**
     * @param values the items, in order, of which there must be at least two
     * @param <T> the item type
     * @return a list valued instance
     */
    @SafeVarargs
    public static <T> MultiValue<T> ofList(T... values)
    {
        if (values.length < 2)
            throw new IllegalArgumentException("A list value needs at least two items");
        Many<T> many = new Many<>(values[0], values[1]);
        for (int i = 2; i < values.length; i++)
        {
            many.add(values[i]);
        }
        return many;
    }

    /**
     * Add an item under a name, promoting an existing single item to a list.
     *
     * @param map the map to add to
     * @param name the name to add the item under
     * @param value the item to add
     * @param <T> the item type
     * @return the value now held under the name
     */
    public static <T> MultiValue<T> add(Map<String, MultiValue<T>> map, String name, T value)
    {
        MultiValue<T> existing = map.get(name);
        MultiValue<T> added = existing == null ? of(value) : existing.add(value);
        map.put(name, added);
        return added;
    }

    private MultiValue()
    {
    }

    /**
     * @return true if this value has been promoted to a list
     */
    public abstract boolean isList();

    /**
     * @return the single item, or the first item of a list
     */
    public abstract T getValue();

    /**
     * @param index the index of the item
     * @return the item at the index
     * @throws IndexOutOfBoundsException if there is no such item
     */
    public abstract T getValue(int index);

    /**
     * @return an unmodifiable list of all the items, in the order they were added
     */
    public abstract List<T> getValues();

    /**
     * @return the number of items
     */
    public abstract int size();

    /**
     * Add an item.
     *
     * @param value the item to add
     * @return the value holding all the items, which is a new list valued
     * instance if this instance held a single item
     */
    public abstract MultiValue<T> add(T value);

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
            return true;
        if (!(o instanceof MultiValue))
            return false;
        MultiValue<?> that = (MultiValue<?>)o;
        return isList() == that.isList() && getValues().equals(that.getValues());
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(isList(), getValues());
    }

    private static final class Single<T> extends MultiValue<T>
    {
        private final T _value;

        private Single(T value)
        {
            _value = value;
        }

        @Override
        public boolean isList()
        {
            return false;
        }

        @Override
        public T getValue()
        {
            return _value;
        }

        @Override
        public T getValue(int index)
        {
            if (index != 0)
                throw new IndexOutOfBoundsException("Index " + index + " out of bounds for length 1");
            return _value;
        }

        @Override
        public List<T> getValues()
        {
            return Collections.singletonList(_value);
        }

        @Override
        public int size()
        {
            return 1;
        }

        @Override
        public MultiValue<T> add(T value)
        {
            return new Many<>(_value, value);
        }

        @Override
        public String toString()
        {
            return String.valueOf(_value);
        }
    }

    private static final class Many<T> extends MultiValue<T>
    {
        private final List<T> _values = new ArrayList<>();

        private Many(T first, T second)
        {
            _values.add(first);
            _values.add(second);
        }

        @Override
        public boolean isList()
        {
            return true;
        }

        @Override
        public T getValue()
        {
            return _values.get(0);
        }

        @Override
        public T getValue(int index)
        {
            return _values.get(index);
        }

        @Override
        public List<T> getValues()
        {
            return Collections.unmodifiableList(_values);
        }

        @Override
        public int size()
        {
            return _values.size();
        }

        @Override
        public MultiValue<T> add(T value)
        {
            _values.add(value);
            return this;
        }

        @Override
        public String toString()
        {
            return _values.toString();
        }
    }
}
