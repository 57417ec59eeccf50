package io.etadata.core.containers;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import java.util.function.Predicate;
import java.util.stream.Stream;

/// An ordered list of elements of one type, with index-based selection.
///
/// Subclasses add validation by overriding [#checkElement], which every
/// insertion path calls before the list is touched. Index operations check
/// all indices first, so a bad index never leaves the container half changed.
///
/// @param <T> the element type
public class DataContainer<T> implements Iterable<T> {

    private final List<T> elements = new ArrayList<>();

    public DataContainer() {
    }

    public DataContainer(Collection<? extends T> elements) {
        addAll(elements);
    }

    /// Hook for subclasses to reject an element before it is added.
    ///
    /// @param element the candidate element
    protected void checkElement(T element) {
        Objects.requireNonNull(element, "elements cannot be null");
    }

    /// Appends an element.
    ///
    /// @param element the element
    public void add(T element) {
        checkElement(element);
        elements.add(element);
    }

    /// Appends every element, or none of them if one is rejected.
    ///
    /// @param toAdd the elements
    public void addAll(Collection<? extends T> toAdd) {
        List<T> staged = new ArrayList<>(toAdd);
        for (T element : staged) {
            checkElement(element);
        }
        elements.addAll(staged);
    }

    /// Appends the elements of another container, or none of them if one is rejected.
    ///
    /// @param container the source container
    public void addContainer(DataContainer<? extends T> container) {
        addAll(container.elements);
    }

    public T get(int index) {
        return elements.get(index);
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    public void clear() {
        elements.clear();
    }

    /// @return a read-only view of the elements
    public List<T> elements() {
        return Collections.unmodifiableList(elements);
    }

    @Override
    public Iterator<T> iterator() {
        return elements().iterator();
    }

    public Stream<T> stream() {
        return elements.stream();
    }

    /// Keeps only the elements at the given positions, in their original order.
    ///
    /// @param indices positions to keep; duplicates are ignored
    /// @throws IndexOutOfBoundsException if an index is out of range
    public void keepIndices(Collection<Integer> indices) {
        TreeSet<Integer> keep = checkedIndexSet(indices);
        List<T> kept = new ArrayList<>(keep.size());
        for (int index : keep) {
            kept.add(elements.get(index));
        }
        elements.clear();
        elements.addAll(kept);
    }

    /// Removes the elements at the given positions.
    ///
    /// @param indices positions to delete; duplicates are ignored
    /// @throws IndexOutOfBoundsException if an index is out of range
    public void deleteIndices(Collection<Integer> indices) {
        TreeSet<Integer> delete = checkedIndexSet(indices);
        for (int index : delete.descendingSet()) {
            elements.remove(index);
        }
    }

    /// Copies the elements at the given positions, in the given order.
    ///
    /// @param indices positions to copy; may repeat or reorder
    /// @return the selected elements
    /// @throws IndexOutOfBoundsException if an index is out of range
    public List<T> extractIndices(List<Integer> indices) {
        List<T> extracted = new ArrayList<>(indices.size());
        for (int index : indices) {
            Objects.checkIndex(index, elements.size());
        }
        for (int index : indices) {
            extracted.add(elements.get(index));
        }
        return extracted;
    }

    /// Keeps only the elements matching the predicate.
    ///
    /// @param predicate the filter
    /// @return the number of elements left
    public int filter(Predicate<? super T> predicate) {
        elements.removeIf(predicate.negate());
        return elements.size();
    }

    private TreeSet<Integer> checkedIndexSet(Collection<Integer> indices) {
        TreeSet<Integer> set = new TreeSet<>();
        for (int index : indices) {
            set.add(Objects.checkIndex(index, elements.size()));
        }
        return set;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return elements.equals(((DataContainer<?>) obj).elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + elements;
    }
}
