package io.etadata.core.sequence;

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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/// A sequence of data files on disk, addressed by one integer index.
///
/// ## Bounds
///
/// A sequence must match real files when it is created; its bounds are the
/// smallest and largest index found. With immutable bounds (the default)
/// only paths inside `[lower, upper]` can be generated. With mutable bounds,
/// [#genPath] may also extend the sequence by exactly one index below or
/// above the current bounds, so a sequence grows without gaps:
///
/// ```text
///   files on disk: 3 4 5 6 7          bounds [3, 7]
///
///   genPath(2)  -> ok, bounds [2, 7]
///   genPath(0)  -> SequenceIndexOutOfBoundsException (gap at 1)
///   genPath(1)  -> ok, bounds [1, 7]
///   genPath(8)  -> ok, bounds [1, 8]
/// ```
///
/// ## Iteration
///
/// Each call to [#iterator()] returns an independent cursor over
/// `[lower, upper]`, so nested or repeated iterations do not interfere.
///
/// ## Serialized form
///
/// ```json
/// {"sequence": "/path/to/video/%05d.png", "immutable_bounds": true}
/// ```
public class DataFileSequence implements Iterable<String> {
    private static final Logger logger = LogManager.getLogger(DataFileSequence.class);

    private final SequencePattern pattern;
    private final boolean immutableBounds;
    private int lowerBound;
    private int upperBound;

    /// Creates a sequence with immutable bounds.
    ///
    /// @param sequence the printf-style pattern, e.g. `/path/to/frame-%05d.json`
    /// @throws InvalidPatternException if the pattern is malformed
    /// @throws PatternMismatchException if no file on disk matches the pattern
    public DataFileSequence(String sequence) {
        this(sequence, true);
    }

    /// Creates a sequence.
    ///
    /// @param sequence the printf-style pattern, e.g. `/path/to/frame-%05d.json`
    /// @param immutableBounds whether the bounds are fixed after construction
    /// @throws InvalidPatternException if the pattern is malformed
    /// @throws PatternMismatchException if no file on disk matches the pattern
    public DataFileSequence(String sequence, boolean immutableBounds) {
        this(SequencePattern.parse(sequence), immutableBounds);
    }

    private DataFileSequence(SequencePattern pattern, boolean immutableBounds) {
        this.pattern = pattern;
        this.immutableBounds = immutableBounds;
        SequencePattern.IndexBounds bounds = pattern.scanBounds();
        this.lowerBound = bounds.lower();
        this.upperBound = bounds.upper();
    }

    /// Builds an immutable sequence for the numbered files in a directory.
    ///
    /// @param directory the directory to inspect
    /// @return the sequence of the largest numbered file family in the directory
    /// @throws PatternMismatchException if the directory holds no numbered files
    public static DataFileSequence forDirectory(Path directory) {
        return forDirectory(directory, true);
    }

    /// Builds a sequence for the numbered files in a directory.
    ///
    /// @param directory the directory to inspect
    /// @param immutableBounds whether the bounds are fixed after construction
    /// @return the sequence of the largest numbered file family in the directory
    /// @throws PatternMismatchException if the directory holds no numbered files
    public static DataFileSequence forDirectory(Path directory, boolean immutableBounds) {
        return new DataFileSequence(SequencePattern.inferFromDirectory(directory), immutableBounds);
    }

    /// @return the pattern text
    public String sequence() {
        return pattern.pattern();
    }

    public SequencePattern pattern() {
        return pattern;
    }

    public boolean isImmutableBounds() {
        return immutableBounds;
    }

    /// @return the file extension of the pattern, including the dot
    public String extension() {
        return pattern.extension();
    }

    public int getLowerBound() {
        return lowerBound;
    }

    public int getUpperBound() {
        return upperBound;
    }

    /// Sets the lower bound, clamped so it never exceeds the upper bound.
    ///
    /// @param value the new lower bound
    /// @throws ImmutableBoundsException if the bounds are immutable
    public void setLowerBound(int value) {
        requireMutable();
        lowerBound = Math.min(value, upperBound);
    }

    /// Sets the upper bound, clamped so it never falls below the lower bound.
    ///
    /// @param value the new upper bound
    /// @throws ImmutableBoundsException if the bounds are immutable
    public void setUpperBound(int value) {
        requireMutable();
        upperBound = Math.max(value, lowerBound);
    }

    public boolean startsAtZero() {
        return lowerBound == 0;
    }

    public boolean startsAtOne() {
        return lowerBound == 1;
    }

    /// @return the number of indices in `[lower, upper]`
    public int size() {
        return upperBound - lowerBound + 1;
    }

    /// @param index a sequence index
    /// @return whether the index lies in `[lower, upper]`
    public boolean checkBounds(int index) {
        return index >= lowerBound && index <= upperBound;
    }

    /// Generates the path for an index.
    ///
    /// With mutable bounds, an index one below the lower bound or one above
    /// the upper bound is accepted and becomes the new bound.
    ///
    /// @param index a sequence index
    /// @return the path for the index
    /// @throws SequenceIndexOutOfBoundsException if the index is outside the
    ///     bounds, or more than one step beyond them for mutable bounds
    /// @throws InvalidIndexException if the index is negative and the bounds are mutable
    public String genPath(int index) {
        if (immutableBounds) {
            if (!checkBounds(index)) {
                throw new SequenceIndexOutOfBoundsException(
                    String.format("Index %d out of bounds [%d, %d]", index, lowerBound, upperBound));
            }
        } else if (index < 0) {
            throw new InvalidIndexException("Indices must be nonnegative; got " + index);
        } else if (index == lowerBound - 1) {
            lowerBound = index;
            logger.trace("Extended {} down to {}", pattern, index);
        } else if (index == upperBound + 1) {
            upperBound = index;
            logger.trace("Extended {} up to {}", pattern, index);
        } else if (!checkBounds(index)) {
            throw new SequenceIndexOutOfBoundsException(String.format(
                "Index %d out of bounds [%d, %d]; mutable sequences can be extended at most one index above/below",
                index, lowerBound, upperBound));
        }
        return pattern.format(index);
    }

    /// @return a fresh cursor over the paths from the lower to the upper bound
    @Override
    public Iterator<String> iterator() {
        return new Cursor(lowerBound);
    }

    public Stream<String> stream() {
        return StreamSupport.stream(
            Spliterators.spliterator(iterator(), size(), Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    private void requireMutable() {
        if (immutableBounds) {
            throw new ImmutableBoundsException("Cannot set bounds of an immutable sequence: " + pattern);
        }
    }

    /// Walks the current bounds without touching the sequence's state.
    private final class Cursor implements Iterator<String> {
        // long so that an upper bound of Integer.MAX_VALUE still ends the walk
        private long next;

        private Cursor(int start) {
            this.next = start;
        }

        @Override
        public boolean hasNext() {
            return next <= upperBound;
        }

        @Override
        public String next() {
            if (!hasNext()) {
                throw new NoSuchElementException("Sequence " + pattern + " exhausted at " + next);
            }
            return pattern.format((int) next++);
        }
    }

    @Override
    public String toString() {
        return "DataFileSequence{sequence='" + pattern + "', immutableBounds=" + immutableBounds
            + ", bounds=[" + lowerBound + ", " + upperBound + "]}";
    }
}
