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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class DataFileSequenceTest {

    @TempDir
    Path dir;

    private String pattern;

    @BeforeEach
    void createFiles() throws IOException {
        for (int i = 3; i <= 7; i++) {
            Files.writeString(dir.resolve(String.format("frame-%03d.json", i)), "{}");
        }
        pattern = dir + "/frame-%03d.json";
    }

    private String path(int index) {
        return String.format("%s/frame-%03d.json", dir, index);
    }

    @Test
    void boundsComeFromDisk() {
        DataFileSequence sequence = new DataFileSequence(pattern);
        assertTrue(sequence.isImmutableBounds());
        assertEquals(3, sequence.getLowerBound());
        assertEquals(7, sequence.getUpperBound());
        assertEquals(5, sequence.size());
        assertEquals(".json", sequence.extension());
        assertFalse(sequence.startsAtZero());
        assertFalse(sequence.startsAtOne());
        assertEquals(pattern, sequence.sequence());
    }

    @Test
    void immutableBoundsRejectOutsideIndices() {
        DataFileSequence sequence = new DataFileSequence(pattern);
        assertEquals(path(5), sequence.genPath(5));
        assertEquals(path(3), sequence.genPath(3));
        assertThrows(SequenceIndexOutOfBoundsException.class, () -> sequence.genPath(2));
        assertThrows(SequenceIndexOutOfBoundsException.class, () -> sequence.genPath(8));
        assertEquals(3, sequence.getLowerBound());
        assertEquals(7, sequence.getUpperBound());
    }

    @Test
    void immutableBoundsCannotBeSet() {
        DataFileSequence sequence = new DataFileSequence(pattern);
        assertThrows(ImmutableBoundsException.class, () -> sequence.setLowerBound(0));
        assertThrows(ImmutableBoundsException.class, () -> sequence.setUpperBound(10));
    }

    @Test
    void mutableBoundsExtendOneStepAtATime() {
        DataFileSequence sequence = new DataFileSequence(pattern, false);

        assertEquals(path(2), sequence.genPath(2));
        assertEquals(2, sequence.getLowerBound());
        assertThrows(SequenceIndexOutOfBoundsException.class, () -> sequence.genPath(0));
        assertEquals(2, sequence.getLowerBound());
        assertEquals(path(1), sequence.genPath(1));
        assertEquals(path(0), sequence.genPath(0));
        assertTrue(sequence.startsAtZero());

        assertEquals(path(8), sequence.genPath(8));
        assertEquals(8, sequence.getUpperBound());
        assertThrows(SequenceIndexOutOfBoundsException.class, () -> sequence.genPath(10));
        assertThrows(InvalidIndexException.class, () -> sequence.genPath(-1));
        assertEquals(9, sequence.size());
    }

    @Test
    void settersClampAgainstOppositeBound() {
        DataFileSequence sequence = new DataFileSequence(pattern, false);
        sequence.setLowerBound(1);
        assertTrue(sequence.startsAtOne());
        sequence.setLowerBound(20);
        assertEquals(7, sequence.getLowerBound());
        sequence.setUpperBound(2);
        assertEquals(7, sequence.getUpperBound());
        sequence.setUpperBound(12);
        assertEquals(12, sequence.getUpperBound());
        assertTrue(sequence.checkBounds(10));
        assertFalse(sequence.checkBounds(6));
    }

    @Test
    void eachIterationStartsOver() {
        DataFileSequence sequence = new DataFileSequence(pattern);
        List<String> expected = List.of(path(3), path(4), path(5), path(6), path(7));

        List<String> first = new ArrayList<>();
        sequence.forEach(first::add);
        assertEquals(expected, first);
        assertEquals(expected, sequence.stream().collect(Collectors.toList()));

        Iterator<String> a = sequence.iterator();
        Iterator<String> b = sequence.iterator();
        a.next();
        a.next();
        assertEquals(path(3), b.next());
        assertEquals(path(5), a.next());
    }

    @Test
    void exhaustedCursorFails() {
        DataFileSequence sequence = new DataFileSequence(pattern);
        Iterator<String> cursor = sequence.iterator();
        for (int i = 0; i < 5; i++) {
            cursor.next();
        }
        assertFalse(cursor.hasNext());
        assertThrows(NoSuchElementException.class, cursor::next);
    }

    @Test
    void cursorEndsAtLargestIndex(@TempDir Path top) throws IOException {
        Files.writeString(top.resolve("f-2147483646.dat"), "x");
        Files.writeString(top.resolve("f-2147483647.dat"), "x");
        DataFileSequence sequence = new DataFileSequence(top + "/f-%d.dat");
        assertEquals(Integer.MAX_VALUE, sequence.getUpperBound());

        Iterator<String> cursor = sequence.iterator();
        assertEquals(top + "/f-2147483646.dat", cursor.next());
        assertEquals(top + "/f-2147483647.dat", cursor.next());
        assertFalse(cursor.hasNext());
        assertThrows(NoSuchElementException.class, cursor::next);
        assertEquals(2, sequence.stream().count());
    }

    @Test
    void missingFilesFail() {
        assertThrows(PatternMismatchException.class, () -> new DataFileSequence(dir + "/clip-%03d.json"));
        assertThrows(PatternMismatchException.class, () -> new DataFileSequence(dir + "/frame-%d.json"));
        assertThrows(PatternMismatchException.class, () -> new DataFileSequence(dir.resolve("nowhere") + "/%d.json"));
    }

    @Test
    void errorsShareOneBase() {
        DataFileSequence sequence = new DataFileSequence(pattern);
        assertThrows(DataFileSequenceException.class, () -> sequence.genPath(100));
        assertThrows(DataFileSequenceException.class, () -> new DataFileSequence(dir + "/frames.json"));
    }

    @Test
    void forDirectoryInfersPattern() throws IOException {
        Files.writeString(dir.resolve("README.md"), "frames");
        DataFileSequence sequence = DataFileSequence.forDirectory(dir);
        assertEquals("frame-%03d.json", sequence.pattern().fileTemplate());
        assertEquals(3, sequence.getLowerBound());
        assertEquals(7, sequence.getUpperBound());
        assertThat(sequence.genPath(4)).endsWith("frame-004.json");
        assertTrue(Files.exists(Path.of(sequence.genPath(4))));
    }

    @Test
    void forDirectoryNeedsNumberedFiles(@TempDir Path empty) {
        assertThrows(PatternMismatchException.class, () -> DataFileSequence.forDirectory(empty));
    }
}
