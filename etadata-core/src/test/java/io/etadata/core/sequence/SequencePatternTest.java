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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class SequencePatternTest {

    @Test
    void parsesPaddedPattern() {
        SequencePattern pattern = SequencePattern.parse("frames/img_%05d.png");
        assertEquals(Path.of("frames/"), pattern.directory());
        assertEquals("img_%05d.png", pattern.fileTemplate());
        assertEquals(".png", pattern.extension());
        assertEquals("frames/img_00042.png", pattern.format(42));
        assertEquals(42, pattern.indexOf("img_00042.png").orElseThrow());
    }

    @Test
    void indexOfRequiresExactFormatting() {
        SequencePattern padded = SequencePattern.parse("out/%03d.json");
        assertTrue(padded.indexOf("7.json").isEmpty());
        assertTrue(padded.indexOf("007.txt").isEmpty());
        assertEquals(7, padded.indexOf("007.json").orElseThrow());
        assertEquals(1234, padded.indexOf("1234.json").orElseThrow());

        SequencePattern plain = SequencePattern.parse("out/%d.json");
        assertTrue(plain.indexOf("007.json").isEmpty());
        assertEquals(7, plain.indexOf("7.json").orElseThrow());
    }

    @Test
    void literalPercentIsAllowed() {
        SequencePattern pattern = SequencePattern.parse("out/100%%_%d.txt");
        assertEquals("out/100%_3.txt", pattern.format(3));
        assertEquals(3, pattern.indexOf("100%_3.txt").orElseThrow());
        assertEquals(".txt", pattern.extension());
    }

    @Test
    void rejectsInvalidPatterns() {
        assertThrows(InvalidPatternException.class, () -> SequencePattern.parse(""));
        assertThrows(InvalidPatternException.class, () -> SequencePattern.parse("out/frame.png"));
        assertThrows(InvalidPatternException.class, () -> SequencePattern.parse("out/%d_%d.png"));
        assertThrows(InvalidPatternException.class, () -> SequencePattern.parse("out/%s.png"));
        assertThrows(InvalidPatternException.class, () -> SequencePattern.parse("out/%0d.png"));
        assertThrows(InvalidPatternException.class, () -> SequencePattern.parse("run%d/frame.png"));
    }

    @Test
    void noExtension() {
        assertEquals("", SequencePattern.parse("out/part-%d").extension());
    }

    @Test
    void infersPaddedFamily(@TempDir Path dir) throws IOException {
        for (int i = 8; i <= 12; i++) {
            Files.createFile(dir.resolve(String.format("frame_%04d.jpg", i)));
        }
        Files.createFile(dir.resolve("notes.txt"));
        Files.createFile(dir.resolve("other1.csv"));

        SequencePattern pattern = SequencePattern.inferFromDirectory(dir);
        assertEquals("frame_%04d.jpg", pattern.fileTemplate());
        assertEquals(new SequencePattern.IndexBounds(8, 12), pattern.scanBounds());
    }

    @Test
    void infersUnpaddedFamily(@TempDir Path dir) throws IOException {
        for (int i : new int[]{1, 2, 10, 11}) {
            Files.createFile(dir.resolve("clip" + i + ".mp4"));
        }
        SequencePattern pattern = SequencePattern.inferFromDirectory(dir);
        assertEquals("clip%d.mp4", pattern.fileTemplate());
        assertEquals(new SequencePattern.IndexBounds(1, 11), pattern.scanBounds());
    }

    @Test
    void inferenceNeedsNumberedFiles(@TempDir Path dir) throws IOException {
        Files.createFile(dir.resolve("readme.md"));
        assertThrows(PatternMismatchException.class, () -> SequencePattern.inferFromDirectory(dir));
    }
}
