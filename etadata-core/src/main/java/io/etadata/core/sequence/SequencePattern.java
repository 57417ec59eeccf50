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

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/// A printf-style path pattern with exactly one integer placeholder in its file name.
///
/// Supported placeholders are `%d`, `%Nd` and `%0Nd`; `%%` stands for a
/// literal percent sign. Examples:
///
/// ```text
/// /path/to/video/%05d.png
/// /path/to/objects/frame-%d.json
/// ```
///
/// A file belongs to the pattern when its name, parsed back to an index and
/// formatted again, reproduces the name exactly. This keeps `%05d` from
/// matching `7.png` and `%d` from matching `007.png`.
public final class SequencePattern {
    private static final Logger logger = LogManager.getLogger(SequencePattern.class);

    private static final Pattern PLACEHOLDER = Pattern.compile("(0?)([1-9]\\d*)?d");
    private static final Pattern NUMBERED_NAME = Pattern.compile(
        "^(?<prefix>.*?)(?<digits>\\d+)(?<suffix>\\D*(?:\\.[A-Za-z0-9]+)?)$");

    private final String pattern;
    private final Path directory;
    private final String fileTemplate;
    private final String suffix;
    private final Pattern fileMatcher;

    private SequencePattern(String pattern, Path directory, String fileTemplate, String prefix, String suffix) {
        this.pattern = pattern;
        this.directory = directory;
        this.fileTemplate = fileTemplate;
        this.suffix = suffix;
        this.fileMatcher = Pattern.compile(Pattern.quote(prefix) + " *(\\d+)" + Pattern.quote(suffix));
    }

    /// Parses and checks a sequence pattern.
    ///
    /// @param pattern the pattern, e.g. `/data/frames/%05d.png`
    /// @return the parsed pattern
    /// @throws InvalidPatternException if the pattern does not hold exactly one
    ///     integer placeholder, holds another conversion, or has the placeholder
    ///     outside the file name
    public static SequencePattern parse(String pattern) {
        if (pattern == null || pattern.isEmpty()) {
            throw new InvalidPatternException("Sequence pattern cannot be empty");
        }
        int nameStart = Math.max(pattern.lastIndexOf('/'), pattern.lastIndexOf(File.separatorChar)) + 1;

        StringBuilder literal = new StringBuilder();
        String prefix = null;
        int placeholders = 0;
        int placeholderAt = -1;
        int i = 0;
        while (i < pattern.length()) {
            char c = pattern.charAt(i);
            if (c != '%') {
                literal.append(c);
                i++;
                continue;
            }
            if (i + 1 < pattern.length() && pattern.charAt(i + 1) == '%') {
                literal.append('%');
                i += 2;
                continue;
            }
            Matcher m = PLACEHOLDER.matcher(pattern).region(i + 1, pattern.length());
            if (!m.lookingAt() || (!m.group(1).isEmpty() && m.group(2) == null)) {
                throw new InvalidPatternException(
                    "Unsupported conversion at position " + i + " of sequence pattern '" + pattern + "'");
            }
            placeholders++;
            placeholderAt = i;
            prefix = literal.toString();
            literal.setLength(0);
            i = m.end();
        }
        if (placeholders != 1) {
            throw new InvalidPatternException(
                "Sequence pattern '" + pattern + "' must hold exactly one integer placeholder; found " + placeholders);
        }
        if (placeholderAt < nameStart) {
            throw new InvalidPatternException(
                "The placeholder of sequence pattern '" + pattern + "' must be in the file name");
        }

        String dirPart = pattern.substring(0, nameStart);
        Path directory = dirPart.isEmpty() ? Path.of(".") : Path.of(dirPart.replace("%%", "%"));
        String fileTemplate = pattern.substring(nameStart);
        String filePrefix = prefix.substring(Math.min(prefix.length(), literalLength(dirPart)));
        return new SequencePattern(pattern, directory, fileTemplate, filePrefix, literal.toString());
    }

    /// Infers the pattern of the largest numbered file family in a directory.
    ///
    /// Files are grouped by the text before and after their last run of
    /// digits, not counting digits in the extension (`clip7.mp4` is clip 7).
    /// Within the largest group, zero-padded indices yield `%0Nd` with the
    /// narrowest padded width, equal widths throughout also yield
    /// `%0Nd`, and anything else yields `%d`.
    ///
    /// @param directory the directory to inspect
    /// @return the inferred pattern, rooted at the directory
    /// @throws PatternMismatchException if the directory holds no numbered files
    public static SequencePattern inferFromDirectory(Path directory) {
        Map<String, List<String>> families = new LinkedHashMap<>();
        for (String name : listFileNames(directory)) {
            Matcher m = NUMBERED_NAME.matcher(name);
            if (m.matches()) {
                String key = m.group("prefix") + '\0' + m.group("suffix");
                families.computeIfAbsent(key, k -> new ArrayList<>()).add(name);
            }
        }
        List<String> largest = families.values().stream()
            .max(Comparator.comparingInt(List::size))
            .orElseThrow(() -> new PatternMismatchException("No numbered files found in directory " + directory));

        Matcher first = NUMBERED_NAME.matcher(largest.get(0));
        if (!first.matches()) {
            throw new IllegalStateException("Grouped file name no longer matches: " + largest.get(0));
        }
        List<String> digitRuns = largest.stream()
            .map(n -> {
                Matcher m = NUMBERED_NAME.matcher(n);
                return m.matches() ? m.group("digits") : "";
            })
            .collect(Collectors.toList());
        int width = digitRuns.get(0).length();
        boolean sameWidth = digitRuns.stream().allMatch(d -> d.length() == width);
        OptionalInt paddedWidth = digitRuns.stream()
            .filter(d -> d.length() > 1 && d.charAt(0) == '0')
            .mapToInt(String::length)
            .min();
        String placeholder;
        if (paddedWidth.isPresent()) {
            placeholder = "%0" + paddedWidth.getAsInt() + "d";
        } else if (sameWidth && width > 1) {
            placeholder = "%0" + width + "d";
        } else {
            placeholder = "%d";
        }

        String template = escape(first.group("prefix")) + placeholder + escape(first.group("suffix"));
        String pattern = escape(directory.toString()) + File.separator + template;
        logger.debug("Inferred sequence pattern {} from {} file(s) in {}", pattern, largest.size(), directory);
        return parse(pattern);
    }

    /// @return the pattern text
    public String pattern() {
        return pattern;
    }

    /// @return the directory holding the sequence's files
    public Path directory() {
        return directory;
    }

    /// @return the file name part of the pattern
    public String fileTemplate() {
        return fileTemplate;
    }

    /// @return the file extension including the dot, or an empty string
    public String extension() {
        int dot = suffix.lastIndexOf('.');
        return dot >= 0 ? suffix.substring(dot) : "";
    }

    /// @param index a sequence index
    /// @return the path for the index
    public String format(int index) {
        return String.format(Locale.ROOT, pattern, index);
    }

    /// @param fileName a bare file name
    /// @return the index the name encodes, if it belongs to this pattern
    public OptionalInt indexOf(String fileName) {
        Matcher m = fileMatcher.matcher(fileName);
        if (!m.matches()) {
            return OptionalInt.empty();
        }
        int index;
        try {
            index = Integer.parseInt(m.group(1));
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
        String formatted = String.format(Locale.ROOT, fileTemplate, index);
        return formatted.equals(fileName) ? OptionalInt.of(index) : OptionalInt.empty();
    }

    /// Scans the pattern's directory once for matching files.
    ///
    /// @return the smallest and largest matching index
    /// @throws PatternMismatchException if no file matches
    public IndexBounds scanBounds() {
        int lower = Integer.MAX_VALUE;
        int upper = Integer.MIN_VALUE;
        int matched = 0;
        for (String name : listFileNames(directory)) {
            OptionalInt index = indexOf(name);
            if (index.isPresent()) {
                lower = Math.min(lower, index.getAsInt());
                upper = Math.max(upper, index.getAsInt());
                matched++;
            }
        }
        if (matched == 0) {
            throw new PatternMismatchException("Sequence '" + pattern + "' did not match any files on disk");
        }
        logger.debug("Sequence {} matched {} file(s) in [{}, {}]", pattern, matched, lower, upper);
        return new IndexBounds(lower, upper);
    }

    private static List<String> listFileNames(Path directory) {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files.filter(Files::isRegularFile)
                .map(p -> p.getFileName().toString())
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to list " + directory, e);
        }
    }

    private static int literalLength(String patternText) {
        return patternText.replace("%%", "%").length();
    }

    private static String escape(String literal) {
        return literal.replace("%", "%%");
    }

    @Override
    public String toString() {
        return pattern;
    }

    /// The inclusive index range found on disk.
    ///
    /// @param lower the smallest index
    /// @param upper the largest index
    public record IndexBounds(int lower, int upper) {
    }
}
