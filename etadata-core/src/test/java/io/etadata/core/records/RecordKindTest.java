package io.etadata.core.records;

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

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class RecordKindTest {

    /// A record with one field of each kind, including an excluded cache field.
    static final class ScoredClip extends BaseDataRecord {
        static final RecordKind<ScoredClip> KIND = RecordKind.builder("scored_clip", ScoredClip.class)
            .required("clip")
            .optional("score")
            .excluded("cache")
            .factory(fields -> new ScoredClip(fields.getString("clip"), fields.optional("score"), "computed"))
            .build();

        private final String clip;
        private final OptionalField<Object> score;
        private final String cache;

        ScoredClip(String clip, OptionalField<Object> score, String cache) {
            this.clip = clip;
            this.score = score;
            this.cache = cache;
        }

        @Override
        public RecordKind<ScoredClip> kind() {
            return KIND;
        }

        @Override
        protected OptionalField<?> field(String name) {
            switch (name) {
                case "clip":
                    return OptionalField.of(clip);
                case "score":
                    return score;
                case "cache":
                    return OptionalField.of(cache);
                default:
                    return OptionalField.absent();
            }
        }
    }

    @Test
    void parseCopiesRequiredAndPresentOptionalFields() {
        ScoredClip clip = ScoredClip.KIND.parse(Map.of("clip", "a.mp4", "score", 0.5, "ignored", 1));
        assertEquals("a.mp4", clip.get("clip"));
        assertEquals(0.5, clip.get("score"));
        assertEquals("computed", clip.get("cache"));
        assertThrows(FieldNotFoundException.class, () -> clip.get("ignored"));
    }

    @Test
    void missingRequiredFieldFails() {
        MissingFieldException e = assertThrows(MissingFieldException.class,
            () -> ScoredClip.KIND.parse(Map.of("score", 1.0)));
        assertThat(e).hasMessageContaining("clip");
        assertInstanceOf(DataRecordsException.class, e);
    }

    @Test
    void absentAndNullOptionalFieldsDiffer() {
        ScoredClip absent = ScoredClip.KIND.parse(Map.of("clip", "a.mp4"));
        Map<String, Object> withNull = new HashMap<>();
        withNull.put("clip", "a.mp4");
        withNull.put("score", null);
        ScoredClip present = ScoredClip.KIND.parse(withNull);

        assertFalse(absent.hasField("score"));
        assertThrows(FieldNotFoundException.class, () -> absent.get("score"));
        assertTrue(present.hasField("score"));
        assertNull(present.get("score"));
        assertNotEquals(absent, present);

        assertThat(absent.toMap()).containsOnlyKeys("clip");
        assertThat(present.toMap()).containsOnlyKeys("clip", "score").containsEntry("score", null);
    }

    @Test
    void excludedFieldsAreNeverSerialized() {
        ScoredClip clip = ScoredClip.KIND.parse(Map.of("clip", "a.mp4", "cache", "stale"));
        assertTrue(clip.hasField("cache"));
        assertThat(clip.toMap()).doesNotContainKey("cache");
        assertEquals("computed", clip.get("cache"));
    }

    @Test
    void fieldsCannotBeDeclaredTwice() {
        assertThrows(IllegalArgumentException.class, () -> RecordKind.builder("dup", ScoredClip.class)
            .required("clip")
            .optional("clip")
            .factory(fields -> null)
            .build());
    }

    @Test
    void labeledVideoKind() {
        assertThat(LabeledVideoRecord.KIND.required()).containsExactly("video_path", "label");
        assertThat(LabeledVideoRecord.KIND.optional()).containsExactly("group");

        LabeledVideoRecord record = LabeledVideoRecord.KIND.parse(Map.of("video_path", "v/1.mp4", "label", 3));
        assertEquals("3", record.getLabel());
        assertTrue(record.getGroup().isAbsent());
        assertEquals(new LabeledVideoRecord("v/1.mp4", "3"), record);
        assertNotEquals(new LabeledVideoRecord("v/1.mp4", "3", "g"), record);
    }

    @Test
    void registryResolvesRegisteredKinds() {
        RecordKindRegistry registry = RecordKindRegistry.create();
        assertThat(registry.names()).containsExactly("labeled_video");
        assertTrue(registry.find("scored_clip").isEmpty());

        registry.register(ScoredClip.KIND);
        assertSame(ScoredClip.KIND, registry.find("scored_clip").orElseThrow());

        RecordKind<ScoredClip> impostor = RecordKind.builder("labeled_video", ScoredClip.class)
            .required("clip")
            .factory(fields -> null)
            .build();
        assertThrows(IllegalArgumentException.class, () -> registry.register(impostor));
    }

    @Test
    void optionalFieldStates() {
        assertTrue(OptionalField.absent().isAbsent());
        assertThrows(java.util.NoSuchElementException.class, () -> OptionalField.absent().get());
        assertTrue(OptionalField.of(null).isPresent());
        assertEquals("x", OptionalField.absent().orElse("x"));
        assertEquals(OptionalField.of(4), OptionalField.of(2).map(v -> v * 2));
        assertTrue(OptionalField.<Integer>absent().map(v -> v * 2).isAbsent());
    }
}
