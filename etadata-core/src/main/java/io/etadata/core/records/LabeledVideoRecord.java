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

import java.util.Objects;

/// A labeled video, optionally tagged with a group such as the parent video
/// several clips were sampled from.
public final class LabeledVideoRecord extends BaseDataRecord {

    public static final String VIDEO_PATH = "video_path";
    public static final String LABEL = "label";
    public static final String GROUP = "group";

    public static final RecordKind<LabeledVideoRecord> KIND =
        RecordKind.builder("labeled_video", LabeledVideoRecord.class)
            .required(VIDEO_PATH, LABEL)
            .optional(GROUP)
            .factory(fields -> new LabeledVideoRecord(
                fields.getString(VIDEO_PATH),
                fields.getString(LABEL),
                fields.optionalString(GROUP)))
            .build();

    private final String videoPath;
    private final String label;
    private final OptionalField<String> group;

    public LabeledVideoRecord(String videoPath, String label) {
        this(videoPath, label, OptionalField.absent());
    }

    public LabeledVideoRecord(String videoPath, String label, String group) {
        this(videoPath, label, OptionalField.of(group));
    }

    public LabeledVideoRecord(String videoPath, String label, OptionalField<String> group) {
        this.videoPath = videoPath;
        this.label = label;
        this.group = Objects.requireNonNull(group, "group cannot be null; use OptionalField.absent()");
    }

    public String getVideoPath() {
        return videoPath;
    }

    public String getLabel() {
        return label;
    }

    public OptionalField<String> getGroup() {
        return group;
    }

    @Override
    public RecordKind<LabeledVideoRecord> kind() {
        return KIND;
    }

    @Override
    protected OptionalField<?> field(String name) {
        switch (name) {
            case VIDEO_PATH:
                return OptionalField.of(videoPath);
            case LABEL:
                return OptionalField.of(label);
            case GROUP:
                return group;
            default:
                return OptionalField.absent();
        }
    }
}
