package me.golemcore.toolexec.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * MAJOR.MINOR.PATCH version with an optional pre-release tag. Build metadata
 * is accepted and ignored for ordering.
 */
public record SemanticVersion(int major, int minor, int patch, String preRelease)
        implements Comparable<SemanticVersion> {

    private static final Pattern VERSION = Pattern.compile(
            "^v?(\\d+)(?:\\.(\\d+))?(?:\\.(\\d+))?(?:-([0-9A-Za-z.-]+))?(?:\\+[0-9A-Za-z.-]+)?$");

    public static SemanticVersion parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Version must not be null");
        }
        Matcher matcher = VERSION.matcher(text.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid semantic version: " + text);
        }
        return new SemanticVersion(
                Integer.parseInt(matcher.group(1)),
                matcher.group(2) != null ? Integer.parseInt(matcher.group(2)) : 0,
                matcher.group(3) != null ? Integer.parseInt(matcher.group(3)) : 0,
                matcher.group(4));
    }

    public static boolean isValid(String text) {
        return text != null && VERSION.matcher(text.trim()).matches();
    }

    public boolean isPreRelease() {
        return preRelease != null && !preRelease.isEmpty();
    }

    @Override
    public int compareTo(SemanticVersion other) {
        int result = Integer.compare(major, other.major);
        if (result != 0) {
            return result;
        }
        result = Integer.compare(minor, other.minor);
        if (result != 0) {
            return result;
        }
        result = Integer.compare(patch, other.patch);
        if (result != 0) {
            return result;
        }
        if (Objects.equals(preRelease, other.preRelease)) {
            return 0;
        }
        // a release sorts after any of its pre-releases
        if (!isPreRelease()) {
            return 1;
        }
        if (!other.isPreRelease()) {
            return -1;
        }
        return preRelease.compareTo(other.preRelease);
    }

    @Override
    public String toString() {
        String base = major + "." + minor + "." + patch;
        return isPreRelease() ? base + "-" + preRelease : base;
    }
}
