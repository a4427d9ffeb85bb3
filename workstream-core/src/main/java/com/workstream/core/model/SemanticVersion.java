package com.workstream.core.model;

import java.util.Comparator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A major.minor.patch version. An optional leading "v" is accepted when parsing.
 */
public record SemanticVersion(int major, int minor, int patch) implements Comparable<SemanticVersion> {

    private static final Pattern PATTERN = Pattern.compile("^v?(\\d+)\\.(\\d+)\\.(\\d+)$");

    private static final Comparator<SemanticVersion> ORDER = Comparator
        .comparingInt(SemanticVersion::major)
        .thenComparingInt(SemanticVersion::minor)
        .thenComparingInt(SemanticVersion::patch);

    public SemanticVersion {
        if (major < 0 || minor < 0 || patch < 0) {
            throw new IllegalArgumentException("Version components must be >= 0");
        }
    }

    public static SemanticVersion parse(String version) {
        if (version == null) {
            throw new IllegalArgumentException("Version must not be null");
        }
        Matcher m = PATTERN.matcher(version.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("Not a semantic version (major.minor.patch): " + version);
        }
        return new SemanticVersion(
            Integer.parseInt(m.group(1)),
            Integer.parseInt(m.group(2)),
            Integer.parseInt(m.group(3))
        );
    }

    public boolean isMajorBumpOver(SemanticVersion previous) {
        return major > previous.major;
    }

    public boolean isNewerThan(SemanticVersion other) {
        return compareTo(other) > 0;
    }

    @Override
    public int compareTo(SemanticVersion other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + patch;
    }
}
