package com.air.core.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Where the patches of a review come from. Exactly one variant is carried by
 * each {@link ReviewRequest}; every variant validates itself on construction.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Origin.SingleCommit.class, name = "hash"),
        @JsonSubTypes.Type(value = Origin.CommitRange.class, name = "range"),
        @JsonSubTypes.Type(value = Origin.Series.class, name = "series"),
        @JsonSubTypes.Type(value = Origin.LiteralPatches.class, name = "patches")
})
public sealed interface Origin
        permits Origin.SingleCommit, Origin.CommitRange, Origin.Series, Origin.LiteralPatches {

    Pattern HASH = Pattern.compile("[0-9a-fA-F]{4,40}");

    /**
     * Number of patches this origin yields, when it can be known before the
     * tree is prepared. Ranges, series and literal patches return -1.
     */
    int knownPatchCount();

    /** Patch count used for queue estimates; unknown counts as one. */
    default int estimatedPatchCount() {
        int known = knownPatchCount();
        return known > 0 ? known : 1;
    }

    /** Short human-readable form used in logs and records. */
    String describe();

    /**
     * Parses the single {@code hash} field of a submission, which may hold
     * either a commit id or a {@code a..b} range.
     */
    static Origin ofHash(String hash) {
        if (hash != null && hash.contains("..")) {
            return new CommitRange(hash);
        }
        return new SingleCommit(hash);
    }

    record SingleCommit(String hash) implements Origin {
        public SingleCommit {
            if (hash == null || !HASH.matcher(hash.trim()).matches()) {
                throw new ValidationException("Invalid commit id: " + hash);
            }
            hash = hash.trim();
        }

        @Override
        public int knownPatchCount() {
            return 1;
        }

        @Override
        public String describe() {
            return hash;
        }
    }

    record CommitRange(String range) implements Origin {
        public CommitRange {
            if (range == null) {
                throw new ValidationException("Commit range is required");
            }
            range = range.trim();
            int sep = range.indexOf("..");
            if (sep <= 0 || sep + 2 >= range.length() || range.startsWith(".", sep + 2)) {
                throw new ValidationException("Invalid commit range: " + range);
            }
        }

        /** The commit the range starts from (exclusive). */
        public String start() {
            return range.substring(0, range.indexOf(".."));
        }

        /** The commit the range ends at (inclusive). */
        public String end() {
            return range.substring(range.indexOf("..") + 2);
        }

        @Override
        public int knownPatchCount() {
            return -1;
        }

        @Override
        public String describe() {
            return range;
        }
    }

    record Series(long seriesId) implements Origin {
        public Series {
            if (seriesId <= 0) {
                throw new ValidationException("Invalid series id: " + seriesId);
            }
        }

        @Override
        public int knownPatchCount() {
            return -1;
        }

        @Override
        public String describe() {
            return "series " + seriesId;
        }
    }

    /**
     * Patch texts applied with {@code git am}. A body may be an mbox holding
     * several patches, so the patch count is only known once they are applied.
     */
    record LiteralPatches(List<String> bodies) implements Origin {
        public LiteralPatches {
            if (bodies == null || bodies.isEmpty()) {
                throw new ValidationException("At least one patch is required");
            }
            for (int i = 0; i < bodies.size(); i++) {
                String body = bodies.get(i);
                if (body == null || body.isBlank()) {
                    throw new ValidationException("Patch " + (i + 1) + " is empty");
                }
            }
            bodies = List.copyOf(bodies);
        }

        @Override
        public int knownPatchCount() {
            return -1;
        }

        @Override
        public int estimatedPatchCount() {
            return bodies.size();
        }

        @Override
        public String describe() {
            return bodies.size() + " literal patch" + (bodies.size() == 1 ? "" : "es");
        }
    }
}
