package com.dbbaskette.codeguardian.service.fix;

import java.util.Optional;

/**
 * Fix ids are derived from the comment id: {@code fix_<commentId>}.
 */
public final class FixIds {

    public static final String PREFIX = "fix_";

    private FixIds() {}

    public static String forComment(Long commentId) {
        if (commentId == null) {
            throw new IllegalArgumentException("Comment has no id");
        }
        return PREFIX + commentId;
    }

    /**
     * @throws IllegalArgumentException if the id is not of the form {@code fix_<positive number>}
     */
    public static long parse(String fixId) {
        if (fixId == null || !fixId.startsWith(PREFIX)) {
            throw new IllegalArgumentException("Malformed fix id: " + fixId);
        }
        try {
            long commentId = Long.parseLong(fixId.substring(PREFIX.length()));
            if (commentId <= 0) {
                throw new IllegalArgumentException("Malformed fix id: " + fixId);
            }
            return commentId;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed fix id: " + fixId, e);
        }
    }

    public static Optional<Long> tryParse(String fixId) {
        try {
            return Optional.of(parse(fixId));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
