package com.backlogstore.core.git;

import java.time.Instant;

/**
 * A branch and the time of its last commit.
 *
 * @param name           short ref name, e.g. {@code feature/login} or {@code origin/main}
 * @param lastCommitTime committer date of the branch head
 * @param remote         whether this is a remote-tracking branch
 */
public record BranchInfo(String name, Instant lastCommitTime, boolean remote) {
}
