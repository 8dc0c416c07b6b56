package com.storysentinel.collectors.fanout;

import com.storysentinel.core.model.Story;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

public record FanOutOutcome(List<Story> succeeded, Set<Integer> failed, int requestsSent) {
    public FanOutOutcome {
        succeeded = List.copyOf(succeeded);
        failed = Set.copyOf(failed);
    }

    public int size() {
        return succeeded.size() + failed.size();
    }

    /**
     * Checks that this outcome covers {@code requested} exactly once: the counts add up and the
     * succeeded story ids plus the failed ids are precisely the requested ids.
     *
     * @throws FanOutInvariantViolation otherwise
     */
    public FanOutOutcome verifyCovers(Set<Integer> requested) {
        if (size() != requested.size()) {
            throw new FanOutInvariantViolation("Fan-out accounted for " + size() + " of " + requested.size()
                    + " identifiers (" + succeeded.size() + " succeeded, " + failed.size() + " failed)");
        }
        if (requestsSent > requested.size()) {
            throw new FanOutInvariantViolation("Fan-out sent " + requestsSent + " requests for "
                    + requested.size() + " identifiers");
        }
        Set<Integer> seen = new HashSet<>(failed);
        for (Story story : succeeded) {
            if (!seen.add(story.id())) {
                throw new FanOutInvariantViolation("Identifier " + story.id() + " reported more than once");
            }
        }
        if (!seen.equals(requested)) {
            Set<Integer> unexpected = new HashSet<>(seen);
            unexpected.removeAll(requested);
            throw new FanOutInvariantViolation("Fan-out reported identifiers that were not requested: " + unexpected);
        }
        return this;
    }
}
