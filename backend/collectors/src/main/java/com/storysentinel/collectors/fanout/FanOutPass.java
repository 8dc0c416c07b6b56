package com.storysentinel.collectors.fanout;

import java.util.Set;

/**
 * One fetch pass over a set of identifiers.
 */
@FunctionalInterface
public interface FanOutPass {
    FanOutOutcome run(Set<Integer> ids) throws InterruptedException;
}
