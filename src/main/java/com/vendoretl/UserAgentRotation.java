package com.vendoretl;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Hands out browser identities round-robin, one per request.
 */
public class UserAgentRotation {

    private final List<String> userAgents;
    private final AtomicInteger next = new AtomicInteger();

    public UserAgentRotation(List<String> userAgents) {
        if (userAgents.isEmpty()) {
            throw new IllegalArgumentException("At least one user agent is required");
        }
        this.userAgents = List.copyOf(userAgents);
    }

    public String next() {
        return userAgents.get(Math.floorMod(next.getAndIncrement(), userAgents.size()));
    }
}
