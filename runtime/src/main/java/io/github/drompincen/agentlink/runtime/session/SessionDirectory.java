package io.github.drompincen.agentlink.runtime.session;

import java.util.Optional;

/**
 * Remote service that allocates new session ids. Empty when it is unavailable; callers then
 * mint an id locally.
 */
public interface SessionDirectory {

    Optional<String> createSession();

    static SessionDirectory local() {
        return Optional::empty;
    }
}
