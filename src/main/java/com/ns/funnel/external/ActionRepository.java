package com.ns.funnel.external;

import java.util.Optional;
import java.util.Set;

public interface ActionRepository {

    /**
     * Event names a saved action matches, or empty when the action does not exist.
     */
    Optional<Set<String>> resolveStepEvents(long actionId);
}
