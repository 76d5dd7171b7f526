package com.facet.backend.modules.auth.domain;

import java.util.UUID;

/**
 * A record that belongs to the employees who took it in or are working on it.
 */
public interface OwnedResource {

    UUID getTakenInBy();

    UUID getWorkedBy();
}
