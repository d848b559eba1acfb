package com.flagship.expense_workflow.identity;

import java.util.Optional;
import java.util.UUID;

/**
 * Read-only view of the identity store.
 *
 * The workflow never authenticates anyone; it only needs to know the role of
 * an expense's creator when a manager tries to approve it, and a display name
 * when returning records to a UI.
 */
public interface IdentityLookup {

    Optional<UserRole> roleOf(UUID userId);

    Optional<String> displayNameOf(UUID userId);
}
