package com.hostelbooking.inventory.sync;

import com.hostelbooking.inventory.domain.model.LedgerEntry;

import java.util.List;
import java.util.Set;

/**
 * What to do with one imported stay.
 *
 * @param target               entry to update or cancel; null for CREATE, SKIP and CONFLICT
 * @param beds                 beds the stay will occupy for CREATE and UPDATE
 * @param conflictingEntryIds  occupants that prevent the claim, for CONFLICT
 * @param directConflict       true when a hostel-owned booking is among those occupants
 */
public record Resolution(
        Action action,
        LedgerEntry target,
        Set<Integer> beds,
        List<Long> conflictingEntryIds,
        boolean directConflict,
        String reason
) {

    public enum Action {
        CREATE,
        UPDATE,
        UNCHANGED,
        CANCEL,
        SKIP,
        CONFLICT
    }

    static Resolution create(Set<Integer> beds) {
        return new Resolution(Action.CREATE, null, beds, List.of(), false, null);
    }

    static Resolution update(LedgerEntry target, Set<Integer> beds) {
        return new Resolution(Action.UPDATE, target, beds, List.of(), false, null);
    }

    static Resolution unchanged(LedgerEntry target) {
        return new Resolution(Action.UNCHANGED, target, target.getBeds(), List.of(), false, null);
    }

    static Resolution cancel(LedgerEntry target) {
        return new Resolution(Action.CANCEL, target, Set.of(), List.of(), false, null);
    }

    static Resolution skip(String reason) {
        return new Resolution(Action.SKIP, null, Set.of(), List.of(), false, reason);
    }

    static Resolution conflict(List<Long> conflictingEntryIds, boolean directConflict, String reason) {
        return new Resolution(Action.CONFLICT, null, Set.of(), conflictingEntryIds, directConflict, reason);
    }
}
