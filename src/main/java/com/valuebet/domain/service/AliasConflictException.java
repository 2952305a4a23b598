package com.valuebet.domain.service;

import java.util.List;

/**
 * Raised when the alias map is built under the REJECT policy and two entities share an alias.
 */
public class AliasConflictException extends RuntimeException {

    private final List<AliasDirectory.AliasConflict> conflicts;

    public AliasConflictException(List<AliasDirectory.AliasConflict> conflicts) {
        super("Aliases shared by different entities: " + conflicts);
        this.conflicts = List.copyOf(conflicts);
    }

    public List<AliasDirectory.AliasConflict> getConflicts() {
        return conflicts;
    }
}
