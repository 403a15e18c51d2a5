package com.example.carerota.exception;

import com.example.carerota.conflict.ConflictResult;

/**
 * Thrown when an assignment is refused because its evaluation produced a conflict.
 */
public class AssignmentConflictException extends BusinessException {

    private final ConflictResult conflict;

    public AssignmentConflictException(ConflictResult conflict) {
        super(conflict.type().name(), conflict.message());
        this.conflict = conflict;
    }

    public ConflictResult getConflict() {
        return conflict;
    }
}
