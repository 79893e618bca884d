package com.flagship.celebration_ledger.compliance;

public enum EmploymentStatus {
    EMPLOYED(true, true),
    SELF_EMPLOYED(true, false),
    NOT_EMPLOYED(false, false),
    RETIRED(false, false);

    private final boolean requiresOccupation;
    private final boolean requiresEmployer;

    EmploymentStatus(boolean requiresOccupation, boolean requiresEmployer) {
        this.requiresOccupation = requiresOccupation;
        this.requiresEmployer = requiresEmployer;
    }

    public boolean requiresOccupation() {
        return requiresOccupation;
    }

    public boolean requiresEmployer() {
        return requiresEmployer;
    }
}
