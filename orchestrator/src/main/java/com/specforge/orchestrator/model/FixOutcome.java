package com.specforge.orchestrator.model;

/** What happened in the single fix attempt of a file. */
public enum FixOutcome {
    NOT_REQUIRED,   // analysis reported zero issues
    APPLIED,        // corrected content replaced the original
    FAILED          // fix call failed or returned nothing; original content kept
}
