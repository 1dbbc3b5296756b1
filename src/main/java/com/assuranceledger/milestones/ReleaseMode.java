package com.assuranceledger.milestones;

public enum ReleaseMode {
    MANUAL,
    AUTOMATIC
}
