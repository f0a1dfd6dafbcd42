package com.assetdiffbot.core.model;

public enum JobType {
    DIFF,
    CLEANUP
}
