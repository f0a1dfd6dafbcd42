package com.assetdiffbot.core.report;

/**
 * A titled table small enough to fit the detail ceiling.
 */
public record DetailBlock(
    String title,
    String changeLabel,
    String table
) {}
