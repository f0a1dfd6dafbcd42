package com.assetdiffbot.core.engine;

import com.assetdiffbot.core.report.CheckOutputs;

/**
 * Result of a diff job that rendered successfully.
 *
 * @param outputs      the published report
 * @param cleanupError failure to clean up references afterwards, null if cleanup succeeded
 */
public record JobOutcome(
    CheckOutputs outputs,
    RuntimeException cleanupError
) {

    public boolean cleanedUp() {
        return cleanupError == null;
    }
}
