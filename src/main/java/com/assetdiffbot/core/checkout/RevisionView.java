package com.assetdiffbot.core.checkout;

import java.nio.file.Path;

/**
 * A working tree materialized at one revision. Only valid inside the scope that produced it.
 *
 * @param root working tree root
 * @param ref  the revision checked out there
 */
public record RevisionView(
    Path root,
    RevisionRef ref
) {

    public Path resolve(String relativePath) {
        return root.resolve(relativePath);
    }
}
