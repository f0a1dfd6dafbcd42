package com.assetdiffbot.core.model;

import java.util.List;

/**
 * Outcome of diffing one asset file.
 *
 * @param file    path of the asset (head path when both exist)
 * @param kind    whole-file classification
 * @param changes identities that differ, in presentation order
 * @param error   decode failure for this asset, null on success
 */
public record AssetDiffResult(
    String file,
    DiffKind kind,
    List<IdentityChange> changes,
    String error
) {

    public AssetDiffResult {
        changes = changes == null ? List.of() : List.copyOf(changes);
    }

    public static AssetDiffResult of(String file, DiffKind kind, List<IdentityChange> changes) {
        return new AssetDiffResult(file, kind, changes, null);
    }

    public static AssetDiffResult failed(String file, DiffKind kind, String error) {
        return new AssetDiffResult(file, kind, List.of(), error);
    }

    public boolean failed() {
        return error != null;
    }
}
