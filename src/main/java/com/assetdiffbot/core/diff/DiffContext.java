package com.assetdiffbot.core.diff;

import com.assetdiffbot.core.checkout.RevisionView;
import com.assetdiffbot.core.model.DiffRequest;

/**
 * Everything a diff engine needs for one job: the request, both materialized revisions
 * and the artifact layout.
 */
public record DiffContext(
    DiffRequest request,
    RevisionView base,
    RevisionView head,
    ArtifactLayout layout
) {}
