package com.assetdiffbot.core.checkout;

/**
 * A local branch and the commit it was pinned to.
 *
 * @param branch   short branch name in the clone
 * @param commit   resolved commit sha the branch points at
 * @param fellBack true when the requested sha was not found and the fetched tip was used
 */
public record RevisionRef(
    String branch,
    String commit,
    boolean fellBack
) {}
