package com.assetdiffbot.core.model;

/**
 * One side of a pull request: the commit sha and the branch it was taken from.
 *
 * @param sha commit sha as reported by the platform
 * @param ref branch name (for the head side this is the contributor's branch)
 */
public record Revision(
    String sha,
    String ref
) {}
