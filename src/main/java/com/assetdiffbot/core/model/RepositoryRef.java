package com.assetdiffbot.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Identity of the repository a request targets.
 *
 * @param id       platform repository id
 * @param fullName {@code owner/name}
 */
public record RepositoryRef(
    long id,
    @JsonProperty("full_name") String fullName
) {}
