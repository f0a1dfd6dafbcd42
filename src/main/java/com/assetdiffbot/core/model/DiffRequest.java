package com.assetdiffbot.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A request to render the asset diff of one pull request.
 * Immutable once enqueued; shared read-only with render tasks.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DiffRequest(
    @JsonProperty("installation_id") long installationId,
    RepositoryRef repo,
    Revision base,
    Revision head,
    @JsonProperty("pull_request") long pullRequest,
    List<FileChange> files,
    @JsonProperty("check_run_id") Long checkRunId
) {

    public DiffRequest {
        files = files == null ? List.of() : List.copyOf(files);
    }

    /**
     * Ref to fetch for the head side. Pull request heads are fetched through the
     * platform's {@code pull/<n>/head} ref so that forks work too.
     */
    public String headFetchRef() {
        return "pull/" + pullRequest + "/head";
    }

    public String describe() {
        return "%s#%d (%s..%s)".formatted(repo.fullName(), pullRequest,
                shortSha(base.sha()), shortSha(head.sha()));
    }

    private static String shortSha(String sha) {
        return sha != null && sha.length() > 7 ? sha.substring(0, 7) : sha;
    }
}
