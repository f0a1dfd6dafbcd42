package com.assetdiffbot.core.diff;

import java.util.Collection;
import java.util.List;

/**
 * Thrown when the head revision yields assets that the base pass never accounted for.
 * Fails the whole job.
 */
public class UnaccountedAssetsException extends RuntimeException {

    private final List<String> files;

    public UnaccountedAssetsException(Collection<String> files) {
        super("Head revision contains assets missing from the base pass: " + String.join(", ", files));
        this.files = List.copyOf(files);
    }

    public List<String> getFiles() {
        return files;
    }
}
