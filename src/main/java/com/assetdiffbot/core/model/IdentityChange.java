package com.assetdiffbot.core.model;

/**
 * One identity that differs between base and head, with links to its rendered artifacts.
 *
 * @param identity    the sprite state or map level
 * @param change      what happened to this identity
 * @param bound       map level classification, null for sprite states
 * @param beforeLink  link to the base render, null if none
 * @param afterLink   link to the head render, null if none
 * @param diffLink    link to the difference render, null if none
 * @param renderError message if rendering this identity failed, null otherwise
 */
public record IdentityChange(
    AssetIdentity identity,
    Change change,
    BoundType bound,
    String beforeLink,
    String afterLink,
    String diffLink,
    String renderError
) {

    public enum Change {
        CREATED("Created"),
        DELETED("Deleted"),
        MODIFIED("Modified");

        private final String text;

        Change(String text) {
            this.text = text;
        }

        public String text() {
            return text;
        }
    }

    public boolean failed() {
        return renderError != null;
    }
}
