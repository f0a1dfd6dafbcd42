package com.assetdiffbot.core.report;

/**
 * Markdown fragments of the report body.
 */
final class ReportTemplates {

    private ReportTemplates() {}

    static final String IMAGE_ALT = "If the image doesn't load, use the raw link above";

    static final String Z_LEVEL_ADDED = "Z-LEVEL ADDED";
    static final String Z_LEVEL_DELETED = "Z-LEVEL DELETED";

    /** Args: state name, old image, new image, change text. */
    static final String SPRITE_LINE = "|%s|%s|%s|%s|";

    /** Args: change label, file title, table rows. */
    static final String SPRITE_DETAILS = """
            <details><summary>%s: %s</summary>

            |State|Old|New|Change|
            |---|---|---|---|
            %s
            </details>

            """;

    /** Args: title, raw link, image link. */
    static final String MAP_ADDED = """
            <details><summary>:new: %s</summary>

            [Image](%s)
            ![%s](%s)
            </details>

            """;

    /** Args: title, raw link, image link. */
    static final String MAP_REMOVED = """
            <details><summary>:wastebasket: %s</summary>

            [Image](%s)
            ![%s](%s)
            </details>

            """;

    /** Args: title, bounds, old link, new link, diff link, old row, new row, diff row. */
    static final String MAP_MODIFIED = """
            <details><summary>:pencil2: %s</summary>

            Changed region: %s

            |%s|%s|%s|
            |---|---|---|
            |%s|%s|%s|
            </details>

            """;

    static final String CLONING_TITLE = "Cloning repo...";
    static final String CLONING_SUMMARY = "The repository is being cloned, this will take a few minutes."
            + " Future runs will not require cloning.";

    /** Args: title, error. */
    static final String ERROR = """
            <details><summary>:warning: %s</summary>

            Failed to render:
            ```
            %s
            ```
            </details>

            """;

    static String image(String link) {
        return "![%s](%s)".formatted(IMAGE_ALT, link);
    }
}
