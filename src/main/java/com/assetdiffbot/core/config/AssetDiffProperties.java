package com.assetdiffbot.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

@Component
@ConfigurationProperties(prefix = "assetdiff")
public class AssetDiffProperties {

    private Git git = new Git();
    private Output output = new Output();
    private Queue queue = new Queue();
    private Render render = new Render();
    private Report report = new Report();
    private Maintenance maintenance = new Maintenance();

    // -- Convenience accessors (delegate to nested) --
    public Path getReposDir() { return Path.of(git.reposDir); }
    public Path getOutputRoot() { return Path.of(output.root); }
    public Path getQueueDir() { return Path.of(queue.directory); }
    public String getBranchPrefix() { return git.branchPrefix; }
    public String getWorktreeName() { return git.worktreeName; }

    /**
     * Remote URL for a repository, from the configured template.
     *
     * @param fullName {@code owner/name}
     */
    public String remoteUrlFor(String fullName) {
        return git.remoteUrlTemplate.formatted(fullName);
    }

    /**
     * Effective render pool size; zero or less means one thread per available processor.
     */
    public int getRenderThreads() {
        return render.threads > 0 ? render.threads : Runtime.getRuntime().availableProcessors();
    }

    public boolean isSpriteFile(String filename) {
        return hasExtension(filename, render.spriteExtensions);
    }

    public boolean isMapFile(String filename) {
        return hasExtension(filename, render.mapExtensions);
    }

    private static boolean hasExtension(String filename, List<String> extensions) {
        if (filename == null) return false;
        String lower = filename.toLowerCase(Locale.ROOT);
        return extensions.stream().anyMatch(ext -> lower.endsWith(ext.toLowerCase(Locale.ROOT)));
    }

    public Git getGit() { return git; }
    public void setGit(Git git) { this.git = git; }
    public Output getOutput() { return output; }
    public void setOutput(Output output) { this.output = output; }
    public Queue getQueue() { return queue; }
    public void setQueue(Queue queue) { this.queue = queue; }
    public Render getRender() { return render; }
    public void setRender(Render render) { this.render = render; }
    public Report getReport() { return report; }
    public void setReport(Report report) { this.report = report; }
    public Maintenance getMaintenance() { return maintenance; }
    public void setMaintenance(Maintenance maintenance) { this.maintenance = maintenance; }

    public static class Git {
        private String reposDir = "./repos";
        private String remoteUrlTemplate = "https://github.com/%s.git";
        private String branchPrefix = "mdb";
        private String worktreeName = "_mdb_worktree_head";

        public String getReposDir() { return reposDir; }
        public void setReposDir(String reposDir) { this.reposDir = reposDir; }
        public String getRemoteUrlTemplate() { return remoteUrlTemplate; }
        public void setRemoteUrlTemplate(String remoteUrlTemplate) { this.remoteUrlTemplate = remoteUrlTemplate; }
        public String getBranchPrefix() { return branchPrefix; }
        public void setBranchPrefix(String branchPrefix) { this.branchPrefix = branchPrefix; }
        public String getWorktreeName() { return worktreeName; }
        public void setWorktreeName(String worktreeName) { this.worktreeName = worktreeName; }
    }

    public static class Output {
        private String root = "./images";
        private String fileHostingUrl = "http://localhost:8080/images";

        public String getRoot() { return root; }
        public void setRoot(String root) { this.root = root; }
        public String getFileHostingUrl() { return fileHostingUrl; }
        public void setFileHostingUrl(String fileHostingUrl) { this.fileHostingUrl = fileHostingUrl; }
    }

    public static class Queue {
        private String directory = "./jobs";

        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }
    }

    public static class Render {
        private int threads = 0;
        private List<String> spriteExtensions = List.of(".dmi");
        private List<String> mapExtensions = List.of(".dmm");

        public int getThreads() { return threads; }
        public void setThreads(int threads) { this.threads = threads; }
        public List<String> getSpriteExtensions() { return spriteExtensions; }
        public void setSpriteExtensions(List<String> spriteExtensions) { this.spriteExtensions = spriteExtensions; }
        public List<String> getMapExtensions() { return mapExtensions; }
        public void setMapExtensions(List<String> mapExtensions) { this.mapExtensions = mapExtensions; }
    }

    public static class Report {
        private String title = "Asset renderings";
        private String summary = "*Please file any issues with the bot maintainers.*\n\n"
                + "*The platform may fail to render some images on large changes. Use the raw links in this case.*\n\n"
                + "Assets with diff:";
        private int detailCeiling = 55_000;
        private int reportCeiling = 60_000;

        public String getTitle() { return title; }
        public void setTitle(String title) { this.title = title; }
        public String getSummary() { return summary; }
        public void setSummary(String summary) { this.summary = summary; }
        public int getDetailCeiling() { return detailCeiling; }
        public void setDetailCeiling(int detailCeiling) { this.detailCeiling = detailCeiling; }
        public int getReportCeiling() { return reportCeiling; }
        public void setReportCeiling(int reportCeiling) { this.reportCeiling = reportCeiling; }
    }

    public static class Maintenance {
        private String cron = "0 30 11 * * *";
        private int retentionDays = 14;

        public String getCron() { return cron; }
        public void setCron(String cron) { this.cron = cron; }
        public int getRetentionDays() { return retentionDays; }
        public void setRetentionDays(int retentionDays) { this.retentionDays = retentionDays; }
    }
}
