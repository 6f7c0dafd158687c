package com.example.clipper.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "clipper.github")
public class GithubProperties {

    private String baseUrl = "https://api.github.com";
    private String htmlUrl = "https://github.com";
    private String owner;
    private String repo;
    private String workflowId = "render.yml";
    private String ref = "main";
    private String keyService = "github";
    private long timeoutSeconds = 30;

    public GithubProperties() {
    }

    /**
     * Lists every missing setting so startup can report them all at once.
     *
     * @return human readable problems, empty when the configuration is usable.
     */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (isBlank(owner) || isBlank(repo)) {
            errors.add("clipper.github.owner and clipper.github.repo are required (GITHUB_OWNER / GITHUB_REPO)");
        }
        if (isBlank(workflowId)) {
            errors.add("clipper.github.workflow-id is required");
        }
        if (isBlank(ref)) {
            errors.add("clipper.github.ref is required");
        }
        return errors;
    }

    public String actionsUrl() {
        return "%s/%s/%s/actions/workflows/%s".formatted(trimSlash(htmlUrl), owner, repo, workflowId);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String trimSlash(String value) {
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getHtmlUrl() {
        return htmlUrl;
    }

    public void setHtmlUrl(String htmlUrl) {
        this.htmlUrl = htmlUrl;
    }

    public String getOwner() {
        return owner;
    }

    public void setOwner(String owner) {
        this.owner = owner;
    }

    public String getRepo() {
        return repo;
    }

    public void setRepo(String repo) {
        this.repo = repo;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public void setWorkflowId(String workflowId) {
        this.workflowId = workflowId;
    }

    public String getRef() {
        return ref;
    }

    public void setRef(String ref) {
        this.ref = ref;
    }

    public String getKeyService() {
        return keyService;
    }

    public void setKeyService(String keyService) {
        this.keyService = keyService;
    }

    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(long timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }
}
