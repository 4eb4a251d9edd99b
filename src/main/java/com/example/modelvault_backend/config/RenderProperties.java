package com.example.modelvault_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Thumbnail rendering: which page to open, how long to wait for it and where the headless browser lives.
 */
@ConfigurationProperties(prefix = "render")
public class RenderProperties {

    /** Page that draws a single model; {@code {id}} is replaced by the model id. */
    private String pageUrlTemplate = "http://localhost:8080/render.html?id={id}";
    private String completionExpression = "window.renderingFinished === true";
    private long completionTimeoutSeconds = 60;
    private long sessionTimeoutSeconds = 300;
    private int viewportWidth = 256;
    private int viewportHeight = 256;

    private Browser browser = new Browser();
    private Executor executor = new Executor();

    public String getPageUrlTemplate() { return pageUrlTemplate; }
    public void setPageUrlTemplate(String pageUrlTemplate) { this.pageUrlTemplate = pageUrlTemplate; }

    public String getCompletionExpression() { return completionExpression; }
    public void setCompletionExpression(String completionExpression) { this.completionExpression = completionExpression; }

    public long getCompletionTimeoutSeconds() { return completionTimeoutSeconds; }
    public void setCompletionTimeoutSeconds(long completionTimeoutSeconds) { this.completionTimeoutSeconds = completionTimeoutSeconds; }

    public long getSessionTimeoutSeconds() { return sessionTimeoutSeconds; }
    public void setSessionTimeoutSeconds(long sessionTimeoutSeconds) { this.sessionTimeoutSeconds = sessionTimeoutSeconds; }

    public int getViewportWidth() { return viewportWidth; }
    public void setViewportWidth(int viewportWidth) { this.viewportWidth = viewportWidth; }

    public int getViewportHeight() { return viewportHeight; }
    public void setViewportHeight(int viewportHeight) { this.viewportHeight = viewportHeight; }

    public Browser getBrowser() { return browser; }
    public void setBrowser(Browser browser) { this.browser = browser; }

    public Executor getExecutor() { return executor; }
    public void setExecutor(Executor executor) { this.executor = executor; }

    public static class Browser {
        private String baseUrl = "http://127.0.0.1:3000";
        private int connectTimeoutMillis = 5_000;

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public int getConnectTimeoutMillis() { return connectTimeoutMillis; }
        public void setConnectTimeoutMillis(int connectTimeoutMillis) { this.connectTimeoutMillis = connectTimeoutMillis; }
    }

    public static class Executor {
        private int threads = 2;
        private int queueCapacity = 50;

        public int getThreads() { return threads; }
        public void setThreads(int threads) { this.threads = threads; }

        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
    }
}
