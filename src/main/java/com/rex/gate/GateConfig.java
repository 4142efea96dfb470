package com.rex.gate;

import java.util.Map;
import java.util.Properties;

/**
 * Gate configuration
 */
public class GateConfig {

    public static final String MODE_GATE = "gate";
    public static final String MODE_PROXY = "proxy";
    public static final String MODE_ALL = "all";

    public String mode;
    public String bindAddress;
    public Integer httpPort;
    public Integer wsPort;
    public String wsPath;
    public Integer eventPort;
    public Long sessionTtlSeconds;
    public String sessionCookieName;
    public String authFile;
    public String webRoot;
    public String entryPage;
    public String assetsPrefix;
    public Integer proxyPort;
    public String upstreamHost;
    public Integer upstreamPort;
    public Integer proxyIdleSeconds;
    public Integer bindRetries;
    public Long bindRetryDelayMillis;

    public GateConfig() {
    }

    /**
     * Defaults of the stock deployment
     */
    public static GateConfig defaults() {
        GateConfig conf = new GateConfig();
        conf.mode = MODE_ALL;
        conf.bindAddress = "0.0.0.0";
        conf.httpPort = 8080;
        conf.wsPort = 8765;
        conf.wsPath = "/";
        conf.eventPort = 8865;
        conf.sessionTtlSeconds = 43200L;
        conf.sessionCookieName = "goodgym_session";
        conf.authFile = "data/auth.json";
        conf.webRoot = ".";
        conf.entryPage = "/vnc_audio.html";
        conf.assetsPrefix = "/assets/";
        conf.proxyPort = 6080;
        conf.upstreamHost = "localhost";
        conf.upstreamPort = 6081;
        conf.proxyIdleSeconds = 60;
        conf.bindRetries = 5;
        conf.bindRetryDelayMillis = 2000L;
        return conf;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append("<@");
        builder.append(Integer.toHexString(hashCode()));
        builder.append(" mode:").append(mode);
        builder.append(" bindAddress:").append(bindAddress);
        builder.append(" httpPort:").append(httpPort);
        builder.append(" wsPort:").append(wsPort);
        builder.append(" wsPath:").append(wsPath);
        builder.append(" eventPort:").append(eventPort);
        builder.append(" sessionTtlSeconds:").append(sessionTtlSeconds);
        builder.append(" sessionCookieName:").append(sessionCookieName);
        builder.append(" authFile:").append(authFile);
        builder.append(" webRoot:").append(webRoot);
        builder.append(" entryPage:").append(entryPage);
        builder.append(" assetsPrefix:").append(assetsPrefix);
        builder.append(" proxyPort:").append(proxyPort);
        builder.append(" upstreamHost:").append(upstreamHost);
        builder.append(" upstreamPort:").append(upstreamPort);
        builder.append(" proxyIdleSeconds:").append(proxyIdleSeconds);
        builder.append(" bindRetries:").append(bindRetries);
        builder.append(" bindRetryDelayMillis:").append(bindRetryDelayMillis);
        builder.append(">");
        return builder.toString();
    }

    public static class Builder {

        private final GateConfig mConfig = defaults();

        public Builder() {
        }

        public Builder(GateConfig conf) {
            merge(conf);
        }

        public Builder(Properties properties) {
            for (String name : properties.stringPropertyNames()) {
                set(name, properties.getProperty(name).trim());
            }
        }

        /**
         * Apply the environment variables the deployment scripts export
         */
        public Builder environment(Map<String, String> env) {
            applyEnv(env, "AUDIO_HTTP_PORT", "httpPort");
            applyEnv(env, "AUDIO_WS_PORT", "wsPort");
            applyEnv(env, "AUDIO_EVENT_PORT", "eventPort");
            applyEnv(env, "SESSION_TTL_SECONDS", "sessionTtlSeconds");
            applyEnv(env, "SESSION_COOKIE_NAME", "sessionCookieName");
            applyEnv(env, "AUTH_FILE", "authFile");
            applyEnv(env, "WEB_ROOT", "webRoot");
            applyEnv(env, "PROXY_PORT", "proxyPort");
            applyEnv(env, "UPSTREAM_HOST", "upstreamHost");
            applyEnv(env, "UPSTREAM_PORT", "upstreamPort");
            return this;
        }

        private void applyEnv(Map<String, String> env, String key, String name) {
            String value = env.get(key);
            if (value != null && !value.trim().isEmpty()) {
                set(name, value.trim());
            }
        }

        private void merge(GateConfig conf) {
            if (conf.mode != null) mConfig.mode = conf.mode;
            if (conf.bindAddress != null) mConfig.bindAddress = conf.bindAddress;
            if (conf.httpPort != null) mConfig.httpPort = conf.httpPort;
            if (conf.wsPort != null) mConfig.wsPort = conf.wsPort;
            if (conf.wsPath != null) mConfig.wsPath = conf.wsPath;
            if (conf.eventPort != null) mConfig.eventPort = conf.eventPort;
            if (conf.sessionTtlSeconds != null) mConfig.sessionTtlSeconds = conf.sessionTtlSeconds;
            if (conf.sessionCookieName != null) mConfig.sessionCookieName = conf.sessionCookieName;
            if (conf.authFile != null) mConfig.authFile = conf.authFile;
            if (conf.webRoot != null) mConfig.webRoot = conf.webRoot;
            if (conf.entryPage != null) mConfig.entryPage = conf.entryPage;
            if (conf.assetsPrefix != null) mConfig.assetsPrefix = conf.assetsPrefix;
            if (conf.proxyPort != null) mConfig.proxyPort = conf.proxyPort;
            if (conf.upstreamHost != null) mConfig.upstreamHost = conf.upstreamHost;
            if (conf.upstreamPort != null) mConfig.upstreamPort = conf.upstreamPort;
            if (conf.proxyIdleSeconds != null) mConfig.proxyIdleSeconds = conf.proxyIdleSeconds;
            if (conf.bindRetries != null) mConfig.bindRetries = conf.bindRetries;
            if (conf.bindRetryDelayMillis != null) mConfig.bindRetryDelayMillis = conf.bindRetryDelayMillis;
        }

        private void set(String name, String value) {
            switch (name) {
            case "mode":
                mConfig.mode = value;
                break;
            case "bindAddress":
                mConfig.bindAddress = value;
                break;
            case "httpPort":
                mConfig.httpPort = Integer.parseInt(value);
                break;
            case "wsPort":
                mConfig.wsPort = Integer.parseInt(value);
                break;
            case "wsPath":
                mConfig.wsPath = value;
                break;
            case "eventPort":
                mConfig.eventPort = Integer.parseInt(value);
                break;
            case "sessionTtlSeconds":
                mConfig.sessionTtlSeconds = Long.parseLong(value);
                break;
            case "sessionCookieName":
                mConfig.sessionCookieName = value;
                break;
            case "authFile":
                mConfig.authFile = value;
                break;
            case "webRoot":
                mConfig.webRoot = value;
                break;
            case "entryPage":
                mConfig.entryPage = value;
                break;
            case "assetsPrefix":
                mConfig.assetsPrefix = value;
                break;
            case "proxyPort":
                mConfig.proxyPort = Integer.parseInt(value);
                break;
            case "upstreamHost":
                mConfig.upstreamHost = value;
                break;
            case "upstreamPort":
                mConfig.upstreamPort = Integer.parseInt(value);
                break;
            case "proxyIdleSeconds":
                mConfig.proxyIdleSeconds = Integer.parseInt(value);
                break;
            case "bindRetries":
                mConfig.bindRetries = Integer.parseInt(value);
                break;
            case "bindRetryDelayMillis":
                mConfig.bindRetryDelayMillis = Long.parseLong(value);
                break;
            }
        }

        public Builder setMode(String value) {
            mConfig.mode = value;
            return this;
        }

        public Builder setBindAddress(String value) {
            mConfig.bindAddress = value;
            return this;
        }

        public Builder setHttpPort(int value) {
            mConfig.httpPort = value;
            return this;
        }

        public Builder setWsPort(int value) {
            mConfig.wsPort = value;
            return this;
        }

        public Builder setEventPort(int value) {
            mConfig.eventPort = value;
            return this;
        }

        public Builder setSessionTtlSeconds(long value) {
            mConfig.sessionTtlSeconds = value;
            return this;
        }

        public Builder setAuthFile(String value) {
            mConfig.authFile = value;
            return this;
        }

        public Builder setWebRoot(String value) {
            mConfig.webRoot = value;
            return this;
        }

        public Builder setProxyPort(int value) {
            mConfig.proxyPort = value;
            return this;
        }

        public Builder setUpstream(String host, int port) {
            mConfig.upstreamHost = host;
            mConfig.upstreamPort = port;
            return this;
        }

        public Builder setProxyIdleSeconds(int value) {
            mConfig.proxyIdleSeconds = value;
            return this;
        }

        public Builder setBindRetries(int retries, long delayMillis) {
            mConfig.bindRetries = retries;
            mConfig.bindRetryDelayMillis = delayMillis;
            return this;
        }

        public GateConfig build() {
            return mConfig;
        }
    }
}
