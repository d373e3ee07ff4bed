package com.linlay.agentchat.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Paths;

@ConfigurationProperties(prefix = "agent.history")
public class HistoryBufferProperties {

    private String dir = Paths.get(System.getProperty("java.io.tmpdir"), "agent-chat").toString();
    private String charset = "UTF-8";
    private String filePrefix = "history-";

    public String getDir() {
        return dir;
    }

    public void setDir(String dir) {
        this.dir = dir;
    }

    public String getCharset() {
        return charset;
    }

    public void setCharset(String charset) {
        this.charset = charset;
    }

    public String getFilePrefix() {
        return filePrefix;
    }

    public void setFilePrefix(String filePrefix) {
        this.filePrefix = filePrefix;
    }
}
