package com.lumen.query.opensearch;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "opensearch")
public class OpenSearchProperties {
    private String baseUrl = "http://localhost:9200";
    private String chunkIndex = "chunks_read";
    private String vectorIndex = "chunks_vec_read";
    private String vectorField = "embedding";
    private String contentField = "content";
    private List<String> keywordFields = new ArrayList<>(List.of("content", "title^2"));
    private int connectTimeoutMs = 200;
    private int readTimeoutMs = 500;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getChunkIndex() {
        return chunkIndex;
    }

    public void setChunkIndex(String chunkIndex) {
        this.chunkIndex = chunkIndex;
    }

    public String getVectorIndex() {
        return vectorIndex;
    }

    public void setVectorIndex(String vectorIndex) {
        this.vectorIndex = vectorIndex;
    }

    public String getVectorField() {
        return vectorField;
    }

    public void setVectorField(String vectorField) {
        this.vectorField = vectorField;
    }

    public String getContentField() {
        return contentField;
    }

    public void setContentField(String contentField) {
        this.contentField = contentField;
    }

    public List<String> getKeywordFields() {
        return keywordFields;
    }

    public void setKeywordFields(List<String> keywordFields) {
        this.keywordFields = keywordFields;
    }

    public int getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(int connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public int getReadTimeoutMs() {
        return readTimeoutMs;
    }

    public void setReadTimeoutMs(int readTimeoutMs) {
        this.readTimeoutMs = readTimeoutMs;
    }
}
