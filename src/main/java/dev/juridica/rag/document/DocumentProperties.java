package dev.juridica.rag.document;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Where generated answer documents are written and served from.
 */
@ConfigurationProperties(prefix = "rag.documents")
public class DocumentProperties {

    /**
     * Output directory of rendered documents.
     */
    private String outputDir = "data/generated_docs";

    /**
     * URL prefix under which the documents are downloadable.
     */
    private String baseUrl = "/api/chat/documents/";

    public String getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(String outputDir) {
        this.outputDir = outputDir;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }
}
