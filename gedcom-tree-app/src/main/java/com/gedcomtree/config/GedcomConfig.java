package com.gedcomtree.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Line and header settings for writing GEDCOM.
 * Bound from application.yml under 'gedcom'.
 */
@Configuration
@ConfigurationProperties(prefix = "gedcom")
public class GedcomConfig {

    // Counts value characters only; the level, pointer and tag in front of them are not included
    private int maxValueLength = 248;
    private String sourceName = "gedcom-tree";
    private String sourceVersion = "1.0.0";

    public int getMaxValueLength() { return maxValueLength; }
    public void setMaxValueLength(int maxValueLength) { this.maxValueLength = maxValueLength; }

    public String getSourceName() { return sourceName; }
    public void setSourceName(String sourceName) { this.sourceName = sourceName; }

    public String getSourceVersion() { return sourceVersion; }
    public void setSourceVersion(String sourceVersion) { this.sourceVersion = sourceVersion; }
}
