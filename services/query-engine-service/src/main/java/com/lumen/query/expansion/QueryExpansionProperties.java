package com.lumen.query.expansion;

import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "query.expansion")
public class QueryExpansionProperties {
    private boolean enabled = true;
    private boolean useSynonyms = true;
    private boolean useAcronyms = true;
    private int maxExpansionsPerTerm = 3;
    private double maxExpansionFactor = 3.0;
    private double minFrequency = 0.1;
    private String thesaurusPath = "classpath:thesaurus/default-thesaurus.yaml";
    private Map<String, String> customAcronyms = new LinkedHashMap<>();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isUseSynonyms() {
        return useSynonyms;
    }

    public void setUseSynonyms(boolean useSynonyms) {
        this.useSynonyms = useSynonyms;
    }

    public boolean isUseAcronyms() {
        return useAcronyms;
    }

    public void setUseAcronyms(boolean useAcronyms) {
        this.useAcronyms = useAcronyms;
    }

    public int getMaxExpansionsPerTerm() {
        return maxExpansionsPerTerm;
    }

    public void setMaxExpansionsPerTerm(int maxExpansionsPerTerm) {
        this.maxExpansionsPerTerm = maxExpansionsPerTerm;
    }

    public double getMaxExpansionFactor() {
        return maxExpansionFactor;
    }

    public void setMaxExpansionFactor(double maxExpansionFactor) {
        this.maxExpansionFactor = maxExpansionFactor;
    }

    public double getMinFrequency() {
        return minFrequency;
    }

    public void setMinFrequency(double minFrequency) {
        this.minFrequency = minFrequency;
    }

    public String getThesaurusPath() {
        return thesaurusPath;
    }

    public void setThesaurusPath(String thesaurusPath) {
        this.thesaurusPath = thesaurusPath;
    }

    public Map<String, String> getCustomAcronyms() {
        return customAcronyms;
    }

    public void setCustomAcronyms(Map<String, String> customAcronyms) {
        this.customAcronyms = customAcronyms;
    }
}
