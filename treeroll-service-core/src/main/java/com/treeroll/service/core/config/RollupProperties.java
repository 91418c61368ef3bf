package com.treeroll.service.core.config;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "treeroll")
public class RollupProperties {
    private Rollup rollup = new Rollup();
    private Definitions definitions = new Definitions();
    private Facts facts = new Facts();

    public Rollup getRollup() {
        return rollup;
    }

    public void setRollup(Rollup rollup) {
        this.rollup = rollup;
    }

    public Definitions getDefinitions() {
        return definitions;
    }

    public void setDefinitions(Definitions definitions) {
        this.definitions = definitions;
    }

    public Facts getFacts() {
        return facts;
    }

    public void setFacts(Facts facts) {
        this.facts = facts;
    }

    public static class Rollup {
        private int parallelism = 1;
        private String nullDimensionValue = "";
        private int defaultSampleSize = 10;
        private int planCacheSize = 256;

        public int getParallelism() {
            return parallelism;
        }

        public void setParallelism(int parallelism) {
            this.parallelism = parallelism;
        }

        public String getNullDimensionValue() {
            return nullDimensionValue;
        }

        public void setNullDimensionValue(String nullDimensionValue) {
            this.nullDimensionValue = nullDimensionValue;
        }

        public int getDefaultSampleSize() {
            return defaultSampleSize;
        }

        public void setDefaultSampleSize(int defaultSampleSize) {
            this.defaultSampleSize = defaultSampleSize;
        }

        public int getPlanCacheSize() {
            return planCacheSize;
        }

        public void setPlanCacheSize(int planCacheSize) {
            this.planCacheSize = planCacheSize;
        }
    }

    public static class Definitions {
        private boolean enabled = true;
        private String location = "classpath:/rollup-definitions/";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getLocation() {
            return location;
        }

        public void setLocation(String location) {
            this.location = location;
        }
    }

    /** Fact table used by configured (non ad-hoc) runs. */
    public static class Facts {
        private String location;
        private List<String> measures = new ArrayList<>();

        public String getLocation() {
            return location;
        }

        public void setLocation(String location) {
            this.location = location;
        }

        public List<String> getMeasures() {
            return measures;
        }

        public void setMeasures(List<String> measures) {
            this.measures = measures;
        }
    }
}
