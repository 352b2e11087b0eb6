package com.bsl.bankcode.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "retrieval")
public class RetrievalProperties {
    private Defaults defaults = new Defaults();
    private Vector vector = new Vector();
    private Keyword keyword = new Keyword();
    private double minFinalScore = 0.0;
    private boolean exactShortCircuit = false;

    public Defaults getDefaults() {
        return defaults;
    }

    public void setDefaults(Defaults defaults) {
        this.defaults = defaults;
    }

    public Vector getVector() {
        return vector;
    }

    public void setVector(Vector vector) {
        this.vector = vector;
    }

    public Keyword getKeyword() {
        return keyword;
    }

    public void setKeyword(Keyword keyword) {
        this.keyword = keyword;
    }

    public double getMinFinalScore() {
        return minFinalScore;
    }

    public void setMinFinalScore(double minFinalScore) {
        this.minFinalScore = minFinalScore;
    }

    public boolean isExactShortCircuit() {
        return exactShortCircuit;
    }

    public void setExactShortCircuit(boolean exactShortCircuit) {
        this.exactShortCircuit = exactShortCircuit;
    }

    /**
     * Initial values of the runtime-tunable {@link RetrievalConfig}.
     */
    public static class Defaults {
        private double similarityThreshold = 0.1;
        private int topK = 5;
        private double vectorWeight = 0.6;
        private double keywordWeight = 0.4;
        private boolean enableHybrid = true;

        public double getSimilarityThreshold() {
            return similarityThreshold;
        }

        public void setSimilarityThreshold(double similarityThreshold) {
            this.similarityThreshold = similarityThreshold;
        }

        public int getTopK() {
            return topK;
        }

        public void setTopK(int topK) {
            this.topK = topK;
        }

        public double getVectorWeight() {
            return vectorWeight;
        }

        public void setVectorWeight(double vectorWeight) {
            this.vectorWeight = vectorWeight;
        }

        public double getKeywordWeight() {
            return keywordWeight;
        }

        public void setKeywordWeight(double keywordWeight) {
            this.keywordWeight = keywordWeight;
        }

        public boolean isEnableHybrid() {
            return enableHybrid;
        }

        public void setEnableHybrid(boolean enableHybrid) {
            this.enableHybrid = enableHybrid;
        }
    }

    public static class Vector {
        private int candidateMultiplier = 10;
        private int minCandidates = 50;
        private int maxCandidates = 500;

        public int getCandidateMultiplier() {
            return candidateMultiplier;
        }

        public void setCandidateMultiplier(int candidateMultiplier) {
            this.candidateMultiplier = candidateMultiplier;
        }

        public int getMinCandidates() {
            return minCandidates;
        }

        public void setMinCandidates(int minCandidates) {
            this.minCandidates = minCandidates;
        }

        public int getMaxCandidates() {
            return maxCandidates;
        }

        public void setMaxCandidates(int maxCandidates) {
            this.maxCandidates = maxCandidates;
        }

        public int poolSize(int topK) {
            int wanted = Math.max(1, topK) * Math.max(1, candidateMultiplier);
            int max = Math.max(1, maxCandidates);
            int min = Math.min(Math.max(1, minCandidates), max);
            return Math.max(min, Math.min(max, wanted));
        }
    }

    public static class Keyword {
        private int maxPostingsPerKeyword = 5000;
        private int maxKeywordCandidates = 200;
        private int fallbackScanLimit = 1000;

        public int getMaxPostingsPerKeyword() {
            return maxPostingsPerKeyword;
        }

        public void setMaxPostingsPerKeyword(int maxPostingsPerKeyword) {
            this.maxPostingsPerKeyword = maxPostingsPerKeyword;
        }

        public int getMaxKeywordCandidates() {
            return maxKeywordCandidates;
        }

        public void setMaxKeywordCandidates(int maxKeywordCandidates) {
            this.maxKeywordCandidates = maxKeywordCandidates;
        }

        public int getFallbackScanLimit() {
            return fallbackScanLimit;
        }

        public void setFallbackScanLimit(int fallbackScanLimit) {
            this.fallbackScanLimit = fallbackScanLimit;
        }
    }
}
