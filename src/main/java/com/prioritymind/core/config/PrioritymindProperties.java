package com.prioritymind.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Tunable constants for ranking, staleness, incremental context and evaluation.
 * <p>
 * Defaults are the calibrated product values; components constructed without
 * Spring use {@code new PrioritymindProperties()}.
 */
@Component
@ConfigurationProperties(prefix = "prioritymind")
public class PrioritymindProperties {

    private Ranking ranking = new Ranking();
    private Baseline baseline = new Baseline();
    private Context context = new Context();
    private Evaluation evaluation = new Evaluation();
    private Store store = new Store();

    public Ranking getRanking() { return ranking; }
    public void setRanking(Ranking ranking) { this.ranking = ranking; }
    public Baseline getBaseline() { return baseline; }
    public void setBaseline(Baseline baseline) { this.baseline = baseline; }
    public Context getContext() { return context; }
    public void setContext(Context context) { this.context = context; }
    public Evaluation getEvaluation() { return evaluation; }
    public void setEvaluation(Evaluation evaluation) { this.evaluation = evaluation; }
    public Store getStore() { return store; }
    public void setStore(Store store) { this.store = store; }

    public static class Ranking {
        private double boostThreshold = 0.7;
        private double penaltyThreshold = 0.3;
        private double boostFactor = 0.3;
        private double penaltyFactor = 0.3;
        private double fallbackConfidence = 0.5;
        private int maxReasonLength = 200;

        public double getBoostThreshold() { return boostThreshold; }
        public void setBoostThreshold(double boostThreshold) { this.boostThreshold = boostThreshold; }
        public double getPenaltyThreshold() { return penaltyThreshold; }
        public void setPenaltyThreshold(double penaltyThreshold) { this.penaltyThreshold = penaltyThreshold; }
        public double getBoostFactor() { return boostFactor; }
        public void setBoostFactor(double boostFactor) { this.boostFactor = boostFactor; }
        public double getPenaltyFactor() { return penaltyFactor; }
        public void setPenaltyFactor(double penaltyFactor) { this.penaltyFactor = penaltyFactor; }
        public double getFallbackConfidence() { return fallbackConfidence; }
        public void setFallbackConfidence(double fallbackConfidence) { this.fallbackConfidence = fallbackConfidence; }
        public int getMaxReasonLength() { return maxReasonLength; }
        public void setMaxReasonLength(int maxReasonLength) { this.maxReasonLength = maxReasonLength; }
    }

    public static class Baseline {
        private int staleWarningHours = 24;
        private int maxAgeDays = 7;

        public int getStaleWarningHours() { return staleWarningHours; }
        public void setStaleWarningHours(int staleWarningHours) { this.staleWarningHours = staleWarningHours; }
        public int getMaxAgeDays() { return maxAgeDays; }
        public void setMaxAgeDays(int maxAgeDays) { this.maxAgeDays = maxAgeDays; }
    }

    public static class Context {
        private int tokensPerTask = 50;
        private int summaryOverheadTokens = 100;
        private int representativeTaskCount = 3;
        private int maxListedDocumentIds = 10;

        public int getTokensPerTask() { return tokensPerTask; }
        public void setTokensPerTask(int tokensPerTask) { this.tokensPerTask = tokensPerTask; }
        public int getSummaryOverheadTokens() { return summaryOverheadTokens; }
        public void setSummaryOverheadTokens(int summaryOverheadTokens) { this.summaryOverheadTokens = summaryOverheadTokens; }
        public int getRepresentativeTaskCount() { return representativeTaskCount; }
        public void setRepresentativeTaskCount(int representativeTaskCount) { this.representativeTaskCount = representativeTaskCount; }
        public int getMaxListedDocumentIds() { return maxListedDocumentIds; }
        public void setMaxListedDocumentIds(int maxListedDocumentIds) { this.maxListedDocumentIds = maxListedDocumentIds; }
    }

    public static class Evaluation {
        private double minConfidence = 0.7;
        private int minIncludedTasks = 10;
        private int maxCorrectionsLength = 100;
        private int majorMoveDistance = 5;
        private double majorMoveRatio = 0.3;
        private int maxIterations = 3;

        public double getMinConfidence() { return minConfidence; }
        public void setMinConfidence(double minConfidence) { this.minConfidence = minConfidence; }
        public int getMinIncludedTasks() { return minIncludedTasks; }
        public void setMinIncludedTasks(int minIncludedTasks) { this.minIncludedTasks = minIncludedTasks; }
        public int getMaxCorrectionsLength() { return maxCorrectionsLength; }
        public void setMaxCorrectionsLength(int maxCorrectionsLength) { this.maxCorrectionsLength = maxCorrectionsLength; }
        public int getMajorMoveDistance() { return majorMoveDistance; }
        public void setMajorMoveDistance(int majorMoveDistance) { this.majorMoveDistance = majorMoveDistance; }
        public double getMajorMoveRatio() { return majorMoveRatio; }
        public void setMajorMoveRatio(double majorMoveRatio) { this.majorMoveRatio = majorMoveRatio; }
        public int getMaxIterations() { return maxIterations; }
        public void setMaxIterations(int maxIterations) { this.maxIterations = maxIterations; }
    }

    public static class Store {
        /** SQLite database file; the in-memory store is used when blank. */
        private String sqlitePath = "";

        public String getSqlitePath() { return sqlitePath; }
        public void setSqlitePath(String sqlitePath) { this.sqlitePath = sqlitePath; }

        public boolean isSqliteConfigured() {
            return sqlitePath != null && !sqlitePath.isBlank();
        }
    }
}
