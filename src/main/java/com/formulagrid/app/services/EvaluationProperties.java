package com.formulagrid.app.services;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Evaluation settings, bound from "formulagrid.evaluation.*" in application.properties.
 */
@ConfigurationProperties(prefix = "formulagrid.evaluation")
public class EvaluationProperties {

    // Longest dependency chain a single evaluation may follow
    private int maxDepth = EvaluationContext.DEFAULT_MAX_DEPTH;

    // Fail on references to missing cells instead of reading them as 0 / blank
    private boolean strictReferences = false;

    public int getMaxDepth() {
        return maxDepth;
    }
    public void setMaxDepth(int maxDepth) {
        this.maxDepth = maxDepth;
    }
    public boolean isStrictReferences() {
        return strictReferences;
    }
    public void setStrictReferences(boolean strictReferences) {
        this.strictReferences = strictReferences;
    }

    public EvaluationContext newContext(boolean forceRecompute) {
        return new EvaluationContext(maxDepth, strictReferences, forceRecompute);
    }
}
