package com.lorekeeper.core.curator;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Tuning for the promotion pass that runs when a task session closes.
 */
@Component
@ConfigurationProperties(prefix = "lorekeeper.curator")
public class CuratorProperties {

    /** Entries scoring below this are dismissed. */
    private double confidenceFloor = 0.6;
    /** Two claims agree when their disagreement is at or below this. */
    private double agreementTolerance = 0.25;
    /** Added to an entry's score for each additional distinct agent in its cluster. */
    private double corroborationBoost = 0.1;
    /** Re-read and re-check attempts after a Canon version conflict. */
    private int maxPromotionAttempts = 3;

    public double getConfidenceFloor() {
        return confidenceFloor;
    }

    public void setConfidenceFloor(double confidenceFloor) {
        this.confidenceFloor = confidenceFloor;
    }

    public double getAgreementTolerance() {
        return agreementTolerance;
    }

    public void setAgreementTolerance(double agreementTolerance) {
        this.agreementTolerance = agreementTolerance;
    }

    public double getCorroborationBoost() {
        return corroborationBoost;
    }

    public void setCorroborationBoost(double corroborationBoost) {
        this.corroborationBoost = corroborationBoost;
    }

    public int getMaxPromotionAttempts() {
        return maxPromotionAttempts;
    }

    public void setMaxPromotionAttempts(int maxPromotionAttempts) {
        this.maxPromotionAttempts = maxPromotionAttempts;
    }
}
