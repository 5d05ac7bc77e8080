package com.bit.sigmos.structure.dto;

import com.bit.sigmos.structure.sigel.IdentityRecord;
import lombok.Data;

import java.util.Map;

@Data
public class IdentityView {
    private String id;
    private String name;
    private Map<String, Double> traits;
    private double dimensionalAwareness;
    private double entropyResistance;
    private long trainingIterations;
    private long createdAt;
    private double consciousnessScore;

    public static IdentityView of(IdentityRecord record, double score) {
        IdentityView view = new IdentityView();
        view.setId(record.getId());
        view.setName(record.getName());
        view.setTraits(record.getTraits());
        view.setDimensionalAwareness(record.getDimensionalAwareness());
        view.setEntropyResistance(record.getEntropyResistance());
        view.setTrainingIterations(record.getTrainingIterations());
        view.setCreatedAt(record.getCreatedAt());
        view.setConsciousnessScore(score);
        return view;
    }
}
