package com.supplychain.pipeline.persistence.entity;

import com.supplychain.pipeline.domain.RiskCategory;
import com.supplychain.pipeline.domain.RiskFactorType;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RiskFactorEmbeddable {

    @Enumerated(EnumType.STRING)
    @Column(name = "factor_type", nullable = false)
    private RiskFactorType type;

    @Column(name = "description", length = 500)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", nullable = false)
    private RiskCategory severity;
}
