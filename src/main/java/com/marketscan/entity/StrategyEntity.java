package com.marketscan.entity;

import com.marketscan.strategy.VoterKind;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the strategies table.
 *
 * <p>{@code voterKind} may be null for rows created with only a display name; the strategy
 * store then resolves the voter from name keywords. Parameters are a JSON object.
 */
@Entity
@Table(name = "strategies")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StrategyEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(length = 500)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "voter_kind", columnDefinition = "varchar(20)")
    private VoterKind voterKind;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "parameters", columnDefinition = "CLOB")
    private String parametersJson;

    private Double weight;

    @Column(name = "created_at")
    private LocalDateTime createdAt;
}
