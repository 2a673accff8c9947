package com.marketscan.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the users table: the account the engine trades for, its Kite credentials
 * and starting capital. Missing credentials put the engine in simulation mode.
 */
@Entity
@Table(name = "users")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable = false, length = 100)
    private String username;

    @Column(name = "kite_api_key", length = 100)
    private String kiteApiKey;

    @Column(name = "kite_access_token", length = 200)
    private String kiteAccessToken;

    @Column(name = "initial_capital", precision = 15, scale = 2)
    private BigDecimal initialCapital;
}
