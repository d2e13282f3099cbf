package com.panwatch.entity;

import com.panwatch.domain.enums.DataSourceType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** JPA entity for the data_sources table. */
@Entity
@Table(name = "data_sources")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DataSourceEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private DataSourceType type;

    @Column(nullable = false, length = 50)
    private String provider;

    private int priority;

    @Column(name = "supports_batch")
    private boolean supportsBatch;

    private boolean enabled;

    /** JSON array of symbols used by the connection test. */
    @Column(name = "test_symbols", length = 500)
    private String testSymbols;

    @Column(length = 4000)
    private String config;
}
