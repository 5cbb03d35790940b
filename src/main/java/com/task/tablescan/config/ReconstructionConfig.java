package com.task.tablescan.config;

import com.task.tablescan.reconstruct.ColumnClusterer;
import com.task.tablescan.reconstruct.GridAligner;
import com.task.tablescan.reconstruct.RowClusterer;
import com.task.tablescan.reconstruct.TableNormalizer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ReconstructionConfig {

    @Bean
    public RowClusterer rowClusterer(
            @Value("${table.rows.gap-multiplier:1.3}") double gapMultiplier,
            @Value("${table.rows.min-threshold:15}") double minThreshold,
            @Value("${table.rows.max-threshold:50}") double maxThreshold,
            @Value("${table.rows.default-gap:30}") double defaultGap
    ) {
        return new RowClusterer(gapMultiplier, minThreshold, maxThreshold, defaultGap);
    }

    @Bean
    public ColumnClusterer columnClusterer(
            @Value("${table.columns.gap-multiplier:2.0}") double gapMultiplier,
            @Value("${table.columns.min-threshold:20}") double minThreshold
    ) {
        return new ColumnClusterer(gapMultiplier, minThreshold);
    }

    @Bean
    public GridAligner gridAligner() {
        return new GridAligner();
    }

    @Bean
    public TableNormalizer tableNormalizer() {
        return new TableNormalizer();
    }
}
