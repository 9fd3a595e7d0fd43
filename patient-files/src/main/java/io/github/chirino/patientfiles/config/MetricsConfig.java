package io.github.chirino.patientfiles.config;

import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.core.instrument.distribution.DistributionStatisticConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import java.util.List;

/**
 * Micrometer configuration for patient-files metrics.
 *
 * <ul>
 *   <li>patient_files_chunk_operation_seconds_* - Chunk store operation timing
 *   <li>patient_files_chunk_bytes_written_total - Bytes flushed to the chunk store
 *   <li>patient_files_uploads_total - Stored files by storage mode
 * </ul>
 */
@ApplicationScoped
public class MetricsConfig {

    @Produces
    @Singleton
    public MeterFilter applicationTagFilter() {
        return MeterFilter.commonTags(List.of(Tag.of("application", "patient-files")));
    }

    /** Enables histogram buckets on chunk store timers for histogram_quantile() in Prometheus. */
    @Produces
    @Singleton
    public MeterFilter histogramFilter() {
        return new MeterFilter() {
            @Override
            public DistributionStatisticConfig configure(
                    Meter.Id id, DistributionStatisticConfig config) {
                if (id.getName().startsWith("patient.files.chunk.operation")) {
                    return DistributionStatisticConfig.builder()
                            .percentiles(0.95, 0.99)
                            .percentilesHistogram(true)
                            .build()
                            .merge(config);
                }
                return config;
            }
        };
    }
}
