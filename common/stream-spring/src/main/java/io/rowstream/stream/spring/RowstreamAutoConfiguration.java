package io.rowstream.stream.spring;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.rowstream.stream.consumer.ConsumerMetrics;
import io.rowstream.stream.error.StorageErrorClassifier;
import io.rowstream.stream.jdbc.CursorSchema;
import io.rowstream.stream.jdbc.EventInserter;
import io.rowstream.stream.jdbc.EventLogSchema;
import io.rowstream.stream.jdbc.JdbcCursorStore;
import io.rowstream.stream.jdbc.JdbcEventLog;
import io.rowstream.stream.jdbc.MySqlErrorClassifier;
import io.rowstream.stream.jdbc.SqlStateErrorClassifier;
import io.rowstream.stream.loop.CursorStore;
import io.rowstream.stream.loop.EventNotifier;
import io.rowstream.stream.loop.EventSource;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnSingleCandidate;
import org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Event log, cursor store and consumer metrics on top of the application's {@link JdbcTemplate}.
 * <p>
 * The event log needs {@code rowstream.events.table}, the cursor store {@code rowstream.cursors.table}.
 */
@AutoConfiguration(
    after = JdbcTemplateAutoConfiguration.class,
    afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass(JdbcTemplate.class)
@EnableConfigurationProperties(RowstreamProperties.class)
public class RowstreamAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(RowstreamAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    StorageErrorClassifier rowstreamErrorClassifier(RowstreamProperties properties) {
        return switch (properties.getErrorClassifier()) {
            case MYSQL -> new MySqlErrorClassifier();
            case SQLSTATE -> new SqlStateErrorClassifier();
        };
    }

    @Bean
    @ConditionalOnMissingBean
    ConsumerMetrics rowstreamConsumerMetrics(ObjectProvider<MeterRegistry> meterRegistry) {
        MeterRegistry registry = meterRegistry.getIfAvailable(() -> {
            log.info("No MeterRegistry found; consumer metrics are kept in memory only");
            return new SimpleMeterRegistry();
        });
        return new ConsumerMetrics(registry);
    }

    @Bean
    @ConditionalOnMissingBean
    InstrumentedConsumers rowstreamInstrumentedConsumers(ConsumerMetrics metrics, RowstreamProperties properties) {
        return new InstrumentedConsumers(metrics, properties.getConsumer());
    }

    @Bean
    @ConditionalOnMissingBean
    EventNotifier rowstreamEventNotifier() {
        return new EventNotifier();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "rowstream.events", name = "table")
    EventLogSchema rowstreamEventLogSchema(RowstreamProperties properties) {
        return properties.getEvents().toSchema();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "rowstream.cursors", name = "table")
    CursorSchema rowstreamCursorSchema(RowstreamProperties properties) {
        return properties.getCursors().toSchema();
    }

    @Bean
    @ConditionalOnMissingBean(EventSource.class)
    @ConditionalOnSingleCandidate(JdbcTemplate.class)
    @ConditionalOnProperty(prefix = "rowstream.events", name = "table")
    JdbcEventLog rowstreamEventLog(JdbcTemplate jdbcTemplate,
                                   EventLogSchema schema,
                                   StorageErrorClassifier classifier,
                                   ObjectProvider<EventInserter> inserter,
                                   EventNotifier notifier,
                                   RowstreamProperties properties) {
        JdbcTemplate jdbc = withQueryTimeout(jdbcTemplate, properties.getJdbc().getQueryTimeout());
        log.info("Rowstream event log on {}", schema);
        return new JdbcEventLog(jdbc, schema, classifier,
            inserter.getIfAvailable(() -> EventInserter.forSchema(schema)), notifier);
    }

    @Bean
    @ConditionalOnMissingBean(CursorStore.class)
    @ConditionalOnSingleCandidate(JdbcTemplate.class)
    @ConditionalOnProperty(prefix = "rowstream.cursors", name = "table")
    JdbcCursorStore rowstreamCursorStore(JdbcTemplate jdbcTemplate,
                                         CursorSchema schema,
                                         StorageErrorClassifier classifier,
                                         RowstreamProperties properties) {
        JdbcTemplate jdbc = withQueryTimeout(jdbcTemplate, properties.getJdbc().getQueryTimeout());
        log.info("Rowstream cursor store on {}", schema);
        return new JdbcCursorStore(jdbc, schema, classifier);
    }

    // The application's template is shared, so the timeout goes on a copy.
    static JdbcTemplate withQueryTimeout(JdbcTemplate template, Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative() || template.getDataSource() == null) {
            return template;
        }
        JdbcTemplate copy = new JdbcTemplate(template.getDataSource());
        copy.setExceptionTranslator(template.getExceptionTranslator());
        copy.setQueryTimeout((int) Math.max(1, timeout.toSeconds()));
        return copy;
    }
}
