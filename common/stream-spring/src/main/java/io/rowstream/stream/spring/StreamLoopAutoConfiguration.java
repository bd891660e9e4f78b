package io.rowstream.stream.spring;

import io.rowstream.stream.consumer.InstrumentedConsumer;
import io.rowstream.stream.loop.CursorStore;
import io.rowstream.stream.loop.EventNotifier;
import io.rowstream.stream.loop.EventSource;
import io.rowstream.stream.loop.StreamLoopOptions;
import java.util.List;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

/**
 * Starts a stream loop for every {@link InstrumentedConsumer} bean once both an event source and a
 * cursor store exist.
 */
@AutoConfiguration(after = RowstreamAutoConfiguration.class)
@ConditionalOnBean({EventSource.class, CursorStore.class})
@ConditionalOnProperty(prefix = "rowstream.loop", name = "enabled", havingValue = "true", matchIfMissing = true)
public class StreamLoopAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    @SuppressWarnings("deprecation")
    StreamLoopOptions rowstreamStreamLoopOptions(RowstreamProperties properties,
                                                 ObjectProvider<EventNotifier> notifier) {
        RowstreamProperties.Loop loop = properties.getLoop();
        return StreamLoopOptions.builder()
            .pollInterval(loop.getPollInterval())
            .errorBackoff(loop.getErrorBackoff())
            .maxErrorBackoff(loop.getMaxErrorBackoff())
            .lag(loop.getLag())
            .startFromHead(loop.isStartFromHead())
            .notifier(notifier.getIfAvailable())
            .build();
    }

    @Bean
    @ConditionalOnMissingBean
    StreamLoopLifecycle rowstreamStreamLoopLifecycle(EventSource source,
                                                     CursorStore cursors,
                                                     ObjectProvider<InstrumentedConsumer> consumers,
                                                     StreamLoopOptions options) {
        List<InstrumentedConsumer> all = consumers.orderedStream().toList();
        return new StreamLoopLifecycle(source, cursors, all, options);
    }
}
