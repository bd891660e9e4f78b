package io.rowstream.stream.spring;

import io.rowstream.stream.consumer.InstrumentedConsumer;
import io.rowstream.stream.jdbc.CursorSchema;
import io.rowstream.stream.jdbc.CursorType;
import io.rowstream.stream.jdbc.EventLogSchema;
import io.rowstream.stream.loop.StreamLoopOptions;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "rowstream")
public class RowstreamProperties {

    public enum ErrorClassifier {
        MYSQL,
        SQLSTATE
    }

    private final Events events = new Events();
    private final Cursors cursors = new Cursors();
    private final Consumer consumer = new Consumer();
    private final Loop loop = new Loop();
    private final Jdbc jdbc = new Jdbc();
    private ErrorClassifier errorClassifier = ErrorClassifier.MYSQL;

    public Events getEvents() {
        return events;
    }

    public Cursors getCursors() {
        return cursors;
    }

    public Consumer getConsumer() {
        return consumer;
    }

    public Loop getLoop() {
        return loop;
    }

    public Jdbc getJdbc() {
        return jdbc;
    }

    public ErrorClassifier getErrorClassifier() {
        return errorClassifier;
    }

    public void setErrorClassifier(ErrorClassifier errorClassifier) {
        this.errorClassifier = errorClassifier;
    }

    public static class Events {

        /**
         * Event log table. Leave unset to skip the event log; an empty value fails startup.
         */
        private String table = "";
        private String foreignIdField = EventLogSchema.DEFAULT_FOREIGN_ID_FIELD;
        private String timeField = EventLogSchema.DEFAULT_TIME_FIELD;
        private String typeField = EventLogSchema.DEFAULT_TYPE_FIELD;
        /**
         * Empty when the table has no metadata column.
         */
        private String metadataField = "";

        public String getTable() {
            return table;
        }

        public void setTable(String table) {
            this.table = table;
        }

        public String getForeignIdField() {
            return foreignIdField;
        }

        public void setForeignIdField(String foreignIdField) {
            this.foreignIdField = foreignIdField;
        }

        public String getTimeField() {
            return timeField;
        }

        public void setTimeField(String timeField) {
            this.timeField = timeField;
        }

        public String getTypeField() {
            return typeField;
        }

        public void setTypeField(String typeField) {
            this.typeField = typeField;
        }

        public String getMetadataField() {
            return metadataField;
        }

        public void setMetadataField(String metadataField) {
            this.metadataField = metadataField;
        }

        EventLogSchema toSchema() {
            return EventLogSchema.builder(table)
                .foreignIdField(foreignIdField)
                .timeField(timeField)
                .typeField(typeField)
                .metadataField(metadataField)
                .build();
        }
    }

    public static class Cursors {

        /**
         * Cursor table. Leave unset to skip the cursor store; an empty value fails startup.
         */
        private String table = "";
        private String idField = CursorSchema.DEFAULT_ID_FIELD;
        private String cursorField = CursorSchema.DEFAULT_CURSOR_FIELD;
        private String timeField = CursorSchema.DEFAULT_TIME_FIELD;
        /**
         * Stream loops require {@code NUMERIC}.
         */
        private CursorType cursorType = CursorType.NUMERIC;

        public String getTable() {
            return table;
        }

        public void setTable(String table) {
            this.table = table;
        }

        public String getIdField() {
            return idField;
        }

        public void setIdField(String idField) {
            this.idField = idField;
        }

        public String getCursorField() {
            return cursorField;
        }

        public void setCursorField(String cursorField) {
            this.cursorField = cursorField;
        }

        public String getTimeField() {
            return timeField;
        }

        public void setTimeField(String timeField) {
            this.timeField = timeField;
        }

        public CursorType getCursorType() {
            return cursorType;
        }

        public void setCursorType(CursorType cursorType) {
            this.cursorType = cursorType;
        }

        CursorSchema toSchema() {
            return CursorSchema.builder(table)
                .idField(idField)
                .cursorField(cursorField)
                .timeField(timeField)
                .cursorType(cursorType)
                .build();
        }
    }

    public static class Consumer {

        /**
         * Zero or negative disables the lag alert gauge.
         */
        private Duration lagAlert = InstrumentedConsumer.DEFAULT_LAG_ALERT;
        /**
         * Zero or negative disables the liveness gauge.
         */
        private Duration activityTtl = InstrumentedConsumer.DEFAULT_ACTIVITY_TTL;

        public Duration getLagAlert() {
            return lagAlert;
        }

        public void setLagAlert(Duration lagAlert) {
            this.lagAlert = lagAlert;
        }

        public Duration getActivityTtl() {
            return activityTtl;
        }

        public void setActivityTtl(Duration activityTtl) {
            this.activityTtl = activityTtl;
        }
    }

    public static class Loop {

        private boolean enabled = true;
        private Duration pollInterval = StreamLoopOptions.DEFAULT_POLL_INTERVAL;
        private Duration errorBackoff = StreamLoopOptions.DEFAULT_ERROR_BACKOFF;
        private Duration maxErrorBackoff = StreamLoopOptions.DEFAULT_MAX_ERROR_BACKOFF;
        private Duration lag = Duration.ZERO;
        private boolean startFromHead;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public Duration getErrorBackoff() {
            return errorBackoff;
        }

        public void setErrorBackoff(Duration errorBackoff) {
            this.errorBackoff = errorBackoff;
        }

        public Duration getMaxErrorBackoff() {
            return maxErrorBackoff;
        }

        public void setMaxErrorBackoff(Duration maxErrorBackoff) {
            this.maxErrorBackoff = maxErrorBackoff;
        }

        public Duration getLag() {
            return lag;
        }

        public void setLag(Duration lag) {
            this.lag = lag;
        }

        public boolean isStartFromHead() {
            return startFromHead;
        }

        public void setStartFromHead(boolean startFromHead) {
            this.startFromHead = startFromHead;
        }
    }

    public static class Jdbc {

        /**
         * Statement timeout for event log and cursor queries. Zero keeps the driver default.
         */
        private Duration queryTimeout = Duration.ZERO;

        public Duration getQueryTimeout() {
            return queryTimeout;
        }

        public void setQueryTimeout(Duration queryTimeout) {
            this.queryTimeout = queryTimeout;
        }
    }
}
