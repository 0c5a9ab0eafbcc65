package lab.escrow.common.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.filter.Filter;
import ch.qos.logback.core.spi.FilterReply;

import java.util.Map;

/**
 * Lets through only events that carry the configured MDC key (correlationId by default).
 * The request-trace appender uses it so background work does not end up in the request log.
 */
public class RequireMdcKeyFilter extends Filter<ILoggingEvent> {

    private String key = "correlationId";

    public void setKey(String key) {
        this.key = key;
    }

    @Override
    public FilterReply decide(ILoggingEvent event) {
        if (event == null || key == null || key.isBlank()) {
            return FilterReply.DENY;
        }
        Map<String, String> mdc = event.getMDCPropertyMap();
        if (mdc != null && mdc.containsKey(key)) {
            return FilterReply.NEUTRAL;
        }
        return FilterReply.DENY;
    }
}
