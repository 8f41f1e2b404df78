package org.sparkworld.runtime.oracle.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sparkworld.runtime.report.TickReport;
import org.sparkworld.runtime.report.WorldEvent;
import org.sparkworld.runtime.report.WorldEventType;
import org.sparkworld.runtime.spi.IRandomProvider;
import org.sparkworld.runtime.spi.ITickReportListener;

import com.typesafe.config.Config;

/**
 * Narrates each tick to the log: the summary at INFO and every event at DEBUG.
 * <p>
 * Option {@code include-dropped} (default false) also narrates dropped actions.
 */
public class LoggingTickReporter implements ITickReportListener {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingTickReporter.class);

    private final boolean includeDropped;

    public LoggingTickReporter(IRandomProvider random, Config options) {
        this.includeDropped = options.hasPath("include-dropped") && options.getBoolean("include-dropped");
    }

    @Override
    public void onTick(TickReport report) {
        LOG.info("[{}] {}", report.simulationId(), report.summary());
        for (WorldEvent event : report.events()) {
            if (includeDropped || event.type() != WorldEventType.DROPPED_ACTION) {
                LOG.debug("[tick {}] {}: {}", event.tick(), event.type(), event.description());
            }
        }
    }
}
