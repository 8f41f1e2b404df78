package org.sparkworld.runtime.spi;

import org.sparkworld.runtime.report.TickReport;

/**
 * Receives the report of every completed tick, e.g. to narrate it.
 * <p>
 * Listeners are called sequentially in their configured order. A failing listener is
 * logged and skipped; it never aborts the tick.
 * </p>
 */
public interface ITickReportListener extends IWorldCollaborator {

    /**
     * @param report The report of the tick that just finished.
     */
    void onTick(TickReport report);
}
