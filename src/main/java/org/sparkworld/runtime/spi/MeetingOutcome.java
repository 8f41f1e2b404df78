package org.sparkworld.runtime.spi;

import java.util.List;
import java.util.Map;

/**
 * Result of a mission meeting.
 *
 * @param transcript Lines of the meeting, in speaking order.
 * @param assignments Task per member id.
 */
public record MeetingOutcome(List<String> transcript, Map<String, String> assignments) {

    public MeetingOutcome {
        transcript = List.copyOf(transcript);
        assignments = Map.copyOf(assignments);
    }
}
