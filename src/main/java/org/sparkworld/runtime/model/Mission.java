package org.sparkworld.runtime.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A goal object owned 1:1 by a bond.
 * <p>
 * Lifecycle: {@link State#CREATED} when the bond forms, {@link State#IN_PROGRESS} after
 * the first progress or task update, {@link State#COMPLETE} when the evaluator judges
 * the goal met or the bond dissolves. A complete mission is immutable: every mutator
 * throws {@link IllegalStateException}.
 */
public class Mission {

    /**
     * Lifecycle states.
     */
    public enum State {
        CREATED,
        IN_PROGRESS,
        COMPLETE
    }

    /**
     * Why a mission was completed.
     */
    public enum CompletionReason {
        /** The evaluator judged the goal achieved. */
        GOAL_MET,
        /** The owning bond was dissolved, e.g. because a member vanished. */
        BOND_DISSOLVED
    }

    public static final String INITIAL_PROGRESS = "Mission just started";

    private final String id;
    private final String bondId;
    private final String title;
    private final String description;
    private final String goal;
    private final String leaderId;
    private final long createdTick;
    private String progress = INITIAL_PROGRESS;
    private final Map<String, String> assignedTasks = new LinkedHashMap<>();
    private State state = State.CREATED;
    private CompletionReason completionReason;
    private long completedTick = -1L;

    public Mission(String id, String bondId, String title, String description, String goal,
                   String leaderId, long createdTick) {
        this.id = id;
        this.bondId = bondId;
        this.title = title;
        this.description = description;
        this.goal = goal;
        this.leaderId = leaderId;
        this.createdTick = createdTick;
    }

    public String getId() {
        return id;
    }

    public String getBondId() {
        return bondId;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public String getGoal() {
        return goal;
    }

    public String getLeaderId() {
        return leaderId;
    }

    public long getCreatedTick() {
        return createdTick;
    }

    public String getProgress() {
        return progress;
    }

    public State getState() {
        return state;
    }

    public boolean isComplete() {
        return state == State.COMPLETE;
    }

    public CompletionReason getCompletionReason() {
        return completionReason;
    }

    public long getCompletedTick() {
        return completedTick;
    }

    /**
     * @return An unmodifiable view of agent id to task description.
     */
    public Map<String, String> getAssignedTasks() {
        return Collections.unmodifiableMap(assignedTasks);
    }

    /**
     * Replaces the progress summary.
     *
     * @param progress The new summary text.
     */
    public void updateProgress(String progress) {
        ensureOpen();
        this.progress = progress;
        this.state = State.IN_PROGRESS;
    }

    /**
     * Replaces all task assignments.
     *
     * @param tasks Agent id to task description.
     */
    public void assignTasks(Map<String, String> tasks) {
        ensureOpen();
        this.assignedTasks.clear();
        this.assignedTasks.putAll(tasks);
        this.state = State.IN_PROGRESS;
    }

    /**
     * Completes the mission.
     *
     * @param reason Why the mission ended.
     * @param tick The tick of completion.
     */
    public void complete(CompletionReason reason, long tick) {
        ensureOpen();
        this.state = State.COMPLETE;
        this.completionReason = reason;
        this.completedTick = tick;
    }

    private void ensureOpen() {
        if (state == State.COMPLETE) {
            throw new IllegalStateException("Mission " + id + " is complete and can no longer change");
        }
    }

    /**
     * Rebuilds a mission from persisted fields.
     *
     * @return The restored mission.
     */
    public static Mission restore(String id, String bondId, String title, String description, String goal,
                                  String leaderId, long createdTick, String progress,
                                  Map<String, String> assignedTasks, State state,
                                  CompletionReason completionReason, long completedTick) {
        Mission mission = new Mission(id, bondId, title, description, goal, leaderId, createdTick);
        mission.progress = progress;
        mission.assignedTasks.putAll(assignedTasks);
        mission.state = state;
        mission.completionReason = completionReason;
        mission.completedTick = completedTick;
        return mission;
    }

    @Override
    public String toString() {
        return id + "('" + title + "', bond=" + bondId + ", " + state + ")";
    }
}
