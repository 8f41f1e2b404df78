package org.sparkworld.runtime.spi;

/**
 * Generated content of a new mission.
 *
 * @param title Short title.
 * @param description What the mission is about.
 * @param goal What counts as done.
 */
public record MissionContent(String title, String description, String goal) {}
