package dev.fathom.project;

/**
 * Published after a project is removed, so stores keyed by the project name can drop their data
 * before the name is registered again.
 */
public record ProjectRemovedEvent(String projectName) {}
