package dev.fathom.structural;

import java.nio.file.Path;
import java.time.Duration;

/**
 * A freshly built SCIP index.
 *
 * @param projectName the indexed project
 * @param indexPath location of the written index
 * @param elapsed wall-clock duration of the build
 */
public record StructuralIndexResult(String projectName, Path indexPath, Duration elapsed) {}
