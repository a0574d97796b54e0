/**
 * TaskMesh source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.taskmesh.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.taskmesh.cli.TaskMeshCommand} maps commands to tag and task operations.</li>
 *   <li>{@code io.taskmesh.tasks.TaskOperations} runs one read-modify-write pass per mutation.</li>
 *   <li>{@code io.taskmesh.storage.TaskDocumentStore} is the only reader and writer of the task file.</li>
 *   <li>{@code io.taskmesh.graph.DependencyGraph} and {@code io.taskmesh.scheduler.NextTaskScheduler} are pure.</li>
 * </ul>
 */
package io.taskmesh;
