/**
 * Dependency validation, cycle detection and traversal. Nothing in this package does I/O.
 */
package io.taskmesh.graph;
