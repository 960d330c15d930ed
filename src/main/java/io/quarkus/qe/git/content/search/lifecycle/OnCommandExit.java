package io.quarkus.qe.git.content.search.lifecycle;

/**
 * Fired once a command has finished, so that beans holding open files can release them.
 */
public record OnCommandExit() {
}
