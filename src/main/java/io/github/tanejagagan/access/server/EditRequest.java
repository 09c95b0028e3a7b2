package io.github.tanejagagan.access.server;

/**
 * One builder operation sent to {@code POST /policies/{id}/edits}. Only the
 * members the operation needs are read.
 */
public record EditRequest(String op,
                          String principal,
                          String newName,
                          String column,
                          String level,
                          Long ruleId,
                          String field,
                          String value) {
}
