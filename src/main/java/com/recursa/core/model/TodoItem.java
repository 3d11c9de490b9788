package com.recursa.core.model;

import java.io.Serializable;

/**
 * One line of the todo list kept in a {@link ConsolidationSnapshot}.
 *
 * @param text   what the step is, concrete enough to act on without history
 * @param status DONE, ONGOING or WAITING
 */
public record TodoItem(
    String text,
    TodoStatus status
) implements Serializable {
}
