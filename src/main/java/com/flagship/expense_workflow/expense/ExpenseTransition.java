package com.flagship.expense_workflow.expense;

import com.flagship.expense_workflow.expense.event.ExpenseEvent;
import lombok.Value;

/**
 * Result of a status-changing operation: the new state plus the event it emitted.
 *
 * @param <E> concrete event type
 */
@Value
public class ExpenseTransition<E extends ExpenseEvent> {
    ExpenseStatus previousStatus;
    ExpenseRequest expense;
    E event;
}
