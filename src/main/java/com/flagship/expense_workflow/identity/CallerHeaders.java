package com.flagship.expense_workflow.identity;

import com.flagship.expense_workflow.exception.ForbiddenException;

/**
 * Headers through which the gateway passes the authenticated caller.
 */
public final class CallerHeaders {

    public static final String USER_ID = "X-User-Id";
    public static final String USER_ROLE = "X-User-Role";

    private CallerHeaders() {
    }

    /**
     * @throws ForbiddenException if the role cannot approve or reject expenses
     */
    public static UserRole requireProcessor(String roleHeader) {
        UserRole role = UserRole.parse(roleHeader);
        if (!role.canProcessExpenses()) {
            throw new ForbiddenException("Only managers or admins can access this resource.");
        }
        return role;
    }
}
