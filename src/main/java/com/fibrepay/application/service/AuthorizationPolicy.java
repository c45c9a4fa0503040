package com.fibrepay.application.service;

import com.fibrepay.domain.exception.ForbiddenException;
import com.fibrepay.domain.model.Actor;
import com.fibrepay.domain.model.WorkDay;

/**
 * Role and scope checks. Admins may act on anything; supervisors only on the
 * days they logged and, for worker lists, only inside their factory.
 */
public class AuthorizationPolicy {

    public boolean canManageDay(Actor actor, WorkDay workDay) {
        if (actor instanceof Actor.Admin) {
            return true;
        }
        if (actor instanceof Actor.Supervisor supervisor) {
            return supervisor.userId().equals(workDay.getLoggedBy());
        }
        return false;
    }

    public void requireDayAccess(Actor actor, WorkDay workDay) {
        if (!canManageDay(actor, workDay)) {
            throw new ForbiddenException("Supervisors can only change work they logged");
        }
    }

    public void requireAdmin(Actor actor, String operation) {
        if (!(actor instanceof Actor.Admin)) {
            throw new ForbiddenException(operation + " requires the admin role");
        }
    }

    /**
     * User whose logged days the actor is limited to, null when unrestricted
     */
    public String loggedByScope(Actor actor) {
        if (actor instanceof Actor.Supervisor supervisor) {
            return supervisor.userId();
        }
        return null;
    }

    /**
     * Factory the actor is limited to, null when unrestricted
     */
    public String factoryScope(Actor actor) {
        if (actor instanceof Actor.Supervisor supervisor) {
            return supervisor.factoryScope().orElse(null);
        }
        return null;
    }
}
