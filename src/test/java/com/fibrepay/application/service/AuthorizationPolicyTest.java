package com.fibrepay.application.service;

import com.fibrepay.domain.exception.ForbiddenException;
import com.fibrepay.domain.model.Actor;
import com.fibrepay.domain.model.WorkDay;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AuthorizationPolicyTest {

    private final AuthorizationPolicy policy = new AuthorizationPolicy();

    private final Actor admin = new Actor.Admin("admin-1");
    private final Actor supervisor = new Actor.Supervisor("sup-1", "factory-a");
    private final Actor unscopedSupervisor = new Actor.Supervisor("sup-2", null);

    private final WorkDay loggedBySupervisor = WorkDay.builder().id("d-1").loggedBy("sup-1").build();

    @Test
    void adminManagesEveryDay() {
        assertTrue(policy.canManageDay(admin, loggedBySupervisor));
        assertDoesNotThrow(() -> policy.requireDayAccess(admin, loggedBySupervisor));
    }

    @Test
    void supervisorManagesOnlyDaysTheyLogged() {
        assertTrue(policy.canManageDay(supervisor, loggedBySupervisor));
        assertFalse(policy.canManageDay(unscopedSupervisor, loggedBySupervisor));
        assertThrows(ForbiddenException.class, () -> policy.requireDayAccess(unscopedSupervisor, loggedBySupervisor));
    }

    @Test
    void requireAdmin_rejectsSupervisors() {
        assertDoesNotThrow(() -> policy.requireAdmin(admin, "Reopening a work day"));

        ForbiddenException error = assertThrows(ForbiddenException.class,
                () -> policy.requireAdmin(supervisor, "Reopening a work day"));
        assertTrue(error.getMessage().startsWith("Reopening a work day"));
    }

    @Test
    void scopes() {
        assertNull(policy.loggedByScope(admin));
        assertEquals("sup-1", policy.loggedByScope(supervisor));

        assertNull(policy.factoryScope(admin));
        assertEquals("factory-a", policy.factoryScope(supervisor));
        assertNull(policy.factoryScope(unscopedSupervisor));
    }
}
