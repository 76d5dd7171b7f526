package com.facet.backend.modules.auth.domain;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Static role to permission table. Pure lookup, no I/O.
 */
public final class RolePermissions {

    private static final Set<Permission> STAFF_PERMISSIONS = Collections.unmodifiableSet(EnumSet.of(
            Permission.CREATE_TICKET,
            Permission.VIEW_TICKET,
            Permission.MODIFY_OWN_TICKET,
            Permission.ADD_NOTES,
            Permission.UPLOAD_PHOTOS
    ));

    private static final Set<Permission> ADMIN_PERMISSIONS;

    static {
        EnumSet<Permission> admin = EnumSet.copyOf(STAFF_PERMISSIONS);
        admin.addAll(EnumSet.of(
                Permission.CLOSE_ANY_TICKET,
                Permission.DELETE_PHOTOS,
                Permission.ARCHIVE_TICKETS,
                Permission.REASSIGN_TICKETS,
                Permission.DELETE_TICKETS,
                Permission.MANAGE_EMPLOYEES,
                Permission.MANAGE_SETTINGS,
                Permission.MANAGE_LOCATIONS
        ));
        ADMIN_PERMISSIONS = Collections.unmodifiableSet(admin);
    }

    private RolePermissions() {
    }

    public static Set<Permission> permissionsFor(EmployeeRole role) {
        if (role == null) {
            return Set.of();
        }
        // Exhaustive switch: adding a role without a mapping does not compile
        return switch (role) {
            case STAFF -> STAFF_PERMISSIONS;
            case ADMIN -> ADMIN_PERMISSIONS;
        };
    }

    public static boolean has(EmployeeRole role, Permission permission) {
        return permission != null && permissionsFor(role).contains(permission);
    }
}
