package com.facet.backend.modules.auth.domain;

public enum Permission {
    CREATE_TICKET,
    VIEW_TICKET,
    MODIFY_OWN_TICKET,
    ADD_NOTES,
    UPLOAD_PHOTOS,
    CLOSE_ANY_TICKET,
    DELETE_PHOTOS,
    ARCHIVE_TICKETS,
    REASSIGN_TICKETS,
    DELETE_TICKETS,
    MANAGE_EMPLOYEES,
    MANAGE_SETTINGS,
    MANAGE_LOCATIONS
}
