package com.example.carerota.staff;

public enum StaffRole {
    ADMIN,
    HOME_MANAGER,
    SENIOR_STAFF,
    SUPPORT_WORKER
}
