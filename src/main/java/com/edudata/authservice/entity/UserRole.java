package com.edudata.authservice.entity;

public enum UserRole {
    STUDENT,
    TEACHER,
    INSTITUTION,
    GOVERNMENT,
    ADMIN;

    /** Spring Security authority name. */
    public String authority() {
        return "ROLE_" + name();
    }
}
