package com.edudata.authservice.model;

public enum MarkUsedResult {
    OK,
    ALREADY_USED,
    NOT_FOUND
}
