package org.example.modelgen.entity;

public enum JobType {
    SUBMIT,
    POLL_STATUS,
    DOWNLOAD_MODEL
}
