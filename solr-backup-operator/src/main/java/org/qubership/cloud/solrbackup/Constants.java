package org.qubership.cloud.solrbackup;

public final class Constants {
    public static final String LEGACY_LOCAL_REPOSITORY = "legacy_local_repository";
    public static final int DEFAULT_MAX_SAVED = 5;

    public static final String RESOURCE_NAME_PATTERN = "[a-z0-9]([-a-z0-9]*[a-z0-9])?";
    public static final String REPOSITORY_NAME_PATTERN = "[a-zA-Z0-9]([-_a-zA-Z0-9]*[a-zA-Z0-9])?";

    private Constants() {
    }
}
