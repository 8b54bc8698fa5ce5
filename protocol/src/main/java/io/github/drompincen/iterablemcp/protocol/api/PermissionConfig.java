package io.github.drompincen.iterablemcp.protocol.api;

/**
 * The three independent permission flags that gate tool exposure.
 * Instances are built per request and never mutated.
 */
public record PermissionConfig(
        boolean allowUserPii,
        boolean allowWrites,
        boolean allowSends
) {
    public static PermissionConfig lockedDown() {
        return new PermissionConfig(false, false, false);
    }

    public static PermissionConfig fullAccess() {
        return new PermissionConfig(true, true, true);
    }

    /** Only the exact string {@code "true"} enables a flag. */
    public static PermissionConfig parse(String userPii, String enableWrites, String enableSends) {
        return new PermissionConfig(
                "true".equals(userPii),
                "true".equals(enableWrites),
                "true".equals(enableSends));
    }
}
