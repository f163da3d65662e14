package com.atrium.permissions;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Resolves effective capabilities from a role and a member's custom permission strings.
 *
 * <p>Custom permissions only add to the role defaults; nothing revokes a default. Strings that do
 * not name a known {@link Capability} are ignored. All methods are pure.
 */
public final class PermissionEngine {

    private PermissionEngine() {
        // utility class
    }

    /** The union of the role defaults and every recognised custom permission. */
    public static Set<Capability> resolve(Role role, Collection<String> customPermissions) {
        if (role == null) {
            throw new IllegalArgumentException("role must not be null");
        }
        EnumSet<Capability> resolved = EnumSet.noneOf(Capability.class);
        resolved.addAll(role.defaultCapabilities());
        if (customPermissions != null) {
            for (String custom : customPermissions) {
                Capability.fromString(custom).ifPresent(resolved::add);
            }
        }
        return Collections.unmodifiableSet(resolved);
    }

    public static Set<Capability> resolve(Role role) {
        return resolve(role, null);
    }

    public static boolean hasPermission(
            Role role, Capability required, Collection<String> customPermissions) {
        if (role == null) {
            throw new IllegalArgumentException("role must not be null");
        }
        if (required == null) {
            throw new IllegalArgumentException("required capability must not be null");
        }
        if (role.defaultCapabilities().contains(required)) {
            return true;
        }
        return customPermissions != null && customPermissions.contains(required.value());
    }

    /** True when every required capability is granted. */
    public static boolean hasAllPermissions(
            Role role, Collection<Capability> required, Collection<String> customPermissions) {
        return missing(role, required, customPermissions).isEmpty();
    }

    /** The required capabilities the role plus custom grants do not cover, for error messages. */
    public static Set<Capability> missing(
            Role role, Collection<Capability> required, Collection<String> customPermissions) {
        Set<Capability> granted = resolve(role, customPermissions);
        EnumSet<Capability> missing = EnumSet.noneOf(Capability.class);
        for (Capability capability : required) {
            if (!granted.contains(capability)) {
                missing.add(capability);
            }
        }
        return Collections.unmodifiableSet(missing);
    }
}
