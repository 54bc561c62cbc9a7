package com.splitttr.coedit.security;

import com.splitttr.coedit.message.ResourceKey;

/**
 * Hook into the application's permission system. Sessions only consult it to
 * answer "may this user edit"; it is never enforced on the bus.
 */
@FunctionalInterface
public interface PermissionChecker {

    PermissionChecker ALLOW_ALL = (userId, resource) -> true;

    boolean canEdit(String userId, ResourceKey resource);
}
