package com.splitttr.coedit.operation;

import com.splitttr.coedit.message.CollaborationOperation;
import com.splitttr.coedit.message.ResourceKey;

import java.util.concurrent.ConcurrentHashMap;

/**
 * Last-in-wins at the version layer: one high-water mark per resource, shared
 * by all originators. An operation whose version does not exceed the mark is
 * a conflict.
 */
public class VersionConflictDetector implements ConflictDetector {

    private final ConcurrentHashMap<ResourceKey, Long> highestVersions = new ConcurrentHashMap<>();

    @Override
    public Verdict detect(CollaborationOperation operation) {
        long version = operation.version();
        boolean[] accepted = {false};
        highestVersions.compute(operation.resource(), (key, highest) -> {
            long current = highest == null ? 0L : highest;
            if (version <= current) {
                return highest;
            }
            accepted[0] = true;
            return version;
        });
        return accepted[0] ? Verdict.ACCEPT : Verdict.CONFLICT;
    }

    @Override
    public long highestVersion(ResourceKey resource) {
        return highestVersions.getOrDefault(resource, 0L);
    }
}
