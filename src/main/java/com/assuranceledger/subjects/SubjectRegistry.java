package com.assuranceledger.subjects;

import com.assuranceledger.common.exception.ValidationException;

/**
 * Port to the external Subject Registry.
 *
 * Subjects are resolved when an entity is created, never at read time.
 */
public interface SubjectRegistry {

    /**
     * Whether the subject exists and is valid within the tenant.
     */
    boolean exists(String tenantId, SubjectRef subject);

    /**
     * Validate a required reference.
     *
     * @throws ValidationException if the reference is missing or unresolved
     */
    default SubjectRef require(String tenantId, String field, SubjectRef subject) {
        if (subject == null) {
            throw new ValidationException(field, "is required");
        }
        return resolve(tenantId, field, SubjectRef.of(subject.getKind(), subject.getId()));
    }

    /**
     * Validate an optional reference; {@code null} passes through.
     *
     * @throws ValidationException if the reference is present but unresolved
     */
    default SubjectRef requireIfPresent(String tenantId, String field, SubjectRef subject) {
        if (subject == null) {
            return null;
        }
        SubjectRef ref = SubjectRef.optional(subject.getKind(), subject.getId());
        return ref == null ? null : resolve(tenantId, field, ref);
    }

    private SubjectRef resolve(String tenantId, String field, SubjectRef subject) {
        if (!exists(tenantId, subject)) {
            throw new ValidationException(field, "unresolved subject " + subject);
        }
        return subject;
    }
}
