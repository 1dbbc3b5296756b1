package com.assuranceledger.subjects;

import com.assuranceledger.common.exception.ValidationException;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Polymorphic reference to a subject (user, location, organization, booking line, ...)
 * owned by the Subject Registry.
 *
 * Every anchor, counterparty, obligor, beneficiary and allocation target is one of these,
 * so the pair shape is validated in exactly one place.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SubjectRef {

    @Column(length = 80)
    private String kind;

    @Column(length = 140)
    private String id;

    /**
     * A required reference: both parts must be present.
     */
    public static SubjectRef of(String kind, String id) {
        if (isBlank(kind) || isBlank(id)) {
            throw new ValidationException("subject", "kind and id are both required");
        }
        return new SubjectRef(kind, id);
    }

    /**
     * An optional reference: all-or-nothing, returns {@code null} when both parts are absent.
     */
    public static SubjectRef optional(String kind, String id) {
        if (isBlank(kind) && isBlank(id)) {
            return null;
        }
        if (isBlank(kind) || isBlank(id)) {
            throw new ValidationException("subject", "kind and id must be provided together");
        }
        return new SubjectRef(kind, id);
    }

    @Override
    public String toString() {
        return kind + ":" + id;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
