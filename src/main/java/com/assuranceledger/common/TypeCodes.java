package com.assuranceledger.common;

import com.assuranceledger.common.exception.ValidationException;

import java.util.regex.Pattern;

/**
 * Validation for extensible vocabularies: a closed enum with one {@code CUSTOM} variant whose
 * free-form code must look like {@code custom_<slug>}.
 */
public final class TypeCodes {

    private static final Pattern CUSTOM_CODE = Pattern.compile("^custom_[a-z0-9_]{1,90}$");

    private TypeCodes() {
    }

    /**
     * Returns the custom code to store for {@code type}: the validated code for {@code CUSTOM},
     * {@code null} for built-ins.
     */
    public static <E extends Enum<E>> String requireCustomCode(String field, E type, String customCode) {
        if (type == null) {
            throw new ValidationException(field, "is required");
        }
        boolean custom = "CUSTOM".equals(type.name());
        if (custom) {
            if (customCode == null || !CUSTOM_CODE.matcher(customCode).matches()) {
                throw new ValidationException(field, "custom type requires a code matching custom_<slug>, got " + customCode);
            }
            return customCode;
        }
        if (customCode != null) {
            throw new ValidationException(field, "custom code is only allowed with the CUSTOM type");
        }
        return null;
    }
}
