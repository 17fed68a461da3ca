package io.buildeval.core.evaluation;

import java.util.EnumSet;
import java.util.Set;

/**
 * Property events reported to the evaluation listener. The bit values match the
 * {@code MsBuildLogPropertyTracking} environment variable.
 */
public enum PropertyTracking {
    PROPERTY_REASSIGNMENT(1),
    PROPERTY_INITIAL_VALUE_SET(2),
    ENVIRONMENT_VARIABLE_READ(4),
    UNINITIALIZED_PROPERTY_READ(8);

    private final int flag;

    PropertyTracking(int flag) {
        this.flag = flag;
    }

    public int flag() {
        return flag;
    }

    /** Decodes a bit mask; unknown bits are ignored. */
    public static Set<PropertyTracking> fromFlags(int flags) {
        Set<PropertyTracking> result = EnumSet.noneOf(PropertyTracking.class);
        for (PropertyTracking t : values()) {
            if ((flags & t.flag) != 0) {
                result.add(t);
            }
        }
        return result;
    }
}
