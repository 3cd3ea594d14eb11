package com.spantagger.domain.tagging.model;

import com.spantagger.domain.tagging.exception.UnknownPolicyException;

import java.util.Locale;

/**
 * How the parser treats an invalid transition.
 */
public enum ErrorPolicy {
    /** Fail on the first invalid transition. */
    STRICT("strict"),
    /** Repair the way span-evaluation scripts do, report nothing. */
    COERCE("coerce"),
    /** Repair like {@link #COERCE} and report every repair. */
    KEEP_GOING("keep-going");

    private final String configName;

    ErrorPolicy(String configName) {
        this.configName = configName;
    }

    public String configName() {
        return configName;
    }

    public boolean repairs() {
        return this != STRICT;
    }

    public boolean reportsRepairs() {
        return this == KEEP_GOING;
    }

    public static ErrorPolicy fromName(String name) {
        if (name != null) {
            String key = name.trim().toLowerCase(Locale.ROOT).replace('_', '-');
            for (ErrorPolicy policy : values()) {
                if (policy.configName.equals(key)) {
                    return policy;
                }
            }
        }
        throw new UnknownPolicyException(name);
    }
}
