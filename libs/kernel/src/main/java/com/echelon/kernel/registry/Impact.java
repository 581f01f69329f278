package com.echelon.kernel.registry;

import java.util.ArrayList;
import java.util.List;

/**
 * What a side-effecting action would do, returned by dry runs.
 *
 * @param creates     resources that would be created
 * @param updates     resources that would be updated
 * @param deletes     resources that would be deleted
 * @param sideEffects external effects (emails, outbound calls)
 * @param risk        {@code low}, {@code medium} or {@code high}
 * @param warnings    anything the operator should read first
 */
public record Impact(
        List<String> creates,
        List<String> updates,
        List<String> deletes,
        List<String> sideEffects,
        String risk,
        List<String> warnings) {

    public static final String RISK_LOW = "low";
    public static final String RISK_MEDIUM = "medium";
    public static final String RISK_HIGH = "high";

    public Impact {
        creates = creates == null ? List.of() : List.copyOf(creates);
        updates = updates == null ? List.of() : List.copyOf(updates);
        deletes = deletes == null ? List.of() : List.copyOf(deletes);
        sideEffects = sideEffects == null ? List.of() : List.copyOf(sideEffects);
        risk = risk == null ? RISK_LOW : risk;
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static Impact creates(String resource, String risk) {
        return new Impact(List.of(resource), null, null, null, risk, null);
    }

    public static Impact updates(String resource, String risk) {
        return new Impact(null, List.of(resource), null, null, risk, null);
    }

    public static Impact deletes(String resource, String risk) {
        return new Impact(null, null, List.of(resource), null, risk, null);
    }

    public Impact withWarning(String warning) {
        List<String> all = new ArrayList<>(warnings);
        all.add(warning);
        return new Impact(creates, updates, deletes, sideEffects, risk, all);
    }

    public Impact withSideEffect(String effect) {
        List<String> all = new ArrayList<>(sideEffects);
        all.add(effect);
        return new Impact(creates, updates, deletes, all, risk, warnings);
    }
}
