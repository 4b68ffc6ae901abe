/*
 * Copyright (c) 2025 Aegis Control Allocator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.allocation.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Information-classification and system-type flags submitted for one system.
 *
 * <p>Every flag is independent. Any combination, including none at all and
 * contradictory ones (CUI and public data together), is a valid selection;
 * resolving them is the job of the allocation rule chain.
 *
 * <h2>Usage</h2>
 * <pre>
 * ClassificationSelection selection = ClassificationSelection.builder()
 *     .proprietary(true)
 *     .systemScope(SystemScope.INTERNAL)
 *     .build();
 * </pre>
 *
 * @param cui                  Controlled Unclassified Information
 * @param cdiDfars             Covered Defense Information (DFARS)
 * @param itar                 ITAR-controlled technical data
 * @param ear                  EAR-controlled data
 * @param ear99Plus            EAR99 or stricter export classification
 * @param publicData           data approved for public release
 * @param pilotShortDuration   short-lived pilot system
 * @param systemScope          internal or external system; never null
 * @param competitionSensitive competition-sensitive data
 * @param proprietary          proprietary data
 * @param pii                  personally identifiable information
 */
public record ClassificationSelection(
    @JsonProperty("cui") boolean cui,
    @JsonProperty("cdi_dfars") boolean cdiDfars,
    @JsonProperty("itar") boolean itar,
    @JsonProperty("ear") boolean ear,
    @JsonProperty("ear99_plus") boolean ear99Plus,
    @JsonProperty("public_data") boolean publicData,
    @JsonProperty("pilot_short_duration") boolean pilotShortDuration,
    @JsonProperty("system_scope") SystemScope systemScope,
    @JsonProperty("competition_sensitive") boolean competitionSensitive,
    @JsonProperty("proprietary") boolean proprietary,
    @JsonProperty("pii") boolean pii
) implements Serializable {

    private static final ClassificationSelection EMPTY = builder().build();

    public ClassificationSelection {
        if (systemScope == null) {
            systemScope = SystemScope.UNSET;
        }
    }

    /**
     * A selection with no flag set and no system scope.
     */
    public static ClassificationSelection empty() {
        return EMPTY;
    }

    /**
     * True if any flag other than CUI puts the system under DFARS.
     */
    public boolean hasDfarsTrigger() {
        return cdiDfars || itar || ear || ear99Plus;
    }

    /**
     * True if the system holds competition-sensitive, proprietary or personal data.
     */
    public boolean hasSensitiveData() {
        return competitionSensitive || proprietary || pii;
    }

    /**
     * True if CUI or any DFARS trigger is set.
     */
    public boolean hasHighRiskFlag() {
        return cui || hasDfarsTrigger();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .cui(cui)
            .cdiDfars(cdiDfars)
            .itar(itar)
            .ear(ear)
            .ear99Plus(ear99Plus)
            .publicData(publicData)
            .pilotShortDuration(pilotShortDuration)
            .systemScope(systemScope)
            .competitionSensitive(competitionSensitive)
            .proprietary(proprietary)
            .pii(pii);
    }

    public static final class Builder {
        private boolean cui;
        private boolean cdiDfars;
        private boolean itar;
        private boolean ear;
        private boolean ear99Plus;
        private boolean publicData;
        private boolean pilotShortDuration;
        private SystemScope systemScope = SystemScope.UNSET;
        private boolean competitionSensitive;
        private boolean proprietary;
        private boolean pii;

        private Builder() {
        }

        public Builder cui(boolean value) { this.cui = value; return this; }
        public Builder cdiDfars(boolean value) { this.cdiDfars = value; return this; }
        public Builder itar(boolean value) { this.itar = value; return this; }
        public Builder ear(boolean value) { this.ear = value; return this; }
        public Builder ear99Plus(boolean value) { this.ear99Plus = value; return this; }
        public Builder publicData(boolean value) { this.publicData = value; return this; }
        public Builder pilotShortDuration(boolean value) { this.pilotShortDuration = value; return this; }
        public Builder systemScope(SystemScope value) { this.systemScope = value; return this; }
        public Builder competitionSensitive(boolean value) { this.competitionSensitive = value; return this; }
        public Builder proprietary(boolean value) { this.proprietary = value; return this; }
        public Builder pii(boolean value) { this.pii = value; return this; }

        public ClassificationSelection build() {
            return new ClassificationSelection(cui, cdiDfars, itar, ear, ear99Plus, publicData,
                pilotShortDuration, systemScope, competitionSensitive, proprietary, pii);
        }
    }
}
