package com.formulagrid.app.formula;

import com.formulagrid.app.models.CellAddress;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Result of statically analysing one formula. Immutable.
 */
public final class FormulaDependencies {
    static final FormulaDependencies NONE = new FormulaDependencies(
            Collections.emptySortedSet(), Collections.emptyMap(), Collections.emptyMap(), Collections.emptyList());

    private final Set<CellAddress> directReferences;
    private final Map<CellAddress, Set<String>> referenceTokens;
    private final Map<String, List<CellAddress>> rangeReferences;
    private final List<ExternalReference> externalReferences;

    FormulaDependencies(Set<CellAddress> directReferences,
                        Map<CellAddress, Set<String>> referenceTokens,
                        Map<String, List<CellAddress>> rangeReferences,
                        List<ExternalReference> externalReferences) {
        this.directReferences = Collections.unmodifiableSet(directReferences);
        this.referenceTokens = Collections.unmodifiableMap(referenceTokens);
        this.rangeReferences = Collections.unmodifiableMap(rangeReferences);
        this.externalReferences = Collections.unmodifiableList(externalReferences);
    }

    /**
     * Every local address the formula depends on, including each cell of every range,
     * in row-major order.
     */
    public Set<CellAddress> getDirectReferences() {
        return directReferences;
    }

    /**
     * The original spellings of each individually written address, e.g. A1 -> {"A1", "$A$1"}.
     * Addresses that only appear inside a range have no entry.
     */
    public Map<CellAddress, Set<String>> getReferenceTokens() {
        return referenceTokens;
    }

    /**
     * Range text as written ("B2:B9") to its expanded addresses, in order of appearance.
     */
    public Map<String, List<CellAddress>> getRangeReferences() {
        return rangeReferences;
    }

    public List<ExternalReference> getExternalReferenceDetails() {
        return externalReferences;
    }

    /**
     * External references as raw strings, in order of appearance.
     */
    public List<String> getExternalReferences() {
        return externalReferences.stream()
                .map(ExternalReference::getRaw)
                .collect(Collectors.toList());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FormulaDependencies)) {
            return false;
        }
        FormulaDependencies that = (FormulaDependencies) o;
        return directReferences.equals(that.directReferences)
                && referenceTokens.equals(that.referenceTokens)
                && rangeReferences.equals(that.rangeReferences)
                && getExternalReferences().equals(that.getExternalReferences());
    }

    @Override
    public int hashCode() {
        return directReferences.hashCode() * 31 + rangeReferences.hashCode();
    }
}
