package io.flowrules.core.catalog;

import io.flowrules.core.model.Flow;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Named flows loaded from one catalog file. Immutable. */
public final class FlowCatalog {

    private final Map<String, Flow> flows;
    private final String source;

    public FlowCatalog(Map<String, Flow> flows, String source) {
        this.flows = Collections.unmodifiableMap(new LinkedHashMap<>(flows));
        this.source = source;
    }

    public Optional<Flow> flow(String name) {
        return Optional.ofNullable(flows.get(name));
    }

    /** Flow names in file order. */
    public Set<String> names() {
        return flows.keySet();
    }

    public int size() {
        return flows.size();
    }

    /** Path or label the catalog was read from. */
    public String source() {
        return source;
    }
}
