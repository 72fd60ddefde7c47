package com.example.access.privilege.catalog;

import com.example.access.exception.PolicyConfigurationException;
import com.example.access.exception.UnknownPrivilegeException;
import com.example.access.privilege.model.PrivilegeDefinition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable registry of every controllable action.
 *
 * <p>Iteration order is declaration order, grouped by category as declared. Each
 * definition also has a dense index used by the role default table.
 */
public final class PrivilegeCatalog {

    private final List<PrivilegeDefinition> definitions;
    private final Map<String, Integer> indexByCode;

    public PrivilegeCatalog(List<PrivilegeDefinition> definitions) {
        if (definitions == null || definitions.isEmpty()) {
            throw new PolicyConfigurationException("Privilege catalog must not be empty");
        }
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < definitions.size(); i++) {
            PrivilegeDefinition definition = definitions.get(i);
            if (index.putIfAbsent(definition.code(), i) != null) {
                throw new PolicyConfigurationException("Duplicate privilege code in catalog: " + definition.code());
            }
        }
        this.definitions = List.copyOf(definitions);
        this.indexByCode = Map.copyOf(index);
    }

    /**
     * All definitions, same order on every call.
     */
    public List<PrivilegeDefinition> listPrivileges() {
        return definitions;
    }

    public int size() {
        return definitions.size();
    }

    public boolean contains(String code) {
        return code != null && indexByCode.containsKey(code);
    }

    public Optional<PrivilegeDefinition> find(String code) {
        Integer index = code != null ? indexByCode.get(code) : null;
        return index != null ? Optional.of(definitions.get(index)) : Optional.empty();
    }

    /**
     * Dense position of a code in the catalog.
     *
     * @throws UnknownPrivilegeException if the catalog has no such code
     */
    public int indexOf(String code) {
        Integer index = code != null ? indexByCode.get(code) : null;
        if (index == null) {
            throw new UnknownPrivilegeException(code);
        }
        return index;
    }

    public PrivilegeDefinition get(int index) {
        return definitions.get(index);
    }

    public List<String> categories() {
        return List.copyOf(byCategory().keySet());
    }

    public Map<String, List<PrivilegeDefinition>> byCategory() {
        Map<String, List<PrivilegeDefinition>> grouped = new LinkedHashMap<>();
        for (PrivilegeDefinition definition : definitions) {
            grouped.computeIfAbsent(definition.category(), k -> new ArrayList<>()).add(definition);
        }
        grouped.replaceAll((category, list) -> List.copyOf(list));
        return Collections.unmodifiableMap(grouped);
    }

    public static PrivilegeCatalog standard() {
        return new PrivilegeCatalog(StandardPrivileges.DEFINITIONS);
    }
}
