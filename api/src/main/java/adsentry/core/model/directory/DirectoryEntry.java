package adsentry.core.model.directory;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * A single directory entry returned by a search.
 *
 * <p>Attribute names are matched case-insensitively, as LDAP attribute
 * descriptions are. Every attribute is multi-valued; single-valued attributes
 * simply hold one value.
 *
 * @param dn         distinguished name of the entry
 * @param attributes attribute values keyed by attribute name
 */
public record DirectoryEntry(String dn, Map<String, List<String>> attributes) {

    public DirectoryEntry {
        if (dn == null) {
            throw new IllegalArgumentException("Entry DN cannot be null");
        }
        final var copy = new TreeMap<String, List<String>>(String.CASE_INSENSITIVE_ORDER);
        if (attributes != null) {
            attributes.forEach((name, values) -> copy.put(name, values != null ? List.copyOf(values) : List.of()));
        }
        attributes = Collections.unmodifiableMap(copy);
    }

    /**
     * All values of an attribute, empty if absent.
     */
    public List<String> values(String attribute) {
        return attributes.getOrDefault(attribute, List.of());
    }

    /**
     * First value of an attribute.
     */
    public Optional<String> firstValue(String attribute) {
        final var values = values(attribute);
        return values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    public boolean hasAttribute(String attribute) {
        return !values(attribute).isEmpty();
    }
}
