package com.example.ldapbridge.ldap;

import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One search match: its DN plus the requested attributes in request order.
 * Attribute lookups ignore case, as LDAP attribute names do.
 */
@Value
public class DirectoryEntry {

    String dn;
    Map<String, String> attributes;

    public DirectoryEntry(String dn, Map<String, String> attributes) {
        this.dn = dn;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public String getAttribute(String name) {
        if (name == null) {
            return null;
        }
        for (Map.Entry<String, String> attribute : attributes.entrySet()) {
            if (attribute.getKey().equalsIgnoreCase(name)) {
                return attribute.getValue();
            }
        }
        return null;
    }
}
