package com.example.ldapbridge.ldap;

import com.example.ldapbridge.exception.DirectoryUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ldap.NamingException;
import org.springframework.ldap.core.DirContextOperations;
import org.springframework.ldap.core.LdapTemplate;
import org.springframework.ldap.core.support.AbstractContextMapper;
import org.springframework.ldap.core.support.SingleContextSource;
import org.springframework.ldap.query.LdapQuery;
import org.springframework.ldap.query.LdapQueryBuilder;
import org.springframework.ldap.query.SearchScope;
import org.springframework.ldap.support.LdapEncoder;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static org.springframework.ldap.query.LdapQueryBuilder.query;

@Component
@Slf4j
public class LdapDirectorySearcher {

    private static final String PLACEHOLDER = "{0}";

    /**
     * Substitutes {@code identifier} into the template's {@code {0}} placeholder and
     * runs a subtree search under {@code organizationalUnit} (or {@code baseDn} when
     * no OU is configured). Matches come back in server order.
     *
     * @param attributes attributes to fetch; all user attributes when empty
     */
    public List<DirectoryEntry> search(LdapConnection connection, String searchTemplate, String organizationalUnit,
                                       String baseDn, String identifier, List<String> attributes) {
        String searchBase = StringUtils.hasText(organizationalUnit) ? organizationalUnit : Objects.toString(baseDn, "");
        String filter = toFilter(searchTemplate, identifier);
        String[] requested = attributes.stream().filter(StringUtils::hasText).distinct().toArray(String[]::new);

        LdapTemplate template = new LdapTemplate(new SingleContextSource(connection.getContext()));
        template.setIgnorePartialResultException(true);
        try {
            LdapQueryBuilder builder = query()
                    .base(searchBase)
                    .searchScope(SearchScope.SUBTREE);
            if (requested.length > 0) {
                builder.attributes(requested);
            }
            LdapQuery ldapQuery = builder.filter(filter);
            log.info("Searching LDAP | Base: '{}' | Filter: '{}'", searchBase, filter);

            List<DirectoryEntry> entries = template.search(ldapQuery, new EntryMapper(requested));
            log.debug("LDAP search returned {} entries", entries.size());
            return entries;
        } catch (NamingException e) {
            log.error("LDAP search under '{}' failed: {}", searchBase, e.getMessage());
            throw new DirectoryUnavailableException("LDAP Error: " + e.getMessage(), e);
        }
    }

    /**
     * Turns "sAMAccountName={0}" into "(sAMAccountName=&lt;identifier&gt;)", with the
     * identifier escaped per RFC 4515. Every other character of the template is kept
     * as written.
     */
    static String toFilter(String searchTemplate, String identifier) {
        String filter = searchTemplate.trim();
        if (!filter.startsWith("(")) {
            filter = "(" + filter + ")";
        }
        return filter.replace(PLACEHOLDER, LdapEncoder.filterEncode(identifier));
    }

    private static final class EntryMapper extends AbstractContextMapper<DirectoryEntry> {

        private final String[] attributes;

        private EntryMapper(String[] attributes) {
            this.attributes = attributes;
        }

        @Override
        protected DirectoryEntry doMapFromContext(DirContextOperations ctx) {
            Map<String, String> values = new LinkedHashMap<>();
            for (String attribute : attributes) {
                values.put(attribute, ctx.getStringAttribute(attribute));
            }
            return new DirectoryEntry(ctx.getNameInNamespace(), values);
        }
    }
}
