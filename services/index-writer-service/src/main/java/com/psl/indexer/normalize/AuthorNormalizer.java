package com.psl.indexer.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.psl.schema.document.Author;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds {@link Author} entries from either parsed-name arrays ({@code [last, first, suffix, affiliation...]})
 * or objects carrying {@code last_name}, {@code first_name}, {@code suffix} and {@code affiliation}.
 */
public class AuthorNormalizer {

    public List<Author> authors(JsonNode raw) {
        List<Author> authors = new ArrayList<>();
        if (raw == null || !raw.isArray()) {
            return authors;
        }
        for (JsonNode entry : raw) {
            Author author = author(entry);
            if (author != null) {
                authors.add(author);
            }
        }
        return authors;
    }

    /**
     * Owners are a set: duplicates collapse, first occurrence keeps its position.
     */
    public List<Author> owners(JsonNode raw) {
        Set<Author> owners = new LinkedHashSet<>(authors(raw));
        return new ArrayList<>(owners);
    }

    public Author author(JsonNode entry) {
        String last;
        String first;
        String suffix;
        List<String> affiliation = new ArrayList<>();
        String authorId = null;
        String orcid = null;
        if (entry.isArray()) {
            last = JsonValues.text(entry.path(0));
            first = JsonValues.text(entry.path(1));
            suffix = JsonValues.text(entry.path(2));
            for (int i = 3; i < entry.size(); i++) {
                addAffiliation(affiliation, entry.get(i));
            }
        } else if (entry.isObject()) {
            last = JsonValues.text(entry.path("last_name"));
            first = JsonValues.text(entry.path("first_name"));
            suffix = JsonValues.text(entry.path("suffix"));
            addAffiliation(affiliation, entry.path("affiliation"));
            authorId = JsonValues.text(entry.path("author_id"));
            orcid = JsonValues.text(entry.path("orcid"));
        } else if (entry.isTextual()) {
            last = JsonValues.text(entry);
            first = null;
            suffix = null;
        } else {
            return null;
        }
        if (last == null && first == null) {
            return null;
        }
        if (last == null) {
            last = first;
            first = null;
        }

        Author author = new Author();
        author.setLastName(last);
        author.setFirstName(first);
        author.setSuffix(suffix);
        author.setAuthorId(authorId);
        author.setOrcid(orcid);
        author.setAffiliation(affiliation.isEmpty() ? null : affiliation);

        List<String> initials = initials(first);
        author.setInitials(initials.isEmpty() ? null : String.join(" ", initials));
        author.setFullName(join(first, last, suffix));

        StringBuilder initialized = new StringBuilder();
        for (String initial : initials) {
            initialized.append(initial).append(". ");
        }
        initialized.append(last);
        if (suffix != null) {
            initialized.append(' ').append(suffix);
        }
        author.setFullNameInitialized(initialized.toString());
        return author;
    }

    static List<String> initials(String givenNames) {
        List<String> initials = new ArrayList<>();
        if (givenNames == null) {
            return initials;
        }
        for (String token : givenNames.split("[\\s.\\-]+")) {
            if (!token.isEmpty()) {
                initials.add(token.substring(0, 1).toUpperCase());
            }
        }
        return initials;
    }

    private static String join(String... parts) {
        StringBuilder builder = new StringBuilder();
        for (String part : parts) {
            if (part == null) {
                continue;
            }
            if (builder.length() > 0) {
                builder.append(' ');
            }
            builder.append(part);
        }
        return builder.toString();
    }

    private static void addAffiliation(List<String> out, JsonNode node) {
        if (node == null) {
            return;
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                addAffiliation(out, item);
            }
            return;
        }
        String value = JsonValues.text(node);
        if (value != null) {
            out.add(value);
        }
    }
}
