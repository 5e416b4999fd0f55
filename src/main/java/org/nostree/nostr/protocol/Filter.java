package org.nostree.nostr.protocol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Nostr subscription filter as defined in NIP-01.
 * Unset fields are omitted from the wire form and match anything.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Filter {

    @JsonProperty("ids")
    private List<String> ids;

    /** Author public keys to match */
    @JsonProperty("authors")
    private List<String> authors;

    @JsonProperty("kinds")
    private List<Integer> kinds;

    /** Events referencing these event IDs (e tag) */
    @JsonProperty("#e")
    private List<String> eTags;

    /** Events referencing these pubkeys (p tag) */
    @JsonProperty("#p")
    private List<String> pTags;

    /** Minimum creation timestamp (inclusive) */
    @JsonProperty("since")
    private Long since;

    /** Maximum creation timestamp (inclusive) */
    @JsonProperty("until")
    private Long until;

    @JsonProperty("limit")
    private Integer limit;

    /**
     * Default constructor for Jackson.
     */
    public Filter() {}

    // Getters
    public List<String> getIds() { return ids; }
    public List<String> getAuthors() { return authors; }
    public List<Integer> getKinds() { return kinds; }
    // Bean names of these getters differ from the wire names
    @JsonIgnore
    public List<String> getETags() { return eTags; }
    @JsonIgnore
    public List<String> getPTags() { return pTags; }
    public Long getSince() { return since; }
    public Long getUntil() { return until; }
    public Integer getLimit() { return limit; }

    /**
     * Check whether an event satisfies this filter.
     * Tag conditions and {@code limit} are left to the relay; ids, authors,
     * kinds and the time window are checked locally.
     */
    public boolean matches(Event event) {
        if (event == null) {
            return false;
        }
        if (ids != null && !ids.contains(event.getId())) {
            return false;
        }
        if (authors != null && !authors.contains(event.getPubkey())) {
            return false;
        }
        if (kinds != null && !kinds.contains(event.getKind())) {
            return false;
        }
        if (since != null && event.getCreatedAt() < since) {
            return false;
        }
        return until == null || event.getCreatedAt() <= until;
    }

    /**
     * Create a builder pre-populated with this filter's fields.
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.filter.ids = ids != null ? new ArrayList<>(ids) : null;
        builder.filter.authors = authors != null ? new ArrayList<>(authors) : null;
        builder.filter.kinds = kinds != null ? new ArrayList<>(kinds) : null;
        builder.filter.eTags = eTags != null ? new ArrayList<>(eTags) : null;
        builder.filter.pTags = pTags != null ? new ArrayList<>(pTags) : null;
        builder.filter.since = since;
        builder.filter.until = until;
        builder.filter.limit = limit;
        return builder;
    }

    /**
     * Create a builder for constructing filters.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for Filter construction.
     */
    public static class Builder {
        private final Filter filter = new Filter();

        public Builder ids(String... ids) {
            filter.ids = Arrays.asList(ids);
            return this;
        }

        public Builder authors(String... authors) {
            filter.authors = Arrays.asList(authors);
            return this;
        }

        public Builder authors(List<String> authors) {
            filter.authors = new ArrayList<>(authors);
            return this;
        }

        public Builder kinds(int... kinds) {
            filter.kinds = new ArrayList<>();
            for (int kind : kinds) {
                filter.kinds.add(kind);
            }
            return this;
        }

        public Builder eTags(String... eTags) {
            filter.eTags = Arrays.asList(eTags);
            return this;
        }

        public Builder pTags(String... pTags) {
            filter.pTags = Arrays.asList(pTags);
            return this;
        }

        public Builder since(long since) {
            filter.since = since;
            return this;
        }

        public Builder until(long until) {
            filter.until = until;
            return this;
        }

        public Builder limit(int limit) {
            filter.limit = limit;
            return this;
        }

        public Filter build() {
            return filter;
        }
    }

    @Override
    public String toString() {
        return "Filter{" +
                "ids=" + (ids != null ? ids.size() : 0) +
                ", authors=" + (authors != null ? authors.size() : 0) +
                ", kinds=" + kinds +
                ", since=" + since +
                ", until=" + until +
                ", limit=" + limit +
                '}';
    }
}
