package org.nostree.nostr.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Nostr event as defined in NIP-01.
 * Relay-preference documents, published notes and everything else a relay stores
 * travel as events; the pool only looks at {@code id} (deduplication) and the
 * outbox layer reads {@code pubkey}, {@code created_at}, {@code kind} and {@code tags}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Event {

    /** Event ID (hex SHA-256 of the serialized event, see {@link EventIds}) */
    @JsonProperty("id")
    private String id;

    /** Author public key (32-byte hex) */
    @JsonProperty("pubkey")
    private String pubkey;

    /** Unix timestamp in seconds */
    @JsonProperty("created_at")
    private long createdAt;

    @JsonProperty("kind")
    private int kind;

    @JsonProperty("tags")
    private List<List<String>> tags;

    @JsonProperty("content")
    private String content;

    /** Schnorr signature (64-byte hex), carried through untouched */
    @JsonProperty("sig")
    private String sig;

    /**
     * Default constructor for Jackson deserialization.
     */
    public Event() {
        this.tags = new ArrayList<>();
        this.content = "";
    }

    public Event(String id, String pubkey, long createdAt, int kind,
                 List<List<String>> tags, String content, String sig) {
        this.id = id;
        this.pubkey = pubkey;
        this.createdAt = createdAt;
        this.kind = kind;
        this.tags = tags != null ? new ArrayList<>(tags) : new ArrayList<>();
        this.content = content != null ? content : "";
        this.sig = sig;
    }

    // Getters
    public String getId() { return id; }
    public String getPubkey() { return pubkey; }
    public long getCreatedAt() { return createdAt; }
    public int getKind() { return kind; }
    public List<List<String>> getTags() { return tags; }
    public String getContent() { return content; }
    public String getSig() { return sig; }

    // Setters
    public void setId(String id) { this.id = id; }
    public void setPubkey(String pubkey) { this.pubkey = pubkey; }
    public void setCreatedAt(long createdAt) { this.createdAt = createdAt; }
    public void setKind(int kind) { this.kind = kind; }
    public void setTags(List<List<String>> tags) {
        this.tags = tags != null ? new ArrayList<>(tags) : new ArrayList<>();
    }
    public void setContent(String content) {
        this.content = content != null ? content : "";
    }
    public void setSig(String sig) { this.sig = sig; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Event event = (Event) o;
        return Objects.equals(id, event.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Event{" +
                "id='" + abbreviate(id) + "'" +
                ", pubkey='" + abbreviate(pubkey) + "'" +
                ", kind=" + kind +
                ", createdAt=" + createdAt +
                ", tags=" + (tags != null ? tags.size() : 0) +
                '}';
    }

    private static String abbreviate(String hex) {
        if (hex == null) {
            return "null";
        }
        return hex.length() > 16 ? hex.substring(0, 16) + "..." : hex;
    }
}
