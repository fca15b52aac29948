package vn.com.fecredit.resumableupload.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Response body returned after every accepted chunk.
 *
 * <p>
 * Serialized as {@code {"upload_id": ..., "offset": ..., "expires": ..., "status": ...}}.
 * Completion hooks may attach further attributes through {@link #put(String, Object)};
 * they are written as top-level JSON fields.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UploadStatusView {

    @JsonProperty("upload_id")
    private String uploadId;

    @JsonProperty("offset")
    private long offset;

    @JsonProperty("expires")
    private LocalDateTime expires;

    @JsonProperty("status")
    private UploadStatus status;

    private final Map<String, Object> attributes = new LinkedHashMap<>();

    /**
     * Default constructor for JSON deserialization.
     */
    public UploadStatusView() {
    }

    public UploadStatusView(String uploadId, long offset, LocalDateTime expires, UploadStatus status) {
        this.uploadId = uploadId;
        this.offset = offset;
        this.expires = expires;
        this.status = status;
    }

    public String getUploadId() { return uploadId; }
    public void setUploadId(String uploadId) { this.uploadId = uploadId; }
    public long getOffset() { return offset; }
    public void setOffset(long offset) { this.offset = offset; }
    public LocalDateTime getExpires() { return expires; }
    public void setExpires(LocalDateTime expires) { this.expires = expires; }
    public UploadStatus getStatus() { return status; }
    public void setStatus(UploadStatus status) { this.status = status; }

    /**
     * Extra response attributes contributed by completion hooks.
     *
     * @return live, insertion-ordered attribute map
     */
    @JsonAnyGetter
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    @JsonAnySetter
    public UploadStatusView put(String name, Object value) {
        attributes.put(name, value);
        return this;
    }
}
