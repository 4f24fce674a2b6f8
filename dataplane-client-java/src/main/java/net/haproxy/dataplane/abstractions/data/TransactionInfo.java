package net.haproxy.dataplane.abstractions.data;

import org.codehaus.jackson.annotate.JsonIgnoreProperties;
import org.codehaus.jackson.annotate.JsonProperty;

/**
 * Server side staging area for configuration edits.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TransactionInfo {
  private String id;
  private long version;
  private String status;

  public TransactionInfo() {
    super();
  }

  public TransactionInfo(String id, long version, String status) {
    super();
    this.id = id;
    this.version = version;
    this.status = status;
  }

  @JsonProperty("id")
  public String getId() {
    return id;
  }

  public void setId(String id) {
    this.id = id;
  }

  /**
   * @return configuration version the transaction was opened against
   */
  @JsonProperty("_version")
  public long getVersion() {
    return version;
  }

  public void setVersion(long version) {
    this.version = version;
  }

  @JsonProperty("status")
  public String getStatus() {
    return status;
  }

  public void setStatus(String status) {
    this.status = status;
  }

  @Override
  public String toString() {
    return "TransactionInfo [id=" + id + ", version=" + version + ", status=" + status + "]";
  }
}
