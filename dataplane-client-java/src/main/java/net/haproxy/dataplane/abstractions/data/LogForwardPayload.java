package net.haproxy.dataplane.abstractions.data;

import org.codehaus.jackson.annotate.JsonIgnoreProperties;
import org.codehaus.jackson.annotate.JsonProperty;
import org.codehaus.jackson.map.annotate.JsonSerialize;
import org.codehaus.jackson.map.annotate.JsonSerialize.Inclusion;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonSerialize(include = Inclusion.NON_NULL)
public class LogForwardPayload implements NamedPayload {
  private String name;
  private Long maxconn;
  private Long backlog;
  private Long timeoutClient;

  public LogForwardPayload() {
    super();
  }

  public LogForwardPayload(String name) {
    super();
    this.name = name;
  }

  @Override
  @JsonProperty("name")
  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  @JsonProperty("maxconn")
  public Long getMaxconn() {
    return maxconn;
  }

  public void setMaxconn(Long maxconn) {
    this.maxconn = maxconn;
  }

  @JsonProperty("backlog")
  public Long getBacklog() {
    return backlog;
  }

  public void setBacklog(Long backlog) {
    this.backlog = backlog;
  }

  @JsonProperty("timeout_client")
  public Long getTimeoutClient() {
    return timeoutClient;
  }

  public void setTimeoutClient(Long timeoutClient) {
    this.timeoutClient = timeoutClient;
  }
}
