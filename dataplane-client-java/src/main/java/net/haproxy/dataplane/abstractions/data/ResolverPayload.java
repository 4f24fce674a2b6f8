package net.haproxy.dataplane.abstractions.data;

import org.codehaus.jackson.annotate.JsonIgnoreProperties;
import org.codehaus.jackson.annotate.JsonProperty;
import org.codehaus.jackson.map.annotate.JsonSerialize;
import org.codehaus.jackson.map.annotate.JsonSerialize.Inclusion;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonSerialize(include = Inclusion.NON_NULL)
public class ResolverPayload implements NamedPayload {
  private String name;
  private Long acceptedPayloadSize;
  private Long holdNx;
  private Long holdObsolete;
  private Long holdOther;
  private Long holdRefused;
  private Long holdTimeout;
  private Long holdValid;
  private Long resolveRetries;
  private Long timeoutResolve;
  private Long timeoutRetry;

  public ResolverPayload() {
    super();
  }

  public ResolverPayload(String name) {
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

  @JsonProperty("accepted_payload_size")
  public Long getAcceptedPayloadSize() {
    return acceptedPayloadSize;
  }

  public void setAcceptedPayloadSize(Long acceptedPayloadSize) {
    this.acceptedPayloadSize = acceptedPayloadSize;
  }

  @JsonProperty("hold_nx")
  public Long getHoldNx() {
    return holdNx;
  }

  public void setHoldNx(Long holdNx) {
    this.holdNx = holdNx;
  }

  @JsonProperty("hold_obsolete")
  public Long getHoldObsolete() {
    return holdObsolete;
  }

  public void setHoldObsolete(Long holdObsolete) {
    this.holdObsolete = holdObsolete;
  }

  @JsonProperty("hold_other")
  public Long getHoldOther() {
    return holdOther;
  }

  public void setHoldOther(Long holdOther) {
    this.holdOther = holdOther;
  }

  @JsonProperty("hold_refused")
  public Long getHoldRefused() {
    return holdRefused;
  }

  public void setHoldRefused(Long holdRefused) {
    this.holdRefused = holdRefused;
  }

  @JsonProperty("hold_timeout")
  public Long getHoldTimeout() {
    return holdTimeout;
  }

  public void setHoldTimeout(Long holdTimeout) {
    this.holdTimeout = holdTimeout;
  }

  @JsonProperty("hold_valid")
  public Long getHoldValid() {
    return holdValid;
  }

  public void setHoldValid(Long holdValid) {
    this.holdValid = holdValid;
  }

  @JsonProperty("resolve_retries")
  public Long getResolveRetries() {
    return resolveRetries;
  }

  public void setResolveRetries(Long resolveRetries) {
    this.resolveRetries = resolveRetries;
  }

  @JsonProperty("timeout_resolve")
  public Long getTimeoutResolve() {
    return timeoutResolve;
  }

  public void setTimeoutResolve(Long timeoutResolve) {
    this.timeoutResolve = timeoutResolve;
  }

  @JsonProperty("timeout_retry")
  public Long getTimeoutRetry() {
    return timeoutRetry;
  }

  public void setTimeoutRetry(Long timeoutRetry) {
    this.timeoutRetry = timeoutRetry;
  }
}
