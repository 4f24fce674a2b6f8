package net.haproxy.dataplane.abstractions.data;

import org.codehaus.jackson.annotate.JsonIgnoreProperties;
import org.codehaus.jackson.annotate.JsonProperty;
import org.codehaus.jackson.map.annotate.JsonSerialize;
import org.codehaus.jackson.map.annotate.JsonSerialize.Inclusion;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonSerialize(include = Inclusion.NON_NULL)
public class BackendPayload implements NamedPayload {
  private String name;
  private String mode;
  private String advCheck;
  private String httpConnectionMode;
  private Long serverTimeout;
  private Long checkTimeout;
  private Long connectTimeout;
  private Long queueTimeout;
  private Long tunnelTimeout;
  private Long tarpitTimeout;
  private String checkcache;
  private Long retries;
  private Balance balance;
  private HttpchkParams httpchkParams;
  private ForwardFor forwardfor;

  public BackendPayload() {
    super();
  }

  public BackendPayload(String name, String mode) {
    super();
    this.name = name;
    this.mode = mode;
  }

  @Override
  @JsonProperty("name")
  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  @JsonProperty("mode")
  public String getMode() {
    return mode;
  }

  public void setMode(String mode) {
    this.mode = mode;
  }

  @JsonProperty("adv_check")
  public String getAdvCheck() {
    return advCheck;
  }

  public void setAdvCheck(String advCheck) {
    this.advCheck = advCheck;
  }

  @JsonProperty("http_connection_mode")
  public String getHttpConnectionMode() {
    return httpConnectionMode;
  }

  public void setHttpConnectionMode(String httpConnectionMode) {
    this.httpConnectionMode = httpConnectionMode;
  }

  @JsonProperty("server_timeout")
  public Long getServerTimeout() {
    return serverTimeout;
  }

  public void setServerTimeout(Long serverTimeout) {
    this.serverTimeout = serverTimeout;
  }

  @JsonProperty("check_timeout")
  public Long getCheckTimeout() {
    return checkTimeout;
  }

  public void setCheckTimeout(Long checkTimeout) {
    this.checkTimeout = checkTimeout;
  }

  @JsonProperty("connect_timeout")
  public Long getConnectTimeout() {
    return connectTimeout;
  }

  public void setConnectTimeout(Long connectTimeout) {
    this.connectTimeout = connectTimeout;
  }

  @JsonProperty("queue_timeout")
  public Long getQueueTimeout() {
    return queueTimeout;
  }

  public void setQueueTimeout(Long queueTimeout) {
    this.queueTimeout = queueTimeout;
  }

  @JsonProperty("tunnel_timeout")
  public Long getTunnelTimeout() {
    return tunnelTimeout;
  }

  public void setTunnelTimeout(Long tunnelTimeout) {
    this.tunnelTimeout = tunnelTimeout;
  }

  @JsonProperty("tarpit_timeout")
  public Long getTarpitTimeout() {
    return tarpitTimeout;
  }

  public void setTarpitTimeout(Long tarpitTimeout) {
    this.tarpitTimeout = tarpitTimeout;
  }

  @JsonProperty("checkcache")
  public String getCheckcache() {
    return checkcache;
  }

  public void setCheckcache(String checkcache) {
    this.checkcache = checkcache;
  }

  @JsonProperty("retries")
  public Long getRetries() {
    return retries;
  }

  public void setRetries(Long retries) {
    this.retries = retries;
  }

  @JsonProperty("balance")
  public Balance getBalance() {
    return balance;
  }

  public void setBalance(Balance balance) {
    this.balance = balance;
  }

  @JsonProperty("httpchk_params")
  public HttpchkParams getHttpchkParams() {
    return httpchkParams;
  }

  public void setHttpchkParams(HttpchkParams httpchkParams) {
    this.httpchkParams = httpchkParams;
  }

  @JsonProperty("forwardfor")
  public ForwardFor getForwardfor() {
    return forwardfor;
  }

  public void setForwardfor(ForwardFor forwardfor) {
    this.forwardfor = forwardfor;
  }
}
