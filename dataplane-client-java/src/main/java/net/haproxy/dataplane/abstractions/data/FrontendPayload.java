package net.haproxy.dataplane.abstractions.data;

import org.codehaus.jackson.annotate.JsonIgnoreProperties;
import org.codehaus.jackson.annotate.JsonProperty;
import org.codehaus.jackson.map.annotate.JsonSerialize;
import org.codehaus.jackson.map.annotate.JsonSerialize.Inclusion;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonSerialize(include = Inclusion.NON_NULL)
public class FrontendPayload implements NamedPayload {
  private String name;
  private String defaultBackend;
  private String mode;
  private Long maxconn;
  private Long backlog;
  private String httpConnectionMode;
  private Long httpKeepAliveTimeout;
  private Long httpRequestTimeout;
  private Boolean httplog;
  private Boolean tcplog;
  private String logFormat;
  private String logTag;
  private String monitorUri;
  private Long clientTimeout;
  private String dontlognull;
  private String optionForwardfor;

  public FrontendPayload() {
    super();
  }

  public FrontendPayload(String name, String defaultBackend, String mode) {
    super();
    this.name = name;
    this.defaultBackend = defaultBackend;
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

  @JsonProperty("default_backend")
  public String getDefaultBackend() {
    return defaultBackend;
  }

  public void setDefaultBackend(String defaultBackend) {
    this.defaultBackend = defaultBackend;
  }

  @JsonProperty("mode")
  public String getMode() {
    return mode;
  }

  public void setMode(String mode) {
    this.mode = mode;
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

  @JsonProperty("http-connection-mode")
  public String getHttpConnectionMode() {
    return httpConnectionMode;
  }

  public void setHttpConnectionMode(String httpConnectionMode) {
    this.httpConnectionMode = httpConnectionMode;
  }

  @JsonProperty("http-keep-alive-timeout")
  public Long getHttpKeepAliveTimeout() {
    return httpKeepAliveTimeout;
  }

  public void setHttpKeepAliveTimeout(Long httpKeepAliveTimeout) {
    this.httpKeepAliveTimeout = httpKeepAliveTimeout;
  }

  @JsonProperty("http-request-timeout")
  public Long getHttpRequestTimeout() {
    return httpRequestTimeout;
  }

  public void setHttpRequestTimeout(Long httpRequestTimeout) {
    this.httpRequestTimeout = httpRequestTimeout;
  }

  @JsonProperty("httplog")
  public Boolean getHttplog() {
    return httplog;
  }

  public void setHttplog(Boolean httplog) {
    this.httplog = httplog;
  }

  @JsonProperty("tcplog")
  public Boolean getTcplog() {
    return tcplog;
  }

  public void setTcplog(Boolean tcplog) {
    this.tcplog = tcplog;
  }

  @JsonProperty("log_format")
  public String getLogFormat() {
    return logFormat;
  }

  public void setLogFormat(String logFormat) {
    this.logFormat = logFormat;
  }

  @JsonProperty("log_tag")
  public String getLogTag() {
    return logTag;
  }

  public void setLogTag(String logTag) {
    this.logTag = logTag;
  }

  @JsonProperty("monitor_uri")
  public String getMonitorUri() {
    return monitorUri;
  }

  public void setMonitorUri(String monitorUri) {
    this.monitorUri = monitorUri;
  }

  @JsonProperty("client_timeout")
  public Long getClientTimeout() {
    return clientTimeout;
  }

  public void setClientTimeout(Long clientTimeout) {
    this.clientTimeout = clientTimeout;
  }

  @JsonProperty("dontlognull")
  public String getDontlognull() {
    return dontlognull;
  }

  public void setDontlognull(String dontlognull) {
    this.dontlognull = dontlognull;
  }

  @JsonProperty("option_forwardfor")
  public String getOptionForwardfor() {
    return optionForwardfor;
  }

  public void setOptionForwardfor(String optionForwardfor) {
    this.optionForwardfor = optionForwardfor;
  }
}
