package net.haproxy.dataplane.abstractions.data;

import org.codehaus.jackson.annotate.JsonIgnoreProperties;
import org.codehaus.jackson.annotate.JsonProperty;
import org.codehaus.jackson.map.annotate.JsonSerialize;
import org.codehaus.jackson.map.annotate.JsonSerialize.Inclusion;

/**
 * The <code>global</code> section. There is exactly one per configuration.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonSerialize(include = Inclusion.NON_NULL)
public class GlobalPayload {
  private Long maxconn;
  private String daemon;
  private Long statsTimeout;
  private Long tuneSslDefaultDhParam;
  private String sslDefaultBindCiphers;
  private String sslDefaultBindOptions;
  private String sslDefaultServerCiphers;
  private String sslDefaultServerOptions;

  public GlobalPayload() {
    super();
  }

  @JsonProperty("maxconn")
  public Long getMaxconn() {
    return maxconn;
  }

  public void setMaxconn(Long maxconn) {
    this.maxconn = maxconn;
  }

  @JsonProperty("daemon")
  public String getDaemon() {
    return daemon;
  }

  public void setDaemon(String daemon) {
    this.daemon = daemon;
  }

  @JsonProperty("stats_timeout")
  public Long getStatsTimeout() {
    return statsTimeout;
  }

  public void setStatsTimeout(Long statsTimeout) {
    this.statsTimeout = statsTimeout;
  }

  @JsonProperty("tune_ssl_default_dh_param")
  public Long getTuneSslDefaultDhParam() {
    return tuneSslDefaultDhParam;
  }

  public void setTuneSslDefaultDhParam(Long tuneSslDefaultDhParam) {
    this.tuneSslDefaultDhParam = tuneSslDefaultDhParam;
  }

  @JsonProperty("ssl_default_bind_ciphers")
  public String getSslDefaultBindCiphers() {
    return sslDefaultBindCiphers;
  }

  public void setSslDefaultBindCiphers(String sslDefaultBindCiphers) {
    this.sslDefaultBindCiphers = sslDefaultBindCiphers;
  }

  @JsonProperty("ssl_default_bind_options")
  public String getSslDefaultBindOptions() {
    return sslDefaultBindOptions;
  }

  public void setSslDefaultBindOptions(String sslDefaultBindOptions) {
    this.sslDefaultBindOptions = sslDefaultBindOptions;
  }

  @JsonProperty("ssl_default_server_ciphers")
  public String getSslDefaultServerCiphers() {
    return sslDefaultServerCiphers;
  }

  public void setSslDefaultServerCiphers(String sslDefaultServerCiphers) {
    this.sslDefaultServerCiphers = sslDefaultServerCiphers;
  }

  @JsonProperty("ssl_default_server_options")
  public String getSslDefaultServerOptions() {
    return sslDefaultServerOptions;
  }

  public void setSslDefaultServerOptions(String sslDefaultServerOptions) {
    this.sslDefaultServerOptions = sslDefaultServerOptions;
  }
}
