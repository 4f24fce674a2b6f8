package net.haproxy.dataplane.abstractions.data;

import org.codehaus.jackson.annotate.JsonIgnoreProperties;
import org.codehaus.jackson.annotate.JsonProperty;
import org.codehaus.jackson.map.annotate.JsonSerialize;
import org.codehaus.jackson.map.annotate.JsonSerialize.Inclusion;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonSerialize(include = Inclusion.NON_NULL)
public class BindPayload implements NamedPayload {
  private String name;
  private String address;
  private Long port;
  private Long portRangeEnd;
  private Long maxconn;
  private String mode;
  private Boolean ssl;
  private String sslCertificate;
  private String sslCafile;
  private String sslMinVer;
  private String sslMaxVer;
  private String alpn;
  private String ciphers;
  private Boolean transparent;
  private Boolean acceptProxy;
  private String user;
  private String group;
  private String iface;
  private String level;

  public BindPayload() {
    super();
  }

  public BindPayload(String name, String address, Long port) {
    super();
    this.name = name;
    this.address = address;
    this.port = port;
  }

  @Override
  @JsonProperty("name")
  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  @JsonProperty("address")
  public String getAddress() {
    return address;
  }

  public void setAddress(String address) {
    this.address = address;
  }

  @JsonProperty("port")
  public Long getPort() {
    return port;
  }

  public void setPort(Long port) {
    this.port = port;
  }

  @JsonProperty("port-range-end")
  public Long getPortRangeEnd() {
    return portRangeEnd;
  }

  public void setPortRangeEnd(Long portRangeEnd) {
    this.portRangeEnd = portRangeEnd;
  }

  @JsonProperty("maxconn")
  public Long getMaxconn() {
    return maxconn;
  }

  public void setMaxconn(Long maxconn) {
    this.maxconn = maxconn;
  }

  @JsonProperty("mode")
  public String getMode() {
    return mode;
  }

  public void setMode(String mode) {
    this.mode = mode;
  }

  @JsonProperty("ssl")
  public Boolean getSsl() {
    return ssl;
  }

  public void setSsl(Boolean ssl) {
    this.ssl = ssl;
  }

  @JsonProperty("ssl_certificate")
  public String getSslCertificate() {
    return sslCertificate;
  }

  public void setSslCertificate(String sslCertificate) {
    this.sslCertificate = sslCertificate;
  }

  @JsonProperty("ssl_cafile")
  public String getSslCafile() {
    return sslCafile;
  }

  public void setSslCafile(String sslCafile) {
    this.sslCafile = sslCafile;
  }

  @JsonProperty("ssl_min_ver")
  public String getSslMinVer() {
    return sslMinVer;
  }

  public void setSslMinVer(String sslMinVer) {
    this.sslMinVer = sslMinVer;
  }

  @JsonProperty("ssl_max_ver")
  public String getSslMaxVer() {
    return sslMaxVer;
  }

  public void setSslMaxVer(String sslMaxVer) {
    this.sslMaxVer = sslMaxVer;
  }

  @JsonProperty("alpn")
  public String getAlpn() {
    return alpn;
  }

  public void setAlpn(String alpn) {
    this.alpn = alpn;
  }

  @JsonProperty("ciphers")
  public String getCiphers() {
    return ciphers;
  }

  public void setCiphers(String ciphers) {
    this.ciphers = ciphers;
  }

  @JsonProperty("transparent")
  public Boolean getTransparent() {
    return transparent;
  }

  public void setTransparent(Boolean transparent) {
    this.transparent = transparent;
  }

  @JsonProperty("accept_proxy")
  public Boolean getAcceptProxy() {
    return acceptProxy;
  }

  public void setAcceptProxy(Boolean acceptProxy) {
    this.acceptProxy = acceptProxy;
  }

  @JsonProperty("user")
  public String getUser() {
    return user;
  }

  public void setUser(String user) {
    this.user = user;
  }

  @JsonProperty("group")
  public String getGroup() {
    return group;
  }

  public void setGroup(String group) {
    this.group = group;
  }

  @JsonProperty("interface")
  public String getIface() {
    return iface;
  }

  public void setIface(String iface) {
    this.iface = iface;
  }

  @JsonProperty("level")
  public String getLevel() {
    return level;
  }

  public void setLevel(String level) {
    this.level = level;
  }
}
